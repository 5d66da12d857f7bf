package io.github.redlet.command;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import io.github.redlet.kv.Store;
import io.github.redlet.resp.RespArray;
import io.github.redlet.resp.RespBulkString;
import io.github.redlet.resp.RespData;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * HGETALL key。返回field、value交替排列的数组，按field排序，保证相同数据的输出相同。
 */
@Getter
@EqualsAndHashCode
@ToString
public class HGetAllCommand implements Command {
    private final String key;

    HGetAllCommand(String key) {
        this.key = key;
    }

    @Override
    public CommandType getType() {
        return CommandType.HGETALL;
    }

    @Override
    public RespData execute(Store store) {
        SortedMap<String, RespData> hash = store.hgetAll(key);
        if (hash.isEmpty()) {
            return RespArray.empty();
        }
        List<RespData> datas = new ArrayList<>(hash.size() * 2);
        for (Map.Entry<String, RespData> entry : hash.entrySet()) {
            datas.add(RespBulkString.withUTF8(entry.getKey()));
            datas.add(entry.getValue());
        }
        return RespArray.with(datas);
    }
}
