package io.github.redlet.command;

import java.util.ArrayList;
import java.util.List;

import com.google.common.collect.ImmutableList;
import io.github.redlet.kv.Store;
import io.github.redlet.resp.RespArray;
import io.github.redlet.resp.RespData;
import io.github.redlet.resp.RespNull;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * HMGET key field [field ...]。结果与请求的field一一对应，不存在的为null。
 */
@Getter
@EqualsAndHashCode
@ToString
public class HMGetCommand implements Command {
    private final String                key;
    private final ImmutableList<String> fields;

    HMGetCommand(String key, List<String> fields) {
        this.key = key;
        this.fields = ImmutableList.copyOf(fields);
    }

    @Override
    public CommandType getType() {
        return CommandType.HMGET;
    }

    @Override
    public RespData execute(Store store) {
        List<RespData> values = new ArrayList<>(fields.size());
        for (String field : fields) {
            RespData value = store.hget(key, field);
            values.add(value == null ? RespNull.instance() : value);
        }
        return RespArray.with(values);
    }
}
