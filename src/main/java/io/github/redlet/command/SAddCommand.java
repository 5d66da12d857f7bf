package io.github.redlet.command;

import java.util.List;

import com.google.common.collect.ImmutableList;
import io.github.redlet.kv.Store;
import io.github.redlet.kv.StoreException;
import io.github.redlet.resp.RespData;
import io.github.redlet.resp.RespInteger;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * SADD key member [member ...]，返回新加入的成员个数
 */
@Getter
@EqualsAndHashCode
@ToString
public class SAddCommand implements Command {
    private final String                  key;
    private final ImmutableList<RespData> members;

    SAddCommand(String key, List<RespData> members) {
        this.key = key;
        this.members = ImmutableList.copyOf(members);
    }

    @Override
    public CommandType getType() {
        return CommandType.SADD;
    }

    @Override
    public RespData execute(Store store) throws StoreException {
        return RespInteger.with(store.sadd(key, members));
    }
}
