package io.github.redlet.command;

import io.github.redlet.kv.Store;
import io.github.redlet.kv.StoreException;
import io.github.redlet.resp.RespArray;
import io.github.redlet.resp.RespData;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * SMEMBERS key，按插入顺序返回所有成员
 */
@Getter
@EqualsAndHashCode
@ToString
public class SMembersCommand implements Command {
    private final String key;

    SMembersCommand(String key) {
        this.key = key;
    }

    @Override
    public CommandType getType() {
        return CommandType.SMEMBERS;
    }

    @Override
    public RespData execute(Store store) throws StoreException {
        return RespArray.with(store.smembers(key));
    }
}
