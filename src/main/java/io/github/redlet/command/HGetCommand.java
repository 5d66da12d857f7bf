package io.github.redlet.command;

import io.github.redlet.kv.Store;
import io.github.redlet.resp.RespData;
import io.github.redlet.resp.RespNull;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * HGET key field
 */
@Getter
@EqualsAndHashCode
@ToString
public class HGetCommand implements Command {
    private final String key;
    private final String field;

    HGetCommand(String key, String field) {
        this.key = key;
        this.field = field;
    }

    @Override
    public CommandType getType() {
        return CommandType.HGET;
    }

    @Override
    public RespData execute(Store store) {
        RespData value = store.hget(key, field);
        return value == null ? RespNull.instance() : value;
    }
}
