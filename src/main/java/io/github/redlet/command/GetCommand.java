package io.github.redlet.command;

import io.github.redlet.kv.Store;
import io.github.redlet.resp.RespData;
import io.github.redlet.resp.RespNull;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * GET key
 */
@Getter
@EqualsAndHashCode
@ToString
public class GetCommand implements Command {
    private final String key;

    GetCommand(String key) {
        this.key = key;
    }

    @Override
    public CommandType getType() {
        return CommandType.GET;
    }

    @Override
    public RespData execute(Store store) {
        RespData value = store.get(key);
        return value == null ? RespNull.instance() : value;
    }
}
