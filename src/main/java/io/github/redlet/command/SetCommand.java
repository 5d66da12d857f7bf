package io.github.redlet.command;

import io.github.redlet.kv.Store;
import io.github.redlet.resp.RespData;
import io.github.redlet.resp.RespSimpleString;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * SET key value，无条件覆盖
 */
@Getter
@EqualsAndHashCode
@ToString
public class SetCommand implements Command {
    private final String   key;
    private final RespData value;

    SetCommand(String key, RespData value) {
        this.key = key;
        this.value = value;
    }

    @Override
    public CommandType getType() {
        return CommandType.SET;
    }

    @Override
    public RespData execute(Store store) {
        store.set(key, value);
        return RespSimpleString.ok();
    }
}
