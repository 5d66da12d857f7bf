package io.github.redlet.command;

import io.github.redlet.kv.Store;
import io.github.redlet.resp.RespData;
import io.github.redlet.resp.RespSimpleString;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 不认识的命令，什么也不做，直接返回OK。
 */
@Getter
@EqualsAndHashCode
@ToString
public class UnrecognizedCommand implements Command {
    private final String name;

    UnrecognizedCommand(String name) {
        this.name = name;
    }

    @Override
    public CommandType getType() {
        return CommandType.UNRECOGNIZED;
    }

    @Override
    public RespData execute(Store store) {
        return RespSimpleString.ok();
    }
}
