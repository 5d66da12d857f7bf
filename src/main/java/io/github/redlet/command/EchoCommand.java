package io.github.redlet.command;

import io.github.redlet.kv.Store;
import io.github.redlet.resp.RespBulkString;
import io.github.redlet.resp.RespData;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * ECHO message
 */
@Getter
@EqualsAndHashCode
@ToString
public class EchoCommand implements Command {
    private final RespBulkString message;

    EchoCommand(RespBulkString message) {
        this.message = message;
    }

    @Override
    public CommandType getType() {
        return CommandType.ECHO;
    }

    @Override
    public RespData execute(Store store) {
        return message;
    }
}
