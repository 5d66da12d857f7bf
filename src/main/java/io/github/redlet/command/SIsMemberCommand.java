package io.github.redlet.command;

import io.github.redlet.kv.Store;
import io.github.redlet.kv.StoreException;
import io.github.redlet.resp.RespData;
import io.github.redlet.resp.RespInteger;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * SISMEMBER key member，返回1或0
 */
@Getter
@EqualsAndHashCode
@ToString
public class SIsMemberCommand implements Command {
    private final String   key;
    private final RespData member;

    SIsMemberCommand(String key, RespData member) {
        this.key = key;
        this.member = member;
    }

    @Override
    public CommandType getType() {
        return CommandType.SISMEMBER;
    }

    @Override
    public RespData execute(Store store) throws StoreException {
        return RespInteger.with(store.sismember(key, member) ? 1 : 0);
    }
}
