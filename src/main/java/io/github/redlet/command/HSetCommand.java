package io.github.redlet.command;

import io.github.redlet.kv.Store;
import io.github.redlet.resp.RespData;
import io.github.redlet.resp.RespSimpleString;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * HSET key field value，第一次写入时创建hash
 */
@Getter
@EqualsAndHashCode
@ToString
public class HSetCommand implements Command {
    private final String   key;
    private final String   field;
    private final RespData value;

    HSetCommand(String key, String field, RespData value) {
        this.key = key;
        this.field = field;
        this.value = value;
    }

    @Override
    public CommandType getType() {
        return CommandType.HSET;
    }

    @Override
    public RespData execute(Store store) {
        store.hset(key, field, value);
        return RespSimpleString.ok();
    }
}
