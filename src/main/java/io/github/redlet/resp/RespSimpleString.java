package io.github.redlet.resp;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RespSimpleString extends RespString {
    private static final RespSimpleString OK = new RespSimpleString("OK");

    public static RespSimpleString withUTF8(String content) {
        return new RespSimpleString(content);
    }

    public static RespSimpleString ok() {
        return OK;
    }

    private RespSimpleString(String content) {
        super(content);
    }

    @Override
    public RespType getType() {
        return RespType.SIMPLE_STRING;
    }
}
