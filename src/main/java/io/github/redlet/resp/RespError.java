package io.github.redlet.resp;

import lombok.EqualsAndHashCode;
import lombok.ToString;

@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RespError extends RespString {

    public static RespError withUTF8(String msg) {
        return new RespError(msg);
    }

    private RespError(String content) {
        super(content);
    }

    @Override
    public RespType getType() {
        return RespType.ERROR;
    }
}
