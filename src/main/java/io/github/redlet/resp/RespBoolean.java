package io.github.redlet.resp;

import java.nio.charset.StandardCharsets;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@EqualsAndHashCode
@ToString
public final class RespBoolean implements RespData {
    public static final RespBoolean TRUE  = new RespBoolean(true);
    public static final RespBoolean FALSE = new RespBoolean(false);

    @Getter
    private final boolean value;

    public static RespBoolean with(boolean value) {
        return value ? TRUE : FALSE;
    }

    private RespBoolean(boolean value) {
        this.value = value;
    }

    @Override
    public RespType getType() {
        return RespType.BOOLEAN;
    }

    @Override
    public byte[] toBytes() {
        return (RespType.BOOLEAN.getFirstChar() + (value ? "t" : "f") + "\r\n").getBytes(StandardCharsets.US_ASCII);
    }
}
