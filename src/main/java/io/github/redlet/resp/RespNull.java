package io.github.redlet.resp;

import java.nio.charset.StandardCharsets;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * RESP3 null（_\r\n）。
 */
@EqualsAndHashCode
@ToString
public final class RespNull implements RespData {
    private static final RespNull INSTANCE = new RespNull();

    public static RespNull instance() {
        return INSTANCE;
    }

    private RespNull() {
    }

    @Override
    public RespType getType() {
        return RespType.NULL;
    }

    @Override
    public byte[] toBytes() {
        return (RespType.NULL.getFirstChar() + "\r\n").getBytes(StandardCharsets.US_ASCII);
    }
}
