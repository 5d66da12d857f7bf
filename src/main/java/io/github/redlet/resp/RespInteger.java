package io.github.redlet.resp;

import java.nio.charset.StandardCharsets;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 64位有符号整数。编码时非负数不带+号。
 */
@EqualsAndHashCode
@ToString
public class RespInteger implements RespData {
    @Getter
    private final long n;

    public static RespInteger with(long n) {
        return new RespInteger(n);
    }

    private RespInteger(long n) {
        this.n = n;
    }

    @Override
    public RespType getType() {
        return RespType.INTEGER;
    }

    @Override
    public byte[] toBytes() {
        return (RespType.INTEGER.getFirstChar() + Long.toString(n) + "\r\n").getBytes(StandardCharsets.US_ASCII);
    }
}
