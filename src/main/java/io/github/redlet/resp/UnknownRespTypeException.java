package io.github.redlet.resp;

public class UnknownRespTypeException extends RespException {
    private static final long serialVersionUID = -3018594781020586913L;

    public UnknownRespTypeException(byte firstByte) {
        super(String.format("unknown resp type: 0x%02x", firstByte & 0xff));
    }
}
