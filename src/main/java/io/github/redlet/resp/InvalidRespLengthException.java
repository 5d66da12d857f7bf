package io.github.redlet.resp;

public class InvalidRespLengthException extends RespException {
    private static final long serialVersionUID = 6270431759912408875L;

    public InvalidRespLengthException(RespType type, String length) {
        super("invalid " + type + " length: " + length);
    }
}
