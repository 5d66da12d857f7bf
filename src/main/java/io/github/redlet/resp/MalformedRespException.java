package io.github.redlet.resp;

public class MalformedRespException extends RespException {
    private static final long serialVersionUID = -1452285316940122316L;

    public MalformedRespException(String message) {
        super(message);
    }

    public MalformedRespException(String message, Throwable cause) {
        super(message, cause);
    }
}
