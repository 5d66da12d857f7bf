package io.github.redlet.resp;

/**
 * RESP协议解析的永久性错误。出现该错误后，字节流无法再重新对齐，连接应当关闭。
 * 数据不完整不属于错误，解码器用{@link RespDecoder#NOT_COMPLETE}或null表示。
 *
 * @author zy
 */
public class RespException extends RuntimeException {
    private static final long serialVersionUID = 4521738216534903447L;

    public RespException(String message) {
        super(message);
    }

    public RespException(String message, Throwable cause) {
        super(message, cause);
    }
}
