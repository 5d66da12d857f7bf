package io.github.redlet.kv;

/**
 * 存储内部错误，如等待锁时被中断。引擎把它转换成错误响应，不影响连接。
 *
 * @author zy
 */
public class StoreException extends Exception {
    private static final long serialVersionUID = 1840795304426515527L;

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
