package io.github.redlet.command;

/**
 * 命令无法执行的错误。这类错误不关闭连接，由引擎转换成错误响应返回给客户端。
 *
 * @author zy
 */
public class CommandException extends Exception {
    private static final long serialVersionUID = -2675213871140265367L;

    public CommandException(String message) {
        super(message);
    }
}
