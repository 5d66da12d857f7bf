package io.github.redlet.command;

/**
 * 参数个数或参数类型错误。
 */
public class InvalidArgumentException extends CommandException {
    private static final long serialVersionUID = 3904461742230998017L;

    public InvalidArgumentException(String message) {
        super(message);
    }
}
