package io.github.redlet.command;

/**
 * 请求帧本身的结构不是命令，如不是数组、空数组、命令名不是bulk string。
 */
public class InvalidCommandException extends CommandException {
    private static final long serialVersionUID = 8832604377290170845L;

    public InvalidCommandException(String message) {
        super(message);
    }
}
