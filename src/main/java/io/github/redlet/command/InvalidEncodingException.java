package io.github.redlet.command;

public class InvalidEncodingException extends CommandException {
    private static final long serialVersionUID = -6009383512884312251L;

    public InvalidEncodingException(String message) {
        super(message);
    }
}
