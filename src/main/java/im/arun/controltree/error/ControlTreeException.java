package im.arun.controltree.error;

public class ControlTreeException extends Exception {
    private final ErrorKind kind;

    public ControlTreeException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ControlTreeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
