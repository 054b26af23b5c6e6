package prop;

public abstract class LogicException extends RuntimeException {

    protected LogicException(String message) {
        super(message);
    }

    protected LogicException(String message, Throwable cause) {
        super(message, cause);
    }
}
