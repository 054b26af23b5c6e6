package prop;

/**
 * Well-formed input that cannot be processed as given. The caller can correct it by changing the
 * input or the configured limits.
 */
public abstract class SemanticException extends LogicException {

    protected SemanticException(String message) {
        super(message);
    }
}
