package guraa.renderverify.core;

/**
 * Thrown when a tolerance document cannot be read. The curve being loaded keeps the
 * entries it had before the attempt.
 */
public class ToleranceParseException extends Exception {

    public ToleranceParseException(String message) {
        super(message);
    }

    public ToleranceParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
