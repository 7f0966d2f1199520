package cold.spray.exception;

public class ValidationException extends TagException {
    public ValidationException(String tag, String message) {
        super(tag, message);
    }
}
