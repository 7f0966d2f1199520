package cold.spray.exception;

public class TagNotCachedException extends TagException {
    public TagNotCachedException(String tag) {
        super(tag, "Значение тега еще не было получено: " + tag);
    }
}
