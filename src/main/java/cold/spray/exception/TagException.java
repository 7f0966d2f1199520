package cold.spray.exception;

public class TagException extends Exception {
    private final String tag;

    public TagException(String tag, String message) {
        super(message);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
