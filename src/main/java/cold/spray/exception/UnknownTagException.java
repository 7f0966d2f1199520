package cold.spray.exception;

public class UnknownTagException extends TagException {
    public UnknownTagException(String tag) {
        super(tag, "Тег не найден в таблице сопоставления: " + tag);
    }
}
