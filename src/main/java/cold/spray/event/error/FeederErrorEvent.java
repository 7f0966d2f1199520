package cold.spray.event.error;

import org.springframework.context.ApplicationEvent;

public class FeederErrorEvent extends ApplicationEvent {
    String operation;

    String reason;

    public FeederErrorEvent(Object source, String operation, String reason) {
        super(source);
        this.operation = operation;
        this.reason = reason;
    }

    public String getOperation() {
        return operation;
    }

    public String getReason() {
        return reason;
    }
}
