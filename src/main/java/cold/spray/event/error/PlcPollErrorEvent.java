package cold.spray.event.error;

import org.springframework.context.ApplicationEvent;

public class PlcPollErrorEvent extends ApplicationEvent {
    String reason;

    public PlcPollErrorEvent(Object source, String reason) {
        super(source);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
