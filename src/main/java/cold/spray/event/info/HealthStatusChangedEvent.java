package cold.spray.event.info;

import cold.spray.enums.HealthStatus;
import org.springframework.context.ApplicationEvent;

public class HealthStatusChangedEvent extends ApplicationEvent {
    HealthStatus previousStatus;

    HealthStatus status;

    public HealthStatusChangedEvent(Object source, HealthStatus previousStatus, HealthStatus status) {
        super(source);
        this.previousStatus = previousStatus;
        this.status = status;
    }

    public HealthStatus getPreviousStatus() {
        return previousStatus;
    }

    public HealthStatus getStatus() {
        return status;
    }
}
