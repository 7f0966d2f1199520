package cold.spray.event.error;

import cold.spray.enums.Device;
import org.springframework.context.ApplicationEvent;

public class TagWriteErrorEvent extends ApplicationEvent {
    String tag;

    Device device;

    public TagWriteErrorEvent(Object source, String tag, Device device) {
        super(source);
        this.tag = tag;
        this.device = device;
    }

    public String getTag() {
        return tag;
    }

    public Device getDevice() {
        return device;
    }
}
