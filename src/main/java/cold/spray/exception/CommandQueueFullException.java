package cold.spray.exception;

import cold.spray.enums.Device;

public class CommandQueueFullException extends HardwareException {
    public CommandQueueFullException(String command, int capacity) {
        super(Device.FEEDER, "enqueue", command,
                "Очередь команд контроллера питателя переполнена, емкость " + capacity);
    }
}
