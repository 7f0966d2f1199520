package cold.spray.exception;

import cold.spray.enums.Device;

public class HardwareException extends Exception {
    private final Device device;
    private final String operation;
    private final String target;

    public HardwareException(Device device, String operation, String target, String message) {
        super(message);
        this.device = device;
        this.operation = operation;
        this.target = target;
    }

    public HardwareException(Device device, String operation, String target, String message, Throwable cause) {
        super(message, cause);
        this.device = device;
        this.operation = operation;
        this.target = target;
    }

    public Device getDevice() {
        return device;
    }

    public String getOperation() {
        return operation;
    }

    public String getTarget() {
        return target;
    }

    @Override
    public String getMessage() {
        return "[" + device.getTag() + "] " + super.getMessage()
                + (operation != null ? ", операция " + operation : "")
                + (target != null ? ", тег " + target : "");
    }
}
