package cold.spray.enums;

public enum GasLine {
    MAIN
            (
                    "gas_control.main_flow.setpoint",
                    "gas_control.main_flow.measured",
                    "valve_control.main_gas",
                    "основная линия газа"
            ),

    FEEDER
            (
                    "gas_control.feeder_flow.setpoint",
                    "gas_control.feeder_flow.measured",
                    "valve_control.feeder_gas",
                    "линия газа питателя"
            );

    private final String setpointTag;

    private final String measuredTag;

    private final String valveTag;

    private final String template;

    GasLine(String setpointTag, String measuredTag, String valveTag, String template) {
        this.setpointTag = setpointTag;
        this.measuredTag = measuredTag;
        this.valveTag = valveTag;
        this.template = template;
    }

    public String getSetpointTag() {
        return setpointTag;
    }

    public String getMeasuredTag() {
        return measuredTag;
    }

    public String getValveTag() {
        return valveTag;
    }

    public String getTemplate() {
        return template;
    }
}
