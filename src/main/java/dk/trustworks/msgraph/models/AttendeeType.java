package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

public enum AttendeeType implements ValuedEnum {

    REQUIRED("required"),
    OPTIONAL("optional"),
    RESOURCE("resource");

    private final String value;

    AttendeeType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public static AttendeeType forValue(String searchValue) {
        for (AttendeeType candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
