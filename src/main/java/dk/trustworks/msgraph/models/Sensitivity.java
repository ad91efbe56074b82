package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

public enum Sensitivity implements ValuedEnum {

    NORMAL("normal"),
    PERSONAL("personal"),
    PRIVATE("private"),
    CONFIDENTIAL("confidential");

    private final String value;

    Sensitivity(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public static Sensitivity forValue(String searchValue) {
        for (Sensitivity candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
