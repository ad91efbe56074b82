package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

public enum WeekIndex implements ValuedEnum {

    FIRST("first"),
    SECOND("second"),
    THIRD("third"),
    FOURTH("fourth"),
    LAST("last");

    private final String value;

    WeekIndex(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public static WeekIndex forValue(String searchValue) {
        for (WeekIndex candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
