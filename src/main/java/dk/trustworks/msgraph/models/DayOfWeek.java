package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

public enum DayOfWeek implements ValuedEnum {

    SUNDAY("sunday"),
    MONDAY("monday"),
    TUESDAY("tuesday"),
    WEDNESDAY("wednesday"),
    THURSDAY("thursday"),
    FRIDAY("friday"),
    SATURDAY("saturday");

    private final String value;

    DayOfWeek(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public static DayOfWeek forValue(String searchValue) {
        for (DayOfWeek candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
