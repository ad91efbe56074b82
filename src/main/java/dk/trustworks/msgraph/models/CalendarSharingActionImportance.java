package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

public enum CalendarSharingActionImportance implements ValuedEnum {

    PRIMARY("primary"),
    SECONDARY("secondary");

    private final String value;

    CalendarSharingActionImportance(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public static CalendarSharingActionImportance forValue(String searchValue) {
        for (CalendarSharingActionImportance candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
