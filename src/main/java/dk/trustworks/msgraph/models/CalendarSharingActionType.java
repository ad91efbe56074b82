package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

public enum CalendarSharingActionType implements ValuedEnum {

    ACCEPT("accept");

    private final String value;

    CalendarSharingActionType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public static CalendarSharingActionType forValue(String searchValue) {
        for (CalendarSharingActionType candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
