package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

public enum CalendarRoleType implements ValuedEnum {

    NONE("none"),
    FREE_BUSY_READ("freeBusyRead"),
    LIMITED_READ("limitedRead"),
    READ("read"),
    WRITE("write"),
    DELEGATE_WITHOUT_PRIVATE_EVENT_ACCESS("delegateWithoutPrivateEventAccess"),
    DELEGATE_WITH_PRIVATE_EVENT_ACCESS("delegateWithPrivateEventAccess"),
    CUSTOM("custom");

    private final String value;

    CalendarRoleType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public static CalendarRoleType forValue(String searchValue) {
        for (CalendarRoleType candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
