package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

public enum RecurrenceRangeType implements ValuedEnum {

    END_DATE("endDate"),
    NO_END("noEnd"),
    NUMBERED("numbered");

    private final String value;

    RecurrenceRangeType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public static RecurrenceRangeType forValue(String searchValue) {
        for (RecurrenceRangeType candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
