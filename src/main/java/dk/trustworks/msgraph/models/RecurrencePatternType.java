package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

public enum RecurrencePatternType implements ValuedEnum {

    DAILY("daily"),
    WEEKLY("weekly"),
    ABSOLUTE_MONTHLY("absoluteMonthly"),
    RELATIVE_MONTHLY("relativeMonthly"),
    ABSOLUTE_YEARLY("absoluteYearly"),
    RELATIVE_YEARLY("relativeYearly");

    private final String value;

    RecurrencePatternType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public static RecurrencePatternType forValue(String searchValue) {
        for (RecurrencePatternType candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
