package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

public enum CalendarColor implements ValuedEnum {

    AUTO("auto"),
    LIGHT_BLUE("lightBlue"),
    LIGHT_GREEN("lightGreen"),
    LIGHT_ORANGE("lightOrange"),
    LIGHT_GRAY("lightGray"),
    LIGHT_YELLOW("lightYellow"),
    LIGHT_TEAL("lightTeal"),
    LIGHT_PINK("lightPink"),
    LIGHT_BROWN("lightBrown"),
    LIGHT_RED("lightRed"),
    MAX_COLOR("maxColor");

    private final String value;

    CalendarColor(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public static CalendarColor forValue(String searchValue) {
        for (CalendarColor candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
