package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

/**
 * Content format of an item body.
 */
public enum BodyType implements ValuedEnum {

    TEXT("text"),
    HTML("html");

    private final String value;

    BodyType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    /**
     * @return the constant with the given wire label, or {@code null} if there is none
     */
    public static BodyType forValue(String searchValue) {
        for (BodyType candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
