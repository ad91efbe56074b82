package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

/**
 * Importance of a message or event.
 */
public enum Importance implements ValuedEnum {

    LOW("low"),
    NORMAL("normal"),
    HIGH("high");

    private final String value;

    Importance(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    /**
     * @return the constant with the given wire label, or {@code null} if there is none
     */
    public static Importance forValue(String searchValue) {
        for (Importance candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
