package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

/**
 * Reason an app registration is flagged.
 */
public enum ManagedAppFlaggedReason implements ValuedEnum {

    NONE("none"),
    ROOTED_DEVICE("rootedDevice");

    private final String value;

    ManagedAppFlaggedReason(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    /**
     * @return the constant with the given wire label, or {@code null} if there is none
     */
    public static ManagedAppFlaggedReason forValue(String searchValue) {
        for (ManagedAppFlaggedReason candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
