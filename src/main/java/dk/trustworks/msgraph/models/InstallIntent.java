package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

/**
 * Install intent of an eBook assignment.
 */
public enum InstallIntent implements ValuedEnum {

    AVAILABLE("available"),
    REQUIRED("required"),
    UNINSTALL("uninstall"),
    AVAILABLE_WITHOUT_ENROLLMENT("availableWithoutEnrollment");

    private final String value;

    InstallIntent(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    /**
     * @return the constant with the given wire label, or {@code null} if there is none
     */
    public static InstallIntent forValue(String searchValue) {
        for (InstallIntent candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
