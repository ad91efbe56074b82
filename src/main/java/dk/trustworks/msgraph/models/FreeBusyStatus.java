package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

/**
 * Availability shown for the time of an event.
 */
public enum FreeBusyStatus implements ValuedEnum {

    UNKNOWN("unknown"),
    FREE("free"),
    TENTATIVE("tentative"),
    BUSY("busy"),
    OOF("oof"),
    WORKING_ELSEWHERE("workingElsewhere");

    private final String value;

    FreeBusyStatus(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    /**
     * @return the constant with the given wire label, or {@code null} if there is none
     */
    public static FreeBusyStatus forValue(String searchValue) {
        for (FreeBusyStatus candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
