package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

public enum FollowupFlagStatus implements ValuedEnum {

    NOT_FLAGGED("notFlagged"),
    COMPLETE("complete"),
    FLAGGED("flagged");

    private final String value;

    FollowupFlagStatus(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public static FollowupFlagStatus forValue(String searchValue) {
        for (FollowupFlagStatus candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
