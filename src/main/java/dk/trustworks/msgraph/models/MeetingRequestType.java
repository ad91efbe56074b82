package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

public enum MeetingRequestType implements ValuedEnum {

    NONE("none"),
    NEW_MEETING_REQUEST("newMeetingRequest"),
    FULL_UPDATE("fullUpdate"),
    INFORMATIONAL_UPDATE("informationalUpdate"),
    SILENT_UPDATE("silentUpdate"),
    OUTDATED("outdated"),
    PRINCIPAL_WANTS_COPY("principalWantsCopy");

    private final String value;

    MeetingRequestType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public static MeetingRequestType forValue(String searchValue) {
        for (MeetingRequestType candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
