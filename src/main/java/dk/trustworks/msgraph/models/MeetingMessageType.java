package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

public enum MeetingMessageType implements ValuedEnum {

    NONE("none"),
    MEETING_REQUEST("meetingRequest"),
    MEETING_CANCELLED("meetingCancelled"),
    MEETING_ACCEPTED("meetingAccepted"),
    MEETING_TENATIVELY_ACCEPTED("meetingTenativelyAccepted"),
    MEETING_DECLINED("meetingDeclined");

    private final String value;

    MeetingMessageType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public static MeetingMessageType forValue(String searchValue) {
        for (MeetingMessageType candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
