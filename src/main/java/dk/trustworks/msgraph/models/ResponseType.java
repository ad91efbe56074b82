package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

/**
 * Response of an attendee or organizer to a meeting request.
 */
public enum ResponseType implements ValuedEnum {

    NONE("none"),
    ORGANIZER("organizer"),
    TENTATIVELY_ACCEPTED("tentativelyAccepted"),
    ACCEPTED("accepted"),
    DECLINED("declined"),
    NOT_RESPONDED("notResponded");

    private final String value;

    ResponseType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    /**
     * @return the constant with the given wire label, or {@code null} if there is none
     */
    public static ResponseType forValue(String searchValue) {
        for (ResponseType candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
