package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

public enum EventType implements ValuedEnum {

    SINGLE_INSTANCE("singleInstance"),
    OCCURRENCE("occurrence"),
    EXCEPTION("exception"),
    SERIES_MASTER("seriesMaster");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public static EventType forValue(String searchValue) {
        for (EventType candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
