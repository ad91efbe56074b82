package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

public enum LocationUniqueIdType implements ValuedEnum {

    UNKNOWN("unknown"),
    LOCATION_STORE("locationStore"),
    DIRECTORY("directory"),
    PRIVATE("private"),
    BING("bing");

    private final String value;

    LocationUniqueIdType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public static LocationUniqueIdType forValue(String searchValue) {
        for (LocationUniqueIdType candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
