package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

public enum LocationType implements ValuedEnum {

    DEFAULT("default"),
    CONFERENCE_ROOM("conferenceRoom"),
    HOME_ADDRESS("homeAddress"),
    BUSINESS_ADDRESS("businessAddress"),
    GEO_COORDINATES("geoCoordinates"),
    STREET_ADDRESS("streetAddress"),
    HOTEL("hotel"),
    RESTAURANT("restaurant"),
    LOCAL_BUSINESS("localBusiness"),
    POSTAL_ADDRESS("postalAddress");

    private final String value;

    LocationType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public static LocationType forValue(String searchValue) {
        for (LocationType candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
