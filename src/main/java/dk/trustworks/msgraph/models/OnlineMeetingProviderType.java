package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

public enum OnlineMeetingProviderType implements ValuedEnum {

    UNKNOWN("unknown"),
    SKYPE_FOR_BUSINESS("skypeForBusiness"),
    SKYPE_FOR_CONSUMER("skypeForConsumer"),
    TEAMS_FOR_BUSINESS("teamsForBusiness");

    private final String value;

    OnlineMeetingProviderType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public static OnlineMeetingProviderType forValue(String searchValue) {
        for (OnlineMeetingProviderType candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
