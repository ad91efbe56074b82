package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

public enum InferenceClassificationType implements ValuedEnum {

    FOCUSED("focused"),
    OTHER("other");

    private final String value;

    InferenceClassificationType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public static InferenceClassificationType forValue(String searchValue) {
        for (InferenceClassificationType candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
