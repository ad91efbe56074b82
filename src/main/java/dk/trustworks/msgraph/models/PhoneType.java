package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

public enum PhoneType implements ValuedEnum {

    HOME("home"),
    BUSINESS("business"),
    MOBILE("mobile"),
    OTHER("other"),
    ASSISTANT("assistant"),
    HOME_FAX("homeFax"),
    BUSINESS_FAX("businessFax"),
    OTHER_FAX("otherFax"),
    PAGER("pager"),
    RADIO("radio");

    private final String value;

    PhoneType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public static PhoneType forValue(String searchValue) {
        for (PhoneType candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
