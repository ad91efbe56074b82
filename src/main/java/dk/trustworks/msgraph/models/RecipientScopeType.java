package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

/**
 * Scope of a recipient relative to the sender's organization. Several can be combined.
 */
public enum RecipientScopeType implements ValuedEnum {

    NONE("none"),
    INTERNAL("internal"),
    EXTERNAL("external"),
    EXTERNAL_PARTNER("externalPartner"),
    EXTERNAL_NON_PARTNER("externalNonPartner");

    private final String value;

    RecipientScopeType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    /**
     * @return the constant with the given wire label, or {@code null} if there is none
     */
    public static RecipientScopeType forValue(String searchValue) {
        for (RecipientScopeType candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
