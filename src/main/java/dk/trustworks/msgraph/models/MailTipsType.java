package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

/**
 * Mail tips requested from getMailTips. Several can be combined.
 */
public enum MailTipsType implements ValuedEnum {

    AUTOMATIC_REPLIES("automaticReplies"),
    MAILBOX_FULL_STATUS("mailboxFullStatus"),
    CUSTOM_MAIL_TIP("customMailTip"),
    EXTERNAL_MEMBER_COUNT("externalMemberCount"),
    TOTAL_MEMBER_COUNT("totalMemberCount"),
    MAX_MESSAGE_SIZE("maxMessageSize"),
    DELIVERY_RESTRICTION("deliveryRestriction"),
    MODERATION_STATUS("moderationStatus"),
    RECIPIENT_SCOPE("recipientScope"),
    RECIPIENT_SUGGESTIONS("recipientSuggestions");

    private final String value;

    MailTipsType(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    /**
     * @return the constant with the given wire label, or {@code null} if there is none
     */
    public static MailTipsType forValue(String searchValue) {
        for (MailTipsType candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
