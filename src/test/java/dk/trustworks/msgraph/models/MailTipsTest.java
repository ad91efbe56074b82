package dk.trustworks.msgraph.models;

import dk.trustworks.msgraph.GraphSerialization;
import org.junit.jupiter.api.*;

import java.util.EnumSet;
import java.util.List;

import static dk.trustworks.msgraph.utils.AssertionHelpers.*;
import static dk.trustworks.msgraph.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the getMailTips request body and the mail tips it returns.
 * Both carry flag enums written as comma-joined labels.
 */
@DisplayName("Mail Tips Tests")
class MailTipsTest {

    private GraphSerialization serialization;

    @BeforeEach
    void setUp() {
        serialization = jsonSerialization();
    }

    @Test
    @DisplayName("flags in any order → written in declaration order")
    void flagLabels_declarationOrder() {
        GetMailTipsPostRequestBody body = serialization.deserialize(
                "{\"mailTipsOptions\":\"maxMessageSize,automaticReplies\"}",
                GetMailTipsPostRequestBody::createFromDiscriminatorValue);

        assertEquals(EnumSet.of(MailTipsType.AUTOMATIC_REPLIES, MailTipsType.MAX_MESSAGE_SIZE), body.getMailTipsOptions());
        assertEquals("automaticReplies,maxMessageSize",
                readJson(plainJsonSerialization().serializeAsString(body)).get("mailTipsOptions").asText());
    }

    @Test
    @DisplayName("empty recipient scope → null, not an empty set")
    void emptyScope_isNull() {
        MailTips tips = serialization.deserialize("{\"recipientScope\":\"\"}", MailTips::createFromDiscriminatorValue);

        assertNull(tips.getRecipientScope());
    }

    @Test
    @DisplayName("recipient scope with two labels → both flags set")
    void twoScopeLabels_bothSet() {
        MailTips tips = serialization.deserialize("{\"recipientScope\":\"internal,external\"}",
                MailTips::createFromDiscriminatorValue);

        assertEquals(EnumSet.of(RecipientScopeType.INTERNAL, RecipientScopeType.EXTERNAL), tips.getRecipientScope());
    }

    @Test
    @DisplayName("request body → options written as one string")
    void requestBody_serialized() {
        // Given
        GetMailTipsPostRequestBody body = new GetMailTipsPostRequestBody();
        body.setEmailAddresses(List.of("alice@contoso.com", "sales@contoso.com"));
        body.setMailTipsOptions(EnumSet.of(MailTipsType.MAILBOX_FULL_STATUS, MailTipsType.AUTOMATIC_REPLIES));

        // When
        String json = serialization.serializeAsString(body);
        GetMailTipsPostRequestBody decoded =
                serialization.deserialize(json, GetMailTipsPostRequestBody::createFromDiscriminatorValue);

        // Then
        assertJsonEquals("{\"emailAddresses\":[\"alice@contoso.com\",\"sales@contoso.com\"],"
                + "\"mailTipsOptions\":\"automaticReplies,mailboxFullStatus\"}", json);
        assertEquals(body.getMailTipsOptions(), decoded.getMailTipsOptions());
        assertEquals(body.getEmailAddresses(), decoded.getEmailAddresses());
    }

    @Test
    @DisplayName("mail tips response → nested replies and recipient scope decoded")
    void mailTipsResponse() {
        // Given
        String payload = "{\"emailAddress\":{\"address\":\"sales@contoso.com\"},"
                + "\"automaticReplies\":{\"message\":\"Out until Monday\","
                + "\"messageLanguage\":{\"locale\":\"en-US\",\"displayName\":\"English\"},"
                + "\"scheduledEndDateTime\":{\"dateTime\":\"2024-03-04T08:00:00.0000000\",\"timeZone\":\"UTC\"}},"
                + "\"mailboxFull\":false,\"maxMessageSize\":37748736,\"isModerated\":true,"
                + "\"externalMemberCount\":3,\"totalMemberCount\":42,"
                + "\"recipientScope\":\"internal,external\","
                + "\"recipientSuggestions\":[{\"emailAddress\":{\"address\":\"bob@contoso.com\"}}]}";

        // When
        MailTips tips = serialization.deserialize(payload, MailTips::createFromDiscriminatorValue);

        // Then
        assertEquals("sales@contoso.com", tips.getEmailAddress().getAddress());
        assertEquals("Out until Monday", tips.getAutomaticReplies().getMessage());
        assertEquals("en-US", tips.getAutomaticReplies().getMessageLanguage().getLocale());
        assertEquals("UTC", tips.getAutomaticReplies().getScheduledEndDateTime().getTimeZone());
        assertFalse(tips.getMailboxFull());
        assertEquals(37748736, tips.getMaxMessageSize());
        assertEquals(42, tips.getTotalMemberCount());
        assertEquals(EnumSet.of(RecipientScopeType.INTERNAL, RecipientScopeType.EXTERNAL), tips.getRecipientScope());
        assertEquals("bob@contoso.com", tips.getRecipientSuggestions().get(0).getEmailAddress().getAddress());
    }

    @Test
    @DisplayName("recipient scope with padded labels → labels not trimmed")
    void paddedScopeLabel_notTrimmed() {
        MailTips tips = serialization.deserialize("{\"recipientScope\":\"internal, external\"}",
                MailTips::createFromDiscriminatorValue);

        assertFalse(tips.getRecipientScope().contains(RecipientScopeType.EXTERNAL));
    }

    @Test
    @DisplayName("mail tips error → code and message decoded")
    void mailTipsError() {
        MailTips tips = serialization.deserialize("{\"error\":{\"code\":\"ErrorInvalidRecipients\","
                + "\"message\":\"No such mailbox\"}}", MailTips::createFromDiscriminatorValue);

        assertEquals("ErrorInvalidRecipients", tips.getError().getCode());
        assertEquals("No such mailbox", tips.getError().getMessage());
    }
}
