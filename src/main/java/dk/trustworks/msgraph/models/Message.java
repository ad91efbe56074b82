package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * An email message in a mailbox folder.
 */
public class Message extends OutlookItem {

    public Message() {
        super();
        this.setOdataType("#microsoft.graph.message");
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link Message}
     */
    public static Message createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        ParseNode mappingValueNode = parseNode.getChildNode("@odata.type");
        String mappingValue = mappingValueNode == null ? null : mappingValueNode.getStringValue();
        if (mappingValue == null) {
            return new Message();
        }
        return switch (mappingValue) {
            case "#microsoft.graph.eventMessage" -> new EventMessage();
            case "#microsoft.graph.eventMessageRequest" -> new EventMessageRequest();
            case "#microsoft.graph.eventMessageResponse" -> new EventMessageResponse();
            case "#microsoft.graph.calendarSharingMessage" -> new CalendarSharingMessage();
            default -> new Message();
        };
    }

    /**
     * Gets the attachments property value. The fileAttachment and itemAttachment attachments for the
     * message.
     *
     * @return the attachments value
     */
    public List<Attachment> getAttachments() {
        return this.backingStore.get("attachments");
    }

    /**
     * Gets the bccRecipients property value. The Bcc: recipients for the message.
     *
     * @return the bccRecipients value
     */
    public List<Recipient> getBccRecipients() {
        return this.backingStore.get("bccRecipients");
    }

    /**
     * Gets the body property value. The body of the message. It can be in HTML or text format.
     *
     * @return the body value
     */
    public ItemBody getBody() {
        return this.backingStore.get("body");
    }

    /**
     * Gets the bodyPreview property value. The first 255 characters of the message body. It is in text
     * format.
     *
     * @return the bodyPreview value
     */
    public String getBodyPreview() {
        return this.backingStore.get("bodyPreview");
    }

    /**
     * Gets the ccRecipients property value. The Cc: recipients for the message.
     *
     * @return the ccRecipients value
     */
    public List<Recipient> getCcRecipients() {
        return this.backingStore.get("ccRecipients");
    }

    /**
     * Gets the conversationId property value. The ID of the conversation the email belongs to.
     *
     * @return the conversationId value
     */
    public String getConversationId() {
        return this.backingStore.get("conversationId");
    }

    /**
     * Gets the conversationIndex property value. Indicates the position of the message within the
     * conversation.
     *
     * @return the conversationIndex value
     */
    public byte[] getConversationIndex() {
        return this.backingStore.get("conversationIndex");
    }

    public List<Extension> getExtensions() {
        return this.backingStore.get("extensions");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("attachments", n -> this.setAttachments(n.getCollectionOfObjectValues(Attachment::createFromDiscriminatorValue)));
        deserializerMap.put("bccRecipients", n -> this.setBccRecipients(n.getCollectionOfObjectValues(Recipient::createFromDiscriminatorValue)));
        deserializerMap.put("body", n -> this.setBody(n.getObjectValue(ItemBody::createFromDiscriminatorValue)));
        deserializerMap.put("bodyPreview", n -> this.setBodyPreview(n.getStringValue()));
        deserializerMap.put("ccRecipients", n -> this.setCcRecipients(n.getCollectionOfObjectValues(Recipient::createFromDiscriminatorValue)));
        deserializerMap.put("conversationId", n -> this.setConversationId(n.getStringValue()));
        deserializerMap.put("conversationIndex", n -> this.setConversationIndex(n.getByteArrayValue()));
        deserializerMap.put("extensions", n -> this.setExtensions(n.getCollectionOfObjectValues(Extension::createFromDiscriminatorValue)));
        deserializerMap.put("flag", n -> this.setFlag(n.getObjectValue(FollowupFlag::createFromDiscriminatorValue)));
        deserializerMap.put("from", n -> this.setFrom(n.getObjectValue(Recipient::createFromDiscriminatorValue)));
        deserializerMap.put("hasAttachments", n -> this.setHasAttachments(n.getBooleanValue()));
        deserializerMap.put("importance", n -> this.setImportance(n.getEnumValue(Importance::forValue)));
        deserializerMap.put("inferenceClassification", n -> this.setInferenceClassification(n.getEnumValue(InferenceClassificationType::forValue)));
        deserializerMap.put("internetMessageHeaders", n -> this.setInternetMessageHeaders(n.getCollectionOfObjectValues(InternetMessageHeader::createFromDiscriminatorValue)));
        deserializerMap.put("internetMessageId", n -> this.setInternetMessageId(n.getStringValue()));
        deserializerMap.put("isDeliveryReceiptRequested", n -> this.setIsDeliveryReceiptRequested(n.getBooleanValue()));
        deserializerMap.put("isDraft", n -> this.setIsDraft(n.getBooleanValue()));
        deserializerMap.put("isRead", n -> this.setIsRead(n.getBooleanValue()));
        deserializerMap.put("isReadReceiptRequested", n -> this.setIsReadReceiptRequested(n.getBooleanValue()));
        deserializerMap.put("multiValueExtendedProperties", n -> this.setMultiValueExtendedProperties(n.getCollectionOfObjectValues(MultiValueLegacyExtendedProperty::createFromDiscriminatorValue)));
        deserializerMap.put("parentFolderId", n -> this.setParentFolderId(n.getStringValue()));
        deserializerMap.put("receivedDateTime", n -> this.setReceivedDateTime(n.getOffsetDateTimeValue()));
        deserializerMap.put("replyTo", n -> this.setReplyTo(n.getCollectionOfObjectValues(Recipient::createFromDiscriminatorValue)));
        deserializerMap.put("sender", n -> this.setSender(n.getObjectValue(Recipient::createFromDiscriminatorValue)));
        deserializerMap.put("sentDateTime", n -> this.setSentDateTime(n.getOffsetDateTimeValue()));
        deserializerMap.put("singleValueExtendedProperties", n -> this.setSingleValueExtendedProperties(n.getCollectionOfObjectValues(SingleValueLegacyExtendedProperty::createFromDiscriminatorValue)));
        deserializerMap.put("subject", n -> this.setSubject(n.getStringValue()));
        deserializerMap.put("toRecipients", n -> this.setToRecipients(n.getCollectionOfObjectValues(Recipient::createFromDiscriminatorValue)));
        deserializerMap.put("uniqueBody", n -> this.setUniqueBody(n.getObjectValue(ItemBody::createFromDiscriminatorValue)));
        deserializerMap.put("webLink", n -> this.setWebLink(n.getStringValue()));
        return deserializerMap;
    }

    public FollowupFlag getFlag() {
        return this.backingStore.get("flag");
    }

    /**
     * Gets the from property value. The owner of the mailbox from which the message is sent.
     *
     * @return the from value
     */
    public Recipient getFrom() {
        return this.backingStore.get("from");
    }

    public Boolean getHasAttachments() {
        return this.backingStore.get("hasAttachments");
    }

    public Importance getImportance() {
        return this.backingStore.get("importance");
    }

    public InferenceClassificationType getInferenceClassification() {
        return this.backingStore.get("inferenceClassification");
    }

    public List<InternetMessageHeader> getInternetMessageHeaders() {
        return this.backingStore.get("internetMessageHeaders");
    }

    /**
     * Gets the internetMessageId property value. The message ID in the format specified by RFC2822.
     *
     * @return the internetMessageId value
     */
    public String getInternetMessageId() {
        return this.backingStore.get("internetMessageId");
    }

    public Boolean getIsDeliveryReceiptRequested() {
        return this.backingStore.get("isDeliveryReceiptRequested");
    }

    public Boolean getIsDraft() {
        return this.backingStore.get("isDraft");
    }

    public Boolean getIsRead() {
        return this.backingStore.get("isRead");
    }

    public Boolean getIsReadReceiptRequested() {
        return this.backingStore.get("isReadReceiptRequested");
    }

    public List<MultiValueLegacyExtendedProperty> getMultiValueExtendedProperties() {
        return this.backingStore.get("multiValueExtendedProperties");
    }

    public String getParentFolderId() {
        return this.backingStore.get("parentFolderId");
    }

    public OffsetDateTime getReceivedDateTime() {
        return this.backingStore.get("receivedDateTime");
    }

    public List<Recipient> getReplyTo() {
        return this.backingStore.get("replyTo");
    }

    /**
     * Gets the sender property value. The account that is actually used to generate the message.
     *
     * @return the sender value
     */
    public Recipient getSender() {
        return this.backingStore.get("sender");
    }

    public OffsetDateTime getSentDateTime() {
        return this.backingStore.get("sentDateTime");
    }

    public List<SingleValueLegacyExtendedProperty> getSingleValueExtendedProperties() {
        return this.backingStore.get("singleValueExtendedProperties");
    }

    public String getSubject() {
        return this.backingStore.get("subject");
    }

    public List<Recipient> getToRecipients() {
        return this.backingStore.get("toRecipients");
    }

    /**
     * Gets the uniqueBody property value. The part of the body of the message that is unique to the
     * current message.
     *
     * @return the uniqueBody value
     */
    public ItemBody getUniqueBody() {
        return this.backingStore.get("uniqueBody");
    }

    /**
     * Gets the webLink property value. The URL to open the message in Outlook on the web.
     *
     * @return the webLink value
     */
    public String getWebLink() {
        return this.backingStore.get("webLink");
    }

    /**
     * Serializes information the current object.
     *
     * @param writer the writer to serialize into
     */
    @Override
    public void serialize(SerializationWriter writer) {
        Objects.requireNonNull(writer, "writer");
        super.serialize(writer);
        writer.writeCollectionOfObjectValues("attachments", this.getAttachments());
        writer.writeCollectionOfObjectValues("bccRecipients", this.getBccRecipients());
        writer.writeObjectValue("body", this.getBody());
        writer.writeStringValue("bodyPreview", this.getBodyPreview());
        writer.writeCollectionOfObjectValues("ccRecipients", this.getCcRecipients());
        writer.writeStringValue("conversationId", this.getConversationId());
        writer.writeByteArrayValue("conversationIndex", this.getConversationIndex());
        writer.writeCollectionOfObjectValues("extensions", this.getExtensions());
        writer.writeObjectValue("flag", this.getFlag());
        writer.writeObjectValue("from", this.getFrom());
        writer.writeBooleanValue("hasAttachments", this.getHasAttachments());
        writer.writeEnumValue("importance", this.getImportance());
        writer.writeEnumValue("inferenceClassification", this.getInferenceClassification());
        writer.writeCollectionOfObjectValues("internetMessageHeaders", this.getInternetMessageHeaders());
        writer.writeStringValue("internetMessageId", this.getInternetMessageId());
        writer.writeBooleanValue("isDeliveryReceiptRequested", this.getIsDeliveryReceiptRequested());
        writer.writeBooleanValue("isDraft", this.getIsDraft());
        writer.writeBooleanValue("isRead", this.getIsRead());
        writer.writeBooleanValue("isReadReceiptRequested", this.getIsReadReceiptRequested());
        writer.writeCollectionOfObjectValues("multiValueExtendedProperties", this.getMultiValueExtendedProperties());
        writer.writeStringValue("parentFolderId", this.getParentFolderId());
        writer.writeOffsetDateTimeValue("receivedDateTime", this.getReceivedDateTime());
        writer.writeCollectionOfObjectValues("replyTo", this.getReplyTo());
        writer.writeObjectValue("sender", this.getSender());
        writer.writeOffsetDateTimeValue("sentDateTime", this.getSentDateTime());
        writer.writeCollectionOfObjectValues("singleValueExtendedProperties", this.getSingleValueExtendedProperties());
        writer.writeStringValue("subject", this.getSubject());
        writer.writeCollectionOfObjectValues("toRecipients", this.getToRecipients());
        writer.writeObjectValue("uniqueBody", this.getUniqueBody());
        writer.writeStringValue("webLink", this.getWebLink());
    }

    public void setAttachments(List<Attachment> value) {
        this.backingStore.set("attachments", value);
    }

    public void setBccRecipients(List<Recipient> value) {
        this.backingStore.set("bccRecipients", value);
    }

    public void setBody(ItemBody value) {
        this.backingStore.set("body", value);
    }

    public void setBodyPreview(String value) {
        this.backingStore.set("bodyPreview", value);
    }

    public void setCcRecipients(List<Recipient> value) {
        this.backingStore.set("ccRecipients", value);
    }

    public void setConversationId(String value) {
        this.backingStore.set("conversationId", value);
    }

    public void setConversationIndex(byte[] value) {
        this.backingStore.set("conversationIndex", value);
    }

    public void setExtensions(List<Extension> value) {
        this.backingStore.set("extensions", value);
    }

    public void setFlag(FollowupFlag value) {
        this.backingStore.set("flag", value);
    }

    public void setFrom(Recipient value) {
        this.backingStore.set("from", value);
    }

    public void setHasAttachments(Boolean value) {
        this.backingStore.set("hasAttachments", value);
    }

    public void setImportance(Importance value) {
        this.backingStore.set("importance", value);
    }

    public void setInferenceClassification(InferenceClassificationType value) {
        this.backingStore.set("inferenceClassification", value);
    }

    public void setInternetMessageHeaders(List<InternetMessageHeader> value) {
        this.backingStore.set("internetMessageHeaders", value);
    }

    public void setInternetMessageId(String value) {
        this.backingStore.set("internetMessageId", value);
    }

    public void setIsDeliveryReceiptRequested(Boolean value) {
        this.backingStore.set("isDeliveryReceiptRequested", value);
    }

    public void setIsDraft(Boolean value) {
        this.backingStore.set("isDraft", value);
    }

    public void setIsRead(Boolean value) {
        this.backingStore.set("isRead", value);
    }

    public void setIsReadReceiptRequested(Boolean value) {
        this.backingStore.set("isReadReceiptRequested", value);
    }

    public void setMultiValueExtendedProperties(List<MultiValueLegacyExtendedProperty> value) {
        this.backingStore.set("multiValueExtendedProperties", value);
    }

    public void setParentFolderId(String value) {
        this.backingStore.set("parentFolderId", value);
    }

    public void setReceivedDateTime(OffsetDateTime value) {
        this.backingStore.set("receivedDateTime", value);
    }

    public void setReplyTo(List<Recipient> value) {
        this.backingStore.set("replyTo", value);
    }

    public void setSender(Recipient value) {
        this.backingStore.set("sender", value);
    }

    public void setSentDateTime(OffsetDateTime value) {
        this.backingStore.set("sentDateTime", value);
    }

    public void setSingleValueExtendedProperties(List<SingleValueLegacyExtendedProperty> value) {
        this.backingStore.set("singleValueExtendedProperties", value);
    }

    public void setSubject(String value) {
        this.backingStore.set("subject", value);
    }

    public void setToRecipients(List<Recipient> value) {
        this.backingStore.set("toRecipients", value);
    }

    public void setUniqueBody(ItemBody value) {
        this.backingStore.set("uniqueBody", value);
    }

    public void setWebLink(String value) {
        this.backingStore.set("webLink", value);
    }
}
