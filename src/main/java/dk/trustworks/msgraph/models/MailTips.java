package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.AdditionalDataHolder;
import com.microsoft.kiota.serialization.Parsable;
import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;
import com.microsoft.kiota.store.BackedModel;
import com.microsoft.kiota.store.BackingStore;
import com.microsoft.kiota.store.BackingStoreFactorySingleton;

import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Informative messages about a recipient, shown while composing a message.
 */
public class MailTips implements AdditionalDataHolder, BackedModel, Parsable {

    /**
     * Holds the property values of this model.
     */
    protected BackingStore backingStore;

    public MailTips() {
        this.backingStore = BackingStoreFactorySingleton.instance.createBackingStore();
        this.setAdditionalData(new HashMap<>());
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link MailTips}
     */
    public static MailTips createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new MailTips();
    }

    /**
     * Gets the payload members that have no property of their own.
     *
     * @return the additional data, created empty on first access
     */
    @Override
    public Map<String, Object> getAdditionalData() {
        Map<String, Object> value = this.backingStore.get("additionalData");
        if (value == null) {
            value = new HashMap<>();
            this.setAdditionalData(value);
        }
        return value;
    }

    public AutomaticRepliesMailTips getAutomaticReplies() {
        return this.backingStore.get("automaticReplies");
    }

    @Override
    public BackingStore getBackingStore() {
        return this.backingStore;
    }

    public String getCustomMailTip() {
        return this.backingStore.get("customMailTip");
    }

    public Boolean getDeliveryRestricted() {
        return this.backingStore.get("deliveryRestricted");
    }

    public EmailAddress getEmailAddress() {
        return this.backingStore.get("emailAddress");
    }

    public MailTipsError getError() {
        return this.backingStore.get("error");
    }

    public Integer getExternalMemberCount() {
        return this.backingStore.get("externalMemberCount");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(13);
        deserializerMap.put("@odata.type", n -> this.setOdataType(n.getStringValue()));
        deserializerMap.put("automaticReplies", n -> this.setAutomaticReplies(n.getObjectValue(AutomaticRepliesMailTips::createFromDiscriminatorValue)));
        deserializerMap.put("customMailTip", n -> this.setCustomMailTip(n.getStringValue()));
        deserializerMap.put("deliveryRestricted", n -> this.setDeliveryRestricted(n.getBooleanValue()));
        deserializerMap.put("emailAddress", n -> this.setEmailAddress(n.getObjectValue(EmailAddress::createFromDiscriminatorValue)));
        deserializerMap.put("error", n -> this.setError(n.getObjectValue(MailTipsError::createFromDiscriminatorValue)));
        deserializerMap.put("externalMemberCount", n -> this.setExternalMemberCount(n.getIntegerValue()));
        deserializerMap.put("isModerated", n -> this.setIsModerated(n.getBooleanValue()));
        deserializerMap.put("mailboxFull", n -> this.setMailboxFull(n.getBooleanValue()));
        deserializerMap.put("maxMessageSize", n -> this.setMaxMessageSize(n.getIntegerValue()));
        deserializerMap.put("recipientScope", n -> this.setRecipientScope(n.getEnumSetValue(RecipientScopeType::forValue)));
        deserializerMap.put("recipientSuggestions", n -> this.setRecipientSuggestions(n.getCollectionOfObjectValues(Recipient::createFromDiscriminatorValue)));
        deserializerMap.put("totalMemberCount", n -> this.setTotalMemberCount(n.getIntegerValue()));
        return deserializerMap;
    }

    public Boolean getIsModerated() {
        return this.backingStore.get("isModerated");
    }

    public Boolean getMailboxFull() {
        return this.backingStore.get("mailboxFull");
    }

    public Integer getMaxMessageSize() {
        return this.backingStore.get("maxMessageSize");
    }

    public String getOdataType() {
        return this.backingStore.get("@odata.type");
    }

    /**
     * Gets the recipientScope property value. The scope of the recipient. Possible values are: none,
     * internal, external, externalPartner, externalNonParther.
     *
     * @return the recipientScope value
     */
    public EnumSet<RecipientScopeType> getRecipientScope() {
        return this.backingStore.get("recipientScope");
    }

    public List<Recipient> getRecipientSuggestions() {
        return this.backingStore.get("recipientSuggestions");
    }

    public Integer getTotalMemberCount() {
        return this.backingStore.get("totalMemberCount");
    }

    /**
     * Serializes information the current object.
     *
     * @param writer the writer to serialize into
     */
    @Override
    public void serialize(SerializationWriter writer) {
        Objects.requireNonNull(writer, "writer");
        writer.writeObjectValue("automaticReplies", this.getAutomaticReplies());
        writer.writeStringValue("customMailTip", this.getCustomMailTip());
        writer.writeBooleanValue("deliveryRestricted", this.getDeliveryRestricted());
        writer.writeObjectValue("emailAddress", this.getEmailAddress());
        writer.writeObjectValue("error", this.getError());
        writer.writeIntegerValue("externalMemberCount", this.getExternalMemberCount());
        writer.writeBooleanValue("isModerated", this.getIsModerated());
        writer.writeBooleanValue("mailboxFull", this.getMailboxFull());
        writer.writeIntegerValue("maxMessageSize", this.getMaxMessageSize());
        writer.writeEnumSetValue("recipientScope", this.getRecipientScope());
        writer.writeCollectionOfObjectValues("recipientSuggestions", this.getRecipientSuggestions());
        writer.writeIntegerValue("totalMemberCount", this.getTotalMemberCount());
        writer.writeStringValue("@odata.type", this.getOdataType());
        writer.writeAdditionalData(this.getAdditionalData());
    }

    public void setAdditionalData(Map<String, Object> value) {
        this.backingStore.set("additionalData", value);
    }

    public void setAutomaticReplies(AutomaticRepliesMailTips value) {
        this.backingStore.set("automaticReplies", value);
    }

    public void setBackingStore(BackingStore value) {
        this.backingStore = Objects.requireNonNull(value, "value");
    }

    public void setCustomMailTip(String value) {
        this.backingStore.set("customMailTip", value);
    }

    public void setDeliveryRestricted(Boolean value) {
        this.backingStore.set("deliveryRestricted", value);
    }

    public void setEmailAddress(EmailAddress value) {
        this.backingStore.set("emailAddress", value);
    }

    public void setError(MailTipsError value) {
        this.backingStore.set("error", value);
    }

    public void setExternalMemberCount(Integer value) {
        this.backingStore.set("externalMemberCount", value);
    }

    public void setIsModerated(Boolean value) {
        this.backingStore.set("isModerated", value);
    }

    public void setMailboxFull(Boolean value) {
        this.backingStore.set("mailboxFull", value);
    }

    public void setMaxMessageSize(Integer value) {
        this.backingStore.set("maxMessageSize", value);
    }

    public void setOdataType(String value) {
        this.backingStore.set("@odata.type", value);
    }

    public void setRecipientScope(EnumSet<RecipientScopeType> value) {
        this.backingStore.set("recipientScope", value);
    }

    public void setRecipientSuggestions(List<Recipient> value) {
        this.backingStore.set("recipientSuggestions", value);
    }

    public void setTotalMemberCount(Integer value) {
        this.backingStore.set("totalMemberCount", value);
    }
}
