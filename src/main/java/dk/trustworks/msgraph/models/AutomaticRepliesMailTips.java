package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.AdditionalDataHolder;
import com.microsoft.kiota.serialization.Parsable;
import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;
import com.microsoft.kiota.store.BackedModel;
import com.microsoft.kiota.store.BackingStore;
import com.microsoft.kiota.store.BackingStoreFactorySingleton;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Mail tip about the automatic replies of a recipient.
 */
public class AutomaticRepliesMailTips implements AdditionalDataHolder, BackedModel, Parsable {

    /**
     * Holds the property values of this model.
     */
    protected BackingStore backingStore;

    public AutomaticRepliesMailTips() {
        this.backingStore = BackingStoreFactorySingleton.instance.createBackingStore();
        this.setAdditionalData(new HashMap<>());
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link AutomaticRepliesMailTips}
     */
    public static AutomaticRepliesMailTips createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new AutomaticRepliesMailTips();
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

    @Override
    public BackingStore getBackingStore() {
        return this.backingStore;
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(5);
        deserializerMap.put("@odata.type", n -> this.setOdataType(n.getStringValue()));
        deserializerMap.put("message", n -> this.setMessage(n.getStringValue()));
        deserializerMap.put("messageLanguage", n -> this.setMessageLanguage(n.getObjectValue(LocaleInfo::createFromDiscriminatorValue)));
        deserializerMap.put("scheduledEndDateTime", n -> this.setScheduledEndDateTime(n.getObjectValue(DateTimeTimeZone::createFromDiscriminatorValue)));
        deserializerMap.put("scheduledStartDateTime", n -> this.setScheduledStartDateTime(n.getObjectValue(DateTimeTimeZone::createFromDiscriminatorValue)));
        return deserializerMap;
    }

    public String getMessage() {
        return this.backingStore.get("message");
    }

    public LocaleInfo getMessageLanguage() {
        return this.backingStore.get("messageLanguage");
    }

    public String getOdataType() {
        return this.backingStore.get("@odata.type");
    }

    public DateTimeTimeZone getScheduledEndDateTime() {
        return this.backingStore.get("scheduledEndDateTime");
    }

    public DateTimeTimeZone getScheduledStartDateTime() {
        return this.backingStore.get("scheduledStartDateTime");
    }

    /**
     * Serializes information the current object.
     *
     * @param writer the writer to serialize into
     */
    @Override
    public void serialize(SerializationWriter writer) {
        Objects.requireNonNull(writer, "writer");
        writer.writeStringValue("message", this.getMessage());
        writer.writeObjectValue("messageLanguage", this.getMessageLanguage());
        writer.writeObjectValue("scheduledEndDateTime", this.getScheduledEndDateTime());
        writer.writeObjectValue("scheduledStartDateTime", this.getScheduledStartDateTime());
        writer.writeStringValue("@odata.type", this.getOdataType());
        writer.writeAdditionalData(this.getAdditionalData());
    }

    public void setAdditionalData(Map<String, Object> value) {
        this.backingStore.set("additionalData", value);
    }

    public void setBackingStore(BackingStore value) {
        this.backingStore = Objects.requireNonNull(value, "value");
    }

    public void setMessage(String value) {
        this.backingStore.set("message", value);
    }

    public void setMessageLanguage(LocaleInfo value) {
        this.backingStore.set("messageLanguage", value);
    }

    public void setOdataType(String value) {
        this.backingStore.set("@odata.type", value);
    }

    public void setScheduledEndDateTime(DateTimeTimeZone value) {
        this.backingStore.set("scheduledEndDateTime", value);
    }

    public void setScheduledStartDateTime(DateTimeTimeZone value) {
        this.backingStore.set("scheduledStartDateTime", value);
    }
}
