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
 * Common base of mail, calendar and contact items stored in an Outlook mailbox.
 */
public class OutlookItem extends Entity {

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link OutlookItem}
     */
    public static OutlookItem createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        ParseNode mappingValueNode = parseNode.getChildNode("@odata.type");
        String mappingValue = mappingValueNode == null ? null : mappingValueNode.getStringValue();
        if (mappingValue == null) {
            return new OutlookItem();
        }
        return switch (mappingValue) {
            case "#microsoft.graph.message" -> new Message();
            case "#microsoft.graph.eventMessage" -> new EventMessage();
            case "#microsoft.graph.eventMessageRequest" -> new EventMessageRequest();
            case "#microsoft.graph.eventMessageResponse" -> new EventMessageResponse();
            case "#microsoft.graph.calendarSharingMessage" -> new CalendarSharingMessage();
            case "#microsoft.graph.event" -> new Event();
            default -> new OutlookItem();
        };
    }

    /**
     * Gets the categories property value. The categories associated with the item.
     *
     * @return the categories value
     */
    public List<String> getCategories() {
        return this.backingStore.get("categories");
    }

    /**
     * Gets the changeKey property value. Identifies the version of the item. Every time the item is
     * changed, changeKey changes as well.
     *
     * @return the changeKey value
     */
    public String getChangeKey() {
        return this.backingStore.get("changeKey");
    }

    public OffsetDateTime getCreatedDateTime() {
        return this.backingStore.get("createdDateTime");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("categories", n -> this.setCategories(n.getCollectionOfPrimitiveValues(String.class)));
        deserializerMap.put("changeKey", n -> this.setChangeKey(n.getStringValue()));
        deserializerMap.put("createdDateTime", n -> this.setCreatedDateTime(n.getOffsetDateTimeValue()));
        deserializerMap.put("lastModifiedDateTime", n -> this.setLastModifiedDateTime(n.getOffsetDateTimeValue()));
        return deserializerMap;
    }

    public OffsetDateTime getLastModifiedDateTime() {
        return this.backingStore.get("lastModifiedDateTime");
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
        writer.writeCollectionOfPrimitiveValues("categories", this.getCategories());
        writer.writeStringValue("changeKey", this.getChangeKey());
        writer.writeOffsetDateTimeValue("createdDateTime", this.getCreatedDateTime());
        writer.writeOffsetDateTimeValue("lastModifiedDateTime", this.getLastModifiedDateTime());
    }

    public void setCategories(List<String> value) {
        this.backingStore.set("categories", value);
    }

    public void setChangeKey(String value) {
        this.backingStore.set("changeKey", value);
    }

    public void setCreatedDateTime(OffsetDateTime value) {
        this.backingStore.set("createdDateTime", value);
    }

    public void setLastModifiedDateTime(OffsetDateTime value) {
        this.backingStore.set("lastModifiedDateTime", value);
    }
}
