package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A file, item or link attached to an event or message.
 */
public class Attachment extends Entity {

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link Attachment}
     */
    public static Attachment createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        ParseNode mappingValueNode = parseNode.getChildNode("@odata.type");
        String mappingValue = mappingValueNode == null ? null : mappingValueNode.getStringValue();
        if (mappingValue == null) {
            return new Attachment();
        }
        return switch (mappingValue) {
            case "#microsoft.graph.fileAttachment" -> new FileAttachment();
            case "#microsoft.graph.itemAttachment" -> new ItemAttachment();
            case "#microsoft.graph.referenceAttachment" -> new ReferenceAttachment();
            default -> new Attachment();
        };
    }

    public String getContentType() {
        return this.backingStore.get("contentType");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("contentType", n -> this.setContentType(n.getStringValue()));
        deserializerMap.put("isInline", n -> this.setIsInline(n.getBooleanValue()));
        deserializerMap.put("lastModifiedDateTime", n -> this.setLastModifiedDateTime(n.getOffsetDateTimeValue()));
        deserializerMap.put("name", n -> this.setName(n.getStringValue()));
        deserializerMap.put("size", n -> this.setSize(n.getIntegerValue()));
        return deserializerMap;
    }

    public Boolean getIsInline() {
        return this.backingStore.get("isInline");
    }

    public OffsetDateTime getLastModifiedDateTime() {
        return this.backingStore.get("lastModifiedDateTime");
    }

    public String getName() {
        return this.backingStore.get("name");
    }

    /**
     * Gets the size property value. The length of the attachment in bytes.
     *
     * @return the size value
     */
    public Integer getSize() {
        return this.backingStore.get("size");
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
        writer.writeStringValue("contentType", this.getContentType());
        writer.writeBooleanValue("isInline", this.getIsInline());
        writer.writeOffsetDateTimeValue("lastModifiedDateTime", this.getLastModifiedDateTime());
        writer.writeStringValue("name", this.getName());
        writer.writeIntegerValue("size", this.getSize());
    }

    public void setContentType(String value) {
        this.backingStore.set("contentType", value);
    }

    public void setIsInline(Boolean value) {
        this.backingStore.set("isInline", value);
    }

    public void setLastModifiedDateTime(OffsetDateTime value) {
        this.backingStore.set("lastModifiedDateTime", value);
    }

    public void setName(String value) {
        this.backingStore.set("name", value);
    }

    public void setSize(Integer value) {
        this.backingStore.set("size", value);
    }
}
