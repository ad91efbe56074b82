package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A management policy applied to a managed app.
 */
public class ManagedAppPolicy extends Entity {

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link ManagedAppPolicy}
     */
    public static ManagedAppPolicy createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new ManagedAppPolicy();
    }

    public OffsetDateTime getCreatedDateTime() {
        return this.backingStore.get("createdDateTime");
    }

    public String getDescription() {
        return this.backingStore.get("description");
    }

    public String getDisplayName() {
        return this.backingStore.get("displayName");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("createdDateTime", n -> this.setCreatedDateTime(n.getOffsetDateTimeValue()));
        deserializerMap.put("description", n -> this.setDescription(n.getStringValue()));
        deserializerMap.put("displayName", n -> this.setDisplayName(n.getStringValue()));
        deserializerMap.put("lastModifiedDateTime", n -> this.setLastModifiedDateTime(n.getOffsetDateTimeValue()));
        deserializerMap.put("version", n -> this.setVersion(n.getStringValue()));
        return deserializerMap;
    }

    public OffsetDateTime getLastModifiedDateTime() {
        return this.backingStore.get("lastModifiedDateTime");
    }

    public String getVersion() {
        return this.backingStore.get("version");
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
        writer.writeOffsetDateTimeValue("createdDateTime", this.getCreatedDateTime());
        writer.writeStringValue("description", this.getDescription());
        writer.writeStringValue("displayName", this.getDisplayName());
        writer.writeOffsetDateTimeValue("lastModifiedDateTime", this.getLastModifiedDateTime());
        writer.writeStringValue("version", this.getVersion());
    }

    public void setCreatedDateTime(OffsetDateTime value) {
        this.backingStore.set("createdDateTime", value);
    }

    public void setDescription(String value) {
        this.backingStore.set("description", value);
    }

    public void setDisplayName(String value) {
        this.backingStore.set("displayName", value);
    }

    public void setLastModifiedDateTime(OffsetDateTime value) {
        this.backingStore.set("lastModifiedDateTime", value);
    }

    public void setVersion(String value) {
        this.backingStore.set("version", value);
    }
}
