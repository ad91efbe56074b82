package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * An operation applied against an app registration.
 */
public class ManagedAppOperation extends Entity {

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link ManagedAppOperation}
     */
    public static ManagedAppOperation createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new ManagedAppOperation();
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
        deserializerMap.put("displayName", n -> this.setDisplayName(n.getStringValue()));
        deserializerMap.put("lastModifiedDateTime", n -> this.setLastModifiedDateTime(n.getOffsetDateTimeValue()));
        deserializerMap.put("state", n -> this.setState(n.getStringValue()));
        deserializerMap.put("version", n -> this.setVersion(n.getStringValue()));
        return deserializerMap;
    }

    public OffsetDateTime getLastModifiedDateTime() {
        return this.backingStore.get("lastModifiedDateTime");
    }

    /**
     * Gets the state property value. The current state of the operation
     *
     * @return the state value
     */
    public String getState() {
        return this.backingStore.get("state");
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
        writer.writeStringValue("displayName", this.getDisplayName());
        writer.writeOffsetDateTimeValue("lastModifiedDateTime", this.getLastModifiedDateTime());
        writer.writeStringValue("state", this.getState());
        writer.writeStringValue("version", this.getVersion());
    }

    public void setDisplayName(String value) {
        this.backingStore.set("displayName", value);
    }

    public void setLastModifiedDateTime(OffsetDateTime value) {
        this.backingStore.set("lastModifiedDateTime", value);
    }

    public void setState(String value) {
        this.backingStore.set("state", value);
    }

    public void setVersion(String value) {
        this.backingStore.set("version", value);
    }
}
