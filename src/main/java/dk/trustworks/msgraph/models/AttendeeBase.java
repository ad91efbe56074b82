package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * An attendee with its attendance type.
 */
public class AttendeeBase extends Recipient {

    public AttendeeBase() {
        super();
        this.setOdataType("#microsoft.graph.attendeeBase");
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link AttendeeBase}
     */
    public static AttendeeBase createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        ParseNode mappingValueNode = parseNode.getChildNode("@odata.type");
        String mappingValue = mappingValueNode == null ? null : mappingValueNode.getStringValue();
        if (mappingValue == null) {
            return new AttendeeBase();
        }
        return switch (mappingValue) {
            case "#microsoft.graph.attendee" -> new Attendee();
            default -> new AttendeeBase();
        };
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("type", n -> this.setType(n.getEnumValue(AttendeeType::forValue)));
        return deserializerMap;
    }

    public AttendeeType getType() {
        return this.backingStore.get("type");
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
        writer.writeEnumValue("type", this.getType());
    }

    public void setType(AttendeeType value) {
        this.backingStore.set("type", value);
    }
}
