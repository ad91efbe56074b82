package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * An attendee's response to a meeting request.
 */
public class EventMessageResponse extends EventMessage {

    public EventMessageResponse() {
        super();
        this.setOdataType("#microsoft.graph.eventMessageResponse");
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link EventMessageResponse}
     */
    public static EventMessageResponse createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new EventMessageResponse();
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("proposedNewTime", n -> this.setProposedNewTime(n.getObjectValue(TimeSlot::createFromDiscriminatorValue)));
        deserializerMap.put("responseType", n -> this.setResponseType(n.getEnumValue(ResponseType::forValue)));
        return deserializerMap;
    }

    public TimeSlot getProposedNewTime() {
        return this.backingStore.get("proposedNewTime");
    }

    public ResponseType getResponseType() {
        return this.backingStore.get("responseType");
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
        writer.writeObjectValue("proposedNewTime", this.getProposedNewTime());
        writer.writeEnumValue("responseType", this.getResponseType());
    }

    public void setProposedNewTime(TimeSlot value) {
        this.backingStore.set("proposedNewTime", value);
    }

    public void setResponseType(ResponseType value) {
        this.backingStore.set("responseType", value);
    }
}
