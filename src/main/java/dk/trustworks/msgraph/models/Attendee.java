package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * An event attendee and their response.
 */
public class Attendee extends AttendeeBase {

    public Attendee() {
        super();
        this.setOdataType("#microsoft.graph.attendee");
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link Attendee}
     */
    public static Attendee createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new Attendee();
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
        deserializerMap.put("status", n -> this.setStatus(n.getObjectValue(ResponseStatus::createFromDiscriminatorValue)));
        return deserializerMap;
    }

    /**
     * Gets the proposedNewTime property value. An alternate date/time proposed by the attendee for a
     * meeting request to start and end.
     *
     * @return the proposedNewTime value
     */
    public TimeSlot getProposedNewTime() {
        return this.backingStore.get("proposedNewTime");
    }

    public ResponseStatus getStatus() {
        return this.backingStore.get("status");
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
        writer.writeObjectValue("status", this.getStatus());
    }

    public void setProposedNewTime(TimeSlot value) {
        this.backingStore.set("proposedNewTime", value);
    }

    public void setStatus(ResponseStatus value) {
        this.backingStore.set("status", value);
    }
}
