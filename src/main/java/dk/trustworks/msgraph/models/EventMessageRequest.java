package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A meeting request sent to an attendee.
 */
public class EventMessageRequest extends EventMessage {

    public EventMessageRequest() {
        super();
        this.setOdataType("#microsoft.graph.eventMessageRequest");
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link EventMessageRequest}
     */
    public static EventMessageRequest createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new EventMessageRequest();
    }

    /**
     * Gets the allowNewTimeProposals property value. True if the meeting organizer allows invitees to
     * propose a new time when responding.
     *
     * @return the allowNewTimeProposals value
     */
    public Boolean getAllowNewTimeProposals() {
        return this.backingStore.get("allowNewTimeProposals");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("allowNewTimeProposals", n -> this.setAllowNewTimeProposals(n.getBooleanValue()));
        deserializerMap.put("meetingRequestType", n -> this.setMeetingRequestType(n.getEnumValue(MeetingRequestType::forValue)));
        deserializerMap.put("previousEndDateTime", n -> this.setPreviousEndDateTime(n.getObjectValue(DateTimeTimeZone::createFromDiscriminatorValue)));
        deserializerMap.put("previousLocation", n -> this.setPreviousLocation(n.getObjectValue(Location::createFromDiscriminatorValue)));
        deserializerMap.put("previousStartDateTime", n -> this.setPreviousStartDateTime(n.getObjectValue(DateTimeTimeZone::createFromDiscriminatorValue)));
        deserializerMap.put("responseRequested", n -> this.setResponseRequested(n.getBooleanValue()));
        return deserializerMap;
    }

    public MeetingRequestType getMeetingRequestType() {
        return this.backingStore.get("meetingRequestType");
    }

    /**
     * Gets the previousEndDateTime property value. If the meeting update changes the meeting end time, the
     * previous end time.
     *
     * @return the previousEndDateTime value
     */
    public DateTimeTimeZone getPreviousEndDateTime() {
        return this.backingStore.get("previousEndDateTime");
    }

    public Location getPreviousLocation() {
        return this.backingStore.get("previousLocation");
    }

    public DateTimeTimeZone getPreviousStartDateTime() {
        return this.backingStore.get("previousStartDateTime");
    }

    public Boolean getResponseRequested() {
        return this.backingStore.get("responseRequested");
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
        writer.writeBooleanValue("allowNewTimeProposals", this.getAllowNewTimeProposals());
        writer.writeEnumValue("meetingRequestType", this.getMeetingRequestType());
        writer.writeObjectValue("previousEndDateTime", this.getPreviousEndDateTime());
        writer.writeObjectValue("previousLocation", this.getPreviousLocation());
        writer.writeObjectValue("previousStartDateTime", this.getPreviousStartDateTime());
        writer.writeBooleanValue("responseRequested", this.getResponseRequested());
    }

    public void setAllowNewTimeProposals(Boolean value) {
        this.backingStore.set("allowNewTimeProposals", value);
    }

    public void setMeetingRequestType(MeetingRequestType value) {
        this.backingStore.set("meetingRequestType", value);
    }

    public void setPreviousEndDateTime(DateTimeTimeZone value) {
        this.backingStore.set("previousEndDateTime", value);
    }

    public void setPreviousLocation(Location value) {
        this.backingStore.set("previousLocation", value);
    }

    public void setPreviousStartDateTime(DateTimeTimeZone value) {
        this.backingStore.set("previousStartDateTime", value);
    }

    public void setResponseRequested(Boolean value) {
        this.backingStore.set("responseRequested", value);
    }
}
