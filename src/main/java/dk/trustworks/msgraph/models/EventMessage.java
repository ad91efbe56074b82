package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A message that carries a meeting request, cancellation or response.
 */
public class EventMessage extends Message {

    public EventMessage() {
        super();
        this.setOdataType("#microsoft.graph.eventMessage");
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link EventMessage}
     */
    public static EventMessage createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        ParseNode mappingValueNode = parseNode.getChildNode("@odata.type");
        String mappingValue = mappingValueNode == null ? null : mappingValueNode.getStringValue();
        if (mappingValue == null) {
            return new EventMessage();
        }
        return switch (mappingValue) {
            case "#microsoft.graph.eventMessageRequest" -> new EventMessageRequest();
            case "#microsoft.graph.eventMessageResponse" -> new EventMessageResponse();
            default -> new EventMessage();
        };
    }

    public DateTimeTimeZone getEndDateTime() {
        return this.backingStore.get("endDateTime");
    }

    /**
     * Gets the event property value. The event associated with the event message.
     *
     * @return the event value
     */
    public Event getEvent() {
        return this.backingStore.get("event");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("endDateTime", n -> this.setEndDateTime(n.getObjectValue(DateTimeTimeZone::createFromDiscriminatorValue)));
        deserializerMap.put("event", n -> this.setEvent(n.getObjectValue(Event::createFromDiscriminatorValue)));
        deserializerMap.put("isAllDay", n -> this.setIsAllDay(n.getBooleanValue()));
        deserializerMap.put("isDelegated", n -> this.setIsDelegated(n.getBooleanValue()));
        deserializerMap.put("isOutOfDate", n -> this.setIsOutOfDate(n.getBooleanValue()));
        deserializerMap.put("location", n -> this.setLocation(n.getObjectValue(Location::createFromDiscriminatorValue)));
        deserializerMap.put("meetingMessageType", n -> this.setMeetingMessageType(n.getEnumValue(MeetingMessageType::forValue)));
        deserializerMap.put("recurrence", n -> this.setRecurrence(n.getObjectValue(PatternedRecurrence::createFromDiscriminatorValue)));
        deserializerMap.put("startDateTime", n -> this.setStartDateTime(n.getObjectValue(DateTimeTimeZone::createFromDiscriminatorValue)));
        deserializerMap.put("type", n -> this.setType(n.getEnumValue(EventType::forValue)));
        return deserializerMap;
    }

    public Boolean getIsAllDay() {
        return this.backingStore.get("isAllDay");
    }

    public Boolean getIsDelegated() {
        return this.backingStore.get("isDelegated");
    }

    public Boolean getIsOutOfDate() {
        return this.backingStore.get("isOutOfDate");
    }

    public Location getLocation() {
        return this.backingStore.get("location");
    }

    public MeetingMessageType getMeetingMessageType() {
        return this.backingStore.get("meetingMessageType");
    }

    public PatternedRecurrence getRecurrence() {
        return this.backingStore.get("recurrence");
    }

    public DateTimeTimeZone getStartDateTime() {
        return this.backingStore.get("startDateTime");
    }

    public EventType getType() {
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
        writer.writeObjectValue("endDateTime", this.getEndDateTime());
        writer.writeObjectValue("event", this.getEvent());
        writer.writeBooleanValue("isAllDay", this.getIsAllDay());
        writer.writeBooleanValue("isDelegated", this.getIsDelegated());
        writer.writeBooleanValue("isOutOfDate", this.getIsOutOfDate());
        writer.writeObjectValue("location", this.getLocation());
        writer.writeEnumValue("meetingMessageType", this.getMeetingMessageType());
        writer.writeObjectValue("recurrence", this.getRecurrence());
        writer.writeObjectValue("startDateTime", this.getStartDateTime());
        writer.writeEnumValue("type", this.getType());
    }

    public void setEndDateTime(DateTimeTimeZone value) {
        this.backingStore.set("endDateTime", value);
    }

    public void setEvent(Event value) {
        this.backingStore.set("event", value);
    }

    public void setIsAllDay(Boolean value) {
        this.backingStore.set("isAllDay", value);
    }

    public void setIsDelegated(Boolean value) {
        this.backingStore.set("isDelegated", value);
    }

    public void setIsOutOfDate(Boolean value) {
        this.backingStore.set("isOutOfDate", value);
    }

    public void setLocation(Location value) {
        this.backingStore.set("location", value);
    }

    public void setMeetingMessageType(MeetingMessageType value) {
        this.backingStore.set("meetingMessageType", value);
    }

    public void setRecurrence(PatternedRecurrence value) {
        this.backingStore.set("recurrence", value);
    }

    public void setStartDateTime(DateTimeTimeZone value) {
        this.backingStore.set("startDateTime", value);
    }

    public void setType(EventType value) {
        this.backingStore.set("type", value);
    }
}
