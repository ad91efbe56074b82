package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A message inviting the recipient to open or add a shared calendar.
 */
public class CalendarSharingMessage extends Message {

    public CalendarSharingMessage() {
        super();
        this.setOdataType("#microsoft.graph.calendarSharingMessage");
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link CalendarSharingMessage}
     */
    public static CalendarSharingMessage createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new CalendarSharingMessage();
    }

    public Boolean getCanAccept() {
        return this.backingStore.get("canAccept");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("canAccept", n -> this.setCanAccept(n.getBooleanValue()));
        deserializerMap.put("sharingMessageAction", n -> this.setSharingMessageAction(n.getObjectValue(CalendarSharingMessageAction::createFromDiscriminatorValue)));
        deserializerMap.put("sharingMessageActions", n -> this.setSharingMessageActions(n.getCollectionOfObjectValues(CalendarSharingMessageAction::createFromDiscriminatorValue)));
        deserializerMap.put("suggestedCalendarName", n -> this.setSuggestedCalendarName(n.getStringValue()));
        return deserializerMap;
    }

    public CalendarSharingMessageAction getSharingMessageAction() {
        return this.backingStore.get("sharingMessageAction");
    }

    public List<CalendarSharingMessageAction> getSharingMessageActions() {
        return this.backingStore.get("sharingMessageActions");
    }

    public String getSuggestedCalendarName() {
        return this.backingStore.get("suggestedCalendarName");
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
        writer.writeBooleanValue("canAccept", this.getCanAccept());
        writer.writeObjectValue("sharingMessageAction", this.getSharingMessageAction());
        writer.writeCollectionOfObjectValues("sharingMessageActions", this.getSharingMessageActions());
        writer.writeStringValue("suggestedCalendarName", this.getSuggestedCalendarName());
    }

    public void setCanAccept(Boolean value) {
        this.backingStore.set("canAccept", value);
    }

    public void setSharingMessageAction(CalendarSharingMessageAction value) {
        this.backingStore.set("sharingMessageAction", value);
    }

    public void setSharingMessageActions(List<CalendarSharingMessageAction> value) {
        this.backingStore.set("sharingMessageActions", value);
    }

    public void setSuggestedCalendarName(String value) {
        this.backingStore.set("suggestedCalendarName", value);
    }
}
