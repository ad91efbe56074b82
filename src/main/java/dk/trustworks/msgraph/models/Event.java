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
 * An event in a user or group calendar.
 */
public class Event extends OutlookItem {

    public Event() {
        super();
        this.setOdataType("#microsoft.graph.event");
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link Event}
     */
    public static Event createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new Event();
    }

    public Boolean getAllowNewTimeProposals() {
        return this.backingStore.get("allowNewTimeProposals");
    }

    public List<Attachment> getAttachments() {
        return this.backingStore.get("attachments");
    }

    /**
     * Gets the attendees property value. The collection of attendees for the event.
     *
     * @return the attendees value
     */
    public List<Attendee> getAttendees() {
        return this.backingStore.get("attendees");
    }

    public ItemBody getBody() {
        return this.backingStore.get("body");
    }

    public String getBodyPreview() {
        return this.backingStore.get("bodyPreview");
    }

    /**
     * Gets the calendar property value. The calendar that contains the event. Navigation property.
     * Read-only.
     *
     * @return the calendar value
     */
    public Calendar getCalendar() {
        return this.backingStore.get("calendar");
    }

    /**
     * Gets the end property value. The date, time, and time zone that the event ends. By default, the end
     * time is in UTC.
     *
     * @return the end value
     */
    public DateTimeTimeZone getEnd() {
        return this.backingStore.get("end");
    }

    public List<Extension> getExtensions() {
        return this.backingStore.get("extensions");
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
        deserializerMap.put("attachments", n -> this.setAttachments(n.getCollectionOfObjectValues(Attachment::createFromDiscriminatorValue)));
        deserializerMap.put("attendees", n -> this.setAttendees(n.getCollectionOfObjectValues(Attendee::createFromDiscriminatorValue)));
        deserializerMap.put("body", n -> this.setBody(n.getObjectValue(ItemBody::createFromDiscriminatorValue)));
        deserializerMap.put("bodyPreview", n -> this.setBodyPreview(n.getStringValue()));
        deserializerMap.put("calendar", n -> this.setCalendar(n.getObjectValue(Calendar::createFromDiscriminatorValue)));
        deserializerMap.put("end", n -> this.setEnd(n.getObjectValue(DateTimeTimeZone::createFromDiscriminatorValue)));
        deserializerMap.put("extensions", n -> this.setExtensions(n.getCollectionOfObjectValues(Extension::createFromDiscriminatorValue)));
        deserializerMap.put("hasAttachments", n -> this.setHasAttachments(n.getBooleanValue()));
        deserializerMap.put("hideAttendees", n -> this.setHideAttendees(n.getBooleanValue()));
        deserializerMap.put("iCalUId", n -> this.setICalUId(n.getStringValue()));
        deserializerMap.put("importance", n -> this.setImportance(n.getEnumValue(Importance::forValue)));
        deserializerMap.put("instances", n -> this.setInstances(n.getCollectionOfObjectValues(Event::createFromDiscriminatorValue)));
        deserializerMap.put("isAllDay", n -> this.setIsAllDay(n.getBooleanValue()));
        deserializerMap.put("isCancelled", n -> this.setIsCancelled(n.getBooleanValue()));
        deserializerMap.put("isDraft", n -> this.setIsDraft(n.getBooleanValue()));
        deserializerMap.put("isOnlineMeeting", n -> this.setIsOnlineMeeting(n.getBooleanValue()));
        deserializerMap.put("isOrganizer", n -> this.setIsOrganizer(n.getBooleanValue()));
        deserializerMap.put("isReminderOn", n -> this.setIsReminderOn(n.getBooleanValue()));
        deserializerMap.put("location", n -> this.setLocation(n.getObjectValue(Location::createFromDiscriminatorValue)));
        deserializerMap.put("locations", n -> this.setLocations(n.getCollectionOfObjectValues(Location::createFromDiscriminatorValue)));
        deserializerMap.put("multiValueExtendedProperties", n -> this.setMultiValueExtendedProperties(n.getCollectionOfObjectValues(MultiValueLegacyExtendedProperty::createFromDiscriminatorValue)));
        deserializerMap.put("onlineMeeting", n -> this.setOnlineMeeting(n.getObjectValue(OnlineMeetingInfo::createFromDiscriminatorValue)));
        deserializerMap.put("onlineMeetingProvider", n -> this.setOnlineMeetingProvider(n.getEnumValue(OnlineMeetingProviderType::forValue)));
        deserializerMap.put("onlineMeetingUrl", n -> this.setOnlineMeetingUrl(n.getStringValue()));
        deserializerMap.put("organizer", n -> this.setOrganizer(n.getObjectValue(Recipient::createFromDiscriminatorValue)));
        deserializerMap.put("originalEndTimeZone", n -> this.setOriginalEndTimeZone(n.getStringValue()));
        deserializerMap.put("originalStart", n -> this.setOriginalStart(n.getOffsetDateTimeValue()));
        deserializerMap.put("originalStartTimeZone", n -> this.setOriginalStartTimeZone(n.getStringValue()));
        deserializerMap.put("recurrence", n -> this.setRecurrence(n.getObjectValue(PatternedRecurrence::createFromDiscriminatorValue)));
        deserializerMap.put("reminderMinutesBeforeStart", n -> this.setReminderMinutesBeforeStart(n.getIntegerValue()));
        deserializerMap.put("responseRequested", n -> this.setResponseRequested(n.getBooleanValue()));
        deserializerMap.put("responseStatus", n -> this.setResponseStatus(n.getObjectValue(ResponseStatus::createFromDiscriminatorValue)));
        deserializerMap.put("sensitivity", n -> this.setSensitivity(n.getEnumValue(Sensitivity::forValue)));
        deserializerMap.put("seriesMasterId", n -> this.setSeriesMasterId(n.getStringValue()));
        deserializerMap.put("showAs", n -> this.setShowAs(n.getEnumValue(FreeBusyStatus::forValue)));
        deserializerMap.put("singleValueExtendedProperties", n -> this.setSingleValueExtendedProperties(n.getCollectionOfObjectValues(SingleValueLegacyExtendedProperty::createFromDiscriminatorValue)));
        deserializerMap.put("start", n -> this.setStart(n.getObjectValue(DateTimeTimeZone::createFromDiscriminatorValue)));
        deserializerMap.put("subject", n -> this.setSubject(n.getStringValue()));
        deserializerMap.put("transactionId", n -> this.setTransactionId(n.getStringValue()));
        deserializerMap.put("type", n -> this.setType(n.getEnumValue(EventType::forValue)));
        deserializerMap.put("webLink", n -> this.setWebLink(n.getStringValue()));
        return deserializerMap;
    }

    public Boolean getHasAttachments() {
        return this.backingStore.get("hasAttachments");
    }

    public Boolean getHideAttendees() {
        return this.backingStore.get("hideAttendees");
    }

    /**
     * Gets the iCalUId property value. A unique identifier for an event across calendars. Differs for each
     * occurrence in a recurring series.
     *
     * @return the iCalUId value
     */
    public String getICalUId() {
        return this.backingStore.get("iCalUId");
    }

    public Importance getImportance() {
        return this.backingStore.get("importance");
    }

    /**
     * Gets the instances property value. The occurrences of a recurring series, if the event is a series
     * master.
     *
     * @return the instances value
     */
    public List<Event> getInstances() {
        return this.backingStore.get("instances");
    }

    public Boolean getIsAllDay() {
        return this.backingStore.get("isAllDay");
    }

    public Boolean getIsCancelled() {
        return this.backingStore.get("isCancelled");
    }

    public Boolean getIsDraft() {
        return this.backingStore.get("isDraft");
    }

    public Boolean getIsOnlineMeeting() {
        return this.backingStore.get("isOnlineMeeting");
    }

    public Boolean getIsOrganizer() {
        return this.backingStore.get("isOrganizer");
    }

    public Boolean getIsReminderOn() {
        return this.backingStore.get("isReminderOn");
    }

    public Location getLocation() {
        return this.backingStore.get("location");
    }

    public List<Location> getLocations() {
        return this.backingStore.get("locations");
    }

    public List<MultiValueLegacyExtendedProperty> getMultiValueExtendedProperties() {
        return this.backingStore.get("multiValueExtendedProperties");
    }

    public OnlineMeetingInfo getOnlineMeeting() {
        return this.backingStore.get("onlineMeeting");
    }

    public OnlineMeetingProviderType getOnlineMeetingProvider() {
        return this.backingStore.get("onlineMeetingProvider");
    }

    public String getOnlineMeetingUrl() {
        return this.backingStore.get("onlineMeetingUrl");
    }

    public Recipient getOrganizer() {
        return this.backingStore.get("organizer");
    }

    public String getOriginalEndTimeZone() {
        return this.backingStore.get("originalEndTimeZone");
    }

    /**
     * Gets the originalStart property value. The start time that was set when the event was created, as a
     * UTC timestamp.
     *
     * @return the originalStart value
     */
    public OffsetDateTime getOriginalStart() {
        return this.backingStore.get("originalStart");
    }

    public String getOriginalStartTimeZone() {
        return this.backingStore.get("originalStartTimeZone");
    }

    public PatternedRecurrence getRecurrence() {
        return this.backingStore.get("recurrence");
    }

    public Integer getReminderMinutesBeforeStart() {
        return this.backingStore.get("reminderMinutesBeforeStart");
    }

    public Boolean getResponseRequested() {
        return this.backingStore.get("responseRequested");
    }

    public ResponseStatus getResponseStatus() {
        return this.backingStore.get("responseStatus");
    }

    public Sensitivity getSensitivity() {
        return this.backingStore.get("sensitivity");
    }

    public String getSeriesMasterId() {
        return this.backingStore.get("seriesMasterId");
    }

    public FreeBusyStatus getShowAs() {
        return this.backingStore.get("showAs");
    }

    public List<SingleValueLegacyExtendedProperty> getSingleValueExtendedProperties() {
        return this.backingStore.get("singleValueExtendedProperties");
    }

    public DateTimeTimeZone getStart() {
        return this.backingStore.get("start");
    }

    public String getSubject() {
        return this.backingStore.get("subject");
    }

    /**
     * Gets the transactionId property value. A custom identifier specified by a client app for the server
     * to avoid redundant POST operations.
     *
     * @return the transactionId value
     */
    public String getTransactionId() {
        return this.backingStore.get("transactionId");
    }

    public EventType getType() {
        return this.backingStore.get("type");
    }

    public String getWebLink() {
        return this.backingStore.get("webLink");
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
        writer.writeCollectionOfObjectValues("attachments", this.getAttachments());
        writer.writeCollectionOfObjectValues("attendees", this.getAttendees());
        writer.writeObjectValue("body", this.getBody());
        writer.writeStringValue("bodyPreview", this.getBodyPreview());
        writer.writeObjectValue("calendar", this.getCalendar());
        writer.writeObjectValue("end", this.getEnd());
        writer.writeCollectionOfObjectValues("extensions", this.getExtensions());
        writer.writeBooleanValue("hasAttachments", this.getHasAttachments());
        writer.writeBooleanValue("hideAttendees", this.getHideAttendees());
        writer.writeStringValue("iCalUId", this.getICalUId());
        writer.writeEnumValue("importance", this.getImportance());
        writer.writeCollectionOfObjectValues("instances", this.getInstances());
        writer.writeBooleanValue("isAllDay", this.getIsAllDay());
        writer.writeBooleanValue("isCancelled", this.getIsCancelled());
        writer.writeBooleanValue("isDraft", this.getIsDraft());
        writer.writeBooleanValue("isOnlineMeeting", this.getIsOnlineMeeting());
        writer.writeBooleanValue("isOrganizer", this.getIsOrganizer());
        writer.writeBooleanValue("isReminderOn", this.getIsReminderOn());
        writer.writeObjectValue("location", this.getLocation());
        writer.writeCollectionOfObjectValues("locations", this.getLocations());
        writer.writeCollectionOfObjectValues("multiValueExtendedProperties", this.getMultiValueExtendedProperties());
        writer.writeObjectValue("onlineMeeting", this.getOnlineMeeting());
        writer.writeEnumValue("onlineMeetingProvider", this.getOnlineMeetingProvider());
        writer.writeStringValue("onlineMeetingUrl", this.getOnlineMeetingUrl());
        writer.writeObjectValue("organizer", this.getOrganizer());
        writer.writeStringValue("originalEndTimeZone", this.getOriginalEndTimeZone());
        writer.writeOffsetDateTimeValue("originalStart", this.getOriginalStart());
        writer.writeStringValue("originalStartTimeZone", this.getOriginalStartTimeZone());
        writer.writeObjectValue("recurrence", this.getRecurrence());
        writer.writeIntegerValue("reminderMinutesBeforeStart", this.getReminderMinutesBeforeStart());
        writer.writeBooleanValue("responseRequested", this.getResponseRequested());
        writer.writeObjectValue("responseStatus", this.getResponseStatus());
        writer.writeEnumValue("sensitivity", this.getSensitivity());
        writer.writeStringValue("seriesMasterId", this.getSeriesMasterId());
        writer.writeEnumValue("showAs", this.getShowAs());
        writer.writeCollectionOfObjectValues("singleValueExtendedProperties", this.getSingleValueExtendedProperties());
        writer.writeObjectValue("start", this.getStart());
        writer.writeStringValue("subject", this.getSubject());
        writer.writeStringValue("transactionId", this.getTransactionId());
        writer.writeEnumValue("type", this.getType());
        writer.writeStringValue("webLink", this.getWebLink());
    }

    public void setAllowNewTimeProposals(Boolean value) {
        this.backingStore.set("allowNewTimeProposals", value);
    }

    public void setAttachments(List<Attachment> value) {
        this.backingStore.set("attachments", value);
    }

    public void setAttendees(List<Attendee> value) {
        this.backingStore.set("attendees", value);
    }

    public void setBody(ItemBody value) {
        this.backingStore.set("body", value);
    }

    public void setBodyPreview(String value) {
        this.backingStore.set("bodyPreview", value);
    }

    public void setCalendar(Calendar value) {
        this.backingStore.set("calendar", value);
    }

    public void setEnd(DateTimeTimeZone value) {
        this.backingStore.set("end", value);
    }

    public void setExtensions(List<Extension> value) {
        this.backingStore.set("extensions", value);
    }

    public void setHasAttachments(Boolean value) {
        this.backingStore.set("hasAttachments", value);
    }

    public void setHideAttendees(Boolean value) {
        this.backingStore.set("hideAttendees", value);
    }

    public void setICalUId(String value) {
        this.backingStore.set("iCalUId", value);
    }

    public void setImportance(Importance value) {
        this.backingStore.set("importance", value);
    }

    public void setInstances(List<Event> value) {
        this.backingStore.set("instances", value);
    }

    public void setIsAllDay(Boolean value) {
        this.backingStore.set("isAllDay", value);
    }

    public void setIsCancelled(Boolean value) {
        this.backingStore.set("isCancelled", value);
    }

    public void setIsDraft(Boolean value) {
        this.backingStore.set("isDraft", value);
    }

    public void setIsOnlineMeeting(Boolean value) {
        this.backingStore.set("isOnlineMeeting", value);
    }

    public void setIsOrganizer(Boolean value) {
        this.backingStore.set("isOrganizer", value);
    }

    public void setIsReminderOn(Boolean value) {
        this.backingStore.set("isReminderOn", value);
    }

    public void setLocation(Location value) {
        this.backingStore.set("location", value);
    }

    public void setLocations(List<Location> value) {
        this.backingStore.set("locations", value);
    }

    public void setMultiValueExtendedProperties(List<MultiValueLegacyExtendedProperty> value) {
        this.backingStore.set("multiValueExtendedProperties", value);
    }

    public void setOnlineMeeting(OnlineMeetingInfo value) {
        this.backingStore.set("onlineMeeting", value);
    }

    public void setOnlineMeetingProvider(OnlineMeetingProviderType value) {
        this.backingStore.set("onlineMeetingProvider", value);
    }

    public void setOnlineMeetingUrl(String value) {
        this.backingStore.set("onlineMeetingUrl", value);
    }

    public void setOrganizer(Recipient value) {
        this.backingStore.set("organizer", value);
    }

    public void setOriginalEndTimeZone(String value) {
        this.backingStore.set("originalEndTimeZone", value);
    }

    public void setOriginalStart(OffsetDateTime value) {
        this.backingStore.set("originalStart", value);
    }

    public void setOriginalStartTimeZone(String value) {
        this.backingStore.set("originalStartTimeZone", value);
    }

    public void setRecurrence(PatternedRecurrence value) {
        this.backingStore.set("recurrence", value);
    }

    public void setReminderMinutesBeforeStart(Integer value) {
        this.backingStore.set("reminderMinutesBeforeStart", value);
    }

    public void setResponseRequested(Boolean value) {
        this.backingStore.set("responseRequested", value);
    }

    public void setResponseStatus(ResponseStatus value) {
        this.backingStore.set("responseStatus", value);
    }

    public void setSensitivity(Sensitivity value) {
        this.backingStore.set("sensitivity", value);
    }

    public void setSeriesMasterId(String value) {
        this.backingStore.set("seriesMasterId", value);
    }

    public void setShowAs(FreeBusyStatus value) {
        this.backingStore.set("showAs", value);
    }

    public void setSingleValueExtendedProperties(List<SingleValueLegacyExtendedProperty> value) {
        this.backingStore.set("singleValueExtendedProperties", value);
    }

    public void setStart(DateTimeTimeZone value) {
        this.backingStore.set("start", value);
    }

    public void setSubject(String value) {
        this.backingStore.set("subject", value);
    }

    public void setTransactionId(String value) {
        this.backingStore.set("transactionId", value);
    }

    public void setType(EventType value) {
        this.backingStore.set("type", value);
    }

    public void setWebLink(String value) {
        this.backingStore.set("webLink", value);
    }
}
