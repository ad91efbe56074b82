package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A container for events: a user calendar or the default calendar of a Microsoft 365 group.
 */
public class Calendar extends Entity {

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link Calendar}
     */
    public static Calendar createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new Calendar();
    }

    /**
     * Gets the allowedOnlineMeetingProviders property value. Represent the online meeting service
     * providers that can be used to create online meetings in this calendar.
     *
     * @return the allowedOnlineMeetingProviders value
     */
    public List<OnlineMeetingProviderType> getAllowedOnlineMeetingProviders() {
        return this.backingStore.get("allowedOnlineMeetingProviders");
    }

    public List<CalendarPermission> getCalendarPermissions() {
        return this.backingStore.get("calendarPermissions");
    }

    /**
     * Gets the calendarView property value. The calendar view for the calendar. Navigation property.
     * Read-only.
     *
     * @return the calendarView value
     */
    public List<Event> getCalendarView() {
        return this.backingStore.get("calendarView");
    }

    public Boolean getCanEdit() {
        return this.backingStore.get("canEdit");
    }

    public Boolean getCanShare() {
        return this.backingStore.get("canShare");
    }

    public Boolean getCanViewPrivateItems() {
        return this.backingStore.get("canViewPrivateItems");
    }

    public String getChangeKey() {
        return this.backingStore.get("changeKey");
    }

    public CalendarColor getColor() {
        return this.backingStore.get("color");
    }

    public OnlineMeetingProviderType getDefaultOnlineMeetingProvider() {
        return this.backingStore.get("defaultOnlineMeetingProvider");
    }

    public List<Event> getEvents() {
        return this.backingStore.get("events");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("allowedOnlineMeetingProviders", n -> this.setAllowedOnlineMeetingProviders(n.getCollectionOfEnumValues(OnlineMeetingProviderType::forValue)));
        deserializerMap.put("calendarPermissions", n -> this.setCalendarPermissions(n.getCollectionOfObjectValues(CalendarPermission::createFromDiscriminatorValue)));
        deserializerMap.put("calendarView", n -> this.setCalendarView(n.getCollectionOfObjectValues(Event::createFromDiscriminatorValue)));
        deserializerMap.put("canEdit", n -> this.setCanEdit(n.getBooleanValue()));
        deserializerMap.put("canShare", n -> this.setCanShare(n.getBooleanValue()));
        deserializerMap.put("canViewPrivateItems", n -> this.setCanViewPrivateItems(n.getBooleanValue()));
        deserializerMap.put("changeKey", n -> this.setChangeKey(n.getStringValue()));
        deserializerMap.put("color", n -> this.setColor(n.getEnumValue(CalendarColor::forValue)));
        deserializerMap.put("defaultOnlineMeetingProvider", n -> this.setDefaultOnlineMeetingProvider(n.getEnumValue(OnlineMeetingProviderType::forValue)));
        deserializerMap.put("events", n -> this.setEvents(n.getCollectionOfObjectValues(Event::createFromDiscriminatorValue)));
        deserializerMap.put("hexColor", n -> this.setHexColor(n.getStringValue()));
        deserializerMap.put("isDefaultCalendar", n -> this.setIsDefaultCalendar(n.getBooleanValue()));
        deserializerMap.put("isRemovable", n -> this.setIsRemovable(n.getBooleanValue()));
        deserializerMap.put("isTallyingResponses", n -> this.setIsTallyingResponses(n.getBooleanValue()));
        deserializerMap.put("multiValueExtendedProperties", n -> this.setMultiValueExtendedProperties(n.getCollectionOfObjectValues(MultiValueLegacyExtendedProperty::createFromDiscriminatorValue)));
        deserializerMap.put("name", n -> this.setName(n.getStringValue()));
        deserializerMap.put("owner", n -> this.setOwner(n.getObjectValue(EmailAddress::createFromDiscriminatorValue)));
        deserializerMap.put("singleValueExtendedProperties", n -> this.setSingleValueExtendedProperties(n.getCollectionOfObjectValues(SingleValueLegacyExtendedProperty::createFromDiscriminatorValue)));
        return deserializerMap;
    }

    /**
     * Gets the hexColor property value. The calendar color, expressed in a hex color code of three
     * hexadecimal values, each ranging from 00 to FF.
     *
     * @return the hexColor value
     */
    public String getHexColor() {
        return this.backingStore.get("hexColor");
    }

    public Boolean getIsDefaultCalendar() {
        return this.backingStore.get("isDefaultCalendar");
    }

    public Boolean getIsRemovable() {
        return this.backingStore.get("isRemovable");
    }

    public Boolean getIsTallyingResponses() {
        return this.backingStore.get("isTallyingResponses");
    }

    public List<MultiValueLegacyExtendedProperty> getMultiValueExtendedProperties() {
        return this.backingStore.get("multiValueExtendedProperties");
    }

    public String getName() {
        return this.backingStore.get("name");
    }

    /**
     * Gets the owner property value. If set, this represents the user who created or added the calendar.
     *
     * @return the owner value
     */
    public EmailAddress getOwner() {
        return this.backingStore.get("owner");
    }

    public List<SingleValueLegacyExtendedProperty> getSingleValueExtendedProperties() {
        return this.backingStore.get("singleValueExtendedProperties");
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
        writer.writeCollectionOfEnumValues("allowedOnlineMeetingProviders", this.getAllowedOnlineMeetingProviders());
        writer.writeCollectionOfObjectValues("calendarPermissions", this.getCalendarPermissions());
        writer.writeCollectionOfObjectValues("calendarView", this.getCalendarView());
        writer.writeBooleanValue("canEdit", this.getCanEdit());
        writer.writeBooleanValue("canShare", this.getCanShare());
        writer.writeBooleanValue("canViewPrivateItems", this.getCanViewPrivateItems());
        writer.writeStringValue("changeKey", this.getChangeKey());
        writer.writeEnumValue("color", this.getColor());
        writer.writeEnumValue("defaultOnlineMeetingProvider", this.getDefaultOnlineMeetingProvider());
        writer.writeCollectionOfObjectValues("events", this.getEvents());
        writer.writeStringValue("hexColor", this.getHexColor());
        writer.writeBooleanValue("isDefaultCalendar", this.getIsDefaultCalendar());
        writer.writeBooleanValue("isRemovable", this.getIsRemovable());
        writer.writeBooleanValue("isTallyingResponses", this.getIsTallyingResponses());
        writer.writeCollectionOfObjectValues("multiValueExtendedProperties", this.getMultiValueExtendedProperties());
        writer.writeStringValue("name", this.getName());
        writer.writeObjectValue("owner", this.getOwner());
        writer.writeCollectionOfObjectValues("singleValueExtendedProperties", this.getSingleValueExtendedProperties());
    }

    public void setAllowedOnlineMeetingProviders(List<OnlineMeetingProviderType> value) {
        this.backingStore.set("allowedOnlineMeetingProviders", value);
    }

    public void setCalendarPermissions(List<CalendarPermission> value) {
        this.backingStore.set("calendarPermissions", value);
    }

    public void setCalendarView(List<Event> value) {
        this.backingStore.set("calendarView", value);
    }

    public void setCanEdit(Boolean value) {
        this.backingStore.set("canEdit", value);
    }

    public void setCanShare(Boolean value) {
        this.backingStore.set("canShare", value);
    }

    public void setCanViewPrivateItems(Boolean value) {
        this.backingStore.set("canViewPrivateItems", value);
    }

    public void setChangeKey(String value) {
        this.backingStore.set("changeKey", value);
    }

    public void setColor(CalendarColor value) {
        this.backingStore.set("color", value);
    }

    public void setDefaultOnlineMeetingProvider(OnlineMeetingProviderType value) {
        this.backingStore.set("defaultOnlineMeetingProvider", value);
    }

    public void setEvents(List<Event> value) {
        this.backingStore.set("events", value);
    }

    public void setHexColor(String value) {
        this.backingStore.set("hexColor", value);
    }

    public void setIsDefaultCalendar(Boolean value) {
        this.backingStore.set("isDefaultCalendar", value);
    }

    public void setIsRemovable(Boolean value) {
        this.backingStore.set("isRemovable", value);
    }

    public void setIsTallyingResponses(Boolean value) {
        this.backingStore.set("isTallyingResponses", value);
    }

    public void setMultiValueExtendedProperties(List<MultiValueLegacyExtendedProperty> value) {
        this.backingStore.set("multiValueExtendedProperties", value);
    }

    public void setName(String value) {
        this.backingStore.set("name", value);
    }

    public void setOwner(EmailAddress value) {
        this.backingStore.set("owner", value);
    }

    public void setSingleValueExtendedProperties(List<SingleValueLegacyExtendedProperty> value) {
        this.backingStore.set("singleValueExtendedProperties", value);
    }
}
