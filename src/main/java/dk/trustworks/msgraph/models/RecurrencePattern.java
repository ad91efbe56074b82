package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.AdditionalDataHolder;
import com.microsoft.kiota.serialization.Parsable;
import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;
import com.microsoft.kiota.store.BackedModel;
import com.microsoft.kiota.store.BackingStore;
import com.microsoft.kiota.store.BackingStoreFactorySingleton;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * How often a recurring event repeats.
 */
public class RecurrencePattern implements AdditionalDataHolder, BackedModel, Parsable {

    /**
     * Holds the property values of this model.
     */
    protected BackingStore backingStore;

    public RecurrencePattern() {
        this.backingStore = BackingStoreFactorySingleton.instance.createBackingStore();
        this.setAdditionalData(new HashMap<>());
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link RecurrencePattern}
     */
    public static RecurrencePattern createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new RecurrencePattern();
    }

    /**
     * Gets the payload members that have no property of their own.
     *
     * @return the additional data, created empty on first access
     */
    @Override
    public Map<String, Object> getAdditionalData() {
        Map<String, Object> value = this.backingStore.get("additionalData");
        if (value == null) {
            value = new HashMap<>();
            this.setAdditionalData(value);
        }
        return value;
    }

    @Override
    public BackingStore getBackingStore() {
        return this.backingStore;
    }

    public Integer getDayOfMonth() {
        return this.backingStore.get("dayOfMonth");
    }

    public List<DayOfWeek> getDaysOfWeek() {
        return this.backingStore.get("daysOfWeek");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(8);
        deserializerMap.put("@odata.type", n -> this.setOdataType(n.getStringValue()));
        deserializerMap.put("dayOfMonth", n -> this.setDayOfMonth(n.getIntegerValue()));
        deserializerMap.put("daysOfWeek", n -> this.setDaysOfWeek(n.getCollectionOfEnumValues(DayOfWeek::forValue)));
        deserializerMap.put("firstDayOfWeek", n -> this.setFirstDayOfWeek(n.getEnumValue(DayOfWeek::forValue)));
        deserializerMap.put("index", n -> this.setIndex(n.getEnumValue(WeekIndex::forValue)));
        deserializerMap.put("interval", n -> this.setInterval(n.getIntegerValue()));
        deserializerMap.put("month", n -> this.setMonth(n.getIntegerValue()));
        deserializerMap.put("type", n -> this.setType(n.getEnumValue(RecurrencePatternType::forValue)));
        return deserializerMap;
    }

    public DayOfWeek getFirstDayOfWeek() {
        return this.backingStore.get("firstDayOfWeek");
    }

    public WeekIndex getIndex() {
        return this.backingStore.get("index");
    }

    /**
     * Gets the interval property value. The number of units between occurrences, where units can be in
     * days, weeks, months, or years.
     *
     * @return the interval value
     */
    public Integer getInterval() {
        return this.backingStore.get("interval");
    }

    public Integer getMonth() {
        return this.backingStore.get("month");
    }

    public String getOdataType() {
        return this.backingStore.get("@odata.type");
    }

    public RecurrencePatternType getType() {
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
        writer.writeIntegerValue("dayOfMonth", this.getDayOfMonth());
        writer.writeCollectionOfEnumValues("daysOfWeek", this.getDaysOfWeek());
        writer.writeEnumValue("firstDayOfWeek", this.getFirstDayOfWeek());
        writer.writeEnumValue("index", this.getIndex());
        writer.writeIntegerValue("interval", this.getInterval());
        writer.writeIntegerValue("month", this.getMonth());
        writer.writeEnumValue("type", this.getType());
        writer.writeStringValue("@odata.type", this.getOdataType());
        writer.writeAdditionalData(this.getAdditionalData());
    }

    public void setAdditionalData(Map<String, Object> value) {
        this.backingStore.set("additionalData", value);
    }

    public void setBackingStore(BackingStore value) {
        this.backingStore = Objects.requireNonNull(value, "value");
    }

    public void setDayOfMonth(Integer value) {
        this.backingStore.set("dayOfMonth", value);
    }

    public void setDaysOfWeek(List<DayOfWeek> value) {
        this.backingStore.set("daysOfWeek", value);
    }

    public void setFirstDayOfWeek(DayOfWeek value) {
        this.backingStore.set("firstDayOfWeek", value);
    }

    public void setIndex(WeekIndex value) {
        this.backingStore.set("index", value);
    }

    public void setInterval(Integer value) {
        this.backingStore.set("interval", value);
    }

    public void setMonth(Integer value) {
        this.backingStore.set("month", value);
    }

    public void setOdataType(String value) {
        this.backingStore.set("@odata.type", value);
    }

    public void setType(RecurrencePatternType value) {
        this.backingStore.set("type", value);
    }
}
