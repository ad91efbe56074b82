package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.AdditionalDataHolder;
import com.microsoft.kiota.serialization.Parsable;
import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;
import com.microsoft.kiota.store.BackedModel;
import com.microsoft.kiota.store.BackingStore;
import com.microsoft.kiota.store.BackingStoreFactorySingleton;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * The date range over which a recurring event repeats.
 */
public class RecurrenceRange implements AdditionalDataHolder, BackedModel, Parsable {

    /**
     * Holds the property values of this model.
     */
    protected BackingStore backingStore;

    public RecurrenceRange() {
        this.backingStore = BackingStoreFactorySingleton.instance.createBackingStore();
        this.setAdditionalData(new HashMap<>());
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link RecurrenceRange}
     */
    public static RecurrenceRange createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new RecurrenceRange();
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

    public LocalDate getEndDate() {
        return this.backingStore.get("endDate");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(6);
        deserializerMap.put("@odata.type", n -> this.setOdataType(n.getStringValue()));
        deserializerMap.put("endDate", n -> this.setEndDate(n.getLocalDateValue()));
        deserializerMap.put("numberOfOccurrences", n -> this.setNumberOfOccurrences(n.getIntegerValue()));
        deserializerMap.put("recurrenceTimeZone", n -> this.setRecurrenceTimeZone(n.getStringValue()));
        deserializerMap.put("startDate", n -> this.setStartDate(n.getLocalDateValue()));
        deserializerMap.put("type", n -> this.setType(n.getEnumValue(RecurrenceRangeType::forValue)));
        return deserializerMap;
    }

    public Integer getNumberOfOccurrences() {
        return this.backingStore.get("numberOfOccurrences");
    }

    public String getOdataType() {
        return this.backingStore.get("@odata.type");
    }

    public String getRecurrenceTimeZone() {
        return this.backingStore.get("recurrenceTimeZone");
    }

    /**
     * Gets the startDate property value. The date to start applying the recurrence pattern.
     *
     * @return the startDate value
     */
    public LocalDate getStartDate() {
        return this.backingStore.get("startDate");
    }

    public RecurrenceRangeType getType() {
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
        writer.writeLocalDateValue("endDate", this.getEndDate());
        writer.writeIntegerValue("numberOfOccurrences", this.getNumberOfOccurrences());
        writer.writeStringValue("recurrenceTimeZone", this.getRecurrenceTimeZone());
        writer.writeLocalDateValue("startDate", this.getStartDate());
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

    public void setEndDate(LocalDate value) {
        this.backingStore.set("endDate", value);
    }

    public void setNumberOfOccurrences(Integer value) {
        this.backingStore.set("numberOfOccurrences", value);
    }

    public void setOdataType(String value) {
        this.backingStore.set("@odata.type", value);
    }

    public void setRecurrenceTimeZone(String value) {
        this.backingStore.set("recurrenceTimeZone", value);
    }

    public void setStartDate(LocalDate value) {
        this.backingStore.set("startDate", value);
    }

    public void setType(RecurrenceRangeType value) {
        this.backingStore.set("type", value);
    }
}
