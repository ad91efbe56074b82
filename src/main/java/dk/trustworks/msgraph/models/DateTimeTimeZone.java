package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.AdditionalDataHolder;
import com.microsoft.kiota.serialization.Parsable;
import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;
import com.microsoft.kiota.store.BackedModel;
import com.microsoft.kiota.store.BackingStore;
import com.microsoft.kiota.store.BackingStoreFactorySingleton;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A local date and time paired with the time zone it is expressed in.
 */
public class DateTimeTimeZone implements AdditionalDataHolder, BackedModel, Parsable {

    /**
     * Holds the property values of this model.
     */
    protected BackingStore backingStore;

    public DateTimeTimeZone() {
        this.backingStore = BackingStoreFactorySingleton.instance.createBackingStore();
        this.setAdditionalData(new HashMap<>());
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link DateTimeTimeZone}
     */
    public static DateTimeTimeZone createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new DateTimeTimeZone();
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

    /**
     * Gets the dateTime property value. A single point of time in a combined date and time representation
     * ({date}T{time}; for example, 2017-08-29T04:00:00.0000000).
     *
     * @return the dateTime value
     */
    public String getDateTime() {
        return this.backingStore.get("dateTime");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(3);
        deserializerMap.put("@odata.type", n -> this.setOdataType(n.getStringValue()));
        deserializerMap.put("dateTime", n -> this.setDateTime(n.getStringValue()));
        deserializerMap.put("timeZone", n -> this.setTimeZone(n.getStringValue()));
        return deserializerMap;
    }

    public String getOdataType() {
        return this.backingStore.get("@odata.type");
    }

    public String getTimeZone() {
        return this.backingStore.get("timeZone");
    }

    /**
     * Serializes information the current object.
     *
     * @param writer the writer to serialize into
     */
    @Override
    public void serialize(SerializationWriter writer) {
        Objects.requireNonNull(writer, "writer");
        writer.writeStringValue("dateTime", this.getDateTime());
        writer.writeStringValue("timeZone", this.getTimeZone());
        writer.writeStringValue("@odata.type", this.getOdataType());
        writer.writeAdditionalData(this.getAdditionalData());
    }

    public void setAdditionalData(Map<String, Object> value) {
        this.backingStore.set("additionalData", value);
    }

    public void setBackingStore(BackingStore value) {
        this.backingStore = Objects.requireNonNull(value, "value");
    }

    public void setDateTime(String value) {
        this.backingStore.set("dateTime", value);
    }

    public void setOdataType(String value) {
        this.backingStore.set("@odata.type", value);
    }

    public void setTimeZone(String value) {
        this.backingStore.set("timeZone", value);
    }
}
