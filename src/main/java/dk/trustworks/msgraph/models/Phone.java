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
 * A phone number.
 */
public class Phone implements AdditionalDataHolder, BackedModel, Parsable {

    /**
     * Holds the property values of this model.
     */
    protected BackingStore backingStore;

    public Phone() {
        this.backingStore = BackingStoreFactorySingleton.instance.createBackingStore();
        this.setAdditionalData(new HashMap<>());
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link Phone}
     */
    public static Phone createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new Phone();
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
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(5);
        deserializerMap.put("@odata.type", n -> this.setOdataType(n.getStringValue()));
        deserializerMap.put("language", n -> this.setLanguage(n.getStringValue()));
        deserializerMap.put("number", n -> this.setNumber(n.getStringValue()));
        deserializerMap.put("region", n -> this.setRegion(n.getStringValue()));
        deserializerMap.put("type", n -> this.setType(n.getEnumValue(PhoneType::forValue)));
        return deserializerMap;
    }

    public String getLanguage() {
        return this.backingStore.get("language");
    }

    public String getNumber() {
        return this.backingStore.get("number");
    }

    public String getOdataType() {
        return this.backingStore.get("@odata.type");
    }

    public String getRegion() {
        return this.backingStore.get("region");
    }

    public PhoneType getType() {
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
        writer.writeStringValue("language", this.getLanguage());
        writer.writeStringValue("number", this.getNumber());
        writer.writeStringValue("region", this.getRegion());
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

    public void setLanguage(String value) {
        this.backingStore.set("language", value);
    }

    public void setNumber(String value) {
        this.backingStore.set("number", value);
    }

    public void setOdataType(String value) {
        this.backingStore.set("@odata.type", value);
    }

    public void setRegion(String value) {
        this.backingStore.set("region", value);
    }

    public void setType(PhoneType value) {
        this.backingStore.set("type", value);
    }
}
