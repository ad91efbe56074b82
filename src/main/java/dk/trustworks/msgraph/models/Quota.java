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
 * Storage quota of a drive.
 */
public class Quota implements AdditionalDataHolder, BackedModel, Parsable {

    /**
     * Holds the property values of this model.
     */
    protected BackingStore backingStore;

    public Quota() {
        this.backingStore = BackingStoreFactorySingleton.instance.createBackingStore();
        this.setAdditionalData(new HashMap<>());
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link Quota}
     */
    public static Quota createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new Quota();
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
     * Gets the deleted property value. Total space consumed by files in the recycle bin, in bytes.
     *
     * @return the deleted value
     */
    public Long getDeleted() {
        return this.backingStore.get("deleted");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(7);
        deserializerMap.put("@odata.type", n -> this.setOdataType(n.getStringValue()));
        deserializerMap.put("deleted", n -> this.setDeleted(n.getLongValue()));
        deserializerMap.put("remaining", n -> this.setRemaining(n.getLongValue()));
        deserializerMap.put("state", n -> this.setState(n.getStringValue()));
        deserializerMap.put("storagePlanInformation", n -> this.setStoragePlanInformation(n.getObjectValue(StoragePlanInformation::createFromDiscriminatorValue)));
        deserializerMap.put("total", n -> this.setTotal(n.getLongValue()));
        deserializerMap.put("used", n -> this.setUsed(n.getLongValue()));
        return deserializerMap;
    }

    public String getOdataType() {
        return this.backingStore.get("@odata.type");
    }

    public Long getRemaining() {
        return this.backingStore.get("remaining");
    }

    /**
     * Gets the state property value. Enumeration value that indicates the state of the storage space:
     * normal, nearing, critical or exceeded.
     *
     * @return the state value
     */
    public String getState() {
        return this.backingStore.get("state");
    }

    public StoragePlanInformation getStoragePlanInformation() {
        return this.backingStore.get("storagePlanInformation");
    }

    public Long getTotal() {
        return this.backingStore.get("total");
    }

    public Long getUsed() {
        return this.backingStore.get("used");
    }

    /**
     * Serializes information the current object.
     *
     * @param writer the writer to serialize into
     */
    @Override
    public void serialize(SerializationWriter writer) {
        Objects.requireNonNull(writer, "writer");
        writer.writeLongValue("deleted", this.getDeleted());
        writer.writeLongValue("remaining", this.getRemaining());
        writer.writeStringValue("state", this.getState());
        writer.writeObjectValue("storagePlanInformation", this.getStoragePlanInformation());
        writer.writeLongValue("total", this.getTotal());
        writer.writeLongValue("used", this.getUsed());
        writer.writeStringValue("@odata.type", this.getOdataType());
        writer.writeAdditionalData(this.getAdditionalData());
    }

    public void setAdditionalData(Map<String, Object> value) {
        this.backingStore.set("additionalData", value);
    }

    public void setBackingStore(BackingStore value) {
        this.backingStore = Objects.requireNonNull(value, "value");
    }

    public void setDeleted(Long value) {
        this.backingStore.set("deleted", value);
    }

    public void setOdataType(String value) {
        this.backingStore.set("@odata.type", value);
    }

    public void setRemaining(Long value) {
        this.backingStore.set("remaining", value);
    }

    public void setState(String value) {
        this.backingStore.set("state", value);
    }

    public void setStoragePlanInformation(StoragePlanInformation value) {
        this.backingStore.set("storagePlanInformation", value);
    }

    public void setTotal(Long value) {
        this.backingStore.set("total", value);
    }

    public void setUsed(Long value) {
        this.backingStore.set("used", value);
    }
}
