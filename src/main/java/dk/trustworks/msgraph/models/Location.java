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
 * Location of an event.
 */
public class Location implements AdditionalDataHolder, BackedModel, Parsable {

    /**
     * Holds the property values of this model.
     */
    protected BackingStore backingStore;

    public Location() {
        this.backingStore = BackingStoreFactorySingleton.instance.createBackingStore();
        this.setAdditionalData(new HashMap<>());
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link Location}
     */
    public static Location createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new Location();
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

    public PhysicalAddress getAddress() {
        return this.backingStore.get("address");
    }

    @Override
    public BackingStore getBackingStore() {
        return this.backingStore;
    }

    public OutlookGeoCoordinates getCoordinates() {
        return this.backingStore.get("coordinates");
    }

    public String getDisplayName() {
        return this.backingStore.get("displayName");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(9);
        deserializerMap.put("@odata.type", n -> this.setOdataType(n.getStringValue()));
        deserializerMap.put("address", n -> this.setAddress(n.getObjectValue(PhysicalAddress::createFromDiscriminatorValue)));
        deserializerMap.put("coordinates", n -> this.setCoordinates(n.getObjectValue(OutlookGeoCoordinates::createFromDiscriminatorValue)));
        deserializerMap.put("displayName", n -> this.setDisplayName(n.getStringValue()));
        deserializerMap.put("locationEmailAddress", n -> this.setLocationEmailAddress(n.getStringValue()));
        deserializerMap.put("locationType", n -> this.setLocationType(n.getEnumValue(LocationType::forValue)));
        deserializerMap.put("locationUri", n -> this.setLocationUri(n.getStringValue()));
        deserializerMap.put("uniqueId", n -> this.setUniqueId(n.getStringValue()));
        deserializerMap.put("uniqueIdType", n -> this.setUniqueIdType(n.getEnumValue(LocationUniqueIdType::forValue)));
        return deserializerMap;
    }

    public String getLocationEmailAddress() {
        return this.backingStore.get("locationEmailAddress");
    }

    public LocationType getLocationType() {
        return this.backingStore.get("locationType");
    }

    public String getLocationUri() {
        return this.backingStore.get("locationUri");
    }

    public String getOdataType() {
        return this.backingStore.get("@odata.type");
    }

    public String getUniqueId() {
        return this.backingStore.get("uniqueId");
    }

    public LocationUniqueIdType getUniqueIdType() {
        return this.backingStore.get("uniqueIdType");
    }

    /**
     * Serializes information the current object.
     *
     * @param writer the writer to serialize into
     */
    @Override
    public void serialize(SerializationWriter writer) {
        Objects.requireNonNull(writer, "writer");
        writer.writeObjectValue("address", this.getAddress());
        writer.writeObjectValue("coordinates", this.getCoordinates());
        writer.writeStringValue("displayName", this.getDisplayName());
        writer.writeStringValue("locationEmailAddress", this.getLocationEmailAddress());
        writer.writeEnumValue("locationType", this.getLocationType());
        writer.writeStringValue("locationUri", this.getLocationUri());
        writer.writeStringValue("uniqueId", this.getUniqueId());
        writer.writeEnumValue("uniqueIdType", this.getUniqueIdType());
        writer.writeStringValue("@odata.type", this.getOdataType());
        writer.writeAdditionalData(this.getAdditionalData());
    }

    public void setAdditionalData(Map<String, Object> value) {
        this.backingStore.set("additionalData", value);
    }

    public void setAddress(PhysicalAddress value) {
        this.backingStore.set("address", value);
    }

    public void setBackingStore(BackingStore value) {
        this.backingStore = Objects.requireNonNull(value, "value");
    }

    public void setCoordinates(OutlookGeoCoordinates value) {
        this.backingStore.set("coordinates", value);
    }

    public void setDisplayName(String value) {
        this.backingStore.set("displayName", value);
    }

    public void setLocationEmailAddress(String value) {
        this.backingStore.set("locationEmailAddress", value);
    }

    public void setLocationType(LocationType value) {
        this.backingStore.set("locationType", value);
    }

    public void setLocationUri(String value) {
        this.backingStore.set("locationUri", value);
    }

    public void setOdataType(String value) {
        this.backingStore.set("@odata.type", value);
    }

    public void setUniqueId(String value) {
        this.backingStore.set("uniqueId", value);
    }

    public void setUniqueIdType(LocationUniqueIdType value) {
        this.backingStore.set("uniqueIdType", value);
    }
}
