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
 * Geographic coordinates and elevation of a location.
 */
public class OutlookGeoCoordinates implements AdditionalDataHolder, BackedModel, Parsable {

    /**
     * Holds the property values of this model.
     */
    protected BackingStore backingStore;

    public OutlookGeoCoordinates() {
        this.backingStore = BackingStoreFactorySingleton.instance.createBackingStore();
        this.setAdditionalData(new HashMap<>());
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link OutlookGeoCoordinates}
     */
    public static OutlookGeoCoordinates createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new OutlookGeoCoordinates();
    }

    /**
     * Gets the accuracy property value. The accuracy of the latitude and longitude, in meters.
     *
     * @return the accuracy value
     */
    public Double getAccuracy() {
        return this.backingStore.get("accuracy");
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

    public Double getAltitude() {
        return this.backingStore.get("altitude");
    }

    public Double getAltitudeAccuracy() {
        return this.backingStore.get("altitudeAccuracy");
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
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(6);
        deserializerMap.put("@odata.type", n -> this.setOdataType(n.getStringValue()));
        deserializerMap.put("accuracy", n -> this.setAccuracy(n.getDoubleValue()));
        deserializerMap.put("altitude", n -> this.setAltitude(n.getDoubleValue()));
        deserializerMap.put("altitudeAccuracy", n -> this.setAltitudeAccuracy(n.getDoubleValue()));
        deserializerMap.put("latitude", n -> this.setLatitude(n.getDoubleValue()));
        deserializerMap.put("longitude", n -> this.setLongitude(n.getDoubleValue()));
        return deserializerMap;
    }

    public Double getLatitude() {
        return this.backingStore.get("latitude");
    }

    public Double getLongitude() {
        return this.backingStore.get("longitude");
    }

    public String getOdataType() {
        return this.backingStore.get("@odata.type");
    }

    /**
     * Serializes information the current object.
     *
     * @param writer the writer to serialize into
     */
    @Override
    public void serialize(SerializationWriter writer) {
        Objects.requireNonNull(writer, "writer");
        writer.writeDoubleValue("accuracy", this.getAccuracy());
        writer.writeDoubleValue("altitude", this.getAltitude());
        writer.writeDoubleValue("altitudeAccuracy", this.getAltitudeAccuracy());
        writer.writeDoubleValue("latitude", this.getLatitude());
        writer.writeDoubleValue("longitude", this.getLongitude());
        writer.writeStringValue("@odata.type", this.getOdataType());
        writer.writeAdditionalData(this.getAdditionalData());
    }

    public void setAccuracy(Double value) {
        this.backingStore.set("accuracy", value);
    }

    public void setAdditionalData(Map<String, Object> value) {
        this.backingStore.set("additionalData", value);
    }

    public void setAltitude(Double value) {
        this.backingStore.set("altitude", value);
    }

    public void setAltitudeAccuracy(Double value) {
        this.backingStore.set("altitudeAccuracy", value);
    }

    public void setBackingStore(BackingStore value) {
        this.backingStore = Objects.requireNonNull(value, "value");
    }

    public void setLatitude(Double value) {
        this.backingStore.set("latitude", value);
    }

    public void setLongitude(Double value) {
        this.backingStore.set("longitude", value);
    }

    public void setOdataType(String value) {
        this.backingStore.set("@odata.type", value);
    }
}
