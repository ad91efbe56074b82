package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.AdditionalDataHolder;
import com.microsoft.kiota.serialization.Parsable;
import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;
import com.microsoft.kiota.store.BackedModel;
import com.microsoft.kiota.store.BackingStore;
import com.microsoft.kiota.store.BackingStoreFactorySingleton;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Photo metadata of a drive item.
 */
public class Photo implements AdditionalDataHolder, BackedModel, Parsable {

    /**
     * Holds the property values of this model.
     */
    protected BackingStore backingStore;

    public Photo() {
        this.backingStore = BackingStoreFactorySingleton.instance.createBackingStore();
        this.setAdditionalData(new HashMap<>());
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link Photo}
     */
    public static Photo createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new Photo();
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

    public String getCameraMake() {
        return this.backingStore.get("cameraMake");
    }

    public String getCameraModel() {
        return this.backingStore.get("cameraModel");
    }

    /**
     * Gets the exposureDenominator property value. The denominator for the exposure time fraction from the
     * camera.
     *
     * @return the exposureDenominator value
     */
    public Double getExposureDenominator() {
        return this.backingStore.get("exposureDenominator");
    }

    public Double getExposureNumerator() {
        return this.backingStore.get("exposureNumerator");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(10);
        deserializerMap.put("@odata.type", n -> this.setOdataType(n.getStringValue()));
        deserializerMap.put("cameraMake", n -> this.setCameraMake(n.getStringValue()));
        deserializerMap.put("cameraModel", n -> this.setCameraModel(n.getStringValue()));
        deserializerMap.put("exposureDenominator", n -> this.setExposureDenominator(n.getDoubleValue()));
        deserializerMap.put("exposureNumerator", n -> this.setExposureNumerator(n.getDoubleValue()));
        deserializerMap.put("fNumber", n -> this.setFNumber(n.getDoubleValue()));
        deserializerMap.put("focalLength", n -> this.setFocalLength(n.getDoubleValue()));
        deserializerMap.put("iso", n -> this.setIso(n.getIntegerValue()));
        deserializerMap.put("orientation", n -> this.setOrientation(n.getIntegerValue()));
        deserializerMap.put("takenDateTime", n -> this.setTakenDateTime(n.getOffsetDateTimeValue()));
        return deserializerMap;
    }

    public Double getFNumber() {
        return this.backingStore.get("fNumber");
    }

    public Double getFocalLength() {
        return this.backingStore.get("focalLength");
    }

    public Integer getIso() {
        return this.backingStore.get("iso");
    }

    public String getOdataType() {
        return this.backingStore.get("@odata.type");
    }

    public Integer getOrientation() {
        return this.backingStore.get("orientation");
    }

    public OffsetDateTime getTakenDateTime() {
        return this.backingStore.get("takenDateTime");
    }

    /**
     * Serializes information the current object.
     *
     * @param writer the writer to serialize into
     */
    @Override
    public void serialize(SerializationWriter writer) {
        Objects.requireNonNull(writer, "writer");
        writer.writeStringValue("cameraMake", this.getCameraMake());
        writer.writeStringValue("cameraModel", this.getCameraModel());
        writer.writeDoubleValue("exposureDenominator", this.getExposureDenominator());
        writer.writeDoubleValue("exposureNumerator", this.getExposureNumerator());
        writer.writeDoubleValue("fNumber", this.getFNumber());
        writer.writeDoubleValue("focalLength", this.getFocalLength());
        writer.writeIntegerValue("iso", this.getIso());
        writer.writeIntegerValue("orientation", this.getOrientation());
        writer.writeOffsetDateTimeValue("takenDateTime", this.getTakenDateTime());
        writer.writeStringValue("@odata.type", this.getOdataType());
        writer.writeAdditionalData(this.getAdditionalData());
    }

    public void setAdditionalData(Map<String, Object> value) {
        this.backingStore.set("additionalData", value);
    }

    public void setBackingStore(BackingStore value) {
        this.backingStore = Objects.requireNonNull(value, "value");
    }

    public void setCameraMake(String value) {
        this.backingStore.set("cameraMake", value);
    }

    public void setCameraModel(String value) {
        this.backingStore.set("cameraModel", value);
    }

    public void setExposureDenominator(Double value) {
        this.backingStore.set("exposureDenominator", value);
    }

    public void setExposureNumerator(Double value) {
        this.backingStore.set("exposureNumerator", value);
    }

    public void setFNumber(Double value) {
        this.backingStore.set("fNumber", value);
    }

    public void setFocalLength(Double value) {
        this.backingStore.set("focalLength", value);
    }

    public void setIso(Integer value) {
        this.backingStore.set("iso", value);
    }

    public void setOdataType(String value) {
        this.backingStore.set("@odata.type", value);
    }

    public void setOrientation(Integer value) {
        this.backingStore.set("orientation", value);
    }

    public void setTakenDateTime(OffsetDateTime value) {
        this.backingStore.set("takenDateTime", value);
    }
}
