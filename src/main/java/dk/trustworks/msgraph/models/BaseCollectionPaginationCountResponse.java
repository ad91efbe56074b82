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
 * Common envelope of collection responses.
 */
public class BaseCollectionPaginationCountResponse implements AdditionalDataHolder, BackedModel, Parsable {

    /**
     * Holds the property values of this model.
     */
    protected BackingStore backingStore;

    public BaseCollectionPaginationCountResponse() {
        this.backingStore = BackingStoreFactorySingleton.instance.createBackingStore();
        this.setAdditionalData(new HashMap<>());
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link BaseCollectionPaginationCountResponse}
     */
    public static BaseCollectionPaginationCountResponse createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new BaseCollectionPaginationCountResponse();
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
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(2);
        deserializerMap.put("@odata.count", n -> this.setOdataCount(n.getLongValue()));
        deserializerMap.put("@odata.nextLink", n -> this.setOdataNextLink(n.getStringValue()));
        return deserializerMap;
    }

    public Long getOdataCount() {
        return this.backingStore.get("@odata.count");
    }

    /**
     * Gets the @odata.nextLink property value. Link to the next page of the collection, absent on the last
     * page.
     *
     * @return the @odata.nextLink value
     */
    public String getOdataNextLink() {
        return this.backingStore.get("@odata.nextLink");
    }

    /**
     * Serializes information the current object.
     *
     * @param writer the writer to serialize into
     */
    @Override
    public void serialize(SerializationWriter writer) {
        Objects.requireNonNull(writer, "writer");
        writer.writeLongValue("@odata.count", this.getOdataCount());
        writer.writeStringValue("@odata.nextLink", this.getOdataNextLink());
        writer.writeAdditionalData(this.getAdditionalData());
    }

    public void setAdditionalData(Map<String, Object> value) {
        this.backingStore.set("additionalData", value);
    }

    public void setBackingStore(BackingStore value) {
        this.backingStore = Objects.requireNonNull(value, "value");
    }

    public void setOdataCount(Long value) {
        this.backingStore.set("@odata.count", value);
    }

    public void setOdataNextLink(String value) {
        this.backingStore.set("@odata.nextLink", value);
    }
}
