package dk.trustworks.msgraph.models.odataerrors;

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
 * The error object of a failed Graph response.
 */
public class MainError implements AdditionalDataHolder, BackedModel, Parsable {

    /**
     * Holds the property values of this model.
     */
    protected BackingStore backingStore;

    public MainError() {
        this.backingStore = BackingStoreFactorySingleton.instance.createBackingStore();
        this.setAdditionalData(new HashMap<>());
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link MainError}
     */
    public static MainError createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new MainError();
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

    public String getCode() {
        return this.backingStore.get("code");
    }

    public List<ErrorDetails> getDetails() {
        return this.backingStore.get("details");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(5);
        deserializerMap.put("code", n -> this.setCode(n.getStringValue()));
        deserializerMap.put("details", n -> this.setDetails(n.getCollectionOfObjectValues(ErrorDetails::createFromDiscriminatorValue)));
        deserializerMap.put("innerError", n -> this.setInnerError(n.getObjectValue(InnerError::createFromDiscriminatorValue)));
        deserializerMap.put("message", n -> this.setMessage(n.getStringValue()));
        deserializerMap.put("target", n -> this.setTarget(n.getStringValue()));
        return deserializerMap;
    }

    public InnerError getInnerError() {
        return this.backingStore.get("innerError");
    }

    public String getMessage() {
        return this.backingStore.get("message");
    }

    public String getTarget() {
        return this.backingStore.get("target");
    }

    /**
     * Serializes information the current object.
     *
     * @param writer the writer to serialize into
     */
    @Override
    public void serialize(SerializationWriter writer) {
        Objects.requireNonNull(writer, "writer");
        writer.writeStringValue("code", this.getCode());
        writer.writeCollectionOfObjectValues("details", this.getDetails());
        writer.writeObjectValue("innerError", this.getInnerError());
        writer.writeStringValue("message", this.getMessage());
        writer.writeStringValue("target", this.getTarget());
        writer.writeAdditionalData(this.getAdditionalData());
    }

    public void setAdditionalData(Map<String, Object> value) {
        this.backingStore.set("additionalData", value);
    }

    public void setBackingStore(BackingStore value) {
        this.backingStore = Objects.requireNonNull(value, "value");
    }

    public void setCode(String value) {
        this.backingStore.set("code", value);
    }

    public void setDetails(List<ErrorDetails> value) {
        this.backingStore.set("details", value);
    }

    public void setInnerError(InnerError value) {
        this.backingStore.set("innerError", value);
    }

    public void setMessage(String value) {
        this.backingStore.set("message", value);
    }

    public void setTarget(String value) {
        this.backingStore.set("target", value);
    }
}
