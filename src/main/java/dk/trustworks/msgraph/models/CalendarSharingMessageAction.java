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
 * An action offered by a calendar sharing message.
 */
public class CalendarSharingMessageAction implements AdditionalDataHolder, BackedModel, Parsable {

    /**
     * Holds the property values of this model.
     */
    protected BackingStore backingStore;

    public CalendarSharingMessageAction() {
        this.backingStore = BackingStoreFactorySingleton.instance.createBackingStore();
        this.setAdditionalData(new HashMap<>());
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link CalendarSharingMessageAction}
     */
    public static CalendarSharingMessageAction createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new CalendarSharingMessageAction();
    }

    public CalendarSharingAction getAction() {
        return this.backingStore.get("action");
    }

    public CalendarSharingActionType getActionType() {
        return this.backingStore.get("actionType");
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
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(4);
        deserializerMap.put("@odata.type", n -> this.setOdataType(n.getStringValue()));
        deserializerMap.put("action", n -> this.setAction(n.getEnumValue(CalendarSharingAction::forValue)));
        deserializerMap.put("actionType", n -> this.setActionType(n.getEnumValue(CalendarSharingActionType::forValue)));
        deserializerMap.put("importance", n -> this.setImportance(n.getEnumValue(CalendarSharingActionImportance::forValue)));
        return deserializerMap;
    }

    public CalendarSharingActionImportance getImportance() {
        return this.backingStore.get("importance");
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
        writer.writeEnumValue("action", this.getAction());
        writer.writeEnumValue("actionType", this.getActionType());
        writer.writeEnumValue("importance", this.getImportance());
        writer.writeStringValue("@odata.type", this.getOdataType());
        writer.writeAdditionalData(this.getAdditionalData());
    }

    public void setAction(CalendarSharingAction value) {
        this.backingStore.set("action", value);
    }

    public void setActionType(CalendarSharingActionType value) {
        this.backingStore.set("actionType", value);
    }

    public void setAdditionalData(Map<String, Object> value) {
        this.backingStore.set("additionalData", value);
    }

    public void setBackingStore(BackingStore value) {
        this.backingStore = Objects.requireNonNull(value, "value");
    }

    public void setImportance(CalendarSharingActionImportance value) {
        this.backingStore.set("importance", value);
    }

    public void setOdataType(String value) {
        this.backingStore.set("@odata.type", value);
    }
}
