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
 * Base of the targets an Intune assignment applies to.
 */
public class DeviceAndAppManagementAssignmentTarget implements AdditionalDataHolder, BackedModel, Parsable {

    /**
     * Holds the property values of this model.
     */
    protected BackingStore backingStore;

    public DeviceAndAppManagementAssignmentTarget() {
        this.backingStore = BackingStoreFactorySingleton.instance.createBackingStore();
        this.setAdditionalData(new HashMap<>());
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link DeviceAndAppManagementAssignmentTarget}
     */
    public static DeviceAndAppManagementAssignmentTarget createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        ParseNode mappingValueNode = parseNode.getChildNode("@odata.type");
        String mappingValue = mappingValueNode == null ? null : mappingValueNode.getStringValue();
        if (mappingValue == null) {
            return new DeviceAndAppManagementAssignmentTarget();
        }
        return switch (mappingValue) {
            case "#microsoft.graph.allDevicesAssignmentTarget" -> new AllDevicesAssignmentTarget();
            case "#microsoft.graph.allLicensedUsersAssignmentTarget" -> new AllLicensedUsersAssignmentTarget();
            case "#microsoft.graph.groupAssignmentTarget" -> new GroupAssignmentTarget();
            case "#microsoft.graph.exclusionGroupAssignmentTarget" -> new ExclusionGroupAssignmentTarget();
            default -> new DeviceAndAppManagementAssignmentTarget();
        };
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
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(1);
        deserializerMap.put("@odata.type", n -> this.setOdataType(n.getStringValue()));
        return deserializerMap;
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
        writer.writeStringValue("@odata.type", this.getOdataType());
        writer.writeAdditionalData(this.getAdditionalData());
    }

    public void setAdditionalData(Map<String, Object> value) {
        this.backingStore.set("additionalData", value);
    }

    public void setBackingStore(BackingStore value) {
        this.backingStore = Objects.requireNonNull(value, "value");
    }

    public void setOdataType(String value) {
        this.backingStore.set("@odata.type", value);
    }
}
