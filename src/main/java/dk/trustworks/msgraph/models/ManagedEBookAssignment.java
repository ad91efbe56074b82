package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Assignment of an eBook to a group of users or devices.
 */
public class ManagedEBookAssignment extends Entity {

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link ManagedEBookAssignment}
     */
    public static ManagedEBookAssignment createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        ParseNode mappingValueNode = parseNode.getChildNode("@odata.type");
        String mappingValue = mappingValueNode == null ? null : mappingValueNode.getStringValue();
        if (mappingValue == null) {
            return new ManagedEBookAssignment();
        }
        return switch (mappingValue) {
            case "#microsoft.graph.iosVppEBookAssignment" -> new IosVppEBookAssignment();
            default -> new ManagedEBookAssignment();
        };
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("installIntent", n -> this.setInstallIntent(n.getEnumValue(InstallIntent::forValue)));
        deserializerMap.put("target", n -> this.setTarget(n.getObjectValue(DeviceAndAppManagementAssignmentTarget::createFromDiscriminatorValue)));
        return deserializerMap;
    }

    public InstallIntent getInstallIntent() {
        return this.backingStore.get("installIntent");
    }

    /**
     * Gets the target property value. The assignment target for eBook.
     *
     * @return the target value
     */
    public DeviceAndAppManagementAssignmentTarget getTarget() {
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
        super.serialize(writer);
        writer.writeEnumValue("installIntent", this.getInstallIntent());
        writer.writeObjectValue("target", this.getTarget());
    }

    public void setInstallIntent(InstallIntent value) {
        this.backingStore.set("installIntent", value);
    }

    public void setTarget(DeviceAndAppManagementAssignmentTarget value) {
        this.backingStore.set("target", value);
    }
}
