package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Targets the members of a group.
 */
public class GroupAssignmentTarget extends DeviceAndAppManagementAssignmentTarget {

    public GroupAssignmentTarget() {
        super();
        this.setOdataType("#microsoft.graph.groupAssignmentTarget");
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link GroupAssignmentTarget}
     */
    public static GroupAssignmentTarget createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        ParseNode mappingValueNode = parseNode.getChildNode("@odata.type");
        String mappingValue = mappingValueNode == null ? null : mappingValueNode.getStringValue();
        if (mappingValue == null) {
            return new GroupAssignmentTarget();
        }
        return switch (mappingValue) {
            case "#microsoft.graph.exclusionGroupAssignmentTarget" -> new ExclusionGroupAssignmentTarget();
            default -> new GroupAssignmentTarget();
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
        deserializerMap.put("groupId", n -> this.setGroupId(n.getStringValue()));
        return deserializerMap;
    }

    public String getGroupId() {
        return this.backingStore.get("groupId");
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
        writer.writeStringValue("groupId", this.getGroupId());
    }

    public void setGroupId(String value) {
        this.backingStore.set("groupId", value);
    }
}
