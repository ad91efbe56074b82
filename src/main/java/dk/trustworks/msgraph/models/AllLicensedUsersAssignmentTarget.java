package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Targets every licensed user.
 */
public class AllLicensedUsersAssignmentTarget extends DeviceAndAppManagementAssignmentTarget {

    public AllLicensedUsersAssignmentTarget() {
        super();
        this.setOdataType("#microsoft.graph.allLicensedUsersAssignmentTarget");
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link AllLicensedUsersAssignmentTarget}
     */
    public static AllLicensedUsersAssignmentTarget createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new AllLicensedUsersAssignmentTarget();
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        return deserializerMap;
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
    }
}
