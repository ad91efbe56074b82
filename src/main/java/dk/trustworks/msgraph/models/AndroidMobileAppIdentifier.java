package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Identifier of an Android app.
 */
public class AndroidMobileAppIdentifier extends MobileAppIdentifier {

    public AndroidMobileAppIdentifier() {
        super();
        this.setOdataType("#microsoft.graph.androidMobileAppIdentifier");
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link AndroidMobileAppIdentifier}
     */
    public static AndroidMobileAppIdentifier createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new AndroidMobileAppIdentifier();
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("packageId", n -> this.setPackageId(n.getStringValue()));
        return deserializerMap;
    }

    public String getPackageId() {
        return this.backingStore.get("packageId");
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
        writer.writeStringValue("packageId", this.getPackageId());
    }

    public void setPackageId(String value) {
        this.backingStore.set("packageId", value);
    }
}
