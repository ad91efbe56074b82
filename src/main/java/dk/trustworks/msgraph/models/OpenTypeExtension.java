package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * An open extension; its untyped properties are kept in the additional data.
 */
public class OpenTypeExtension extends Extension {

    public OpenTypeExtension() {
        super();
        this.setOdataType("#microsoft.graph.openTypeExtension");
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link OpenTypeExtension}
     */
    public static OpenTypeExtension createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new OpenTypeExtension();
    }

    /**
     * Gets the extensionName property value. A unique text identifier for an open type data extension.
     *
     * @return the extensionName value
     */
    public String getExtensionName() {
        return this.backingStore.get("extensionName");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("extensionName", n -> this.setExtensionName(n.getStringValue()));
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
        writer.writeStringValue("extensionName", this.getExtensionName());
    }

    public void setExtensionName(String value) {
        this.backingStore.set("extensionName", value);
    }
}
