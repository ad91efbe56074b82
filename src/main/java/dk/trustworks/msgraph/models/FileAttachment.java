package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A file attached to a message or event.
 */
public class FileAttachment extends Attachment {

    public FileAttachment() {
        super();
        this.setOdataType("#microsoft.graph.fileAttachment");
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link FileAttachment}
     */
    public static FileAttachment createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new FileAttachment();
    }

    /**
     * Gets the contentBytes property value. The base64-encoded contents of the file.
     *
     * @return the contentBytes value
     */
    public byte[] getContentBytes() {
        return this.backingStore.get("contentBytes");
    }

    public String getContentId() {
        return this.backingStore.get("contentId");
    }

    public String getContentLocation() {
        return this.backingStore.get("contentLocation");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("contentBytes", n -> this.setContentBytes(n.getByteArrayValue()));
        deserializerMap.put("contentId", n -> this.setContentId(n.getStringValue()));
        deserializerMap.put("contentLocation", n -> this.setContentLocation(n.getStringValue()));
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
        writer.writeByteArrayValue("contentBytes", this.getContentBytes());
        writer.writeStringValue("contentId", this.getContentId());
        writer.writeStringValue("contentLocation", this.getContentLocation());
    }

    public void setContentBytes(byte[] value) {
        this.backingStore.set("contentBytes", value);
    }

    public void setContentId(String value) {
        this.backingStore.set("contentId", value);
    }

    public void setContentLocation(String value) {
        this.backingStore.set("contentLocation", value);
    }
}
