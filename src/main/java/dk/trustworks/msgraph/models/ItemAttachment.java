package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A message or event attached to another message or event.
 */
public class ItemAttachment extends Attachment {

    public ItemAttachment() {
        super();
        this.setOdataType("#microsoft.graph.itemAttachment");
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link ItemAttachment}
     */
    public static ItemAttachment createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new ItemAttachment();
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("item", n -> this.setItem(n.getObjectValue(OutlookItem::createFromDiscriminatorValue)));
        return deserializerMap;
    }

    /**
     * Gets the item property value. The attached message or event.
     *
     * @return the item value
     */
    public OutlookItem getItem() {
        return this.backingStore.get("item");
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
        writer.writeObjectValue("item", this.getItem());
    }

    public void setItem(OutlookItem value) {
        this.backingStore.set("item", value);
    }
}
