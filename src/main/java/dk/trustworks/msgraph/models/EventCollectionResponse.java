package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * A page of events.
 */
public class EventCollectionResponse extends BaseCollectionPaginationCountResponse {

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link EventCollectionResponse}
     */
    public static EventCollectionResponse createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new EventCollectionResponse();
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("value", n -> this.setValue(n.getCollectionOfObjectValues(Event::createFromDiscriminatorValue)));
        return deserializerMap;
    }

    public List<Event> getValue() {
        return this.backingStore.get("value");
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
        writer.writeCollectionOfObjectValues("value", this.getValue());
    }

    public void setValue(List<Event> value) {
        this.backingStore.set("value", value);
    }
}
