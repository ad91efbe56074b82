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
 * Base type of every addressable Microsoft Graph resource.
 */
public class Entity implements AdditionalDataHolder, BackedModel, Parsable {

    /**
     * Holds the property values of this model.
     */
    protected BackingStore backingStore;

    public Entity() {
        this.backingStore = BackingStoreFactorySingleton.instance.createBackingStore();
        this.setAdditionalData(new HashMap<>());
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link Entity}
     */
    public static Entity createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        ParseNode mappingValueNode = parseNode.getChildNode("@odata.type");
        String mappingValue = mappingValueNode == null ? null : mappingValueNode.getStringValue();
        if (mappingValue == null) {
            return new Entity();
        }
        return switch (mappingValue) {
            case "#microsoft.graph.outlookItem" -> new OutlookItem();
            case "#microsoft.graph.message" -> new Message();
            case "#microsoft.graph.eventMessage" -> new EventMessage();
            case "#microsoft.graph.eventMessageRequest" -> new EventMessageRequest();
            case "#microsoft.graph.eventMessageResponse" -> new EventMessageResponse();
            case "#microsoft.graph.calendarSharingMessage" -> new CalendarSharingMessage();
            case "#microsoft.graph.event" -> new Event();
            case "#microsoft.graph.calendar" -> new Calendar();
            case "#microsoft.graph.calendarPermission" -> new CalendarPermission();
            case "#microsoft.graph.attachment" -> new Attachment();
            case "#microsoft.graph.fileAttachment" -> new FileAttachment();
            case "#microsoft.graph.itemAttachment" -> new ItemAttachment();
            case "#microsoft.graph.referenceAttachment" -> new ReferenceAttachment();
            case "#microsoft.graph.extension" -> new Extension();
            case "#microsoft.graph.openTypeExtension" -> new OpenTypeExtension();
            case "#microsoft.graph.singleValueLegacyExtendedProperty" -> new SingleValueLegacyExtendedProperty();
            case "#microsoft.graph.multiValueLegacyExtendedProperty" -> new MultiValueLegacyExtendedProperty();
            case "#microsoft.graph.managedAppRegistration" -> new ManagedAppRegistration();
            case "#microsoft.graph.androidManagedAppRegistration" -> new AndroidManagedAppRegistration();
            case "#microsoft.graph.iosManagedAppRegistration" -> new IosManagedAppRegistration();
            case "#microsoft.graph.managedAppPolicy" -> new ManagedAppPolicy();
            case "#microsoft.graph.managedAppOperation" -> new ManagedAppOperation();
            case "#microsoft.graph.managedEBook" -> new ManagedEBook();
            case "#microsoft.graph.iosVppEBook" -> new IosVppEBook();
            case "#microsoft.graph.managedEBookAssignment" -> new ManagedEBookAssignment();
            case "#microsoft.graph.iosVppEBookAssignment" -> new IosVppEBookAssignment();
            case "#microsoft.graph.eBookInstallSummary" -> new EBookInstallSummary();
            default -> new Entity();
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
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(2);
        deserializerMap.put("@odata.type", n -> this.setOdataType(n.getStringValue()));
        deserializerMap.put("id", n -> this.setId(n.getStringValue()));
        return deserializerMap;
    }

    /**
     * Gets the id property value. The unique identifier for an entity. Read-only.
     *
     * @return the id value
     */
    public String getId() {
        return this.backingStore.get("id");
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
        writer.writeStringValue("id", this.getId());
        writer.writeStringValue("@odata.type", this.getOdataType());
        writer.writeAdditionalData(this.getAdditionalData());
    }

    public void setAdditionalData(Map<String, Object> value) {
        this.backingStore.set("additionalData", value);
    }

    public void setBackingStore(BackingStore value) {
        this.backingStore = Objects.requireNonNull(value, "value");
    }

    public void setId(String value) {
        this.backingStore.set("id", value);
    }

    public void setOdataType(String value) {
        this.backingStore.set("@odata.type", value);
    }
}
