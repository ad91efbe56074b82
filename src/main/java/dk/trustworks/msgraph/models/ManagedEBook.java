package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * An eBook distributed through Intune.
 */
public class ManagedEBook extends Entity {

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link ManagedEBook}
     */
    public static ManagedEBook createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        ParseNode mappingValueNode = parseNode.getChildNode("@odata.type");
        String mappingValue = mappingValueNode == null ? null : mappingValueNode.getStringValue();
        if (mappingValue == null) {
            return new ManagedEBook();
        }
        return switch (mappingValue) {
            case "#microsoft.graph.iosVppEBook" -> new IosVppEBook();
            default -> new ManagedEBook();
        };
    }

    /**
     * Gets the assignments property value. The list of assignments for this eBook.
     *
     * @return the assignments value
     */
    public List<ManagedEBookAssignment> getAssignments() {
        return this.backingStore.get("assignments");
    }

    public OffsetDateTime getCreatedDateTime() {
        return this.backingStore.get("createdDateTime");
    }

    public String getDescription() {
        return this.backingStore.get("description");
    }

    public String getDisplayName() {
        return this.backingStore.get("displayName");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("assignments", n -> this.setAssignments(n.getCollectionOfObjectValues(ManagedEBookAssignment::createFromDiscriminatorValue)));
        deserializerMap.put("createdDateTime", n -> this.setCreatedDateTime(n.getOffsetDateTimeValue()));
        deserializerMap.put("description", n -> this.setDescription(n.getStringValue()));
        deserializerMap.put("displayName", n -> this.setDisplayName(n.getStringValue()));
        deserializerMap.put("informationUrl", n -> this.setInformationUrl(n.getStringValue()));
        deserializerMap.put("installSummary", n -> this.setInstallSummary(n.getObjectValue(EBookInstallSummary::createFromDiscriminatorValue)));
        deserializerMap.put("largeCover", n -> this.setLargeCover(n.getObjectValue(MimeContent::createFromDiscriminatorValue)));
        deserializerMap.put("lastModifiedDateTime", n -> this.setLastModifiedDateTime(n.getOffsetDateTimeValue()));
        deserializerMap.put("privacyInformationUrl", n -> this.setPrivacyInformationUrl(n.getStringValue()));
        deserializerMap.put("publishedDateTime", n -> this.setPublishedDateTime(n.getOffsetDateTimeValue()));
        deserializerMap.put("publisher", n -> this.setPublisher(n.getStringValue()));
        return deserializerMap;
    }

    public String getInformationUrl() {
        return this.backingStore.get("informationUrl");
    }

    public EBookInstallSummary getInstallSummary() {
        return this.backingStore.get("installSummary");
    }

    /**
     * Gets the largeCover property value. Book cover.
     *
     * @return the largeCover value
     */
    public MimeContent getLargeCover() {
        return this.backingStore.get("largeCover");
    }

    public OffsetDateTime getLastModifiedDateTime() {
        return this.backingStore.get("lastModifiedDateTime");
    }

    public String getPrivacyInformationUrl() {
        return this.backingStore.get("privacyInformationUrl");
    }

    public OffsetDateTime getPublishedDateTime() {
        return this.backingStore.get("publishedDateTime");
    }

    public String getPublisher() {
        return this.backingStore.get("publisher");
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
        writer.writeCollectionOfObjectValues("assignments", this.getAssignments());
        writer.writeOffsetDateTimeValue("createdDateTime", this.getCreatedDateTime());
        writer.writeStringValue("description", this.getDescription());
        writer.writeStringValue("displayName", this.getDisplayName());
        writer.writeStringValue("informationUrl", this.getInformationUrl());
        writer.writeObjectValue("installSummary", this.getInstallSummary());
        writer.writeObjectValue("largeCover", this.getLargeCover());
        writer.writeOffsetDateTimeValue("lastModifiedDateTime", this.getLastModifiedDateTime());
        writer.writeStringValue("privacyInformationUrl", this.getPrivacyInformationUrl());
        writer.writeOffsetDateTimeValue("publishedDateTime", this.getPublishedDateTime());
        writer.writeStringValue("publisher", this.getPublisher());
    }

    public void setAssignments(List<ManagedEBookAssignment> value) {
        this.backingStore.set("assignments", value);
    }

    public void setCreatedDateTime(OffsetDateTime value) {
        this.backingStore.set("createdDateTime", value);
    }

    public void setDescription(String value) {
        this.backingStore.set("description", value);
    }

    public void setDisplayName(String value) {
        this.backingStore.set("displayName", value);
    }

    public void setInformationUrl(String value) {
        this.backingStore.set("informationUrl", value);
    }

    public void setInstallSummary(EBookInstallSummary value) {
        this.backingStore.set("installSummary", value);
    }

    public void setLargeCover(MimeContent value) {
        this.backingStore.set("largeCover", value);
    }

    public void setLastModifiedDateTime(OffsetDateTime value) {
        this.backingStore.set("lastModifiedDateTime", value);
    }

    public void setPrivacyInformationUrl(String value) {
        this.backingStore.set("privacyInformationUrl", value);
    }

    public void setPublishedDateTime(OffsetDateTime value) {
        this.backingStore.set("publishedDateTime", value);
    }

    public void setPublisher(String value) {
        this.backingStore.set("publisher", value);
    }
}
