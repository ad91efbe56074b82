package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Permissions of a user with whom a calendar has been shared or delegated.
 */
public class CalendarPermission extends Entity {

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link CalendarPermission}
     */
    public static CalendarPermission createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new CalendarPermission();
    }

    public List<CalendarRoleType> getAllowedRoles() {
        return this.backingStore.get("allowedRoles");
    }

    public EmailAddress getEmailAddress() {
        return this.backingStore.get("emailAddress");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("allowedRoles", n -> this.setAllowedRoles(n.getCollectionOfEnumValues(CalendarRoleType::forValue)));
        deserializerMap.put("emailAddress", n -> this.setEmailAddress(n.getObjectValue(EmailAddress::createFromDiscriminatorValue)));
        deserializerMap.put("isInsideOrganization", n -> this.setIsInsideOrganization(n.getBooleanValue()));
        deserializerMap.put("isRemovable", n -> this.setIsRemovable(n.getBooleanValue()));
        deserializerMap.put("role", n -> this.setRole(n.getEnumValue(CalendarRoleType::forValue)));
        return deserializerMap;
    }

    public Boolean getIsInsideOrganization() {
        return this.backingStore.get("isInsideOrganization");
    }

    public Boolean getIsRemovable() {
        return this.backingStore.get("isRemovable");
    }

    public CalendarRoleType getRole() {
        return this.backingStore.get("role");
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
        writer.writeCollectionOfEnumValues("allowedRoles", this.getAllowedRoles());
        writer.writeObjectValue("emailAddress", this.getEmailAddress());
        writer.writeBooleanValue("isInsideOrganization", this.getIsInsideOrganization());
        writer.writeBooleanValue("isRemovable", this.getIsRemovable());
        writer.writeEnumValue("role", this.getRole());
    }

    public void setAllowedRoles(List<CalendarRoleType> value) {
        this.backingStore.set("allowedRoles", value);
    }

    public void setEmailAddress(EmailAddress value) {
        this.backingStore.set("emailAddress", value);
    }

    public void setIsInsideOrganization(Boolean value) {
        this.backingStore.set("isInsideOrganization", value);
    }

    public void setIsRemovable(Boolean value) {
        this.backingStore.set("isRemovable", value);
    }

    public void setRole(CalendarRoleType value) {
        this.backingStore.set("role", value);
    }
}
