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
 * An app registered with the Intune app protection service.
 */
public class ManagedAppRegistration extends Entity {

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link ManagedAppRegistration}
     */
    public static ManagedAppRegistration createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        ParseNode mappingValueNode = parseNode.getChildNode("@odata.type");
        String mappingValue = mappingValueNode == null ? null : mappingValueNode.getStringValue();
        if (mappingValue == null) {
            return new ManagedAppRegistration();
        }
        return switch (mappingValue) {
            case "#microsoft.graph.androidManagedAppRegistration" -> new AndroidManagedAppRegistration();
            case "#microsoft.graph.iosManagedAppRegistration" -> new IosManagedAppRegistration();
            default -> new ManagedAppRegistration();
        };
    }

    /**
     * Gets the appIdentifier property value. The app package Identifier
     *
     * @return the appIdentifier value
     */
    public MobileAppIdentifier getAppIdentifier() {
        return this.backingStore.get("appIdentifier");
    }

    public String getApplicationVersion() {
        return this.backingStore.get("applicationVersion");
    }

    /**
     * Gets the appliedPolicies property value. Zero or more policys already applied on the registered app
     * when it last synchronized with managment service.
     *
     * @return the appliedPolicies value
     */
    public List<ManagedAppPolicy> getAppliedPolicies() {
        return this.backingStore.get("appliedPolicies");
    }

    public OffsetDateTime getCreatedDateTime() {
        return this.backingStore.get("createdDateTime");
    }

    public String getDeviceName() {
        return this.backingStore.get("deviceName");
    }

    /**
     * Gets the deviceTag property value. App management SDK generated tag, which helps relate apps hosted
     * on the same device.
     *
     * @return the deviceTag value
     */
    public String getDeviceTag() {
        return this.backingStore.get("deviceTag");
    }

    public String getDeviceType() {
        return this.backingStore.get("deviceType");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("appIdentifier", n -> this.setAppIdentifier(n.getObjectValue(MobileAppIdentifier::createFromDiscriminatorValue)));
        deserializerMap.put("applicationVersion", n -> this.setApplicationVersion(n.getStringValue()));
        deserializerMap.put("appliedPolicies", n -> this.setAppliedPolicies(n.getCollectionOfObjectValues(ManagedAppPolicy::createFromDiscriminatorValue)));
        deserializerMap.put("createdDateTime", n -> this.setCreatedDateTime(n.getOffsetDateTimeValue()));
        deserializerMap.put("deviceName", n -> this.setDeviceName(n.getStringValue()));
        deserializerMap.put("deviceTag", n -> this.setDeviceTag(n.getStringValue()));
        deserializerMap.put("deviceType", n -> this.setDeviceType(n.getStringValue()));
        deserializerMap.put("flaggedReasons", n -> this.setFlaggedReasons(n.getCollectionOfEnumValues(ManagedAppFlaggedReason::forValue)));
        deserializerMap.put("intendedPolicies", n -> this.setIntendedPolicies(n.getCollectionOfObjectValues(ManagedAppPolicy::createFromDiscriminatorValue)));
        deserializerMap.put("lastSyncDateTime", n -> this.setLastSyncDateTime(n.getOffsetDateTimeValue()));
        deserializerMap.put("managementSdkVersion", n -> this.setManagementSdkVersion(n.getStringValue()));
        deserializerMap.put("operations", n -> this.setOperations(n.getCollectionOfObjectValues(ManagedAppOperation::createFromDiscriminatorValue)));
        deserializerMap.put("platformVersion", n -> this.setPlatformVersion(n.getStringValue()));
        deserializerMap.put("userId", n -> this.setUserId(n.getStringValue()));
        deserializerMap.put("version", n -> this.setVersion(n.getStringValue()));
        return deserializerMap;
    }

    /**
     * Gets the flaggedReasons property value. Zero or more reasons an app registration is flagged. E.g.
     * app running on rooted device
     *
     * @return the flaggedReasons value
     */
    public List<ManagedAppFlaggedReason> getFlaggedReasons() {
        return this.backingStore.get("flaggedReasons");
    }

    public List<ManagedAppPolicy> getIntendedPolicies() {
        return this.backingStore.get("intendedPolicies");
    }

    public OffsetDateTime getLastSyncDateTime() {
        return this.backingStore.get("lastSyncDateTime");
    }

    public String getManagementSdkVersion() {
        return this.backingStore.get("managementSdkVersion");
    }

    public List<ManagedAppOperation> getOperations() {
        return this.backingStore.get("operations");
    }

    public String getPlatformVersion() {
        return this.backingStore.get("platformVersion");
    }

    public String getUserId() {
        return this.backingStore.get("userId");
    }

    public String getVersion() {
        return this.backingStore.get("version");
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
        writer.writeObjectValue("appIdentifier", this.getAppIdentifier());
        writer.writeStringValue("applicationVersion", this.getApplicationVersion());
        writer.writeCollectionOfObjectValues("appliedPolicies", this.getAppliedPolicies());
        writer.writeOffsetDateTimeValue("createdDateTime", this.getCreatedDateTime());
        writer.writeStringValue("deviceName", this.getDeviceName());
        writer.writeStringValue("deviceTag", this.getDeviceTag());
        writer.writeStringValue("deviceType", this.getDeviceType());
        writer.writeCollectionOfEnumValues("flaggedReasons", this.getFlaggedReasons());
        writer.writeCollectionOfObjectValues("intendedPolicies", this.getIntendedPolicies());
        writer.writeOffsetDateTimeValue("lastSyncDateTime", this.getLastSyncDateTime());
        writer.writeStringValue("managementSdkVersion", this.getManagementSdkVersion());
        writer.writeCollectionOfObjectValues("operations", this.getOperations());
        writer.writeStringValue("platformVersion", this.getPlatformVersion());
        writer.writeStringValue("userId", this.getUserId());
        writer.writeStringValue("version", this.getVersion());
    }

    public void setAppIdentifier(MobileAppIdentifier value) {
        this.backingStore.set("appIdentifier", value);
    }

    public void setApplicationVersion(String value) {
        this.backingStore.set("applicationVersion", value);
    }

    public void setAppliedPolicies(List<ManagedAppPolicy> value) {
        this.backingStore.set("appliedPolicies", value);
    }

    public void setCreatedDateTime(OffsetDateTime value) {
        this.backingStore.set("createdDateTime", value);
    }

    public void setDeviceName(String value) {
        this.backingStore.set("deviceName", value);
    }

    public void setDeviceTag(String value) {
        this.backingStore.set("deviceTag", value);
    }

    public void setDeviceType(String value) {
        this.backingStore.set("deviceType", value);
    }

    public void setFlaggedReasons(List<ManagedAppFlaggedReason> value) {
        this.backingStore.set("flaggedReasons", value);
    }

    public void setIntendedPolicies(List<ManagedAppPolicy> value) {
        this.backingStore.set("intendedPolicies", value);
    }

    public void setLastSyncDateTime(OffsetDateTime value) {
        this.backingStore.set("lastSyncDateTime", value);
    }

    public void setManagementSdkVersion(String value) {
        this.backingStore.set("managementSdkVersion", value);
    }

    public void setOperations(List<ManagedAppOperation> value) {
        this.backingStore.set("operations", value);
    }

    public void setPlatformVersion(String value) {
        this.backingStore.set("platformVersion", value);
    }

    public void setUserId(String value) {
        this.backingStore.set("userId", value);
    }

    public void setVersion(String value) {
        this.backingStore.set("version", value);
    }
}
