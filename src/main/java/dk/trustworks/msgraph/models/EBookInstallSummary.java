package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Install counts of an eBook.
 */
public class EBookInstallSummary extends Entity {

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link EBookInstallSummary}
     */
    public static EBookInstallSummary createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new EBookInstallSummary();
    }

    public Integer getFailedDeviceCount() {
        return this.backingStore.get("failedDeviceCount");
    }

    public Integer getFailedUserCount() {
        return this.backingStore.get("failedUserCount");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("failedDeviceCount", n -> this.setFailedDeviceCount(n.getIntegerValue()));
        deserializerMap.put("failedUserCount", n -> this.setFailedUserCount(n.getIntegerValue()));
        deserializerMap.put("installedDeviceCount", n -> this.setInstalledDeviceCount(n.getIntegerValue()));
        deserializerMap.put("installedUserCount", n -> this.setInstalledUserCount(n.getIntegerValue()));
        deserializerMap.put("notInstalledDeviceCount", n -> this.setNotInstalledDeviceCount(n.getIntegerValue()));
        deserializerMap.put("notInstalledUserCount", n -> this.setNotInstalledUserCount(n.getIntegerValue()));
        return deserializerMap;
    }

    public Integer getInstalledDeviceCount() {
        return this.backingStore.get("installedDeviceCount");
    }

    public Integer getInstalledUserCount() {
        return this.backingStore.get("installedUserCount");
    }

    public Integer getNotInstalledDeviceCount() {
        return this.backingStore.get("notInstalledDeviceCount");
    }

    public Integer getNotInstalledUserCount() {
        return this.backingStore.get("notInstalledUserCount");
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
        writer.writeIntegerValue("failedDeviceCount", this.getFailedDeviceCount());
        writer.writeIntegerValue("failedUserCount", this.getFailedUserCount());
        writer.writeIntegerValue("installedDeviceCount", this.getInstalledDeviceCount());
        writer.writeIntegerValue("installedUserCount", this.getInstalledUserCount());
        writer.writeIntegerValue("notInstalledDeviceCount", this.getNotInstalledDeviceCount());
        writer.writeIntegerValue("notInstalledUserCount", this.getNotInstalledUserCount());
    }

    public void setFailedDeviceCount(Integer value) {
        this.backingStore.set("failedDeviceCount", value);
    }

    public void setFailedUserCount(Integer value) {
        this.backingStore.set("failedUserCount", value);
    }

    public void setInstalledDeviceCount(Integer value) {
        this.backingStore.set("installedDeviceCount", value);
    }

    public void setInstalledUserCount(Integer value) {
        this.backingStore.set("installedUserCount", value);
    }

    public void setNotInstalledDeviceCount(Integer value) {
        this.backingStore.set("notInstalledDeviceCount", value);
    }

    public void setNotInstalledUserCount(Integer value) {
        this.backingStore.set("notInstalledUserCount", value);
    }
}
