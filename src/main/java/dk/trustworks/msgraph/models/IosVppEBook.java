package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * An eBook purchased through the Apple Volume Purchase Program.
 */
public class IosVppEBook extends ManagedEBook {

    public IosVppEBook() {
        super();
        this.setOdataType("#microsoft.graph.iosVppEBook");
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link IosVppEBook}
     */
    public static IosVppEBook createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new IosVppEBook();
    }

    public String getAppleId() {
        return this.backingStore.get("appleId");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(super.getFieldDeserializers());
        deserializerMap.put("appleId", n -> this.setAppleId(n.getStringValue()));
        deserializerMap.put("genres", n -> this.setGenres(n.getCollectionOfPrimitiveValues(String.class)));
        deserializerMap.put("language", n -> this.setLanguage(n.getStringValue()));
        deserializerMap.put("seller", n -> this.setSeller(n.getStringValue()));
        deserializerMap.put("totalLicenseCount", n -> this.setTotalLicenseCount(n.getIntegerValue()));
        deserializerMap.put("usedLicenseCount", n -> this.setUsedLicenseCount(n.getIntegerValue()));
        deserializerMap.put("vppOrganizationName", n -> this.setVppOrganizationName(n.getStringValue()));
        deserializerMap.put("vppTokenId", n -> this.setVppTokenId(n.getUUIDValue()));
        return deserializerMap;
    }

    public List<String> getGenres() {
        return this.backingStore.get("genres");
    }

    public String getLanguage() {
        return this.backingStore.get("language");
    }

    public String getSeller() {
        return this.backingStore.get("seller");
    }

    public Integer getTotalLicenseCount() {
        return this.backingStore.get("totalLicenseCount");
    }

    public Integer getUsedLicenseCount() {
        return this.backingStore.get("usedLicenseCount");
    }

    public String getVppOrganizationName() {
        return this.backingStore.get("vppOrganizationName");
    }

    /**
     * Gets the vppTokenId property value. The Vpp token ID.
     *
     * @return the vppTokenId value
     */
    public UUID getVppTokenId() {
        return this.backingStore.get("vppTokenId");
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
        writer.writeStringValue("appleId", this.getAppleId());
        writer.writeCollectionOfPrimitiveValues("genres", this.getGenres());
        writer.writeStringValue("language", this.getLanguage());
        writer.writeStringValue("seller", this.getSeller());
        writer.writeIntegerValue("totalLicenseCount", this.getTotalLicenseCount());
        writer.writeIntegerValue("usedLicenseCount", this.getUsedLicenseCount());
        writer.writeStringValue("vppOrganizationName", this.getVppOrganizationName());
        writer.writeUUIDValue("vppTokenId", this.getVppTokenId());
    }

    public void setAppleId(String value) {
        this.backingStore.set("appleId", value);
    }

    public void setGenres(List<String> value) {
        this.backingStore.set("genres", value);
    }

    public void setLanguage(String value) {
        this.backingStore.set("language", value);
    }

    public void setSeller(String value) {
        this.backingStore.set("seller", value);
    }

    public void setTotalLicenseCount(Integer value) {
        this.backingStore.set("totalLicenseCount", value);
    }

    public void setUsedLicenseCount(Integer value) {
        this.backingStore.set("usedLicenseCount", value);
    }

    public void setVppOrganizationName(String value) {
        this.backingStore.set("vppOrganizationName", value);
    }

    public void setVppTokenId(UUID value) {
        this.backingStore.set("vppTokenId", value);
    }
}
