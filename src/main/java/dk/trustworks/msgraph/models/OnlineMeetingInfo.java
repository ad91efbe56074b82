package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.AdditionalDataHolder;
import com.microsoft.kiota.serialization.Parsable;
import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.SerializationWriter;
import com.microsoft.kiota.store.BackedModel;
import com.microsoft.kiota.store.BackingStore;
import com.microsoft.kiota.store.BackingStoreFactorySingleton;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Details for an attendee to join an online meeting.
 */
public class OnlineMeetingInfo implements AdditionalDataHolder, BackedModel, Parsable {

    /**
     * Holds the property values of this model.
     */
    protected BackingStore backingStore;

    public OnlineMeetingInfo() {
        this.backingStore = BackingStoreFactorySingleton.instance.createBackingStore();
        this.setAdditionalData(new HashMap<>());
    }

    /**
     * Creates a new instance of the appropriate class based on the {@code @odata.type} of the node.
     *
     * @param parseNode the node to read the discriminator from
     * @return a {@link OnlineMeetingInfo}
     */
    public static OnlineMeetingInfo createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new OnlineMeetingInfo();
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

    public String getConferenceId() {
        return this.backingStore.get("conferenceId");
    }

    /**
     * The deserialization information for the current model.
     *
     * @return the field deserializers keyed by wire name
     */
    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(7);
        deserializerMap.put("@odata.type", n -> this.setOdataType(n.getStringValue()));
        deserializerMap.put("conferenceId", n -> this.setConferenceId(n.getStringValue()));
        deserializerMap.put("joinUrl", n -> this.setJoinUrl(n.getStringValue()));
        deserializerMap.put("phones", n -> this.setPhones(n.getCollectionOfObjectValues(Phone::createFromDiscriminatorValue)));
        deserializerMap.put("quickDial", n -> this.setQuickDial(n.getStringValue()));
        deserializerMap.put("tollFreeNumbers", n -> this.setTollFreeNumbers(n.getCollectionOfPrimitiveValues(String.class)));
        deserializerMap.put("tollNumber", n -> this.setTollNumber(n.getStringValue()));
        return deserializerMap;
    }

    public String getJoinUrl() {
        return this.backingStore.get("joinUrl");
    }

    public String getOdataType() {
        return this.backingStore.get("@odata.type");
    }

    public List<Phone> getPhones() {
        return this.backingStore.get("phones");
    }

    public String getQuickDial() {
        return this.backingStore.get("quickDial");
    }

    public List<String> getTollFreeNumbers() {
        return this.backingStore.get("tollFreeNumbers");
    }

    public String getTollNumber() {
        return this.backingStore.get("tollNumber");
    }

    /**
     * Serializes information the current object.
     *
     * @param writer the writer to serialize into
     */
    @Override
    public void serialize(SerializationWriter writer) {
        Objects.requireNonNull(writer, "writer");
        writer.writeStringValue("conferenceId", this.getConferenceId());
        writer.writeStringValue("joinUrl", this.getJoinUrl());
        writer.writeCollectionOfObjectValues("phones", this.getPhones());
        writer.writeStringValue("quickDial", this.getQuickDial());
        writer.writeCollectionOfPrimitiveValues("tollFreeNumbers", this.getTollFreeNumbers());
        writer.writeStringValue("tollNumber", this.getTollNumber());
        writer.writeStringValue("@odata.type", this.getOdataType());
        writer.writeAdditionalData(this.getAdditionalData());
    }

    public void setAdditionalData(Map<String, Object> value) {
        this.backingStore.set("additionalData", value);
    }

    public void setBackingStore(BackingStore value) {
        this.backingStore = Objects.requireNonNull(value, "value");
    }

    public void setConferenceId(String value) {
        this.backingStore.set("conferenceId", value);
    }

    public void setJoinUrl(String value) {
        this.backingStore.set("joinUrl", value);
    }

    public void setOdataType(String value) {
        this.backingStore.set("@odata.type", value);
    }

    public void setPhones(List<Phone> value) {
        this.backingStore.set("phones", value);
    }

    public void setQuickDial(String value) {
        this.backingStore.set("quickDial", value);
    }

    public void setTollFreeNumbers(List<String> value) {
        this.backingStore.set("tollFreeNumbers", value);
    }

    public void setTollNumber(String value) {
        this.backingStore.set("tollNumber", value);
    }
}
