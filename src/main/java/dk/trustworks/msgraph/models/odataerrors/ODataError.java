package dk.trustworks.msgraph.models.odataerrors;

import com.microsoft.kiota.ApiException;
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
 * Body of a failed Graph response, raised as an {@link ApiException}.
 * <p>
 * Graph wraps every error as {@code {"error": {"code": "...", "message": "..."}}}.
 * The exception message reads {@code Graph API error <status>: <error.message>}.
 */
public class ODataError extends ApiException implements AdditionalDataHolder, BackedModel, Parsable {

    private transient BackingStore backingStore;

    public ODataError() {
        super();
        this.backingStore = BackingStoreFactorySingleton.instance.createBackingStore();
        this.setAdditionalData(new HashMap<>());
    }

    public static ODataError createFromDiscriminatorValue(ParseNode parseNode) {
        Objects.requireNonNull(parseNode, "parseNode");
        return new ODataError();
    }

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
     * Gets the error property value. The structure of this object is service-specific.
     *
     * @return the main error
     */
    public MainError getError() {
        return this.backingStore.get("error");
    }

    @Override
    public Map<String, Consumer<ParseNode>> getFieldDeserializers() {
        HashMap<String, Consumer<ParseNode>> deserializerMap = new HashMap<>(1);
        deserializerMap.put("error", n -> this.setError(n.getObjectValue(MainError::createFromDiscriminatorValue)));
        return deserializerMap;
    }

    @Override
    public String getMessage() {
        MainError error = getError();
        if (error != null && error.getMessage() != null && !error.getMessage().isBlank()) {
            return String.format("Graph API error %d: %s", getResponseStatusCode(), error.getMessage());
        }
        String code = error == null || error.getCode() == null ? "unknown" : error.getCode();
        return String.format("Graph API error %d (code %s)", getResponseStatusCode(), code);
    }

    /**
     * Determines if the error indicates the resource was not found.
     */
    public boolean isNotFound() {
        return getResponseStatusCode() == 404;
    }

    /**
     * Determines if the error indicates an authorization issue.
     */
    public boolean isUnauthorized() {
        return getResponseStatusCode() == 401 || getResponseStatusCode() == 403;
    }

    public boolean isClientError() {
        return getResponseStatusCode() >= 400 && getResponseStatusCode() < 500;
    }

    public boolean isServerError() {
        return getResponseStatusCode() >= 500;
    }

    @Override
    public void serialize(SerializationWriter writer) {
        Objects.requireNonNull(writer, "writer");
        writer.writeObjectValue("error", this.getError());
        writer.writeAdditionalData(this.getAdditionalData());
    }

    public void setAdditionalData(Map<String, Object> value) {
        this.backingStore.set("additionalData", value);
    }

    public void setBackingStore(BackingStore value) {
        this.backingStore = Objects.requireNonNull(value, "value");
    }

    @Override
    public void setResponseStatusCode(int value) {
        super.setResponseStatusCode(value);
    }

    public void setError(MainError value) {
        this.backingStore.set("error", value);
    }
}
