package dk.trustworks.msgraph;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.microsoft.kiota.serialization.JsonParseNodeFactory;
import com.microsoft.kiota.serialization.Parsable;
import com.microsoft.kiota.serialization.ParsableFactory;
import com.microsoft.kiota.serialization.ParseNode;
import com.microsoft.kiota.serialization.ParseNodeFactory;
import com.microsoft.kiota.serialization.ParseNodeFactoryRegistry;
import com.microsoft.kiota.serialization.SerializationWriter;
import com.microsoft.kiota.serialization.SerializationWriterFactory;
import com.microsoft.kiota.serialization.SerializationWriterFactoryRegistry;
import com.microsoft.kiota.store.BackingStoreParseNodeFactory;
import com.microsoft.kiota.store.BackingStoreSerializationWriterProxyFactory;
import dk.trustworks.msgraph.config.GraphSerializationConfig;
import dk.trustworks.msgraph.models.odataerrors.ODataError;
import dk.trustworks.msgraph.serialization.GraphJsonSerializationWriterFactory;
import lombok.extern.jbosslog.JBossLog;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Entry point for turning Graph models into payloads and back.
 *
 * <p>The default instance is configured from MicroProfile Config (see
 * {@link GraphSerializationConfig}) and registers the Kiota JSON factories, wrapped in the
 * Kiota backing store proxies unless disabled. With the proxies, a decoded model that is
 * modified and written again only carries the modified properties.
 */
@JBossLog
public class GraphSerialization {

    private static final ObjectMapper PRETTY_PRINTER = new ObjectMapper()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private static final Pattern VENDOR_PREFIX = Pattern.compile("[^/]+\\+");

    private static volatile GraphSerialization defaultInstance;

    private final ParseNodeFactoryRegistry parseNodeFactories;
    private final SerializationWriterFactoryRegistry serializationWriterFactories;
    private final String contentType;
    private final boolean indentOutput;

    public GraphSerialization(GraphSerializationConfig config) {
        this(defaultParseNodeFactories(config), defaultSerializationWriterFactories(config),
            config.getContentType(), config.isIndentOutput());
    }

    /**
     * @throws IllegalArgumentException if either registry has no factory for the content type
     */
    public GraphSerialization(ParseNodeFactoryRegistry parseNodeFactories,
                              SerializationWriterFactoryRegistry serializationWriterFactories,
                              String contentType) {
        this(parseNodeFactories, serializationWriterFactories, contentType, false);
    }

    private GraphSerialization(ParseNodeFactoryRegistry parseNodeFactories,
                               SerializationWriterFactoryRegistry serializationWriterFactories,
                               String contentType,
                               boolean indentOutput) {
        this.parseNodeFactories = Objects.requireNonNull(parseNodeFactories, "parseNodeFactories");
        this.serializationWriterFactories = Objects.requireNonNull(serializationWriterFactories, "serializationWriterFactories");
        this.contentType = Objects.requireNonNull(contentType, "contentType");
        this.indentOutput = indentOutput;

        if (!serves(parseNodeFactories.contentTypeAssociatedFactories.keySet(), contentType)) {
            throw new IllegalArgumentException("No parse node factory registered for " + contentType);
        }
        if (!serves(serializationWriterFactories.contentTypeAssociatedFactories.keySet(), contentType)) {
            throw new IllegalArgumentException("No serialization writer factory registered for " + contentType);
        }
    }

    /**
     * @return the shared instance built from the application configuration
     */
    public static GraphSerialization getDefault() {
        GraphSerialization instance = defaultInstance;
        if (instance == null) {
            synchronized (GraphSerialization.class) {
                instance = defaultInstance;
                if (instance == null) {
                    instance = new GraphSerialization(GraphSerializationConfig.load());
                    defaultInstance = instance;
                    log.infof("Initialized Graph serialization for %s", instance.contentType);
                }
            }
        }
        return instance;
    }

    public String getContentType() {
        return contentType;
    }

    public ParseNodeFactoryRegistry getParseNodeFactories() {
        return parseNodeFactories;
    }

    public SerializationWriterFactoryRegistry getSerializationWriterFactories() {
        return serializationWriterFactories;
    }

    /**
     * Writes a model as a root object.
     */
    public byte[] serialize(Parsable value) {
        Objects.requireNonNull(value, "value");
        try (SerializationWriter writer = serializationWriterFactories.getSerializationWriter(contentType)) {
            writer.writeObjectValue(null, value);
            return content(writer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + value.getClass().getSimpleName(), e);
        }
    }

    public String serializeAsString(Parsable value) {
        return new String(serialize(value), StandardCharsets.UTF_8);
    }

    /**
     * Writes models as a root array.
     */
    public <T extends Parsable> byte[] serializeCollection(Iterable<T> values) {
        Objects.requireNonNull(values, "values");
        try (SerializationWriter writer = serializationWriterFactories.getSerializationWriter(contentType)) {
            writer.writeCollectionOfObjectValues(null, values);
            return content(writer);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write collection", e);
        }
    }

    public <T extends Parsable> String serializeCollectionAsString(Iterable<T> values) {
        return new String(serializeCollection(values), StandardCharsets.UTF_8);
    }

    /**
     * Decodes a root object, letting the factory pick the concrete type from the payload.
     * Malformed payloads fail with the parser's runtime exception.
     */
    public <T extends Parsable> T deserialize(InputStream content, ParsableFactory<T> factory) {
        return rootNode(content).getObjectValue(factory);
    }

    public <T extends Parsable> T deserialize(String payload, ParsableFactory<T> factory) {
        Objects.requireNonNull(payload, "payload");
        return deserialize(new ByteArrayInputStream(payload.getBytes(StandardCharsets.UTF_8)), factory);
    }

    public <T extends Parsable> List<T> deserializeCollection(InputStream content, ParsableFactory<T> factory) {
        return rootNode(content).getCollectionOfObjectValues(factory);
    }

    public <T extends Parsable> List<T> deserializeCollection(String payload, ParsableFactory<T> factory) {
        Objects.requireNonNull(payload, "payload");
        return deserializeCollection(new ByteArrayInputStream(payload.getBytes(StandardCharsets.UTF_8)), factory);
    }

    /**
     * Decodes the body of a failed Graph response.
     *
     * @param responseStatusCode the HTTP status of the response
     * @param payload            the response body, possibly empty
     * @return the error, never {@code null}
     */
    public ODataError deserializeError(int responseStatusCode, String payload) {
        ODataError error = null;
        if (payload != null && !payload.isBlank()) {
            try {
                error = deserialize(payload, ODataError::createFromDiscriminatorValue);
            } catch (RuntimeException e) {
                log.warnf(e, "Failed to decode Graph error response body (status %d)", responseStatusCode);
            }
        }
        if (error == null) {
            error = new ODataError();
        }
        error.setResponseStatusCode(responseStatusCode);
        return error;
    }

    private byte[] content(SerializationWriter writer) throws IOException {
        byte[] content;
        try (InputStream serialized = writer.getSerializedContent()) {
            content = serialized.readAllBytes();
        }
        if (!indentOutput) {
            return content;
        }
        return PRETTY_PRINTER.writerWithDefaultPrettyPrinter().writeValueAsBytes(PRETTY_PRINTER.readTree(content));
    }

    // The registries fall back from a vendor type such as application/vnd.ms-graph+json to application/json
    private static boolean serves(Set<String> registered, String contentType) {
        return registered.contains(contentType)
            || registered.contains(VENDOR_PREFIX.matcher(contentType).replaceAll(""));
    }

    private ParseNode rootNode(InputStream content) {
        Objects.requireNonNull(content, "content");
        return parseNodeFactories.getParseNode(contentType, content);
    }

    private static ParseNodeFactoryRegistry defaultParseNodeFactories(GraphSerializationConfig config) {
        ParseNodeFactory json = new JsonParseNodeFactory();
        ParseNodeFactoryRegistry registry = new ParseNodeFactoryRegistry();
        registry.contentTypeAssociatedFactories.put(json.getValidContentType(),
            config.isBackingStoreEnabled() ? new BackingStoreParseNodeFactory(json) : json);
        return registry;
    }

    private static SerializationWriterFactoryRegistry defaultSerializationWriterFactories(GraphSerializationConfig config) {
        SerializationWriterFactory json = new GraphJsonSerializationWriterFactory();
        SerializationWriterFactoryRegistry registry = new SerializationWriterFactoryRegistry();
        registry.contentTypeAssociatedFactories.put(json.getValidContentType(),
            config.isBackingStoreEnabled() ? new BackingStoreSerializationWriterProxyFactory(json) : json);
        return registry;
    }
}
