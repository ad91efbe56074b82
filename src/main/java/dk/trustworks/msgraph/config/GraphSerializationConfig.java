package dk.trustworks.msgraph.config;

import dk.trustworks.msgraph.serialization.GraphJsonSerializationWriterFactory;
import lombok.Getter;
import lombok.extern.jbosslog.JBossLog;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;

import java.util.Locale;

/**
 * Serialization settings read from MicroProfile Config.
 *
 * <pre>
 * msgraph.serialization.content-type=application/json
 * msgraph.serialization.backing-store.enabled=true
 * msgraph.serialization.json.indent-output=false
 * </pre>
 */
@JBossLog
@Getter
public class GraphSerializationConfig {

    public static final String CONTENT_TYPE = "msgraph.serialization.content-type";
    public static final String BACKING_STORE_ENABLED = "msgraph.serialization.backing-store.enabled";
    public static final String JSON_INDENT_OUTPUT = "msgraph.serialization.json.indent-output";

    private final String contentType;

    // If true, payloads are read and written through the change-tracking backing store proxies
    private final boolean backingStoreEnabled;

    private final boolean indentOutput;

    public GraphSerializationConfig(String contentType, boolean backingStoreEnabled, boolean indentOutput) {
        this.contentType = withoutParameters(contentType);
        this.backingStoreEnabled = backingStoreEnabled;
        this.indentOutput = indentOutput;
    }

    /**
     * Settings with every property at its default.
     */
    public static GraphSerializationConfig defaults() {
        return new GraphSerializationConfig(GraphJsonSerializationWriterFactory.APPLICATION_JSON, true, false);
    }

    /**
     * Reads the settings from the application's MicroProfile Config.
     */
    public static GraphSerializationConfig load() {
        return from(ConfigProvider.getConfig());
    }

    public static GraphSerializationConfig from(Config config) {
        GraphSerializationConfig settings = new GraphSerializationConfig(
            config.getOptionalValue(CONTENT_TYPE, String.class).orElse(GraphJsonSerializationWriterFactory.APPLICATION_JSON),
            config.getOptionalValue(BACKING_STORE_ENABLED, Boolean.class).orElse(true),
            config.getOptionalValue(JSON_INDENT_OUTPUT, Boolean.class).orElse(false));
        log.debugf("Graph serialization settings: contentType=%s, backingStore=%s, indentOutput=%s",
            settings.contentType, settings.backingStoreEnabled, settings.indentOutput);
        return settings;
    }

    /**
     * Lower-cases a media type and drops its parameters, e.g. {@code Application/JSON; charset=utf-8}
     * becomes {@code application/json}.
     *
     * @throws IllegalArgumentException if the value is blank
     */
    static String withoutParameters(String contentType) {
        if (contentType == null || contentType.isBlank()) {
            throw new IllegalArgumentException("Content type must not be blank");
        }
        int separator = contentType.indexOf(';');
        String mediaType = separator < 0 ? contentType : contentType.substring(0, separator);
        if (mediaType.isBlank()) {
            throw new IllegalArgumentException("Content type must not be blank: " + contentType);
        }
        return mediaType.trim().toLowerCase(Locale.ROOT);
    }
}
