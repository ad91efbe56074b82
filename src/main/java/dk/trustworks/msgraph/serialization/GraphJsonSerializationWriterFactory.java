package dk.trustworks.msgraph.serialization;

import com.microsoft.kiota.serialization.SerializationWriter;
import com.microsoft.kiota.serialization.SerializationWriterFactory;

import java.util.Objects;

/**
 * Creates {@link GraphJsonSerializationWriter}s for {@code application/json}.
 */
public class GraphJsonSerializationWriterFactory implements SerializationWriterFactory {

    public static final String APPLICATION_JSON = "application/json";

    @Override
    public String getValidContentType() {
        return APPLICATION_JSON;
    }

    @Override
    public SerializationWriter getSerializationWriter(String contentType) {
        Objects.requireNonNull(contentType, "contentType");
        if (!APPLICATION_JSON.equals(contentType)) {
            throw new IllegalArgumentException("expected a " + APPLICATION_JSON + " content type, got " + contentType);
        }
        return new GraphJsonSerializationWriter();
    }
}
