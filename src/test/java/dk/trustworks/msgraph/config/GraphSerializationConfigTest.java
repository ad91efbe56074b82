package dk.trustworks.msgraph.config;

import dk.trustworks.msgraph.GraphSerialization;
import dk.trustworks.msgraph.models.ItemBody;
import dk.trustworks.msgraph.serialization.GraphJsonSerializationWriterFactory;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for GraphSerializationConfig.
 * Tests defaults, overrides and normalization of the configured content type.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("GraphSerializationConfig Unit Tests")
class GraphSerializationConfigTest {

    @Mock
    Config config;

    @Test
    @DisplayName("nothing configured → defaults")
    void nothingConfigured_defaults() {
        // When
        GraphSerializationConfig settings = GraphSerializationConfig.from(config);

        // Then
        assertEquals(GraphJsonSerializationWriterFactory.APPLICATION_JSON, settings.getContentType());
        assertTrue(settings.isBackingStoreEnabled());
        assertFalse(settings.isIndentOutput());
    }

    @Test
    @DisplayName("every key configured → values used, content type parameters stripped")
    void everythingConfigured() {
        // Given
        when(config.getOptionalValue(GraphSerializationConfig.CONTENT_TYPE, String.class))
                .thenReturn(Optional.of("Application/JSON; charset=utf-8"));
        when(config.getOptionalValue(GraphSerializationConfig.BACKING_STORE_ENABLED, Boolean.class))
                .thenReturn(Optional.of(false));
        when(config.getOptionalValue(GraphSerializationConfig.JSON_INDENT_OUTPUT, Boolean.class))
                .thenReturn(Optional.of(true));

        // When
        GraphSerializationConfig settings = GraphSerializationConfig.from(config);

        // Then
        assertEquals("application/json", settings.getContentType());
        assertFalse(settings.isBackingStoreEnabled());
        assertTrue(settings.isIndentOutput());
        verify(config).getOptionalValue(GraphSerializationConfig.CONTENT_TYPE, String.class);
    }

    @Test
    @DisplayName("blank content type → IllegalArgumentException")
    void blankContentType_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new GraphSerializationConfig(" ", true, false));
    }

    @Test
    @DisplayName("application config → bundled defaults")
    void load_usesBundledDefaults() {
        GraphSerializationConfig settings = GraphSerializationConfig.load();

        assertEquals(GraphJsonSerializationWriterFactory.APPLICATION_JSON, settings.getContentType());
        assertTrue(settings.isBackingStoreEnabled());
    }

    @Test
    @DisplayName("indented output configured → serialized JSON spans lines")
    void indentOutput_appliedBySerialization() {
        GraphSerialization serialization =
                new GraphSerialization(new GraphSerializationConfig(GraphJsonSerializationWriterFactory.APPLICATION_JSON, false, true));
        ItemBody body = new ItemBody();
        body.setContent("x");

        assertTrue(serialization.serializeAsString(body).contains("\n"));
    }
}
