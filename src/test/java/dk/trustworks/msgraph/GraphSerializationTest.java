package dk.trustworks.msgraph;

import com.fasterxml.jackson.databind.JsonNode;
import com.microsoft.kiota.serialization.JsonParseNodeFactory;
import com.microsoft.kiota.serialization.ParseNodeFactoryRegistry;
import com.microsoft.kiota.serialization.SerializationWriterFactoryRegistry;
import dk.trustworks.msgraph.models.BodyType;
import dk.trustworks.msgraph.models.Event;
import dk.trustworks.msgraph.models.EventMessageRequest;
import dk.trustworks.msgraph.models.Importance;
import dk.trustworks.msgraph.models.Message;
import dk.trustworks.msgraph.serialization.GraphJsonSerializationWriterFactory;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static dk.trustworks.msgraph.utils.AssertionHelpers.*;
import static dk.trustworks.msgraph.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for GraphSerialization.
 * Tests round trips, PATCH-style output through the backing store and collection payloads.
 */
@DisplayName("GraphSerialization Unit Tests")
class GraphSerializationTest {

    private static final String MESSAGE_PAYLOAD = "{"
            + "\"id\":\"AAMkAGI2TG93AAA=\","
            + "\"subject\":\"Quarterly review\","
            + "\"isRead\":false,"
            + "\"importance\":\"high\","
            + "\"receivedDateTime\":\"2024-03-01T09:30:00Z\","
            + "\"body\":{\"contentType\":\"html\",\"content\":\"<p>Agenda attached</p>\"},"
            + "\"toRecipients\":[{\"emailAddress\":{\"name\":\"Alice\",\"address\":\"alice@contoso.com\"}}]"
            + "}";

    private GraphSerialization serialization;

    @BeforeEach
    void setUp() {
        serialization = jsonSerialization();
    }

    // =========================================================================
    // ROUND TRIP Tests
    // =========================================================================

    @Nested
    @DisplayName("Round Trips")
    class RoundTripTests {

        @Test
        @DisplayName("serialize then deserialize → every set property survives")
        void message_roundTrip() {
            // Given
            Message original = message().to("bob@contoso.com").build();

            // When
            String json = serialization.serializeAsString(original);
            Message decoded = serialization.deserialize(json, Message::createFromDiscriminatorValue);

            // Then
            assertEquals(original.getId(), decoded.getId());
            assertEquals(original.getSubject(), decoded.getSubject());
            assertEquals(original.getImportance(), decoded.getImportance());
            assertEquals(original.getIsRead(), decoded.getIsRead());
            assertEquals(original.getReceivedDateTime(), decoded.getReceivedDateTime());
            assertEquals(original.getBody().getContent(), decoded.getBody().getContent());
            assertEquals(original.getBody().getContentType(), decoded.getBody().getContentType());
            assertEquals(2, decoded.getToRecipients().size());
            assertEquals("bob@contoso.com", decoded.getToRecipients().get(1).getEmailAddress().getAddress());
            assertEquals("#microsoft.graph.message", decoded.getOdataType());
        }

        @Test
        @DisplayName("unknown members → written back unchanged")
        void additionalData_roundTrip() {
            // Given
            String payload = "{\"@odata.etag\":\"W/\\\"CQAAABYAAAB\\\"\",\"subject\":\"Quarterly review\"}";
            Message decoded = plainJsonSerialization().deserialize(payload, Message::createFromDiscriminatorValue);

            // When
            String json = plainJsonSerialization().serializeAsString(decoded);

            // Then
            assertTrue(decoded.getAdditionalData().containsKey("@odata.etag"));
            assertEquals("W/\"CQAAABYAAAB\"", readJson(json).get("@odata.etag").asText());
        }

        @Test
        @DisplayName("collection → JSON array and back, discriminator per element")
        void collection_roundTrip() {
            // Given
            EventMessageRequest request = new EventMessageRequest();
            request.setSubject("Invitation");
            List<Message> messages = List.of(message().subject("Plain").build(), request);

            // When
            String json = serialization.serializeCollectionAsString(messages);
            List<Message> decoded = serialization.deserializeCollection(json, Message::createFromDiscriminatorValue);

            // Then
            assertTrue(readJson(json).isArray());
            assertEquals(2, decoded.size());
            assertEquals(Message.class, decoded.get(0).getClass());
            assertInstanceOf(EventMessageRequest.class, decoded.get(1));
            assertEquals("Invitation", decoded.get(1).getSubject());
        }

        @Test
        @DisplayName("null element in a collection → written as null")
        void nullElement_writtenAsNull() {
            // Given
            Message message = new Message();
            message.setToRecipients(new ArrayList<>(Arrays.asList(recipient("alice@contoso.com"), null)));

            // When
            JsonNode recipients = readJson(plainJsonSerialization().serializeAsString(message)).get("toRecipients");

            // Then
            assertEquals(2, recipients.size());
            assertEquals("alice@contoso.com", recipients.get(0).get("emailAddress").get("address").asText());
            assertTrue(recipients.get(1).isNull());
        }

        @Test
        @DisplayName("malformed field → decode fails")
        void malformedField_failsDecode() {
            assertThrows(RuntimeException.class,
                    () -> serialization.deserialize("{\"subject\":\"ok\",\"receivedDateTime\":\"yesterday\"}",
                            Message::createFromDiscriminatorValue));
        }

        @Test
        @DisplayName("malformed JSON → decode fails")
        void malformedJson_failsDecode() {
            assertThrows(RuntimeException.class,
                    () -> serialization.deserialize("{\"subject\":", Message::createFromDiscriminatorValue));
        }
    }

    // =========================================================================
    // BACKING STORE Tests
    // =========================================================================

    @Nested
    @DisplayName("Backing Store Output")
    class BackingStoreOutputTests {

        @Test
        @DisplayName("decoded model → reports no changes and serializes as {}")
        void decodedModel_serializesEmpty() {
            // Given
            Message decoded = serialization.deserialize(MESSAGE_PAYLOAD, Message::createFromDiscriminatorValue);

            // Then
            assertNoChangedValues(decoded);
            assertJsonEquals("{}", serialization.serializeAsString(decoded));
        }

        @Test
        @DisplayName("one setter after decode → only that property is written")
        void singleChange_writesOnlyThatProperty() {
            // Given
            Message decoded = serialization.deserialize(MESSAGE_PAYLOAD, Message::createFromDiscriminatorValue);

            // When
            decoded.setSubject("Quarterly review (moved)");

            // Then
            assertJsonEquals("{\"subject\":\"Quarterly review (moved)\"}", serialization.serializeAsString(decoded));
        }

        @Test
        @DisplayName("property cleared after decode → written as explicit null")
        void clearedProperty_writesExplicitNull() {
            // Given
            Message decoded = serialization.deserialize(MESSAGE_PAYLOAD, Message::createFromDiscriminatorValue);

            // When
            decoded.setImportance(Importance.LOW);
            decoded.setIsRead(null);

            // Then
            assertJsonEquals("{\"importance\":\"low\",\"isRead\":null}", serialization.serializeAsString(decoded));
        }

        @Test
        @DisplayName("nested model changed after decode → nested object written")
        void nestedChange_writesNestedObject() {
            // Given
            Message decoded = serialization.deserialize(MESSAGE_PAYLOAD, Message::createFromDiscriminatorValue);

            // When
            decoded.getBody().setContent("<p>New agenda</p>");
            String json = serialization.serializeAsString(decoded);

            // Then
            assertEquals(1, readJson(json).size(), json);
            assertEquals("<p>New agenda</p>", readJson(json).get("body").get("content").asText());
        }

        @Test
        @DisplayName("collection grown in place after decode → whole collection written")
        void grownCollection_writesExistingElements() {
            // Given
            Message decoded = serialization.deserialize(
                    "{\"toRecipients\":[{\"emailAddress\":{\"address\":\"alice@contoso.com\"}}]}",
                    Message::createFromDiscriminatorValue);

            // When
            decoded.getToRecipients().add(recipient("bob@contoso.com"));
            JsonNode recipients = readJson(serialization.serializeAsString(decoded)).get("toRecipients");

            // Then
            assertNotNull(recipients);
            assertEquals(2, recipients.size());
            assertEquals("alice@contoso.com", recipients.get(0).get("emailAddress").get("address").asText());
            assertEquals("bob@contoso.com", recipients.get(1).get("emailAddress").get("address").asText());
        }

        @Test
        @DisplayName("serialized model → marked unchanged afterwards")
        void serializedModel_isUnchangedAfterwards() {
            // Given
            Event event = event().build();
            String first = serialization.serializeAsString(event);

            // When
            String second = serialization.serializeAsString(event);

            // Then
            assertEquals("Sprint planning", readJson(first).get("subject").asText());
            assertJsonEquals("{}", second);
        }

        @Test
        @DisplayName("backing store disabled → decoded model written in full")
        void backingStoreDisabled_writesEverything() {
            // Given
            GraphSerialization plain = plainJsonSerialization();
            Message decoded = plain.deserialize(MESSAGE_PAYLOAD, Message::createFromDiscriminatorValue);

            // When
            String json = plain.serializeAsString(decoded);

            // Then
            assertEquals("Quarterly review", readJson(json).get("subject").asText());
            assertEquals("html", readJson(json).get("body").get("contentType").asText());
        }
    }

    // =========================================================================
    // CONFIGURATION Tests
    // =========================================================================

    @Nested
    @DisplayName("Configuration")
    class ConfigurationTests {

        @Test
        @DisplayName("vendor content type → served by the JSON factories")
        void vendorContentType_servedByJson() {
            // Given
            ParseNodeFactoryRegistry parsers = new ParseNodeFactoryRegistry();
            parsers.contentTypeAssociatedFactories.put("application/json", new JsonParseNodeFactory());
            SerializationWriterFactoryRegistry writers = new SerializationWriterFactoryRegistry();
            writers.contentTypeAssociatedFactories.put("application/json", new GraphJsonSerializationWriterFactory());

            // When
            GraphSerialization vendor = new GraphSerialization(parsers, writers, "application/vnd.ms-graph+json");
            Message decoded = vendor.deserialize("{\"subject\":\"x\"}", Message::createFromDiscriminatorValue);

            // Then
            assertEquals("x", decoded.getSubject());
        }

        @Test
        @DisplayName("content type nobody serves → IllegalArgumentException at construction")
        void unservedContentType_rejected() {
            ParseNodeFactoryRegistry parsers = new ParseNodeFactoryRegistry();
            parsers.contentTypeAssociatedFactories.put("application/json", new JsonParseNodeFactory());

            assertThrows(IllegalArgumentException.class,
                    () -> new GraphSerialization(parsers, new SerializationWriterFactoryRegistry(),
                            GraphJsonSerializationWriterFactory.APPLICATION_JSON));
        }

        @Test
        @DisplayName("default instance → shared and JSON based")
        void defaultInstance_isShared() {
            GraphSerialization instance = GraphSerialization.getDefault();

            assertSame(instance, GraphSerialization.getDefault());
            assertEquals(GraphJsonSerializationWriterFactory.APPLICATION_JSON, instance.getContentType());
        }

        @Test
        @DisplayName("serialize with body type → label written")
        void bodyType_writtenAsLabel() {
            Message message = message().body("plain", BodyType.TEXT).build();

            String json = serialization.serializeAsString(message);

            assertEquals("text", readJson(json).get("body").get("contentType").asText());
        }
    }
}
