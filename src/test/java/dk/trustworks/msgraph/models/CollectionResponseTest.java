package dk.trustworks.msgraph.models;

import dk.trustworks.msgraph.GraphSerialization;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Map;

import static dk.trustworks.msgraph.utils.AssertionHelpers.*;
import static dk.trustworks.msgraph.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for paged collection responses and open extensions.
 */
@DisplayName("Collection Response Tests")
class CollectionResponseTest {

    private GraphSerialization serialization;

    @BeforeEach
    void setUp() {
        serialization = jsonSerialization();
    }

    @Test
    @DisplayName("message page → count, next link and per-element types")
    void messagePage() {
        // Given
        String payload = "{\"@odata.context\":\"https://graph.microsoft.com/v1.0/$metadata#users('u-1')/messages\","
                + "\"@odata.count\":5000000000,"
                + "\"@odata.nextLink\":\"https://graph.microsoft.com/v1.0/me/messages?$skip=10\","
                + "\"value\":[{\"id\":\"m-1\",\"subject\":\"Plain\"},"
                + "{\"@odata.type\":\"#microsoft.graph.eventMessageResponse\",\"id\":\"m-2\",\"responseType\":\"accepted\"}]}";

        // When
        MessageCollectionResponse page =
                serialization.deserialize(payload, MessageCollectionResponse::createFromDiscriminatorValue);

        // Then
        assertEquals(5000000000L, page.getOdataCount());
        assertEquals("https://graph.microsoft.com/v1.0/me/messages?$skip=10", page.getOdataNextLink());
        assertEquals("https://graph.microsoft.com/v1.0/$metadata#users('u-1')/messages",
                page.getAdditionalData().get("@odata.context"));
        List<Message> messages = page.getValue();
        assertEquals(Message.class, messages.get(0).getClass());
        EventMessageResponse response = assertInstanceOf(EventMessageResponse.class, messages.get(1));
        assertEquals(ResponseType.ACCEPTED, response.getResponseType());
    }

    @Test
    @DisplayName("last page → no next link")
    void lastPage() {
        EventCollectionResponse page = serialization.deserialize("{\"value\":[]}",
                EventCollectionResponse::createFromDiscriminatorValue);

        assertNull(page.getOdataNextLink());
        assertTrue(page.getValue().isEmpty());
    }

    @Test
    @DisplayName("new calendar page → written with its annotations")
    void calendarPage_serialized() {
        // Given
        Calendar calendar = new Calendar();
        calendar.setName("Team");
        CalendarCollectionResponse page = new CalendarCollectionResponse();
        page.setOdataCount(1L);
        page.setValue(List.of(calendar));

        // When
        String json = serialization.serializeAsString(page);

        // Then
        assertJsonEquals("{\"@odata.count\":1,\"value\":[{\"name\":\"Team\"}]}",
                json);
    }

    @Test
    @DisplayName("open extension → untyped members kept in additional data")
    void openExtension() {
        // Given
        String payload = "{\"extensions\":[{\"@odata.type\":\"#microsoft.graph.openTypeExtension\","
                + "\"id\":\"Com.Contoso.Referral\",\"extensionName\":\"Com.Contoso.Referral\","
                + "\"companyName\":\"Wingtip Toys\",\"dealValue\":500050,\"expirationDate\":\"2015-12-03T10:00:00.000Z\","
                + "\"topPicks\":[\"Apple\",\"Banana\"],\"owner\":{\"alias\":\"jdoe\"}}]}";

        // When
        Message message = serialization.deserialize(payload, Message::createFromDiscriminatorValue);

        // Then
        OpenTypeExtension extension = assertInstanceOf(OpenTypeExtension.class, message.getExtensions().get(0));
        assertEquals("Com.Contoso.Referral", extension.getExtensionName());
        Map<String, Object> data = extension.getAdditionalData();
        assertEquals("Wingtip Toys", data.get("companyName"));
        assertEquals("2015-12-03T10:00:00.000Z", data.get("expirationDate"));
        assertTrue(data.keySet().containsAll(List.of("dealValue", "topPicks", "owner")), data.keySet().toString());
    }

    @Test
    @DisplayName("open extension with new members → members written after the properties")
    void openExtension_serialized() {
        // Given
        OpenTypeExtension extension = new OpenTypeExtension();
        extension.setExtensionName("Com.Contoso.Referral");
        extension.getAdditionalData().put("companyName", "Wingtip Toys");

        // When
        String json = serialization.serializeAsString(extension);

        // Then
        assertJsonEquals("{\"@odata.type\":\"#microsoft.graph.openTypeExtension\","
                + "\"extensionName\":\"Com.Contoso.Referral\",\"companyName\":\"Wingtip Toys\"}", json);
    }
}
