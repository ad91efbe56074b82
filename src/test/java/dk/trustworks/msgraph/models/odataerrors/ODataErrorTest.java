package dk.trustworks.msgraph.models.odataerrors;

import com.microsoft.kiota.ApiException;
import dk.trustworks.msgraph.GraphSerialization;
import org.junit.jupiter.api.*;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static dk.trustworks.msgraph.utils.AssertionHelpers.*;
import static dk.trustworks.msgraph.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ODataError.
 * Tests decoding of Graph error bodies and the resulting exception messages.
 */
@DisplayName("ODataError Unit Tests")
class ODataErrorTest {

    private static final String NOT_FOUND_PAYLOAD = "{\"error\":{"
            + "\"code\":\"ErrorItemNotFound\","
            + "\"message\":\"The specified object was not found in the store.\","
            + "\"details\":[{\"code\":\"ItemNotFound\",\"target\":\"id\"}],"
            + "\"innerError\":{\"date\":\"2024-03-01T09:30:00\",\"request-id\":\"2f1a-44\","
            + "\"client-request-id\":\"c-77\"}}}";

    private GraphSerialization serialization;

    @BeforeEach
    void setUp() {
        serialization = jsonSerialization();
    }

    @Test
    @DisplayName("404 error body → not found, message from the payload")
    void notFound() {
        // When
        ODataError error = serialization.deserializeError(404, NOT_FOUND_PAYLOAD);

        // Then
        assertTrue(error.isNotFound());
        assertTrue(error.isClientError());
        assertFalse(error.isServerError());
        assertEquals("Graph API error 404: The specified object was not found in the store.", error.getMessage());
        assertEquals("ErrorItemNotFound", error.getError().getCode());
        assertEquals("id", error.getError().getDetails().get(0).getTarget());
    }

    @Test
    @DisplayName("inner error → request ids and offset-less date read as UTC")
    void innerError() {
        InnerError inner = serialization.deserializeError(404, NOT_FOUND_PAYLOAD).getError().getInnerError();

        assertEquals("2f1a-44", inner.getRequestId());
        assertEquals("c-77", inner.getClientRequestId());
        assertEquals(OffsetDateTime.of(2024, 3, 1, 9, 30, 0, 0, ZoneOffset.UTC), inner.getDate());
    }

    @Test
    @DisplayName("empty body → empty error, message names status and unknown code")
    void emptyBody() {
        ODataError error = serialization.deserializeError(500, "");

        assertNull(error.getError());
        assertTrue(error.isServerError());
        assertEquals("Graph API error 500 (code unknown)", error.getMessage());
    }

    @Test
    @DisplayName("error without message → message names the code")
    void errorWithoutMessage() {
        ODataError error = serialization.deserializeError(429, "{\"error\":{\"code\":\"TooManyRequests\",\"message\":\" \"}}");

        assertEquals("Graph API error 429 (code TooManyRequests)", error.getMessage());
    }

    @Test
    @DisplayName("malformed body → empty error keeping the status")
    void malformedBody() {
        ODataError error = serialization.deserializeError(502, "<html>Bad Gateway</html>");

        assertNull(error.getError());
        assertEquals(502, error.getResponseStatusCode());
    }

    @Test
    @DisplayName("401 and 403 → unauthorized")
    void unauthorized() {
        assertTrue(serialization.deserializeError(401, null).isUnauthorized());
        assertTrue(serialization.deserializeError(403, "{}").isUnauthorized());
        assertFalse(serialization.deserializeError(404, "{}").isUnauthorized());
    }

    @Test
    @DisplayName("decoded error → throwable as ApiException")
    void throwable() {
        ODataError error = serialization.deserializeError(403, "{\"error\":{\"code\":\"Forbidden\",\"message\":\"Access denied\"}}");

        ApiException thrown = assertThrows(ApiException.class, () -> {
            throw error;
        });

        assertSame(error, thrown);
        assertEquals(403, thrown.getResponseStatusCode());
    }

    @Test
    @DisplayName("constructed error → serialized as a Graph error body")
    void serialized() {
        // Given
        MainError main = new MainError();
        main.setCode("BadRequest");
        main.setMessage("Invalid filter clause");
        ODataError error = new ODataError();
        error.setError(main);

        // When
        String json = plainJsonSerialization().serializeAsString(error);

        // Then
        assertJsonEquals("{\"error\":{\"code\":\"BadRequest\",\"message\":\"Invalid filter clause\"}}", json);
    }
}
