package dk.trustworks.msgraph.models;

import dk.trustworks.msgraph.GraphSerialization;
import org.junit.jupiter.api.*;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static dk.trustworks.msgraph.utils.AssertionHelpers.*;
import static dk.trustworks.msgraph.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the drive facets: storage quota and photo metadata.
 */
@DisplayName("Drive Facet Tests")
class DriveFacetsTest {

    private GraphSerialization serialization;

    @BeforeEach
    void setUp() {
        serialization = jsonSerialization();
    }

    @Test
    @DisplayName("quota above 32 bits → longs and nested plan decoded")
    void quota() {
        // Given
        String payload = "{\"total\":1099511627776,\"used\":53687091200,\"remaining\":1045824536576,"
                + "\"deleted\":0,\"state\":\"normal\",\"storagePlanInformation\":{\"upgradeAvailable\":true}}";

        // When
        Quota quota = serialization.deserialize(payload, Quota::createFromDiscriminatorValue);

        // Then
        assertEquals(1099511627776L, quota.getTotal());
        assertEquals(53687091200L, quota.getUsed());
        assertEquals(0L, quota.getDeleted());
        assertEquals("normal", quota.getState());
        assertTrue(quota.getStoragePlanInformation().getUpgradeAvailable());
    }

    @Test
    @DisplayName("quota without storage plan → nested facet left null")
    void quotaWithoutPlan() {
        Quota quota = serialization.deserialize("{\"used\":1024}", Quota::createFromDiscriminatorValue);

        assertEquals(1024L, quota.getUsed());
        assertNull(quota.getStoragePlanInformation());
        assertNull(quota.getTotal());
    }

    @Test
    @DisplayName("photo metadata → numbers and capture time survive a round trip")
    void photo_roundTrip() {
        // Given
        Photo photo = new Photo();
        photo.setCameraMake("Canon");
        photo.setFNumber(2.8);
        photo.setIso(400);
        photo.setTakenDateTime(OffsetDateTime.of(2023, 7, 14, 18, 5, 0, 0, ZoneOffset.ofHours(2)));

        // When
        String json = serialization.serializeAsString(photo);
        Photo decoded = serialization.deserialize(json, Photo::createFromDiscriminatorValue);

        // Then
        assertEquals("2023-07-14T18:05:00+02:00", readJson(json).get("takenDateTime").asText());
        assertEquals("Canon", decoded.getCameraMake());
        assertEquals(2.8, decoded.getFNumber());
        assertEquals(400, decoded.getIso());
        assertEquals(photo.getTakenDateTime(), decoded.getTakenDateTime());
        assertNull(decoded.getOdataType());
        assertFalse(readJson(json).has("@odata.type"));
    }
}
