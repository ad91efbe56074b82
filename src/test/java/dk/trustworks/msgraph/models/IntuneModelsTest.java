package dk.trustworks.msgraph.models;

import dk.trustworks.msgraph.GraphSerialization;
import org.junit.jupiter.api.*;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

import static dk.trustworks.msgraph.utils.AssertionHelpers.*;
import static dk.trustworks.msgraph.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the device management models: managed e-books and app registrations.
 */
@DisplayName("Intune Model Tests")
class IntuneModelsTest {

    private static final UUID VPP_TOKEN = UUID.fromString("9f3a2c1e-5b7d-4e8f-a1b2-c3d4e5f60718");

    private GraphSerialization serialization;

    @BeforeEach
    void setUp() {
        serialization = jsonSerialization();
    }

    @Nested
    @DisplayName("Managed E-Books")
    class ManagedEBookTests {

        @Test
        @DisplayName("iOS VPP e-book through ManagedEBook → subtype with UUID and cover")
        void iosVppEBook_decodedThroughBase() {
            // Given
            String payload = "{\"@odata.type\":\"#microsoft.graph.iosVppEBook\",\"id\":\"eb-1\","
                    + "\"displayName\":\"Field guide\",\"publisher\":\"Contoso Press\","
                    + "\"publishedDateTime\":\"2023-11-02T00:00:00Z\","
                    + "\"largeCover\":{\"type\":\"image/png\",\"value\":\"iVBORw==\"},"
                    + "\"vppTokenId\":\"" + VPP_TOKEN + "\",\"appleId\":\"1234\","
                    + "\"genres\":[\"Reference\",\"Travel\"],\"totalLicenseCount\":50,\"usedLicenseCount\":12}";

            // When
            ManagedEBook book = serialization.deserialize(payload, ManagedEBook::createFromDiscriminatorValue);

            // Then
            IosVppEBook vpp = assertInstanceOf(IosVppEBook.class, book);
            assertEquals("Field guide", vpp.getDisplayName());
            assertEquals(VPP_TOKEN, vpp.getVppTokenId());
            assertEquals(List.of("Reference", "Travel"), vpp.getGenres());
            assertEquals(12, vpp.getUsedLicenseCount());
            assertEquals("image/png", vpp.getLargeCover().getType());
            assertArrayEquals(new byte[]{(byte) 0x89, 'P', 'N', 'G'}, vpp.getLargeCover().getValue());
        }

        @Test
        @DisplayName("iOS VPP e-book through Entity → same subtype")
        void iosVppEBook_decodedThroughEntity() {
            Entity entity = serialization.deserialize("{\"@odata.type\":\"#microsoft.graph.iosVppEBook\",\"id\":\"eb-2\"}",
                    Entity::createFromDiscriminatorValue);

            assertInstanceOf(IosVppEBook.class, entity);
            assertEquals("eb-2", entity.getId());
        }

        @Test
        @DisplayName("new e-book → UUID and cover written as text")
        void iosVppEBook_serialized() {
            // Given
            MimeContent cover = new MimeContent();
            cover.setType("text/plain");
            cover.setValue("cover".getBytes(StandardCharsets.UTF_8));
            IosVppEBook book = new IosVppEBook();
            book.setVppTokenId(VPP_TOKEN);
            book.setLargeCover(cover);

            // When
            String json = serialization.serializeAsString(book);

            // Then
            assertEquals(VPP_TOKEN.toString(), readJson(json).get("vppTokenId").asText());
            assertEquals("Y292ZXI=", readJson(json).get("largeCover").get("value").asText());
            assertEquals("#microsoft.graph.iosVppEBook", readJson(json).get("@odata.type").asText());
        }

        @Test
        @DisplayName("malformed UUID → decode fails")
        void malformedUuid_fails() {
            assertThrows(IllegalArgumentException.class,
                    () -> serialization.deserialize("{\"vppTokenId\":\"not-a-uuid\"}", IosVppEBook::createFromDiscriminatorValue));
        }
    }

    @Nested
    @DisplayName("Managed App Registrations")
    class ManagedAppRegistrationTests {

        @Test
        @DisplayName("Android registration → flagged reasons and app identifier decoded")
        void androidRegistration() {
            // Given
            String payload = "{\"@odata.type\":\"#microsoft.graph.androidManagedAppRegistration\",\"id\":\"r-1\","
                    + "\"deviceName\":\"Pixel 8\",\"platformVersion\":\"14\",\"userId\":\"u-1\","
                    + "\"lastSyncDateTime\":\"2024-03-01T09:30:00Z\","
                    + "\"flaggedReasons\":[\"rootedDevice\",\"jailbrokenSoon\"],"
                    + "\"appIdentifier\":{\"@odata.type\":\"#microsoft.graph.androidMobileAppIdentifier\","
                    + "\"packageId\":\"com.contoso.mail\"}}";

            // When
            ManagedAppRegistration registration =
                    serialization.deserialize(payload, ManagedAppRegistration::createFromDiscriminatorValue);

            // Then
            assertInstanceOf(AndroidManagedAppRegistration.class, registration);
            assertEquals("Pixel 8", registration.getDeviceName());
            assertEquals(RECEIVED_AT, registration.getLastSyncDateTime());
            assertEquals(ManagedAppFlaggedReason.ROOTED_DEVICE, registration.getFlaggedReasons().get(0));
            AndroidMobileAppIdentifier identifier =
                    assertInstanceOf(AndroidMobileAppIdentifier.class, registration.getAppIdentifier());
            assertEquals("com.contoso.mail", identifier.getPackageId());
        }

        @Test
        @DisplayName("registration without @odata.type → base registration")
        void untypedRegistration() {
            ManagedAppRegistration registration = serialization.deserialize("{\"deviceName\":\"unknown\"}",
                    ManagedAppRegistration::createFromDiscriminatorValue);

            assertEquals(ManagedAppRegistration.class, registration.getClass());
        }

        @Test
        @DisplayName("new registration → identifier written with its own type")
        void newRegistration_serialized() {
            // Given
            AndroidMobileAppIdentifier identifier = new AndroidMobileAppIdentifier();
            identifier.setPackageId("com.contoso.mail");
            AndroidManagedAppRegistration registration = new AndroidManagedAppRegistration();
            registration.setAppIdentifier(identifier);
            registration.setFlaggedReasons(List.of(ManagedAppFlaggedReason.NONE));

            // When
            String json = serialization.serializeAsString(registration);

            // Then
            assertJsonEquals("{\"@odata.type\":\"#microsoft.graph.androidManagedAppRegistration\","
                    + "\"appIdentifier\":{\"@odata.type\":\"#microsoft.graph.androidMobileAppIdentifier\","
                    + "\"packageId\":\"com.contoso.mail\"},\"flaggedReasons\":[\"none\"]}", json);
        }
    }
}
