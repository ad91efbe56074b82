package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ParseNode;
import org.junit.jupiter.api.*;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static dk.trustworks.msgraph.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for createFromDiscriminatorValue across the model hierarchies.
 */
@DisplayName("Discriminator Unit Tests")
class DiscriminatorTest {

    private static ParseNode typed(String odataType) {
        return jsonNode("{\"@odata.type\":\"" + odataType + "\"}");
    }

    @Nested
    @DisplayName("Message Hierarchy")
    class MessageHierarchyTests {

        @Test
        @DisplayName("#microsoft.graph.eventMessageRequest → EventMessageRequest")
        void eventMessageRequest() {
            Message message = Message.createFromDiscriminatorValue(typed("#microsoft.graph.eventMessageRequest"));

            assertInstanceOf(EventMessageRequest.class, message);
        }

        @Test
        @DisplayName("#microsoft.graph.eventMessageResponse → EventMessageResponse")
        void eventMessageResponse() {
            assertInstanceOf(EventMessageResponse.class,
                    EventMessage.createFromDiscriminatorValue(typed("#microsoft.graph.eventMessageResponse")));
        }

        @Test
        @DisplayName("unknown or missing type → declaring type")
        void unknownOrMissing_defaultsToBase() {
            assertEquals(Message.class, Message.createFromDiscriminatorValue(typed("#microsoft.graph.post")).getClass());
            assertEquals(Message.class, Message.createFromDiscriminatorValue(jsonNode("{}")).getClass());
        }

        @Test
        @DisplayName("#microsoft.graph.calendarSharingMessage → CalendarSharingMessage from Message, OutlookItem and Entity")
        void calendarSharingMessage() {
            String type = "#microsoft.graph.calendarSharingMessage";

            assertInstanceOf(CalendarSharingMessage.class, Message.createFromDiscriminatorValue(typed(type)));
            assertInstanceOf(CalendarSharingMessage.class, OutlookItem.createFromDiscriminatorValue(typed(type)));
            assertInstanceOf(CalendarSharingMessage.class, Entity.createFromDiscriminatorValue(typed(type)));
        }

        @Test
        @DisplayName("#microsoft.graph.referenceAttachment → ReferenceAttachment from Attachment and Entity")
        void referenceAttachment() {
            String type = "#microsoft.graph.referenceAttachment";

            assertInstanceOf(ReferenceAttachment.class, Attachment.createFromDiscriminatorValue(typed(type)));
            assertInstanceOf(ReferenceAttachment.class, Entity.createFromDiscriminatorValue(typed(type)));
            assertEquals(Message.class, Message.createFromDiscriminatorValue(typed(type)).getClass());
        }

        @Test
        @DisplayName("type outside the hierarchy → declaring type")
        void siblingType_defaultsToBase() {
            assertEquals(Message.class, Message.createFromDiscriminatorValue(typed("#microsoft.graph.event")).getClass());
        }

        @Test
        @DisplayName("OutlookItem → Message or Event")
        void outlookItem() {
            assertInstanceOf(Event.class, OutlookItem.createFromDiscriminatorValue(typed("#microsoft.graph.event")));
            assertInstanceOf(EventMessage.class, OutlookItem.createFromDiscriminatorValue(typed("#microsoft.graph.eventMessage")));
        }

        @Test
        @DisplayName("Entity → any entity type")
        void entity() {
            assertInstanceOf(FileAttachment.class, Entity.createFromDiscriminatorValue(typed("#microsoft.graph.fileAttachment")));
            assertInstanceOf(IosVppEBook.class, Entity.createFromDiscriminatorValue(typed("#microsoft.graph.iosVppEBook")));
            assertInstanceOf(Calendar.class, Entity.createFromDiscriminatorValue(typed("#microsoft.graph.calendar")));
            assertEquals(Entity.class, Entity.createFromDiscriminatorValue(typed("#microsoft.graph.user")).getClass());
        }
    }

    @Nested
    @DisplayName("Decoding Through Discriminators")
    class DecodingTests {

        @Test
        @DisplayName("item attachment → attached event decoded as Event")
        void itemAttachment_decodesPolymorphicItem() {
            // Given
            ParseNode root = jsonNode("{\"@odata.type\":\"#microsoft.graph.itemAttachment\",\"name\":\"Invite\","
                    + "\"item\":{\"@odata.type\":\"#microsoft.graph.event\",\"subject\":\"Offsite\"}}");

            // When
            Attachment attachment = root.getObjectValue(Attachment::createFromDiscriminatorValue);

            // Then
            ItemAttachment itemAttachment = assertInstanceOf(ItemAttachment.class, attachment);
            assertEquals("Invite", itemAttachment.getName());
            Event event = assertInstanceOf(Event.class, itemAttachment.getItem());
            assertEquals("Offsite", event.getSubject());
        }

        @Test
        @DisplayName("message attachments → file and item attachments side by side")
        void messageAttachments() {
            // Given
            ParseNode root = jsonNode("{\"hasAttachments\":true,\"attachments\":["
                    + "{\"@odata.type\":\"#microsoft.graph.fileAttachment\",\"name\":\"a.txt\",\"contentBytes\":\"aGVsbG8=\",\"size\":5},"
                    + "{\"@odata.type\":\"#microsoft.graph.itemAttachment\",\"name\":\"fwd\"}]}");

            // When
            Message message = root.getObjectValue(Message::createFromDiscriminatorValue);

            // Then
            List<Attachment> attachments = message.getAttachments();
            FileAttachment file = assertInstanceOf(FileAttachment.class, attachments.get(0));
            assertEquals(5, file.getSize());
            assertEquals("hello", new String(file.getContentBytes(), StandardCharsets.UTF_8));
            assertInstanceOf(ItemAttachment.class, attachments.get(1));
        }

        @Test
        @DisplayName("assignment targets → most derived target type")
        void assignmentTargets() {
            // Given
            ParseNode root = jsonNode("{\"installIntent\":\"required\",\"target\":"
                    + "{\"@odata.type\":\"#microsoft.graph.exclusionGroupAssignmentTarget\",\"groupId\":\"g-1\"}}");

            // When
            ManagedEBookAssignment assignment = root.getObjectValue(ManagedEBookAssignment::createFromDiscriminatorValue);

            // Then
            assertEquals(InstallIntent.REQUIRED, assignment.getInstallIntent());
            ExclusionGroupAssignmentTarget target = assertInstanceOf(ExclusionGroupAssignmentTarget.class, assignment.getTarget());
            assertEquals("g-1", target.getGroupId());
        }

        @Test
        @DisplayName("calendar sharing message → sharing actions and inherited message fields decoded")
        void calendarSharingMessage_decoded() {
            // Given
            ParseNode root = jsonNode("{\"@odata.type\":\"#microsoft.graph.calendarSharingMessage\","
                    + "\"subject\":\"Alice shared her calendar\",\"canAccept\":true,\"suggestedCalendarName\":\"Alice\","
                    + "\"sharingMessageAction\":{\"action\":\"accept\",\"actionType\":\"accept\",\"importance\":\"primary\"},"
                    + "\"sharingMessageActions\":[{\"action\":\"viewCalendar\",\"importance\":\"secondary\"}]}");

            // When
            Message message = root.getObjectValue(Message::createFromDiscriminatorValue);

            // Then
            CalendarSharingMessage sharing = assertInstanceOf(CalendarSharingMessage.class, message);
            assertEquals("Alice shared her calendar", sharing.getSubject());
            assertTrue(sharing.getCanAccept());
            assertEquals("Alice", sharing.getSuggestedCalendarName());
            assertEquals(CalendarSharingAction.ACCEPT, sharing.getSharingMessageAction().getAction());
            assertEquals(CalendarSharingActionType.ACCEPT, sharing.getSharingMessageAction().getActionType());
            assertEquals(CalendarSharingActionImportance.PRIMARY, sharing.getSharingMessageAction().getImportance());
            assertEquals(CalendarSharingAction.VIEW_CALENDAR, sharing.getSharingMessageActions().get(0).getAction());
            assertEquals(CalendarSharingActionImportance.SECONDARY, sharing.getSharingMessageActions().get(0).getImportance());
        }

        @Test
        @DisplayName("reference attachment in a message → decoded alongside file attachments")
        void referenceAttachment_decoded() {
            ParseNode root = jsonNode("{\"attachments\":["
                    + "{\"@odata.type\":\"#microsoft.graph.referenceAttachment\",\"name\":\"Budget.xlsx\",\"isInline\":false}]}");

            Message message = root.getObjectValue(Message::createFromDiscriminatorValue);

            ReferenceAttachment attachment = assertInstanceOf(ReferenceAttachment.class, message.getAttachments().get(0));
            assertEquals("Budget.xlsx", attachment.getName());
            assertFalse(attachment.getIsInline());
        }

        @Test
        @DisplayName("recipients → attendees keep their attendee properties")
        void recipientHierarchy() {
            ParseNode root = jsonNode("{\"@odata.type\":\"#microsoft.graph.attendee\",\"type\":\"optional\","
                    + "\"emailAddress\":{\"address\":\"carol@contoso.com\"}}");

            Recipient recipient = root.getObjectValue(Recipient::createFromDiscriminatorValue);

            Attendee attendee = assertInstanceOf(Attendee.class, recipient);
            assertEquals(AttendeeType.OPTIONAL, attendee.getType());
            assertEquals("carol@contoso.com", attendee.getEmailAddress().getAddress());
        }
    }

    @Nested
    @DisplayName("Construction")
    class ConstructionTests {

        @Test
        @DisplayName("types derived from a polymorphic base → @odata.type preset")
        void derivedTypes_presetOdataType() {
            assertEquals("#microsoft.graph.message", new Message().getOdataType());
            assertEquals("#microsoft.graph.event", new Event().getOdataType());
            assertEquals("#microsoft.graph.eventMessageRequest", new EventMessageRequest().getOdataType());
            assertEquals("#microsoft.graph.calendarSharingMessage", new CalendarSharingMessage().getOdataType());
            assertEquals("#microsoft.graph.referenceAttachment", new ReferenceAttachment().getOdataType());
            assertEquals("#microsoft.graph.iosVppEBook", new IosVppEBook().getOdataType());
            assertEquals("#microsoft.graph.allLicensedUsersAssignmentTarget", new AllLicensedUsersAssignmentTarget().getOdataType());
        }

        @Test
        @DisplayName("abstract-like bases → no @odata.type")
        void bases_leaveOdataTypeUnset() {
            assertNull(new Entity().getOdataType());
            assertNull(new OutlookItem().getOdataType());
            assertNull(new Attachment().getOdataType());
            assertNull(new ManagedAppRegistration().getOdataType());
            assertNull(new MobileAppIdentifier().getOdataType());
            assertNull(new DeviceAndAppManagementAssignmentTarget().getOdataType());
        }

        @Test
        @DisplayName("direct entity subtypes and standalone complex types → no @odata.type")
        void nonPolymorphicTypes_leaveOdataTypeUnset() {
            assertNull(new Calendar().getOdataType());
            assertNull(new CalendarPermission().getOdataType());
            assertNull(new ManagedAppPolicy().getOdataType());
            assertNull(new ManagedEBook().getOdataType());
            assertNull(new SingleValueLegacyExtendedProperty().getOdataType());
            assertNull(new ItemBody().getOdataType());
            assertNull(new Recipient().getOdataType());
            assertNull(new CalendarSharingMessageAction().getOdataType());
            assertNull(new Photo().getOdataType());
        }

        @Test
        @DisplayName("new model → empty additional data")
        void newModel_hasEmptyAdditionalData() {
            assertTrue(new Calendar().getAdditionalData().isEmpty());
        }
    }
}
