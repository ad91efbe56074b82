package dk.trustworks.msgraph.models;

import dk.trustworks.msgraph.GraphSerialization;
import org.junit.jupiter.api.*;

import java.time.LocalDate;
import java.util.List;

import static dk.trustworks.msgraph.utils.AssertionHelpers.*;
import static dk.trustworks.msgraph.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Round trip tests for calendar models: events, recurrences, locations and calendars.
 */
@DisplayName("Event and Calendar Model Tests")
class EventCalendarTest {

    private GraphSerialization serialization;

    @BeforeEach
    void setUp() {
        serialization = jsonSerialization();
    }

    @Test
    @DisplayName("recurring online meeting → every nested value survives a round trip")
    void recurringOnlineMeeting_roundTrip() {
        // Given
        Event event = event()
                .attendee("alice@contoso.com", AttendeeType.REQUIRED, ResponseType.ACCEPTED)
                .attendee("room-1@contoso.com", AttendeeType.RESOURCE, ResponseType.NOT_RESPONDED)
                .build();
        event.setIsOnlineMeeting(true);
        event.setOnlineMeetingProvider(OnlineMeetingProviderType.TEAMS_FOR_BUSINESS);
        event.setShowAs(FreeBusyStatus.WORKING_ELSEWHERE);
        event.setReminderMinutesBeforeStart(15);
        event.setCategories(List.of("Planning"));

        RecurrencePattern pattern = new RecurrencePattern();
        pattern.setType(RecurrencePatternType.WEEKLY);
        pattern.setInterval(2);
        pattern.setDaysOfWeek(List.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY));
        pattern.setFirstDayOfWeek(DayOfWeek.MONDAY);
        RecurrenceRange range = new RecurrenceRange();
        range.setType(RecurrenceRangeType.END_DATE);
        range.setStartDate(LocalDate.of(2024, 3, 4));
        range.setEndDate(LocalDate.of(2024, 6, 28));
        PatternedRecurrence recurrence = new PatternedRecurrence();
        recurrence.setPattern(pattern);
        recurrence.setRange(range);
        event.setRecurrence(recurrence);

        OutlookGeoCoordinates coordinates = new OutlookGeoCoordinates();
        coordinates.setLatitude(55.6761);
        coordinates.setLongitude(12.5683);
        Location location = new Location();
        location.setDisplayName("Copenhagen office");
        location.setLocationType(LocationType.BUSINESS_ADDRESS);
        location.setCoordinates(coordinates);
        event.setLocation(location);

        // When
        String json = serialization.serializeAsString(event);
        Event decoded = serialization.deserialize(json, Event::createFromDiscriminatorValue);

        // Then
        assertEquals("Sprint planning", decoded.getSubject());
        assertEquals("2024-03-04T09:00:00.0000000", decoded.getStart().getDateTime());
        assertEquals("Romance Standard Time", decoded.getEnd().getTimeZone());
        assertEquals(OnlineMeetingProviderType.TEAMS_FOR_BUSINESS, decoded.getOnlineMeetingProvider());
        assertEquals(FreeBusyStatus.WORKING_ELSEWHERE, decoded.getShowAs());
        assertEquals(15, decoded.getReminderMinutesBeforeStart());
        assertEquals(List.of("Planning"), decoded.getCategories());

        assertEquals(2, decoded.getAttendees().size());
        Attendee room = decoded.getAttendees().get(1);
        assertEquals(AttendeeType.RESOURCE, room.getType());
        assertEquals(ResponseType.NOT_RESPONDED, room.getStatus().getResponse());

        RecurrencePattern decodedPattern = decoded.getRecurrence().getPattern();
        assertEquals(List.of(DayOfWeek.MONDAY, DayOfWeek.WEDNESDAY), decodedPattern.getDaysOfWeek());
        assertEquals(2, decodedPattern.getInterval());
        assertEquals(LocalDate.of(2024, 6, 28), decoded.getRecurrence().getRange().getEndDate());

        assertEquals(LocationType.BUSINESS_ADDRESS, decoded.getLocation().getLocationType());
        assertEquals(55.6761, decoded.getLocation().getCoordinates().getLatitude());
    }

    @Test
    @DisplayName("wire labels → camelCase as sent by Graph")
    void wireLabels() {
        // Given
        Event event = event().build();
        event.setShowAs(FreeBusyStatus.OOF);
        event.setType(EventType.SERIES_MASTER);

        // When
        String json = serialization.serializeAsString(event);

        // Then
        assertEquals("oof", readJson(json).get("showAs").asText());
        assertEquals("seriesMaster", readJson(json).get("type").asText());
        assertEquals("#microsoft.graph.event", readJson(json).get("@odata.type").asText());
    }

    @Test
    @DisplayName("calendar payload → enums and enum collections decoded")
    void calendarPayload() {
        // Given
        String payload = "{\"id\":\"AAMkAGI2TGuLAAA=\",\"name\":\"Calendar\",\"color\":\"lightBlue\","
                + "\"hexColor\":\"#0078d4\",\"isDefaultCalendar\":true,\"canEdit\":true,"
                + "\"defaultOnlineMeetingProvider\":\"teamsForBusiness\","
                + "\"allowedOnlineMeetingProviders\":[\"teamsForBusiness\",\"zoomForBusiness\"],"
                + "\"owner\":{\"name\":\"Alice\",\"address\":\"alice@contoso.com\"},"
                + "\"calendarPermissions\":[{\"id\":\"p-1\",\"role\":\"delegateWithPrivateEventAccess\","
                + "\"allowedRoles\":[\"freeBusyRead\",\"write\"],\"isInsideOrganization\":true}]}";

        // When
        Calendar calendar = serialization.deserialize(payload, Calendar::createFromDiscriminatorValue);

        // Then
        assertEquals(CalendarColor.LIGHT_BLUE, calendar.getColor());
        assertEquals("#0078d4", calendar.getHexColor());
        assertTrue(calendar.getIsDefaultCalendar());
        assertEquals(OnlineMeetingProviderType.TEAMS_FOR_BUSINESS, calendar.getAllowedOnlineMeetingProviders().get(0));
        assertEquals(OnlineMeetingProviderType.TEAMS_FOR_BUSINESS, calendar.getDefaultOnlineMeetingProvider());
        assertNull(calendar.getOdataType());
        assertEquals("Alice", calendar.getOwner().getName());
        CalendarPermission permission = calendar.getCalendarPermissions().get(0);
        assertEquals(CalendarRoleType.DELEGATE_WITH_PRIVATE_EVENT_ACCESS, permission.getRole());
        assertEquals(List.of(CalendarRoleType.FREE_BUSY_READ, CalendarRoleType.WRITE), permission.getAllowedRoles());
    }

    @Test
    @DisplayName("meeting request → request and message properties both decoded")
    void meetingRequest() {
        // Given
        String payload = "{\"@odata.type\":\"#microsoft.graph.eventMessageRequest\",\"subject\":\"Offsite\","
                + "\"meetingMessageType\":\"meetingRequest\",\"meetingRequestType\":\"newMeetingRequest\","
                + "\"allowNewTimeProposals\":true,\"isAllDay\":false,"
                + "\"startDateTime\":{\"dateTime\":\"2024-04-10T08:00:00.0000000\",\"timeZone\":\"UTC\"},"
                + "\"previousLocation\":{\"displayName\":\"Room 1\",\"locationType\":\"conferenceRoom\"}}";

        // When
        Message message = serialization.deserialize(payload, Message::createFromDiscriminatorValue);

        // Then
        EventMessageRequest request = assertInstanceOf(EventMessageRequest.class, message);
        assertEquals("Offsite", request.getSubject());
        assertEquals(MeetingMessageType.MEETING_REQUEST, request.getMeetingMessageType());
        assertEquals(MeetingRequestType.NEW_MEETING_REQUEST, request.getMeetingRequestType());
        assertTrue(request.getAllowNewTimeProposals());
        assertEquals("UTC", request.getStartDateTime().getTimeZone());
        assertEquals(LocationType.CONFERENCE_ROOM, request.getPreviousLocation().getLocationType());
    }
}
