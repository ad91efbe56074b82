package dk.trustworks.msgraph.utils;

import com.microsoft.kiota.serialization.JsonParseNodeFactory;
import com.microsoft.kiota.serialization.ParseNode;
import dk.trustworks.msgraph.GraphSerialization;
import dk.trustworks.msgraph.config.GraphSerializationConfig;
import dk.trustworks.msgraph.models.Attendee;
import dk.trustworks.msgraph.models.AttendeeType;
import dk.trustworks.msgraph.models.BodyType;
import dk.trustworks.msgraph.models.DateTimeTimeZone;
import dk.trustworks.msgraph.models.EmailAddress;
import dk.trustworks.msgraph.models.Event;
import dk.trustworks.msgraph.models.Importance;
import dk.trustworks.msgraph.models.ItemBody;
import dk.trustworks.msgraph.models.Message;
import dk.trustworks.msgraph.models.Recipient;
import dk.trustworks.msgraph.models.ResponseStatus;
import dk.trustworks.msgraph.models.ResponseType;
import dk.trustworks.msgraph.serialization.GraphJsonSerializationWriterFactory;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Test data builders for creating test fixtures.
 * Provides fluent builders for Graph models with sensible defaults.
 */
public class TestDataBuilders {

    public static final OffsetDateTime RECEIVED_AT = OffsetDateTime.of(2024, 3, 1, 9, 30, 0, 0, ZoneOffset.UTC);

    /**
     * Builder for Message with sensible defaults.
     */
    public static class MessageBuilder {
        private String id = "AAMkAGI2TG93AAA=";
        private String subject = "Quarterly review";
        private String bodyContent = "<p>Agenda attached</p>";
        private BodyType bodyType = BodyType.HTML;
        private Importance importance = Importance.HIGH;
        private Boolean isRead = false;
        private OffsetDateTime receivedDateTime = RECEIVED_AT;
        private final List<String> toAddresses = new ArrayList<>(List.of("alice@contoso.com"));

        public MessageBuilder id(String id) {
            this.id = id;
            return this;
        }

        public MessageBuilder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public MessageBuilder body(String content, BodyType type) {
            this.bodyContent = content;
            this.bodyType = type;
            return this;
        }

        public MessageBuilder importance(Importance importance) {
            this.importance = importance;
            return this;
        }

        public MessageBuilder isRead(Boolean isRead) {
            this.isRead = isRead;
            return this;
        }

        public MessageBuilder to(String address) {
            this.toAddresses.add(address);
            return this;
        }

        public Message build() {
            Message message = new Message();
            message.setId(id);
            message.setSubject(subject);
            message.setBody(itemBody(bodyContent, bodyType));
            message.setImportance(importance);
            message.setIsRead(isRead);
            message.setReceivedDateTime(receivedDateTime);
            List<Recipient> recipients = new ArrayList<>();
            for (String address : toAddresses) {
                recipients.add(recipient(address));
            }
            message.setToRecipients(recipients);
            return message;
        }
    }

    /**
     * Builder for Event with sensible defaults.
     */
    public static class EventBuilder {
        private String subject = "Sprint planning";
        private DateTimeTimeZone start = dateTimeTimeZone("2024-03-04T09:00:00.0000000", "Romance Standard Time");
        private DateTimeTimeZone end = dateTimeTimeZone("2024-03-04T10:00:00.0000000", "Romance Standard Time");
        private final List<Attendee> attendees = new ArrayList<>();

        public EventBuilder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public EventBuilder start(String dateTime, String timeZone) {
            this.start = dateTimeTimeZone(dateTime, timeZone);
            return this;
        }

        public EventBuilder end(String dateTime, String timeZone) {
            this.end = dateTimeTimeZone(dateTime, timeZone);
            return this;
        }

        public EventBuilder attendee(String address, AttendeeType type, ResponseType response) {
            Attendee attendee = new Attendee();
            attendee.setEmailAddress(emailAddress(address));
            attendee.setType(type);
            ResponseStatus status = new ResponseStatus();
            status.setResponse(response);
            attendee.setStatus(status);
            this.attendees.add(attendee);
            return this;
        }

        public Event build() {
            Event event = new Event();
            event.setSubject(subject);
            event.setStart(start);
            event.setEnd(end);
            if (!attendees.isEmpty()) {
                event.setAttendees(new ArrayList<>(attendees));
            }
            return event;
        }
    }

    // =========================================================================
    // Factory methods
    // =========================================================================

    public static MessageBuilder message() {
        return new MessageBuilder();
    }

    public static EventBuilder event() {
        return new EventBuilder();
    }

    public static ItemBody itemBody(String content, BodyType type) {
        ItemBody body = new ItemBody();
        body.setContent(content);
        body.setContentType(type);
        return body;
    }

    public static EmailAddress emailAddress(String address) {
        EmailAddress emailAddress = new EmailAddress();
        emailAddress.setAddress(address);
        return emailAddress;
    }

    public static Recipient recipient(String address) {
        Recipient recipient = new Recipient();
        recipient.setEmailAddress(emailAddress(address));
        return recipient;
    }

    public static DateTimeTimeZone dateTimeTimeZone(String dateTime, String timeZone) {
        DateTimeTimeZone value = new DateTimeTimeZone();
        value.setDateTime(dateTime);
        value.setTimeZone(timeZone);
        return value;
    }

    /**
     * Serialization with the default settings: JSON through the backing store proxies.
     */
    public static GraphSerialization jsonSerialization() {
        return new GraphSerialization(GraphSerializationConfig.defaults());
    }

    /**
     * Serialization without the backing store proxies: every set value is written.
     */
    public static GraphSerialization plainJsonSerialization() {
        return new GraphSerialization(new GraphSerializationConfig(GraphJsonSerializationWriterFactory.APPLICATION_JSON, false, false));
    }

    /**
     * Root node of a JSON payload, without any assignment hooks.
     */
    public static ParseNode jsonNode(String json) {
        return new JsonParseNodeFactory().getParseNode(GraphJsonSerializationWriterFactory.APPLICATION_JSON,
                new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }
}
