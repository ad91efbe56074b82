package dk.trustworks.msgraph.models;

import dk.trustworks.msgraph.GraphSerialization;
import com.microsoft.kiota.serialization.ValuedEnum;
import org.junit.jupiter.api.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.lang.reflect.Method;
import java.util.HashSet;
import java.util.Set;
import java.util.stream.Stream;

import static dk.trustworks.msgraph.utils.TestDataBuilders.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks the label contract shared by every Graph enum.
 */
@DisplayName("Enum Label Tests")
class EnumValuesTest {

    static Stream<Class<? extends ValuedEnum>> valuedEnums() {
        return Stream.of(
                AttendeeType.class, BodyType.class, CalendarColor.class, CalendarRoleType.class,
                CalendarSharingAction.class, CalendarSharingActionImportance.class, CalendarSharingActionType.class,
                DayOfWeek.class,
                EventType.class, FollowupFlagStatus.class, FreeBusyStatus.class, Importance.class,
                InferenceClassificationType.class, InstallIntent.class, LocationType.class, LocationUniqueIdType.class,
                MailTipsType.class, ManagedAppFlaggedReason.class, MeetingMessageType.class, MeetingRequestType.class,
                OnlineMeetingProviderType.class, PhoneType.class, RecipientScopeType.class, RecurrencePatternType.class,
                RecurrenceRangeType.class, ResponseType.class, Sensitivity.class, WeekIndex.class);
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("valuedEnums")
    @DisplayName("every label → resolves to its own constant")
    void labelsResolve(Class<? extends ValuedEnum> enumClass) throws Exception {
        Method forValue = enumClass.getMethod("forValue", String.class);
        Set<String> labels = new HashSet<>();

        for (ValuedEnum constant : enumClass.getEnumConstants()) {
            assertSame(constant, forValue.invoke(null, constant.getValue()), constant.getValue());
            assertTrue(labels.add(constant.getValue()), "duplicate label " + constant.getValue());
        }
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("valuedEnums")
    @DisplayName("unknown, null or differently cased label → null")
    void unknownLabels_areNull(Class<? extends ValuedEnum> enumClass) throws Exception {
        Method forValue = enumClass.getMethod("forValue", String.class);
        String first = enumClass.getEnumConstants()[0].getValue();

        assertNull(forValue.invoke(null, "definitelyNotAGraphValue"));
        assertNull(forValue.invoke(null, (Object) null));
        assertNull(forValue.invoke(null, first.toUpperCase() + "_"));
    }

    @Test
    @DisplayName("unknown importance on the wire → property left null")
    void unknownLabelInPayload_isNull() {
        GraphSerialization serialization = jsonSerialization();

        Message message = serialization.deserialize("{\"subject\":\"x\",\"importance\":\"urgent\"}",
                Message::createFromDiscriminatorValue);

        assertEquals("x", message.getSubject());
        assertNull(message.getImportance());
    }

    @Test
    @DisplayName("labels → camelCase wire names")
    void labels_areCamelCase() {
        assertEquals("workingElsewhere", FreeBusyStatus.WORKING_ELSEWHERE.getValue());
        assertEquals("teamsForBusiness", OnlineMeetingProviderType.TEAMS_FOR_BUSINESS.getValue());
        assertEquals("availableWithoutEnrollment", InstallIntent.AVAILABLE_WITHOUT_ENROLLMENT.getValue());
        assertEquals(WeekIndex.LAST, WeekIndex.forValue("last"));
    }
}
