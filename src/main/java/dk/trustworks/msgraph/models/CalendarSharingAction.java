package dk.trustworks.msgraph.models;

import com.microsoft.kiota.serialization.ValuedEnum;

public enum CalendarSharingAction implements ValuedEnum {

    ACCEPT("accept"),
    ACCEPT_AND_VIEW_CALENDAR("acceptAndViewCalendar"),
    VIEW_CALENDAR("viewCalendar"),
    ADD_THIS_CALENDAR("addThisCalendar");

    private final String value;

    CalendarSharingAction(String value) {
        this.value = value;
    }

    @Override
    public String getValue() {
        return value;
    }

    public static CalendarSharingAction forValue(String searchValue) {
        for (CalendarSharingAction candidate : values()) {
            if (candidate.value.equals(searchValue)) {
                return candidate;
            }
        }
        return null;
    }
}
