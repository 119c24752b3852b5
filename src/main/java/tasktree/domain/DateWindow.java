package tasktree.domain;

import java.time.LocalDate;

/**
 * Inclusive date range used for day-scoped visibility and for cascading schedules.
 *
 * <p>Either bound may be absent, which leaves that side of the window open.
 *
 * @param start first visible day (nullable)
 * @param end   last visible day (nullable)
 */
public record DateWindow(LocalDate start, LocalDate end) {

    public DateWindow {
        if (start != null && end != null && end.isBefore(start)) {
            throw new IllegalArgumentException("window end must not be before window start");
        }
    }

    /**
     * Single-day window.
     *
     * @param day the only day in the window
     * @return a window starting and ending on {@code day}
     */
    public static DateWindow onDay(final LocalDate day) {
        return new DateWindow(day, day);
    }

    /**
     * @param day day to test (must not be null)
     * @return true if the day falls inside the window, bounds included
     */
    public boolean contains(final LocalDate day) {
        Validation.validateNotNull(day, "day");
        if (start != null && day.isBefore(start)) {
            return false;
        }
        return end == null || !day.isAfter(end);
    }

    /**
     * A multi-day item that is not due on the viewed day.
     *
     * @param day the viewed day
     * @return true if the window spans several days and does not end on {@code day}
     */
    public boolean isOngoingOn(final LocalDate day) {
        if (start == null || end == null) {
            return false;
        }
        return !start.equals(end) && !end.equals(day);
    }
}
