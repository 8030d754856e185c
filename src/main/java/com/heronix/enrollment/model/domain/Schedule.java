package com.heronix.enrollment.model.domain;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.heronix.enrollment.exception.InvalidScheduleException;

/**
 * Weekly meeting slot of a course: the days it meets, a time range
 * in minutes of the day, and the room.
 *
 * The time range is half-open: a course meeting 10:00-11:30 and one
 * meeting 11:30-13:00 on the same day do not overlap.
 */
public record Schedule(Set<DayOfWeek> days, int startMinute, int endMinute, String room) {

    private static final int MINUTES_PER_DAY = 24 * 60;

    private static final Pattern TIME_RANGE =
            Pattern.compile("^\\s*(\\d{2}):(\\d{2})\\s*-\\s*(\\d{2}):(\\d{2})\\s*$");

    public Schedule {
        if (days == null || days.isEmpty()) {
            throw new InvalidScheduleException("Schedule must meet on at least one day");
        }
        if (startMinute < 0 || endMinute > MINUTES_PER_DAY || startMinute >= endMinute) {
            throw new InvalidScheduleException(
                    "Invalid time range: " + startMinute + "-" + endMinute + " (minutes of day)");
        }
        if (room == null || room.isBlank()) {
            throw new InvalidScheduleException("Schedule room is required");
        }
        days = Collections.unmodifiableSet(EnumSet.copyOf(days));
        room = room.trim();
    }

    /**
     * Build a schedule from record values.
     *
     * @param dayNames  day names (e.g., "Monday"), case-insensitive
     * @param timeRange time range in "HH:MM-HH:MM" form
     * @param room      room identifier
     * @return the schedule
     * @throws InvalidScheduleException if any value is malformed
     */
    public static Schedule parse(Collection<String> dayNames, String timeRange, String room) {
        int[] range = parseTimeRange(timeRange);
        return new Schedule(parseDays(dayNames), range[0], range[1], room);
    }

    /**
     * Parse "HH:MM-HH:MM" into start and end minutes of the day.
     */
    public static int[] parseTimeRange(String timeRange) {
        if (timeRange == null) {
            throw new InvalidScheduleException("Time range is required");
        }
        Matcher matcher = TIME_RANGE.matcher(timeRange);
        if (!matcher.matches()) {
            throw new InvalidScheduleException("Malformed time range: '" + timeRange + "' (expected HH:MM-HH:MM)");
        }
        int start = toMinutes(matcher.group(1), matcher.group(2), timeRange);
        int end = toMinutes(matcher.group(3), matcher.group(4), timeRange);
        return new int[] {start, end};
    }

    private static int toMinutes(String hours, String minutes, String source) {
        int h = Integer.parseInt(hours);
        int m = Integer.parseInt(minutes);
        if (h > 23 || m > 59) {
            throw new InvalidScheduleException("Time out of range in '" + source + "'");
        }
        return h * 60 + m;
    }

    private static Set<DayOfWeek> parseDays(Collection<String> dayNames) {
        if (dayNames == null || dayNames.isEmpty()) {
            throw new InvalidScheduleException("Schedule must meet on at least one day");
        }
        Set<DayOfWeek> parsed = EnumSet.noneOf(DayOfWeek.class);
        for (String name : dayNames) {
            if (name == null || name.isBlank()) {
                throw new InvalidScheduleException("Blank day name in schedule");
            }
            try {
                parsed.add(DayOfWeek.valueOf(name.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new InvalidScheduleException("Unknown day: " + name, e);
            }
        }
        return parsed;
    }

    /**
     * Check whether two schedules share a day and an overlapping time range.
     * Symmetric; the room does not matter.
     */
    public boolean overlaps(Schedule other) {
        if (Collections.disjoint(days, other.days)) {
            return false;
        }
        return startMinute < other.endMinute && other.startMinute < endMinute;
    }

    /**
     * Render the time range as "HH:MM-HH:MM".
     */
    public String formatTime() {
        return String.format("%02d:%02d-%02d:%02d",
                startMinute / 60, startMinute % 60, endMinute / 60, endMinute % 60);
    }

    /**
     * Day names in week order (e.g., ["Monday", "Wednesday"]).
     */
    public List<String> dayNames() {
        return days.stream()
                .map(day -> day.getDisplayName(TextStyle.FULL, Locale.ENGLISH))
                .collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return String.join("/", dayNames()) + " " + formatTime() + " @ " + room;
    }
}
