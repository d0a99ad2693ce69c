package com.slotplanner.slotplanner_api.solver;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import com.slotplanner.slotplanner_api.model.Availability;
import com.slotplanner.slotplanner_api.model.TimeSlot;

/**
 * The weekly raster every availability and assignment is indexed against.
 * <p>
 * Position {@code p} of the grid is {@code dayIndex * ticksPerDay + tick}; ordering by position is
 * the canonical slot order. A session started at {@code p} occupies {@code p}, {@code p + 1} and
 * {@code p + 2}, which must lie on the same day.
 */
public final class SlotGrid {

    public static final int RASTER_MINUTES = Availability.RASTER_MINUTES;
    public static final int SESSION_TICKS = 3;
    public static final int SESSION_MINUTES = SESSION_TICKS * RASTER_MINUTES;
    public static final List<DayOfWeek> WEEKDAYS = List.of(
            DayOfWeek.MONDAY, DayOfWeek.TUESDAY, DayOfWeek.WEDNESDAY, DayOfWeek.THURSDAY, DayOfWeek.FRIDAY);

    private final LocalTime dayStart;
    private final LocalTime dayEnd;
    private final LocalTime earlyCutoff;
    private final int ticksPerDay;
    private final List<TimeSlot> slots;

    public SlotGrid(LocalTime dayStart, LocalTime dayEnd, LocalTime earlyCutoff) {
        if (dayStart == null || dayEnd == null || earlyCutoff == null) {
            throw new IllegalArgumentException("Grid times must not be null.");
        }
        if (!dayStart.isBefore(dayEnd)) {
            throw new IllegalArgumentException("Day start " + dayStart + " must be before day end " + dayEnd + ".");
        }
        if (!onRaster(dayStart) || !onRaster(dayEnd)) {
            throw new IllegalArgumentException("Day start and end must lie on the " + RASTER_MINUTES + "-minute raster.");
        }
        long minutes = ChronoUnit.MINUTES.between(dayStart, dayEnd);
        if (minutes < SESSION_MINUTES) {
            throw new IllegalArgumentException("Operating window is shorter than one " + SESSION_MINUTES + "-minute session.");
        }
        this.dayStart = dayStart;
        this.dayEnd = dayEnd;
        this.earlyCutoff = earlyCutoff;
        this.ticksPerDay = (int) (minutes / RASTER_MINUTES);

        List<TimeSlot> all = new ArrayList<>(WEEKDAYS.size() * ticksPerDay);
        for (DayOfWeek day : WEEKDAYS) {
            for (int tick = 0; tick < ticksPerDay; tick++) {
                all.add(new TimeSlot(day, dayStart.plusMinutes((long) tick * RASTER_MINUTES)));
            }
        }
        this.slots = Collections.unmodifiableList(all);
    }

    public static SlotGrid standard() {
        return new SlotGrid(LocalTime.of(7, 0), LocalTime.of(20, 0), LocalTime.of(12, 0));
    }

    private static boolean onRaster(LocalTime time) {
        return time.getSecond() == 0 && time.getNano() == 0 && time.getMinute() % RASTER_MINUTES == 0;
    }

    public LocalTime getDayStart() { return dayStart; }
    public LocalTime getDayEnd() { return dayEnd; }
    public LocalTime getEarlyCutoff() { return earlyCutoff; }
    public int ticksPerDay() { return ticksPerDay; }
    public int positionCount() { return slots.size(); }
    public int lastStartTick() { return ticksPerDay - SESSION_TICKS; }

    /** Every raster position of the week in slot order. */
    public List<TimeSlot> slots() {
        return slots;
    }

    /** Positions at which a whole session fits, in slot order. */
    public List<TimeSlot> startSlots() {
        List<TimeSlot> starts = new ArrayList<>();
        for (int p = 0; p < slots.size(); p++) {
            if (isStartPosition(p)) starts.add(slots.get(p));
        }
        return starts;
    }

    public boolean contains(TimeSlot slot) {
        if (slot == null || slot.weekday() == null || slot.startTime() == null) return false;
        if (!WEEKDAYS.contains(slot.weekday()) || !onRaster(slot.startTime())) return false;
        return !slot.startTime().isBefore(dayStart) && slot.startTime().isBefore(dayEnd);
    }

    public int positionOf(TimeSlot slot) {
        if (!contains(slot)) {
            throw new IllegalArgumentException("Time slot " + slot + " is not on the grid.");
        }
        int dayIndex = WEEKDAYS.indexOf(slot.weekday());
        int tick = (int) (ChronoUnit.MINUTES.between(dayStart, slot.startTime()) / RASTER_MINUTES);
        return dayIndex * ticksPerDay + tick;
    }

    public TimeSlot slotAt(int position) {
        return slots.get(position);
    }

    public int dayIndexOf(int position) {
        return position / ticksPerDay;
    }

    public int tickOf(int position) {
        return position % ticksPerDay;
    }

    public boolean isStartPosition(int position) {
        return position >= 0 && position < slots.size() && tickOf(position) <= lastStartTick();
    }

    /** Linear per-day credit: 1 at the first start of the day, 0 at the last possible start. */
    public double earliness(int position) {
        int lastStart = lastStartTick();
        if (lastStart == 0) return 1.0;
        return 1.0 - (double) tickOf(position) / lastStart;
    }

    public boolean isEarly(int position) {
        return slotAt(position).startTime().isBefore(earlyCutoff);
    }

    public boolean isEarly(TimeSlot slot) {
        return slot.startTime().isBefore(earlyCutoff);
    }

    /** Grid positions of the given slots; slots off the grid are skipped. */
    public BitSet positionsOf(Collection<TimeSlot> available) {
        BitSet bits = new BitSet(slots.size());
        for (TimeSlot slot : available) {
            if (contains(slot)) bits.set(positionOf(slot));
        }
        return bits;
    }

    /** True if a session can start at {@code position} and all three of its ticks are set. */
    public boolean coversSession(BitSet bits, int position) {
        if (!isStartPosition(position)) return false;
        for (int i = 0; i < SESSION_TICKS; i++) {
            if (!bits.get(position + i)) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return "SlotGrid[" + dayStart + "-" + dayEnd + ", early<" + earlyCutoff + "]";
    }
}
