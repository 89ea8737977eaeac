package com.vidnyan.eaf.domain.model;

import com.vidnyan.eaf.domain.error.EafError;
import com.vidnyan.eaf.domain.error.EafException;

import java.util.*;

/**
 * Document-wide ordered collection of time slots.
 * Immutable: every operation that changes slots returns a new instance.
 */
public record TimeOrder(List<TimeSlot> timeSlots) {

    private static final String ID_PREFIX = "ts";

    public TimeOrder {
        timeSlots = timeSlots == null ? List.of() : List.copyOf(timeSlots);
    }

    public static TimeOrder empty() {
        return new TimeOrder(List.of());
    }

    public static TimeOrder of(TimeSlot... slots) {
        return new TimeOrder(List.of(slots));
    }

    /**
     * Time slots with IDs ts{start}, ts{start+1}, ... for the given values.
     */
    public static TimeOrder fromValues(List<Long> values, int start) {
        List<TimeSlot> slots = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            slots.add(new TimeSlot(ID_PREFIX + (start + i), values.get(i)));
        }
        return new TimeOrder(slots);
    }

    public int size() {
        return timeSlots.size();
    }

    public boolean isEmpty() {
        return timeSlots.isEmpty();
    }

    public Optional<TimeSlot> find(String id) {
        return timeSlots.stream()
                .filter(ts -> ts.id().equals(id))
                .findFirst();
    }

    public boolean containsId(String id) {
        return find(id).isPresent();
    }

    public List<String> ids() {
        return timeSlots.stream().map(TimeSlot::id).toList();
    }

    /**
     * Time slot ID to value. Values may be null.
     */
    public Map<String, Long> valuesById() {
        Map<String, Long> values = new LinkedHashMap<>();
        for (TimeSlot ts : timeSlots) {
            values.put(ts.id(), ts.value());
        }
        return values;
    }

    /**
     * Time slot value to ID, for slots with a value.
     * If several slots share a value the first one wins.
     */
    public Map<Long, String> idsByValue() {
        Map<Long, String> ids = new LinkedHashMap<>();
        for (TimeSlot ts : timeSlots) {
            if (ts.hasValue()) {
                ids.putIfAbsent(ts.value(), ts.id());
            }
        }
        return ids;
    }

    public Optional<Long> minValue() {
        return timeSlots.stream()
                .map(TimeSlot::value)
                .filter(Objects::nonNull)
                .min(Long::compare);
    }

    public Optional<Long> maxValue() {
        return timeSlots.stream()
                .map(TimeSlot::value)
                .filter(Objects::nonNull)
                .max(Long::compare);
    }

    /**
     * IDs that occur more than once.
     */
    public Set<String> duplicateIds() {
        Set<String> seen = new HashSet<>();
        Set<String> duplicates = new LinkedHashSet<>();
        for (TimeSlot ts : timeSlots) {
            if (!seen.add(ts.id())) {
                duplicates.add(ts.id());
            }
        }
        return duplicates;
    }

    public boolean hasDuplicateIds() {
        return new HashSet<>(ids()).size() < timeSlots.size();
    }

    /**
     * Next free numerical ID, i.e. "ts" followed by the highest numerical suffix + 1.
     */
    public String generateId() {
        return ID_PREFIX + nextIdNumber();
    }

    private long nextIdNumber() {
        return timeSlots.stream()
                .map(ts -> IdNumbers.suffix(ts.id()))
                .flatMap(Optional::stream)
                .max(Long::compare)
                .map(n -> n + 1)
                .orElse(1L);
    }

    /**
     * Add a time slot. A null ID generates a new one.
     */
    public TimeOrder add(String id, Long value) {
        String slotId = id != null ? id : generateId();
        if (containsId(slotId)) {
            throw EafException.of(EafError.TIMESLOT_ID_EXISTS, slotId);
        }
        List<TimeSlot> slots = new ArrayList<>(timeSlots);
        slots.add(new TimeSlot(slotId, value));
        return new TimeOrder(slots);
    }

    /**
     * Time slots with a value within [start, end]. Unaligned slots are dropped.
     */
    public TimeOrder filter(long start, long end) {
        return new TimeOrder(timeSlots.stream()
                .filter(ts -> ts.containedIn(start, end))
                .toList());
    }

    /**
     * Shift all time values. Unless negative values are allowed, fails if the
     * smallest value would drop below zero.
     */
    public TimeOrder shift(long ms, boolean allowNegative) {
        if (!allowNegative && minValue().map(min -> min + ms < 0).orElse(false)) {
            throw EafException.of(EafError.VALUE_TOO_SMALL, ms);
        }
        return new TimeOrder(timeSlots.stream()
                .map(ts -> ts.shifted(ms))
                .toList());
    }

    /**
     * Renumber all slots sequentially from ts{start}, keeping their order.
     */
    public Renumbered renumber(int start) {
        Map<String, String> renames = new HashMap<>();
        List<TimeSlot> slots = new ArrayList<>(timeSlots.size());
        for (int i = 0; i < timeSlots.size(); i++) {
            TimeSlot ts = timeSlots.get(i);
            String newId = ID_PREFIX + (start + i);
            renames.put(ts.id(), newId);
            slots.add(ts.withId(newId));
        }
        return new Renumbered(new TimeOrder(slots), Collections.unmodifiableMap(renames));
    }

    /**
     * Renumbered time order plus old ID to new ID mapping.
     */
    public record Renumbered(TimeOrder timeOrder, Map<String, String> renames) {}
}
