package com.vidnyan.eaf.domain.model;

import com.vidnyan.eaf.domain.error.EafError;
import com.vidnyan.eaf.domain.error.EafException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class TimeOrderTest {

    @Test
    void generateId_ShouldUseHighestNumericalSuffix() {
        TimeOrder timeOrder = TimeOrder.of(
                TimeSlot.of("ts1", 0),
                TimeSlot.of("ts7", 100),
                TimeSlot.unaligned("start"));

        assertEquals("ts8", timeOrder.generateId());
        assertEquals("ts1", TimeOrder.empty().generateId());
    }

    @Test
    void add_ShouldRejectExistingId() {
        TimeOrder timeOrder = TimeOrder.of(TimeSlot.of("ts1", 0));

        EafException e = assertThrows(EafException.class, () -> timeOrder.add("ts1", 10L));
        assertEquals(EafError.TIMESLOT_ID_EXISTS, e.getError());
    }

    @Test
    void add_ShouldGenerateIdWhenMissing() {
        TimeOrder timeOrder = TimeOrder.of(TimeSlot.of("ts1", 0)).add(null, 250L);

        assertEquals(List.of("ts1", "ts2"), timeOrder.ids());
        assertEquals(Optional.of(250L), timeOrder.find("ts2").map(TimeSlot::value));
    }

    @Test
    void filter_ShouldDropUnalignedAndOutsideSlots() {
        TimeOrder timeOrder = TimeOrder.of(
                TimeSlot.of("ts1", 0),
                TimeSlot.of("ts2", 500),
                TimeSlot.unaligned("ts3"),
                TimeSlot.of("ts4", 1200));

        TimeOrder filtered = timeOrder.filter(0, 1000);

        assertEquals(List.of("ts1", "ts2"), filtered.ids());
    }

    @Test
    void shift_ShouldRejectNegativeValuesUnlessAllowed() {
        TimeOrder timeOrder = TimeOrder.of(TimeSlot.of("ts1", 100), TimeSlot.unaligned("ts2"));

        EafException e = assertThrows(EafException.class, () -> timeOrder.shift(-200, false));
        assertEquals(EafError.VALUE_TOO_SMALL, e.getError());

        TimeOrder shifted = timeOrder.shift(-200, true);
        assertEquals(Optional.of(-100L), shifted.minValue());
        assertNull(shifted.find("ts2").orElseThrow().value());
    }

    @Test
    void renumber_ShouldKeepOrderAndReportRenames() {
        TimeOrder timeOrder = TimeOrder.of(TimeSlot.of("x", 0), TimeSlot.of("y", 10));

        TimeOrder.Renumbered renumbered = timeOrder.renumber(5);

        assertEquals(List.of("ts5", "ts6"), renumbered.timeOrder().ids());
        assertEquals("ts6", renumbered.renames().get("y"));
    }

    @Test
    void idsByValue_ShouldKeepFirstSlotPerValue() {
        TimeOrder timeOrder = TimeOrder.of(TimeSlot.of("ts2", 500), TimeSlot.of("ts3", 500));

        assertEquals("ts2", timeOrder.idsByValue().get(500L));
        assertFalse(timeOrder.hasDuplicateIds());
    }
}
