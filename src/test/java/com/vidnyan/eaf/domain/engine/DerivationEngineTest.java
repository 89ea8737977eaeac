package com.vidnyan.eaf.domain.engine;

import com.vidnyan.eaf.domain.EafFixtures;
import com.vidnyan.eaf.domain.error.EafError;
import com.vidnyan.eaf.domain.error.EafException;
import com.vidnyan.eaf.domain.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DerivationEngineTest {

    @Test
    void derive_ShouldResolveReferredAnnotationThroughParent() {
        DerivedEaf derived = EafFixtures.wordsAndTranslit().derive();

        DerivedAnnotation r1 = derived.span("r1").orElseThrow();
        assertEquals(0L, r1.start());
        assertEquals(500L, r1.end());
        assertEquals("a1", r1.mainAnnotationId());
        assertEquals("translit", r1.tierId());
        assertEquals("a1", derived.mainAnnotation("r1").map(Annotation::id).orElseThrow());

        DerivedAnnotation a2 = derived.span("a2").orElseThrow();
        assertEquals(new DerivedAnnotation("a2", "words", 500L, 1000L, null), a2);
    }

    @Test
    void derive_ShouldFollowChainsAcrossSeveralTiers() {
        EafDocument document = EafFixtures.wordsAndTranslit()
                .addTier(Tier.referred("gloss", "translit", "gloss-lt", List.of(
                        Annotation.referred("g1", "greeting", "r1"))));

        DerivedAnnotation g1 = document.derive().span("g1").orElseThrow();

        assertEquals("a1", g1.mainAnnotationId());
        assertEquals(0L, g1.start());
        assertEquals(500L, g1.end());
    }

    @Test
    void derive_ShouldGiveTokensTheSpanOfTheirParent() {
        DerivedEaf derived = EafFixtures.tokenized().derive();

        for (String token : List.of("t1", "t2", "t3")) {
            DerivedAnnotation span = derived.span(token).orElseThrow();
            assertEquals(0L, span.start());
            assertEquals(900L, span.end());
        }
    }

    @Test
    void derive_ShouldFailOnReferenceCycle() {
        EafDocument document = EafDocument.builder()
                .tiers(List.of(
                        Tier.main("main", List.of()),
                        Tier.referred("x", "main", "lt", List.of(
                                Annotation.referred("x1", "", "x2"),
                                Annotation.referred("x2", "", "x1")))))
                .build();

        EafException e = assertThrows(EafException.class, document::derive);
        assertEquals(EafError.REFERENCE_CYCLE, e.getError());
        assertEquals(EafError.Category.REFERENTIAL, e.getCategory());
    }

    @Test
    void derive_ShouldReportMissingMainAnnotation() {
        EafDocument document = EafFixtures.wordsAndTranslit().toBuilder()
                .tiers(List.of(
                        EafFixtures.wordsAndTranslit().requireTier("words"),
                        Tier.referred("translit", "words", "translit-lt", List.of(
                                Annotation.referred("r1", "HELLO", "a9")))))
                .build();

        EafException e = assertThrows(EafException.class, document::derive);
        assertEquals(EafError.MISSING_MAIN_ANNOTATION, e.getError());
        assertTrue(e.getMessage().contains("'r1'"));
        assertTrue(e.getMessage().contains("'a9'"));
    }

    @Test
    void derive_ShouldReportMissingTimeslotRef() {
        EafDocument document = EafDocument.builder()
                .timeOrder(TimeOrder.of(TimeSlot.of("ts1", 0)))
                .tiers(List.of(Tier.main("words", List.of(
                        Annotation.alignable("a1", "hello", "ts1", "ts9")))))
                .build();

        EafException e = assertThrows(EafException.class, document::derive);
        assertEquals(EafError.MISSING_TIMESLOT_REF, e.getError());
    }

    @Test
    void derive_ShouldLeaveUnalignedBoundsOpen() {
        EafDocument document = EafDocument.builder()
                .timeOrder(TimeOrder.of(TimeSlot.of("ts1", 0), TimeSlot.unaligned("ts2")))
                .tiers(List.of(Tier.main("words", List.of(
                        Annotation.alignable("a1", "hello", "ts1", "ts2")))))
                .build();

        DerivedAnnotation a1 = document.derive().span("a1").orElseThrow();

        assertEquals(0L, a1.start());
        assertNull(a1.end());
        assertFalse(a1.hasSpan());
    }

    @Test
    void derive_ShouldBeIdempotent() {
        IndexedEaf indexed = EafFixtures.tokenized().index();

        Derivation first = DerivationEngine.derive(indexed);
        Derivation second = DerivationEngine.derive(indexed);

        assertEquals(first, second);
        assertEquals(4, first.size());
    }
}
