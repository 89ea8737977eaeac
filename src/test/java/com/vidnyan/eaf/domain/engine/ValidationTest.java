package com.vidnyan.eaf.domain.engine;

import com.vidnyan.eaf.domain.EafFixtures;
import com.vidnyan.eaf.domain.error.EafError;
import com.vidnyan.eaf.domain.error.EafException;
import com.vidnyan.eaf.domain.model.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValidationTest {

    @Test
    void overlap_ShouldDetectOverlappingSpans() {
        DerivedEaf derived = EafFixtures.tier("t", "a", 0, 500, "b", 400, 900).derive();

        assertTrue(Validation.overlap(derived.document().annotations(), derived.derivation()));
    }

    @Test
    void overlap_ShouldTreatTouchingSpansAsDisjoint() {
        DerivedEaf derived = EafFixtures.tier("t", "b", 500, 1000, "a", 0, 500).derive();

        assertFalse(Validation.overlap(derived.document().annotations(), derived.derivation()));
        assertFalse(derived.overlaps("t"));
    }

    @Test
    void overlap_ShouldFailOnUnresolvedSpan() {
        DerivedEaf derived = EafDocument.builder()
                .timeOrder(TimeOrder.of(TimeSlot.of("ts1", 0), TimeSlot.unaligned("ts2")))
                .tiers(List.of(Tier.main("t", List.of(Annotation.alignable("a1", "x", "ts1", "ts2")))))
                .build()
                .derive();

        EafException e = assertThrows(EafException.class,
                () -> Validation.overlap(derived.document().annotations(), derived.derivation()));
        assertEquals(EafError.MISSING_TIMESLOT_VALUE, e.getError());
    }

    @Test
    void duplicateChecks_ShouldCompareCounts() {
        EafDocument document = EafFixtures.wordsAndTranslit();
        EafDocument duplicated = document.withTiers(List.of(
                document.requireTier("words"), Tier.main("words", List.of())));

        assertFalse(Validation.hasDuplicateTierIds(document));
        assertTrue(Validation.hasDuplicateTierIds(duplicated));
        assertFalse(Validation.hasDuplicateTimeslotIds(document.timeOrder()));
        assertFalse(Validation.hasDuplicateAnnotationIds(document));
        assertTrue(Validation.tierTypeMatches(document.requireTier("translit")));
    }

    @Test
    void validate_ShouldAcceptConsistentDocument() {
        ValidationReport report = Validation.validate(EafFixtures.wordsAndTranslit());

        assertTrue(report.isValid(), () -> report.issues().toString());
    }

    @Test
    void validate_ShouldReportTierCycleAndMissingParent() {
        EafDocument document = EafDocument.builder()
                .tiers(List.of(
                        Tier.referred("a", "b", "lt", List.of()),
                        Tier.referred("b", "a", "lt", List.of()),
                        Tier.referred("c", "gone", "lt", List.of())))
                .build();

        ValidationReport report = Validation.validate(document);

        assertTrue(report.has(EafError.TIER_CYCLE));
        assertEquals("c", report.issuesOf(EafError.MISSING_PARENT_TIER).get(0).subjectId());
    }

    @Test
    void validate_ShouldReportMisalignedReferredTier() {
        EafDocument document = EafFixtures.wordsAndTranslit()
                .addAnnotation("translit", Annotation.referred("r2", "WORLD", "a2"))
                .addAnnotation("translit", Annotation.referred("r3", "AGAIN", "a2"));

        ValidationReport report = Validation.validate(document);

        assertTrue(report.has(EafError.TIER_ALIGNMENT));
        assertEquals(EafError.Category.INTEGRITY, report.issuesOf(EafError.TIER_ALIGNMENT).get(0).category());
    }

    @Test
    void validate_ShouldReportOverlapAndParentOutsideParentTier() {
        EafDocument overlapping = EafFixtures.tier("t", "a", 0, 500, "b", 400, 900);
        EafDocument wrongParent = EafFixtures.wordsAndTranslit()
                .addTier(Tier.referred("gloss", "translit", "gloss-lt", List.of()));
        wrongParent = wrongParent.withTiers(wrongParent.tiers().stream()
                .map(t -> t.id().equals("gloss")
                        ? t.withAnnotations(List.of(Annotation.referred("g1", "x", "a1")))
                        : t)
                .toList());

        assertTrue(Validation.validate(overlapping).has(EafError.ANNOTATION_OVERLAP));
        assertEquals("Annotation timespans overlap in tier 't': a1 and a2",
                Validation.validate(overlapping).issuesOf(EafError.ANNOTATION_OVERLAP).get(0).message());
        ValidationReport report = Validation.validate(wrongParent);
        assertTrue(report.has(EafError.INVALID_ANNOTATION_ID));
        assertEquals("g1", report.issuesOf(EafError.INVALID_ANNOTATION_ID).get(0).subjectId());
    }

    @Test
    void validate_ShouldReportDerivationFailure() {
        EafDocument document = EafFixtures.wordsAndTranslit().toBuilder()
                .tiers(List.of(
                        EafFixtures.wordsAndTranslit().requireTier("words"),
                        Tier.referred("translit", "words", "translit-lt", List.of(
                                Annotation.referred("r1", "HELLO", "a9")))))
                .build();

        ValidationReport report = Validation.validate(document);

        assertTrue(report.has(EafError.MISSING_MAIN_ANNOTATION));
    }
}
