package com.vidnyan.eaf.domain.engine;

import com.vidnyan.eaf.domain.EafFixtures;
import com.vidnyan.eaf.domain.error.EafError;
import com.vidnyan.eaf.domain.error.EafException;
import com.vidnyan.eaf.domain.model.*;
import com.vidnyan.eaf.domain.model.meta.LinguisticType;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MergeEngineTest {

    @Test
    void merge_ShouldCombineTiersAndSortByStart() {
        EafDocument first = EafFixtures.tier("speaker1", "a", 0, 100, "c", 200, 300, "e", 400, 500);
        EafDocument second = EafFixtures.tier("speaker1", "b", 100, 200, "d", 300, 400);

        DerivedEaf merged = MergeEngine.merge(List.of(first, second));

        assertEquals(List.of("speaker1"), merged.tierIds());
        assertEquals(List.of("a", "b", "c", "d", "e"), merged.document().requireTier("speaker1").values());
        assertEquals(10, merged.document().timeOrder().size());
        assertEquals(List.of("a1", "a2", "a3", "a4", "a5"),
                merged.document().annotations().stream().map(Annotation::id).toList());

        List<Long> starts = merged.spans("speaker1").stream().map(DerivedAnnotation::start).toList();
        assertEquals(List.of(0L, 100L, 200L, 300L, 400L), starts);
    }

    @Test
    void merge_ShouldResolveCollidingIds() {
        EafDocument first = EafFixtures.wordsAndTranslit();
        EafDocument second = EafFixtures.wordsAndTranslit().shift(2000, false);

        DerivedEaf merged = MergeEngine.merge(List.of(first, second));

        List<Annotation> annotations = merged.document().annotations();
        Set<String> ids = new HashSet<>();
        annotations.forEach(a -> assertTrue(ids.add(a.id()), "duplicate id " + a.id()));
        assertEquals(6, annotations.size());

        List<String> words = merged.index().annotationsOf("words");
        for (Annotation annotation : merged.document().requireTier("translit").annotations()) {
            String parent = annotation.parentId().orElseThrow();
            assertTrue(words.contains(parent));
        }
        assertEquals(List.of(0L, 2000L),
                merged.spans("translit").stream().map(DerivedAnnotation::start).toList());
        // tiers sorted by id
        assertEquals(List.of("translit", "words"), merged.tierIds());
    }

    @Test
    void merge_ShouldUnionMetadataByValue() {
        EafDocument first = EafFixtures.wordsAndTranslit();
        EafDocument second = EafFixtures.tier("notes", "n", 5000, 6000);

        DerivedEaf merged = MergeEngine.merge(List.of(first, second));

        assertEquals(2, merged.document().linguisticTypes().size());
        assertTrue(merged.document().linguisticTypes().contains(LinguisticType.defaultType()));
        assertEquals(List.of("notes", "translit", "words"), merged.tierIds());
    }

    @Test
    void merge_ShouldFailOnOverlap() {
        EafDocument first = EafFixtures.tier("speaker1", "a", 0, 500);
        EafDocument second = EafFixtures.tier("speaker1", "b", 250, 750);

        EafException e = assertThrows(EafException.class, () -> MergeEngine.merge(List.of(first, second)));
        assertEquals(EafError.ANNOTATION_OVERLAP, e.getError());
    }

    @Test
    void merge_ShouldNameOriginalAnnotationsInOverlapError() {
        // Arrange
        EafDocument first = EafFixtures.tier("speaker1", "a", 0, 500, "b", 600, 700);
        EafDocument second = EafFixtures.tier("speaker1", "c", 650, 900);

        // Act
        EafException e = assertThrows(EafException.class, () -> MergeEngine.merge(List.of(first, second)));

        // Assert
        assertEquals(EafError.ANNOTATION_OVERLAP, e.getError());
        assertTrue(e.getMessage().contains("'a2' (input 1)"), e.getMessage());
        assertTrue(e.getMessage().contains("'a1' (input 2)"), e.getMessage());
        assertFalse(e.getMessage().matches(".*[0-9a-f]{8}-[0-9a-f]{4}-.*"), e.getMessage());
    }

    @Test
    void merge_ShouldAcceptUnalignedSlotsLikeValidation() {
        // Arrange
        TimeOrder timeOrder = TimeOrder.of(
                TimeSlot.of("ts1", 0),
                TimeSlot.unaligned("ts2"),
                TimeSlot.of("ts3", 900));
        EafDocument document = EafDocument.empty().toBuilder()
                .timeOrder(timeOrder)
                .tiers(List.of(Tier.main("speaker1", List.of(
                        Annotation.alignable("a1", "first", "ts1", "ts2"),
                        Annotation.alignable("a2", "second", "ts2", "ts3")))))
                .build();

        // Act
        DerivedEaf merged = MergeEngine.merge(List.of(document));

        // Assert
        assertTrue(Validation.validate(document).isValid());
        assertEquals(List.of("first", "second"), merged.document().requireTier("speaker1").values());
        assertEquals(4, merged.document().timeOrder().size());
        assertEquals(0L, merged.span("a1").orElseThrow().start());
        assertNull(merged.span("a1").orElseThrow().end());
        assertEquals(900L, merged.span("a2").orElseThrow().end());
        assertTrue(Validation.validate(merged.document()).isValid());
    }

    @Test
    void merge_ShouldKeepTokenChainsResolvable() {
        // Arrange
        EafDocument first = EafFixtures.tokenized();
        EafDocument second = EafFixtures.tokenized().shift(1000, false);

        // Act
        DerivedEaf merged = MergeEngine.merge(List.of(first, second));

        // Assert
        Tier tokens = merged.document().requireTier("tokens");
        assertEquals(6, tokens.size());

        Set<String> ids = new HashSet<>();
        merged.document().annotations().forEach(a -> assertTrue(ids.add(a.id()), "duplicate id " + a.id()));

        List<String> words = merged.index().annotationsOf("words");
        int chained = 0;
        for (Annotation annotation : tokens.annotations()) {
            RefAnnotation token = (RefAnnotation) annotation;
            assertTrue(words.contains(token.annotationRef()));
            if (token.previousAnnotation() != null) {
                RefAnnotation previous = (RefAnnotation) tokens.find(token.previousAnnotation()).orElseThrow();
                assertEquals(token.annotationRef(), previous.annotationRef());
                chained++;
            }
        }
        assertEquals(4, chained);
        assertEquals(List.of("one", "two", "three", "one", "two", "three"), tokens.values());
        assertEquals(List.of(0L, 0L, 0L, 1000L, 1000L, 1000L),
                merged.spans("tokens").stream().map(DerivedAnnotation::start).toList());
    }

    @Test
    void merge_ShouldRejectTierKindMismatch() {
        EafDocument first = EafFixtures.tier("t", "a", 0, 100);
        EafDocument second = EafFixtures.tier("p", "b", 0, 100)
                .addTier(Tier.referred("t", "p", "lt", List.of(Annotation.referred("r1", "B", "a1"))));

        EafException e = assertThrows(EafException.class, () -> MergeEngine.merge(List.of(first, second)));
        assertEquals(EafError.TIER_TYPE_MISMATCH, e.getError());
        assertEquals("Tier 't' is main in one document and referred in another", e.getMessage());
    }

    @Test
    void merge_ShouldRequireInput() {
        EafException e = assertThrows(EafException.class, () -> MergeEngine.merge(List.of()));
        assertEquals(EafError.NO_DATA, e.getError());
    }

    @Test
    void merge_ShouldRejectUnimplementedStrategy() {
        List<EafDocument> documents = List.of(EafFixtures.wordsAndTranslit());

        EafException e = assertThrows(EafException.class,
                () -> MergeEngine.merge(documents, OverlapStrategy.JOIN));
        assertEquals(EafError.UNSUPPORTED_OVERLAP_STRATEGY, e.getError());
        assertEquals(EafError.Category.INPUT, e.getCategory());
    }
}
