package com.vidnyan.eaf.domain.engine;

import com.vidnyan.eaf.domain.error.EafError;
import com.vidnyan.eaf.domain.error.EafException;
import com.vidnyan.eaf.domain.model.AlignableAnnotation;
import com.vidnyan.eaf.domain.model.Annotation;
import com.vidnyan.eaf.domain.model.Derivation;
import com.vidnyan.eaf.domain.model.DerivedAnnotation;
import com.vidnyan.eaf.domain.model.DerivedEaf;
import com.vidnyan.eaf.domain.model.EafDocument;
import com.vidnyan.eaf.domain.model.RefAnnotation;
import com.vidnyan.eaf.domain.model.Tier;
import com.vidnyan.eaf.domain.model.TimeOrder;
import com.vidnyan.eaf.domain.model.TimeSlot;
import lombok.extern.slf4j.Slf4j;

import java.util.*;
import java.util.function.Function;

/**
 * Combines several documents into one.
 * <p>
 * Each input is derived and its annotations tagged with random IDs, so
 * identical IDs in different inputs never collide. Tiers with the same ID are
 * joined, annotations sorted by start time, and a new time order is generated
 * from the derived values. Annotations on unaligned time slots take no part
 * in the overlap check and keep their open bounds. The result is renumbered
 * from a1/ts1.
 */
@Slf4j
public final class MergeEngine {

    private MergeEngine() {
    }

    /**
     * Merge documents, failing on overlapping annotations.
     */
    public static DerivedEaf merge(List<EafDocument> documents) {
        return merge(documents, OverlapStrategy.FAIL);
    }

    /**
     * @throws EafException NO_DATA for an empty input, UNSUPPORTED_OVERLAP_STRATEGY,
     *                      TIER_TYPE_MISMATCH if a tier ID is main in one input and
     *                      referred in another, ANNOTATION_OVERLAP on overlapping
     *                      annotations in a merged main tier
     */
    public static DerivedEaf merge(List<EafDocument> documents, OverlapStrategy strategy) {
        if (documents == null || documents.isEmpty()) {
            throw EafException.of(EafError.NO_DATA);
        }
        if (!strategy.implemented()) {
            throw EafException.of(EafError.UNSUPPORTED_OVERLAP_STRATEGY, strategy);
        }

        // Step 1: derive and tag each input
        Map<String, DerivedAnnotation> spans = new HashMap<>();
        Map<String, Origin> origins = new HashMap<>();
        List<EafDocument> tagged = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            tagged.add(tag(documents.get(i).derive(), i + 1, spans, origins));
        }
        Derivation derivation = new Derivation(spans);

        // Step 2: union metadata
        EafDocument first = documents.get(0);
        EafDocument.EafDocumentBuilder merged = first.toBuilder()
                .date(null)
                .linguisticTypes(union(tagged, EafDocument::linguisticTypes))
                .locales(union(tagged, EafDocument::locales))
                .languages(union(tagged, EafDocument::languages))
                .constraints(union(tagged, EafDocument::constraints))
                .controlledVocabularies(union(tagged, EafDocument::controlledVocabularies));

        // Step 3: union tiers, first contributor supplies the attributes
        Map<String, Tier> tiers = new LinkedHashMap<>();
        Map<String, List<Annotation>> annotations = new HashMap<>();
        for (EafDocument document : tagged) {
            for (Tier tier : document.tiers()) {
                Tier known = tiers.putIfAbsent(tier.id(), tier);
                if (known != null && known.isMain() != tier.isMain()) {
                    throw EafException.of(EafError.TIER_TYPE_MISMATCH, tier.id(), kind(known), kind(tier));
                }
                annotations.computeIfAbsent(tier.id(), k -> new ArrayList<>()).addAll(tier.annotations());
            }
        }

        Comparator<Annotation> byStart = Comparator.comparing(
                (Annotation a) -> derivation.start(a.id()).orElse(null),
                Comparator.nullsLast(Comparator.naturalOrder()));

        List<Tier> sortedTiers = new ArrayList<>(tiers.size());
        for (Tier tier : tiers.values()) {
            List<Annotation> combined = annotations.get(tier.id());
            if (tier.isMain()) {
                Optional<List<String>> overlap = Validation.firstOverlap(combined, derivation);
                if (overlap.isPresent()) {
                    throw EafException.of(EafError.ANNOTATION_OVERLAP, tier.id(),
                            origins.get(overlap.get().get(0)), origins.get(overlap.get().get(1)));
                }
            }
            List<Annotation> sorted = new ArrayList<>(combined);
            sorted.sort(byStart);
            sortedTiers.add(tier.withAnnotations(sorted));
        }
        sortedTiers.sort(Comparator.comparing(Tier::id));

        // Step 4: fresh time order from derived values
        List<TimeSlot> slots = new ArrayList<>();
        List<Tier> alignedTiers = new ArrayList<>(sortedTiers.size());
        for (Tier tier : sortedTiers) {
            List<Annotation> aligned = new ArrayList<>(tier.size());
            for (Annotation annotation : tier.annotations()) {
                if (annotation instanceof AlignableAnnotation al) {
                    DerivedAnnotation span = spans.get(al.id());
                    TimeSlot start = new TimeSlot("ts" + (slots.size() + 1), span.start());
                    TimeSlot end = new TimeSlot("ts" + (slots.size() + 2), span.end());
                    slots.add(start);
                    slots.add(end);
                    aligned.add(al.withTimeSlotRefs(start.id(), end.id()));
                } else {
                    aligned.add(annotation);
                }
            }
            alignedTiers.add(tier.withAnnotations(aligned));
        }
        slots.sort(Comparator.comparing(TimeSlot::value, Comparator.nullsLast(Comparator.naturalOrder())));

        EafDocument result = merged
                .timeOrder(new TimeOrder(slots))
                .tiers(alignedTiers)
                .build();

        log.debug("Merged {} documents into {} tiers, {} annotations, {} time slots",
                documents.size(), result.tierCount(), result.annotationCount(), slots.size());

        // Step 5: clean IDs
        return result.derive().remap(1, 1);
    }

    /**
     * Give every annotation a random ID and rewrite parent and previous references.
     * Derived values are recorded under the new IDs, the original ID under {@code origins}.
     */
    private static EafDocument tag(DerivedEaf derived, int input,
                                   Map<String, DerivedAnnotation> spans, Map<String, Origin> origins) {
        EafDocument document = derived.document();
        Map<String, String> tags = new HashMap<>();
        for (Annotation annotation : document.annotations()) {
            String tag = UUID.randomUUID().toString();
            tags.put(annotation.id(), tag);
            origins.put(tag, new Origin(input, annotation.id()));
        }
        for (Annotation annotation : document.annotations()) {
            String tag = tags.get(annotation.id());
            derived.span(annotation.id()).ifPresent(d -> spans.put(tag, new DerivedAnnotation(
                    tag, d.tierId(), d.start(), d.end(),
                    d.mainAnnotationId() == null ? null : tags.get(d.mainAnnotationId()))));
        }

        List<Tier> tiers = document.tiers().stream()
                .map(tier -> tier.withAnnotations(tier.annotations().stream()
                        .map(a -> retag(a, tags))
                        .toList()))
                .toList();
        return document.withTiers(tiers);
    }

    private static Annotation retag(Annotation annotation, Map<String, String> tags) {
        if (annotation instanceof RefAnnotation ref) {
            String previous = ref.previousAnnotation() == null
                    ? null
                    : tags.getOrDefault(ref.previousAnnotation(), ref.previousAnnotation());
            return ref.withId(tags.get(ref.id()))
                    .withAnnotationRef(tags.getOrDefault(ref.annotationRef(), ref.annotationRef()))
                    .withPreviousAnnotation(previous);
        }
        return annotation.withId(tags.get(annotation.id()));
    }

    private static String kind(Tier tier) {
        return tier.isMain() ? "main" : "referred";
    }

    private static <T> List<T> union(List<EafDocument> documents,
                                     Function<EafDocument, List<T>> collection) {
        Set<T> values = new LinkedHashSet<>();
        documents.forEach(d -> values.addAll(collection.apply(d)));
        return new ArrayList<>(values);
    }

    /**
     * Where a tagged annotation came from. Inputs are numbered from 1.
     */
    private record Origin(int input, String annotationId) {
        @Override
        public String toString() {
            return "'" + annotationId + "' (input " + input + ")";
        }
    }
}
