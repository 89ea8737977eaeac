package com.vidnyan.eaf.domain.model;

import com.vidnyan.eaf.domain.error.EafError;
import com.vidnyan.eaf.domain.error.EafException;
import com.vidnyan.eaf.domain.index.TierHierarchy;
import com.vidnyan.eaf.domain.model.meta.Constraint;
import com.vidnyan.eaf.domain.model.meta.ControlledVocabulary;
import com.vidnyan.eaf.domain.model.meta.Header;
import com.vidnyan.eaf.domain.model.meta.Language;
import com.vidnyan.eaf.domain.model.meta.LinguisticType;
import com.vidnyan.eaf.domain.model.meta.Locale;
import com.vidnyan.eaf.domain.model.meta.StereoType;
import lombok.Builder;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * An ELAN annotation document: ordered tiers, one time order and the metadata
 * tiers refer to. Immutable aggregate root; every mutation returns a new
 * document and leaves this one untouched.
 * <p>
 * Lookups that follow references need an index ({@link #index()}) and time
 * values need a derivation ({@link #derive()}). Both must be recomputed after
 * a mutation, which the phase types enforce.
 */
@Builder(toBuilder = true)
public record EafDocument(
    String author,
    String date,
    String format,
    String version,
    Header header,
    TimeOrder timeOrder,
    List<Tier> tiers,
    List<LinguisticType> linguisticTypes,
    List<Locale> locales,
    List<Language> languages,
    List<Constraint> constraints,
    List<ControlledVocabulary> controlledVocabularies
) {

    public static final String FORMAT_VERSION = "3.0";

    public EafDocument {
        author = author == null ? "" : author;
        format = format == null ? FORMAT_VERSION : format;
        version = version == null ? FORMAT_VERSION : version;
        header = header == null ? Header.empty() : header;
        timeOrder = timeOrder == null ? TimeOrder.empty() : timeOrder;
        tiers = tiers == null ? List.of() : List.copyOf(tiers);
        linguisticTypes = linguisticTypes == null ? List.of() : List.copyOf(linguisticTypes);
        locales = locales == null ? List.of() : List.copyOf(locales);
        languages = languages == null ? List.of() : List.copyOf(languages);
        constraints = constraints == null ? List.of() : List.copyOf(constraints);
        controlledVocabularies = controlledVocabularies == null ? List.of() : List.copyOf(controlledVocabularies);

        Set<String> duplicates = timeOrder.duplicateIds();
        if (!duplicates.isEmpty()) {
            throw EafException.of(EafError.DUPLICATE_TIMESLOT_ID, duplicates.iterator().next());
        }
    }

    /**
     * Empty document with the default linguistic type.
     */
    public static EafDocument empty() {
        return EafDocument.builder()
                .linguisticTypes(List.of(LinguisticType.defaultType()))
                .build();
    }

    /**
     * Document with a single main tier built from (value, start, end) triples.
     * Annotation IDs are a1, a2, ... and time slot IDs ts1, ts2, ...
     */
    public static EafDocument fromValues(String tierId, List<TimedValue> values) {
        List<Annotation> annotations = new ArrayList<>();
        List<Long> slotValues = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            TimedValue v = values.get(i);
            if (v.start() > v.end()) {
                throw EafException.of(EafError.INVALID_TIME_SPAN, v.start(), v.end());
            }
            annotations.add(Annotation.alignable("a" + (i + 1), v.value(),
                    "ts" + (2 * i + 1), "ts" + (2 * i + 2)));
            slotValues.add(v.start());
            slotValues.add(v.end());
        }
        return empty().toBuilder()
                .timeOrder(TimeOrder.fromValues(slotValues, 1))
                .tiers(List.of(Tier.main(tierId, annotations)))
                .build();
    }

    // Phases

    /**
     * Build the reference index for this document.
     */
    public IndexedEaf index() {
        return IndexedEaf.of(this);
    }

    /**
     * Index and derive in one step.
     */
    public DerivedEaf derive() {
        return index().derive();
    }

    // Queries

    public List<String> tierIds() {
        return tiers.stream().map(Tier::id).toList();
    }

    public List<String> mainTierIds() {
        return tiers.stream().filter(Tier::isMain).map(Tier::id).toList();
    }

    public List<String> refTierIds() {
        return tiers.stream().filter(Tier::isReferred).map(Tier::id).toList();
    }

    public Optional<Tier> getTier(String tierId) {
        return tiers.stream()
                .filter(t -> t.id().equals(tierId))
                .findFirst();
    }

    public Tier requireTier(String tierId) {
        return getTier(tierId).orElseThrow(() -> EafException.of(EafError.INVALID_TIER_ID, tierId));
    }

    /**
     * All annotations in document order.
     */
    public List<Annotation> annotations() {
        return tiers.stream()
                .flatMap(t -> t.annotations().stream())
                .toList();
    }

    public List<Annotation> annotations(String tierId) {
        return requireTier(tierId).annotations();
    }

    public Optional<Annotation> findAnnotation(String annotationId) {
        return tiers.stream()
                .flatMap(t -> t.annotations().stream())
                .filter(a -> a.id().equals(annotationId))
                .findFirst();
    }

    public int annotationCount() {
        return tiers.stream().mapToInt(Tier::size).sum();
    }

    public int tierCount() {
        return tiers.size();
    }

    /**
     * Case sensitive or insensitive substring search over annotation values.
     * Positions are 1-based within each tier.
     */
    public List<QueryMatch> query(String pattern, boolean ignoreCase) {
        String needle = ignoreCase ? pattern.toLowerCase() : pattern;
        List<QueryMatch> matches = new ArrayList<>();
        for (Tier tier : tiers) {
            List<Annotation> annotations = tier.annotations();
            for (int i = 0; i < annotations.size(); i++) {
                Annotation a = annotations.get(i);
                String haystack = ignoreCase ? a.text().toLowerCase() : a.text();
                if (haystack.contains(needle)) {
                    matches.add(new QueryMatch(i + 1, tier.id(), a.id(), a.text(),
                            a.parentId().orElse(null)));
                }
            }
        }
        return matches;
    }

    /**
     * Next free annotation ID, "a" followed by the highest numerical suffix + 1.
     */
    public String generateAnnotationId() {
        long next = tiers.stream()
                .flatMap(t -> t.annotations().stream())
                .map(a -> IdNumbers.suffix(a.id()))
                .flatMap(Optional::stream)
                .max(Long::compare)
                .map(n -> n + 1)
                .orElse(1L);
        return "a" + next;
    }

    public String generateTimeslotId() {
        return timeOrder.generateId();
    }

    // Mutations

    public EafDocument withTimeOrder(TimeOrder newTimeOrder) {
        return toBuilder().timeOrder(newTimeOrder).build();
    }

    public EafDocument withTiers(List<Tier> newTiers) {
        return toBuilder().tiers(newTiers).build();
    }

    public EafDocument addTimeslot(String id, Long value) {
        return withTimeOrder(timeOrder.add(id, value));
    }

    /**
     * Shift all time values.
     */
    public EafDocument shift(long ms, boolean allowNegative) {
        return withTimeOrder(timeOrder.shift(ms, allowNegative));
    }

    public EafDocument addTier(Tier tier) {
        return addTier(tier, null);
    }

    /**
     * Append a tier. A referred tier's parent must already exist, annotation
     * variants must match the tier kind and all IDs must be new. The tier's
     * linguistic type (and the stereotype's constraint) is added if missing.
     */
    public EafDocument addTier(Tier tier, StereoType stereotype) {
        if (getTier(tier.id()).isPresent()) {
            throw EafException.of(EafError.DUPLICATE_TIER_ID, tier.id());
        }
        if (tier.isReferred() && getTier(tier.parentRef()).isEmpty()) {
            throw EafException.of(EafError.MISSING_PARENT_TIER, tier.parentRef(), tier.id());
        }
        Set<String> existingIds = new HashSet<>();
        annotations().forEach(a -> existingIds.add(a.id()));
        for (Annotation a : tier.annotations()) {
            if (a.isReferred() != tier.isReferred()) {
                throw EafException.of(EafError.ANNOTATION_TYPE_MISMATCH, a.id(), tier.id());
            }
            if (!existingIds.add(a.id())) {
                throw EafException.of(EafError.ANNOTATION_ID_EXISTS, a.id());
            }
            if (a instanceof AlignableAnnotation al) {
                requireTimeslot(al.timeSlotRef1());
                requireTimeslot(al.timeSlotRef2());
            }
        }

        List<LinguisticType> types = new ArrayList<>(linguisticTypes);
        List<Constraint> newConstraints = new ArrayList<>(constraints);
        boolean typeKnown = types.stream().anyMatch(lt -> lt.id().equals(tier.linguisticTypeRef()));
        if (!typeKnown) {
            types.add(LinguisticType.of(tier.linguisticTypeRef(), stereotype));
            if (stereotype != null && newConstraints.stream().noneMatch(c -> c.stereotype() == stereotype)) {
                newConstraints.add(Constraint.of(stereotype));
            }
        }

        List<Tier> newTiers = new ArrayList<>(tiers);
        newTiers.add(tier);
        return toBuilder()
                .tiers(newTiers)
                .linguisticTypes(types)
                .constraints(newConstraints)
                .build();
    }

    /**
     * Remove a tier together with every tier that depends on it.
     */
    public EafDocument removeTier(String tierId) {
        requireTier(tierId);
        Set<String> removed = new HashSet<>(TierHierarchy.build(this).descendants(tierId));
        removed.add(tierId);
        return withTiers(tiers.stream()
                .filter(t -> !removed.contains(t.id()))
                .toList());
    }

    /**
     * Append an annotation to a tier. The ID must be new, the variant must match
     * the tier kind and every reference (time slots, parent, previous) must resolve.
     */
    public EafDocument addAnnotation(String tierId, Annotation annotation) {
        Tier tier = requireTier(tierId);
        if (findAnnotation(annotation.id()).isPresent()) {
            throw EafException.of(EafError.ANNOTATION_ID_EXISTS, annotation.id());
        }
        if (annotation.isReferred() != tier.isReferred()) {
            throw EafException.of(EafError.ANNOTATION_TYPE_MISMATCH, annotation.id(), tierId);
        }
        if (annotation instanceof AlignableAnnotation al) {
            requireTimeslot(al.timeSlotRef1());
            requireTimeslot(al.timeSlotRef2());
        } else if (annotation instanceof RefAnnotation ref) {
            Tier parent = requireTier(tier.parentRef());
            if (parent.find(ref.annotationRef()).isEmpty()) {
                throw EafException.of(EafError.INVALID_ANNOTATION_ID, ref.annotationRef());
            }
            if (ref.previousAnnotation() != null && tier.find(ref.previousAnnotation()).isEmpty()) {
                throw EafException.of(EafError.INVALID_ANNOTATION_ID, ref.previousAnnotation());
            }
        }

        List<Annotation> annotations = new ArrayList<>(tier.annotations());
        annotations.add(annotation);
        return replaceTier(tier.withAnnotations(annotations));
    }

    /**
     * Add a time-aligned annotation to a main tier, generating its ID and two
     * new time slots. The annotation is placed before the first annotation
     * starting later.
     */
    public EafDocument addAlignableAnnotation(String tierId, String value, long start, long end) {
        if (start > end) {
            throw EafException.of(EafError.INVALID_TIME_SPAN, start, end);
        }
        Tier tier = requireTier(tierId);
        if (tier.isReferred()) {
            throw EafException.of(EafError.ANNOTATION_TYPE_MISMATCH, generateAnnotationId(), tierId);
        }

        String ts1 = timeOrder.generateId();
        TimeOrder withStart = timeOrder.add(ts1, start);
        String ts2 = withStart.generateId();
        TimeOrder withBoth = withStart.add(ts2, end);

        AlignableAnnotation annotation = Annotation.alignable(generateAnnotationId(), value, ts1, ts2);
        Map<String, Long> values = timeOrder.valuesById();
        List<Annotation> annotations = new ArrayList<>(tier.annotations());
        int position = annotations.size();
        for (int i = 0; i < annotations.size(); i++) {
            if (annotations.get(i) instanceof AlignableAnnotation other) {
                Long otherStart = values.get(other.timeSlotRef1());
                if (otherStart != null && otherStart > start) {
                    position = i;
                    break;
                }
            }
        }
        annotations.add(position, annotation);

        return withTimeOrder(withBoth).replaceTier(tier.withAnnotations(annotations));
    }

    /**
     * Remove an annotation and every annotation that refers to it, directly or
     * through other referred annotations. Tokens following a removed token are
     * relinked to the removed token's predecessor.
     */
    public EafDocument removeAnnotation(String annotationId) {
        if (findAnnotation(annotationId).isEmpty()) {
            throw EafException.of(EafError.INVALID_ANNOTATION_ID, annotationId);
        }

        Set<String> removed = new HashSet<>();
        removed.add(annotationId);
        boolean grew = true;
        while (grew) {
            grew = false;
            for (Annotation a : annotations()) {
                if (a instanceof RefAnnotation ref && removed.contains(ref.annotationRef()) && removed.add(ref.id())) {
                    grew = true;
                }
            }
        }

        Map<String, String> previousOfRemoved = new HashMap<>();
        for (Annotation a : annotations()) {
            if (removed.contains(a.id()) && a instanceof RefAnnotation ref) {
                previousOfRemoved.put(ref.id(), ref.previousAnnotation());
            }
        }

        List<Tier> newTiers = new ArrayList<>(tiers.size());
        for (Tier tier : tiers) {
            List<Annotation> kept = new ArrayList<>();
            for (Annotation a : tier.annotations()) {
                if (removed.contains(a.id())) {
                    continue;
                }
                if (a instanceof RefAnnotation ref && ref.previousAnnotation() != null
                        && removed.contains(ref.previousAnnotation())) {
                    String previous = ref.previousAnnotation();
                    while (previous != null && removed.contains(previous)) {
                        previous = previousOfRemoved.get(previous);
                    }
                    a = ref.withPreviousAnnotation(previous);
                }
                kept.add(a);
            }
            newTiers.add(tier.withAnnotations(kept));
        }
        return withTiers(newTiers);
    }

    /**
     * Prefix every tier ID (and parent reference) with the given string.
     */
    public EafDocument prefixTierIds(String prefix) {
        return withTiers(tiers.stream()
                .map(t -> t.toBuilder()
                        .id(prefix + t.id())
                        .parentRef(t.parentRef() == null ? null : prefix + t.parentRef())
                        .build())
                .toList());
    }

    private EafDocument replaceTier(Tier tier) {
        return withTiers(tiers.stream()
                .map(t -> t.id().equals(tier.id()) ? tier : t)
                .toList());
    }

    private void requireTimeslot(String timeslotId) {
        if (timeslotId == null || !timeOrder.containsId(timeslotId)) {
            throw EafException.of(EafError.INVALID_TIMESLOT_ID, timeslotId);
        }
    }
}
