package com.vidnyan.eaf.domain.index;

import com.vidnyan.eaf.domain.model.AlignableAnnotation;
import com.vidnyan.eaf.domain.model.Annotation;
import com.vidnyan.eaf.domain.model.EafDocument;
import com.vidnyan.eaf.domain.model.RefAnnotation;
import com.vidnyan.eaf.domain.model.Tier;

import java.util.*;

/**
 * Precomputed lookups over a document's references.
 * Built in one pass over tiers and annotations in document order; never fails
 * and is never patched. Immutable and thread-safe.
 */
public final class ReferenceIndex {

    private final Map<String, String> annotationToTier;
    private final Map<String, String> annotationToParent;
    private final Map<String, List<String>> tierToAnnotations;
    private final Map<String, String> tierToParent;
    private final Map<String, Long> timeslotValues;   // slot id → value, values may be null
    private final Map<Long, String> timeslotIds;      // value → first slot id with that value
    private final Map<String, TimeslotRefs> annotationToTimeslots;
    private final Map<String, Position> annotationPositions;
    private final Map<String, Integer> tierPositions;

    private ReferenceIndex(
            Map<String, String> annotationToTier,
            Map<String, String> annotationToParent,
            Map<String, List<String>> tierToAnnotations,
            Map<String, String> tierToParent,
            Map<String, Long> timeslotValues,
            Map<Long, String> timeslotIds,
            Map<String, TimeslotRefs> annotationToTimeslots,
            Map<String, Position> annotationPositions,
            Map<String, Integer> tierPositions
    ) {
        this.annotationToTier = Collections.unmodifiableMap(annotationToTier);
        this.annotationToParent = Collections.unmodifiableMap(annotationToParent);
        this.tierToAnnotations = Collections.unmodifiableMap(tierToAnnotations);
        this.tierToParent = Collections.unmodifiableMap(tierToParent);
        this.timeslotValues = Collections.unmodifiableMap(timeslotValues);
        this.timeslotIds = Collections.unmodifiableMap(timeslotIds);
        this.annotationToTimeslots = Collections.unmodifiableMap(annotationToTimeslots);
        this.annotationPositions = Collections.unmodifiableMap(annotationPositions);
        this.tierPositions = Collections.unmodifiableMap(tierPositions);
    }

    /**
     * Build the index from a document.
     * If an ID occurs more than once the last occurrence wins.
     */
    public static ReferenceIndex build(EafDocument document) {
        Map<String, String> a2t = new HashMap<>();
        Map<String, String> a2p = new HashMap<>();
        Map<String, List<String>> t2a = new LinkedHashMap<>();
        Map<String, String> t2p = new HashMap<>();
        Map<String, TimeslotRefs> a2ts = new HashMap<>();
        Map<String, Position> aPos = new HashMap<>();
        Map<String, Integer> tPos = new LinkedHashMap<>();

        List<Tier> tiers = document.tiers();
        for (int t = 0; t < tiers.size(); t++) {
            Tier tier = tiers.get(t);
            tPos.put(tier.id(), t);
            if (tier.parentRef() != null) {
                t2p.put(tier.id(), tier.parentRef());
            }

            List<String> ids = new ArrayList<>(tier.size());
            List<Annotation> annotations = tier.annotations();
            for (int a = 0; a < annotations.size(); a++) {
                Annotation annotation = annotations.get(a);
                ids.add(annotation.id());
                a2t.put(annotation.id(), tier.id());
                aPos.put(annotation.id(), new Position(t, a));

                if (annotation instanceof AlignableAnnotation al) {
                    a2ts.put(al.id(), new TimeslotRefs(al.timeSlotRef1(), al.timeSlotRef2()));
                } else if (annotation instanceof RefAnnotation ref) {
                    a2p.put(ref.id(), ref.annotationRef());
                }
            }
            t2a.put(tier.id(), Collections.unmodifiableList(ids));
        }

        return new ReferenceIndex(
                a2t, a2p, t2a, t2p,
                document.timeOrder().valuesById(),
                document.timeOrder().idsByValue(),
                a2ts, aPos, tPos
        );
    }

    /**
     * Get the ID of the tier owning an annotation.
     */
    public Optional<String> tierOf(String annotationId) {
        return Optional.ofNullable(annotationToTier.get(annotationId));
    }

    /**
     * Get the parent annotation ID of a referred annotation.
     */
    public Optional<String> parentOf(String annotationId) {
        return Optional.ofNullable(annotationToParent.get(annotationId));
    }

    /**
     * Get annotation IDs of a tier in document order.
     */
    public List<String> annotationsOf(String tierId) {
        return tierToAnnotations.getOrDefault(tierId, List.of());
    }

    /**
     * Get the parent tier ID of a referred tier.
     */
    public Optional<String> parentTierOf(String tierId) {
        return Optional.ofNullable(tierToParent.get(tierId));
    }

    /**
     * Get the IDs of tiers whose parent is the given tier, in document order.
     */
    public List<String> childTiersOf(String tierId) {
        return tierPositions.keySet().stream()
                .filter(id -> tierId.equals(tierToParent.get(id)))
                .toList();
    }

    /**
     * Get the time slot reference pair of an alignable annotation.
     */
    public Optional<TimeslotRefs> timeslotsOf(String annotationId) {
        return Optional.ofNullable(annotationToTimeslots.get(annotationId));
    }

    public boolean hasTimeslot(String timeslotId) {
        return timeslotValues.containsKey(timeslotId);
    }

    /**
     * Get the value of a time slot. Empty if the slot is unknown or unaligned.
     */
    public Optional<Long> timeslotValue(String timeslotId) {
        return Optional.ofNullable(timeslotValues.get(timeslotId));
    }

    public Optional<String> timeslotId(long value) {
        return Optional.ofNullable(timeslotIds.get(value));
    }

    public Optional<Position> positionOf(String annotationId) {
        return Optional.ofNullable(annotationPositions.get(annotationId));
    }

    public Optional<Integer> tierPosition(String tierId) {
        return Optional.ofNullable(tierPositions.get(tierId));
    }

    public boolean hasTier(String tierId) {
        return tierPositions.containsKey(tierId);
    }

    public boolean hasAnnotation(String annotationId) {
        return annotationToTier.containsKey(annotationId);
    }

    /**
     * Get all tier IDs in document order.
     */
    public List<String> tierIds() {
        return List.copyOf(tierPositions.keySet());
    }

    /**
     * Get statistics.
     */
    public Stats stats() {
        return new Stats(
                tierPositions.size(),
                annotationToTier.size(),
                annotationToParent.size(),
                timeslotValues.size()
        );
    }

    /**
     * Location of an annotation: tier position in the document and annotation
     * position within the tier.
     */
    public record Position(int tier, int annotation) {}

    public record TimeslotRefs(String start, String end) {}

    public record Stats(int tierCount, int annotationCount, int referredCount, int timeslotCount) {}
}
