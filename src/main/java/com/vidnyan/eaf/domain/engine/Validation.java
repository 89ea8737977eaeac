package com.vidnyan.eaf.domain.engine;

import com.vidnyan.eaf.domain.engine.ValidationReport.Issue;
import com.vidnyan.eaf.domain.error.EafError;
import com.vidnyan.eaf.domain.error.EafException;
import com.vidnyan.eaf.domain.index.TierHierarchy;
import com.vidnyan.eaf.domain.model.AlignableAnnotation;
import com.vidnyan.eaf.domain.model.Annotation;
import com.vidnyan.eaf.domain.model.Derivation;
import com.vidnyan.eaf.domain.model.DerivedAnnotation;
import com.vidnyan.eaf.domain.model.DerivedEaf;
import com.vidnyan.eaf.domain.model.EafDocument;
import com.vidnyan.eaf.domain.model.RefAnnotation;
import com.vidnyan.eaf.domain.model.Tier;
import com.vidnyan.eaf.domain.model.TimeOrder;
import lombok.extern.slf4j.Slf4j;

import java.util.*;

/**
 * Consistency checks over tiers, annotations and time slots.
 */
@Slf4j
public final class Validation {

    private Validation() {
    }

    /**
     * Check if any two annotations overlap in time. Spans are taken from the
     * derivation and treated as half-open, so touching annotations do not overlap.
     *
     * @throws EafException MISSING_TIMESLOT_VALUE if an annotation has no resolved span
     */
    public static boolean overlap(List<? extends Annotation> annotations, Derivation derivation) {
        List<DerivedAnnotation> spans = new ArrayList<>(annotations.size());
        for (Annotation annotation : annotations) {
            DerivedAnnotation span = derivation.get(annotation.id())
                    .filter(DerivedAnnotation::hasSpan)
                    .orElseThrow(() -> EafException.of(EafError.MISSING_TIMESLOT_VALUE, annotation.id()));
            spans.add(span);
        }
        spans.sort(Comparator.comparing(DerivedAnnotation::start));

        for (int i = 0; i + 1 < spans.size(); i++) {
            if (spans.get(i).end() > spans.get(i + 1).start()) {
                return true;
            }
        }
        return false;
    }

    /**
     * First pair of overlapping annotations, in start order. Annotations without
     * a resolved span (unaligned time slots) are left out.
     */
    public static Optional<List<String>> firstOverlap(List<? extends Annotation> annotations,
                                                      Derivation derivation) {
        List<DerivedAnnotation> spans = annotations.stream()
                .map(a -> derivation.get(a.id()))
                .flatMap(Optional::stream)
                .filter(DerivedAnnotation::hasSpan)
                .sorted(Comparator.comparing(DerivedAnnotation::start))
                .toList();
        for (int i = 0; i + 1 < spans.size(); i++) {
            if (spans.get(i).end() > spans.get(i + 1).start()) {
                return Optional.of(List.of(spans.get(i).annotationId(), spans.get(i + 1).annotationId()));
            }
        }
        return Optional.empty();
    }

    public static boolean hasDuplicateTimeslotIds(TimeOrder timeOrder) {
        return timeOrder.hasDuplicateIds();
    }

    public static boolean hasDuplicateTierIds(EafDocument document) {
        return new HashSet<>(document.tierIds()).size() < document.tierCount();
    }

    public static boolean hasDuplicateAnnotationIds(EafDocument document) {
        return document.annotations().stream().map(Annotation::id).distinct().count()
                < document.annotationCount();
    }

    /**
     * Check that all annotations in a tier match the tier kind.
     */
    public static boolean tierTypeMatches(Tier tier) {
        return tier.typeMatches();
    }

    /**
     * Run every check and collect the problems found.
     * Derivation errors are reported as issues instead of being thrown.
     */
    public static ValidationReport validate(EafDocument document) {
        List<Issue> issues = new ArrayList<>();

        issues.addAll(duplicateIds(document));
        issues.addAll(tierStructure(document));
        issues.addAll(references(document));

        try {
            DerivedEaf derived = document.derive();
            issues.addAll(overlaps(derived));
        } catch (EafException e) {
            // Already reported by the reference checks
            if (issues.stream().noneMatch(i -> i.error() == e.getError())) {
                issues.add(new Issue(e.getError(), null, e.getMessage()));
            }
        }

        log.debug("Validated document with {} tiers: {} issues", document.tierCount(), issues.size());
        return new ValidationReport(issues);
    }

    private static List<Issue> duplicateIds(EafDocument document) {
        List<Issue> issues = new ArrayList<>();
        Set<String> tiers = new HashSet<>();
        for (String id : document.tierIds()) {
            if (!tiers.add(id)) {
                issues.add(Issue.of(EafError.DUPLICATE_TIER_ID, id, id));
            }
        }
        Set<String> annotations = new HashSet<>();
        for (Annotation annotation : document.annotations()) {
            if (!annotations.add(annotation.id())) {
                issues.add(Issue.of(EafError.DUPLICATE_ANNOTATION_ID, annotation.id(), annotation.id()));
            }
        }
        for (String id : document.timeOrder().duplicateIds()) {
            issues.add(Issue.of(EafError.DUPLICATE_TIMESLOT_ID, id, id));
        }
        return issues;
    }

    private static List<Issue> tierStructure(EafDocument document) {
        List<Issue> issues = new ArrayList<>();
        TierHierarchy hierarchy = TierHierarchy.build(document);

        hierarchy.missingParents().forEach((tier, parent) ->
                issues.add(Issue.of(EafError.MISSING_PARENT_TIER, tier, parent, tier)));
        for (List<String> cycle : hierarchy.findCycles()) {
            issues.add(Issue.of(EafError.TIER_CYCLE, cycle.get(0), String.join(" -> ", cycle)));
        }

        for (Tier tier : document.tiers()) {
            tier.annotations().stream()
                    .filter(a -> a.isReferred() != tier.isReferred())
                    .findFirst()
                    .ifPresent(a -> issues.add(Issue.of(EafError.ANNOTATION_TYPE_MISMATCH, a.id(), a.id(), tier.id())));

            if (tier.isReferred() && !tier.isTokenized()) {
                document.getTier(tier.parentRef())
                        .filter(parent -> !parent.isTokenized() && tier.size() > parent.size())
                        .ifPresent(parent -> issues.add(
                                Issue.of(EafError.TIER_ALIGNMENT, tier.id(), tier.id(), parent.id())));
            }
        }
        return issues;
    }

    private static List<Issue> references(EafDocument document) {
        List<Issue> issues = new ArrayList<>();
        for (Tier tier : document.tiers()) {
            Optional<Tier> parent = tier.isReferred() ? document.getTier(tier.parentRef()) : Optional.empty();
            for (Annotation annotation : tier.annotations()) {
                if (annotation instanceof AlignableAnnotation al) {
                    if (!al.hasTimeSlotRefs()
                            || !document.timeOrder().containsId(al.timeSlotRef1())
                            || !document.timeOrder().containsId(al.timeSlotRef2())) {
                        issues.add(Issue.of(EafError.MISSING_TIMESLOT_REF, al.id(), al.id()));
                    }
                } else if (annotation instanceof RefAnnotation ref && parent.isPresent()
                        && parent.get().find(ref.annotationRef()).isEmpty()) {
                    issues.add(new Issue(EafError.INVALID_ANNOTATION_ID, ref.id(), String.format(
                            "Parent annotation '%s' of '%s' is not in tier '%s'",
                            ref.annotationRef(), ref.id(), parent.get().id())));
                }
            }
        }
        return issues;
    }

    /**
     * Overlap check per main tier. Annotations with unaligned time slots are skipped.
     * Runs per tier in parallel.
     */
    private static List<Issue> overlaps(DerivedEaf derived) {
        Derivation derivation = derived.derivation();
        return derived.document().tiers().parallelStream()
                .filter(Tier::isMain)
                .flatMap(tier -> firstOverlap(tier.annotations(), derivation).stream()
                        .map(pair -> Issue.of(EafError.ANNOTATION_OVERLAP, tier.id(),
                                tier.id(), pair.get(0), pair.get(1))))
                .toList();
    }
}
