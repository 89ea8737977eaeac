package com.vidnyan.eaf.domain.engine;

import com.vidnyan.eaf.domain.error.EafError;
import com.vidnyan.eaf.domain.error.EafException;
import com.vidnyan.eaf.domain.model.AlignableAnnotation;
import com.vidnyan.eaf.domain.model.Annotation;
import com.vidnyan.eaf.domain.model.DerivedEaf;
import com.vidnyan.eaf.domain.model.EafDocument;
import com.vidnyan.eaf.domain.model.RefAnnotation;
import com.vidnyan.eaf.domain.model.Tier;
import com.vidnyan.eaf.domain.model.TimeOrder;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Renumbers annotation and time slot IDs while keeping every reference intact.
 * Time slots become ts{timeslotStart}, ts{timeslotStart + 1}, ... in their
 * current order; annotations become a{annotationStart}, ... in document order.
 */
@Slf4j
public final class RemapEngine {

    private static final String ANNOTATION_PREFIX = "a";

    private RemapEngine() {
    }

    /**
     * Remap a derived document. The result is indexed and derived again.
     *
     * @throws EafException DUPLICATE_ANNOTATION_ID if an annotation ID occurs twice,
     *                      INVALID_TIMESLOT_ID if an alignable annotation refers to an unknown slot
     */
    public static DerivedEaf remap(DerivedEaf derived, int annotationStart, int timeslotStart) {
        EafDocument document = derived.document();

        // Phase 1: rename maps
        TimeOrder.Renumbered slots = document.timeOrder().renumber(timeslotStart);
        Map<String, String> annotationIds = new HashMap<>();
        int next = annotationStart;
        for (Annotation annotation : document.annotations()) {
            if (annotationIds.put(annotation.id(), ANNOTATION_PREFIX + next++) != null) {
                throw EafException.of(EafError.DUPLICATE_ANNOTATION_ID, annotation.id());
            }
        }

        // Phase 2: apply
        List<Tier> tiers = new ArrayList<>(document.tierCount());
        for (Tier tier : document.tiers()) {
            List<Annotation> annotations = new ArrayList<>(tier.size());
            for (Annotation annotation : tier.annotations()) {
                annotations.add(rename(annotation, annotationIds, slots.renames()));
            }
            tiers.add(tier.withAnnotations(annotations));
        }

        EafDocument remapped = document.toBuilder()
                .timeOrder(slots.timeOrder())
                .tiers(tiers)
                .build();

        log.debug("Remapped {} annotations from a{} and {} time slots from ts{}",
                annotationIds.size(), annotationStart, slots.timeOrder().size(), timeslotStart);
        return remapped.derive();
    }

    private static Annotation rename(Annotation annotation,
                                     Map<String, String> annotationIds,
                                     Map<String, String> slotIds) {
        String newId = annotationIds.get(annotation.id());
        if (annotation instanceof AlignableAnnotation al) {
            return al.withId(newId).withTimeSlotRefs(
                    renameSlot(al.timeSlotRef1(), slotIds),
                    renameSlot(al.timeSlotRef2(), slotIds));
        }
        RefAnnotation ref = (RefAnnotation) annotation;
        String previous = ref.previousAnnotation() == null
                ? null
                : annotationIds.getOrDefault(ref.previousAnnotation(), ref.previousAnnotation());
        return ref.withId(newId)
                .withAnnotationRef(annotationIds.getOrDefault(ref.annotationRef(), ref.annotationRef()))
                .withPreviousAnnotation(previous);
    }

    private static String renameSlot(String slotId, Map<String, String> slotIds) {
        String renamed = slotId == null ? null : slotIds.get(slotId);
        if (renamed == null) {
            throw EafException.of(EafError.INVALID_TIMESLOT_ID, slotId);
        }
        return renamed;
    }
}
