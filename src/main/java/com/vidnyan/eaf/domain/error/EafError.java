package com.vidnyan.eaf.domain.error;

/**
 * Error codes raised by the document model and its engines.
 * Each code belongs to one {@link Category} and carries a message template.
 */
public enum EafError {

    // Input
    NO_DATA(Category.INPUT, "Input is empty or contains no relevant data"),
    UNSUPPORTED_OVERLAP_STRATEGY(Category.INPUT, "Overlap strategy %s is not implemented"),

    // Referential
    INVALID_TIER_ID(Category.REFERENTIAL, "No such tier '%s'"),
    INVALID_ANNOTATION_ID(Category.REFERENTIAL, "No such annotation '%s'"),
    INVALID_TIMESLOT_ID(Category.REFERENTIAL, "No such time slot '%s'"),
    MISSING_TIMESLOT_REF(Category.REFERENTIAL, "No time slot reference for annotation '%s'"),
    MISSING_TIMESLOT_VALUE(Category.REFERENTIAL, "No time slot value for annotation '%s'"),
    MISSING_MAIN_ANNOTATION(Category.REFERENTIAL,
            "Missing main annotation for '%s'. No annotation with ID '%s'"),
    MISSING_PARENT_TIER(Category.REFERENTIAL, "Parent tier '%s' of referred tier '%s' does not exist"),
    REFERENCE_CYCLE(Category.REFERENTIAL, "Annotation references form a cycle: %s"),

    // Structural
    ANNOTATION_TYPE_MISMATCH(Category.STRUCTURAL,
            "Annotation '%s' does not match the type of tier '%s'"),
    TIER_TYPE_MISMATCH(Category.STRUCTURAL, "Tier '%s' is %s in one document and %s in another"),
    TIER_CYCLE(Category.STRUCTURAL, "Tier parent references form a cycle: %s"),

    // Integrity
    ANNOTATION_ID_EXISTS(Category.INTEGRITY, "Annotation with ID '%s' already exists"),
    DUPLICATE_ANNOTATION_ID(Category.INTEGRITY, "Annotation ID '%s' occurs more than once"),
    TIMESLOT_ID_EXISTS(Category.INTEGRITY, "Time slot with ID '%s' already exists"),
    DUPLICATE_TIMESLOT_ID(Category.INTEGRITY, "Time slot ID '%s' occurs more than once"),
    DUPLICATE_TIER_ID(Category.INTEGRITY, "Tier ID '%s' occurs more than once"),
    ANNOTATION_OVERLAP(Category.INTEGRITY, "Annotation timespans overlap in tier '%s': %s and %s"),
    TIER_ALIGNMENT(Category.INTEGRITY,
            "Annotations in referred tier '%s' exceed those in parent tier '%s'"),

    // Value domain
    VALUE_TOO_SMALL(Category.VALUE_DOMAIN, "Shifting by %dms produces negative time values"),
    INVALID_TIME_SPAN(Category.VALUE_DOMAIN, "Invalid time span %dms-%dms"),

    // Collaborators
    CODEC(Category.IO, "Failed to process EAF content: %s"),
    IO(Category.IO, "I/O failure for '%s': %s");

    public enum Category {
        INPUT,
        REFERENTIAL,
        STRUCTURAL,
        INTEGRITY,
        VALUE_DOMAIN,
        IO
    }

    private final Category category;
    private final String template;

    EafError(Category category, String template) {
        this.category = category;
        this.template = template;
    }

    public Category category() {
        return category;
    }

    /**
     * Render the message template with the given arguments.
     */
    public String format(Object... args) {
        return args.length == 0 ? template : String.format(template, args);
    }
}
