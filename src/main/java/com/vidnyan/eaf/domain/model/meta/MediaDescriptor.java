package com.vidnyan.eaf.domain.model.meta;

public record MediaDescriptor(
    String mediaUrl,
    String relativeMediaUrl,
    String mimeType,
    Long timeOrigin,
    String extractedFrom
) {}
