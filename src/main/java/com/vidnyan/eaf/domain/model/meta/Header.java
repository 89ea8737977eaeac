package com.vidnyan.eaf.domain.model.meta;

import java.util.List;

/**
 * Document header: linked media and free-form properties.
 * Carried as-is; nothing in the header takes part in reference resolution.
 */
public record Header(
    String mediaFile,
    String timeUnits,
    List<MediaDescriptor> mediaDescriptors,
    List<Property> properties
) {

    public static final String MILLISECONDS = "milliseconds";

    public Header {
        timeUnits = timeUnits == null ? MILLISECONDS : timeUnits;
        mediaDescriptors = mediaDescriptors == null ? List.of() : List.copyOf(mediaDescriptors);
        properties = properties == null ? List.of() : List.copyOf(properties);
    }

    public static Header empty() {
        return new Header(null, MILLISECONDS, List.of(), List.of());
    }
}
