package com.vidnyan.eaf.application.port.out;

import com.vidnyan.eaf.domain.model.EafDocument;

/**
 * Port for converting between EAF content and documents.
 * Decoded documents carry no derived values; encoding ignores them.
 */
public interface EafCodec {

    /**
     * Decode EAF content.
     *
     * @throws com.vidnyan.eaf.domain.error.EafException CODEC on malformed content
     */
    EafDocument decode(byte[] content);

    /**
     * Encode a document as EAF.
     */
    byte[] encode(EafDocument document);
}
