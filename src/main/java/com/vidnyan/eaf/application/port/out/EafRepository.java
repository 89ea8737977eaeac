package com.vidnyan.eaf.application.port.out;

import com.vidnyan.eaf.domain.model.DerivedEaf;
import com.vidnyan.eaf.domain.model.EafDocument;

import java.nio.file.Path;

/**
 * Port for loading and storing EAF documents.
 */
public interface EafRepository {

    /**
     * Read a document without indexing or deriving it.
     */
    EafDocument load(Path path);

    /**
     * Read a document, then index and derive it.
     */
    default DerivedEaf read(Path path) {
        return load(path).derive();
    }

    /**
     * Write a document, replacing any existing file.
     */
    void write(Path path, EafDocument document);
}
