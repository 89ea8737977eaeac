package com.vidnyan.eaf.adapter.out.file;

import com.vidnyan.eaf.application.port.out.EafCodec;
import com.vidnyan.eaf.application.port.out.EafRepository;
import com.vidnyan.eaf.domain.error.EafError;
import com.vidnyan.eaf.domain.error.EafException;
import com.vidnyan.eaf.domain.model.EafDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * File system based document repository.
 * Reads and writes EAF files through the codec.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemEafRepository implements EafRepository {

    private final EafCodec codec;

    @Override
    public EafDocument load(Path path) {
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        } catch (IOException e) {
            throw new EafException(EafError.IO, EafError.IO.format(path, e.getMessage()), e);
        }
        EafDocument document = codec.decode(content);
        log.info("Loaded {}: {} tiers, {} annotations", path.getFileName(),
                document.tierCount(), document.annotationCount());
        return document;
    }

    @Override
    public void write(Path path, EafDocument document) {
        byte[] content = codec.encode(document);
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(path, content);
        } catch (IOException e) {
            throw new EafException(EafError.IO, EafError.IO.format(path, e.getMessage()), e);
        }
        log.info("Wrote {} ({} bytes)", path, content.length);
    }
}
