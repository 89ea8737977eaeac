package com.vidnyan.eaf.adapter.out.file;

import com.vidnyan.eaf.adapter.out.xml.JacksonEafCodec;
import com.vidnyan.eaf.config.EafConfiguration;
import com.vidnyan.eaf.config.EafProperties;
import com.vidnyan.eaf.domain.EafFixtures;
import com.vidnyan.eaf.domain.error.EafError;
import com.vidnyan.eaf.domain.error.EafException;
import com.vidnyan.eaf.domain.model.DerivedEaf;
import com.vidnyan.eaf.domain.model.EafDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemEafRepositoryTest {

    @TempDir
    Path tempDir;

    private final FileSystemEafRepository repository = new FileSystemEafRepository(
            new JacksonEafCodec(new EafConfiguration().xmlMapper(), new EafProperties()));

    @Test
    void write_ShouldCreateParentDirectories() {
        // Arrange
        Path output = tempDir.resolve("nested/dir/out.eaf");

        // Act
        repository.write(output, EafFixtures.wordsAndTranslit());

        // Assert
        assertTrue(Files.isRegularFile(output));
    }

    @Test
    void read_ShouldReturnDerivedDocument() {
        // Arrange
        Path file = tempDir.resolve("words.eaf");
        repository.write(file, EafFixtures.wordsAndTranslit());

        // Act
        DerivedEaf derived = repository.read(file);

        // Assert
        assertEquals(List.of("words", "translit"), derived.tierIds());
        assertEquals(0L, derived.span("r1").orElseThrow().start());
        assertEquals(500L, derived.span("r1").orElseThrow().end());
    }

    @Test
    void load_ShouldKeepTiersAndTimeOrder() {
        // Arrange
        EafDocument original = EafFixtures.wordsAndTranslit();
        Path file = tempDir.resolve("words.eaf");
        repository.write(file, original);

        // Act
        EafDocument loaded = repository.load(file);

        // Assert
        assertEquals(original.tiers(), loaded.tiers());
        assertEquals(original.timeOrder(), loaded.timeOrder());
        assertNotNull(loaded.date());
    }

    @Test
    void load_ShouldFailWithIoErrorForMissingFile() {
        Path missing = tempDir.resolve("missing.eaf");

        EafException e = assertThrows(EafException.class, () -> repository.load(missing));

        assertEquals(EafError.IO, e.getError());
        assertEquals(EafError.Category.IO, e.getCategory());
        assertTrue(e.getMessage().contains("missing.eaf"));
    }

    @Test
    void load_ShouldFailWithCodecErrorForInvalidContent() throws Exception {
        Path file = tempDir.resolve("broken.eaf");
        Files.writeString(file, "not xml at all");

        EafException e = assertThrows(EafException.class, () -> repository.load(file));

        assertEquals(EafError.CODEC, e.getError());
    }
}
