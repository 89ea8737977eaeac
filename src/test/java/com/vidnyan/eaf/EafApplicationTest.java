package com.vidnyan.eaf;

import com.vidnyan.eaf.adapter.in.cli.EafCliRunner;
import com.vidnyan.eaf.application.port.in.ProcessEafUseCase;
import com.vidnyan.eaf.application.port.in.ProcessEafUseCase.*;
import com.vidnyan.eaf.application.port.out.EafRepository;
import com.vidnyan.eaf.domain.model.EafDocument;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Loads the application context and runs operations against real files.
 */
@SpringBootTest
class EafApplicationTest {

    @TempDir
    Path tempDir;

    @Autowired
    private ProcessEafUseCase processEafUseCase;

    @Autowired
    private EafRepository eafRepository;

    @Autowired
    private EafCliRunner cliRunner;

    @Test
    void contextLoads_ShouldIdleWithoutCommand() {
        assertEquals(0, cliRunner.getExitCode());
    }

    @Test
    void shiftThenExtract_ShouldKeepReferencesResolvable() throws IOException {
        // Arrange
        Path input = copyFixture();
        Path shifted = tempDir.resolve("out/shifted.eaf");
        Path cut = tempDir.resolve("out/cut.eaf");

        // Act
        processEafUseCase.shift(new ShiftRequest(input, shifted, 1000));
        OperationResult result = processEafUseCase.extract(new ExtractRequest(shifted, cut, 1500, 2000));

        // Assert
        EafDocument document = eafRepository.load(cut);
        assertEquals(List.of("world"), document.requireTier("words").values());
        assertEquals(List.of("WORLD"), document.requireTier("translit").values());
        assertEquals(List.of("ts1", "ts2", "ts3"), document.timeOrder().ids());
        assertEquals(0L, result.summary().minTime());
        assertEquals(500L, result.summary().maxTime());
        assertTrue(processEafUseCase.validate(cut).isValid());
    }

    @Test
    void validate_ShouldAcceptFixture() throws IOException {
        ValidationResult result = processEafUseCase.validate(copyFixture());

        assertTrue(result.isValid(), () -> result.report().issues().toString());
    }

    private Path copyFixture() throws IOException {
        Path target = tempDir.resolve("sample.eaf");
        try (InputStream in = getClass().getResourceAsStream("/fixtures/sample.eaf")) {
            assertNotNull(in, "fixture missing");
            Files.copy(in, target);
        }
        return target;
    }
}
