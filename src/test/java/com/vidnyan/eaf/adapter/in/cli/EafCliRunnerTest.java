package com.vidnyan.eaf.adapter.in.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.eaf.application.port.in.ProcessEafUseCase;
import com.vidnyan.eaf.application.port.in.ProcessEafUseCase.*;
import com.vidnyan.eaf.config.EafProperties;
import com.vidnyan.eaf.domain.EafFixtures;
import com.vidnyan.eaf.domain.engine.ValidationReport;
import com.vidnyan.eaf.domain.error.EafError;
import com.vidnyan.eaf.domain.error.EafException;
import com.vidnyan.eaf.domain.model.DerivedEaf;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EafCliRunnerTest {

    @Mock
    private ProcessEafUseCase processEafUseCase;

    private EafProperties properties;
    private EafCliRunner runner;

    @BeforeEach
    void setUp() {
        properties = new EafProperties();
        runner = new EafCliRunner(processEafUseCase, properties, new ObjectMapper());
    }

    @Test
    void run_ShouldDoNothingWithoutCommand() throws Exception {
        runner.run();

        assertEquals(EafCliRunner.EXIT_OK, runner.getExitCode());
        verifyNoInteractions(processEafUseCase);
    }

    @Test
    void run_ShouldRejectUnknownCommand() throws Exception {
        properties.getCli().setCommand("convert");

        runner.run();

        assertEquals(EafCliRunner.EXIT_USAGE, runner.getExitCode());
        verifyNoInteractions(processEafUseCase);
    }

    @Test
    void run_ShouldRejectMissingOutput() throws Exception {
        // Arrange
        properties.getCli().setCommand("shift");
        properties.getCli().setInputs(List.of("in.eaf"));

        // Act
        runner.run();

        // Assert
        assertEquals(EafCliRunner.EXIT_USAGE, runner.getExitCode());
        verifyNoInteractions(processEafUseCase);
    }

    @Test
    void run_ShouldPassExtractWindow() throws Exception {
        // Arrange
        EafProperties.Cli cli = properties.getCli();
        cli.setCommand("extract");
        cli.setInputs(List.of("in.eaf"));
        cli.setOutput("out.eaf");
        cli.setStart(100);
        cli.setEnd(200);
        when(processEafUseCase.extract(any())).thenReturn(result(Path.of("out.eaf")));

        // Act
        runner.run();

        // Assert
        ArgumentCaptor<ExtractRequest> request = ArgumentCaptor.forClass(ExtractRequest.class);
        verify(processEafUseCase).extract(request.capture());
        assertEquals(new ExtractRequest(Path.of("in.eaf"), Path.of("out.eaf"), 100, 200), request.getValue());
        assertEquals(EafCliRunner.EXIT_OK, runner.getExitCode());
    }

    @Test
    void run_ShouldPassAllMergeInputs() throws Exception {
        // Arrange
        EafProperties.Cli cli = properties.getCli();
        cli.setCommand("MERGE");
        cli.setInputs(List.of("a.eaf", "b.eaf"));
        cli.setOutput("merged.eaf");
        when(processEafUseCase.merge(any())).thenReturn(result(Path.of("merged.eaf")));

        // Act
        runner.run();

        // Assert
        ArgumentCaptor<MergeRequest> request = ArgumentCaptor.forClass(MergeRequest.class);
        verify(processEafUseCase).merge(request.capture());
        assertEquals(List.of(Path.of("a.eaf"), Path.of("b.eaf")), request.getValue().inputs());
        assertNull(request.getValue().strategy());
    }

    @Test
    void run_ShouldExitWithFailureOnProcessingError() throws Exception {
        // Arrange
        EafProperties.Cli cli = properties.getCli();
        cli.setCommand("remap");
        cli.setInputs(List.of("in.eaf"));
        cli.setOutput("out.eaf");
        when(processEafUseCase.remap(any())).thenThrow(EafException.of(EafError.DUPLICATE_ANNOTATION_ID, "a1"));

        // Act
        runner.run();

        // Assert
        assertEquals(EafCliRunner.EXIT_FAILED, runner.getExitCode());
    }

    @Test
    void run_ShouldExitWithInvalidWhenValidationFindsIssues() throws Exception {
        // Arrange
        properties.getCli().setCommand("validate");
        properties.getCli().setInputs(List.of("in.eaf"));
        ValidationReport report = new ValidationReport(List.of(
                ValidationReport.Issue.of(EafError.ANNOTATION_OVERLAP, "t", "t", "a1", "a2")));
        when(processEafUseCase.validate(Path.of("in.eaf")))
                .thenReturn(new ValidationResult(Path.of("in.eaf"), report));

        // Act
        runner.run();

        // Assert
        assertEquals(EafCliRunner.EXIT_INVALID, runner.getExitCode());
    }

    @Test
    void run_ShouldInspectEveryInput() throws Exception {
        // Arrange
        properties.getCli().setCommand("inspect");
        properties.getCli().setInputs(List.of("a.eaf", "b.eaf"));
        DocumentSummary summary = DocumentSummary.of(EafFixtures.wordsAndTranslit().derive());
        when(processEafUseCase.inspect(any())).thenAnswer(
                invocation -> new InspectResult(invocation.getArgument(0), summary));

        // Act
        runner.run();

        // Assert
        verify(processEafUseCase).inspect(Path.of("a.eaf"));
        verify(processEafUseCase).inspect(Path.of("b.eaf"));
        assertEquals(EafCliRunner.EXIT_OK, runner.getExitCode());
    }

    private OperationResult result(Path output) {
        DerivedEaf derived = EafFixtures.wordsAndTranslit().derive();
        return new OperationResult(output, DocumentSummary.of(derived), 5);
    }
}
