package com.vidnyan.eaf.adapter.in.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.eaf.application.port.in.ProcessEafUseCase;
import com.vidnyan.eaf.application.port.in.ProcessEafUseCase.*;
import com.vidnyan.eaf.config.EafProperties;
import com.vidnyan.eaf.domain.engine.ValidationReport.Issue;
import com.vidnyan.eaf.domain.error.EafException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;

/**
 * CLI Runner for EAF processing.
 * Runs the command named by the eaf.cli.command property.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EafCliRunner implements CommandLineRunner, ExitCodeGenerator {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_INVALID = 2;
    static final int EXIT_USAGE = 64;

    private final ProcessEafUseCase processEafUseCase;
    private final EafProperties properties;
    private final ObjectMapper objectMapper;

    private int exitCode = EXIT_OK;

    @Override
    public void run(String... args) throws Exception {
        EafProperties.Cli cli = properties.getCli();
        if (cli.getCommand() == null || cli.getCommand().isBlank()) {
            log.info("No command specified. Set eaf.cli.command property.");
            return;
        }

        log.info("╔══════════════════════════════════════════════════════════════╗");
        log.info("║           EAF Engine - ELAN annotation documents             ║");
        log.info("╠══════════════════════════════════════════════════════════════╣");
        log.info("║ Command: {}", cli.getCommand());
        log.info("║ Inputs:  {}", cli.getInputs());
        log.info("╚══════════════════════════════════════════════════════════════╝");

        try {
            exitCode = switch (cli.getCommand().toLowerCase()) {
                case "inspect" -> inspect(cli);
                case "validate" -> validate(cli);
                case "merge" -> printResult(processEafUseCase.merge(
                        new MergeRequest(inputs(cli), output(cli), null)));
                case "extract" -> printResult(processEafUseCase.extract(
                        new ExtractRequest(singleInput(cli), output(cli), cli.getStart(), cli.getEnd())));
                case "remap" -> printResult(processEafUseCase.remap(
                        new RemapRequest(singleInput(cli), output(cli), cli.getAnnotationStart(), cli.getTimeslotStart())));
                case "shift" -> printResult(processEafUseCase.shift(
                        new ShiftRequest(singleInput(cli), output(cli), cli.getShift())));
                default -> {
                    log.error("Unknown command '{}'. Use inspect, validate, merge, extract, remap or shift.",
                            cli.getCommand());
                    yield EXIT_USAGE;
                }
            };
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            exitCode = EXIT_USAGE;
        } catch (EafException e) {
            log.error("Failed [{} / {}]: {}", e.getCategory(), e.getError(), e.getMessage());
            exitCode = EXIT_FAILED;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private int inspect(EafProperties.Cli cli) throws Exception {
        for (Path input : inputs(cli)) {
            InspectResult result = processEafUseCase.inspect(input);
            log.info("");
            log.info("═══════════════════════════════════════════════════════════════");
            log.info(" {}", input);
            log.info("═══════════════════════════════════════════════════════════════");
            log.info("{}", objectMapper.writeValueAsString(result.summary()));
        }
        return EXIT_OK;
    }

    private int validate(EafProperties.Cli cli) {
        int code = EXIT_OK;
        for (Path input : inputs(cli)) {
            ValidationResult result = processEafUseCase.validate(input);
            log.info("");
            log.info("═══════════════════════════════════════════════════════════════");
            log.info(" VALIDATION: {}", input);
            log.info("═══════════════════════════════════════════════════════════════");
            if (result.isValid()) {
                log.info(" ✅ No issues found.");
                continue;
            }
            code = EXIT_INVALID;
            for (Issue issue : result.report().issues()) {
                log.info(" 🔴 [{}] {}", issue.error(), issue.message());
            }
        }
        return code;
    }

    private int printResult(OperationResult result) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" Output:      {}", result.output());
        log.info(" Tiers:       {}", result.summary().tierCount());
        log.info(" Annotations: {}", result.summary().annotationCount());
        log.info(" Time slots:  {}", result.summary().timeslotCount());
        log.info(" Duration:    {}ms", result.durationMs());
        log.info("═══════════════════════════════════════════════════════════════");
        return EXIT_OK;
    }

    private List<Path> inputs(EafProperties.Cli cli) {
        if (cli.getInputs().isEmpty()) {
            throw new IllegalArgumentException("no input files, set eaf.cli.inputs");
        }
        return cli.getInputs().stream().map(Path::of).toList();
    }

    private Path singleInput(EafProperties.Cli cli) {
        List<Path> inputs = inputs(cli);
        if (inputs.size() > 1) {
            throw new IllegalArgumentException("expected one input file, got " + inputs.size());
        }
        return inputs.get(0);
    }

    private Path output(EafProperties.Cli cli) {
        if (cli.getOutput() == null || cli.getOutput().isBlank()) {
            throw new IllegalArgumentException("no output file, set eaf.cli.output");
        }
        return Path.of(cli.getOutput());
    }
}
