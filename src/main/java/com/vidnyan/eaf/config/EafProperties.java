package com.vidnyan.eaf.config;

import com.vidnyan.eaf.domain.engine.OverlapStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for EAF processing.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "eaf")
public class EafProperties {

    /**
     * Indent written EAF files.
     */
    private boolean prettyPrint = true;

    /**
     * Overlap strategy for merges that do not name one.
     */
    private OverlapStrategy overlapStrategy = OverlapStrategy.FAIL;

    /**
     * Allow shifts that move time values below zero.
     */
    private boolean allowNegativeShift = false;

    private Cli cli = new Cli();

    /**
     * Command line invocation. Nothing runs unless a command is set.
     */
    @Data
    public static class Cli {

        /**
         * One of inspect, validate, merge, extract, remap, shift.
         */
        private String command;

        private List<String> inputs = new ArrayList<>();

        private String output;

        /** Window start in ms for extract. */
        private long start;

        /** Window end in ms for extract. */
        private long end;

        /** Shift in ms. */
        private long shift;

        private int annotationStart = 1;

        private int timeslotStart = 1;
    }
}
