package com.vidnyan.eaf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * EAF Engine - consistency engine for ELAN annotation documents.
 *
 * Reads, merges, cuts and renumbers EAF files while keeping every
 * tier, annotation and time slot reference resolvable.
 */
@SpringBootApplication
public class EafApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(EafApplication.class, args)));
    }
}
