package com.dcruver.notebook;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for the Notebook Vault Agent.
 *
 * Keeps the program/course/class/module frontmatter of a Markdown vault in line with
 * where each note lives. Runs dry by default; every change is backed up and reported.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@Slf4j
public class NotebookVaultAgentApplication {

    public static void main(String[] args) {
        log.info("Starting Notebook Vault Agent...");
        SpringApplication.run(NotebookVaultAgentApplication.class, args);
    }
}
