package com.abroadhelper.resources.service;

import com.abroadhelper.config.ResourceProperties;
import com.abroadhelper.resources.model.BrokenLinkFinding;
import com.abroadhelper.resources.model.IndeterminateLinkFinding;
import com.abroadhelper.resources.model.InvalidDateFinding;
import com.abroadhelper.resources.model.MissingFieldsFinding;
import com.abroadhelper.resources.model.ResourceCategory;
import com.abroadhelper.resources.model.StaleDataFinding;
import com.abroadhelper.resources.model.ValidationResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

@Component
public class ValidationCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ValidationCliRunner.class);

    private final ResourceProperties properties;
    private final ResourceValidationService validationService;
    private final ObjectMapper objectMapper;
    private final ConfigurableApplicationContext applicationContext;

    public ValidationCliRunner(
        ResourceProperties properties,
        ResourceValidationService validationService,
        ObjectMapper objectMapper,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.validationService = validationService;
        this.objectMapper = objectMapper;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getCli().isRun()) {
            return;
        }

        ValidationResult result = validationService.run(category(properties.getCli().getCategory()));
        logSummary(result);

        String output = properties.getCli().getOutput();
        if (output != null && !output.isBlank()) {
            write(result, Path.of(output.trim()));
        }

        if (properties.getCli().isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }

    static Optional<ResourceCategory> category(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(ResourceCategory.fromValue(raw)
            .orElseThrow(() -> new IllegalArgumentException("Unsupported resources.cli.category: " + raw)));
    }

    private void logSummary(ValidationResult result) {
        log.info(
            "Validation summary category={} total={} issues={} passed={}",
            result.category() == null ? "all" : result.category(),
            result.totalResources(),
            result.issuesCount(),
            result.passed().size()
        );
        for (BrokenLinkFinding finding : result.brokenLinks()) {
            log.info("Broken link id={} status={} url={} title={}", finding.id(), finding.statusCode(), finding.url(), finding.title());
        }
        for (StaleDataFinding finding : result.staleData()) {
            log.info("Stale data id={} daysOld={} title={}", finding.id(), finding.daysOld(), finding.title());
        }
        for (InvalidDateFinding finding : result.invalidDates()) {
            log.info("Invalid dates id={} errors={} title={}", finding.id(), finding.errors(), finding.title());
        }
        for (MissingFieldsFinding finding : result.missingFields()) {
            log.info("Missing fields id={} missing={} title={}", finding.id(), finding.missing(), finding.title());
        }
        for (IndeterminateLinkFinding finding : result.indeterminateLinks()) {
            log.info("Unchecked link id={} reason={} url={}", finding.id(), finding.reason(), finding.url());
        }
    }

    private void write(ValidationResult result, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), result);
            log.info("Validation result written to {}", path);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not write validation result to " + path, e);
        }
    }
}
