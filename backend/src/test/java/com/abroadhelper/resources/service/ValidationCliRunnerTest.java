package com.abroadhelper.resources.service;

import com.abroadhelper.config.ResourceProperties;
import com.abroadhelper.resources.model.ResourceCategory;
import com.abroadhelper.resources.model.ValidationResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.context.ConfigurableApplicationContext;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ValidationCliRunnerTest {

    @Mock
    private ResourceValidationService validationService;

    @Mock
    private ConfigurableApplicationContext applicationContext;

    @TempDir
    Path tempDir;

    @Test
    void doesNothingUnlessEnabled() {
        ResourceProperties properties = new ResourceProperties();

        runner(properties).run(new DefaultApplicationArguments());

        verifyNoInteractions(validationService);
    }

    @Test
    void writesResultJsonForRequestedCategory() throws Exception {
        ResourceProperties properties = new ResourceProperties();
        properties.getCli().setRun(true);
        properties.getCli().setExitAfterRun(false);
        properties.getCli().setCategory("Visa");
        Path output = tempDir.resolve("reports/validation.json");
        properties.getCli().setOutput(output.toString());
        when(validationService.run(Optional.of(ResourceCategory.VISA))).thenReturn(new ValidationResult(
            "visa", 2, List.of(), List.of(), List.of(), List.of(), List.of(), List.of("a", "b")));

        runner(properties).run(new DefaultApplicationArguments());

        JsonNode json = new ObjectMapper().readTree(output.toFile());
        assertThat(json.get("category").asText()).isEqualTo("visa");
        assertThat(json.get("total_resources").asInt()).isEqualTo(2);
        assertThat(json.get("broken_links").isArray()).isTrue();
        assertThat(json.get("passed")).hasSize(2);
    }

    @Test
    void unknownCategoryIsRejected() {
        assertThat(ValidationCliRunner.category(" ")).isEmpty();
        assertThatThrownBy(() -> ValidationCliRunner.category("housing"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("housing");
    }

    private ValidationCliRunner runner(ResourceProperties properties) {
        return new ValidationCliRunner(properties, validationService, new ObjectMapper(), applicationContext);
    }
}
