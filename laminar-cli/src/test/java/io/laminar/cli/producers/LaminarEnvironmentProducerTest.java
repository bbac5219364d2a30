package io.laminar.cli.producers;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import io.laminar.core.LaminarConfig;
import io.laminar.core.extraction.ExtractionCollaborator;
import io.laminar.core.extraction.RetryingExtractionCollaborator;
import io.laminar.core.template.LogicalField;
import java.lang.reflect.Field;
import java.time.Duration;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.eclipse.microprofile.config.Config;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class LaminarEnvironmentProducerTest {

    @Nested
    @DisplayName("Pipeline configuration")
    class PipelineConfiguration {

        @Test
        void shouldFallBackToDefaultsWithoutProperties() {
            LaminarConfig result = LaminarEnvironmentProducer.toLaminarConfig(config(Map.of()));

            LaminarConfig defaults = LaminarConfig.defaults();
            assertThat(result.getConfidenceThreshold())
                    .isEqualTo(defaults.getConfidenceThreshold());
            assertThat(result.getWorkers()).isEqualTo(defaults.getWorkers());
            assertThat(result.getDirection()).isEqualTo("TD");
            assertThat(result.getCollaboratorTimeout())
                    .isEqualTo(defaults.getCollaboratorTimeout());
        }

        @Test
        void shouldReadEverySetting() {
            Map<String, String> properties = new HashMap<>();
            properties.put("laminar.confidence.threshold", "0.55");
            properties.put("laminar.workers", "2");
            properties.put("laminar.diagram.include-notes", "false");
            properties.put("laminar.diagram.include-metadata", "true");
            properties.put("laminar.diagram.markdown-fence", "true");
            properties.put("laminar.diagram.direction", "LR");
            properties.put("laminar.ai.timeout-seconds", "30");
            properties.put("laminar.ai.max-attempts", "5");
            properties.put("laminar.ai.backoff-millis", "250");

            LaminarConfig result = LaminarEnvironmentProducer.toLaminarConfig(config(properties));

            assertThat(result.getConfidenceThreshold()).isEqualTo(0.55);
            assertThat(result.getWorkers()).isEqualTo(2);
            assertThat(result.isIncludeNotes()).isFalse();
            assertThat(result.isIncludeMetadata()).isTrue();
            assertThat(result.isMarkdownFence()).isTrue();
            assertThat(result.getDirection()).isEqualTo("LR");
            assertThat(result.getCollaboratorTimeout()).isEqualTo(Duration.ofSeconds(30));
            assertThat(result.getCollaboratorMaxAttempts()).isEqualTo(5);
            assertThat(result.getCollaboratorBackoff()).isEqualTo(Duration.ofMillis(250));
        }

        @Test
        void shouldAddConfiguredHeaderAliases() {
            Map<String, String> properties =
                    Map.of("laminar.template.aliases.step_title", "Aufgabe, Tätigkeit");

            LaminarConfig result = LaminarEnvironmentProducer.toLaminarConfig(config(properties));

            assertThat(result.getAliases().aliasesOf(LogicalField.STEP_TITLE))
                    .contains("aufgabe", "tätigkeit");
            assertThat(result.getAliases().candidates("aufgabe"))
                    .containsExactly(LogicalField.STEP_TITLE);
        }

        @Test
        void shouldRejectUnsupportedDirection() {
            Config config = config(Map.of("laminar.diagram.direction", "UP"));

            assertThatThrownBy(() -> LaminarEnvironmentProducer.toLaminarConfig(config))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("UP");
        }
    }

    @Nested
    @DisplayName("Credentials")
    class Credentials {

        @Test
        void shouldCollectApiKeysFromEnvironment() {
            Map<String, String> env = new HashMap<>();
            env.put("ANTHROPIC_API_KEY", "sk-ant");
            env.put("PATH", "/usr/bin");
            env.put("OPENAI_API_KEY", " ");

            Map<String, String> result =
                    LaminarEnvironmentProducer.collectCredentials(config(Map.of()), env);

            assertThat(result).containsExactly(Map.entry("ANTHROPIC_API_KEY", "sk-ant"));
        }

        @Test
        void shouldPreferPrefixedEnvironmentVariable() {
            Map<String, String> env = new HashMap<>();
            env.put("ANTHROPIC_API_KEY", "plain");
            env.put("LAMINAR_ANTHROPIC_API_KEY", "prefixed");

            Map<String, String> result =
                    LaminarEnvironmentProducer.collectCredentials(config(Map.of()), env);

            assertThat(result).containsEntry("ANTHROPIC_API_KEY", "prefixed").hasSize(1);
        }

        @Test
        void shouldLetPropertiesOverrideEnvironment() {
            Map<String, String> properties = new LinkedHashMap<>();
            properties.put("laminar.credentials.ANTHROPIC_API_KEY", "from-properties");
            properties.put("laminar.credentials.GOOGLE_API_KEY", "");
            properties.put("laminar.workers", "3");

            Map<String, String> result =
                    LaminarEnvironmentProducer.collectCredentials(
                            config(properties), Map.of("ANTHROPIC_API_KEY", "from-env"));

            assertThat(result).containsExactly(Map.entry("ANTHROPIC_API_KEY", "from-properties"));
        }
    }

    @Test
    void shouldProduceRetryingCollaboratorWithoutContactingModel() throws Exception {
        LaminarEnvironmentProducer producer = new LaminarEnvironmentProducer();
        Field field = LaminarEnvironmentProducer.class.getDeclaredField("config");
        field.setAccessible(true);
        field.set(producer, config(Map.of("laminar.ai.model", "claude-test-model")));

        ExtractionCollaborator result = producer.extractionCollaborator(LaminarConfig.defaults());

        assertThat(result).isInstanceOf(RetryingExtractionCollaborator.class);
        producer.cleanup();
    }

    /// Config mock backed by a property map, converting values the way MicroProfile does.
    private static Config config(Map<String, String> properties) {
        Config config = mock(Config.class);
        when(config.getPropertyNames()).thenReturn(properties.keySet());
        when(config.getOptionalValue(anyString(), any()))
                .thenAnswer(
                        invocation -> {
                            String value = properties.get(invocation.<String>getArgument(0));
                            Class<?> type = invocation.getArgument(1);
                            return Optional.ofNullable(value).map(v -> convert(v, type));
                        });
        return config;
    }

    private static Object convert(String value, Class<?> type) {
        if (type == Double.class) {
            return Double.valueOf(value);
        }
        if (type == Integer.class) {
            return Integer.valueOf(value);
        }
        if (type == Long.class) {
            return Long.valueOf(value);
        }
        if (type == Boolean.class) {
            return Boolean.valueOf(value);
        }
        if (type == String[].class) {
            return Arrays.stream(value.split(",")).map(String::trim).toArray(String[]::new);
        }
        return value;
    }
}
