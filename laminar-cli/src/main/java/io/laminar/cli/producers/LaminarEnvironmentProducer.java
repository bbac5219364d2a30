package io.laminar.cli.producers;

import io.laminar.adapter.langchain4j.LangChain4jExtractionCollaborator;
import io.laminar.adapter.langchain4j.LangChain4jModelFactory;
import io.laminar.core.LaminarConfig;
import io.laminar.core.extraction.ExtractionCollaborator;
import io.laminar.core.extraction.RetryingExtractionCollaborator;
import io.laminar.core.template.AliasTable;
import io.laminar.core.template.LogicalField;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;
import org.eclipse.microprofile.config.Config;

/// CDI producer for the pipeline configuration and the AI collaborator.
///
/// ### Credential Discovery
/// Credentials are collected from, later sources winning:
/// 1. **Environment variables** ending in `_API_KEY`; a `LAMINAR_` prefix is dropped,
///    so `LAMINAR_ANTHROPIC_API_KEY` is read as `ANTHROPIC_API_KEY`
/// 2. **Application properties** under `laminar.credentials.*`
///
/// ### Configuration Properties
/// | Property | Type | Default | Description |
/// |----------|------|---------|-------------|
/// | `laminar.confidence.threshold` | double | `0.7` | Minimum template confidence |
/// | `laminar.workers` | int | `4` | Sheets processed concurrently |
/// | `laminar.ai.model` | String | `claude-sonnet-4-20250514` | Extraction model |
/// | `laminar.ai.timeout-seconds` | long | `120` | Limit per model call |
/// | `laminar.ai.max-attempts` | int | `3` | Attempts per sheet |
/// | `laminar.ai.backoff-millis` | long | `2000` | Delay before the first retry |
/// | `laminar.diagram.include-notes` | boolean | `true` | Emit step notes |
/// | `laminar.diagram.include-metadata` | boolean | `false` | Append system and program |
/// | `laminar.diagram.markdown-fence` | boolean | `false` | Wrap in a Markdown fence |
/// | `laminar.diagram.direction` | String | `TD` | Flowchart direction |
/// | `laminar.template.aliases.<field>` | list | - | Extra header aliases, e.g. `step_title` |
///
/// The model is created on the first sheet that needs it, so a missing API key only
/// fails sheets that actually take the AI path.
@ApplicationScoped
public class LaminarEnvironmentProducer {

    private static final Logger logger =
            Logger.getLogger(LaminarEnvironmentProducer.class.getName());

    static final String CREDENTIALS_PREFIX = "laminar.credentials.";
    static final String ALIASES_PREFIX = "laminar.template.aliases.";

    @Inject Config config;

    private RetryingExtractionCollaborator collaborator;

    /// Produces the pipeline configuration from application properties.
    ///
    /// @return configuration singleton, never null
    /// @throws IllegalArgumentException if a property is out of range
    @Produces
    @Singleton
    public LaminarConfig laminarConfig() {
        LaminarConfig laminarConfig = toLaminarConfig(config);
        logger.fine(
                "Configured LaminarConfig: threshold="
                        + laminarConfig.getConfidenceThreshold()
                        + ", workers="
                        + laminarConfig.getWorkers());
        return laminarConfig;
    }

    /// Produces the AI collaborator with timeout and retry.
    ///
    /// @param laminarConfig configuration with the retry limits, not null
    /// @return collaborator singleton, never null
    @Produces
    @Singleton
    public ExtractionCollaborator extractionCollaborator(LaminarConfig laminarConfig) {
        String modelName =
                config.getOptionalValue("laminar.ai.model", String.class)
                        .orElse(LangChain4jModelFactory.DEFAULT_MODEL);
        Map<String, String> credentials = collectCredentials(config, System.getenv());
        Duration timeout = laminarConfig.getCollaboratorTimeout();

        ExtractionCollaborator deferred =
                new DeferredExtractionCollaborator(
                        () ->
                                LangChain4jExtractionCollaborator.create(
                                        modelName, credentials, timeout));
        collaborator = new RetryingExtractionCollaborator(deferred, laminarConfig);
        logger.info("Configured AI collaborator with model " + modelName);
        return collaborator;
    }

    /// Reads every `laminar.*` setting, falling back to the defaults of {@link LaminarConfig}.
    static LaminarConfig toLaminarConfig(Config config) {
        LaminarConfig defaults = LaminarConfig.defaults();
        LaminarConfig.Builder builder =
                defaults.toBuilder()
                        .confidenceThreshold(
                                config.getOptionalValue(
                                                "laminar.confidence.threshold", Double.class)
                                        .orElse(defaults.getConfidenceThreshold()))
                        .workers(
                                config.getOptionalValue("laminar.workers", Integer.class)
                                        .orElse(defaults.getWorkers()))
                        .includeNotes(
                                config.getOptionalValue(
                                                "laminar.diagram.include-notes", Boolean.class)
                                        .orElse(defaults.isIncludeNotes()))
                        .includeMetadata(
                                config.getOptionalValue(
                                                "laminar.diagram.include-metadata", Boolean.class)
                                        .orElse(defaults.isIncludeMetadata()))
                        .markdownFence(
                                config.getOptionalValue(
                                                "laminar.diagram.markdown-fence", Boolean.class)
                                        .orElse(defaults.isMarkdownFence()))
                        .direction(
                                config.getOptionalValue("laminar.diagram.direction", String.class)
                                        .orElse(defaults.getDirection()));

        config.getOptionalValue("laminar.ai.timeout-seconds", Long.class)
                .ifPresent(seconds -> builder.collaboratorTimeout(Duration.ofSeconds(seconds)));
        config.getOptionalValue("laminar.ai.max-attempts", Integer.class)
                .ifPresent(builder::collaboratorMaxAttempts);
        config.getOptionalValue("laminar.ai.backoff-millis", Long.class)
                .ifPresent(millis -> builder.collaboratorBackoff(Duration.ofMillis(millis)));

        return builder.aliases(readAliases(config)).build();
    }

    private static AliasTable readAliases(Config config) {
        AliasTable aliases = AliasTable.defaults();
        for (LogicalField field : LogicalField.values()) {
            String property = ALIASES_PREFIX + field.key();
            String[] extra =
                    config.getOptionalValue(property, String[].class).orElse(new String[0]);
            if (extra.length > 0) {
                aliases = aliases.withAliases(field, extra);
                logger.fine("Added " + extra.length + " header alias(es) for " + field);
            }
        }
        return aliases;
    }

    /// Collects API keys from environment variables and `laminar.credentials.*`.
    ///
    /// @param config application configuration, not null
    /// @param environment environment variables, not null
    /// @return credentials keyed by name, e.g. `ANTHROPIC_API_KEY`, never null
    static Map<String, String> collectCredentials(Config config, Map<String, String> environment) {
        Map<String, String> credentials = new LinkedHashMap<>();
        environment.forEach(
                (name, value) -> {
                    if (name.endsWith("_API_KEY")
                            && !name.startsWith("LAMINAR_")
                            && !value.isBlank()) {
                        credentials.put(name, value);
                    }
                });
        environment.forEach(
                (name, value) -> {
                    if (name.endsWith("_API_KEY")
                            && name.startsWith("LAMINAR_")
                            && !value.isBlank()) {
                        credentials.put(name.substring("LAMINAR_".length()), value);
                    }
                });

        for (String propertyName : config.getPropertyNames()) {
            if (propertyName.startsWith(CREDENTIALS_PREFIX)) {
                config.getOptionalValue(propertyName, String.class)
                        .filter(value -> !value.isBlank())
                        .ifPresent(
                                value ->
                                        credentials.put(
                                                propertyName.substring(CREDENTIALS_PREFIX.length()),
                                                value));
            }
        }
        return credentials;
    }

    /// Stops the collaborator's call threads on shutdown.
    @PreDestroy
    public void cleanup() {
        if (collaborator != null) {
            collaborator.close();
        }
    }
}
