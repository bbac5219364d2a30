package io.laminar.adapter.langchain4j;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.laminar.core.exception.CollaboratorException;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

/// Creates LangChain4j {@link ChatModel} instances for the supported providers.
///
/// The provider is chosen by model name prefix:
///
/// | Prefix | Provider | Credential keys |
/// |--------|----------|-----------------|
/// | `claude` | Anthropic | `anthropic_api_key`, `ANTHROPIC_API_KEY` |
/// | `gpt`, `o1` | OpenAI | `openai_api_key`, `OPENAI_API_KEY` |
/// | `gemini` | Google AI | `google_api_key`, `GOOGLE_API_KEY` |
///
/// Extraction must be reproducible, so every model runs at temperature 0 with a token
/// budget large enough for a complete process document.
///
/// @implNote Stateless and thread-safe. Each call creates a new model instance.
public final class LangChain4jModelFactory {

    private static final Logger logger = Logger.getLogger(LangChain4jModelFactory.class.getName());

    /// Default model used when none is configured.
    public static final String DEFAULT_MODEL = "claude-sonnet-4-20250514";

    static final int MAX_TOKENS = 8192;
    static final double TEMPERATURE = 0.0;

    /// Returns whether a model name maps to a supported provider.
    public boolean supportsModel(String modelName) {
        if (modelName == null) return false;
        return modelName.startsWith("claude")
                || modelName.startsWith("gpt")
                || modelName.startsWith("o1")
                || modelName.startsWith("gemini");
    }

    /// Creates the chat model for a model name.
    ///
    /// @param modelName provider model name, not null
    /// @param credentials API keys keyed by credential name, not null
    /// @param timeout per-request timeout, not null
    /// @return configured chat model, never null
    /// @throws CollaboratorException permanent, if the model is unsupported or its API key is
    ///     missing
    public ChatModel createModel(
            String modelName, Map<String, String> credentials, Duration timeout)
            throws CollaboratorException {
        logger.fine("Creating chat model: " + modelName);

        if (modelName.startsWith("claude")) {
            return AnthropicChatModel.builder()
                    .apiKey(requireApiKey(credentials, "anthropic_api_key", "ANTHROPIC_API_KEY"))
                    .modelName(modelName)
                    .temperature(TEMPERATURE)
                    .maxTokens(MAX_TOKENS)
                    .timeout(timeout)
                    .build();
        } else if (modelName.startsWith("gpt") || modelName.startsWith("o1")) {
            return OpenAiChatModel.builder()
                    .apiKey(requireApiKey(credentials, "openai_api_key", "OPENAI_API_KEY"))
                    .modelName(modelName)
                    .temperature(TEMPERATURE)
                    .maxTokens(MAX_TOKENS)
                    .timeout(timeout)
                    .build();
        } else if (modelName.startsWith("gemini")) {
            return GoogleAiGeminiChatModel.builder()
                    .apiKey(requireApiKey(credentials, "google_api_key", "GOOGLE_API_KEY"))
                    .modelName(modelName)
                    .temperature(TEMPERATURE)
                    .maxOutputTokens(MAX_TOKENS)
                    .timeout(timeout)
                    .build();
        }

        throw new CollaboratorException("Unsupported model: " + modelName, false);
    }

    /// Looks up an API key from credentials, trying each key name in order.
    ///
    /// @param credentials credential map to search, not null
    /// @param keyNames candidate key names in priority order
    /// @return the first non-blank value found, never null
    /// @throws CollaboratorException permanent, if no key name resolves to a value
    static String requireApiKey(Map<String, String> credentials, String... keyNames)
            throws CollaboratorException {
        for (String keyName : keyNames) {
            String value = credentials.get(keyName);
            if (value != null && !value.isBlank()) return value;
        }
        throw new CollaboratorException(
                "API key not found. Provide one of: " + String.join(", ", keyNames), false);
    }
}
