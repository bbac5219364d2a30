package io.laminar.adapter.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import io.laminar.core.exception.CollaboratorException;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class LangChain4jModelFactoryTest {

    private final LangChain4jModelFactory factory = new LangChain4jModelFactory();

    @Test
    void shouldSupportKnownPrefixes() {
        assertThat(factory.supportsModel(LangChain4jModelFactory.DEFAULT_MODEL)).isTrue();
        assertThat(factory.supportsModel("gpt-4o")).isTrue();
        assertThat(factory.supportsModel("o1-mini")).isTrue();
        assertThat(factory.supportsModel("gemini-1.5-pro")).isTrue();
        assertThat(factory.supportsModel("llama3")).isFalse();
        assertThat(factory.supportsModel(null)).isFalse();
    }

    @Test
    void shouldCreateProviderByPrefix() throws Exception {
        Duration timeout = Duration.ofSeconds(30);

        ChatModel claude =
                factory.createModel(
                        "claude-sonnet-4-20250514", Map.of("ANTHROPIC_API_KEY", "k"), timeout);
        ChatModel gpt = factory.createModel("gpt-4o", Map.of("openai_api_key", "k"), timeout);
        ChatModel gemini =
                factory.createModel("gemini-1.5-pro", Map.of("GOOGLE_API_KEY", "k"), timeout);

        assertThat(claude).isInstanceOf(AnthropicChatModel.class);
        assertThat(gpt).isInstanceOf(OpenAiChatModel.class);
        assertThat(gemini).isInstanceOf(GoogleAiGeminiChatModel.class);
    }

    @Test
    void shouldFailPermanentlyWithoutApiKey() {
        assertThatThrownBy(
                        () ->
                                factory.createModel(
                                        "claude-sonnet-4-20250514",
                                        Map.of("ANTHROPIC_API_KEY", " "),
                                        Duration.ofSeconds(5)))
                .isInstanceOf(CollaboratorException.class)
                .hasMessageContaining("ANTHROPIC_API_KEY")
                .satisfies(e -> assertThat(((CollaboratorException) e).isTransient()).isFalse());
    }

    @Test
    void shouldRejectUnsupportedModel() {
        assertThatThrownBy(() -> factory.createModel("llama3", Map.of(), Duration.ofSeconds(5)))
                .isInstanceOf(CollaboratorException.class)
                .hasMessage("Unsupported model: llama3");
    }

    @Test
    void shouldLoadBundledSample() throws Exception {
        assertThat(ExtractionPrompts.loadSample()).contains("\"process_steps\"");
    }
}
