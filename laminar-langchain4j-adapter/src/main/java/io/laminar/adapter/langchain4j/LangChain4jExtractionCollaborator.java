package io.laminar.adapter.langchain4j;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.laminar.core.document.ProcessDocument;
import io.laminar.core.exception.CollaboratorException;
import io.laminar.core.extraction.DocumentResponseParser;
import io.laminar.core.extraction.ExtractionCollaborator;
import io.laminar.core.extraction.SheetCsv;
import io.laminar.core.template.SheetTable;
import io.laminar.serialization.extraction.JacksonDocumentResponseParser;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// LangChain4j implementation of {@link ExtractionCollaborator}.
///
/// Sends one request per sheet: a system prompt describing the analyst role, then a user
/// message carrying the sheet as semicolon-separated text, a sample document and the
/// extraction rules. The answer is parsed by a {@link DocumentResponseParser}.
///
/// Failures of the model call itself (network, rate limit, provider error) are reported as
/// transient, so {@link io.laminar.core.extraction.RetryingExtractionCollaborator} can
/// retry them.
///
/// @implNote Thread-safe as long as the wrapped {@link ChatModel} is; LangChain4j's HTTP
/// based models are. No conversation state is kept between sheets.
///
/// @see LangChain4jModelFactory for model creation
public class LangChain4jExtractionCollaborator implements ExtractionCollaborator {

    private static final Logger logger =
            Logger.getLogger(LangChain4jExtractionCollaborator.class.getName());

    private final ChatModel model;
    private final String modelName;
    private final DocumentResponseParser parser;
    private final String sample;

    /// Creates a collaborator around an existing chat model.
    ///
    /// @param model chat model to call, not null
    /// @param modelName model name, for log messages, not null
    /// @param parser answer parser, not null
    /// @param sample sample document shown to the model, not null
    public LangChain4jExtractionCollaborator(
            ChatModel model, String modelName, DocumentResponseParser parser, String sample) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.modelName = Objects.requireNonNull(modelName, "modelName must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.sample = Objects.requireNonNull(sample, "sample must not be null");
    }

    /// Creates a collaborator for a model name, using the bundled sample document.
    ///
    /// @param modelName provider model name, e.g. {@value LangChain4jModelFactory#DEFAULT_MODEL}
    /// @param credentials API keys, not null
    /// @param timeout per-request timeout, not null
    /// @return collaborator, never null
    /// @throws CollaboratorException permanent, if the model is unsupported or unauthenticated
    public static LangChain4jExtractionCollaborator create(
            String modelName, Map<String, String> credentials, Duration timeout)
            throws CollaboratorException {
        ChatModel model =
                new LangChain4jModelFactory().createModel(modelName, credentials, timeout);
        return new LangChain4jExtractionCollaborator(
                model,
                modelName,
                new JacksonDocumentResponseParser(),
                ExtractionPrompts.loadSample());
    }

    @Override
    public ProcessDocument extract(SheetTable sheet) throws CollaboratorException {
        Instant startTime = Instant.now();
        logger.info("Analyzing sheet '" + sheet.name() + "' with " + modelName);

        List<ChatMessage> messages =
                List.of(
                        SystemMessage.from(ExtractionPrompts.SYSTEM_PROMPT),
                        UserMessage.from(
                                ExtractionPrompts.userMessage(
                                        sheet.name(), SheetCsv.render(sheet), sample)));

        ChatResponse response;
        try {
            response = model.chat(messages);
        } catch (RuntimeException e) {
            throw new CollaboratorException("Model call failed: " + e.getMessage(), e, true);
        }

        if (response == null || response.aiMessage() == null) {
            throw new CollaboratorException("No response from model", true);
        }
        AiMessage aiMessage = response.aiMessage();
        String text = aiMessage.text();
        if (text == null || text.isBlank()) {
            throw new CollaboratorException("Model returned an empty answer", true);
        }

        logUsage(sheet.name(), response, startTime);
        return parser.parse(text);
    }

    private void logUsage(String sheetName, ChatResponse response, Instant startTime) {
        long durationMs = Duration.between(startTime, Instant.now()).toMillis();
        var metadata = response.metadata();
        var tokenUsage = metadata != null ? metadata.tokenUsage() : null;
        logger.fine(
                () ->
                        "Sheet '"
                                + sheetName
                                + "' answered in "
                                + durationMs
                                + " ms"
                                + (tokenUsage != null
                                        ? " (" + tokenUsage.totalTokenCount() + " tokens)"
                                        : ""));
    }
}
