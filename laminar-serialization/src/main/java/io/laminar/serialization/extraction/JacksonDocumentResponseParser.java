package io.laminar.serialization.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.laminar.core.document.ProcessDocument;
import io.laminar.core.exception.CollaboratorException;
import io.laminar.core.extraction.DocumentResponseParser;
import io.laminar.serialization.ProcessSerializer;
import java.util.Objects;

/// Jackson-based implementation of {@link DocumentResponseParser}.
///
/// Extracts the JSON object from a model answer before parsing it. Tried in order:
///
/// 1. the body of a ` ```json ` fence
/// 2. the body of any ` ``` ` fence
/// 3. the text between the first `{` and the last `}`
///
/// Every parse failure is reported as a transient {@link CollaboratorException}, since
/// asking the model again usually yields well-formed output.
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is thread-safe
/// (a fully configured Jackson mapper is).
public class JacksonDocumentResponseParser implements DocumentResponseParser {

    private final ObjectMapper objectMapper;

    /// Creates a parser backed by a mapper from {@link ProcessSerializer#createMapper()}.
    public JacksonDocumentResponseParser() {
        this(ProcessSerializer.createMapper());
    }

    /// Creates a parser backed by the given Jackson mapper.
    ///
    /// @param objectMapper mapper with {@code LaminarJacksonModule} registered, not null
    public JacksonDocumentResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public ProcessDocument parse(String content) throws CollaboratorException {
        Objects.requireNonNull(content, "content must not be null");
        String json = extractJson(content);
        if (json.isEmpty()) {
            throw new CollaboratorException("AI answer is empty", true);
        }

        try {
            ProcessDocument document = objectMapper.readValue(json, ProcessDocument.class);
            if (document == null || document.steps() == null) {
                throw new CollaboratorException("AI answer has no process_steps", true);
            }
            return document;
        } catch (JsonProcessingException e) {
            throw new CollaboratorException(
                    "AI answer is not a valid process document: " + e.getOriginalMessage(),
                    e,
                    true);
        }
    }

    /// Extracts the JSON content from a model answer, stripping markdown fences.
    static String extractJson(String content) {
        int start = content.indexOf("```json");
        if (start >= 0) {
            start = content.indexOf('\n', start) + 1;
            int end = content.indexOf("```", start);
            if (start > 0 && end > start) {
                return content.substring(start, end).trim();
            }
        }

        start = content.indexOf("```");
        if (start >= 0) {
            start = content.indexOf('\n', start) + 1;
            int end = content.indexOf("```", start);
            if (start > 0 && end > start) {
                return content.substring(start, end).trim();
            }
        }

        int objectStart = content.indexOf('{');
        int objectEnd = content.lastIndexOf('}');
        if (objectStart >= 0 && objectEnd > objectStart) {
            return content.substring(objectStart, objectEnd + 1);
        }

        return content.trim();
    }
}
