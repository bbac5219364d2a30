package io.laminar.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.laminar.core.document.ProcessDocument;
import io.laminar.core.exception.InvalidProcessDocumentException;
import io.laminar.core.model.Process;

/// Utility class for reading and writing canonical process documents as JSON.
///
/// ### Usage
/// {@snippet :
/// // Persist a built process
/// String json = ProcessSerializer.toJson(process);
///
/// // Read a canonical document back
/// ProcessDocument document = ProcessSerializer.fromJson(json);
/// }
///
/// @implNote Thread-safe. A new mapper is created per call via `createMapper()`; callers
/// on hot paths should keep their own.
///
/// @see LaminarJacksonModule for the registered type handlers
public final class ProcessSerializer {

    private ProcessSerializer() {}

    /// Serializes a built process as its canonical document.
    ///
    /// @param process the process to serialize, not null
    /// @return pretty-printed JSON, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(Process process) {
        return toJson(ProcessDocument.from(process));
    }

    /// Serializes a canonical document.
    ///
    /// @param document the document to serialize, not null
    /// @return pretty-printed JSON, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(ProcessDocument document) {
        try {
            return createMapper().writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize process document: " + e.getMessage(), e);
        }
    }

    /// Deserializes a canonical document.
    ///
    /// @param json JSON text, not null
    /// @return parsed document, never null
    /// @throws InvalidProcessDocumentException if the text is not a process document
    public static ProcessDocument fromJson(String json) throws InvalidProcessDocumentException {
        try {
            ProcessDocument document = createMapper().readValue(json, ProcessDocument.class);
            if (document == null) {
                throw new InvalidProcessDocumentException("Process document is empty");
            }
            return document;
        } catch (JsonProcessingException e) {
            throw new InvalidProcessDocumentException(
                    "Failed to parse process document: " + e.getOriginalMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for canonical process documents.
    ///
    /// Registers:
    /// - `LaminarJacksonModule` for the document codec
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - indented output
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new LaminarJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
