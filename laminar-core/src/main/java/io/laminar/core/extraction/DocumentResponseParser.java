package io.laminar.core.extraction;

import io.laminar.core.document.ProcessDocument;
import io.laminar.core.exception.CollaboratorException;

/// Parses the text answer of a language model into a canonical process document.
///
/// Implementations must tolerate the wrappers models put around JSON (Markdown code
/// fences, a leading sentence).
///
/// @see io.laminar.core.extraction.ExtractionCollaborator
public interface DocumentResponseParser {

    /// Parses a model answer.
    ///
    /// @param content raw answer text, not null
    /// @return parsed document, never null
    /// @throws CollaboratorException transient, if the answer holds no usable document
    ProcessDocument parse(String content) throws CollaboratorException;
}
