package io.laminar.core.extraction;

import io.laminar.core.document.ProcessDocument;
import io.laminar.core.exception.CollaboratorException;
import io.laminar.core.template.SheetTable;

/// External service that reads a free-form sheet and answers with a canonical process
/// document.
///
/// Implementations are called from worker threads and must be thread-safe. They
/// classify their failures: transient ones (network, timeout, malformed answer) are
/// retried by {@link RetryingExtractionCollaborator}, permanent ones are not.
///
/// @see io.laminar.core.graph.GraphBuilder#fromDocument
@FunctionalInterface
public interface ExtractionCollaborator {

    /// Extracts a process document from a sheet.
    ///
    /// @param sheet sheet contents, not null
    /// @return document conforming to the canonical schema, never null
    /// @throws CollaboratorException if no usable document could be obtained
    ProcessDocument extract(SheetTable sheet) throws CollaboratorException;
}
