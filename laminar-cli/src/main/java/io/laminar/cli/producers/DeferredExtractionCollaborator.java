package io.laminar.cli.producers;

import io.laminar.core.document.ProcessDocument;
import io.laminar.core.exception.CollaboratorException;
import io.laminar.core.extraction.ExtractionCollaborator;
import io.laminar.core.template.SheetTable;

/// Collaborator that creates its delegate on the first extraction.
///
/// A failed creation is not cached; the next sheet tries again.
final class DeferredExtractionCollaborator implements ExtractionCollaborator {

    /// Creates the real collaborator.
    @FunctionalInterface
    interface Factory {
        ExtractionCollaborator create() throws CollaboratorException;
    }

    private final Factory factory;
    private ExtractionCollaborator delegate;

    DeferredExtractionCollaborator(Factory factory) {
        this.factory = factory;
    }

    @Override
    public ProcessDocument extract(SheetTable sheet) throws CollaboratorException {
        return delegate().extract(sheet);
    }

    private synchronized ExtractionCollaborator delegate() throws CollaboratorException {
        if (delegate == null) {
            delegate = factory.create();
        }
        return delegate;
    }
}
