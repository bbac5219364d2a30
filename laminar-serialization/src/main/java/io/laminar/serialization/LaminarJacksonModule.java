package io.laminar.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.laminar.core.document.ProcessDocument;
import java.io.Serial;

/// Jackson `SimpleModule` that registers the canonical process document codec.
///
/// `ProcessDocument` is handled by a custom serializer/deserializer pair working on the
/// JSON tree, so the core records carry no Jackson annotations and unknown step fields
/// survive as attributes.
///
/// @implNote No classpath scanning; every registration is explicit.
/// @see ProcessSerializer for the convenience factory API
public class LaminarJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 2291575106731584470L;

    public LaminarJacksonModule() {
        super("LaminarJacksonModule");

        addSerializer(ProcessDocument.class, new ProcessDocumentSerializer());
        addDeserializer(ProcessDocument.class, new ProcessDocumentDeserializer());
    }
}
