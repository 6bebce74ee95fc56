package com.modeldoc.render;

import com.modeldoc.model.DocumentModel;
import java.io.IOException;
import java.io.Writer;

/**
 * Writes an assembled model as a document. Equation text already carries anchor markup and must be
 * written as is; everything else is the renderer's to escape.
 */
public interface ModelRenderer {

    void render(DocumentModel document, Writer out) throws IOException;
}
