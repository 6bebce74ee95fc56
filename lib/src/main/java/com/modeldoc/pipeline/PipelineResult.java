package com.modeldoc.pipeline;

import com.modeldoc.loader.LoaderMessage;
import com.modeldoc.model.DocumentModel;
import java.nio.file.Path;
import java.util.List;

public final class PipelineResult {
    private final DocumentModel document;
    private final List<LoaderMessage> messages;
    private final Path output;

    public PipelineResult(DocumentModel document, List<LoaderMessage> messages, Path output) {
        this.document = document;
        this.messages = List.copyOf(messages);
        this.output = output;
    }

    public DocumentModel getDocument() {
        return document;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }

    /** Absolute path of the written document. */
    public Path getOutput() {
        return output;
    }
}
