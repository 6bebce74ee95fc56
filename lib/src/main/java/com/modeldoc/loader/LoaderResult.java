package com.modeldoc.loader;

import com.modeldoc.loader.ast.ModelFileNode;
import java.util.List;

/** Parsed model file plus the diagnostics collected while reading it. */
public final class LoaderResult {
    private final ModelFileNode modelFile;
    private final List<LoaderMessage> messages;

    public LoaderResult(ModelFileNode modelFile, List<LoaderMessage> messages) {
        this.modelFile = modelFile;
        this.messages = List.copyOf(messages);
    }

    public ModelFileNode getModelFile() {
        return modelFile;
    }

    public List<LoaderMessage> getMessages() {
        return messages;
    }
}
