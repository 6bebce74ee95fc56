package com.modeldoc.model;

import java.util.Objects;

/** What the renderer receives: the frozen model and the time it was generated. */
public final class DocumentModel {
    private final Model model;
    private final String generatedAt;

    public DocumentModel(Model model, String generatedAt) {
        this.model = Objects.requireNonNull(model, "model");
        this.generatedAt = Objects.requireNonNull(generatedAt, "generatedAt");
    }

    public Model getModel() {
        return model;
    }

    public String getGeneratedAt() {
        return generatedAt;
    }
}
