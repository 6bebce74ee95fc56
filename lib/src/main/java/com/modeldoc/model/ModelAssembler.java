package com.modeldoc.model;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

public final class ModelAssembler {
    static final DateTimeFormatter GENERATED_AT_FORMAT =
            DateTimeFormatter.ofPattern("dd/MM/yyyy - HH'h'mm", Locale.ROOT);

    private final Clock clock;

    public ModelAssembler(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public DocumentModel assemble(Model model) {
        return new DocumentModel(model, GENERATED_AT_FORMAT.format(LocalDateTime.now(clock)));
    }
}
