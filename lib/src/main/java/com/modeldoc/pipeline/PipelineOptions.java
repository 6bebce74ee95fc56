package com.modeldoc.pipeline;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for one documentation run. Parameter and legend tables are optional; their stages are
 * skipped when the path is absent.
 */
public final class PipelineOptions {
    private final Path input;
    private final Path output;
    private final Path parameterTable;
    private final Path legendTable;
    private final Charset tableCharset;

    private PipelineOptions(Builder builder) {
        this.input = Objects.requireNonNull(builder.input, "input");
        this.output = Objects.requireNonNull(builder.output, "output");
        this.parameterTable = builder.parameterTable;
        this.legendTable = builder.legendTable;
        this.tableCharset = builder.tableCharset;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path getInput() {
        return input;
    }

    public Path getOutput() {
        return output;
    }

    public Optional<Path> getParameterTable() {
        return Optional.ofNullable(parameterTable);
    }

    public Optional<Path> getLegendTable() {
        return Optional.ofNullable(legendTable);
    }

    public Charset getTableCharset() {
        return tableCharset;
    }

    public static final class Builder {
        private Path input;
        private Path output;
        private Path parameterTable;
        private Path legendTable;
        private Charset tableCharset = StandardCharsets.UTF_8;

        private Builder() {}

        public Builder input(Path input) {
            this.input = input;
            return this;
        }

        public Builder output(Path output) {
            this.output = output;
            return this;
        }

        public Builder parameterTable(Path parameterTable) {
            this.parameterTable = parameterTable;
            return this;
        }

        public Builder legendTable(Path legendTable) {
            this.legendTable = legendTable;
            return this;
        }

        public Builder tableCharset(Charset tableCharset) {
            this.tableCharset = Objects.requireNonNull(tableCharset, "tableCharset");
            return this;
        }

        public PipelineOptions build() {
            return new PipelineOptions(this);
        }
    }
}
