package com.modeldoc.table;

import com.modeldoc.loader.LoaderMessage;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Reads {@code key;value} tables, one record per line and no header. Fields may be quoted with
 * {@code "} ({@code ""} inside quotes is a literal quote). A record that does not have exactly two
 * fields, or has an empty key, is skipped with a warning; blank lines are ignored.
 */
public final class KeyValueTableReader {
    private static final Logger LOGGER = Logger.getLogger(KeyValueTableReader.class.getName());
    private static final char DELIMITER = ';';
    private static final char QUOTE = '"';

    private final Charset charset;

    public KeyValueTableReader(Charset charset) {
        this.charset = Objects.requireNonNull(charset, "charset");
    }

    /**
     * @param description what the table is for, used in diagnostics ("parameter table")
     * @param messages receives one warning per skipped record
     */
    public KeyValueTable read(Path path, String description, List<LoaderMessage> messages)
            throws MissingTableFileException {
        Objects.requireNonNull(path, "path");
        KeyValueTable.Builder table = KeyValueTable.builder();
        // InputStreamReader substitutes undecodable bytes instead of failing the whole table.
        try (BufferedReader reader =
                new BufferedReader(new InputStreamReader(Files.newInputStream(path), charset))) {
            String line;
            int lineno = 0;
            while ((line = reader.readLine()) != null) {
                lineno++;
                if (lineno == 1 && !line.isEmpty() && line.charAt(0) == '\uFEFF') {
                    line = line.substring(1);
                }
                if (line.isBlank()) {
                    continue;
                }
                List<String> fields = parseRecord(line);
                if (fields == null || fields.size() != 2 || fields.get(0).isBlank()) {
                    String problem =
                            fields == null
                                    ? "unterminated quote"
                                    : fields.size() != 2 ? fields.size() + " columns" : "empty key";
                    messages.add(
                            new LoaderMessage(
                                    LoaderMessage.Level.WARNING,
                                    "Skipping malformed " + description + " row (" + problem + "): " + line,
                                    path.toString(),
                                    lineno));
                    continue;
                }
                table.put(fields.get(0).trim(), fields.get(1));
            }
        } catch (IOException ex) {
            throw new MissingTableFileException(description, path, ex);
        }
        KeyValueTable result = table.build();
        LOGGER.info("Read " + result.size() + " entries from " + description + " " + path);
        return result;
    }

    /** Splits one record; returns {@code null} when a quoted field is not closed. */
    static List<String> parseRecord(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean quoted = false;
        boolean fieldStart = true;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == QUOTE) {
                    if (i + 1 < line.length() && line.charAt(i + 1) == QUOTE) {
                        field.append(QUOTE);
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    field.append(c);
                }
            } else if (c == DELIMITER) {
                fields.add(field.toString());
                field.setLength(0);
                fieldStart = true;
                continue;
            } else if (c == QUOTE && fieldStart) {
                quoted = true;
            } else {
                field.append(c);
            }
            fieldStart = false;
        }
        if (quoted) {
            return null;
        }
        fields.add(field.toString());
        return fields;
    }
}
