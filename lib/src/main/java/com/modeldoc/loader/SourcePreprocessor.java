package com.modeldoc.loader;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text pass run before lexing. {@code //region} and {@code //endregion} are rewritten to the
 * {@code --} spelling first, since comment removal would otherwise swallow them. C-style comments
 * are then blanked: every commented character except line breaks becomes a space, so token
 * positions still match the original file.
 */
public final class SourcePreprocessor {

    private static final Pattern SLASH_REGION_MARKER =
            Pattern.compile("//(?=(?:end)?region\\b)", Pattern.CASE_INSENSITIVE);

    public String process(String text) {
        return stripComments(normalizeRegionMarkers(text));
    }

    String normalizeRegionMarkers(String text) {
        Matcher matcher = SLASH_REGION_MARKER.matcher(text);
        return matcher.replaceAll("--");
    }

    String stripComments(String text) {
        StringBuilder out = new StringBuilder(text.length());
        int length = text.length();
        int i = 0;
        while (i < length) {
            char c = text.charAt(i);
            char next = i + 1 < length ? text.charAt(i + 1) : '\0';
            if (c == '/' && next == '/') {
                while (i < length && text.charAt(i) != '\n' && text.charAt(i) != '\r') {
                    out.append(' ');
                    i++;
                }
            } else if (c == '/' && next == '*') {
                out.append("  ");
                i += 2;
                // An unterminated comment runs to the end of the input.
                while (i < length && !(text.charAt(i) == '*' && i + 1 < length && text.charAt(i + 1) == '/')) {
                    out.append(blank(text.charAt(i)));
                    i++;
                }
                if (i < length) {
                    out.append("  ");
                    i += 2;
                }
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static char blank(char c) {
        return c == '\n' || c == '\r' ? c : ' ';
    }
}
