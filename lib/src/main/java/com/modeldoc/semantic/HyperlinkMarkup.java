package com.modeldoc.semantic;

import java.util.function.Function;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Anchor markup inserted into equation text, and scanning helpers that only look at the text
 * between anchor tags. Later stages rewrite linked text, so a key such as {@code a} or
 * {@code href} must never match inside the markup itself.
 */
public final class HyperlinkMarkup {

    /** Class carried by the anchor of an equation's own name. */
    public static final String SELF_REFERENCE_CLASS = "main_variable";

    private static final Pattern TAG =
            Pattern.compile("<a href=\"#[^\"<>]*\"(?: class=\"" + SELF_REFERENCE_CLASS + "\")?>|</a>");

    private static final String IDENTIFIER_CHARS = "A-Za-z0-9_.";

    private HyperlinkMarkup() {}

    public static String link(String name) {
        return "<a href=\"#" + name + "\">" + name + "</a>";
    }

    public static String selfLink(String name) {
        return "<a href=\"#" + name + "\" class=\"" + SELF_REFERENCE_CLASS + "\">" + name + "</a>";
    }

    /**
     * Pattern matching {@code key} only where it is not preceded or followed by an identifier
     * character (letter, digit, underscore or dot).
     */
    public static Pattern boundaryPattern(String key) {
        return Pattern.compile(
                "(?<![" + IDENTIFIER_CHARS + "])" + Pattern.quote(key) + "(?![" + IDENTIFIER_CHARS + "])",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    /** Pattern matching maximal runs of identifier characters. */
    static Pattern identifierPattern() {
        return Pattern.compile("[" + IDENTIFIER_CHARS + "]+");
    }

    /** True when {@code pattern} matches somewhere outside anchor tags. */
    public static boolean containsOutsideMarkup(String text, Pattern pattern) {
        Matcher tags = TAG.matcher(text);
        int start = 0;
        while (tags.find()) {
            if (pattern.matcher(text.substring(start, tags.start())).find()) {
                return true;
            }
            start = tags.end();
        }
        return pattern.matcher(text.substring(start)).find();
    }

    /**
     * Replace every match of {@code pattern} outside anchor tags. Tags are copied unchanged and
     * each stretch of text between them is matched on its own.
     */
    public static String replaceOutsideMarkup(
            String text, Pattern pattern, Function<MatchResult, String> replacement) {
        StringBuilder out = new StringBuilder(text.length());
        Matcher tags = TAG.matcher(text);
        int start = 0;
        while (tags.find()) {
            appendReplaced(out, text.substring(start, tags.start()), pattern, replacement);
            out.append(tags.group());
            start = tags.end();
        }
        appendReplaced(out, text.substring(start), pattern, replacement);
        return out.toString();
    }

    private static void appendReplaced(
            StringBuilder out, String segment, Pattern pattern, Function<MatchResult, String> replacement) {
        Matcher matcher = pattern.matcher(segment);
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement.apply(matcher.toMatchResult())));
        }
        matcher.appendTail(out);
    }
}
