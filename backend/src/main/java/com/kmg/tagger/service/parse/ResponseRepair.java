package com.kmg.tagger.service.parse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fixes the ways vision models break JSON: answers cut off mid-structure, numbers with leading
 * zeros, and runaway lines that repeat the same digits until the token limit.
 */
public final class ResponseRepair {
    private static final Logger log = LoggerFactory.getLogger(ResponseRepair.class);

    private static final Pattern NUMERIC_ARRAY = Pattern.compile("\\[(\\s*\\d+(?:\\s*,\\s*\\d+)*\\s*)]");
    private static final Pattern LEADING_ZERO = Pattern.compile("0\\d+");
    private static final Pattern RUNAWAY_LINE = Pattern.compile("^\\s*[\\d\\s,\\[\\]\"]+$");
    static final int RUNAWAY_LINE_LENGTH = 100;

    private ResponseRepair() {
    }

    /**
     * The JSON object inside a model answer, or {@code null} when the answer has no opening
     * brace. A missing closing brace is treated as truncation and repaired.
     */
    public static String extractJson(String response) {
        int start = response.indexOf('{');
        if (start < 0) {
            return null;
        }
        int end = response.lastIndexOf('}');
        if (end > start) {
            return response.substring(start, end + 1);
        }
        log.debug("Attempting to repair truncated JSON response");
        return closeTruncated(response.substring(start));
    }

    /**
     * Quotes every entry of all-numeric arrays, so {@code [06, 7]} becomes {@code ["06", "7"]}.
     */
    public static Repaired quoteArrayNumbers(String json) {
        Matcher matcher = NUMERIC_ARRAY.matcher(json);
        StringBuilder out = new StringBuilder();
        boolean leadingZeros = false;
        while (matcher.find()) {
            List<String> parts = new ArrayList<>();
            for (String part : matcher.group(1).split(",")) {
                String trimmed = part.trim();
                if (LEADING_ZERO.matcher(trimmed).matches()) {
                    leadingZeros = true;
                }
                parts.add("\"" + trimmed + "\"");
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement("[" + String.join(", ", parts) + "]"));
        }
        matcher.appendTail(out);
        return new Repaired(out.toString(), leadingZeros);
    }

    /**
     * Cuts an unterminated answer back to its last complete string element, drops runaway digit
     * lines, and closes any brackets and braces still open.
     */
    public static String closeTruncated(String json) {
        if (json.stripTrailing().endsWith("}")) {
            return json;
        }

        String text = json;
        int lastComplete = lastCompleteStringEnd(text);
        if (lastComplete > 0 && lastComplete < text.length() - 1) {
            text = stripTrailingComma(text.substring(0, lastComplete));
        }

        List<String> kept = new ArrayList<>();
        for (String line : text.split("\n", -1)) {
            if (line.length() > RUNAWAY_LINE_LENGTH && RUNAWAY_LINE.matcher(line).matches()) {
                log.debug("Dropping runaway array content");
                break;
            }
            kept.add(line);
        }

        String result = stripTrailingComma(String.join("\n", kept));
        int openBrackets = count(result, '[') - count(result, ']');
        int openBraces = count(result, '{') - count(result, '}');
        return result + "]".repeat(Math.max(0, openBrackets)) + "}".repeat(Math.max(0, openBraces));
    }

    private static int lastCompleteStringEnd(String text) {
        int lastComplete = -1;
        boolean inString = false;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) != '"' || (i > 0 && text.charAt(i - 1) == '\\')) {
                continue;
            }
            inString = !inString;
            if (!inString) {
                String rest = text.substring(i + 1).stripLeading();
                if (!rest.isEmpty() && ",]}".indexOf(rest.charAt(0)) >= 0) {
                    lastComplete = i + 1;
                }
            }
        }
        return lastComplete;
    }

    private static String stripTrailingComma(String text) {
        String trimmed = text.stripTrailing();
        while (trimmed.endsWith(",")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1).stripTrailing();
        }
        return trimmed;
    }

    private static int count(String text, char c) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == c) {
                n++;
            }
        }
        return n;
    }

    public record Repaired(String json, boolean leadingZerosFixed) {
    }
}
