package com.cpparchitect.core.generator;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

import com.cpparchitect.core.generator.Dialect.Replacement;

/**
 * Makes source-derived text safe to embed in a diagram dialect.
 *
 * <p>For labels and conditions the steps are:
 * <ol>
 *   <li>replace control characters, then apply the dialect's replacement table</li>
 *   <li>collapse whitespace runs to single spaces and trim</li>
 *   <li>strip parentheses or brackets that wrap the whole value</li>
 *   <li>truncate to the context width, the {@value #ELLIPSIS} marker included</li>
 *   <li>substitute a fixed token for empty results</li>
 * </ol>
 *
 * <p>File names keep only {@code [A-Za-z0-9_]}, collapse underscore runs and are
 * truncated without marker.
 *
 * <p>{@code sanitize(sanitize(x, c), c)} equals {@code sanitize(x, c)} for every input.
 */
public final class TextSanitizer {

    /** Marker appended to truncated labels and conditions */
    public static final String ELLIPSIS = "...";

    // Fallback tokens
    public static final String LABEL_FALLBACK = "item";
    public static final String CONDITION_FALLBACK = "condition";
    public static final String FILENAME_FALLBACK = "diagram";

    // Sanitization patterns
    private static final Pattern CONTROL_CHARACTERS =
        Pattern.compile("[\\p{Cntrl}&&[^\\s]]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern FILENAME_UNSAFE = Pattern.compile("[^A-Za-z0-9_]");
    private static final Pattern UNDERSCORE_RUN = Pattern.compile("_+");

    private final Dialect dialect;

    public TextSanitizer(Dialect dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    public Dialect getDialect() {
        return dialect;
    }

    /**
     * Sanitizes a value for a context.
     *
     * @param value raw text (may be null)
     * @param context target context
     * @return non-empty safe text
     */
    public String sanitize(String value, SanitizationContext context) {
        Objects.requireNonNull(context, "context must not be null");
        String text = value == null ? "" : value;
        return switch (context) {
            case LABEL -> sanitizeText(text, dialect.labelReplacements(), dialect.labelWidth(), LABEL_FALLBACK);
            case CONDITION -> sanitizeText(text, dialect.conditionReplacements(), dialect.conditionWidth(), CONDITION_FALLBACK);
            case FILENAME -> sanitizeFilename(text);
        };
    }

    public String label(String value) {
        return sanitize(value, SanitizationContext.LABEL);
    }

    public String condition(String value) {
        return sanitize(value, SanitizationContext.CONDITION);
    }

    public String filename(String value) {
        return sanitize(value, SanitizationContext.FILENAME);
    }

    private String sanitizeText(String value, List<Replacement> replacements, int width, String fallback) {
        String text = CONTROL_CHARACTERS.matcher(value).replaceAll(" ");
        for (Replacement replacement : replacements) {
            text = text.replace(replacement.from(), replacement.to());
        }
        text = WHITESPACE.matcher(text).replaceAll(" ").trim();
        text = stripWrapping(text);
        text = truncate(text, width);
        return text.isBlank() ? fallback : text;
    }

    private String sanitizeFilename(String value) {
        String text = FILENAME_UNSAFE.matcher(value).replaceAll("_");
        text = UNDERSCORE_RUN.matcher(text).replaceAll("_");
        text = trimUnderscores(text);
        if (text.length() > dialect.filenameWidth()) {
            text = trimUnderscores(text.substring(0, dialect.filenameWidth()));
        }
        return text.isEmpty() ? FILENAME_FALLBACK : text;
    }

    /**
     * Removes bracket pairs that enclose the entire value, repeatedly.
     */
    static String stripWrapping(String text) {
        String current = text;
        while (current.length() >= 2 && wrapsWhole(current)) {
            current = current.substring(1, current.length() - 1).trim();
        }
        return current;
    }

    private static boolean wrapsWhole(String text) {
        char open = text.charAt(0);
        char close = switch (open) {
            case '(' -> ')';
            case '[' -> ']';
            case '{' -> '}';
            default -> 0;
        };
        if (close == 0 || text.charAt(text.length() - 1) != close) {
            return false;
        }
        // Brackets inside literals such as ')' do not count, unless a quote is left open
        boolean skipLiterals = literalsClosed(text);
        int depth = 0;
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (skipLiterals && (c == '\'' || c == '"')) {
                quote = c;
            } else if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0 && i < text.length() - 1) {
                    // First bracket closes before the end: (a) && (b)
                    return false;
                }
            }
        }
        return depth == 0;
    }

    private static boolean literalsClosed(String text) {
        char quote = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
            }
        }
        return quote == 0;
    }

    private static String truncate(String text, int width) {
        if (text.length() <= width) {
            return text;
        }
        int cut = width - ELLIPSIS.length();
        if (Character.isHighSurrogate(text.charAt(cut - 1))) {
            cut--;
        }
        return text.substring(0, cut).trim() + ELLIPSIS;
    }

    private static String trimUnderscores(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == '_') {
            start++;
        }
        while (end > start && text.charAt(end - 1) == '_') {
            end--;
        }
        return text.substring(start, end);
    }
}
