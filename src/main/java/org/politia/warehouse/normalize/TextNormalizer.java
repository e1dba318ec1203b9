package org.politia.warehouse.normalize;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Source-independent text canonicalization. Every method is pure and never throws.
 */
public final class TextNormalizer {

    /**
     * Stored in place of a session date that is missing or cannot be parsed.
     */
    public static final LocalDate UNKNOWN_DATE = LocalDate.of(1970, 1, 1);

    /**
     * Honorific and role tokens stripped from speaker names, matched as whole tokens.
     */
    static final Set<String> TITLE_TOKENS = Set.of(
        "PRESIDENTE", "ON", "ONOREVOLE", "SENATORE", "SENATRICE",
        "DEPUTATO", "DEPUTATA", "MINISTRO", "MINISTRA",
        "PRESIDENT", "HONORABLE", "SENATOR", "DEPUTY", "MINISTER"
    );

    // also covers no-break and other Unicode space separators
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\p{Z}]+");
    private static final Pattern EDGE_WHITESPACE = Pattern.compile("^[\\s\\p{Z}]+|[\\s\\p{Z}]+$");
    private static final Pattern NOT_NAME_CHARACTER = Pattern.compile("[^\\p{L}\\p{Nd} ]");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE,
        DateTimeFormatter.BASIC_ISO_DATE,
        DateTimeFormatter.ofPattern("dd/MM/yyyy")
    );

    private TextNormalizer() {
    }

    /**
     * Canonical matching form of a person name: uppercase, punctuation and titles removed,
     * single-spaced. Idempotent.
     */
    public static String normalizeName(String raw) {
        if (raw == null) {
            return "";
        }
        String upper = raw.toUpperCase(Locale.ROOT);
        String spaced = WHITESPACE.matcher(upper).replaceAll(" ");
        // punctuation goes before title stripping so "On." is recognized as a title
        String cleaned = NOT_NAME_CHARACTER.matcher(spaced).replaceAll("");

        StringJoiner joiner = new StringJoiner(" ");
        for (String token : cleaned.split(" ")) {
            if (!token.isEmpty() && !TITLE_TOKENS.contains(token)) {
                joiner.add(token);
            }
        }
        return joiner.toString();
    }

    /**
     * Trimmed speech or title text; blank input becomes the empty string.
     */
    public static String normalizeText(String raw) {
        if (raw == null) {
            return "";
        }
        return EDGE_WHITESPACE.matcher(raw).replaceAll("");
    }

    /**
     * Whitespace-separated words of {@code raw} as written, without any other normalization.
     */
    public static List<String> words(String raw) {
        String trimmed = normalizeText(raw);
        return trimmed.isEmpty() ? List.of() : List.of(WHITESPACE.split(trimmed));
    }

    /**
     * Parses the date formats seen in the transcript feeds, falling back to {@link #UNKNOWN_DATE}.
     */
    public static LocalDate parseDate(String raw) {
        String value = normalizeText(raw);
        if (value.isEmpty()) {
            return UNKNOWN_DATE;
        }
        for (DateTimeFormatter format : DATE_FORMATS) {
            try {
                return LocalDate.parse(value, format);
            } catch (DateTimeParseException e) {
                // next format
            }
        }
        return UNKNOWN_DATE;
    }

    public static boolean isUnknownDate(LocalDate date) {
        return date == null || UNKNOWN_DATE.equals(date);
    }
}
