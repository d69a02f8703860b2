package io.github.pierce.xmlflat.schema;

import java.util.regex.Pattern;

/**
 * Infers a {@link ColumnType} from a single string value.
 *
 * <p>Rules are applied in this order:</p>
 * <ol>
 *   <li>null or empty: {@code VARCHAR(500)}</li>
 *   <li>integer literal: {@code INTEGER}</li>
 *   <li>decimal literal: {@code FLOAT}</li>
 *   <li>8 or 10 characters with exactly two {@code -} or two {@code /}: {@code DATE}</li>
 *   <li>otherwise {@code VARCHAR(min(max(length, 100) * 2, 16777216))}</li>
 * </ol>
 * <p>The empty check looks at the raw value; the remaining rules look at the
 * stripped value, so a whitespace-only value becomes {@code VARCHAR(200)}.</p>
 * <p>Numeric literals accept any Unicode decimal digit and a single
 * underscore between digits, as in {@code 1_000} or {@code 1_000.5}.</p>
 */
public final class ColumnTypeInferrer {

    public static final int MIN_TEXT_LENGTH = 100;
    public static final int MAX_TEXT_LENGTH = 16_777_216;

    // Any Unicode decimal digit; single underscores may separate digit groups.
    private static final String DIGITS = "\\d(?:_?\\d)*";

    private static final Pattern INTEGER_LITERAL =
            Pattern.compile("[+-]?" + DIGITS, Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern DECIMAL_LITERAL = Pattern.compile(
            "[+-]?(" + DIGITS + "(\\.(" + DIGITS + ")?)?|\\." + DIGITS + ")([eE][+-]?" + DIGITS + ")?",
            Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern SPECIAL_FLOAT =
            Pattern.compile("[+-]?(inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

    private ColumnTypeInferrer() {
        // Utility class should not be instantiated
    }

    public static ColumnType infer(String value) {
        if (value == null || value.isEmpty()) {
            return ColumnType.DEFAULT_TEXT;
        }

        String stripped = value.strip();

        if (isIntegerLiteral(stripped)) {
            return ColumnType.INTEGER;
        }
        if (isDecimalLiteral(stripped)) {
            return ColumnType.FLOAT;
        }

        int length = stripped.codePointCount(0, stripped.length());
        if (looksLikeDate(stripped, length)) {
            return ColumnType.DATE;
        }

        long sized = (long) Math.max(length, MIN_TEXT_LENGTH) * 2;
        return ColumnType.varchar((int) Math.min(sized, MAX_TEXT_LENGTH));
    }

    static boolean isIntegerLiteral(String value) {
        return INTEGER_LITERAL.matcher(value).matches();
    }

    static boolean isDecimalLiteral(String value) {
        return DECIMAL_LITERAL.matcher(value).matches() || SPECIAL_FLOAT.matcher(value).matches();
    }

    private static boolean looksLikeDate(String value, int length) {
        if (length != 8 && length != 10) {
            return false;
        }
        return count(value, '-') == 2 || count(value, '/') == 2;
    }

    private static int count(String value, char separator) {
        int count = 0;
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) == separator) {
                count++;
            }
        }
        return count;
    }
}
