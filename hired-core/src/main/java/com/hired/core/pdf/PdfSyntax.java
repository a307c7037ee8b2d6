package com.hired.core.pdf;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Low-level PDF token encoding: numbers, literal strings and dates.
 *
 * <p>Text is encoded with WinAnsiEncoding, the encoding declared on the
 * document font. Characters outside it are replaced with {@code ?}.
 */
public final class PdfSyntax {

    private static final byte REPLACEMENT = '?';

    private static final DateTimeFormatter PDF_DATE = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    /** Unicode characters that WinAnsiEncoding places in the 0x80-0x9F range. */
    private static final Map<Character, Integer> WIN_ANSI_EXTRAS = Map.ofEntries(
        Map.entry('€', 0x80), Map.entry('‚', 0x82), Map.entry('ƒ', 0x83),
        Map.entry('„', 0x84), Map.entry('…', 0x85), Map.entry('†', 0x86),
        Map.entry('‡', 0x87), Map.entry('ˆ', 0x88), Map.entry('‰', 0x89),
        Map.entry('Š', 0x8A), Map.entry('‹', 0x8B), Map.entry('Œ', 0x8C),
        Map.entry('Ž', 0x8E), Map.entry('‘', 0x91), Map.entry('’', 0x92),
        Map.entry('“', 0x93), Map.entry('”', 0x94), Map.entry('•', 0x95),
        Map.entry('–', 0x96), Map.entry('—', 0x97), Map.entry('˜', 0x98),
        Map.entry('™', 0x99), Map.entry('š', 0x9A), Map.entry('›', 0x9B),
        Map.entry('œ', 0x9C), Map.entry('ž', 0x9E), Map.entry('Ÿ', 0x9F)
    );

    /** WinAnsi code of the bullet glyph. */
    public static final int BULLET = 0x95;

    private PdfSyntax() {
        // Utility class
    }

    /**
     * Formats a number with at most two decimals and no trailing zeros.
     *
     * @param value number to format
     * @return PDF numeric token
     */
    public static String number(double value) {
        BigDecimal decimal = BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).stripTrailingZeros();
        if (decimal.signum() == 0) {
            return "0";
        }
        return decimal.scale() <= 0 ? decimal.toBigInteger().toString() : decimal.toPlainString();
    }

    /**
     * Encodes a character to its WinAnsi byte.
     *
     * @param c character
     * @return byte value 0-255
     */
    static int winAnsi(char c) {
        if (c == '\t' || c == '\n' || c == '\r') {
            return ' ';
        }
        if ((c >= 0x20 && c <= 0x7E) || (c >= 0xA0 && c <= 0xFF)) {
            return c;
        }
        Integer extra = WIN_ANSI_EXTRAS.get(c);
        return extra != null ? extra : REPLACEMENT;
    }

    /**
     * Encodes text as a PDF literal string including the surrounding parentheses.
     *
     * @param text text to encode
     * @return WinAnsi bytes with {@code \\}, {@code (} and {@code )} escaped
     */
    public static byte[] literal(String text) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(text.length() + 2);
        out.write('(');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c) && i + 1 < text.length() && Character.isLowSurrogate(text.charAt(i + 1))) {
                i++;
                out.write(REPLACEMENT);
                continue;
            }
            int b = winAnsi(c);
            if (b == '\\' || b == '(' || b == ')') {
                out.write('\\');
            }
            out.write(b);
        }
        out.write(')');
        return out.toByteArray();
    }

    /**
     * Formats an instant as a PDF date string, e.g. {@code (D:20240131120000Z)}.
     *
     * @param dateTime date and time
     * @return PDF date literal
     */
    public static String date(ZonedDateTime dateTime) {
        return "(D:" + PDF_DATE.format(dateTime.withZoneSameInstant(ZoneOffset.UTC)) + "Z)";
    }

    /**
     * Encodes PDF syntax that is pure ASCII.
     *
     * @param syntax operators, names and numbers
     * @return ASCII bytes
     */
    public static byte[] ascii(String syntax) {
        return syntax.getBytes(StandardCharsets.US_ASCII);
    }
}
