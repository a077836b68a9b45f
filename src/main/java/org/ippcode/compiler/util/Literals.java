package org.ippcode.compiler.util;

import java.math.BigInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Grammar checks and decoding for the textual constants of IPPcode.
 */
public final class Literals {

    /** Identifier grammar shared by labels and variable names. The first character is ASCII, the rest any word character. */
    public static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_\\-$&%*!?][\\w\\-$&%*!?]*", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern DECIMAL = Pattern.compile("[-+]?[0-9]+");
    private static final Pattern OCTAL = Pattern.compile("0[oO][0-7]+");
    private static final Pattern HEXADECIMAL = Pattern.compile("0[xX][0-9a-fA-F]+");
    private static final Pattern STRING = Pattern.compile("(?:[^\\\\]|\\\\[0-9]{3})*");
    private static final Pattern ESCAPE = Pattern.compile("\\\\([0-9]{3})");

    private Literals() {}

    /**
     * @param text The candidate name.
     * @return {@code true} if the text is a valid label or variable name.
     */
    public static boolean isIdentifier(String text) {
        return IDENTIFIER.matcher(text).matches();
    }

    /**
     * @param text The literal part of an {@code int@} constant.
     * @return {@code true} for a signed decimal, a {@code 0o} octal or a {@code 0x} hexadecimal number.
     */
    public static boolean isInteger(String text) {
        return DECIMAL.matcher(text).matches()
                || OCTAL.matcher(text).matches()
                || HEXADECIMAL.matcher(text).matches();
    }

    /**
     * @param text The literal part of a {@code bool@} constant.
     * @return {@code true} for exactly {@code true} or {@code false}.
     */
    public static boolean isBoolean(String text) {
        return "true".equals(text) || "false".equals(text);
    }

    /**
     * @param text The literal part of a {@code nil@} constant.
     * @return {@code true} for exactly {@code nil}.
     */
    public static boolean isNil(String text) {
        return "nil".equals(text);
    }

    /**
     * A string literal may contain any character, but every backslash must start a
     * {@code \DDD} escape with exactly three decimal digits.
     * @param text The literal part of a {@code string@} constant.
     * @return {@code true} if the escapes are well-formed.
     */
    public static boolean isString(String text) {
        return STRING.matcher(text).matches();
    }

    /**
     * Replaces every {@code \DDD} escape with the character whose code point is {@code DDD}.
     * @param text A literal accepted by {@link #isString(String)}.
     * @return The decoded text.
     */
    public static String decodeString(String text) {
        Matcher matcher = ESCAPE.matcher(text);
        StringBuilder decoded = new StringBuilder(text.length());
        while (matcher.find()) {
            int codePoint = Integer.parseInt(matcher.group(1));
            matcher.appendReplacement(decoded, Matcher.quoteReplacement(new String(Character.toChars(codePoint))));
        }
        matcher.appendTail(decoded);
        return decoded.toString();
    }

    /**
     * Decodes an integer literal accepted by {@link #isInteger(String)}.
     * @param text The literal text.
     * @return The value it denotes.
     * @throws NumberFormatException if the text is not an integer literal.
     */
    public static BigInteger decodeInteger(String text) {
        if (OCTAL.matcher(text).matches()) {
            return new BigInteger(text.substring(2), 8);
        }
        if (HEXADECIMAL.matcher(text).matches()) {
            return new BigInteger(text.substring(2), 16);
        }
        if (DECIMAL.matcher(text).matches()) {
            return new BigInteger(text.startsWith("+") ? text.substring(1) : text, 10);
        }
        throw new NumberFormatException("Invalid integer literal: " + text);
    }
}
