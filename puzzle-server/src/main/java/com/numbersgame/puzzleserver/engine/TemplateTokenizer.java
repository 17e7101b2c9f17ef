package com.numbersgame.puzzleserver.engine;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a placeholder rendering such as {@code ({0}+{1})*{2}} into
 * {@code ["(", "{0}", "+", "{1}", ")", "*", "{2}"]}.
 * <p>
 * Input always comes from {@link CanonicalPrinter}, so anything outside the template alphabet is
 * rejected rather than skipped.
 */
public final class TemplateTokenizer {

    private TemplateTokenizer() {}

    public static List<String> tokenize(String template) {
        List<String> tokens = new ArrayList<>();
        int pos = 0;
        int length = template.length();
        while (pos < length) {
            char c = template.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '(' || c == ')' || Operator.isSymbol(c)) {
                tokens.add(String.valueOf(c));
                pos++;
            } else if (c == '{') {
                int end = pos + 1;
                while (end < length && Character.isDigit(template.charAt(end))) {
                    end++;
                }
                if (end == pos + 1 || end >= length || template.charAt(end) != '}') {
                    throw new IllegalArgumentException("Malformed placeholder at position " + pos + ": " + template);
                }
                tokens.add(template.substring(pos, end + 1));
                pos = end + 1;
            } else {
                throw new IllegalArgumentException("Unexpected character '" + c + "' at position " + pos + ": " + template);
            }
        }
        return tokens;
    }

    public static boolean isPlaceholder(String token) {
        return token.length() > 2 && token.charAt(0) == '{' && token.charAt(token.length() - 1) == '}';
    }

    public static int placeholderIndex(String token) {
        if (!isPlaceholder(token)) {
            throw new IllegalArgumentException("Not a placeholder: " + token);
        }
        return Integer.parseInt(token.substring(1, token.length() - 1));
    }
}
