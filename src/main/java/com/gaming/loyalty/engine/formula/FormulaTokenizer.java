package com.gaming.loyalty.engine.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a reward formula into numbers, identifiers, operators and parentheses.
 */
final class FormulaTokenizer {

    private FormulaTokenizer() {
    }

    static List<FormulaToken> tokenize(String expression) {
        List<FormulaToken> tokens = new ArrayList<>();
        int i = 0;
        int length = expression.length();
        while (i < length) {
            char c = expression.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < length && Character.isDigit(expression.charAt(i + 1)))) {
                int start = i;
                i = scanNumber(expression, i);
                tokens.add(new FormulaToken(FormulaToken.Kind.NUMBER, expression.substring(start, i), start));
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < length && (Character.isLetterOrDigit(expression.charAt(i)) || expression.charAt(i) == '_')) {
                    i++;
                }
                tokens.add(new FormulaToken(FormulaToken.Kind.IDENTIFIER, expression.substring(start, i), start));
            } else {
                tokens.add(new FormulaToken(operator(c, i), String.valueOf(c), i));
                i++;
            }
        }
        tokens.add(new FormulaToken(FormulaToken.Kind.END, "", length));
        return tokens;
    }

    private static int scanNumber(String expression, int start) {
        int i = start;
        int length = expression.length();
        while (i < length && Character.isDigit(expression.charAt(i))) {
            i++;
        }
        if (i < length && expression.charAt(i) == '.') {
            i++;
            while (i < length && Character.isDigit(expression.charAt(i))) {
                i++;
            }
        }
        if (i < length && (expression.charAt(i) == 'e' || expression.charAt(i) == 'E')) {
            int exponent = i + 1;
            if (exponent < length && (expression.charAt(exponent) == '+' || expression.charAt(exponent) == '-')) {
                exponent++;
            }
            if (exponent < length && Character.isDigit(expression.charAt(exponent))) {
                i = exponent;
                while (i < length && Character.isDigit(expression.charAt(i))) {
                    i++;
                }
            }
        }
        return i;
    }

    private static FormulaToken.Kind operator(char c, int position) {
        return switch (c) {
            case '+' -> FormulaToken.Kind.PLUS;
            case '-' -> FormulaToken.Kind.MINUS;
            case '*' -> FormulaToken.Kind.STAR;
            case '/' -> FormulaToken.Kind.SLASH;
            case '(' -> FormulaToken.Kind.LEFT_PAREN;
            case ')' -> FormulaToken.Kind.RIGHT_PAREN;
            default -> throw new FormulaEvaluationException("Unexpected character '" + c + "' at position " + position);
        };
    }
}
