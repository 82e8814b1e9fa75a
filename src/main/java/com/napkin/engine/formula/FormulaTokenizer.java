package com.napkin.engine.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a formula body into {@link Token}s.
 * Letters followed by digits form a reference ("a1" and "A1" alike);
 * letters followed by "(" form a function name; any other letter run is rejected.
 */
final class FormulaTokenizer {

    private FormulaTokenizer() {
    }

    static List<Token> tokenize(String formula) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int length = formula.length();
        while (i < length) {
            char ch = formula.charAt(i);
            if (Character.isWhitespace(ch)) {
                i++;
                continue;
            }
            if (isDigit(ch) || ch == '.') {
                i = readNumber(formula, i, tokens);
                continue;
            }
            if (isLetter(ch)) {
                i = readWord(formula, i, tokens);
                continue;
            }
            Token.Type type;
            switch (ch) {
                case '+':
                    type = Token.Type.PLUS;
                    break;
                case '-':
                    type = Token.Type.MINUS;
                    break;
                case '*':
                    type = Token.Type.STAR;
                    break;
                case '/':
                    type = Token.Type.SLASH;
                    break;
                case '(':
                    type = Token.Type.LEFT_PAREN;
                    break;
                case ')':
                    type = Token.Type.RIGHT_PAREN;
                    break;
                case ',':
                    type = Token.Type.COMMA;
                    break;
                case ';':
                    type = Token.Type.SEMICOLON;
                    break;
                case ':':
                    type = Token.Type.COLON;
                    break;
                default:
                    throw new FormulaException(FormulaErrorType.INVALID_FORMULA,
                            "Unexpected character '" + ch + "' at position " + i);
            }
            tokens.add(new Token(type, String.valueOf(ch), i));
            i++;
        }
        tokens.add(new Token(Token.Type.END, "", length));
        return tokens;
    }

    private static int readNumber(String formula, int start, List<Token> tokens) {
        int i = start;
        int length = formula.length();
        boolean digits = false;
        while (i < length && isDigit(formula.charAt(i))) {
            i++;
            digits = true;
        }
        if (i < length && formula.charAt(i) == '.') {
            i++;
            while (i < length && isDigit(formula.charAt(i))) {
                i++;
                digits = true;
            }
        }
        if (!digits) {
            throw new FormulaException(FormulaErrorType.INVALID_FORMULA, "Malformed number at position " + start);
        }
        // exponent marker, only consumed when digits follow it
        if (i < length && (formula.charAt(i) == 'e' || formula.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < length && (formula.charAt(j) == '+' || formula.charAt(j) == '-')) {
                j++;
            }
            if (j < length && isDigit(formula.charAt(j))) {
                while (j < length && isDigit(formula.charAt(j))) {
                    j++;
                }
                i = j;
            }
        }
        tokens.add(new Token(Token.Type.NUMBER, formula.substring(start, i), start));
        return i;
    }

    private static int readWord(String formula, int start, List<Token> tokens) {
        int i = start;
        int length = formula.length();
        while (i < length && isLetter(formula.charAt(i))) {
            i++;
        }
        String letters = formula.substring(start, i);
        if (i < length && isDigit(formula.charAt(i))) {
            while (i < length && isDigit(formula.charAt(i))) {
                i++;
            }
            tokens.add(new Token(Token.Type.REFERENCE, formula.substring(start, i), start));
            return i;
        }
        int next = i;
        while (next < length && Character.isWhitespace(formula.charAt(next))) {
            next++;
        }
        if (next < length && formula.charAt(next) == '(') {
            tokens.add(new Token(Token.Type.FUNCTION, letters, start));
            return i;
        }
        throw new FormulaException(FormulaErrorType.INVALID_FORMULA,
                "Unexpected name '" + letters + "' at position " + start);
    }

    private static boolean isDigit(char ch) {
        return ch >= '0' && ch <= '9';
    }

    private static boolean isLetter(char ch) {
        return (ch >= 'A' && ch <= 'Z') || (ch >= 'a' && ch <= 'z');
    }
}
