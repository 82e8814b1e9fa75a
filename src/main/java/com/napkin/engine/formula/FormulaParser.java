package com.napkin.engine.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser from tokens to an {@link Expression} tree.
 *
 * <pre>
 * expr     := term (('+' | '-') term)*
 * term     := unary (('*' | '/') unary)*
 * unary    := ('+' | '-') unary | primary
 * primary  := NUMBER | REFERENCE | call | '(' expr ')'
 * call     := NAME '(' [segment (';' segment)*] ')'
 * segment  := [argument (',' argument)*]
 * argument := REFERENCE [':' REFERENCE] | ['+' | '-'] NUMBER | call
 * </pre>
 */
final class FormulaParser {
    private final List<Token> tokens;
    private int pos;

    private FormulaParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    static Expression parse(String formula) {
        FormulaParser parser = new FormulaParser(FormulaTokenizer.tokenize(formula));
        Expression expression = parser.parseExpression();
        if (!parser.peek().is(Token.Type.END)) {
            throw parser.unexpected();
        }
        return expression;
    }

    private Expression parseExpression() {
        Expression left = parseTerm();
        while (peek().is(Token.Type.PLUS) || peek().is(Token.Type.MINUS)) {
            Token.Type operator = advance().getType();
            left = new Expression.Binary(operator, left, parseTerm());
        }
        return left;
    }

    private Expression parseTerm() {
        Expression left = parseUnary();
        while (peek().is(Token.Type.STAR) || peek().is(Token.Type.SLASH)) {
            Token.Type operator = advance().getType();
            left = new Expression.Binary(operator, left, parseUnary());
        }
        return left;
    }

    private Expression parseUnary() {
        if (peek().is(Token.Type.MINUS)) {
            advance();
            return new Expression.Negate(parseUnary());
        }
        if (peek().is(Token.Type.PLUS)) {
            advance();
            return parseUnary();
        }
        return parsePrimary();
    }

    private Expression parsePrimary() {
        Token token = peek();
        switch (token.getType()) {
            case NUMBER:
                advance();
                return new Expression.Number(Double.parseDouble(token.getText()));
            case REFERENCE:
                advance();
                return new Expression.Reference(CellReferences.decode(token.getText()));
            case FUNCTION:
                return parseCall();
            case LEFT_PAREN:
                advance();
                Expression inner = parseExpression();
                expect(Token.Type.RIGHT_PAREN);
                return inner;
            default:
                throw unexpected();
        }
    }

    private Expression.Call parseCall() {
        Token name = advance();
        SpreadsheetFunction function = SpreadsheetFunction.fromName(name.getText());
        expect(Token.Type.LEFT_PAREN);

        List<List<FunctionArgument>> segments = new ArrayList<>();
        if (peek().is(Token.Type.RIGHT_PAREN)) {
            advance();
            return new Expression.Call(function, new ArrayList<>(), null);
        }
        while (true) {
            segments.add(parseSegment(segments.isEmpty()));
            if (peek().is(Token.Type.SEMICOLON)) {
                advance();
                continue;
            }
            expect(Token.Type.RIGHT_PAREN);
            break;
        }

        List<FunctionArgument> primary = segments.get(0);
        FunctionArgument secondary = null;
        // the places segment counts only as a single argument
        if (segments.size() > 1 && segments.get(1).size() == 1) {
            secondary = segments.get(1).get(0);
        }
        return new Expression.Call(function, primary, secondary);
    }

    private List<FunctionArgument> parseSegment(boolean primary) {
        List<FunctionArgument> arguments = new ArrayList<>();
        if (!primary && (peek().is(Token.Type.SEMICOLON) || peek().is(Token.Type.RIGHT_PAREN))) {
            return arguments;
        }
        arguments.add(parseArgument());
        while (peek().is(Token.Type.COMMA)) {
            advance();
            arguments.add(parseArgument());
        }
        return arguments;
    }

    private FunctionArgument parseArgument() {
        Token token = peek();
        FunctionArgument argument;
        switch (token.getType()) {
            case REFERENCE:
                advance();
                if (peek().is(Token.Type.COLON)) {
                    advance();
                    if (!peek().is(Token.Type.REFERENCE)) {
                        throw new FormulaException(FormulaErrorType.INVALID_RANGE,
                                "Range starting at " + token.getText() + " has no end cell");
                    }
                    Token end = advance();
                    argument = new FunctionArgument.Range(
                            CellReferences.decode(token.getText()), CellReferences.decode(end.getText()));
                } else {
                    argument = new FunctionArgument.Reference(CellReferences.decode(token.getText()));
                }
                break;
            case NUMBER:
                advance();
                argument = new FunctionArgument.Value(new Expression.Number(Double.parseDouble(token.getText())));
                break;
            case PLUS:
            case MINUS:
                advance();
                Token number = advance();
                if (!number.is(Token.Type.NUMBER)) {
                    throw invalidArgument(token);
                }
                double value = Double.parseDouble(number.getText());
                argument = new FunctionArgument.Value(
                        new Expression.Number(token.is(Token.Type.MINUS) ? -value : value));
                break;
            case FUNCTION:
                argument = new FunctionArgument.Value(parseCall());
                break;
            default:
                throw invalidArgument(token);
        }
        Token.Type next = peek().getType();
        if (next != Token.Type.COMMA && next != Token.Type.SEMICOLON && next != Token.Type.RIGHT_PAREN) {
            throw invalidArgument(peek());
        }
        return argument;
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token advance() {
        Token token = tokens.get(pos);
        if (!token.is(Token.Type.END)) {
            pos++;
        }
        return token;
    }

    private void expect(Token.Type type) {
        if (!peek().is(type)) {
            throw unexpected();
        }
        advance();
    }

    private FormulaException unexpected() {
        Token token = peek();
        if (token.is(Token.Type.END)) {
            return new FormulaException(FormulaErrorType.INVALID_FORMULA, "Unexpected end of formula");
        }
        return new FormulaException(FormulaErrorType.INVALID_FORMULA,
                "Unexpected '" + token.getText() + "' at position " + token.getPosition());
    }

    private FormulaException invalidArgument(Token token) {
        return new FormulaException(FormulaErrorType.INVALID_REFERENCE,
                "Invalid function argument near '" + token.getText() + "' at position " + token.getPosition());
    }
}
