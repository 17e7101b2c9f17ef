package com.numbersgame.puzzleserver.engine;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser for player submissions.
 * <pre>
 * expr   := term (('+' | '-') term)*
 * term   := factor (('*' | '/') factor)*
 * factor := ['+' | '-'] (integer | '(' expr ')')
 * </pre>
 * Nothing outside this grammar can be represented, so parsing is also the safety boundary.
 * Multi-digit literals may not start with {@code 0}; parenthesis nesting and the number of
 * literals are capped.
 */
public final class SubmissionParser {

    enum TokenType {
        NUMBER, PLUS, MINUS, MULTIPLY, DIVIDE, LPAREN, RPAREN, EOF
    }

    record Token(TokenType type, String value, int position) {
        @Override
        public String toString() {
            return type == TokenType.EOF ? "end of input" : "'" + value + "'";
        }
    }

    public sealed interface Node permits Literal, Negate, Binary {
        Rational evaluate();
    }

    public record Literal(BigInteger value) implements Node {
        @Override
        public Rational evaluate() { return Rational.of(value); }
    }

    public record Negate(Node operand) implements Node {
        @Override
        public Rational evaluate() { return operand.evaluate().negate(); }
    }

    public record Binary(Node left, Operator op, Node right) implements Node {
        @Override
        public Rational evaluate() { return op.apply(left.evaluate(), right.evaluate()); }
    }

    // literals are in source order
    public record ParsedSubmission(Node root, List<BigInteger> literals) {
        public Rational evaluate() {
            return root.evaluate();
        }
    }

    static final class Lexer {
        private final String source;
        private int pos;

        Lexer(String source) {
            this.source = source;
        }

        Token nextToken() {
            while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
                pos++;
            }
            if (pos >= source.length()) {
                return new Token(TokenType.EOF, "", pos);
            }
            int start = pos;
            char c = source.charAt(pos);
            if (c >= '0' && c <= '9') {
                while (pos < source.length() && source.charAt(pos) >= '0' && source.charAt(pos) <= '9') {
                    pos++;
                }
                return new Token(TokenType.NUMBER, source.substring(start, pos), start);
            }
            pos++;
            switch (c) {
                case '+': return new Token(TokenType.PLUS, "+", start);
                case '-': return new Token(TokenType.MINUS, "-", start);
                case '*': return new Token(TokenType.MULTIPLY, "*", start);
                case '/': return new Token(TokenType.DIVIDE, "/", start);
                case '(': return new Token(TokenType.LPAREN, "(", start);
                case ')': return new Token(TokenType.RPAREN, ")", start);
                default: throw new SubmissionSyntaxException("Unrecognized character '" + c + "' at position " + start);
            }
        }
    }

    // Bounds parser and evaluator recursion
    static final int MAX_NESTING = 200;
    static final int MAX_LITERALS = 1000;

    private final Lexer lexer;
    private final List<BigInteger> literals = new ArrayList<>();
    private Token currentToken;
    private int depth;

    private SubmissionParser(String source) {
        this.lexer = new Lexer(source);
        this.currentToken = lexer.nextToken();
    }

    /**
     * @throws SubmissionSyntaxException if {@code source} is not a complete expression of the grammar
     */
    public static ParsedSubmission parse(String source) {
        SubmissionParser parser = new SubmissionParser(source);
        Node root = parser.parseExpression();
        if (parser.currentToken.type() != TokenType.EOF) {
            throw new SubmissionSyntaxException("Unexpected " + parser.currentToken
                    + " at position " + parser.currentToken.position());
        }
        return new ParsedSubmission(root, List.copyOf(parser.literals));
    }

    private void consume(TokenType expectedType) {
        if (currentToken.type() != expectedType) {
            throw new SubmissionSyntaxException("Expected " + expectedType + ", got " + currentToken
                    + " at position " + currentToken.position());
        }
        currentToken = lexer.nextToken();
    }

    private Node parseExpression() {
        Node node = parseTerm();
        while (currentToken.type() == TokenType.PLUS || currentToken.type() == TokenType.MINUS) {
            Operator op = currentToken.type() == TokenType.PLUS ? Operator.ADD : Operator.SUB;
            consume(currentToken.type());
            node = new Binary(node, op, parseTerm());
        }
        return node;
    }

    private Node parseTerm() {
        Node node = parseFactor();
        while (currentToken.type() == TokenType.MULTIPLY || currentToken.type() == TokenType.DIVIDE) {
            Operator op = currentToken.type() == TokenType.MULTIPLY ? Operator.MUL : Operator.DIV;
            consume(currentToken.type());
            node = new Binary(node, op, parseFactor());
        }
        return node;
    }

    private Node parseFactor() {
        boolean negate = false;
        if (currentToken.type() == TokenType.PLUS) {
            consume(TokenType.PLUS);
        } else if (currentToken.type() == TokenType.MINUS) {
            consume(TokenType.MINUS);
            negate = true;
        }
        Node node = parsePrimary();
        return negate ? new Negate(node) : node;
    }

    private Node parsePrimary() {
        Token token = currentToken;
        if (token.type() == TokenType.NUMBER) {
            if (token.value().length() > 1 && token.value().charAt(0) == '0') {
                throw new SubmissionSyntaxException("Leading zeros are not allowed in '" + token.value()
                        + "' at position " + token.position());
            }
            if (literals.size() >= MAX_LITERALS) {
                throw new SubmissionSyntaxException("Expression has too many numbers");
            }
            consume(TokenType.NUMBER);
            BigInteger value = new BigInteger(token.value());
            literals.add(value);
            return new Literal(value);
        } else if (token.type() == TokenType.LPAREN) {
            if (depth >= MAX_NESTING) {
                throw new SubmissionSyntaxException("Expression nested too deeply");
            }
            consume(TokenType.LPAREN);
            depth++;
            Node node = parseExpression();
            consume(TokenType.RPAREN);
            depth--;
            return node;
        }
        throw new SubmissionSyntaxException("Invalid syntax: unexpected " + token + " at position " + token.position());
    }
}
