package com.numbersgame.puzzleserver.engine;

// All left-associative
public enum Operator {
    ADD('+', 1),
    SUB('-', 1),
    MUL('*', 2),
    DIV('/', 2);

    private final char symbol;
    private final int precedence;

    Operator(char symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public char symbol() { return symbol; }
    public int precedence() { return precedence; }

    public Rational apply(Rational a, Rational b) {
        switch (this) {
            case ADD: return a.add(b);
            case SUB: return a.subtract(b);
            case MUL: return a.multiply(b);
            case DIV: return a.divide(b);
            default: throw new IllegalStateException("Unknown operator: " + this);
        }
    }

    public static Operator fromSymbol(char symbol) {
        switch (symbol) {
            case '+': return ADD;
            case '-': return SUB;
            case '*': return MUL;
            case '/': return DIV;
            default: throw new IllegalArgumentException("Unknown operator symbol: " + symbol);
        }
    }

    public static boolean isSymbol(char c) {
        return c == '+' || c == '-' || c == '*' || c == '/';
    }
}
