package io.github.manjago.evolver.demo;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * One token of an arithmetic expression: an operator, a constant or the input x.
 */
public record Token(Type type, double value) {

    public enum Type {
        ADD("+"), SUB("-"), MUL("*"), DIV("/"), NUMBER(null), INPUT("x");

        private final String symbol;

        Type(String symbol) {
            this.symbol = symbol;
        }

        public boolean isOperand() {
            return this == NUMBER || this == INPUT;
        }
    }

    public static Token operator(Type type) {
        if (type.isOperand()) {
            throw new IllegalArgumentException("Not an operator: " + type);
        }
        return new Token(type, 0.0);
    }

    public static Token number(double value) {
        return new Token(Type.NUMBER, value);
    }

    public static Token input() {
        return new Token(Type.INPUT, 0.0);
    }

    /**
     * Parse "+", "-", "*", "/", "x" or a decimal number.
     */
    public static @NotNull Token parse(@NotNull String text) {
        for (Type type : Type.values()) {
            if (type.symbol != null && type.symbol.equals(text)) {
                return new Token(type, 0.0);
            }
        }
        try {
            return number(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unknown token: " + text, e);
        }
    }

    /**
     * Operand value: the constant, or x for the input token.
     */
    @Contract(pure = true)
    public double operand(double x) {
        return type == Type.INPUT ? x : value;
    }

    @Override
    public String toString() {
        return type == Type.NUMBER ? String.valueOf(value) : type.symbol;
    }
}
