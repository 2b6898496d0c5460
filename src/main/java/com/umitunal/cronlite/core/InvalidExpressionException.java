package com.umitunal.cronlite.core;

/**
 * Thrown when a schedule expression cannot be parsed.
 */
public class InvalidExpressionException extends CronLiteException {
    private final String expression;

    public InvalidExpressionException(String expression, String reason) {
        super("Invalid schedule expression '" + expression + "': " + reason);
        this.expression = expression;
    }

    public String getExpression() {
        return expression;
    }
}
