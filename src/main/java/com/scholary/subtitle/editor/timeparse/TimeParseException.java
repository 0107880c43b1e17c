package com.scholary.subtitle.editor.timeparse;

/**
 * Exception thrown when a time expression cannot be turned into seconds.
 *
 * <p>Recoverable: callers either substitute a default or reject the edit that carried the
 * expression.
 */
public class TimeParseException extends RuntimeException {

  private final String expression;

  public TimeParseException(String expression) {
    super(String.format("Unrecognized time expression: '%s'", expression));
    this.expression = expression;
  }

  public String getExpression() {
    return expression;
  }
}
