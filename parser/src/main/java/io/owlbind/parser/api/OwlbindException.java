package io.owlbind.parser.api;

import java.util.Objects;

/**
 * Checked failure of schema compilation, document binding or source retrieval.
 *
 * <p>Every instance carries an {@link ErrorCode} and, where one is known, the schema path, tag or
 * location it concerns. Both are appended to the message as {@code message: context [CODE]}.
 */
public abstract class OwlbindException extends Exception {
  private final ErrorCode code;
  private final String context;

  protected OwlbindException(ErrorCode code, String message, String context) {
    this(code, message, context, null);
  }

  protected OwlbindException(ErrorCode code, String message, String context, Throwable cause) {
    super(message, cause);
    this.code = Objects.requireNonNull(code);
    this.context = context;
  }

  public ErrorCode getErrorCode() {
    return code;
  }

  /** Returns what the failure concerns, or null. */
  public String getContext() {
    return context;
  }

  @Override
  public String getMessage() {
    String message = super.getMessage();
    return context == null
        ? message + " [" + code + "]"
        : message + ": " + context + " [" + code + "]";
  }
}
