package io.owlbind.parser.api;

/**
 * Thrown when a literal is read from a node without text. Extension parsing treats it as "no base
 * value"; everywhere else it aborts the document.
 */
public class EmptyValueException extends OwlbindException {

  public EmptyValueException(String context) {
    super(ErrorCode.EMPTY_VALUE, "Literal node has no text", context);
  }
}
