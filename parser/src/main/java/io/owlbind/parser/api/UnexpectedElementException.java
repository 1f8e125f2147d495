package io.owlbind.parser.api;

/** Thrown when a document contains a child element its content model does not declare. */
public class UnexpectedElementException extends OwlbindException {

  public UnexpectedElementException(String tag, int line) {
    super(
        ErrorCode.UNEXPECTED_ELEMENT,
        "Element is not declared by the enclosing content model",
        line > 0 ? tag + " (line " + line + ")" : tag);
  }
}
