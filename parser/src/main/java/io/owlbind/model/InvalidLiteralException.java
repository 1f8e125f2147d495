package io.owlbind.model;

/** Thrown by {@link LiteralKind#parse(String)} for text that is not a lexical form of the kind. */
public class InvalidLiteralException extends Exception {
  private final LiteralKind kind;
  private final String text;

  InvalidLiteralException(LiteralKind kind, String text, Throwable cause) {
    super(
        text.isEmpty()
            ? "Empty " + kind.label() + " literal"
            : String.format("'%s' is not a valid %s", text, kind.label()),
        cause);
    this.kind = kind;
    this.text = text;
  }

  public LiteralKind getKind() {
    return kind;
  }

  public String getText() {
    return text;
  }

  /** Whether the text was empty rather than malformed. */
  public boolean isEmptyText() {
    return text.isEmpty();
  }
}
