package io.owlbind.model;

import java.util.Objects;

/** A string literal. Raw markup captured from wildcards is a text literal with a markup datatype. */
public final class TextLiteral extends Literal {
  public static final QualifiedName STRING = Namespaces.xs("string");

  private final String value;

  public TextLiteral(String value) {
    this(value, STRING);
  }

  public TextLiteral(String value, QualifiedName datatype) {
    super(datatype);
    this.value = Objects.requireNonNull(value, "value must not be null");
  }

  @Override
  public String getValue() {
    return value;
  }

  @Override
  public String getLexicalForm() {
    return value;
  }
}
