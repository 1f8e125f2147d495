package io.owlbind.model;

import java.math.BigInteger;

/** An {@code xs:integer} literal. Years and compact month/day fragments are carried as integers. */
public final class IntegerLiteral extends Literal {
  public static final QualifiedName INTEGER = Namespaces.xs("integer");

  private final BigInteger value;

  public IntegerLiteral(BigInteger value) {
    super(INTEGER);
    this.value = value;
  }

  public IntegerLiteral(long value) {
    this(BigInteger.valueOf(value));
  }

  @Override
  public BigInteger getValue() {
    return value;
  }

  @Override
  public String getLexicalForm() {
    return value.toString();
  }
}
