package io.owlbind.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/** A calendar date literal ({@code xs:date}, {@code yyyy-MM-dd}). */
public final class DateLiteral extends Literal {
  public static final QualifiedName DATE = Namespaces.xs("date");

  private final LocalDate value;

  public DateLiteral(LocalDate value) {
    super(DATE);
    this.value = value;
  }

  @Override
  public LocalDate getValue() {
    return value;
  }

  @Override
  public String getLexicalForm() {
    return DateTimeFormatter.ISO_LOCAL_DATE.format(value);
  }
}
