package io.owlbind.model;

/**
 * Immutable scalar value with its XML datatype.
 *
 * <p>Subclasses hold the parsed value and know how to render it back to its lexical form.
 */
public abstract class Literal implements Value {
  private final QualifiedName datatype;

  protected Literal(QualifiedName datatype) {
    this.datatype = datatype;
  }

  /** Returns the datatype, e.g. {@code {http://www.w3.org/2001/XMLSchema}string}. */
  public QualifiedName getDatatype() {
    return datatype;
  }

  /** Returns the parsed value ({@link String}, {@link java.time.LocalDate} or {@link java.math.BigInteger}). */
  public abstract Object getValue();

  /** Returns the lexical form written to the ontology. */
  public abstract String getLexicalForm();

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Literal that = (Literal) o;
    return datatype.equals(that.datatype) && getValue().equals(that.getValue());
  }

  @Override
  public int hashCode() {
    return 31 * datatype.hashCode() + getValue().hashCode();
  }

  @Override
  public String toString() {
    return getLexicalForm();
  }
}
