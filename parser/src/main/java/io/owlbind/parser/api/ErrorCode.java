package io.owlbind.parser.api;

/** Classifies an {@link OwlbindException} by the input that is at fault. */
public enum ErrorCode {
  /** A non-text literal node or attribute is empty. */
  EMPTY_VALUE(Fault.DOCUMENT),
  /** Text does not match the lexical form of its datatype. */
  MALFORMED_LITERAL(Fault.DOCUMENT),
  /** A value is not a term of its enumerated vocabulary. */
  UNKNOWN_VOCABULARY(Fault.DOCUMENT),
  /** A child element is not declared by its content model. */
  UNEXPECTED_ELEMENT(Fault.DOCUMENT),
  /** Wildcard content comes from a namespace that is neither declared nor pass-through. */
  UNEXPECTED_NAMESPACE(Fault.DOCUMENT),
  /** The document root is not a top-level element of the schema. */
  UNKNOWN_ROOT(Fault.DOCUMENT),
  /** A type, element or prefix name does not resolve. */
  UNRESOLVED(Fault.SCHEMA),
  /** The schema uses a construct that cannot be compiled. */
  SCHEMA_DEFECT(Fault.SCHEMA),
  /** One tag is bound to two types within a content model. */
  TYPE_CONFLICT(Fault.SCHEMA),
  /** A schema or document cannot be retrieved. */
  SOURCE_UNAVAILABLE(Fault.SOURCE);

  /** The input a failure is attributed to. */
  public enum Fault {
    SCHEMA,
    DOCUMENT,
    SOURCE
  }

  private final Fault fault;

  ErrorCode(Fault fault) {
    this.fault = fault;
  }

  public Fault fault() {
    return fault;
  }
}
