package io.owlbind.parser.internal_api.schema;

/**
 * Enumeration of the type variants a compiled schema holds.
 */
public enum TypeKind {
  /** Built-in scalar type such as {@code xs:string} or {@code xs:date}. */
  LITERAL,

  /** Enumerated vocabulary ({@code xs:simpleType} with an {@code xs:restriction}). */
  SIMPLE,

  /** Structured type with attributes and an optional content model. */
  COMPLEX
}
