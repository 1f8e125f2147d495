package io.owlbind.parser.internal_api.schema;

import io.owlbind.model.QualifiedName;
import io.owlbind.parser.api.UnresolvedReferenceException;

/** Looks up registered types by qualified name. */
@FunctionalInterface
public interface TypeRegistry {

  /**
   * Returns the type registered under the name.
   *
   * @param name qualified type name
   * @return the type
   * @throws UnresolvedReferenceException if no such type is registered
   */
  TypeDefinition lookup(QualifiedName name) throws UnresolvedReferenceException;
}
