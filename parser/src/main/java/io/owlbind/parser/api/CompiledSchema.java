package io.owlbind.parser.api;

import io.owlbind.model.GraphEntry;
import io.owlbind.model.QualifiedName;
import io.owlbind.parser.internal_api.schema.ElementDecl;
import io.owlbind.parser.internal_api.schema.TypeDefinition;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Type model compiled from one XML Schema.
 *
 * <p>Unmodifiable once returned by {@link OwlbindParser#compile}; one instance may parse any
 * number of documents.
 */
public interface CompiledSchema {

  /** Returns the schema's target namespace, empty when absent. */
  String getTargetNamespace();

  /** Returns the top-level element declarations, in schema order. */
  Map<QualifiedName, ElementDecl> getElements();

  /** Returns the type registry: built-ins followed by the schema's named types. */
  Map<QualifiedName, TypeDefinition> getTypes();

  /**
   * Returns the prelude: classes, vocabulary individuals and relation notes declared by the
   * schema itself.
   */
  List<GraphEntry> getPrelude();

  SchemaOptions getOptions();

  /** Returns the type registered under the name, if any. */
  default Optional<TypeDefinition> findType(QualifiedName name) {
    return Optional.ofNullable(getTypes().get(name));
  }

  /** Returns the public name of an element local name. */
  default String publicName(String localName) {
    return getOptions().aliasOf(localName);
  }
}
