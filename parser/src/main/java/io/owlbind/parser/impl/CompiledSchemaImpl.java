package io.owlbind.parser.impl;

import io.owlbind.model.GraphEntry;
import io.owlbind.model.QualifiedName;
import io.owlbind.parser.api.CompiledSchema;
import io.owlbind.parser.api.SchemaOptions;
import io.owlbind.parser.internal_api.schema.ElementDecl;
import io.owlbind.parser.internal_api.schema.TypeDefinition;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class CompiledSchemaImpl implements CompiledSchema {
  private final String targetNamespace;
  private final Map<QualifiedName, ElementDecl> elements;
  private final Map<QualifiedName, TypeDefinition> types;
  private final List<GraphEntry> prelude;
  private final SchemaOptions options;

  CompiledSchemaImpl(
      String targetNamespace,
      Map<QualifiedName, ElementDecl> elements,
      Map<QualifiedName, TypeDefinition> types,
      List<GraphEntry> prelude,
      SchemaOptions options) {
    this.targetNamespace = targetNamespace;
    this.elements = Collections.unmodifiableMap(new LinkedHashMap<>(elements));
    this.types = Collections.unmodifiableMap(new LinkedHashMap<>(types));
    this.prelude = List.copyOf(prelude);
    this.options = options;
  }

  @Override
  public String getTargetNamespace() {
    return targetNamespace;
  }

  @Override
  public Map<QualifiedName, ElementDecl> getElements() {
    return elements;
  }

  @Override
  public Map<QualifiedName, TypeDefinition> getTypes() {
    return types;
  }

  @Override
  public List<GraphEntry> getPrelude() {
    return prelude;
  }

  @Override
  public SchemaOptions getOptions() {
    return options;
  }

  @Override
  public String toString() {
    return "CompiledSchema{"
        + "targetNamespace='"
        + targetNamespace
        + '\''
        + ", elements="
        + elements.size()
        + ", types="
        + types.size()
        + ", prelude="
        + prelude.size()
        + '}';
  }
}
