package io.owlbind.parser.api;

import io.owlbind.model.Namespaces;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Schema compilation options.
 *
 * <p>Per-type keys are type paths: a named type's local name ({@code RelationshipsType}), or
 * for an inline type the path of declarations that own it joined with {@code /}
 * ({@code ExecutionFlowType/Attack_Step/Technique}). An inline attribute type ends in
 * {@code @name}.
 *
 * @param forceAlone types flattened into their owner regardless of shape
 * @param skipPushdown flattened types whose documentation stays on the owning relation
 * @param elementAliases public names for element local names
 * @param passThroughNamespaces namespaces whose wildcard content is kept as raw markup
 */
public record SchemaOptions(
    Set<String> forceAlone,
    Set<String> skipPushdown,
    Map<String, String> elementAliases,
    Set<String> passThroughNamespaces) {

  public SchemaOptions {
    forceAlone = Set.copyOf(forceAlone);
    skipPushdown = Set.copyOf(skipPushdown);
    elementAliases = Map.copyOf(elementAliases);
    passThroughNamespaces = Set.copyOf(passThroughNamespaces);
  }

  /** No overrides, XHTML pass-through. */
  public static SchemaOptions defaults() {
    return builder().build();
  }

  /** Returns the alias of an element local name, or the name itself. */
  public String aliasOf(String localName) {
    return elementAliases.getOrDefault(localName, localName);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private final Set<String> forceAlone = new LinkedHashSet<>();
    private final Set<String> skipPushdown = new LinkedHashSet<>();
    private final Map<String, String> elementAliases = new LinkedHashMap<>();
    private final Set<String> passThroughNamespaces = new LinkedHashSet<>(Set.of(Namespaces.XHTML));

    public Builder forceAlone(String... typePaths) {
      forceAlone.addAll(Set.of(typePaths));
      return this;
    }

    public Builder skipPushdown(String... typePaths) {
      skipPushdown.addAll(Set.of(typePaths));
      return this;
    }

    public Builder elementAlias(String localName, String alias) {
      elementAliases.put(localName, alias);
      return this;
    }

    public Builder passThroughNamespace(String namespace) {
      passThroughNamespaces.add(namespace);
      return this;
    }

    /** Replaces the pass-through namespaces, dropping the XHTML default. */
    public Builder passThroughNamespaces(Set<String> namespaces) {
      passThroughNamespaces.clear();
      passThroughNamespaces.addAll(namespaces);
      return this;
    }

    public SchemaOptions build() {
      return new SchemaOptions(forceAlone, skipPushdown, elementAliases, passThroughNamespaces);
    }
  }
}
