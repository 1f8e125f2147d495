package io.owlbind.model;

import java.util.Objects;

/**
 * A namespace-qualified XML name.
 *
 * <p>{@link #toString()} renders the Clark notation ({@code {namespace}local}) used as registry key;
 * {@link #toIri()} renders the {@code namespace#local} form written to ontologies.
 *
 * @param namespace namespace URI, or the empty string for unqualified names
 * @param localName local part
 */
public record QualifiedName(String namespace, String localName) {

  public QualifiedName {
    namespace = namespace == null ? "" : namespace;
    Objects.requireNonNull(localName, "localName must not be null");
  }

  /** Builds a name in the given namespace. */
  public static QualifiedName of(String namespace, String localName) {
    return new QualifiedName(namespace, localName);
  }

  /**
   * Parses the Clark notation produced by {@link #toString()}.
   *
   * @param clark {@code {namespace}local} or a bare local name
   * @return the qualified name
   */
  public static QualifiedName parse(String clark) {
    if (clark.startsWith("{")) {
      int end = clark.indexOf('}');
      if (end > 0) {
        return new QualifiedName(clark.substring(1, end), clark.substring(end + 1));
      }
    }
    return new QualifiedName("", clark);
  }

  public boolean hasNamespace() {
    return !namespace.isEmpty();
  }

  /** Returns {@code namespace#local}, or the bare local name when unqualified. */
  public String toIri() {
    return hasNamespace() ? namespace + "#" + localName : localName;
  }

  @Override
  public String toString() {
    return hasNamespace() ? "{" + namespace + "}" + localName : localName;
  }
}
