package io.owlbind.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the entity graph.
 *
 * <p>Document individuals are created by the instance parser, one per non-flattened complex
 * element. Vocabulary individuals are created once by the schema compiler and shared by every
 * document. The public identity is not stored here; see {@link IdentityResolver}.
 */
public final class Individual implements Value {
  private final String baseName;
  private final String type;
  private final List<Has> assertions;
  private final List<String> annotations;
  private boolean ignore;

  /**
   * @param baseName disambiguating name used when no display name or id is available
   * @param type public type name, or null
   * @param assertions assertions whose subject is this individual
   * @param annotations human readable comments
   */
  public Individual(String baseName, String type, List<Has> assertions, List<String> annotations) {
    this.baseName = baseName;
    this.type = type;
    this.assertions = List.copyOf(assertions);
    this.annotations = new ArrayList<>(annotations);
  }

  public Individual(String baseName, String type, List<Has> assertions) {
    this(baseName, type, assertions, List.of());
  }

  public String getBaseName() {
    return baseName;
  }

  public String getType() {
    return type;
  }

  public List<Has> getAssertions() {
    return assertions;
  }

  public List<String> getAnnotations() {
    return Collections.unmodifiableList(annotations);
  }

  /**
   * Whether serialization skips this individual. Relations pointing to it are still written.
   */
  public boolean isIgnored() {
    return ignore;
  }

  public void setIgnored(boolean ignore) {
    this.ignore = ignore;
  }

  @Override
  public String toString() {
    return "Individual{" + (type == null ? "" : type + ":") + baseName + ", " + assertions + "}";
  }
}
