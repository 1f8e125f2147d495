package io.owlbind.model.rule;

/**
 * One condition or conclusion of a {@link Rule}. Names are IRIs; names without {@code #} are
 * local to the ontology being written and get a leading {@code #}.
 */
public interface Atom {

  /** Returns the name as an IRI reference, adding the local {@code #} prefix when needed. */
  static String iri(String name) {
    return name.contains("#") ? name : "#" + name;
  }
}
