package io.owlbind.model.rule;

/**
 * {@code subject} has the literal {@code object} through {@code property}.
 *
 * @param subject subject variable IRI
 * @param property data property IRI
 * @param object literal variable IRI
 */
public record DataPropertyAtom(String subject, String property, String object) implements Atom {
  public DataPropertyAtom {
    subject = Atom.iri(subject);
    property = Atom.iri(property);
    object = Atom.iri(object);
  }
}
