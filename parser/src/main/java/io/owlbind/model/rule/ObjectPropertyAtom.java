package io.owlbind.model.rule;

/**
 * {@code subject} is related to the individual {@code object} through {@code property}.
 *
 * @param subject subject variable IRI
 * @param property object property IRI
 * @param object object variable IRI
 */
public record ObjectPropertyAtom(String subject, String property, String object) implements Atom {
  public ObjectPropertyAtom {
    subject = Atom.iri(subject);
    property = Atom.iri(property);
    object = Atom.iri(object);
  }
}
