package io.owlbind.model.rule;

/**
 * {@code variable} is an instance of {@code classIri}.
 *
 * @param variable variable IRI
 * @param classIri class IRI
 */
public record ClassAtom(String variable, String classIri) implements Atom {
  public ClassAtom {
    variable = Atom.iri(variable);
    classIri = Atom.iri(classIri);
  }
}
