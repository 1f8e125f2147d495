package io.owlbind.model;

/** Well-known namespace URIs. */
public final class Namespaces {
  private Namespaces() {}

  public static final String XS = "http://www.w3.org/2001/XMLSchema";
  public static final String XHTML = "http://www.w3.org/1999/xhtml";
  public static final String RDFS = "http://www.w3.org/2000/01/rdf-schema#";
  public static final String OWL = "http://www.w3.org/2002/07/owl#";

  /** Returns {@code {xs}local}. */
  public static QualifiedName xs(String localName) {
    return QualifiedName.of(XS, localName);
  }
}
