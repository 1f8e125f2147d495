package io.owlbind.converter;

import io.owlbind.model.Assertions;
import io.owlbind.model.GraphEntry;
import io.owlbind.model.Has;
import io.owlbind.model.IdentityResolver;
import io.owlbind.model.Individual;
import io.owlbind.model.Literal;
import io.owlbind.model.Namespaces;
import io.owlbind.model.OwlClass;
import io.owlbind.model.PropertyNote;
import io.owlbind.model.SlugRole;
import io.owlbind.model.Slugs;
import io.owlbind.model.Value;
import io.owlbind.model.rule.Atom;
import io.owlbind.model.rule.ClassAtom;
import io.owlbind.model.rule.DataPropertyAtom;
import io.owlbind.model.rule.ObjectPropertyAtom;
import io.owlbind.model.rule.Rule;
import io.owlbind.parser.api.EntityGraph;
import java.io.Writer;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import javax.xml.XMLConstants;
import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes an entity graph and its rules as an OWL/XML ontology.
 *
 * <p>Every individual is written once, the first time it is met, followed by the individuals it
 * refers to. Ignored individuals are not written, though assertions pointing at them are.
 */
public class OwlXmlWriter {
  private static final Logger LOG = LoggerFactory.getLogger(OwlXmlWriter.class);

  private static final String RDF = "http://www.w3.org/1999/02/22-rdf-syntax-ns#";
  private static final String XSD = Namespaces.XS + "#";
  private static final String RDFS_LABEL = Namespaces.RDFS + "label";
  private static final String RDFS_COMMENT = Namespaces.RDFS + "comment";
  private static final String RULE_ENABLED =
      "http://swrl.stanford.edu/ontologies/3.3/swrla.owl#isRuleEnabled";

  private final Writer out;
  private final IdentityResolver identities;
  private final String ontologyIri;
  private final Set<Individual> written = Collections.newSetFromMap(new IdentityHashMap<>());
  private XMLStreamWriter xml;
  private int depth;

  /**
   * @param out destination; flushed but not closed
   * @param identities resolves individual names
   * @param ontologyIri IRI of the ontology, also its {@code xml:base}
   */
  public OwlXmlWriter(Writer out, IdentityResolver identities, String ontologyIri) {
    this.out = out;
    this.identities = identities;
    this.ontologyIri = ontologyIri;
  }

  /**
   * Writes a complete ontology document.
   *
   * @param graph prelude and parsed documents
   * @param rules rules appended after the entities
   * @throws XMLStreamException if the output cannot be written
   */
  public void write(EntityGraph graph, List<Rule> rules) throws XMLStreamException {
    xml = XMLOutputFactory.newInstance().createXMLStreamWriter(out);
    depth = 0;
    xml.writeStartDocument("UTF-8", "1.0");
    newline();
    xml.writeStartElement("Ontology");
    xml.writeDefaultNamespace(Namespaces.OWL);
    xml.writeAttribute("xml", XMLConstants.XML_NS_URI, "base", ontologyIri);
    xml.writeNamespace("rdf", RDF);
    xml.writeNamespace("xsd", XSD);
    xml.writeNamespace("rdfs", Namespaces.RDFS);
    xml.writeAttribute("ontologyIRI", ontologyIri);
    depth++;
    prefix("", ontologyIri);
    prefix("owl", Namespaces.OWL);
    prefix("rdf", RDF);
    prefix("xml", XMLConstants.XML_NS_URI);
    prefix("xsd", XSD);
    prefix("rdfs", Namespaces.RDFS);

    for (GraphEntry entry : graph.entries()) {
      writeEntry(entry);
    }
    for (Rule rule : rules) {
      writeRule(rule);
    }
    close();
    xml.writeEndDocument();
    xml.flush();
    LOG.debug("Wrote {} individuals and {} rules to {}", written.size(), rules.size(), ontologyIri);
  }

  private void writeEntry(GraphEntry entry) throws XMLStreamException {
    if (entry instanceof OwlClass) {
      writeClass((OwlClass) entry);
    } else if (entry instanceof Individual) {
      writeIndividual((Individual) entry);
    } else if (entry instanceof PropertyNote) {
      PropertyNote note = (PropertyNote) entry;
      String property = "#" + Slugs.slugify(note.attribute(), SlugRole.PROPERTY);
      for (String annotation : note.annotations()) {
        annotation(RDFS_COMMENT, property, annotation);
      }
    } else if (entry instanceof Assertions) {
      for (Has has : ((Assertions) entry).assertions()) {
        for (Value value : has.getValues()) {
          if (value instanceof Individual) {
            writeIndividual((Individual) value);
          }
        }
      }
    } else {
      LOG.debug("Skipping top-level entry without subject: {}", entry);
    }
  }

  private void writeClass(OwlClass owlClass) throws XMLStreamException {
    String iri = "#" + Slugs.slugify(owlClass.name());
    open("Declaration");
    leaf("Class", iri);
    close();
    for (String annotation : owlClass.annotations()) {
      annotation(RDFS_COMMENT, iri, annotation);
    }
  }

  private void writeIndividual(Individual individual) throws XMLStreamException {
    if (individual.isIgnored() || !written.add(individual)) {
      return;
    }
    String iri = "#" + identities.slug(individual);
    open("Declaration");
    leaf("NamedIndividual", iri);
    close();
    annotation(RDFS_LABEL, iri, identities.displayName(individual));
    for (String annotation : individual.getAnnotations()) {
      annotation(RDFS_COMMENT, iri, annotation);
    }
    if (individual.getType() != null) {
      open("ClassAssertion");
      leaf("Class", "#" + Slugs.slugify(individual.getType()));
      leaf("NamedIndividual", iri);
      close();
    }
    for (Has has : individual.getAssertions()) {
      String property = "#" + Slugs.slugify(has.getAttribute(), SlugRole.PROPERTY);
      for (Value value : has.getValues()) {
        if (value instanceof Literal) {
          Literal literal = (Literal) value;
          open("DataPropertyAssertion");
          leaf("DataProperty", property);
          leaf("NamedIndividual", iri);
          literal(literal.getDatatype().toIri(), literal.getLexicalForm());
          close();
        } else {
          Individual target = (Individual) value;
          open("ObjectPropertyAssertion");
          leaf("ObjectProperty", property);
          leaf("NamedIndividual", iri);
          leaf("NamedIndividual", "#" + identities.slug(target));
          close();
          writeIndividual(target);
        }
      }
    }
  }

  private void writeRule(Rule rule) throws XMLStreamException {
    open("DLSafeRule");
    open("Annotation");
    leaf("AnnotationProperty", RULE_ENABLED);
    literal(XSD + "boolean", "true");
    close();
    open("Annotation");
    newline();
    xml.writeEmptyElement("AnnotationProperty");
    xml.writeAttribute("abbreviatedIRI", "rdfs:label");
    literal(null, rule.name());
    close();
    open("Body");
    for (Atom atom : rule.body()) {
      writeAtom(atom);
    }
    close();
    open("Head");
    for (Atom atom : rule.head()) {
      writeAtom(atom);
    }
    close();
    close();
  }

  private void writeAtom(Atom atom) throws XMLStreamException {
    if (atom instanceof ClassAtom) {
      ClassAtom classAtom = (ClassAtom) atom;
      open("ClassAtom");
      leaf("Class", classAtom.classIri());
      leaf("Variable", classAtom.variable());
    } else if (atom instanceof ObjectPropertyAtom) {
      ObjectPropertyAtom property = (ObjectPropertyAtom) atom;
      open("ObjectPropertyAtom");
      leaf("ObjectProperty", property.property());
      leaf("Variable", property.subject());
      leaf("Variable", property.object());
    } else {
      DataPropertyAtom property = (DataPropertyAtom) atom;
      open("DataPropertyAtom");
      leaf("DataProperty", property.property());
      leaf("Variable", property.subject());
      leaf("Variable", property.object());
    }
    close();
  }

  private void annotation(String property, String subject, String text)
      throws XMLStreamException {
    open("AnnotationAssertion");
    leaf("AnnotationProperty", property);
    newline();
    xml.writeStartElement("IRI");
    xml.writeCharacters(subject);
    xml.writeEndElement();
    literal(null, text);
    close();
  }

  private void literal(String datatype, String text) throws XMLStreamException {
    newline();
    xml.writeStartElement("Literal");
    if (datatype != null) {
      xml.writeAttribute("datatypeIRI", datatype);
    }
    xml.writeCharacters(text);
    xml.writeEndElement();
  }

  private void prefix(String name, String iri) throws XMLStreamException {
    newline();
    xml.writeEmptyElement("Prefix");
    xml.writeAttribute("name", name);
    xml.writeAttribute("IRI", iri);
  }

  private void leaf(String element, String iri) throws XMLStreamException {
    newline();
    xml.writeEmptyElement(element);
    xml.writeAttribute("IRI", iri);
  }

  private void open(String element) throws XMLStreamException {
    newline();
    xml.writeStartElement(element);
    depth++;
  }

  private void close() throws XMLStreamException {
    depth--;
    newline();
    xml.writeEndElement();
  }

  private void newline() throws XMLStreamException {
    xml.writeCharacters("\n");
    for (int i = 0; i < depth; i++) {
      xml.writeCharacters("    ");
    }
  }
}
