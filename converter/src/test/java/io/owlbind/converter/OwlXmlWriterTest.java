package io.owlbind.converter;

import static io.owlbind.model.rule.Atoms.data;
import static io.owlbind.model.rule.Atoms.object;
import static io.owlbind.model.rule.Atoms.type;
import static org.assertj.core.api.Assertions.assertThat;

import io.owlbind.model.Assertions;
import io.owlbind.model.Has;
import io.owlbind.model.IdentityResolver;
import io.owlbind.model.Individual;
import io.owlbind.model.IntegerLiteral;
import io.owlbind.model.Namespaces;
import io.owlbind.model.NamingConfig;
import io.owlbind.model.OwlClass;
import io.owlbind.model.PropertyNote;
import io.owlbind.model.TextLiteral;
import io.owlbind.model.rule.Rule;
import io.owlbind.parser.api.EntityGraph;
import io.owlbind.parser.api.ParsedDocument;
import io.owlbind.utils.XmlDocuments;
import java.io.ByteArrayInputStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

class OwlXmlWriterTest {
  private static final String ONTOLOGY = "https://example.org/cwe";

  private Individual childOf;
  private Individual weakness;
  private Individual hidden;

  @BeforeEach
  void buildEntities() {
    childOf = new Individual("ChildOf", "RelatedNatureEnumeration", List.of(), List.of("Parent."));
    Individual related =
        new Individual(
            "Related_Weakness_7",
            "Related_Weakness",
            List.of(new Has("Nature", childOf), new Has("CWE_ID", new IntegerLiteral(74))));
    hidden = new Individual("Secret_9", "Secret", List.of());
    hidden.setIgnored(true);
    weakness =
        new Individual(
            "Weakness_3",
            "Weakness",
            List.of(
                new Has("ID", new IntegerLiteral(79)),
                new Has("Name", new TextLiteral("Cross-site Scripting")),
                new Has("Related_Weakness", related),
                new Has("Secret", hidden)));
  }

  @Test
  void writesDeclarationsAndAssertions() throws Exception {
    // given
    EntityGraph graph =
        new EntityGraph(
            List.of(
                new OwlClass("Weakness", List.of("A flaw.")),
                childOf,
                new PropertyNote("Related_Weakness", List.of("Link between weaknesses."))),
            List.of(
                new ParsedDocument(
                    "inline", List.of(new Assertions(List.of(new Has("Weakness", weakness)))))));

    // when
    String owl = write(graph, List.of());

    // then
    Document doc = parse(owl);
    Element root = doc.getDocumentElement();
    assertThat(root.getNamespaceURI()).isEqualTo(Namespaces.OWL);
    assertThat(root.getLocalName()).isEqualTo("Ontology");
    assertThat(root.getAttribute("ontologyIRI")).isEqualTo(ONTOLOGY);

    assertThat(declared(doc, "Class")).containsExactly("#Weakness");
    assertThat(declared(doc, "NamedIndividual"))
        .containsExactly(
            "#indRelatedNatureEnumerationChildOf",
            "#CWE-79",
            "#indRelatedWeaknessRelatedWeakness7");
    assertThat(annotations(doc))
        .containsEntry("#Weakness", List.of("A flaw."))
        .containsEntry("#hasRelatedWeakness", List.of("Link between weaknesses."))
        .containsEntry("#CWE-79", List.of("Cross-site Scripting"))
        .containsEntry("#indRelatedNatureEnumerationChildOf", List.of("ChildOf", "Parent."));
    assertThat(owl)
        .contains("datatypeIRI=\"http://www.w3.org/2001/XMLSchema#integer\"")
        .contains("IRI=\"#hasCWEID\"")
        .contains("IRI=\"#hasNature\"");
  }

  @Test
  void pointsAtIgnoredIndividualsWithoutDeclaringThem() throws Exception {
    EntityGraph graph =
        new EntityGraph(List.of(), List.of(new ParsedDocument("inline", List.of(weakness))));

    String owl = write(graph, List.of());

    Document doc = parse(owl);
    assertThat(declared(doc, "NamedIndividual")).doesNotContain("#indSecretSecret9");
    assertThat(owl).contains("IRI=\"#indSecretSecret9\"").contains("IRI=\"#hasSecret\"");
  }

  @Test
  void writesRules() throws Exception {
    Rule rule =
        new Rule(
            "hasCAPEC",
            List.of(
                type("w", "Weakness"),
                data("w hasCAPECID id"),
                type("a", "https://example.org/capec#AttackPattern")),
            object("w hasCAPEC a"));

    String owl = write(new EntityGraph(List.of(), List.of()), List.of(rule, rule));

    Document doc = parse(owl);
    assertThat(doc.getElementsByTagNameNS(Namespaces.OWL, "DLSafeRule").getLength()).isEqualTo(2);
    assertThat(doc.getElementsByTagNameNS(Namespaces.OWL, "ClassAtom").getLength()).isEqualTo(4);
    assertThat(owl)
        .contains("abbreviatedIRI=\"rdfs:label\"")
        .contains(">hasCAPEC</Literal>")
        .contains("IRI=\"https://example.org/capec#AttackPattern\"")
        .contains("IRI=\"#hasCAPECID\"")
        .contains("IRI=\"#w\"");
  }

  private static String write(EntityGraph graph, List<Rule> rules) throws Exception {
    StringWriter out = new StringWriter();
    new OwlXmlWriter(out, new IdentityResolver(namingConfig()), ONTOLOGY).write(graph, rules);
    return out.toString();
  }

  private static Document parse(String owl) throws Exception {
    return XmlDocuments.parse(new ByteArrayInputStream(owl.getBytes(StandardCharsets.UTF_8)));
  }

  private static NamingConfig namingConfig() {
    return new NamingConfig(List.of("ID"), List.of("Name"), Map.of("Weakness", "CWE"));
  }

  /** Returns the IRIs of the declarations of one entity kind, in document order. */
  private static List<String> declared(Document doc, String kind) {
    List<String> iris = new ArrayList<>();
    for (Element declaration : elements(doc, "Declaration")) {
      for (Element entity : XmlDocuments.childElements(declaration)) {
        if (kind.equals(entity.getLocalName())) {
          iris.add(entity.getAttribute("IRI"));
        }
      }
    }
    return iris;
  }

  /** Groups annotation literals by subject IRI. */
  private static Map<String, List<String>> annotations(Document doc) {
    return elements(doc, "AnnotationAssertion").stream()
        .collect(
            Collectors.groupingBy(
                a -> XmlDocuments.childElements(a, Namespaces.OWL, "IRI").get(0).getTextContent(),
                Collectors.mapping(
                    a ->
                        XmlDocuments.childElements(a, Namespaces.OWL, "Literal")
                            .get(0)
                            .getTextContent(),
                    Collectors.toList())));
  }

  private static List<Element> elements(Document doc, String localName) {
    return XmlDocuments.childElements(doc.getDocumentElement(), Namespaces.OWL, localName);
  }
}
