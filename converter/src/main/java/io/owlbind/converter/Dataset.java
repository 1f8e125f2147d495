package io.owlbind.converter;

import static io.owlbind.model.rule.Atoms.data;
import static io.owlbind.model.rule.Atoms.object;
import static io.owlbind.model.rule.Atoms.type;

import io.owlbind.model.rule.Atom;
import io.owlbind.model.rule.Rule;
import io.owlbind.parser.api.SchemaOptions;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** The MITRE datasets the converter knows, with their sources, schema patches and rules. */
public enum Dataset {
  CAPEC(
      "https://capec.mitre.org/data/xsd/ap_schema_latest.xsd",
      "https://capec.mitre.org/data/xml/capec_latest.xml",
      "AttackPattern") {
    @Override
    public SchemaOptions schemaOptions() {
      return SchemaOptions.builder()
          .forceAlone("RelationshipsType", "ExecutionFlowType/Attack_Step/Technique")
          .build();
    }

    @Override
    List<Rule> ownRules(String baseIri) {
      return List.of(
          new Rule(
              "hasCWE",
              List.of(
                  type("a", "AttackPattern"),
                  data("a hasID id"),
                  type("w", baseIri + "cwe#Weakness"),
                  data("w " + baseIri + "cwe#hasCAPECID id")),
              object("a hasCWE w")));
    }
  },

  CVE(
      "https://cve.mitre.org/schema/cve/cve_1.0.xsd",
      "https://cve.mitre.org/data/downloads/allitems.xml",
      null) {
    @Override
    public SchemaOptions schemaOptions() {
      return SchemaOptions.builder().elementAlias("item", "Vulnerability").build();
    }

    @Override
    List<Rule> ownRules(String baseIri) {
      return List.of(
          new Rule(
              "hasCWE",
              List.of(
                  type("v", "Vulnerability"),
                  type("w", baseIri + "cwe#Weakness"),
                  object("w " + baseIri + "cwe#hasCVE v")),
              object("v hasCWE w")));
    }
  },

  CWE(
      "https://cwe.mitre.org/data/xsd/cwe_schema_latest.xsd",
      "https://cwe.mitre.org/data/xml/cwec_latest.xml.zip",
      "Weakness") {
    @Override
    public SchemaOptions schemaOptions() {
      return SchemaOptions.builder().forceAlone("MemberType", "RelationshipsType").build();
    }

    @Override
    List<Rule> ownRules(String baseIri) {
      return List.of(
          new Rule(
              "hasCAPEC",
              List.of(
                  type("w", "Weakness"),
                  data("w hasCAPECID id"),
                  type("a", baseIri + "capec#AttackPattern"),
                  data("a " + baseIri + "capec#hasID id")),
              object("w hasCAPEC a")),
          new Rule(
              "hasCVE",
              List.of(
                  type("w", "Weakness"),
                  object("w hasObservedExample e"),
                  data("e hasReference id"),
                  type("v", baseIri + "cve#Vulnerability"),
                  data("v " + baseIri + "cve#hasName id")),
              object("w hasCVE v")));
    }
  };

  /** Relation natures of related entries, each giving rise to one rule. */
  static final List<String> RELATION_NATURES =
      List.of(
          "canAlsoBe", "canFollow", "canPrecede", "childOf", "peerOf", "requires", "startsWith");

  private final String schemaUrl;
  private final String dataUrl;
  private final String relatedType;

  Dataset(String schemaUrl, String dataUrl, String relatedType) {
    this.schemaUrl = schemaUrl;
    this.dataUrl = dataUrl;
    this.relatedType = relatedType;
  }

  public String schemaUrl() {
    return schemaUrl;
  }

  public String dataUrl() {
    return dataUrl;
  }

  /** Returns the lower case name used in IRIs and command line options. */
  public String kind() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Returns the schema patches of this dataset. */
  public abstract SchemaOptions schemaOptions();

  abstract List<Rule> ownRules(String baseIri);

  /**
   * Returns the reasoning rules written with the ontology.
   *
   * @param baseIri prefix of the ontology IRIs, used to refer to the other datasets
   * @return rules in output order
   */
  public List<Rule> rules(String baseIri) {
    List<Rule> rules = new ArrayList<>(ownRules(baseIri));
    if (relatedType == null) {
      return rules;
    }
    String related = "hasRelated" + relatedType;
    String relatedId = "has" + name() + "ID";
    rules.add(
        new Rule(
            "relatedTo",
            List.of(
                object("s1 " + related + " r"), data("r " + relatedId + " id"), data("s2 hasID id")),
            object("s1 relatedTo s2")));
    for (String nature : RELATION_NATURES) {
      List<Atom> body =
          List.of(
              object("s1 " + related + " r"),
              object("r hasNature indRelatedNatureEnumeration" + capitalize(nature)),
              data("r " + relatedId + " id"),
              data("s2 hasID id"));
      rules.add(new Rule(nature, body, object("s1", nature, "s2")));
    }
    return rules;
  }

  private static String capitalize(String s) {
    return Character.toUpperCase(s.charAt(0)) + s.substring(1);
  }
}
