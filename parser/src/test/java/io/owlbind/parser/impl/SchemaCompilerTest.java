package io.owlbind.parser.impl;

import static io.owlbind.parser.impl.SchemaFixtures.classNames;
import static io.owlbind.parser.impl.SchemaFixtures.classes;
import static io.owlbind.parser.impl.SchemaFixtures.compile;
import static io.owlbind.parser.impl.SchemaFixtures.compileSchema;
import static io.owlbind.parser.impl.SchemaFixtures.notes;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.owlbind.model.Has;
import io.owlbind.model.Individual;
import io.owlbind.model.Namespaces;
import io.owlbind.model.OwlClass;
import io.owlbind.model.PropertyNote;
import io.owlbind.model.QualifiedName;
import io.owlbind.model.TextLiteral;
import io.owlbind.parser.api.CompiledSchema;
import io.owlbind.parser.api.SchemaDefectException;
import io.owlbind.parser.api.SchemaOptions;
import io.owlbind.parser.api.TypeConflictException;
import io.owlbind.parser.api.UnresolvedReferenceException;
import io.owlbind.parser.internal_api.schema.ComplexType;
import io.owlbind.parser.internal_api.schema.ElementDecl;
import io.owlbind.parser.internal_api.schema.LiteralType;
import io.owlbind.parser.internal_api.schema.Sequence;
import io.owlbind.parser.internal_api.schema.TypeDefinition;
import java.util.List;
import org.junit.jupiter.api.Test;

class SchemaCompilerTest {

  @Test
  void resolvesForwardAndRecursiveReferences() throws Exception {
    CompiledSchema schema =
        compile(
            """
            <xs:element name="Tree" type="TreeType"/>
            <xs:complexType name="TreeType">
              <xs:sequence>
                <xs:element name="Node" type="NodeType"/>
                <xs:element name="Label" type="xs:string"/>
              </xs:sequence>
            </xs:complexType>
            <xs:complexType name="NodeType">
              <xs:sequence>
                <xs:element name="Node" type="NodeType"/>
                <xs:element name="Value" type="xs:integer"/>
              </xs:sequence>
            </xs:complexType>
            """);

    assertThat(classNames(schema)).containsExactly("Tree", "Node");
    assertThat(schema.getElements()).containsKey(QualifiedName.of("", "Tree"));
    assertThat(schema.getTypes().get(QualifiedName.of("", "NodeType")).isMarked()).isTrue();
  }

  @Test
  void resolvesElementsReferencingThemselves() throws Exception {
    // given
    CompiledSchema schema =
        compile(
            """
            <xs:element name="Node">
              <xs:complexType>
                <xs:sequence>
                  <xs:element name="Label" type="xs:string"/>
                  <xs:element ref="Node" minOccurs="0" maxOccurs="unbounded"/>
                </xs:sequence>
              </xs:complexType>
            </xs:element>
            """);

    // when
    Individual root =
        SchemaFixtures.parseIndividual(
            schema, "<Node><Label>root</Label><Node><Label>leaf</Label></Node></Node>");

    // then
    assertThat(classNames(schema)).containsExactly("Node");
    assertThat(root.getAssertions())
        .extracting(Has::getAttribute)
        .containsExactly("Label", "Node");
    Individual leaf = (Individual) root.getAssertions().get(1).getValue();
    assertThat(leaf.getType()).isEqualTo("Node");
    assertThat(leaf.getAssertions())
        .extracting(Has::getValue)
        .containsExactly(new TextLiteral("leaf"));
  }

  @Test
  void resolvesMutuallyReferencingElements() throws Exception {
    CompiledSchema schema =
        compile(
            """
            <xs:element name="Assembly">
              <xs:complexType>
                <xs:sequence>
                  <xs:element name="Name" type="xs:string"/>
                  <xs:element ref="Part" maxOccurs="unbounded"/>
                </xs:sequence>
              </xs:complexType>
            </xs:element>
            <xs:element name="Part">
              <xs:complexType>
                <xs:sequence>
                  <xs:element name="Serial" type="xs:string"/>
                  <xs:element ref="Assembly" minOccurs="0"/>
                </xs:sequence>
              </xs:complexType>
            </xs:element>
            """);

    Individual assembly =
        SchemaFixtures.parseIndividual(
            schema,
            """
            <Assembly>
              <Name>engine</Name>
              <Part>
                <Serial>p1</Serial>
                <Assembly><Name>pump</Name><Part><Serial>p2</Serial></Part></Assembly>
              </Part>
            </Assembly>
            """);

    assertThat(classNames(schema)).containsExactly("Assembly", "Part");
    Individual part = (Individual) assembly.getAssertions().get(1).getValue();
    assertThat(part.getAssertions())
        .extracting(Has::getAttribute)
        .containsExactly("Serial", "Assembly");
    Individual pump = (Individual) part.getAssertions().get(1).getValue();
    assertThat(pump.getBaseName()).isEqualTo("Assembly_5");
  }

  @Test
  void countsTheMembersOfNestedSequences() throws Exception {
    CompiledSchema schema =
        compile(
            """
            <xs:element name="Entry" type="EntryType"/>
            <xs:complexType name="EntryType">
              <xs:sequence>
                <xs:sequence>
                  <xs:element name="Title" type="xs:string"/>
                  <xs:element name="Year" type="xs:integer"/>
                </xs:sequence>
              </xs:sequence>
            </xs:complexType>
            <xs:complexType name="WrapperType">
              <xs:sequence>
                <xs:sequence>
                  <xs:element name="Title" type="xs:string"/>
                </xs:sequence>
              </xs:sequence>
            </xs:complexType>
            """);

    assertThat(schema.getTypes().get(QualifiedName.of("", "EntryType")).isAlone()).isFalse();
    assertThat(schema.getTypes().get(QualifiedName.of("", "WrapperType")).isAlone()).isTrue();
    assertThat(classNames(schema)).containsExactly("Entry");
    Individual entry =
        SchemaFixtures.parseIndividual(
            schema, "<Entry><Title>Dune</Title><Year>1965</Year></Entry>");
    assertThat(entry.getAssertions())
        .extracting(Has::getAttribute)
        .containsExactly("Title", "Year");
  }

  @Test
  void failsOnUndeclaredElementReferences() {
    assertThatThrownBy(
            () ->
                compile(
                    """
                    <xs:element name="Root">
                      <xs:complexType>
                        <xs:sequence><xs:element ref="Missing"/></xs:sequence>
                      </xs:complexType>
                    </xs:element>
                    """))
        .isInstanceOf(UnresolvedReferenceException.class)
        .hasMessageContaining("Element is not declared: Missing");
  }

  @Test
  void failsOnUndeclaredTypes() {
    assertThatThrownBy(() -> compile("<xs:element name=\"Root\" type=\"MissingType\"/>"))
        .isInstanceOf(UnresolvedReferenceException.class)
        .hasMessageContaining("MissingType");
  }

  @Test
  void failsOnUndeclaredPrefixes() {
    assertThatThrownBy(() -> compile("<xs:element name=\"Root\" type=\"nope:Thing\"/>"))
        .isInstanceOf(UnresolvedReferenceException.class)
        .hasMessageContaining("nope:Thing");
  }

  @Test
  void failsOnElementsWithoutType() {
    assertThatThrownBy(() -> compile("<xs:element name=\"Root\"/>"))
        .isInstanceOf(SchemaDefectException.class)
        .hasMessageContaining("Root");
  }

  @Test
  void keepsBuiltinsWhenTheSchemaRedeclaresThem() throws Exception {
    CompiledSchema schema =
        compileSchema(
            """
            <xs:schema xmlns:xs="http://www.w3.org/2001/XMLSchema"
                       targetNamespace="http://www.w3.org/2001/XMLSchema">
              <xs:complexType name="string">
                <xs:sequence>
                  <xs:element name="A" type="xs:integer"/>
                  <xs:element name="B" type="xs:integer"/>
                </xs:sequence>
              </xs:complexType>
            </xs:schema>
            """,
            SchemaOptions.defaults());

    assertThat(schema.getTypes().get(Namespaces.xs("string"))).isInstanceOf(LiteralType.class);
    assertThat(classes(schema)).isEmpty();
  }

  @Test
  void rejectsChoiceBranchesBindingOneTagToTwoTypes() {
    assertThatThrownBy(
            () ->
                compile(
                    """
                    <xs:complexType name="RootType">
                      <xs:choice>
                        <xs:element name="X" type="xs:string"/>
                        <xs:sequence>
                          <xs:element name="X" type="xs:integer"/>
                          <xs:element name="Y" type="xs:string"/>
                        </xs:sequence>
                      </xs:choice>
                    </xs:complexType>
                    """))
        .isInstanceOf(TypeConflictException.class)
        .hasMessageContaining("'X'");
  }

  @Test
  void rejectsSequenceAndNestedChoiceDisagreeing() {
    assertThatThrownBy(
            () ->
                compile(
                    """
                    <xs:complexType name="RootType">
                      <xs:sequence>
                        <xs:element name="X" type="xs:string"/>
                        <xs:choice>
                          <xs:element name="X" type="xs:date"/>
                          <xs:element name="Z" type="xs:string"/>
                        </xs:choice>
                      </xs:sequence>
                    </xs:complexType>
                    """))
        .isInstanceOf(TypeConflictException.class);
  }

  @Test
  void rejectsTwoInlineTypesUnderOneTag() {
    assertThatThrownBy(
            () ->
                compile(
                    """
                    <xs:complexType name="RootType">
                      <xs:choice>
                        <xs:element name="X">
                          <xs:complexType><xs:attribute name="a"/></xs:complexType>
                        </xs:element>
                        <xs:element name="X">
                          <xs:complexType><xs:attribute name="a"/></xs:complexType>
                        </xs:element>
                      </xs:choice>
                    </xs:complexType>
                    """))
        .isInstanceOf(TypeConflictException.class);
  }

  @Test
  void acceptsRepeatedTagsWithTheSameNamedType() throws Exception {
    CompiledSchema schema =
        compile(
            """
            <xs:element name="Root" type="RootType"/>
            <xs:complexType name="RootType">
              <xs:choice>
                <xs:element name="X" type="xs:string"/>
                <xs:sequence>
                  <xs:element name="X" type="xs:string"/>
                  <xs:element name="Y" type="xs:string"/>
                </xs:sequence>
              </xs:choice>
            </xs:complexType>
            """);

    assertThat(classNames(schema)).containsExactly("Root");
  }

  @Test
  void rejectsWildcardNextToNamedChildren() {
    assertThatThrownBy(
            () ->
                compile(
                    """
                    <xs:complexType name="MixedType">
                      <xs:sequence>
                        <xs:element name="A" type="xs:string"/>
                        <xs:any namespace="##any"/>
                      </xs:sequence>
                    </xs:complexType>
                    """))
        .isInstanceOf(SchemaDefectException.class)
        .hasMessageContaining("MixedType");
  }

  @Test
  void rejectsTwoWildcards() {
    assertThatThrownBy(
            () ->
                compile(
                    """
                    <xs:complexType name="AnyType">
                      <xs:sequence><xs:any/><xs:any/></xs:sequence>
                    </xs:complexType>
                    """))
        .isInstanceOf(SchemaDefectException.class)
        .hasMessageContaining("at most one wildcard");
  }

  @Test
  void rejectsSimpleTypesThatAreNotRestrictions() {
    assertThatThrownBy(
            () ->
                compile(
                    """
                    <xs:simpleType name="Either">
                      <xs:union memberTypes="xs:string xs:integer"/>
                    </xs:simpleType>
                    """))
        .isInstanceOf(SchemaDefectException.class)
        .hasMessageContaining("Either");
  }

  @Test
  void declaresOneClassPerPublicName() throws Exception {
    CompiledSchema schema =
        compile(
            """
            <xs:element name="Catalog" type="CatalogType"/>
            <xs:complexType name="CatalogType">
              <xs:sequence>
                <xs:element name="Entry" type="EntryType"/>
                <xs:element name="Archive" type="ArchiveType"/>
              </xs:sequence>
            </xs:complexType>
            <xs:complexType name="ArchiveType">
              <xs:sequence>
                <xs:element name="Entry" type="OldEntryType"/>
                <xs:element name="Year" type="xs:gYear"/>
              </xs:sequence>
            </xs:complexType>
            <xs:complexType name="EntryType">
              <xs:attribute name="ID"/>
              <xs:attribute name="Name"/>
            </xs:complexType>
            <xs:complexType name="OldEntryType">
              <xs:attribute name="ID"/>
              <xs:attribute name="Retired" type="xs:date"/>
            </xs:complexType>
            """);

    assertThat(classNames(schema)).containsExactly("Catalog", "Entry", "Archive");
  }

  @Test
  void declaresUnreachedTypesUnderTheirOwnName() throws Exception {
    CompiledSchema schema =
        compile(
            """
            <xs:complexType name="OrphanType">
              <xs:attribute name="a"/>
              <xs:attribute name="b"/>
            </xs:complexType>
            """);

    assertThat(classNames(schema)).containsExactly("OrphanType");
  }

  @Test
  void declaresVocabulariesWithTheirTerms() throws Exception {
    CompiledSchema schema =
        compile(
            """
            <xs:element name="Paint" type="PaintType"/>
            <xs:complexType name="PaintType">
              <xs:sequence>
                <xs:element name="Color" type="ColorType"/>
                <xs:element name="Finish">
                  <xs:simpleType>
                    <xs:restriction base="xs:string">
                      <xs:enumeration value="Matte"/>
                    </xs:restriction>
                  </xs:simpleType>
                </xs:element>
              </xs:sequence>
            </xs:complexType>
            <xs:simpleType name="ColorType">
              <xs:annotation><xs:documentation>Primary colors.</xs:documentation></xs:annotation>
              <xs:restriction base="xs:string">
                <xs:enumeration value="Red">
                  <xs:annotation><xs:documentation>Warm.</xs:documentation></xs:annotation>
                </xs:enumeration>
                <xs:enumeration value="Blue"/>
              </xs:restriction>
            </xs:simpleType>
            <xs:simpleType name="ShortText">
              <xs:restriction base="xs:string"><xs:maxLength value="10"/></xs:restriction>
            </xs:simpleType>
            """);

    assertThat(classes(schema))
        .containsExactly(
            new OwlClass("Paint", List.of()),
            new OwlClass("ColorType", List.of("Primary colors.")),
            new OwlClass("Finish", List.of()));
    assertThat(schema.getPrelude())
        .filteredOn(Individual.class::isInstance)
        .map(e -> ((Individual) e).getBaseName() + ":" + ((Individual) e).getType())
        .containsExactly("Red:ColorType", "Blue:ColorType", "Matte:Finish");
    Individual red = (Individual) schema.getPrelude().get(2);
    assertThat(red.getAnnotations()).containsExactly("Warm.");
  }

  @Test
  void pushesWrapperDocumentationIntoTheWrappedClass() throws Exception {
    CompiledSchema schema = compile(wrapperSchema(false));

    assertThat(classes(schema))
        .contains(new OwlClass("Inner", List.of("Inner doc", "Wrapper doc")))
        .extracting(OwlClass::name)
        .doesNotContain("Wrapper");
    assertThat(notes(schema)).extracting(PropertyNote::attribute).doesNotContain("Wrapper");
  }

  @Test
  void pushesDocumentationThroughChainedWrappers() throws Exception {
    CompiledSchema schema = compile(wrapperSchema(true));

    assertThat(classes(schema))
        .contains(new OwlClass("Inner", List.of("Inner doc", "Wrapper doc", "Outer doc")));
  }

  @Test
  void keepsDocumentationOnTheRelationWhenPushDownIsSkipped() throws Exception {
    CompiledSchema schema =
        compile(wrapperSchema(false), SchemaOptions.builder().skipPushdown("WrapperType").build());

    assertThat(classes(schema)).contains(new OwlClass("Inner", List.of("Inner doc")));
    assertThat(notes(schema)).contains(new PropertyNote("Wrapper", List.of("Wrapper doc")));
  }

  @Test
  void pushesDocumentationOfSingleAttributeWrappersToTheAttribute() throws Exception {
    CompiledSchema schema =
        compile(
            """
            <xs:element name="Entry" type="EntryType"/>
            <xs:complexType name="EntryType">
              <xs:sequence>
                <xs:element name="Name" type="xs:string"/>
                <xs:element name="Related" type="RefType"/>
              </xs:sequence>
            </xs:complexType>
            <xs:complexType name="RefType">
              <xs:annotation>
                <xs:documentation>Points to another entry.</xs:documentation>
              </xs:annotation>
              <xs:attribute name="CWE_ID" type="xs:integer"/>
            </xs:complexType>
            """);

    assertThat(notes(schema))
        .containsExactly(new PropertyNote("CWE_ID", List.of("Points to another entry.")));
  }

  @Test
  void keepsWildcardWrapperDocumentationOnTheRelation() throws Exception {
    CompiledSchema schema =
        compile(
            """
            <xs:element name="Entry" type="EntryType"/>
            <xs:complexType name="EntryType">
              <xs:sequence>
                <xs:element name="Name" type="xs:string"/>
                <xs:element name="Description" type="StructuredTextType"/>
              </xs:sequence>
            </xs:complexType>
            <xs:complexType name="StructuredTextType">
              <xs:annotation><xs:documentation>Free text.</xs:documentation></xs:annotation>
              <xs:sequence><xs:any namespace="http://www.w3.org/1999/xhtml"/></xs:sequence>
            </xs:complexType>
            """);

    assertThat(notes(schema))
        .containsExactly(new PropertyNote("Description", List.of("Free text.")));
  }

  @Test
  void flattensForcedTypesByPath() throws Exception {
    CompiledSchema schema =
        compile(
            """
            <xs:element name="Flow" type="FlowType"/>
            <xs:complexType name="FlowType">
              <xs:sequence>
                <xs:element name="Step">
                  <xs:complexType>
                    <xs:sequence>
                      <xs:element name="Technique" type="xs:string"/>
                      <xs:element name="Note" type="xs:string"/>
                    </xs:sequence>
                  </xs:complexType>
                </xs:element>
                <xs:element name="Owner" type="xs:string"/>
              </xs:sequence>
            </xs:complexType>
            """,
            SchemaOptions.builder().forceAlone("FlowType/Step").build());

    assertThat(classNames(schema)).containsExactly("Flow");
    ComplexType flow = (ComplexType) schema.getTypes().get(QualifiedName.of("", "FlowType"));
    ElementDecl step = ((Sequence) flow.getContent()).names().get(QualifiedName.of("", "Step"));
    assertThat(step).isNotNull();
    TypeDefinition inline = step.getType().getInline();
    assertThat(inline.getPath()).isEqualTo("FlowType/Step");
    assertThat(inline.isAlone()).isTrue();
  }

  @Test
  void qualifiesLocalElementsOnlyWhenAsked() throws Exception {
    String body =
        """
          <xs:element name="Root">
            <xs:complexType>
              <xs:sequence>
                <xs:element name="A" type="xs:string"/>
                <xs:element name="B" type="xs:string" form="%s"/>
              </xs:sequence>
            </xs:complexType>
          </xs:element>
        </xs:schema>
        """;
    CompiledSchema unqualified =
        compileSchema(
            "<xs:schema xmlns:xs=\"http://www.w3.org/2001/XMLSchema\" targetNamespace=\"urn:t\">"
                + body.formatted("qualified"),
            SchemaOptions.defaults());
    CompiledSchema qualified =
        compileSchema(
            "<xs:schema xmlns:xs=\"http://www.w3.org/2001/XMLSchema\" targetNamespace=\"urn:t\""
                + " elementFormDefault=\"qualified\">"
                + body.formatted("unqualified"),
            SchemaOptions.defaults());

    assertThat(childNames(unqualified))
        .containsExactly(QualifiedName.of("", "A"), QualifiedName.of("urn:t", "B"));
    assertThat(childNames(qualified))
        .containsExactly(QualifiedName.of("urn:t", "A"), QualifiedName.of("", "B"));
  }

  private static List<QualifiedName> childNames(CompiledSchema schema) {
    ElementDecl root = schema.getElements().get(QualifiedName.of("urn:t", "Root"));
    ComplexType type = (ComplexType) root.getType().getInline();
    return List.copyOf(
        ((Sequence) type.getContent()).names().keySet());
  }

  private static String wrapperSchema(boolean chained) {
    String wrapped =
        chained
            ? """
              <xs:complexType name="WrapperType">
                <xs:annotation><xs:documentation>Wrapper doc</xs:documentation></xs:annotation>
                <xs:sequence><xs:element name="Outer" type="OuterType"/></xs:sequence>
              </xs:complexType>
              <xs:complexType name="OuterType">
                <xs:annotation><xs:documentation>Outer doc</xs:documentation></xs:annotation>
                <xs:sequence><xs:element name="Inner" type="InnerType"/></xs:sequence>
              </xs:complexType>
              """
            : """
              <xs:complexType name="WrapperType">
                <xs:annotation><xs:documentation>Wrapper doc</xs:documentation></xs:annotation>
                <xs:sequence><xs:element name="Inner" type="InnerType"/></xs:sequence>
              </xs:complexType>
              """;
    return """
        <xs:element name="Root" type="RootType"/>
        <xs:complexType name="RootType">
          <xs:sequence>
            <xs:element name="Wrapper" type="WrapperType"/>
            <xs:element name="Title" type="xs:string"/>
          </xs:sequence>
        </xs:complexType>
        <xs:complexType name="InnerType">
          <xs:annotation><xs:documentation>Inner doc</xs:documentation></xs:annotation>
          <xs:sequence>
            <xs:element name="A" type="xs:string"/>
            <xs:element name="B" type="xs:string"/>
          </xs:sequence>
        </xs:complexType>
        """
        + wrapped;
  }
}
