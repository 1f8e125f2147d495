package io.owlbind.parser.internal_api.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.owlbind.model.LiteralKind;
import io.owlbind.model.QualifiedName;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.Test;

class TypeDefinitionTest {

  private static ComplexType entryType() {
    return new ComplexType(
        QualifiedName.of("", "EntryType"),
        "EntryType",
        List.of("Own doc"),
        List.of(
            new AttributeDecl("a", TypeRef.named(QualifiedName.of("", "x")), false, List.of()),
            new AttributeDecl("b", TypeRef.named(QualifiedName.of("", "x")), false, List.of())),
        null,
        false);
  }

  @Test
  void describesTypesIndependentlyOfTheDefaultLocale() {
    Locale previous = Locale.getDefault();
    Locale.setDefault(new Locale("tr", "TR"));
    try {
      assertThat(entryType().describe()).isEqualTo("complex type EntryType");
      assertThat(new LiteralType(QualifiedName.of("", "id"), LiteralKind.INTEGER).describe())
          .startsWith("literal type");
    } finally {
      Locale.setDefault(previous);
    }
  }

  @Test
  void marksOnlyOnce() {
    ComplexType type = entryType();

    assertThat(type.isMarked()).isFalse();
    assertThat(type.mark()).isTrue();
    assertThat(type.mark()).isFalse();
    assertThat(type.isMarked()).isTrue();
  }

  @Test
  void mergesPushedDocumentationWithoutDuplicates() {
    ComplexType type = entryType();

    type.receiveAnnotations(List.of("Wrapper doc", "Own doc"));
    type.receiveAnnotations(List.of("Wrapper doc"));

    assertThat(type.getClassAnnotations()).containsExactly("Own doc", "Wrapper doc");
  }

  @Test
  void refusesDocumentationAfterTheClassWasDeclared() {
    ComplexType type = entryType();
    type.mark();

    assertThatThrownBy(() -> type.receiveAnnotations(List.of("late")))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("EntryType");
  }

  @Test
  void decidesFlatteningFromShape() {
    AttributeDecl id =
        new AttributeDecl("id", TypeRef.named(QualifiedName.of("", "x")), false, List.of());

    assertThat(entryType().isAlone()).isFalse();
    assertThat(new ComplexType(null, "Ref", List.of(), List.of(id), null, false).isAlone())
        .isTrue();
    assertThat(new ComplexType(null, "Empty", List.of(), List.of(), null, false).isAlone())
        .isFalse();
    assertThat(new ComplexType(null, "Forced", List.of(), List.of(), null, true).isAlone())
        .isTrue();
  }

  @Test
  void comparesReferencesByNameOrIdentity() {
    ComplexType inline = entryType();
    TypeRef named = TypeRef.named(QualifiedName.of("urn:t", "T"));

    assertThat(named.sameAs(TypeRef.named(QualifiedName.of("urn:t", "T")))).isTrue();
    assertThat(named.sameAs(TypeRef.named(QualifiedName.of("", "T")))).isFalse();
    assertThat(TypeRef.inline(inline).sameAs(TypeRef.inline(inline))).isTrue();
    assertThat(TypeRef.inline(inline).sameAs(TypeRef.inline(entryType()))).isFalse();
    assertThat(TypeRef.named(QualifiedName.of("", "EntryType")).refersTo(inline)).isTrue();
  }
}
