package io.owlbind.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import org.junit.jupiter.api.Test;

class LiteralKindTest {

  @Test
  void parsesText() throws Exception {
    Literal literal = LiteralKind.TEXT.parse("hello");
    assertThat(literal).isEqualTo(new TextLiteral("hello"));
    assertThat(literal.getDatatype()).isEqualTo(Namespaces.xs("string"));
  }

  @Test
  void textAcceptsEmptyValues() throws Exception {
    assertThat(LiteralKind.TEXT.parse("").getLexicalForm()).isEmpty();
  }

  @Test
  void parsesDates() throws Exception {
    Literal literal = LiteralKind.DATE.parse("2024-03-01");
    assertThat(literal.getValue()).isEqualTo(LocalDate.of(2024, 3, 1));
    assertThat(literal.getLexicalForm()).isEqualTo("2024-03-01");
  }

  @Test
  void parsesIntegers() throws Exception {
    Literal literal = LiteralKind.INTEGER.parse("12345678901234567890");
    assertThat(literal.getValue()).isEqualTo(new BigInteger("12345678901234567890"));
  }

  @Test
  void flattensDateFragments() throws Exception {
    assertThat(LiteralKind.DATE_FRAGMENT.parse("--05")).isEqualTo(new IntegerLiteral(5));
    assertThat(LiteralKind.DATE_FRAGMENT.parse("---17")).isEqualTo(new IntegerLiteral(17));
    assertThat(LiteralKind.DATE_FRAGMENT.parse("--12-24"))
        .isEqualTo(new IntegerLiteral(1224));
  }

  @Test
  void rejectsEmptyNonTextValues() {
    assertThatThrownBy(() -> LiteralKind.DATE.parse(""))
        .isInstanceOfSatisfying(
            InvalidLiteralException.class, e -> assertThat(e.isEmptyText()).isTrue())
        .hasMessageContaining("date");
    assertThatThrownBy(() -> LiteralKind.INTEGER.parse(""))
        .isInstanceOf(InvalidLiteralException.class);
  }

  @Test
  void rejectsMalformedValues() {
    assertThatThrownBy(() -> LiteralKind.DATE.parse("2024-02-30"))
        .isInstanceOfSatisfying(
            InvalidLiteralException.class, e -> assertThat(e.isEmptyText()).isFalse())
        .hasCauseInstanceOf(DateTimeParseException.class);
    assertThatThrownBy(() -> LiteralKind.INTEGER.parse("twelve"))
        .isInstanceOf(InvalidLiteralException.class)
        .hasMessageContaining("'twelve' is not a valid integer")
        .hasCauseInstanceOf(NumberFormatException.class);
  }
}
