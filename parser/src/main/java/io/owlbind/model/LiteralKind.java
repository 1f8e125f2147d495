package io.owlbind.model;

import java.math.BigInteger;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * The scalar kinds a built-in XSD type maps to, each with its parse contract.
 *
 * <p>Input text is expected to be trimmed already. Only {@link #TEXT} accepts an empty string.
 */
public enum LiteralKind {
  /** Any string. */
  TEXT {
    @Override
    Literal parseLexical(String text) {
      return new TextLiteral(text);
    }

    @Override
    public boolean acceptsEmpty() {
      return true;
    }
  },

  /** Calendar date in {@code yyyy-MM-dd}. */
  DATE {
    @Override
    Literal parseLexical(String text) {
      return new DateLiteral(LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE));
    }
  },

  /** Arbitrary precision integer (also used for years). */
  INTEGER {
    @Override
    Literal parseLexical(String text) {
      return new IntegerLiteral(new BigInteger(text));
    }
  },

  /** {@code --MM}, {@code ---DD} or {@code --MM-DD} fragments, flattened to an integer. */
  DATE_FRAGMENT {
    @Override
    Literal parseLexical(String text) {
      return new IntegerLiteral(new BigInteger(text.replace("-", "")));
    }
  };

  abstract Literal parseLexical(String text);

  public boolean acceptsEmpty() {
    return false;
  }

  /** Lower-case name used in messages. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a trimmed lexical form.
   *
   * @param text the trimmed text
   * @return the literal
   * @throws InvalidLiteralException if the text is empty and this kind needs a value, or is not a
   *     valid lexical form
   */
  public Literal parse(String text) throws InvalidLiteralException {
    if (text.isEmpty() && !acceptsEmpty()) {
      throw new InvalidLiteralException(this, text, null);
    }
    try {
      return parseLexical(text);
    } catch (NumberFormatException | DateTimeParseException e) {
      throw new InvalidLiteralException(this, text, e);
    }
  }
}
