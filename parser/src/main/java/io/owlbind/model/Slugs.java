package io.owlbind.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes free text into the camel-cased identifiers used as ontology IRI fragments.
 *
 * <p>The output is the join key between generated entity names and the relation names that rules
 * refer to, so every step here is part of the contract:
 *
 * <ol>
 *   <li>for {@link SlugRole#PROPERTY}, remove {@code @};
 *   <li>remove parenthesized asides together with the whitespace before them;
 *   <li>in {@code :'quoted'} segments, spell out {@code /} and {@code :};
 *   <li>spell out or drop the symbols of {@link #REPLACEMENTS}, in table order;
 *   <li>split on spaces, non-breaking spaces, tabs, newlines, commas, underscores and hyphens;
 *   <li>capitalize every word, concatenate, prepend the role prefix.
 * </ol>
 *
 * <pre>{@code
 * Slugs.slugify("C# (language)")                    -> "CSharp"
 * Slugs.slugify("Related_Weakness", SlugRole.PROPERTY) -> "hasRelatedWeakness"
 * Slugs.slugify("Weaknessread/write", SlugRole.INDIVIDUAL) -> "indWeaknessreadOrWrite"
 * }</pre>
 */
public final class Slugs {
  private Slugs() {}

  // only '\n' ends a line, so asides spanning '\r' or '\u2028' are still removed
  private static final Pattern PARENTHESES =
      Pattern.compile(
          "\\s*\\(.*?\\)", Pattern.UNICODE_CHARACTER_CLASS | Pattern.UNIX_LINES);
  private static final Pattern QUOTED =
      Pattern.compile(
          ":\\s*'([^']*?)'", Pattern.UNICODE_CHARACTER_CLASS | Pattern.UNIX_LINES);
  private static final Pattern DELIMITERS = Pattern.compile("[ \\u00a0\\n\\t,_-]+");

  private static final Map<String, String> INNER_REPLACEMENTS = new LinkedHashMap<>();
  private static final Map<String, String> REPLACEMENTS = new LinkedHashMap<>();

  static {
    INNER_REPLACEMENTS.put("/", "Slash");
    INNER_REPLACEMENTS.put(":", "Colon");

    REPLACEMENTS.put("#", "Sharp");
    REPLACEMENTS.put("+", "Plus");
    REPLACEMENTS.put(".", "Dot");
    REPLACEMENTS.put("\\", "Backslash");
    REPLACEMENTS.put("&", "And");
    REPLACEMENTS.put("'", "");
    REPLACEMENTS.put("/", "Or");
    REPLACEMENTS.put(":", "");
    REPLACEMENTS.put("*", "Wildcard");
    REPLACEMENTS.put("=", "Equal");
    REPLACEMENTS.put("\"", "");
    REPLACEMENTS.put("%", "Percent");
    REPLACEMENTS.put("<", "Below");
    REPLACEMENTS.put(">", "Above");
    REPLACEMENTS.put("^", "");
  }

  /** Slugifies with {@link SlugRole#PLAIN}. */
  public static String slugify(String string) {
    return slugify(string, SlugRole.PLAIN);
  }

  /**
   * Normalizes a string.
   *
   * @param string the text to normalize
   * @param role decides the prefix
   * @return the slug
   * @throws IllegalArgumentException if nothing is left to build a slug from
   */
  public static String slugify(String string, SlugRole role) {
    String s = string;
    if (role == SlugRole.PROPERTY) {
      s = s.replace("@", "");
    }
    s = PARENTHESES.matcher(s).replaceAll("");
    s =
        QUOTED
            .matcher(s)
            .replaceAll(
                m -> Matcher.quoteReplacement(" " + replace(m.group(1), INNER_REPLACEMENTS) + " "));
    s = replace(s, REPLACEMENTS);

    List<String> words = new ArrayList<>();
    for (String word : DELIMITERS.split(strip(s))) {
      if (!word.isEmpty()) {
        words.add(word);
      }
    }
    if (words.isEmpty()) {
      throw new IllegalArgumentException("Cannot build a slug from '" + string + "'");
    }

    StringBuilder sb = new StringBuilder(role.prefix());
    for (String word : words) {
      sb.append(capitalize(word));
    }
    return sb.toString();
  }

  private static String replace(String string, Map<String, String> replacements) {
    String s = string;
    for (Map.Entry<String, String> e : replacements.entrySet()) {
      s = s.replace(e.getKey(), " " + e.getValue() + " ");
    }
    return s;
  }

  private static String capitalize(String word) {
    int first = Character.charCount(word.codePointAt(0));
    return word.substring(0, first).toUpperCase(Locale.ROOT) + word.substring(first);
  }

  // String.strip() keeps non-breaking spaces
  private static String strip(String s) {
    int start = 0;
    int end = s.length();
    while (start < end && isSpace(s.charAt(start))) {
      start++;
    }
    while (end > start && isSpace(s.charAt(end - 1))) {
      end--;
    }
    return s.substring(start, end);
  }

  private static boolean isSpace(char c) {
    return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\u0085';
  }
}
