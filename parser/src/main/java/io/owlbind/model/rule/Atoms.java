package io.owlbind.model.rule;

/**
 * Builds atoms from compact {@code "subject predicate object"} triples.
 *
 * <pre>{@code
 * Atoms.data("a hasID id")      // DataPropertyAtom(#a, #hasID, #id)
 * Atoms.object("w hasCVE v")    // ObjectPropertyAtom(#w, #hasCVE, #v)
 * Atoms.type("a", "AttackPattern")
 * }</pre>
 */
public final class Atoms {
  private Atoms() {}

  public static ClassAtom type(String variable, String classIri) {
    return new ClassAtom(variable, classIri);
  }

  public static ObjectPropertyAtom object(String triple) {
    String[] parts = split(triple);
    return new ObjectPropertyAtom(parts[0], parts[1], parts[2]);
  }

  public static ObjectPropertyAtom object(String subject, String property, String object) {
    return object(subject + " " + property + " " + object);
  }

  public static DataPropertyAtom data(String triple) {
    String[] parts = split(triple);
    return new DataPropertyAtom(parts[0], parts[1], parts[2]);
  }

  private static String[] split(String triple) {
    String[] parts = triple.trim().split("\\s+");
    if (parts.length != 3) {
      throw new IllegalArgumentException("Expected 'subject predicate object': " + triple);
    }
    if ("a".equals(parts[1])) {
      throw new IllegalArgumentException("Class membership needs Atoms.type(): " + triple);
    }
    return parts;
  }
}
