package io.owlbind.parser.internal_api.schema;

import io.owlbind.model.QualifiedName;
import io.owlbind.model.Value;
import io.owlbind.parser.api.OwlbindException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import org.w3c.dom.Element;

/**
 * Abstract base class of compiled schema types.
 *
 * <p>A type is immutable once the schema is compiled, apart from two one-shot flags set by the
 * compiler's prelude pass: {@code marked} (its class has been declared) and the documentation
 * pushed down from a flattened wrapper.
 */
public abstract class TypeDefinition {
  private final QualifiedName name;
  private final String path;
  private final TypeKind kind;
  private final List<String> annotations;
  private final List<String> pushedAnnotations = new ArrayList<>();
  private boolean marked;

  /**
   * @param name registry name, or null for inline types
   * @param path override key: the type's local name, or the element path of an inline type
   * @param kind the variant
   * @param annotations documentation declared on the type
   */
  protected TypeDefinition(
      QualifiedName name, String path, TypeKind kind, List<String> annotations) {
    this.name = name;
    this.path = path;
    this.kind = kind;
    this.annotations = List.copyOf(annotations);
  }

  /** Returns the registry name, or null for an inline type. */
  public QualifiedName getName() {
    return name;
  }

  public String getPath() {
    return path;
  }

  public TypeKind getKind() {
    return kind;
  }

  /** Whether parsed content is spliced into the owner instead of becoming an individual. */
  public abstract boolean isAlone();

  /**
   * Parses an element.
   *
   * @param node the element
   * @param context document context
   * @return a literal or an individual
   * @throws OwlbindException if the element does not match the type
   */
  public abstract Value parse(Element node, ParseContext context) throws OwlbindException;

  /**
   * Parses an attribute value.
   *
   * @param raw the raw attribute text
   * @param context document context
   * @return a literal or an individual
   * @throws OwlbindException if the value does not match the type
   */
  public abstract Value parseValue(String raw, ParseContext context) throws OwlbindException;

  public List<String> getAnnotations() {
    return annotations;
  }

  /** Returns the documentation pushed into this type by flattened wrappers. */
  public List<String> getPushedAnnotations() {
    return Collections.unmodifiableList(pushedAnnotations);
  }

  /** Returns own documentation followed by pushed documentation. */
  public List<String> getClassAnnotations() {
    List<String> all = new ArrayList<>(annotations);
    for (String pushed : pushedAnnotations) {
      if (!all.contains(pushed)) {
        all.add(pushed);
      }
    }
    return all;
  }

  /**
   * Receives documentation from a flattened wrapper.
   *
   * @param pushed documentation to add
   * @throws IllegalStateException if the class of this type has already been declared
   */
  public void receiveAnnotations(List<String> pushed) {
    if (marked) {
      throw new IllegalStateException(
          "Documentation pushed into " + describe() + " after its class was declared");
    }
    pushedAnnotations.addAll(pushed);
  }

  public boolean isMarked() {
    return marked;
  }

  /**
   * Records that the class of this type has been declared.
   *
   * @return true on the first call, false afterwards
   */
  public boolean mark() {
    if (marked) {
      return false;
    }
    marked = true;
    return true;
  }

  /** Returns a short description for messages. */
  public String describe() {
    String label = name != null ? name.toString() : path;
    return kind.name().toLowerCase(Locale.ROOT) + " type " + label;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{" + (name != null ? name : path) + "}";
  }
}
