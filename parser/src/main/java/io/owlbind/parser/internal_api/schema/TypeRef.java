package io.owlbind.parser.internal_api.schema;

import io.owlbind.model.QualifiedName;
import io.owlbind.parser.api.UnresolvedReferenceException;
import java.util.Objects;

/**
 * Reference from a declaration to its type.
 *
 * <p>Named references are resolved through the registry each time they are dereferenced, so the
 * referenced type may be declared later in the schema or refer back to the referrer. Inline
 * types are owned by the declaration. An element reference made while the referenced global
 * element is still being built is keyed by the element name and bound to that element's type
 * once it exists.
 */
public final class TypeRef {
  private final QualifiedName name;
  private final TypeDefinition inline;
  private final QualifiedName element;
  private TypeRef bound;

  private TypeRef(QualifiedName name, TypeDefinition inline, QualifiedName element) {
    this.name = name;
    this.inline = inline;
    this.element = element;
  }

  public static TypeRef named(QualifiedName name) {
    return new TypeRef(Objects.requireNonNull(name), null, null);
  }

  public static TypeRef inline(TypeDefinition type) {
    return new TypeRef(null, Objects.requireNonNull(type), null);
  }

  /** Returns an unbound reference to the type of a global element, see {@link #bind(TypeRef)}. */
  public static TypeRef ofElement(QualifiedName element) {
    return new TypeRef(null, null, Objects.requireNonNull(element));
  }

  /**
   * Binds an element reference to the type of the built element.
   *
   * @throws IllegalStateException if this is not an unbound element reference
   */
  public void bind(TypeRef target) {
    if (element == null || bound != null) {
      throw new IllegalStateException("Not an unbound element reference: " + this);
    }
    bound = Objects.requireNonNull(target);
  }

  public boolean isInline() {
    return target().inline != null;
  }

  /** Returns the referenced name, or null for an inline type. */
  public QualifiedName getName() {
    return target().name;
  }

  /** Returns the inline type, or null for a named reference. */
  public TypeDefinition getInline() {
    return target().inline;
  }

  /**
   * Returns the live type.
   *
   * @param registry the registry to look named references up in
   * @return the type
   * @throws UnresolvedReferenceException if a named reference is not registered
   */
  public TypeDefinition resolve(TypeRegistry registry) throws UnresolvedReferenceException {
    TypeRef ref = target();
    return ref.inline != null ? ref.inline : registry.lookup(ref.name);
  }

  /**
   * Whether both references denote the same type: same name, or the same inline object. Unbound
   * element references only match references to the same element.
   */
  public boolean sameAs(TypeRef other) {
    TypeRef a = current();
    TypeRef b = other.current();
    if (a.element != null || b.element != null) {
      return a.element != null && a.element.equals(b.element);
    }
    if (a.inline != null || b.inline != null) {
      return a.inline == b.inline;
    }
    return a.name.equals(b.name);
  }

  /** Whether this reference denotes the type, comparing registry names without resolving. */
  public boolean refersTo(TypeDefinition type) {
    TypeRef ref = current();
    if (ref.element != null) {
      return false;
    }
    if (ref.inline != null) {
      return ref.inline == type;
    }
    return type.getName() != null && ref.name.equals(type.getName());
  }

  private TypeRef current() {
    return bound != null ? bound : this;
  }

  private TypeRef target() {
    if (element != null && bound == null) {
      throw new IllegalStateException("Element " + element + " is still being compiled");
    }
    return current();
  }

  @Override
  public String toString() {
    TypeRef ref = current();
    if (ref.element != null) {
      return "type of element " + ref.element;
    }
    return ref.inline != null ? "inline " + ref.inline.describe() : ref.name.toString();
  }
}
