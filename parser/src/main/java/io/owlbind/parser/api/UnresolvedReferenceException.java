package io.owlbind.parser.api;

/** Thrown when a type, element or namespace prefix cannot be found. */
public class UnresolvedReferenceException extends OwlbindException {

  public UnresolvedReferenceException(String message, String name) {
    this(ErrorCode.UNRESOLVED, message, name);
  }

  private UnresolvedReferenceException(ErrorCode code, String message, String name) {
    super(code, message, name);
  }

  public static UnresolvedReferenceException unknownType(String qualifiedName) {
    return new UnresolvedReferenceException("Type is not registered", qualifiedName);
  }

  public static UnresolvedReferenceException unknownElement(String qualifiedName) {
    return new UnresolvedReferenceException("Element is not declared", qualifiedName);
  }

  public static UnresolvedReferenceException unknownPrefix(String reference) {
    return new UnresolvedReferenceException("Namespace prefix is not declared", reference);
  }

  public static UnresolvedReferenceException unknownRootElement(String qualifiedName) {
    return new UnresolvedReferenceException(
        ErrorCode.UNKNOWN_ROOT, "No top-level element declaration", qualifiedName);
  }
}
