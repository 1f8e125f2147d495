package io.owlbind.parser.api;

/**
 * Thrown when wildcard content lives in a namespace that is neither declared by the wildcard nor
 * configured as pass-through.
 */
public class UnexpectedNamespaceException extends OwlbindException {

  public UnexpectedNamespaceException(String message, String tag) {
    super(ErrorCode.UNEXPECTED_NAMESPACE, message, tag);
  }

  public static UnexpectedNamespaceException notDeclared(String actual, String declared) {
    return new UnexpectedNamespaceException(
        String.format("Wildcard accepts '%s' only", declared), actual);
  }

  public static UnexpectedNamespaceException notPassThrough(String tag) {
    return new UnexpectedNamespaceException(
        "No schema type and namespace is not pass-through", tag);
  }
}
