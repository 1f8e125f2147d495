package io.owlbind.parser.api;

/**
 * Thrown when an XSD uses a construct the compiler cannot represent, such as a wildcard mixed
 * with named children or a simple type that is not a restriction.
 */
public class SchemaDefectException extends OwlbindException {

  public SchemaDefectException(String message, String context) {
    super(ErrorCode.SCHEMA_DEFECT, message, context);
  }

  SchemaDefectException(ErrorCode code, String message, String context) {
    super(code, message, context);
  }

  public static SchemaDefectException mixedWildcard(String path) {
    return new SchemaDefectException("A sequence cannot mix a wildcard with named children", path);
  }

  public static SchemaDefectException multipleWildcards(String path) {
    return new SchemaDefectException("A sequence can declare at most one wildcard", path);
  }

  public static SchemaDefectException unsupportedSimpleType(String path) {
    return new SchemaDefectException("Only restriction-based simple types are supported", path);
  }

  public static SchemaDefectException missingType(String declaration) {
    return new SchemaDefectException(
        "Declaration has neither a type attribute nor an inline type", declaration);
  }

  public static SchemaDefectException notAnAttributeType(String type) {
    return new SchemaDefectException("Complex types cannot carry attribute values", type);
  }
}
