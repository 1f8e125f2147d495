package io.owlbind.parser.api;

/**
 * Thrown at compile time when two branches of a choice (or a sequence and one of its choices)
 * bind the same tag to different types.
 */
public class TypeConflictException extends SchemaDefectException {

  public TypeConflictException(String message, String tag) {
    super(ErrorCode.TYPE_CONFLICT, message, tag);
  }

  public static TypeConflictException conflictingBranches(String tag, String first, String second) {
    return new TypeConflictException(
        String.format("Tag '%s' is bound to both %s and %s", tag, first, second), tag);
  }
}
