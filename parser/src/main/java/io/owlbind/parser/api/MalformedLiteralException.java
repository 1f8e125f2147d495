package io.owlbind.parser.api;

/** Thrown when a literal's text does not match the lexical form of its datatype. */
public class MalformedLiteralException extends OwlbindException {

  public MalformedLiteralException(String text, String datatype, String context, Throwable cause) {
    super(
        ErrorCode.MALFORMED_LITERAL,
        String.format("'%s' is not a valid %s", text, datatype),
        context,
        cause);
  }
}
