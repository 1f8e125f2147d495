package io.owlbind.parser.api;

/** Thrown when a value is not part of its enumerated vocabulary. */
public class UnknownVocabularyValueException extends OwlbindException {

  public UnknownVocabularyValueException(String value, String vocabulary) {
    super(
        ErrorCode.UNKNOWN_VOCABULARY,
        String.format("Value '%s' is not declared by the vocabulary", value),
        vocabulary);
  }
}
