package io.owlbind.parser.internal_api.schema;

import io.owlbind.model.Value;
import io.owlbind.parser.api.OwlbindException;
import io.owlbind.parser.api.UnknownVocabularyValueException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Restriction of a base type to a finite set of values. Without enumerations the base type
 * parses the value; other facets are not checked.
 */
public final class Restriction {
  private final TypeRef base;
  private final Map<String, Enumeration> enumerations;

  public Restriction(TypeRef base, List<Enumeration> enumerations) {
    this.base = base;
    Map<String, Enumeration> byValue = new LinkedHashMap<>();
    for (Enumeration e : enumerations) {
      byValue.putIfAbsent(e.getValue(), e);
    }
    this.enumerations = Collections.unmodifiableMap(byValue);
  }

  public TypeRef getBase() {
    return base;
  }

  public Collection<Enumeration> getEnumerations() {
    return enumerations.values();
  }

  /**
   * Maps trimmed text to its vocabulary individual, or to a base literal when the restriction
   * enumerates nothing.
   */
  Value lookup(String text, String vocabulary, ParseContext context) throws OwlbindException {
    if (enumerations.isEmpty()) {
      return base.resolve(context).parseValue(text, context);
    }
    Enumeration term = enumerations.get(text);
    if (term == null) {
      throw new UnknownVocabularyValueException(text, vocabulary);
    }
    return term.getIndividual();
  }
}
