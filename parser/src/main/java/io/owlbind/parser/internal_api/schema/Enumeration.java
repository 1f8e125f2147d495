package io.owlbind.parser.internal_api.schema;

import io.owlbind.model.Individual;
import java.util.List;

/**
 * One vocabulary term. The term's individual is created once, when the schema is compiled, and
 * returned for every occurrence in every document.
 */
public final class Enumeration {
  private final String value;
  private final Individual individual;

  public Enumeration(String value, String vocabulary, List<String> annotations) {
    this.value = value;
    this.individual = new Individual(value, vocabulary, List.of(), annotations);
  }

  public String getValue() {
    return value;
  }

  public Individual getIndividual() {
    return individual;
  }
}
