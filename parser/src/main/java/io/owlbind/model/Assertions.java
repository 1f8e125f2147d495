package io.owlbind.model;

import java.util.List;

/**
 * Assertions with no owning individual, the result of parsing a flattened root element.
 *
 * @param assertions the assertions, in document order
 */
public record Assertions(List<Has> assertions) implements GraphEntry {
  public Assertions {
    assertions = List.copyOf(assertions);
  }
}
