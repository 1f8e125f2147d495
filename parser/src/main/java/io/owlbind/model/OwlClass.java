package io.owlbind.model;

import java.util.List;

/**
 * A class declaration. Emitted once per non-flattened complex type and once per enumerated
 * vocabulary.
 *
 * @param name public class name (slugified on output)
 * @param annotations documentation carried by the class
 */
public record OwlClass(String name, List<String> annotations) implements GraphEntry {
  public OwlClass {
    annotations = List.copyOf(annotations);
  }
}
