package io.owlbind.model;

import java.util.List;

/**
 * Documentation attached to a relation rather than to a class.
 *
 * @param attribute relation name as found in the schema (slugified on output)
 * @param annotations documentation
 */
public record PropertyNote(String attribute, List<String> annotations) implements GraphEntry {
  public PropertyNote {
    annotations = List.copyOf(annotations);
  }
}
