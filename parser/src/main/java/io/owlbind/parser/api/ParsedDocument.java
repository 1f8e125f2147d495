package io.owlbind.parser.api;

import io.owlbind.model.GraphEntry;
import java.util.List;

/**
 * Entities parsed from one instance document. Each top-level result is an
 * {@link io.owlbind.model.Individual}, an {@link io.owlbind.model.Assertions} group (when the
 * root type is flattened) or a {@link io.owlbind.model.Literal}.
 *
 * @param source where the document came from, for logging
 * @param results top-level results
 */
public record ParsedDocument(String source, List<GraphEntry> results) {
  public ParsedDocument {
    results = List.copyOf(results);
  }
}
