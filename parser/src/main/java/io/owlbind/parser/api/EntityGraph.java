package io.owlbind.parser.api;

import io.owlbind.model.GraphEntry;
import java.util.ArrayList;
import java.util.List;

/**
 * Prelude of a schema together with the documents parsed against it.
 *
 * @param prelude schema-level declarations
 * @param documents parsed documents in order
 */
public record EntityGraph(List<GraphEntry> prelude, List<ParsedDocument> documents) {
  public EntityGraph {
    prelude = List.copyOf(prelude);
    documents = List.copyOf(documents);
  }

  /** Returns the prelude followed by every document's results. */
  public List<GraphEntry> entries() {
    List<GraphEntry> all = new ArrayList<>(prelude);
    for (ParsedDocument document : documents) {
      all.addAll(document.results());
    }
    return all;
  }
}
