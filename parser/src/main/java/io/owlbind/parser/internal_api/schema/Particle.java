package io.owlbind.parser.internal_api.schema;

import io.owlbind.model.QualifiedName;
import java.util.Map;

/** A member of a content model that contributes element tags to the dispatch table. */
public interface Particle {

  /** Returns the element declarations reachable from this particle, keyed by tag. */
  Map<QualifiedName, ElementDecl> names();
}
