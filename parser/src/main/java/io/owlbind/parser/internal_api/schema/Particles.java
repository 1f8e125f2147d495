package io.owlbind.parser.internal_api.schema;

import io.owlbind.model.Has;
import io.owlbind.model.QualifiedName;
import io.owlbind.parser.api.OwlbindException;
import io.owlbind.parser.api.TypeConflictException;
import io.owlbind.parser.api.UnexpectedElementException;
import io.owlbind.utils.XmlDocuments;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.w3c.dom.Element;

final class Particles {
  private Particles() {}

  /** Merges the tag tables of the particles; one tag must always denote one type. */
  static Map<QualifiedName, ElementDecl> merge(List<? extends Particle> particles)
      throws TypeConflictException {
    Map<QualifiedName, ElementDecl> merged = new LinkedHashMap<>();
    for (Particle particle : particles) {
      for (Map.Entry<QualifiedName, ElementDecl> e : particle.names().entrySet()) {
        ElementDecl existing = merged.putIfAbsent(e.getKey(), e.getValue());
        if (existing != null && !existing.getType().sameAs(e.getValue().getType())) {
          throw TypeConflictException.conflictingBranches(
              e.getKey().toString(),
              existing.getType().toString(),
              e.getValue().getType().toString());
        }
      }
    }
    return Collections.unmodifiableMap(merged);
  }

  /** Dispatches every child element of the node through the table. */
  static List<Has> dispatch(
      Map<QualifiedName, ElementDecl> table, Element node, ParseContext context)
      throws OwlbindException {
    List<Has> assertions = new ArrayList<>();
    for (Element child : XmlDocuments.childElements(node)) {
      ElementDecl decl = table.get(XmlDocuments.nameOf(child));
      if (decl == null) {
        throw new UnexpectedElementException(child.getTagName(), XmlDocuments.lineOf(child));
      }
      assertions.addAll(decl.parse(child, context));
    }
    return assertions;
  }
}
