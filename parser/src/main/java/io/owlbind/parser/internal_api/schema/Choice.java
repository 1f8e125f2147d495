package io.owlbind.parser.internal_api.schema;

import io.owlbind.model.Has;
import io.owlbind.model.QualifiedName;
import io.owlbind.parser.api.OwlbindException;
import io.owlbind.parser.api.TypeConflictException;
import java.util.List;
import java.util.Map;
import org.w3c.dom.Element;

/** Alternative branches merged into one tag table. Never alone. */
public final class Choice implements ContentModel, Particle {
  private final List<Particle> branches;
  private final Map<QualifiedName, ElementDecl> table;

  public Choice(List<Particle> branches) throws TypeConflictException {
    this.branches = List.copyOf(branches);
    this.table = Particles.merge(this.branches);
  }

  public List<Particle> getBranches() {
    return branches;
  }

  @Override
  public Map<QualifiedName, ElementDecl> names() {
    return table;
  }

  @Override
  public boolean isAlone() {
    return false;
  }

  @Override
  public List<Has> parse(Element node, ParseContext context) throws OwlbindException {
    return Particles.dispatch(table, node, context);
  }

  @Override
  public String toString() {
    return "Choice" + table.keySet();
  }
}
