package io.owlbind.parser.internal_api.schema;

import io.owlbind.model.Has;
import io.owlbind.model.Namespaces;
import io.owlbind.model.QualifiedName;
import io.owlbind.parser.api.OwlbindException;
import io.owlbind.parser.api.SchemaDefectException;
import io.owlbind.utils.XmlDocuments;
import java.util.List;
import java.util.Map;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

/**
 * Ordered named children, or a single wildcard. Child elements are dispatched by tag in
 * document order; occurrence counts are not enforced.
 */
public final class Sequence implements ContentModel, Particle {
  private final List<Particle> children;
  private final Wildcard wildcard;
  private final Map<QualifiedName, ElementDecl> table;

  /**
   * @param children element declarations, choices and nested sequences in schema order
   * @param wildcard the wildcard, or null
   * @param context where the sequence is declared, for error messages
   * @throws SchemaDefectException if a wildcard is mixed with named children or tags conflict
   */
  public Sequence(List<Particle> children, Wildcard wildcard, String context)
      throws SchemaDefectException {
    if (wildcard != null && !children.isEmpty()) {
      throw SchemaDefectException.mixedWildcard(context);
    }
    this.children = List.copyOf(children);
    this.wildcard = wildcard;
    this.table = Particles.merge(this.children);
  }

  public List<Particle> getChildren() {
    return children;
  }

  public Wildcard getWildcard() {
    return wildcard;
  }

  @Override
  public Map<QualifiedName, ElementDecl> names() {
    return table;
  }

  /** Counts named children, looking through nested sequences; a choice counts once. */
  public int childCount() {
    int count = 0;
    for (Particle child : children) {
      if (child instanceof Sequence && ((Sequence) child).wildcard == null) {
        count += ((Sequence) child).childCount();
      } else {
        count++;
      }
    }
    return count;
  }

  @Override
  public boolean isAlone() {
    return wildcard != null || childCount() <= 1;
  }

  @Override
  public List<Has> parse(Element node, ParseContext context) throws OwlbindException {
    if (wildcard != null) {
      return List.of(wildcard.parse(wrapContent(node), context));
    }
    return Particles.dispatch(table, node, context);
  }

  /** Copies the whole inner content of the node into a detached XHTML {@code div}. */
  private static Element wrapContent(Element node) {
    Element div = node.getOwnerDocument().createElementNS(Namespaces.XHTML, "div");
    for (Node child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
      div.appendChild(XmlDocuments.copyOf(child));
    }
    return div;
  }

  @Override
  public String toString() {
    return wildcard != null ? "Sequence{any}" : "Sequence" + table.keySet();
  }
}
