package io.owlbind.parser.internal_api.schema;

import io.owlbind.model.Has;
import io.owlbind.model.QualifiedName;
import io.owlbind.model.Value;
import io.owlbind.parser.api.OwlbindException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.w3c.dom.Element;

/** Element declaration: a tag bound to a type. */
public final class ElementDecl implements Particle {
  private final QualifiedName name;
  private final TypeRef type;
  private final List<String> annotations;
  private final List<String> pushedAnnotations = new ArrayList<>();

  public ElementDecl(QualifiedName name, TypeRef type, List<String> annotations) {
    this.name = name;
    this.type = type;
    this.annotations = List.copyOf(annotations);
  }

  public QualifiedName getName() {
    return name;
  }

  public TypeRef getType() {
    return type;
  }

  /** Returns own documentation followed by documentation left on the relation by a wrapper. */
  public List<String> getRelationAnnotations() {
    List<String> all = new ArrayList<>(annotations);
    all.addAll(pushedAnnotations);
    return all;
  }

  /** Keeps wrapper documentation on this relation. */
  public void addRelationAnnotations(List<String> pushed) {
    for (String note : pushed) {
      if (!annotations.contains(note) && !pushedAnnotations.contains(note)) {
        pushedAnnotations.add(note);
      }
    }
  }

  @Override
  public Map<QualifiedName, ElementDecl> names() {
    return Map.of(name, this);
  }

  /**
   * Parses an element bound to this declaration.
   *
   * @return one assertion named after the element, or the spliced assertions of an alone type
   */
  public List<Has> parse(Element node, ParseContext context) throws OwlbindException {
    TypeDefinition resolved = type.resolve(context);
    String relation = context.publicName(node);
    if (resolved.isAlone()) {
      List<Has> spliced = new ArrayList<>();
      for (Has has : ((ComplexType) resolved).parseAssertions(node, context)) {
        spliced.add(has.isPlaceholder() ? has.renamed(relation) : has);
      }
      return spliced;
    }
    Value value = resolved.parse(node, context);
    return List.of(new Has(relation, value));
  }

  @Override
  public String toString() {
    return "ElementDecl{" + name + " : " + type + "}";
  }
}
