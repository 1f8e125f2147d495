package io.owlbind.parser.internal_api.schema;

import io.owlbind.model.Has;
import io.owlbind.parser.api.OwlbindException;
import io.owlbind.utils.XmlDocuments;
import java.util.ArrayList;
import java.util.List;
import org.w3c.dom.Element;

/** Attribute declaration. Absent attributes are skipped whether required or not. */
public final class AttributeDecl {
  private final String name;
  private final TypeRef type;
  private final boolean required;
  private final List<String> annotations;
  private final List<String> pushedAnnotations = new ArrayList<>();

  public AttributeDecl(String name, TypeRef type, boolean required, List<String> annotations) {
    this.name = name;
    this.type = type;
    this.required = required;
    this.annotations = List.copyOf(annotations);
  }

  public String getName() {
    return name;
  }

  public TypeRef getType() {
    return type;
  }

  public boolean isRequired() {
    return required;
  }

  public List<String> getRelationAnnotations() {
    List<String> all = new ArrayList<>(annotations);
    all.addAll(pushedAnnotations);
    return all;
  }

  public void addRelationAnnotations(List<String> pushed) {
    for (String note : pushed) {
      if (!annotations.contains(note) && !pushedAnnotations.contains(note)) {
        pushedAnnotations.add(note);
      }
    }
  }

  /** Parses a raw attribute value into one assertion. */
  public Has parse(String raw, ParseContext context) throws OwlbindException {
    return new Has(name, type.resolve(context).parseValue(raw, context));
  }

  /** Appends an assertion for every declared attribute present on the node, in declaration order. */
  static void collect(
      List<AttributeDecl> declarations, Element node, ParseContext context, List<Has> out)
      throws OwlbindException {
    for (AttributeDecl decl : declarations) {
      String raw = XmlDocuments.attribute(node, decl.name);
      if (raw != null) {
        out.add(decl.parse(raw, context));
      }
    }
  }

  @Override
  public String toString() {
    return "AttributeDecl{@" + name + " : " + type + "}";
  }
}
