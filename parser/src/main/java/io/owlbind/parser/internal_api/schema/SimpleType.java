package io.owlbind.parser.internal_api.schema;

import io.owlbind.model.QualifiedName;
import io.owlbind.model.Value;
import io.owlbind.parser.api.EmptyValueException;
import io.owlbind.parser.api.OwlbindException;
import io.owlbind.utils.XmlDocuments;
import java.util.List;
import org.w3c.dom.Element;

/** Enumerated vocabulary. Never alone. */
public final class SimpleType extends TypeDefinition {
  private final String className;
  private final Restriction restriction;

  /**
   * @param name registry name, or null when inline
   * @param path override key
   * @param className public class name: the type's local name, or the owning declaration's name
   * @param annotations documentation
   * @param restriction the value restriction
   */
  public SimpleType(
      QualifiedName name,
      String path,
      String className,
      List<String> annotations,
      Restriction restriction) {
    super(name, path, TypeKind.SIMPLE, annotations);
    this.className = className;
    this.restriction = restriction;
  }

  public String getClassName() {
    return className;
  }

  public Restriction getRestriction() {
    return restriction;
  }

  @Override
  public boolean isAlone() {
    return false;
  }

  @Override
  public Value parse(Element node, ParseContext context) throws OwlbindException {
    String text = XmlDocuments.leadingText(node);
    if (text == null || text.trim().isEmpty()) {
      throw new EmptyValueException(node.getTagName() + " at line " + XmlDocuments.lineOf(node));
    }
    return restriction.lookup(text.trim(), className, context);
  }

  @Override
  public Value parseValue(String raw, ParseContext context) throws OwlbindException {
    return restriction.lookup(raw.trim(), className, context);
  }
}
