package io.owlbind.parser.internal_api.schema;

import io.owlbind.model.InvalidLiteralException;
import io.owlbind.model.Literal;
import io.owlbind.model.LiteralKind;
import io.owlbind.model.QualifiedName;
import io.owlbind.model.Value;
import io.owlbind.parser.api.EmptyValueException;
import io.owlbind.parser.api.MalformedLiteralException;
import io.owlbind.parser.api.OwlbindException;
import io.owlbind.utils.XmlDocuments;
import java.util.List;
import org.w3c.dom.Element;

/** Built-in scalar type. */
public final class LiteralType extends TypeDefinition {
  private final LiteralKind literalKind;

  public LiteralType(QualifiedName name, LiteralKind literalKind) {
    super(name, name.localName(), TypeKind.LITERAL, List.of());
    this.literalKind = literalKind;
  }

  public LiteralKind getLiteralKind() {
    return literalKind;
  }

  @Override
  public boolean isAlone() {
    return false;
  }

  @Override
  public Value parse(Element node, ParseContext context) throws OwlbindException {
    String where = node.getTagName() + " at line " + XmlDocuments.lineOf(node);
    String text = XmlDocuments.leadingText(node);
    if (text == null || text.trim().isEmpty()) {
      throw new EmptyValueException(where);
    }
    return literal(text.trim(), where);
  }

  @Override
  public Value parseValue(String raw, ParseContext context) throws OwlbindException {
    return literal(raw.trim(), getName().toString());
  }

  private Literal literal(String text, String where)
      throws EmptyValueException, MalformedLiteralException {
    try {
      return literalKind.parse(text);
    } catch (InvalidLiteralException e) {
      if (e.isEmptyText()) {
        throw new EmptyValueException(where);
      }
      throw new MalformedLiteralException(text, literalKind.label(), where, e.getCause());
    }
  }
}
