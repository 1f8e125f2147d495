package io.owlbind.parser.impl;

import io.owlbind.model.QualifiedName;
import io.owlbind.model.TextLiteral;
import io.owlbind.model.Value;
import io.owlbind.parser.api.CompiledSchema;
import io.owlbind.parser.api.UnexpectedNamespaceException;
import io.owlbind.parser.api.UnresolvedReferenceException;
import io.owlbind.parser.internal_api.schema.ParseContext;
import io.owlbind.parser.internal_api.schema.TypeDefinition;
import io.owlbind.utils.XmlDocuments;
import java.util.Optional;
import org.w3c.dom.Element;

/** Parse state of one document. Only reads the compiled schema. */
final class DocumentContext implements ParseContext {
  private final CompiledSchema schema;
  private int unknownPositions;

  DocumentContext(CompiledSchema schema) {
    this.schema = schema;
  }

  @Override
  public TypeDefinition lookup(QualifiedName name) throws UnresolvedReferenceException {
    TypeDefinition type = schema.getTypes().get(name);
    if (type == null) {
      throw UnresolvedReferenceException.unknownType(name.toString());
    }
    return type;
  }

  @Override
  public Optional<TypeDefinition> findType(QualifiedName name) {
    return schema.findType(name);
  }

  @Override
  public String publicName(Element node) {
    return schema.publicName(XmlDocuments.nameOf(node).localName());
  }

  @Override
  public int positionOf(Element node) {
    int line = XmlDocuments.lineOf(node);
    // trees built without line information fall back to a per-document counter
    return line >= 0 ? line : ++unknownPositions;
  }

  @Override
  public Value raw(Element node) throws UnexpectedNamespaceException {
    QualifiedName tag = XmlDocuments.nameOf(node);
    boolean passThrough =
        tag.hasNamespace()
            && schema.getOptions().passThroughNamespaces().contains(tag.namespace());
    if (!passThrough) {
      throw UnexpectedNamespaceException.notPassThrough(tag.toString());
    }
    return new TextLiteral(XmlDocuments.toMarkup(node), tag);
  }
}
