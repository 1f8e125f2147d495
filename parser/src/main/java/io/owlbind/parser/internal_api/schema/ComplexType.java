package io.owlbind.parser.internal_api.schema;

import io.owlbind.model.Has;
import io.owlbind.model.Individual;
import io.owlbind.model.QualifiedName;
import io.owlbind.model.Value;
import io.owlbind.parser.api.OwlbindException;
import io.owlbind.parser.api.SchemaDefectException;
import java.util.ArrayList;
import java.util.List;
import org.w3c.dom.Element;

/**
 * Structured type: attributes plus optional content.
 *
 * <p>The type is alone when it carries a single attribute and no content, or alone content and
 * at most one attribute. An alone type never becomes an individual: its assertions are spliced
 * into the owning element.
 */
public final class ComplexType extends TypeDefinition {
  private final List<AttributeDecl> attributes;
  private final ContentModel content;
  private final boolean alone;

  /**
   * @param name registry name, or null when inline
   * @param path override key
   * @param annotations documentation
   * @param attributes attributes in declaration order
   * @param content the content model, or null
   * @param forceAlone whether the type is flattened regardless of its shape
   */
  public ComplexType(
      QualifiedName name,
      String path,
      List<String> annotations,
      List<AttributeDecl> attributes,
      ContentModel content,
      boolean forceAlone) {
    super(name, path, TypeKind.COMPLEX, annotations);
    this.attributes = List.copyOf(attributes);
    this.content = content;
    this.alone =
        forceAlone
            || (content == null
                ? this.attributes.size() == 1
                : content.isAlone() && this.attributes.size() <= 1);
  }

  public List<AttributeDecl> getAttributes() {
    return attributes;
  }

  /** Returns the content model, or null. */
  public ContentModel getContent() {
    return content;
  }

  @Override
  public boolean isAlone() {
    return alone;
  }

  /** Parses attributes then content, without creating an individual. */
  public List<Has> parseAssertions(Element node, ParseContext context) throws OwlbindException {
    List<Has> assertions = new ArrayList<>();
    AttributeDecl.collect(attributes, node, context, assertions);
    if (content != null) {
      assertions.addAll(content.parse(node, context));
    }
    return assertions;
  }

  @Override
  public Value parse(Element node, ParseContext context) throws OwlbindException {
    if (!alone && !isMarked()) {
      throw new IllegalStateException("No class was declared for " + describe());
    }
    List<Has> assertions = parseAssertions(node, context);
    String type = context.publicName(node);
    return new Individual(type + "_" + context.positionOf(node), type, assertions);
  }

  @Override
  public Value parseValue(String raw, ParseContext context) throws OwlbindException {
    throw SchemaDefectException.notAnAttributeType(describe());
  }
}
