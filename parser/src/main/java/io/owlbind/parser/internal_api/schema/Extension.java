package io.owlbind.parser.internal_api.schema;

import io.owlbind.model.Has;
import io.owlbind.parser.api.EmptyValueException;
import io.owlbind.parser.api.OwlbindException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

/**
 * Derivation from a base type with extra attributes. A scalar or vocabulary base contributes a
 * placeholder value; a complex base contributes its assertions. Never alone.
 */
public final class Extension implements ContentModel {
  private static final Logger LOG = LoggerFactory.getLogger(Extension.class);

  private final TypeRef base;
  private final List<AttributeDecl> attributes;

  public Extension(TypeRef base, List<AttributeDecl> attributes) {
    this.base = base;
    this.attributes = List.copyOf(attributes);
  }

  public TypeRef getBase() {
    return base;
  }

  public List<AttributeDecl> getAttributes() {
    return attributes;
  }

  @Override
  public boolean isAlone() {
    return false;
  }

  @Override
  public List<Has> parse(Element node, ParseContext context) throws OwlbindException {
    List<Has> assertions = new ArrayList<>();
    AttributeDecl.collect(attributes, node, context, assertions);
    TypeDefinition type = base.resolve(context);
    try {
      if (type instanceof ComplexType) {
        assertions.addAll(((ComplexType) type).parseAssertions(node, context));
      } else {
        assertions.add(Has.placeholder(type.parse(node, context)));
      }
    } catch (EmptyValueException e) {
      // an empty base contributes nothing; the attributes still stand
      LOG.debug("Dropping empty base {} of {}", base, e.getContext());
    }
    return assertions;
  }

  @Override
  public String toString() {
    return "Extension{" + base + "}";
  }
}
