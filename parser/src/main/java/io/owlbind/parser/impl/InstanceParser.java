package io.owlbind.parser.impl;

import io.owlbind.model.Assertions;
import io.owlbind.model.GraphEntry;
import io.owlbind.model.Has;
import io.owlbind.model.QualifiedName;
import io.owlbind.parser.api.CompiledSchema;
import io.owlbind.parser.api.OwlbindException;
import io.owlbind.parser.api.ParsedDocument;
import io.owlbind.parser.api.UnresolvedReferenceException;
import io.owlbind.parser.internal_api.schema.ElementDecl;
import io.owlbind.utils.XmlDocuments;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Walks instance documents against a compiled schema.
 *
 * <p>The root element must be declared at the top level of the schema. A flattened root yields an
 * {@link Assertions} group; any other root yields the individual or literal it parses to.
 */
public final class InstanceParser {
  private static final Logger LOG = LoggerFactory.getLogger(InstanceParser.class);

  private final CompiledSchema schema;

  public InstanceParser(CompiledSchema schema) {
    this.schema = schema;
  }

  /**
   * Parses one document.
   *
   * @param document the instance document
   * @param source where the document came from, for logging
   * @return the top-level results
   * @throws OwlbindException if the document does not conform to the schema
   */
  public ParsedDocument parse(Document document, String source) throws OwlbindException {
    Element root = document.getDocumentElement();
    QualifiedName tag = XmlDocuments.nameOf(root);
    ElementDecl decl = schema.getElements().get(tag);
    if (decl == null) {
      throw UnresolvedReferenceException.unknownRootElement(tag.toString());
    }
    DocumentContext context = new DocumentContext(schema);
    boolean flattened = decl.getType().resolve(context).isAlone();
    List<Has> assertions = decl.parse(root, context);
    GraphEntry result = flattened ? new Assertions(assertions) : assertions.get(0).getValue();
    LOG.debug("Parsed {} with root {}", source, tag);
    return new ParsedDocument(source, List.of(result));
  }
}
