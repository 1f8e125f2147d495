package io.owlbind.parser.internal_api.schema;

import io.owlbind.model.Has;
import io.owlbind.model.QualifiedName;
import io.owlbind.model.Value;
import io.owlbind.parser.api.OwlbindException;
import io.owlbind.parser.api.UnexpectedNamespaceException;
import io.owlbind.utils.XmlDocuments;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.w3c.dom.Element;

/**
 * {@code xs:any} capture. The namespace constraint is the attribute's token list:
 * {@code ##any}, {@code ##other}, {@code ##targetNamespace}, {@code ##local} or namespace URIs.
 */
public final class Wildcard {
  private final String namespace;
  private final String targetNamespace;
  private final List<String> tokens;

  public Wildcard(String namespace, String targetNamespace) {
    this.namespace = namespace == null || namespace.isBlank() ? "##any" : namespace.trim();
    this.targetNamespace = targetNamespace == null ? "" : targetNamespace;
    this.tokens = Arrays.asList(this.namespace.split("\\s+"));
  }

  public String getNamespace() {
    return namespace;
  }

  /** Whether an element in the namespace may be captured. */
  public boolean accepts(String elementNamespace) {
    String ns = elementNamespace == null ? "" : elementNamespace;
    for (String token : tokens) {
      switch (token) {
        case "##any":
          return true;
        case "##other":
          if (!ns.isEmpty() && !ns.equals(targetNamespace)) {
            return true;
          }
          break;
        case "##targetNamespace":
          if (ns.equals(targetNamespace)) {
            return true;
          }
          break;
        case "##local":
          if (ns.isEmpty()) {
            return true;
          }
          break;
        default:
          if (ns.equals(token)) {
            return true;
          }
      }
    }
    return false;
  }

  /**
   * Parses captured content: through the registry type named after the tag when there is one,
   * else as raw markup.
   *
   * @return a placeholder assertion for the owning element to rename
   */
  public Has parse(Element node, ParseContext context) throws OwlbindException {
    String ns = node.getNamespaceURI();
    if (!accepts(ns)) {
      throw UnexpectedNamespaceException.notDeclared(ns == null ? "" : ns, namespace);
    }
    QualifiedName tag = XmlDocuments.nameOf(node);
    Optional<TypeDefinition> type = context.findType(tag);
    Value value = type.isPresent() ? type.get().parse(node, context) : context.raw(node);
    return Has.placeholder(value);
  }
}
