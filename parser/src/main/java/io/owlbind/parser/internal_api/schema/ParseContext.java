package io.owlbind.parser.internal_api.schema;

import io.owlbind.model.QualifiedName;
import io.owlbind.model.Value;
import io.owlbind.parser.api.UnexpectedNamespaceException;
import java.util.Optional;
import org.w3c.dom.Element;

/**
 * What type records need from the instance parser while walking one document.
 */
public interface ParseContext extends TypeRegistry {

  /** Returns the type registered under the name, if any. */
  Optional<TypeDefinition> findType(QualifiedName name);

  /** Returns the public name of an element: its local name or its configured alias. */
  String publicName(Element node);

  /** Returns the source position of an element, used to tell individuals apart. */
  int positionOf(Element node);

  /**
   * Captures an element as opaque markup.
   *
   * @param node the element
   * @return a text literal typed after the element's namespace and local name
   * @throws UnexpectedNamespaceException if the element's namespace is not pass-through
   */
  Value raw(Element node) throws UnexpectedNamespaceException;
}
