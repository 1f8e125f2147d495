package io.owlbind.parser.internal_api.schema;

import io.owlbind.model.Has;
import io.owlbind.parser.api.OwlbindException;
import java.util.List;
import org.w3c.dom.Element;

/** Content of a complex type: a sequence, a choice or an extension. */
public interface ContentModel {

  /** Whether the owning type may be flattened on account of this content. */
  boolean isAlone();

  /**
   * Parses the content of an element.
   *
   * @param node the element whose children are parsed
   * @param context document context
   * @return assertions in document order
   * @throws OwlbindException if the content does not match
   */
  List<Has> parse(Element node, ParseContext context) throws OwlbindException;
}
