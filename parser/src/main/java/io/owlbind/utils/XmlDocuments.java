package io.owlbind.utils;

import io.owlbind.model.QualifiedName;
import java.io.IOException;
import java.io.InputStream;
import java.io.StringWriter;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.xml.sax.Attributes;
import org.xml.sax.InputSource;
import org.xml.sax.Locator;
import org.xml.sax.SAXException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * DOM helpers for schema and instance documents.
 *
 * <p>Documents are built through SAX so that every element remembers the line it started on
 * ({@link #lineOf(Node)}). Namespace declarations are kept as {@code xmlns} attributes, which
 * keeps prefix lookups working on the resulting tree.
 */
public final class XmlDocuments {
  private XmlDocuments() {}

  private static final String LINE_KEY = "owlbind.line";
  private static final TransformerFactory TRANSFORMERS = transformerFactory();

  /**
   * Parses a whole document into memory.
   *
   * @param in the document bytes; not closed by this method
   * @return namespace-aware DOM with line numbers
   * @throws IOException if the stream cannot be read or is not well-formed XML
   */
  public static Document parse(InputStream in) throws IOException {
    try {
      SAXParserFactory factory = SAXParserFactory.newInstance();
      factory.setNamespaceAware(true);
      factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
      factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
      factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
      SAXParser parser = factory.newSAXParser();

      Document document =
          DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
      parser.parse(new InputSource(in), new DomBuilder(document));
      return document;
    } catch (SAXException | ParserConfigurationException e) {
      throw new IOException("Malformed XML document", e);
    }
  }

  /** Returns the source line of an element, or -1 when unknown. */
  public static int lineOf(Node node) {
    Object line = node.getUserData(LINE_KEY);
    return line instanceof Integer ? (Integer) line : -1;
  }

  /** Deep-copies a node, keeping the source line of every copied element. */
  public static Node copyOf(Node node) {
    Node copy = node.cloneNode(false);
    if (node.getNodeType() == Node.ELEMENT_NODE) {
      Object line = node.getUserData(LINE_KEY);
      if (line != null) {
        copy.setUserData(LINE_KEY, line, null);
      }
    }
    for (Node child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
      copy.appendChild(copyOf(child));
    }
    return copy;
  }

  /** Returns the element children of a node, in document order. */
  public static List<Element> childElements(Node node) {
    List<Element> elements = new ArrayList<>();
    for (Node child = node.getFirstChild(); child != null; child = child.getNextSibling()) {
      if (child.getNodeType() == Node.ELEMENT_NODE) {
        elements.add((Element) child);
      }
    }
    return elements;
  }

  /** Returns the element children with the given namespace and local name. */
  public static List<Element> childElements(Node node, String namespace, String localName) {
    List<Element> elements = new ArrayList<>();
    for (Element child : childElements(node)) {
      if (namespace.equals(child.getNamespaceURI()) && localName.equals(child.getLocalName())) {
        elements.add(child);
      }
    }
    return elements;
  }

  /**
   * Returns the text that precedes the first non-text child, or null when the element starts
   * with a child element or has no content at all.
   */
  public static String leadingText(Element element) {
    StringBuilder sb = null;
    for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
      short type = child.getNodeType();
      if (type != Node.TEXT_NODE && type != Node.CDATA_SECTION_NODE) {
        break;
      }
      if (sb == null) {
        sb = new StringBuilder();
      }
      sb.append(child.getNodeValue());
    }
    return sb == null ? null : sb.toString();
  }

  /** Returns the namespace-qualified name of an element. */
  public static QualifiedName nameOf(Element element) {
    String local = element.getLocalName() != null ? element.getLocalName() : element.getTagName();
    return QualifiedName.of(element.getNamespaceURI(), local);
  }

  /** Returns an attribute without namespace, or null if absent. */
  public static String attribute(Element element, String name) {
    return element.hasAttribute(name) ? element.getAttribute(name) : null;
  }

  /** Serializes a node to markup, without XML declaration. */
  public static String toMarkup(Node node) {
    try {
      Transformer transformer = TRANSFORMERS.newTransformer();
      transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "yes");
      StringWriter writer = new StringWriter();
      transformer.transform(new DOMSource(node), new StreamResult(writer));
      return writer.toString();
    } catch (TransformerException e) {
      throw new IllegalStateException("Cannot serialize in-memory DOM node", e);
    }
  }

  private static TransformerFactory transformerFactory() {
    TransformerFactory factory = TransformerFactory.newInstance();
    factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
    factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
    return factory;
  }

  private static final class DomBuilder extends DefaultHandler {
    private final Document document;
    private final Deque<Node> open = new ArrayDeque<>();
    private final List<String[]> pendingPrefixes = new ArrayList<>();
    private final StringBuilder text = new StringBuilder();
    private Locator locator;

    DomBuilder(Document document) {
      this.document = document;
      open.push(document);
    }

    @Override
    public void setDocumentLocator(Locator locator) {
      this.locator = locator;
    }

    @Override
    public void startPrefixMapping(String prefix, String uri) {
      pendingPrefixes.add(new String[] {prefix, uri});
    }

    @Override
    public void startElement(String uri, String localName, String qName, Attributes attributes) {
      flushText();
      Element element = document.createElementNS(uri.isEmpty() ? null : uri, qName);
      for (String[] mapping : pendingPrefixes) {
        String name = mapping[0].isEmpty() ? "xmlns" : "xmlns:" + mapping[0];
        element.setAttributeNS(XMLConstants.XMLNS_ATTRIBUTE_NS_URI, name, mapping[1]);
      }
      pendingPrefixes.clear();
      for (int i = 0; i < attributes.getLength(); i++) {
        String attributeUri = attributes.getURI(i);
        element.setAttributeNS(
            attributeUri.isEmpty() ? null : attributeUri,
            attributes.getQName(i),
            attributes.getValue(i));
      }
      if (locator != null) {
        element.setUserData(LINE_KEY, locator.getLineNumber(), null);
      }
      open.peek().appendChild(element);
      open.push(element);
    }

    @Override
    public void endElement(String uri, String localName, String qName) {
      flushText();
      open.pop();
    }

    @Override
    public void characters(char[] ch, int start, int length) {
      text.append(ch, start, length);
    }

    private void flushText() {
      if (text.length() == 0) {
        return;
      }
      // text outside the root element is whitespace and has no place in a DOM document
      if (open.peek() != document) {
        open.peek().appendChild(document.createTextNode(text.toString()));
      }
      text.setLength(0);
    }
  }
}
