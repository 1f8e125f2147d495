package io.owlbind.parser.impl;

import io.owlbind.model.GraphEntry;
import io.owlbind.model.Namespaces;
import io.owlbind.model.QualifiedName;
import io.owlbind.parser.api.CompiledSchema;
import io.owlbind.parser.api.OwlbindException;
import io.owlbind.parser.api.SchemaDefectException;
import io.owlbind.parser.api.SchemaOptions;
import io.owlbind.parser.api.UnresolvedReferenceException;
import io.owlbind.parser.internal_api.schema.AttributeDecl;
import io.owlbind.parser.internal_api.schema.Choice;
import io.owlbind.parser.internal_api.schema.ComplexType;
import io.owlbind.parser.internal_api.schema.ContentModel;
import io.owlbind.parser.internal_api.schema.ElementDecl;
import io.owlbind.parser.internal_api.schema.Enumeration;
import io.owlbind.parser.internal_api.schema.Extension;
import io.owlbind.parser.internal_api.schema.Particle;
import io.owlbind.parser.internal_api.schema.Restriction;
import io.owlbind.parser.internal_api.schema.Sequence;
import io.owlbind.parser.internal_api.schema.SimpleType;
import io.owlbind.parser.internal_api.schema.TypeDefinition;
import io.owlbind.parser.internal_api.schema.TypeRef;
import io.owlbind.parser.internal_api.schema.Wildcard;
import io.owlbind.utils.XmlDocuments;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.xml.XMLConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Compiles an XML Schema document into a {@link CompiledSchema}.
 *
 * <p>Only the subset of XSD needed for data-centric schemas is understood: top-level elements
 * and named types, sequences, choices, attribute-only extensions, enumerated restrictions and a
 * single {@code xs:any} per sequence. Other constructs are skipped with a warning.
 *
 * <p>References between types are kept as names and resolved through the registry when first
 * dereferenced, so declarations may appear in any order and may be recursive.
 */
public final class SchemaCompiler {
  private static final Logger LOG = LoggerFactory.getLogger(SchemaCompiler.class);

  private final SchemaOptions options;
  private final Map<QualifiedName, TypeDefinition> registry = new LinkedHashMap<>();
  private final Map<QualifiedName, ElementDecl> elements = new LinkedHashMap<>();
  private final Map<QualifiedName, Element> globalElementNodes = new HashMap<>();
  private final Map<QualifiedName, ElementDecl> globalElements = new HashMap<>();
  private final Map<QualifiedName, List<TypeRef>> pendingElementRefs = new HashMap<>();
  private final List<TypeDefinition> declaredTypes = new ArrayList<>();
  private final List<ElementDecl> declaredElements = new ArrayList<>();
  private String targetNamespace = "";
  private boolean qualifiedLocals;

  private SchemaCompiler(SchemaOptions options) {
    this.options = options;
  }

  /**
   * Compiles a schema and runs its prelude pass.
   *
   * @param xsd the schema document
   * @param options per-type overrides and aliases
   * @return the compiled schema
   * @throws OwlbindException if the schema is defective or references something undeclared
   */
  public static CompiledSchema compile(Document xsd, SchemaOptions options)
      throws OwlbindException {
    return new SchemaCompiler(options).run(xsd);
  }

  private CompiledSchema run(Document xsd) throws OwlbindException {
    Element root = xsd.getDocumentElement();
    if (!isXs(root, "schema")) {
      throw new SchemaDefectException(
          "Document is not an XML Schema", XmlDocuments.nameOf(root).toString());
    }
    String tns = XmlDocuments.attribute(root, "targetNamespace");
    targetNamespace = tns == null ? "" : tns;
    qualifiedLocals = "qualified".equals(XmlDocuments.attribute(root, "elementFormDefault"));
    BuiltinTypes.registerInto(registry);

    for (Element child : XmlDocuments.childElements(root)) {
      if (isXs(child, "element")) {
        globalElementNodes.put(QualifiedName.of(targetNamespace, nameAttribute(child, "")), child);
      }
    }

    for (Element child : XmlDocuments.childElements(root)) {
      if (!Namespaces.XS.equals(child.getNamespaceURI())) {
        continue;
      }
      String kind = child.getLocalName();
      if ("element".equals(kind)) {
        QualifiedName name = QualifiedName.of(targetNamespace, nameAttribute(child, ""));
        elements.put(name, globalElement(name));
      } else if ("complexType".equals(kind)) {
        String local = nameAttribute(child, "");
        QualifiedName name = QualifiedName.of(targetNamespace, local);
        register(name, buildComplex(child, name, local));
      } else if ("simpleType".equals(kind)) {
        String local = nameAttribute(child, "");
        QualifiedName name = QualifiedName.of(targetNamespace, local);
        register(name, buildSimple(child, name, local, local));
      } else if (!"annotation".equals(kind)) {
        LOG.warn("Skipping unsupported top-level xs:{}", kind);
      }
    }
    LOG.debug(
        "Registered {} elements and {} types from schema {}",
        elements.size(),
        registry.size(),
        targetNamespace);

    List<GraphEntry> prelude =
        new PreludeBuilder(
                options,
                this::lookup,
                elements.values(),
                registry.values(),
                declaredTypes,
                declaredElements)
            .build();
    return new CompiledSchemaImpl(targetNamespace, elements, registry, prelude, options);
  }

  private TypeDefinition lookup(QualifiedName name) throws UnresolvedReferenceException {
    TypeDefinition type = registry.get(name);
    if (type == null) {
      throw UnresolvedReferenceException.unknownType(name.toString());
    }
    return type;
  }

  private void register(QualifiedName name, TypeDefinition type) {
    if (BuiltinTypes.isBuiltin(name)) {
      LOG.warn("Schema type {} collides with a built-in type, keeping the built-in", name);
      return;
    }
    if (registry.putIfAbsent(name, type) != null) {
      LOG.warn("Duplicate declaration of type {}, keeping the first one", name);
    }
  }

  private ElementDecl globalElement(QualifiedName name) throws OwlbindException {
    ElementDecl decl = globalElements.get(name);
    if (decl != null) {
      return decl;
    }
    Element node = globalElementNodes.get(name);
    if (node == null) {
      throw UnresolvedReferenceException.unknownElement(name.toString());
    }
    List<TypeRef> pending = pendingElementRefs.get(name);
    if (pending != null) {
      // a reference from inside the element's own content: bound once the element is built
      TypeRef ref = TypeRef.ofElement(name);
      pending.add(ref);
      ElementDecl recursive = new ElementDecl(name, ref, annotationsOf(node));
      declaredElements.add(recursive);
      return recursive;
    }
    pending = new ArrayList<>();
    pendingElementRefs.put(name, pending);
    decl = buildElement(node, name, "");
    pendingElementRefs.remove(name);
    for (TypeRef ref : pending) {
      ref.bind(decl.getType());
    }
    globalElements.put(name, decl);
    return decl;
  }

  private ElementDecl buildElement(Element node, QualifiedName name, String parentPath)
      throws OwlbindException {
    String path = join(parentPath, name.localName());
    TypeRef type;
    String typeName = XmlDocuments.attribute(node, "type");
    Element complex = firstXsChild(node, "complexType");
    Element simple = firstXsChild(node, "simpleType");
    if (typeName != null) {
      type = TypeRef.named(resolveReference(node, typeName));
    } else if (complex != null) {
      type = TypeRef.inline(buildComplex(complex, null, path));
    } else if (simple != null) {
      type = TypeRef.inline(buildSimple(simple, null, path, name.localName()));
    } else {
      throw SchemaDefectException.missingType("element " + path);
    }
    ElementDecl decl = new ElementDecl(name, type, annotationsOf(node));
    declaredElements.add(decl);
    return decl;
  }

  private ElementDecl buildLocalElement(Element node, String parentPath) throws OwlbindException {
    String ref = XmlDocuments.attribute(node, "ref");
    if (ref != null) {
      return globalElement(resolveReference(node, ref));
    }
    String local = nameAttribute(node, parentPath);
    String form = XmlDocuments.attribute(node, "form");
    boolean qualified = form != null ? "qualified".equals(form) : qualifiedLocals;
    QualifiedName name = QualifiedName.of(qualified ? targetNamespace : "", local);
    return buildElement(node, name, parentPath);
  }

  private ComplexType buildComplex(Element node, QualifiedName name, String path)
      throws OwlbindException {
    List<AttributeDecl> attributes = buildAttributes(node, path);
    ContentModel content = null;
    for (Element child : XmlDocuments.childElements(node)) {
      if (content != null || !Namespaces.XS.equals(child.getNamespaceURI())) {
        continue;
      }
      switch (child.getLocalName()) {
        case "sequence":
          content = buildSequence(child, path);
          break;
        case "all":
          LOG.debug("Treating xs:all in {} as a sequence", path);
          content = buildSequence(child, path);
          break;
        case "choice":
          content = buildChoice(child, path);
          break;
        case "complexContent":
        case "simpleContent":
          content = buildDerivation(child, path);
          break;
        case "attribute":
        case "anyAttribute":
        case "annotation":
          break;
        default:
          LOG.warn("Ignoring unsupported xs:{} in type {}", child.getLocalName(), path);
      }
    }
    ComplexType type =
        new ComplexType(
            name,
            path,
            annotationsOf(node),
            attributes,
            content,
            options.forceAlone().contains(path));
    declaredTypes.add(type);
    return type;
  }

  private ContentModel buildDerivation(Element node, String path) throws OwlbindException {
    Element extension = firstXsChild(node, "extension");
    if (extension == null) {
      LOG.warn("Ignoring restricted content of type {}", path);
      return null;
    }
    String base = XmlDocuments.attribute(extension, "base");
    if (base == null) {
      throw SchemaDefectException.missingType("extension in " + path);
    }
    for (Element child : XmlDocuments.childElements(extension)) {
      if (isXs(child, "sequence") || isXs(child, "choice")) {
        LOG.warn("Ignoring content added by extension in type {}", path);
      }
    }
    return new Extension(
        TypeRef.named(resolveReference(extension, base)), buildAttributes(extension, path));
  }

  private Sequence buildSequence(Element node, String path) throws OwlbindException {
    List<Particle> children = new ArrayList<>();
    Wildcard wildcard = null;
    for (Element child : XmlDocuments.childElements(node)) {
      if (!Namespaces.XS.equals(child.getNamespaceURI())) {
        continue;
      }
      switch (child.getLocalName()) {
        case "element":
          children.add(buildLocalElement(child, path));
          break;
        case "choice":
          children.add(buildChoice(child, path));
          break;
        case "sequence":
          children.add(buildSequence(child, path));
          break;
        case "any":
          if (wildcard != null) {
            throw SchemaDefectException.multipleWildcards(path);
          }
          wildcard = new Wildcard(XmlDocuments.attribute(child, "namespace"), targetNamespace);
          break;
        case "annotation":
          break;
        default:
          LOG.warn("Ignoring unsupported xs:{} in sequence of {}", child.getLocalName(), path);
      }
    }
    return new Sequence(children, wildcard, path);
  }

  private Choice buildChoice(Element node, String path) throws OwlbindException {
    List<Particle> branches = new ArrayList<>();
    for (Element child : XmlDocuments.childElements(node)) {
      if (!Namespaces.XS.equals(child.getNamespaceURI())) {
        continue;
      }
      switch (child.getLocalName()) {
        case "element":
          branches.add(buildLocalElement(child, path));
          break;
        case "sequence":
          branches.add(buildSequence(child, path));
          break;
        case "choice":
          branches.add(buildChoice(child, path));
          break;
        case "annotation":
          break;
        default:
          LOG.warn("Ignoring unsupported xs:{} in choice of {}", child.getLocalName(), path);
      }
    }
    return new Choice(branches);
  }

  private List<AttributeDecl> buildAttributes(Element owner, String path)
      throws OwlbindException {
    List<AttributeDecl> attributes = new ArrayList<>();
    for (Element node : XmlDocuments.childElements(owner, Namespaces.XS, "attribute")) {
      if (XmlDocuments.attribute(node, "ref") != null) {
        LOG.warn("Ignoring attribute reference {} in {}", node.getAttribute("ref"), path);
        continue;
      }
      String name = nameAttribute(node, path);
      String attributePath = join(path, "@" + name);
      String typeName = XmlDocuments.attribute(node, "type");
      Element simple = firstXsChild(node, "simpleType");
      TypeRef type;
      if (typeName != null) {
        type = TypeRef.named(resolveReference(node, typeName));
      } else if (simple != null) {
        type = TypeRef.inline(buildSimple(simple, null, attributePath, name));
      } else {
        type = TypeRef.named(Namespaces.xs("string"));
      }
      attributes.add(
          new AttributeDecl(
              name,
              type,
              "required".equals(XmlDocuments.attribute(node, "use")),
              annotationsOf(node)));
    }
    return attributes;
  }

  private SimpleType buildSimple(
      Element node, QualifiedName name, String path, String className) throws OwlbindException {
    Element restriction = firstXsChild(node, "restriction");
    if (restriction == null || XmlDocuments.attribute(restriction, "base") == null) {
      throw SchemaDefectException.unsupportedSimpleType(path);
    }
    List<Enumeration> enumerations = new ArrayList<>();
    for (Element e : XmlDocuments.childElements(restriction, Namespaces.XS, "enumeration")) {
      enumerations.add(new Enumeration(e.getAttribute("value"), className, annotationsOf(e)));
    }
    TypeRef base = TypeRef.named(resolveReference(restriction, restriction.getAttribute("base")));
    SimpleType type =
        new SimpleType(
            name, path, className, annotationsOf(node), new Restriction(base, enumerations));
    declaredTypes.add(type);
    return type;
  }

  /** Resolves a {@code prefix:local} reference against the namespaces in scope at the node. */
  private QualifiedName resolveReference(Element at, String reference)
      throws UnresolvedReferenceException {
    String ref = reference.trim();
    int colon = ref.indexOf(':');
    if (colon < 0) {
      return QualifiedName.of(targetNamespace, ref);
    }
    String prefix = ref.substring(0, colon);
    String namespace =
        XMLConstants.XML_NS_PREFIX.equals(prefix)
            ? XMLConstants.XML_NS_URI
            : at.lookupNamespaceURI(prefix);
    if (namespace == null) {
      throw UnresolvedReferenceException.unknownPrefix(ref);
    }
    return QualifiedName.of(namespace, ref.substring(colon + 1));
  }

  private static List<String> annotationsOf(Element node) {
    List<String> notes = new ArrayList<>();
    for (Element annotation : XmlDocuments.childElements(node, Namespaces.XS, "annotation")) {
      for (Element doc :
          XmlDocuments.childElements(annotation, Namespaces.XS, "documentation")) {
        String text = doc.getTextContent().trim();
        if (!text.isEmpty()) {
          notes.add(text);
        }
      }
    }
    return notes;
  }

  private static String nameAttribute(Element node, String path) throws SchemaDefectException {
    String name = XmlDocuments.attribute(node, "name");
    if (name == null || name.isBlank()) {
      throw new SchemaDefectException(
          "Declaration without a name: xs:" + node.getLocalName(), path.isEmpty() ? "/" : path);
    }
    return name.trim();
  }

  private static Element firstXsChild(Element node, String localName) {
    List<Element> children = XmlDocuments.childElements(node, Namespaces.XS, localName);
    return children.isEmpty() ? null : children.get(0);
  }

  private static boolean isXs(Element node, String localName) {
    return Namespaces.XS.equals(node.getNamespaceURI()) && localName.equals(node.getLocalName());
  }

  private static String join(String parentPath, String segment) {
    return parentPath.isEmpty() ? segment : parentPath + "/" + segment;
  }
}
