package io.owlbind.parser.api;

import io.owlbind.parser.impl.InstanceParser;
import io.owlbind.parser.impl.SchemaCompiler;
import io.owlbind.utils.XmlDocuments;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.w3c.dom.Document;

/**
 * Main entry point for compiling schemas and parsing documents into entity graphs.
 *
 * <p>Example usage:
 *
 * <pre>{@code
 * CompiledSchema schema = OwlbindParser.compile(Path.of("catalog.xsd"));
 * ParsedDocument doc = OwlbindParser.parse(schema, Path.of("catalog.xml"));
 * EntityGraph graph = OwlbindParser.graph(schema, List.of(doc));
 * graph.entries().forEach(System.out::println);
 * }</pre>
 *
 * <p>A compiled schema is unmodifiable and may parse any number of documents. Vocabulary
 * individuals are shared by every document parsed with the same schema.
 */
public final class OwlbindParser {

  private OwlbindParser() {}

  /**
   * Compiles a schema file with default options.
   *
   * @param xsd path to the schema
   * @return the compiled schema
   * @throws IOException if the file cannot be read or is not well-formed XML
   * @throws OwlbindException if the schema is defective
   */
  public static CompiledSchema compile(Path xsd) throws IOException, OwlbindException {
    return compile(xsd, SchemaOptions.defaults());
  }

  /**
   * Compiles a schema file.
   *
   * @param xsd path to the schema
   * @param options per-type overrides and aliases
   * @return the compiled schema
   * @throws IOException if the file cannot be read or is not well-formed XML
   * @throws OwlbindException if the schema is defective
   */
  public static CompiledSchema compile(Path xsd, SchemaOptions options)
      throws IOException, OwlbindException {
    Objects.requireNonNull(xsd, "xsd must not be null");
    try (InputStream in = Files.newInputStream(xsd)) {
      return compile(in, options);
    }
  }

  /**
   * Compiles a schema read from a stream. The stream is not closed.
   *
   * @param xsd schema bytes
   * @param options per-type overrides and aliases
   * @return the compiled schema
   * @throws IOException if the stream cannot be read or is not well-formed XML
   * @throws OwlbindException if the schema is defective
   */
  public static CompiledSchema compile(InputStream xsd, SchemaOptions options)
      throws IOException, OwlbindException {
    Objects.requireNonNull(xsd, "xsd must not be null");
    Objects.requireNonNull(options, "options must not be null");
    return SchemaCompiler.compile(XmlDocuments.parse(xsd), options);
  }

  /**
   * Parses a document file.
   *
   * @param schema the compiled schema
   * @param xml path to the document
   * @return the parsed document
   * @throws IOException if the file cannot be read or is not well-formed XML
   * @throws OwlbindException if the document does not conform to the schema
   */
  public static ParsedDocument parse(CompiledSchema schema, Path xml)
      throws IOException, OwlbindException {
    Objects.requireNonNull(xml, "xml must not be null");
    try (InputStream in = Files.newInputStream(xml)) {
      return parse(schema, in, xml.toString());
    }
  }

  /**
   * Parses a document read from a stream. The stream is not closed.
   *
   * @param schema the compiled schema
   * @param xml document bytes
   * @param source where the document came from, for logging
   * @return the parsed document
   * @throws IOException if the stream cannot be read or is not well-formed XML
   * @throws OwlbindException if the document does not conform to the schema
   */
  public static ParsedDocument parse(CompiledSchema schema, InputStream xml, String source)
      throws IOException, OwlbindException {
    Objects.requireNonNull(schema, "schema must not be null");
    Objects.requireNonNull(xml, "xml must not be null");
    return parse(schema, XmlDocuments.parse(xml), source);
  }

  /**
   * Parses an already loaded document.
   *
   * @param schema the compiled schema
   * @param document the document
   * @param source where the document came from, for logging
   * @return the parsed document
   * @throws OwlbindException if the document does not conform to the schema
   */
  public static ParsedDocument parse(CompiledSchema schema, Document document, String source)
      throws OwlbindException {
    return new InstanceParser(schema).parse(document, source);
  }

  /**
   * Combines the schema prelude with parsed documents.
   *
   * @param schema the schema the documents were parsed with
   * @param documents parsed documents
   * @return the entity graph
   */
  public static EntityGraph graph(CompiledSchema schema, List<ParsedDocument> documents) {
    return new EntityGraph(schema.getPrelude(), new ArrayList<>(documents));
  }
}
