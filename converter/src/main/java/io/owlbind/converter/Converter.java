package io.owlbind.converter;

import io.owlbind.model.IdentityResolver;
import io.owlbind.parser.api.CompiledSchema;
import io.owlbind.parser.api.EntityGraph;
import io.owlbind.parser.api.OwlbindException;
import io.owlbind.parser.api.OwlbindParser;
import io.owlbind.parser.api.ParsedDocument;
import java.io.IOException;
import java.io.InputStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import javax.xml.stream.XMLStreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Converts one dataset: fetch schema and data, parse, write {@code <KIND>.owx}. */
public class Converter {
  private static final Logger LOG = LoggerFactory.getLogger(Converter.class);

  private final ConverterConfig config;
  private final SourceFetcher fetcher;

  public Converter(ConverterConfig config) {
    this(config, new SourceFetcher());
  }

  Converter(ConverterConfig config, SourceFetcher fetcher) {
    this.config = config;
    this.fetcher = fetcher;
  }

  /**
   * Converts a dataset.
   *
   * @param dataset the dataset profile
   * @param schemaLocation schema path or URL, or null for the dataset default
   * @param dataLocation data path or URL, or null for the dataset default
   * @param outputDirectory directory receiving the ontology
   * @return the written file
   * @throws OwlbindException if a source cannot be fetched or does not conform
   * @throws IOException if a source is not well-formed XML or the output cannot be written
   */
  public Path convert(
      Dataset dataset, String schemaLocation, String dataLocation, Path outputDirectory)
      throws OwlbindException, IOException {
    String schemaSource = schemaLocation != null ? schemaLocation : dataset.schemaUrl();
    String dataSource = dataLocation != null ? dataLocation : dataset.dataUrl();

    CompiledSchema schema;
    try (InputStream in = fetcher.open(schemaSource)) {
      schema = OwlbindParser.compile(in, dataset.schemaOptions());
    }
    LOG.info("Compiled {} schema from {}", dataset, schemaSource);

    ParsedDocument document;
    try (InputStream in = fetcher.open(dataSource)) {
      document = OwlbindParser.parse(schema, in, dataSource);
    }
    EntityGraph graph = OwlbindParser.graph(schema, List.of(document));
    LOG.info("Parsed {} data from {}", dataset, dataSource);

    Files.createDirectories(outputDirectory);
    Path target = outputDirectory.resolve(dataset.name() + ".owx");
    try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
      IdentityResolver identities = new IdentityResolver(config.naming());
      new OwlXmlWriter(out, identities, config.baseIri() + dataset.kind())
          .write(graph, dataset.rules(config.baseIri()));
    } catch (XMLStreamException e) {
      throw new IOException("Cannot write ontology " + target, e);
    }
    LOG.info("Wrote {}", target);
    return target;
  }
}
