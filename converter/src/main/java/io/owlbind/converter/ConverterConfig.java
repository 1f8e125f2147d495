package io.owlbind.converter;

import io.owlbind.model.NamingConfig;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Converter configuration. Loads from {@code owlbind.properties} on the classpath by default, or
 * from a file given on the command line.
 *
 * <p>Keys: {@code naming.idAttributes} and {@code naming.nameAttributes} (comma separated, by
 * priority), {@code naming.typeAlias.<Type>}, {@code ontology.baseIri}, {@code
 * output.directory}.
 *
 * @param naming identity rules for individuals
 * @param baseIri prefix of every ontology IRI; the dataset kind is appended
 * @param outputDirectory where ontologies are written
 */
public record ConverterConfig(NamingConfig naming, String baseIri, Path outputDirectory) {

  static final String RESOURCE = "/owlbind.properties";

  /**
   * Creates the built-in configuration used for the MITRE datasets.
   *
   * @return default configuration
   */
  public static ConverterConfig defaults() {
    return fromProperties(new Properties());
  }

  /**
   * Loads {@code owlbind.properties} from the classpath.
   *
   * @return loaded configuration, or defaults if the resource is missing
   * @throws IOException if the resource exists but cannot be read
   */
  public static ConverterConfig load() throws IOException {
    try (InputStream in = ConverterConfig.class.getResourceAsStream(RESOURCE)) {
      if (in == null) {
        return defaults();
      }
      Properties props = new Properties();
      props.load(in);
      return fromProperties(props);
    }
  }

  /**
   * Loads configuration from a properties file.
   *
   * @param path the file
   * @return loaded configuration; absent keys take their default
   * @throws IOException if the file cannot be read
   */
  public static ConverterConfig load(Path path) throws IOException {
    Properties props = new Properties();
    try (var reader = Files.newBufferedReader(path)) {
      props.load(reader);
    }
    return fromProperties(props);
  }

  static ConverterConfig fromProperties(Properties props) {
    List<String> ids = list(props.getProperty("naming.idAttributes", "ID,seq"));
    List<String> names =
        list(props.getProperty("naming.nameAttributes", "Name,name,Title,Term,Entry_Name"));

    Map<String, String> aliases = new LinkedHashMap<>();
    String prefix = "naming.typeAlias.";
    boolean customAliases = false;
    for (String key : props.stringPropertyNames()) {
      if (key.startsWith(prefix)) {
        aliases.put(key.substring(prefix.length()), props.getProperty(key).trim());
        customAliases = true;
      }
    }
    if (!customAliases) {
      aliases.put("Attack_Pattern", "CAPEC");
      aliases.put("Vulnerability", "CVE");
      aliases.put("Weakness", "CWE");
    }

    String baseIri = props.getProperty("ontology.baseIri", "https://owl.caprica-project.org/");
    Path output = Path.of(props.getProperty("output.directory", "."));
    return new ConverterConfig(new NamingConfig(ids, names, aliases), baseIri, output);
  }

  private static List<String> list(String value) {
    return Arrays.stream(value.split(","))
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .collect(Collectors.toList());
  }
}
