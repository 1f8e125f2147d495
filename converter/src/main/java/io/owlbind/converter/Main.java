package io.owlbind.converter;

import io.owlbind.parser.api.ErrorCode;
import io.owlbind.parser.api.OwlbindException;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

@CommandLine.Command(
    name = "owlbind",
    description = "Converts MITRE CAPEC, CVE and CWE catalogs to OWL ontologies",
    version = "0.1.0",
    mixinStandardHelpOptions = true)
public class Main implements Callable<Integer> {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  @CommandLine.Spec private CommandLine.Model.CommandSpec spec;

  @CommandLine.Option(names = "--capec", description = "Process CAPEC")
  private boolean capec;

  @CommandLine.Option(names = "--capec-schema", description = "CAPEC schema path or URL")
  private String capecSchema;

  @CommandLine.Option(names = "--capec-data", description = "CAPEC data path or URL")
  private String capecData;

  @CommandLine.Option(names = "--cve", description = "Process CVE")
  private boolean cve;

  @CommandLine.Option(names = "--cve-schema", description = "CVE schema path or URL")
  private String cveSchema;

  @CommandLine.Option(names = "--cve-data", description = "CVE data path or URL")
  private String cveData;

  @CommandLine.Option(names = "--cwe", description = "Process CWE")
  private boolean cwe;

  @CommandLine.Option(names = "--cwe-schema", description = "CWE schema path or URL")
  private String cweSchema;

  @CommandLine.Option(names = "--cwe-data", description = "CWE data path or URL")
  private String cweData;

  @CommandLine.Option(names = "--all", description = "Shorthand for --capec, --cve and --cwe")
  private boolean all;

  @CommandLine.Option(
      names = {"-o", "--output-dir"},
      description = "Directory receiving the ontologies (default: output.directory setting)")
  private Path outputDir;

  @CommandLine.Option(
      names = {"-c", "--config"},
      description = "Properties file overriding the bundled owlbind.properties")
  private Path configFile;

  private final Function<ConverterConfig, Converter> converters;

  public Main() {
    this(Converter::new);
  }

  Main(Function<ConverterConfig, Converter> converters) {
    this.converters = converters;
  }

  public static void main(String[] args) {
    int exitCode = new CommandLine(new Main()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public Integer call() throws Exception {
    List<Dataset> datasets = selectedDatasets();
    if (datasets.isEmpty()) {
      throw new CommandLine.ParameterException(
          spec.commandLine(), "At least one of CAPEC, CVE or CWE must be processed");
    }

    ConverterConfig config;
    try {
      config = configFile != null ? ConverterConfig.load(configFile) : ConverterConfig.load();
    } catch (IOException e) {
      System.err.println("Error: cannot read configuration: " + e.getMessage());
      return 1;
    }
    Path target = outputDir != null ? outputDir : config.outputDirectory();
    Converter converter = converters.apply(config);

    for (Dataset dataset : datasets) {
      try {
        Path written = converter.convert(dataset, schemaOf(dataset), dataOf(dataset), target);
        System.out.println(written);
      } catch (OwlbindException e) {
        LOG.debug("Conversion of {} failed", dataset, e);
        System.err.println("Error: " + dataset + ": " + e.getMessage());
        System.err.println(hint(dataset, e.getErrorCode()));
        return 1;
      } catch (IOException e) {
        LOG.debug("Conversion of {} failed", dataset, e);
        System.err.println("Error: " + dataset + ": " + e.getMessage());
        return 1;
      }
    }
    return 0;
  }

  static String hint(Dataset dataset, ErrorCode code) {
    switch (code.fault()) {
      case SOURCE:
        return String.format(
            "Check --%s-schema and --%s-data or the configured URLs",
            dataset.kind(), dataset.kind());
      case SCHEMA:
        return "The " + dataset + " schema is incomplete or unsupported; check its schema options";
      default:
        return "The " + dataset + " data does not conform to its schema";
    }
  }

  List<Dataset> selectedDatasets() {
    List<Dataset> datasets = new ArrayList<>();
    for (Dataset dataset : Dataset.values()) {
      if (all || isSelected(dataset)) {
        datasets.add(dataset);
      }
    }
    return datasets;
  }

  private boolean isSelected(Dataset dataset) {
    switch (dataset) {
      case CAPEC:
        return capec || capecSchema != null || capecData != null;
      case CVE:
        return cve || cveSchema != null || cveData != null;
      case CWE:
        return cwe || cweSchema != null || cweData != null;
      default:
        return false;
    }
  }

  private String schemaOf(Dataset dataset) {
    switch (dataset) {
      case CAPEC:
        return capecSchema;
      case CVE:
        return cveSchema;
      default:
        return cweSchema;
    }
  }

  private String dataOf(Dataset dataset) {
    switch (dataset) {
      case CAPEC:
        return capecData;
      case CVE:
        return cveData;
      default:
        return cweData;
    }
  }
}
