package io.owlbind.converter;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens schema and data sources. {@code http://} and {@code https://} locations are downloaded,
 * anything else is a file path. A location ending in {@code .zip} yields its first file entry.
 */
public class SourceFetcher {
  private static final Logger LOG = LoggerFactory.getLogger(SourceFetcher.class);

  /**
   * Opens a source. The caller closes the returned stream.
   *
   * @param location file path or URL
   * @return the source bytes
   * @throws SourceException if the source cannot be opened
   */
  public InputStream open(String location) throws SourceException {
    InputStream in = openLocation(location);
    if (location.toLowerCase(Locale.ROOT).endsWith(".zip")) {
      return firstEntry(in, location);
    }
    return in;
  }

  private InputStream openLocation(String location) throws SourceException {
    try {
      if (isRemote(location)) {
        LOG.info("Downloading {}", location);
        return URI.create(location).toURL().openStream();
      }
      LOG.debug("Opening {}", location);
      return Files.newInputStream(Path.of(location));
    } catch (IOException | IllegalArgumentException e) {
      throw SourceException.unreadable(location, e);
    }
  }

  private static InputStream firstEntry(InputStream in, String location) throws SourceException {
    ZipInputStream zip = new ZipInputStream(in);
    try {
      ZipEntry entry = zip.getNextEntry();
      while (entry != null && entry.isDirectory()) {
        entry = zip.getNextEntry();
      }
      if (entry == null) {
        zip.close();
        throw SourceException.emptyArchive(location);
      }
      LOG.debug("Reading entry {} of {}", entry.getName(), location);
      return zip;
    } catch (IOException e) {
      closeQuietly(zip, e);
      throw SourceException.unreadable(location, e);
    }
  }

  private static void closeQuietly(InputStream in, IOException failure) {
    try {
      in.close();
    } catch (IOException e) {
      failure.addSuppressed(e);
    }
  }

  static boolean isRemote(String location) {
    String lower = location.toLowerCase(Locale.ROOT);
    return lower.startsWith("http://") || lower.startsWith("https://");
  }
}
