package io.owlbind.converter;

import io.owlbind.parser.api.ErrorCode;
import io.owlbind.parser.api.OwlbindException;

/** Thrown when a schema or data source cannot be retrieved. */
public class SourceException extends OwlbindException {

  public SourceException(String message, String location, Throwable cause) {
    super(ErrorCode.SOURCE_UNAVAILABLE, message, location, cause);
  }

  /**
   * Creates an exception for a location that cannot be opened or read.
   *
   * @param location the file path or URL
   * @param cause the underlying I/O failure
   * @return a new SourceException
   */
  public static SourceException unreadable(String location, Throwable cause) {
    return new SourceException("Cannot read source", location, cause);
  }

  /**
   * Creates an exception for an archive without any file entry.
   *
   * @param location the archive location
   * @return a new SourceException
   */
  public static SourceException emptyArchive(String location) {
    return new SourceException("Archive has no entries", location, null);
  }
}
