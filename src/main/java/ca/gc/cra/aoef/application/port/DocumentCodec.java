package ca.gc.cra.aoef.application.port;

import ca.gc.cra.aoef.application.exchange.CollectionKind;
import ca.gc.cra.aoef.application.exchange.record.AoefDocument;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * <strong>What:</strong> Port serializing {@link AoefDocument} envelopes.
 * <p><strong>Role:</strong> Implemented by the Jackson-based JSON codec; the only place that knows field names.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe to share; each call works on its own streams.</p>
 *
 * @since 0.1.0
 */
public interface DocumentCodec {
  /**
   * Writes {@code document} to {@code out}. The stream is flushed but not closed.
   *
   * @param document document to write
   * @param out destination stream
   * @throws IOException if writing fails
   */
  void write(AoefDocument document, OutputStream out) throws IOException;

  /**
   * Reads and validates one document.
   *
   * @param in source stream, read to the end
   * @param expected kind the caller expects; {@code null} accepts any kind
   * @return parsed document
   * @throws IOException if reading fails
   * @throws ca.gc.cra.aoef.error.MalformedDocumentException if the JSON is not an AOEF document
   * @throws ca.gc.cra.aoef.error.VersionMismatchException if the version is not supported
   * @throws ca.gc.cra.aoef.error.UnsupportedTypeException if the collection type is unknown or unexpected
   */
  AoefDocument read(InputStream in, CollectionKind expected) throws IOException;
}
