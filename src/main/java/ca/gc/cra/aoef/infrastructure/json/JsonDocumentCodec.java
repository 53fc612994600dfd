package ca.gc.cra.aoef.infrastructure.json;

import ca.gc.cra.aoef.application.exchange.CollectionKind;
import ca.gc.cra.aoef.application.exchange.record.AoefDocument;
import ca.gc.cra.aoef.application.port.DocumentCodec;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonFactoryBuilder;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * {@link DocumentCodec} backed by Jackson's streaming API.
 *
 * <p>Non-finite numbers are written and read as the bare tokens {@code NaN}, {@code Infinity} and
 * {@code -Infinity}, matching documents produced by Python's {@code json} module.</p>
 *
 * @since 0.1.0
 */
public final class JsonDocumentCodec implements DocumentCodec {
  private final AoefJsonWriter writer;
  private final AoefJsonReader reader;

  /** Creates a codec writing compact JSON. */
  public JsonDocumentCodec() {
    this(false);
  }

  /**
   * Creates a codec.
   *
   * @param pretty whether to indent written documents
   */
  public JsonDocumentCodec(boolean pretty) {
    JsonFactory factory = new JsonFactoryBuilder()
        .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
        .disable(JsonWriteFeature.WRITE_NAN_AS_STRINGS)
        .build();
    this.writer = new AoefJsonWriter(factory, pretty);
    this.reader = new AoefJsonReader(factory);
  }

  @Override
  public void write(AoefDocument document, OutputStream out) throws IOException {
    writer.write(document, out);
  }

  @Override
  public AoefDocument read(InputStream in, CollectionKind expected) throws IOException {
    return reader.read(in, expected);
  }
}
