package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.application.exchange.record.RecordingRecord;
import ca.gc.cra.aoef.domain.Recording;
import java.nio.file.Path;
import java.util.Objects;
import java.util.UUID;

/**
 * <strong>What:</strong> Converts recordings, routing tags, owners, and note authors through the leaf adapters.
 * <p><strong>Paths:</strong> With an audio directory configured, exported paths are stored relative to it and
 * imported paths are resolved against it. Without one, paths are stored as given.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class RecordingAdapter extends UuidExchangeAdapter<Recording, RecordingRecord> {
  private final TagAdapter tags;
  private final UserAdapter users;
  private final NoteAdapter notes;
  private final Path audioDir;

  /**
   * Creates the adapter.
   *
   * @param tags tag adapter
   * @param users user adapter
   * @param notes note adapter
   * @param audioDir base directory of audio files; may be {@code null}
   */
  public RecordingAdapter(TagAdapter tags, UserAdapter users, NoteAdapter notes, Path audioDir) {
    super("recording");
    this.tags = Objects.requireNonNull(tags, "tags");
    this.users = Objects.requireNonNull(users, "users");
    this.notes = Objects.requireNonNull(notes, "notes");
    this.audioDir = audioDir == null ? null : audioDir.normalize();
  }

  @Override
  protected UUID recordId(RecordingRecord record) {
    return record.uuid();
  }

  @Override
  protected RecordingRecord assembleExchange(Recording obj, UUID id) {
    return new RecordingRecord(
        id,
        exportPath(obj.path()),
        obj.duration(),
        obj.channels(),
        obj.samplerate(),
        obj.timeExpansion() == 1.0 ? null : obj.timeExpansion(),
        obj.hash(),
        obj.date(),
        obj.time(),
        obj.latitude(),
        obj.longitude(),
        tags.toIds(obj.tags()),
        Features.toMap(obj.features()),
        notes.toExchange(obj.notes()),
        users.toIds(obj.owners()),
        obj.rights());
  }

  @Override
  protected Recording assembleDomain(RecordingRecord record) {
    String owner = describe(record.uuid());
    return new Recording(
        record.uuid(),
        importPath(record.path()),
        record.duration(),
        record.channels(),
        record.samplerate(),
        record.timeExpansion() == null ? 1.0 : record.timeExpansion(),
        record.hash(),
        record.date(),
        record.time(),
        record.latitude(),
        record.longitude(),
        tags.fromIds(record.tags(), owner),
        Features.fromMap(record.features()),
        notes.toDomain(record.notes(), owner),
        users.fromIds(record.owners(), owner),
        record.rights());
  }

  private String exportPath(Path path) {
    if (audioDir == null) {
      return path.toString();
    }
    Path normalized = path.normalize();
    if (!normalized.startsWith(audioDir)) {
      throw new IllegalArgumentException("Recording path " + path + " is not inside audio directory " + audioDir);
    }
    return audioDir.relativize(normalized).toString();
  }

  private Path importPath(String path) {
    return audioDir == null ? Path.of(path) : audioDir.resolve(path);
  }
}
