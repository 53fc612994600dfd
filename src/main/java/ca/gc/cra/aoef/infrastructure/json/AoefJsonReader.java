package ca.gc.cra.aoef.infrastructure.json;

import ca.gc.cra.aoef.application.exchange.AoefConverter;
import ca.gc.cra.aoef.application.exchange.CollectionKind;
import ca.gc.cra.aoef.application.exchange.record.AnnotationProjectRecord;
import ca.gc.cra.aoef.application.exchange.record.AnnotationSetRecord;
import ca.gc.cra.aoef.application.exchange.record.AnnotationTaskRecord;
import ca.gc.cra.aoef.application.exchange.record.AoefDocument;
import ca.gc.cra.aoef.application.exchange.record.ClipAnnotationRecord;
import ca.gc.cra.aoef.application.exchange.record.ClipEvaluationRecord;
import ca.gc.cra.aoef.application.exchange.record.ClipPredictionRecord;
import ca.gc.cra.aoef.application.exchange.record.ClipRecord;
import ca.gc.cra.aoef.application.exchange.record.CollectionRecord;
import ca.gc.cra.aoef.application.exchange.record.DatasetRecord;
import ca.gc.cra.aoef.application.exchange.record.EntityTables;
import ca.gc.cra.aoef.application.exchange.record.EvaluationRecord;
import ca.gc.cra.aoef.application.exchange.record.EvaluationSetRecord;
import ca.gc.cra.aoef.application.exchange.record.MatchRecord;
import ca.gc.cra.aoef.application.exchange.record.ModelRunRecord;
import ca.gc.cra.aoef.application.exchange.record.NoteRecord;
import ca.gc.cra.aoef.application.exchange.record.PredictedTagRecord;
import ca.gc.cra.aoef.application.exchange.record.PredictionSetRecord;
import ca.gc.cra.aoef.application.exchange.record.RecordingRecord;
import ca.gc.cra.aoef.application.exchange.record.RecordingSetRecord;
import ca.gc.cra.aoef.application.exchange.record.SequenceAnnotationRecord;
import ca.gc.cra.aoef.application.exchange.record.SequencePredictionRecord;
import ca.gc.cra.aoef.application.exchange.record.SequenceRecord;
import ca.gc.cra.aoef.application.exchange.record.SoundEventAnnotationRecord;
import ca.gc.cra.aoef.application.exchange.record.SoundEventPredictionRecord;
import ca.gc.cra.aoef.application.exchange.record.SoundEventRecord;
import ca.gc.cra.aoef.application.exchange.record.StatusBadgeRecord;
import ca.gc.cra.aoef.application.exchange.record.TagRecord;
import ca.gc.cra.aoef.application.exchange.record.UserRecord;
import ca.gc.cra.aoef.domain.AnnotationState;
import ca.gc.cra.aoef.domain.Geometry;
import ca.gc.cra.aoef.error.MalformedDocumentException;
import com.fasterxml.jackson.core.JsonFactory;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.BiFunction;

/**
 * <strong>What:</strong> Parses and validates AOEF JSON into an {@link AoefDocument}.
 * <p><strong>Why:</strong> All shape checks happen here, before any adapter runs, so adapters only ever see
 * well-typed records.</p>
 * <p><strong>Order of checks:</strong> JSON syntax, then {@code version} (exact match), then
 * {@code collection_type} and the caller's expected kind, then every record.</p>
 * <p><strong>Errors:</strong> Shape problems raise {@link MalformedDocumentException} naming the JSON path of
 * the offending value (for example {@code data.clips[3].recording}).</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; holds no per-call state.</p>
 *
 * @since 0.1.0
 */
public final class AoefJsonReader {
  private final JsonSupport json;

  public AoefJsonReader(JsonFactory jsonFactory) {
    this.json = new JsonSupport(jsonFactory);
  }

  /**
   * Reads one document.
   *
   * @param in JSON source; consumed and closed
   * @param expected expected kind, or {@code null} for any kind
   * @return validated document
   * @throws IOException if the stream cannot be read
   */
  public AoefDocument read(InputStream in, CollectionKind expected) throws IOException {
    Object root;
    try {
      root = json.parse(in);
    } catch (IllegalArgumentException ex) {
      throw new MalformedDocumentException("$", ex.getMessage(), ex);
    }
    Map<String, Object> envelope = object(root, "$");
    Object version = envelope.get("version");
    if (!(version instanceof String versionText)) {
      throw new MalformedDocumentException("version", "expected a version string");
    }
    AoefConverter.requireSupportedVersion(versionText);
    LocalDateTime createdOn = requireDateTime(envelope, "created_on", "");
    Map<String, Object> data = object(envelope.get("data"), "data");
    CollectionKind kind = CollectionKind.fromTag(requireString(data, "collection_type", "data"));
    AoefConverter.requireKind(kind, expected);
    return new AoefDocument(versionText, createdOn, readCollection(kind, data, createdOn));
  }

  private CollectionRecord readCollection(CollectionKind kind, Map<String, Object> data, LocalDateTime fallback) {
    String path = "data";
    UUID uuid = requireUuid(data, "uuid", path);
    LocalDateTime createdOn = optDateTime(data, "created_on", path);
    if (createdOn == null) {
      createdOn = fallback;
    }
    if ((kind == CollectionKind.RECORDING_SET || kind == CollectionKind.DATASET) && data.get("recordings") == null) {
      throw new MalformedDocumentException("data.recordings", "required field is missing");
    }
    EntityTables tables = readTables(data, path);
    return switch (kind) {
      case RECORDING_SET -> new RecordingSetRecord(uuid, createdOn, tables);
      case DATASET -> new DatasetRecord(
          uuid, createdOn, tables, requireString(data, "name", path), optString(data, "description", path));
      case ANNOTATION_SET -> new AnnotationSetRecord(uuid, createdOn, tables);
      case ANNOTATION_PROJECT -> new AnnotationProjectRecord(
          uuid,
          createdOn,
          tables,
          requireString(data, "name", path),
          optString(data, "description", path),
          optString(data, "instructions", path),
          list(data, "project_tags", path, AoefJsonReader::integer),
          list(data, "tasks", path, AoefJsonReader::task));
      case EVALUATION_SET -> new EvaluationSetRecord(
          uuid,
          createdOn,
          tables,
          requireString(data, "name", path),
          optString(data, "description", path),
          list(data, "evaluation_tags", path, AoefJsonReader::integer));
      case PREDICTION_SET -> new PredictionSetRecord(uuid, createdOn, tables);
      case MODEL_RUN -> new ModelRunRecord(
          uuid,
          createdOn,
          tables,
          requireString(data, "name", path),
          optString(data, "version", path),
          optString(data, "description", path));
      case EVALUATION -> new EvaluationRecord(
          uuid,
          createdOn,
          tables,
          requireString(data, "evaluation_task", path),
          values(data, "metrics", path),
          optDouble(data, "score", path));
    };
  }

  private static EntityTables readTables(Map<String, Object> data, String path) {
    return new EntityTables(
        list(data, "users", path, AoefJsonReader::user),
        list(data, "tags", path, AoefJsonReader::tag),
        list(data, "recordings", path, AoefJsonReader::recording),
        list(data, "clips", path, AoefJsonReader::clip),
        list(data, "sound_events", path, AoefJsonReader::soundEvent),
        list(data, "sequences", path, AoefJsonReader::sequence),
        list(data, "sound_event_annotations", path, AoefJsonReader::soundEventAnnotation),
        list(data, "sequence_annotations", path, AoefJsonReader::sequenceAnnotation),
        list(data, "clip_annotations", path, AoefJsonReader::clipAnnotation),
        list(data, "sound_event_predictions", path, AoefJsonReader::soundEventPrediction),
        list(data, "sequence_predictions", path, AoefJsonReader::sequencePrediction),
        list(data, "clip_predictions", path, AoefJsonReader::clipPrediction),
        list(data, "matches", path, AoefJsonReader::match),
        list(data, "clip_evaluations", path, AoefJsonReader::clipEvaluation));
  }

  private static UserRecord user(Object value, String path) {
    Map<String, Object> obj = object(value, path);
    return new UserRecord(
        requireInt(obj, "id", path),
        requireUuid(obj, "uuid", path),
        optString(obj, "username", path),
        optString(obj, "email", path),
        optString(obj, "name", path),
        optString(obj, "institution", path));
  }

  private static TagRecord tag(Object value, String path) {
    Map<String, Object> obj = object(value, path);
    return new TagRecord(
        requireInt(obj, "id", path), requireString(obj, "key", path), requireString(obj, "value", path));
  }

  private static NoteRecord note(Object value, String path) {
    Map<String, Object> obj = object(value, path);
    return new NoteRecord(
        requireUuid(obj, "uuid", path),
        requireString(obj, "message", path),
        optInt(obj, "created_by", path),
        optBoolean(obj, "is_issue", path),
        optDateTime(obj, "created_on", path));
  }

  private static RecordingRecord recording(Object value, String path) {
    Map<String, Object> obj = object(value, path);
    return new RecordingRecord(
        requireUuid(obj, "uuid", path),
        requireString(obj, "path", path),
        requireDouble(obj, "duration", path),
        requireInt(obj, "channels", path),
        requireInt(obj, "samplerate", path),
        optDouble(obj, "time_expansion", path),
        optString(obj, "hash", path),
        optDate(obj, "date", path),
        optTime(obj, "time", path),
        optDouble(obj, "latitude", path),
        optDouble(obj, "longitude", path),
        list(obj, "tags", path, AoefJsonReader::integer),
        values(obj, "features", path),
        list(obj, "notes", path, AoefJsonReader::note),
        list(obj, "owners", path, AoefJsonReader::integer),
        optString(obj, "rights", path));
  }

  private static ClipRecord clip(Object value, String path) {
    Map<String, Object> obj = object(value, path);
    return new ClipRecord(
        requireUuid(obj, "uuid", path),
        requireUuid(obj, "recording", path),
        requireDouble(obj, "start_time", path),
        requireDouble(obj, "end_time", path),
        values(obj, "features", path));
  }

  private static SoundEventRecord soundEvent(Object value, String path) {
    Map<String, Object> obj = object(value, path);
    return new SoundEventRecord(
        requireUuid(obj, "uuid", path),
        requireUuid(obj, "recording", path),
        geometry(obj.get("geometry"), at(path, "geometry")),
        values(obj, "features", path));
  }

  private static Geometry geometry(Object value, String path) {
    if (value == null) {
      return null;
    }
    Map<String, Object> obj = object(value, path);
    Object coordinates = obj.get("coordinates");
    if (coordinates == null) {
      throw new MalformedDocumentException(at(path, "coordinates"), "required field is missing");
    }
    return new Geometry(requireString(obj, "type", path), coordinates);
  }

  private static SequenceRecord sequence(Object value, String path) {
    Map<String, Object> obj = object(value, path);
    return new SequenceRecord(
        requireUuid(obj, "uuid", path),
        list(obj, "sound_events", path, AoefJsonReader::uuid),
        values(obj, "features", path),
        optUuid(obj, "parent", path));
  }

  private static SoundEventAnnotationRecord soundEventAnnotation(Object value, String path) {
    Map<String, Object> obj = object(value, path);
    return new SoundEventAnnotationRecord(
        requireUuid(obj, "uuid", path),
        requireUuid(obj, "sound_event", path),
        list(obj, "notes", path, AoefJsonReader::note),
        list(obj, "tags", path, AoefJsonReader::integer),
        optInt(obj, "created_by", path),
        optDateTime(obj, "created_on", path));
  }

  private static SequenceAnnotationRecord sequenceAnnotation(Object value, String path) {
    Map<String, Object> obj = object(value, path);
    return new SequenceAnnotationRecord(
        requireUuid(obj, "uuid", path),
        requireUuid(obj, "sequence", path),
        list(obj, "notes", path, AoefJsonReader::note),
        list(obj, "tags", path, AoefJsonReader::integer),
        optInt(obj, "created_by", path),
        optDateTime(obj, "created_on", path));
  }

  private static ClipAnnotationRecord clipAnnotation(Object value, String path) {
    Map<String, Object> obj = object(value, path);
    return new ClipAnnotationRecord(
        requireUuid(obj, "uuid", path),
        requireUuid(obj, "clip", path),
        list(obj, "tags", path, AoefJsonReader::integer),
        list(obj, "annotations", path, AoefJsonReader::uuid),
        list(obj, "sequences", path, AoefJsonReader::uuid),
        list(obj, "notes", path, AoefJsonReader::note),
        optDateTime(obj, "created_on", path));
  }

  private static AnnotationTaskRecord task(Object value, String path) {
    Map<String, Object> obj = object(value, path);
    return new AnnotationTaskRecord(
        requireUuid(obj, "uuid", path),
        requireUuid(obj, "clip", path),
        list(obj, "status_badges", path, AoefJsonReader::statusBadge),
        optDateTime(obj, "created_on", path));
  }

  private static StatusBadgeRecord statusBadge(Object value, String path) {
    Map<String, Object> obj = object(value, path);
    String state = requireString(obj, "state", path);
    AnnotationState parsed;
    try {
      parsed = AnnotationState.fromWireName(state);
    } catch (IllegalArgumentException ex) {
      throw new MalformedDocumentException(at(path, "state"), ex.getMessage(), ex);
    }
    return new StatusBadgeRecord(parsed, optInt(obj, "owner", path), optDateTime(obj, "created_on", path));
  }

  private static SoundEventPredictionRecord soundEventPrediction(Object value, String path) {
    Map<String, Object> obj = object(value, path);
    return new SoundEventPredictionRecord(
        requireUuid(obj, "uuid", path),
        requireUuid(obj, "sound_event", path),
        requireDouble(obj, "score", path),
        list(obj, "tags", path, AoefJsonReader::predictedTag));
  }

  private static SequencePredictionRecord sequencePrediction(Object value, String path) {
    Map<String, Object> obj = object(value, path);
    return new SequencePredictionRecord(
        requireUuid(obj, "uuid", path),
        requireUuid(obj, "sequence", path),
        requireDouble(obj, "score", path),
        list(obj, "tags", path, AoefJsonReader::predictedTag));
  }

  private static ClipPredictionRecord clipPrediction(Object value, String path) {
    Map<String, Object> obj = object(value, path);
    return new ClipPredictionRecord(
        requireUuid(obj, "uuid", path),
        requireUuid(obj, "clip", path),
        list(obj, "sound_events", path, AoefJsonReader::uuid),
        list(obj, "sequences", path, AoefJsonReader::uuid),
        list(obj, "tags", path, AoefJsonReader::predictedTag),
        values(obj, "features", path));
  }

  private static PredictedTagRecord predictedTag(Object value, String path) {
    if (!(value instanceof List<?> pair) || pair.size() != 2) {
      throw new MalformedDocumentException(path, "expected a [tag, score] pair");
    }
    return new PredictedTagRecord(integer(pair.get(0), path + "[0]"), number(pair.get(1), path + "[1]"));
  }

  private static MatchRecord match(Object value, String path) {
    Map<String, Object> obj = object(value, path);
    return new MatchRecord(
        requireUuid(obj, "uuid", path),
        optUuid(obj, "source", path),
        optUuid(obj, "target", path),
        requireDouble(obj, "affinity", path),
        optDouble(obj, "score", path),
        values(obj, "metrics", path));
  }

  private static ClipEvaluationRecord clipEvaluation(Object value, String path) {
    Map<String, Object> obj = object(value, path);
    return new ClipEvaluationRecord(
        requireUuid(obj, "uuid", path),
        requireUuid(obj, "annotations", path),
        requireUuid(obj, "predictions", path),
        list(obj, "matches", path, AoefJsonReader::uuid),
        values(obj, "metrics", path),
        optDouble(obj, "score", path));
  }

  // Field helpers. Each takes the containing object and its path, and reports the full field path.

  private static Map<String, Object> object(Object value, String path) {
    if (!(value instanceof Map<?, ?> raw)) {
      throw new MalformedDocumentException(path, "expected an object");
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<?, ?> entry : raw.entrySet()) {
      copy.put(String.valueOf(entry.getKey()), entry.getValue());
    }
    return copy;
  }

  private static <T> List<T> list(
      Map<String, Object> obj, String field, String path, BiFunction<Object, String, T> element) {
    Object value = obj.get(field);
    if (value == null) {
      return List.of();
    }
    String listPath = at(path, field);
    if (!(value instanceof List<?> items)) {
      throw new MalformedDocumentException(listPath, "expected an array");
    }
    List<T> result = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      result.add(element.apply(items.get(i), listPath + "[" + i + "]"));
    }
    return result;
  }

  private static Map<String, Double> values(Map<String, Object> obj, String field, String path) {
    Object value = obj.get(field);
    if (value == null) {
      return Map.of();
    }
    String mapPath = at(path, field);
    Map<String, Object> raw = object(value, mapPath);
    Map<String, Double> result = new LinkedHashMap<>();
    for (Map.Entry<String, Object> entry : raw.entrySet()) {
      result.put(entry.getKey(), number(entry.getValue(), at(mapPath, entry.getKey())));
    }
    return result;
  }

  private static String requireString(Map<String, Object> obj, String field, String path) {
    String value = optString(obj, field, path);
    if (value == null) {
      throw new MalformedDocumentException(at(path, field), "required field is missing");
    }
    return value;
  }

  private static String optString(Map<String, Object> obj, String field, String path) {
    Object value = obj.get(field);
    if (value == null) {
      return null;
    }
    if (!(value instanceof String text)) {
      throw new MalformedDocumentException(at(path, field), "expected a string");
    }
    return text;
  }

  private static UUID requireUuid(Map<String, Object> obj, String field, String path) {
    Object value = obj.get(field);
    if (value == null) {
      throw new MalformedDocumentException(at(path, field), "required field is missing");
    }
    return uuid(value, at(path, field));
  }

  private static UUID optUuid(Map<String, Object> obj, String field, String path) {
    Object value = obj.get(field);
    return value == null ? null : uuid(value, at(path, field));
  }

  private static UUID uuid(Object value, String path) {
    if (!(value instanceof String text)) {
      throw new MalformedDocumentException(path, "expected a uuid string");
    }
    try {
      return UUID.fromString(text);
    } catch (IllegalArgumentException ex) {
      throw new MalformedDocumentException(path, "invalid uuid '" + text + "'", ex);
    }
  }

  private static double requireDouble(Map<String, Object> obj, String field, String path) {
    Object value = obj.get(field);
    if (value == null) {
      throw new MalformedDocumentException(at(path, field), "required field is missing");
    }
    return number(value, at(path, field));
  }

  private static Double optDouble(Map<String, Object> obj, String field, String path) {
    Object value = obj.get(field);
    return value == null ? null : number(value, at(path, field));
  }

  private static double number(Object value, String path) {
    if (!(value instanceof Number number)) {
      throw new MalformedDocumentException(path, "expected a number");
    }
    return number.doubleValue();
  }

  private static int requireInt(Map<String, Object> obj, String field, String path) {
    Object value = obj.get(field);
    if (value == null) {
      throw new MalformedDocumentException(at(path, field), "required field is missing");
    }
    return integer(value, at(path, field));
  }

  private static Integer optInt(Map<String, Object> obj, String field, String path) {
    Object value = obj.get(field);
    return value == null ? null : integer(value, at(path, field));
  }

  private static int integer(Object value, String path) {
    if (value instanceof Integer number) {
      return number;
    }
    if (value instanceof Long || value instanceof BigInteger) {
      throw new MalformedDocumentException(path, "integer out of range");
    }
    throw new MalformedDocumentException(path, "expected an integer");
  }

  private static boolean optBoolean(Map<String, Object> obj, String field, String path) {
    Object value = obj.get(field);
    if (value == null) {
      return false;
    }
    if (!(value instanceof Boolean flag)) {
      throw new MalformedDocumentException(at(path, field), "expected a boolean");
    }
    return flag;
  }

  private static LocalDateTime requireDateTime(Map<String, Object> obj, String field, String path) {
    LocalDateTime value = optDateTime(obj, field, path);
    if (value == null) {
      throw new MalformedDocumentException(at(path, field), "required field is missing");
    }
    return value;
  }

  private static LocalDateTime optDateTime(Map<String, Object> obj, String field, String path) {
    String text = optString(obj, field, path);
    if (text == null) {
      return null;
    }
    try {
      TemporalAccessor parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(text, OffsetDateTime::from, LocalDateTime::from);
      if (parsed instanceof OffsetDateTime offset) {
        // Offsets are normalised to UTC; the domain keeps local date-times.
        return offset.withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
      }
      return (LocalDateTime) parsed;
    } catch (DateTimeParseException ex) {
      throw new MalformedDocumentException(at(path, field), "invalid ISO-8601 date-time '" + text + "'", ex);
    }
  }

  private static LocalDate optDate(Map<String, Object> obj, String field, String path) {
    String text = optString(obj, field, path);
    if (text == null) {
      return null;
    }
    try {
      return LocalDate.parse(text, DateTimeFormatter.ISO_LOCAL_DATE);
    } catch (DateTimeParseException ex) {
      throw new MalformedDocumentException(at(path, field), "invalid ISO-8601 date '" + text + "'", ex);
    }
  }

  private static LocalTime optTime(Map<String, Object> obj, String field, String path) {
    String text = optString(obj, field, path);
    if (text == null) {
      return null;
    }
    try {
      return LocalTime.parse(text, DateTimeFormatter.ISO_LOCAL_TIME);
    } catch (DateTimeParseException ex) {
      throw new MalformedDocumentException(at(path, field), "invalid ISO-8601 time '" + text + "'", ex);
    }
  }

  private static String at(String path, String field) {
    return path.isEmpty() ? field : path + "." + field;
  }
}
