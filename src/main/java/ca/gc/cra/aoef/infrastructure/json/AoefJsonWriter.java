package ca.gc.cra.aoef.infrastructure.json;

import ca.gc.cra.aoef.application.exchange.record.AnnotationProjectRecord;
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
import ca.gc.cra.aoef.application.exchange.record.RecordingRecord;
import ca.gc.cra.aoef.application.exchange.record.SequenceAnnotationRecord;
import ca.gc.cra.aoef.application.exchange.record.SequencePredictionRecord;
import ca.gc.cra.aoef.application.exchange.record.SequenceRecord;
import ca.gc.cra.aoef.application.exchange.record.SoundEventAnnotationRecord;
import ca.gc.cra.aoef.application.exchange.record.SoundEventPredictionRecord;
import ca.gc.cra.aoef.application.exchange.record.SoundEventRecord;
import ca.gc.cra.aoef.application.exchange.record.StatusBadgeRecord;
import ca.gc.cra.aoef.application.exchange.record.TagRecord;
import ca.gc.cra.aoef.application.exchange.record.UserRecord;
import ca.gc.cra.aoef.domain.Geometry;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * <strong>What:</strong> Streams an {@link AoefDocument} as JSON with Jackson's {@link JsonGenerator}.
 * <p><strong>Format:</strong> Field names are snake_case; {@code null} fields and empty optional lists are
 * omitted; {@code recordings} is always present for recording sets and datasets.</p>
 * <p><strong>Thread-safety:</strong> Thread-safe; the shared {@link JsonFactory} is immutable once configured.</p>
 *
 * @since 0.1.0
 */
public final class AoefJsonWriter {
  private final JsonFactory jsonFactory;
  private final boolean pretty;

  public AoefJsonWriter(JsonFactory jsonFactory, boolean pretty) {
    this.jsonFactory = jsonFactory;
    this.pretty = pretty;
  }

  /**
   * Writes {@code document} to {@code out}; the stream is flushed, not closed.
   *
   * @param document document to write
   * @param out destination
   * @throws IOException if the stream rejects the write
   */
  public void write(AoefDocument document, OutputStream out) throws IOException {
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      if (pretty) {
        gen.useDefaultPrettyPrinter();
      }
      gen.writeStartObject();
      gen.writeStringField("version", document.version());
      gen.writeStringField("created_on", dateTime(document.createdOn()));
      gen.writeFieldName("data");
      writeCollection(gen, document.data());
      gen.writeEndObject();
    }
    out.flush();
  }

  private void writeCollection(JsonGenerator gen, CollectionRecord data) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("collection_type", data.kind().tag());
    gen.writeStringField("uuid", data.uuid().toString());
    writeDateTime(gen, "created_on", data.createdOn());
    switch (data.kind()) {
      case DATASET -> {
        DatasetRecord dataset = (DatasetRecord) data;
        gen.writeStringField("name", dataset.name());
        writeOptional(gen, "description", dataset.description());
      }
      case ANNOTATION_PROJECT -> {
        AnnotationProjectRecord project = (AnnotationProjectRecord) data;
        gen.writeStringField("name", project.name());
        writeOptional(gen, "description", project.description());
        writeOptional(gen, "instructions", project.instructions());
        writeIntList(gen, "project_tags", project.projectTags());
        if (!project.tasks().isEmpty()) {
          gen.writeArrayFieldStart("tasks");
          for (AnnotationTaskRecord task : project.tasks()) {
            writeTask(gen, task);
          }
          gen.writeEndArray();
        }
      }
      case EVALUATION_SET -> {
        EvaluationSetRecord set = (EvaluationSetRecord) data;
        gen.writeStringField("name", set.name());
        writeOptional(gen, "description", set.description());
        writeIntList(gen, "evaluation_tags", set.evaluationTags());
      }
      case MODEL_RUN -> {
        ModelRunRecord run = (ModelRunRecord) data;
        gen.writeStringField("name", run.name());
        writeOptional(gen, "version", run.version());
        writeOptional(gen, "description", run.description());
      }
      case EVALUATION -> {
        EvaluationRecord evaluation = (EvaluationRecord) data;
        gen.writeStringField("evaluation_task", evaluation.evaluationTask());
        writeValues(gen, "metrics", evaluation.metrics());
        writeOptional(gen, "score", evaluation.score());
      }
      case RECORDING_SET, ANNOTATION_SET, PREDICTION_SET -> {
        // no kind-specific fields
      }
    }
    boolean recordingsRequired = switch (data.kind()) {
      case RECORDING_SET, DATASET -> true;
      default -> false;
    };
    writeTables(gen, data.tables(), recordingsRequired);
    gen.writeEndObject();
  }

  private void writeTables(JsonGenerator gen, EntityTables tables, boolean recordingsRequired) throws IOException {
    if (!tables.users().isEmpty()) {
      gen.writeArrayFieldStart("users");
      for (UserRecord user : tables.users()) {
        gen.writeStartObject();
        gen.writeNumberField("id", user.id());
        gen.writeStringField("uuid", user.uuid().toString());
        writeOptional(gen, "username", user.username());
        writeOptional(gen, "email", user.email());
        writeOptional(gen, "name", user.name());
        writeOptional(gen, "institution", user.institution());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    if (!tables.tags().isEmpty()) {
      gen.writeArrayFieldStart("tags");
      for (TagRecord tag : tables.tags()) {
        gen.writeStartObject();
        gen.writeNumberField("id", tag.id());
        gen.writeStringField("key", tag.key());
        gen.writeStringField("value", tag.value());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    if (recordingsRequired || !tables.recordings().isEmpty()) {
      gen.writeArrayFieldStart("recordings");
      for (RecordingRecord recording : tables.recordings()) {
        writeRecording(gen, recording);
      }
      gen.writeEndArray();
    }
    if (!tables.clips().isEmpty()) {
      gen.writeArrayFieldStart("clips");
      for (ClipRecord clip : tables.clips()) {
        gen.writeStartObject();
        gen.writeStringField("uuid", clip.uuid().toString());
        gen.writeStringField("recording", clip.recording().toString());
        gen.writeNumberField("start_time", clip.startTime());
        gen.writeNumberField("end_time", clip.endTime());
        writeValues(gen, "features", clip.features());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    if (!tables.soundEvents().isEmpty()) {
      gen.writeArrayFieldStart("sound_events");
      for (SoundEventRecord soundEvent : tables.soundEvents()) {
        gen.writeStartObject();
        gen.writeStringField("uuid", soundEvent.uuid().toString());
        gen.writeStringField("recording", soundEvent.recording().toString());
        if (soundEvent.geometry() != null) {
          writeGeometry(gen, soundEvent.geometry());
        }
        writeValues(gen, "features", soundEvent.features());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    if (!tables.sequences().isEmpty()) {
      gen.writeArrayFieldStart("sequences");
      for (SequenceRecord sequence : tables.sequences()) {
        gen.writeStartObject();
        gen.writeStringField("uuid", sequence.uuid().toString());
        gen.writeArrayFieldStart("sound_events");
        for (UUID soundEvent : sequence.soundEvents()) {
          gen.writeString(soundEvent.toString());
        }
        gen.writeEndArray();
        writeValues(gen, "features", sequence.features());
        writeOptional(gen, "parent", sequence.parent());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    if (!tables.soundEventAnnotations().isEmpty()) {
      gen.writeArrayFieldStart("sound_event_annotations");
      for (SoundEventAnnotationRecord annotation : tables.soundEventAnnotations()) {
        gen.writeStartObject();
        gen.writeStringField("uuid", annotation.uuid().toString());
        gen.writeStringField("sound_event", annotation.soundEvent().toString());
        writeNotes(gen, annotation.notes());
        writeIntList(gen, "tags", annotation.tags());
        writeOptional(gen, "created_by", annotation.createdBy());
        writeDateTime(gen, "created_on", annotation.createdOn());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    if (!tables.sequenceAnnotations().isEmpty()) {
      gen.writeArrayFieldStart("sequence_annotations");
      for (SequenceAnnotationRecord annotation : tables.sequenceAnnotations()) {
        gen.writeStartObject();
        gen.writeStringField("uuid", annotation.uuid().toString());
        gen.writeStringField("sequence", annotation.sequence().toString());
        writeNotes(gen, annotation.notes());
        writeIntList(gen, "tags", annotation.tags());
        writeOptional(gen, "created_by", annotation.createdBy());
        writeDateTime(gen, "created_on", annotation.createdOn());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    if (!tables.clipAnnotations().isEmpty()) {
      gen.writeArrayFieldStart("clip_annotations");
      for (ClipAnnotationRecord annotation : tables.clipAnnotations()) {
        gen.writeStartObject();
        gen.writeStringField("uuid", annotation.uuid().toString());
        gen.writeStringField("clip", annotation.clip().toString());
        writeIntList(gen, "tags", annotation.tags());
        writeUuidList(gen, "annotations", annotation.annotations());
        writeUuidList(gen, "sequences", annotation.sequences());
        writeNotes(gen, annotation.notes());
        writeDateTime(gen, "created_on", annotation.createdOn());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    if (!tables.soundEventPredictions().isEmpty()) {
      gen.writeArrayFieldStart("sound_event_predictions");
      for (SoundEventPredictionRecord prediction : tables.soundEventPredictions()) {
        gen.writeStartObject();
        gen.writeStringField("uuid", prediction.uuid().toString());
        gen.writeStringField("sound_event", prediction.soundEvent().toString());
        gen.writeNumberField("score", prediction.score());
        writePredictedTags(gen, prediction.tags());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    if (!tables.sequencePredictions().isEmpty()) {
      gen.writeArrayFieldStart("sequence_predictions");
      for (SequencePredictionRecord prediction : tables.sequencePredictions()) {
        gen.writeStartObject();
        gen.writeStringField("uuid", prediction.uuid().toString());
        gen.writeStringField("sequence", prediction.sequence().toString());
        gen.writeNumberField("score", prediction.score());
        writePredictedTags(gen, prediction.tags());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    if (!tables.clipPredictions().isEmpty()) {
      gen.writeArrayFieldStart("clip_predictions");
      for (ClipPredictionRecord prediction : tables.clipPredictions()) {
        gen.writeStartObject();
        gen.writeStringField("uuid", prediction.uuid().toString());
        gen.writeStringField("clip", prediction.clip().toString());
        writeUuidList(gen, "sound_events", prediction.soundEvents());
        writeUuidList(gen, "sequences", prediction.sequences());
        writePredictedTags(gen, prediction.tags());
        writeValues(gen, "features", prediction.features());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    if (!tables.matches().isEmpty()) {
      gen.writeArrayFieldStart("matches");
      for (MatchRecord match : tables.matches()) {
        gen.writeStartObject();
        gen.writeStringField("uuid", match.uuid().toString());
        writeOptional(gen, "source", match.source());
        writeOptional(gen, "target", match.target());
        gen.writeNumberField("affinity", match.affinity());
        writeOptional(gen, "score", match.score());
        writeValues(gen, "metrics", match.metrics());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    if (!tables.clipEvaluations().isEmpty()) {
      gen.writeArrayFieldStart("clip_evaluations");
      for (ClipEvaluationRecord evaluation : tables.clipEvaluations()) {
        gen.writeStartObject();
        gen.writeStringField("uuid", evaluation.uuid().toString());
        gen.writeStringField("annotations", evaluation.annotations().toString());
        gen.writeStringField("predictions", evaluation.predictions().toString());
        writeUuidList(gen, "matches", evaluation.matches());
        writeValues(gen, "metrics", evaluation.metrics());
        writeOptional(gen, "score", evaluation.score());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
  }

  private void writeRecording(JsonGenerator gen, RecordingRecord recording) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("uuid", recording.uuid().toString());
    gen.writeStringField("path", recording.path());
    gen.writeNumberField("duration", recording.duration());
    gen.writeNumberField("channels", recording.channels());
    gen.writeNumberField("samplerate", recording.samplerate());
    writeOptional(gen, "time_expansion", recording.timeExpansion());
    writeOptional(gen, "hash", recording.hash());
    if (recording.date() != null) {
      gen.writeStringField("date", DateTimeFormatter.ISO_LOCAL_DATE.format(recording.date()));
    }
    if (recording.time() != null) {
      gen.writeStringField("time", DateTimeFormatter.ISO_LOCAL_TIME.format(recording.time()));
    }
    writeOptional(gen, "latitude", recording.latitude());
    writeOptional(gen, "longitude", recording.longitude());
    writeIntList(gen, "tags", recording.tags());
    writeValues(gen, "features", recording.features());
    writeNotes(gen, recording.notes());
    writeIntList(gen, "owners", recording.owners());
    writeOptional(gen, "rights", recording.rights());
    gen.writeEndObject();
  }

  private void writeTask(JsonGenerator gen, AnnotationTaskRecord task) throws IOException {
    gen.writeStartObject();
    gen.writeStringField("uuid", task.uuid().toString());
    gen.writeStringField("clip", task.clip().toString());
    if (!task.statusBadges().isEmpty()) {
      gen.writeArrayFieldStart("status_badges");
      for (StatusBadgeRecord badge : task.statusBadges()) {
        gen.writeStartObject();
        gen.writeStringField("state", badge.state().wireName());
        writeOptional(gen, "owner", badge.owner());
        writeDateTime(gen, "created_on", badge.createdOn());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    writeDateTime(gen, "created_on", task.createdOn());
    gen.writeEndObject();
  }

  private void writeNotes(JsonGenerator gen, List<NoteRecord> notes) throws IOException {
    if (notes.isEmpty()) {
      return;
    }
    gen.writeArrayFieldStart("notes");
    for (NoteRecord note : notes) {
      gen.writeStartObject();
      gen.writeStringField("uuid", note.uuid().toString());
      gen.writeStringField("message", note.message());
      writeOptional(gen, "created_by", note.createdBy());
      gen.writeBooleanField("is_issue", note.issue());
      writeDateTime(gen, "created_on", note.createdOn());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private void writePredictedTags(JsonGenerator gen, List<PredictedTagRecord> tags) throws IOException {
    if (tags.isEmpty()) {
      return;
    }
    gen.writeArrayFieldStart("tags");
    for (PredictedTagRecord tag : tags) {
      gen.writeStartArray();
      gen.writeNumber(tag.tag());
      gen.writeNumber(tag.score());
      gen.writeEndArray();
    }
    gen.writeEndArray();
  }

  private void writeGeometry(JsonGenerator gen, Geometry geometry) throws IOException {
    gen.writeObjectFieldStart("geometry");
    gen.writeStringField("type", geometry.type());
    gen.writeFieldName("coordinates");
    writeOpaque(gen, geometry.coordinates());
    gen.writeEndObject();
  }

  private void writeOpaque(JsonGenerator gen, Object value) throws IOException {
    if (value == null) {
      gen.writeNull();
    } else if (value instanceof String text) {
      gen.writeString(text);
    } else if (value instanceof Boolean flag) {
      gen.writeBoolean(flag);
    } else if (value instanceof Integer number) {
      gen.writeNumber(number);
    } else if (value instanceof Long number) {
      gen.writeNumber(number);
    } else if (value instanceof BigInteger number) {
      gen.writeNumber(number);
    } else if (value instanceof BigDecimal number) {
      gen.writeNumber(number);
    } else if (value instanceof Number number) {
      gen.writeNumber(number.doubleValue());
    } else if (value instanceof List<?> list) {
      gen.writeStartArray();
      for (Object item : list) {
        writeOpaque(gen, item);
      }
      gen.writeEndArray();
    } else if (value instanceof Map<?, ?> map) {
      gen.writeStartObject();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        gen.writeFieldName(String.valueOf(entry.getKey()));
        writeOpaque(gen, entry.getValue());
      }
      gen.writeEndObject();
    } else {
      throw new IllegalArgumentException("Unsupported geometry value type: " + value.getClass().getName());
    }
  }

  private static void writeValues(JsonGenerator gen, String field, Map<String, Double> values) throws IOException {
    if (values == null || values.isEmpty()) {
      return;
    }
    gen.writeObjectFieldStart(field);
    for (Map.Entry<String, Double> entry : values.entrySet()) {
      gen.writeNumberField(entry.getKey(), entry.getValue());
    }
    gen.writeEndObject();
  }

  private static void writeIntList(JsonGenerator gen, String field, List<Integer> ids) throws IOException {
    if (ids.isEmpty()) {
      return;
    }
    gen.writeArrayFieldStart(field);
    for (Integer id : ids) {
      gen.writeNumber(id);
    }
    gen.writeEndArray();
  }

  private static void writeUuidList(JsonGenerator gen, String field, List<UUID> ids) throws IOException {
    if (ids.isEmpty()) {
      return;
    }
    gen.writeArrayFieldStart(field);
    for (UUID id : ids) {
      gen.writeString(id.toString());
    }
    gen.writeEndArray();
  }

  private static void writeOptional(JsonGenerator gen, String field, String value) throws IOException {
    if (value != null) {
      gen.writeStringField(field, value);
    }
  }

  private static void writeOptional(JsonGenerator gen, String field, UUID value) throws IOException {
    if (value != null) {
      gen.writeStringField(field, value.toString());
    }
  }

  private static void writeOptional(JsonGenerator gen, String field, Integer value) throws IOException {
    if (value != null) {
      gen.writeNumberField(field, value);
    }
  }

  private static void writeOptional(JsonGenerator gen, String field, Double value) throws IOException {
    if (value != null) {
      gen.writeNumberField(field, value);
    }
  }

  private static void writeDateTime(JsonGenerator gen, String field, LocalDateTime value) throws IOException {
    if (value != null) {
      gen.writeStringField(field, dateTime(value));
    }
  }

  private static String dateTime(LocalDateTime value) {
    return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(value);
  }
}
