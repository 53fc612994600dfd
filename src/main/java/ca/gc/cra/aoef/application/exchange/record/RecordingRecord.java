package ca.gc.cra.aoef.application.exchange.record;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Exchange form of a recording.
 *
 * @param uuid recording identifier
 * @param path audio path, relative to the audio directory when one is configured
 * @param duration duration in seconds
 * @param channels channel count
 * @param samplerate sample rate in Hz
 * @param timeExpansion time expansion; {@code null} stands for {@code 1.0}
 * @param hash content hash; may be {@code null}
 * @param date recording date; may be {@code null}
 * @param time recording time; may be {@code null}
 * @param latitude latitude; may be {@code null}
 * @param longitude longitude; may be {@code null}
 * @param tags tag ids
 * @param features feature values keyed by name
 * @param notes embedded notes
 * @param owners user ids of the owners
 * @param rights rights statement; may be {@code null}
 */
public record RecordingRecord(
    UUID uuid,
    String path,
    double duration,
    int channels,
    int samplerate,
    Double timeExpansion,
    String hash,
    LocalDate date,
    LocalTime time,
    Double latitude,
    Double longitude,
    List<Integer> tags,
    Map<String, Double> features,
    List<NoteRecord> notes,
    List<Integer> owners,
    String rights) {}
