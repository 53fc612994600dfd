package ca.gc.cra.aoef.domain;

import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * <strong>What:</strong> Audio file plus the metadata needed to interpret it.
 * <p><strong>Why:</strong> Recordings are the most widely shared node of the graph; clips and sound events
 * point at them.</p>
 * <p><strong>Thread-safety:</strong> Immutable; list components are defensively copied.</p>
 *
 * @param uuid recording identifier; never {@code null}
 * @param path location of the audio file; never {@code null}
 * @param duration duration in seconds
 * @param channels number of audio channels
 * @param samplerate sample rate in Hz
 * @param timeExpansion time expansion factor; {@code 1.0} for real-time recordings
 * @param hash content hash of the file; may be {@code null}
 * @param date recording date; may be {@code null}
 * @param time recording time of day; may be {@code null}
 * @param latitude latitude in decimal degrees; may be {@code null}
 * @param longitude longitude in decimal degrees; may be {@code null}
 * @param tags recording-level tags
 * @param features recording-level features
 * @param notes attached notes
 * @param owners users who own the recording
 * @param rights licence or rights statement; may be {@code null}
 * @since 0.1.0
 */
public record Recording(
    UUID uuid,
    Path path,
    double duration,
    int channels,
    int samplerate,
    double timeExpansion,
    String hash,
    LocalDate date,
    LocalTime time,
    Double latitude,
    Double longitude,
    List<Tag> tags,
    List<Feature> features,
    List<Note> notes,
    List<User> owners,
    String rights) implements Identified {

  public Recording {
    Objects.requireNonNull(uuid, "uuid");
    Objects.requireNonNull(path, "path");
    tags = tags == null ? List.of() : List.copyOf(tags);
    features = features == null ? List.of() : List.copyOf(features);
    notes = notes == null ? List.of() : List.copyOf(notes);
    owners = owners == null ? List.of() : List.copyOf(owners);
  }

  /**
   * Starts a builder for a recording with the mandatory fields set.
   *
   * @param uuid recording identifier
   * @param path audio file location
   * @return builder with {@code timeExpansion = 1.0} and no optional metadata
   */
  public static Builder builder(UUID uuid, Path path) {
    return new Builder(uuid, path);
  }

  /** Mutable builder for {@link Recording}; not thread-safe. */
  public static final class Builder {
    private final UUID uuid;
    private final Path path;
    private double duration;
    private int channels = 1;
    private int samplerate;
    private double timeExpansion = 1.0;
    private String hash;
    private LocalDate date;
    private LocalTime time;
    private Double latitude;
    private Double longitude;
    private List<Tag> tags = List.of();
    private List<Feature> features = List.of();
    private List<Note> notes = List.of();
    private List<User> owners = List.of();
    private String rights;

    private Builder(UUID uuid, Path path) {
      this.uuid = uuid;
      this.path = path;
    }

    public Builder duration(double duration) {
      this.duration = duration;
      return this;
    }

    public Builder channels(int channels) {
      this.channels = channels;
      return this;
    }

    public Builder samplerate(int samplerate) {
      this.samplerate = samplerate;
      return this;
    }

    public Builder timeExpansion(double timeExpansion) {
      this.timeExpansion = timeExpansion;
      return this;
    }

    public Builder hash(String hash) {
      this.hash = hash;
      return this;
    }

    public Builder date(LocalDate date) {
      this.date = date;
      return this;
    }

    public Builder time(LocalTime time) {
      this.time = time;
      return this;
    }

    public Builder location(Double latitude, Double longitude) {
      this.latitude = latitude;
      this.longitude = longitude;
      return this;
    }

    public Builder tags(List<Tag> tags) {
      this.tags = tags;
      return this;
    }

    public Builder features(List<Feature> features) {
      this.features = features;
      return this;
    }

    public Builder notes(List<Note> notes) {
      this.notes = notes;
      return this;
    }

    public Builder owners(List<User> owners) {
      this.owners = owners;
      return this;
    }

    public Builder rights(String rights) {
      this.rights = rights;
      return this;
    }

    public Recording build() {
      return new Recording(uuid, path, duration, channels, samplerate, timeExpansion, hash, date, time,
          latitude, longitude, tags, features, notes, owners, rights);
    }
  }
}
