package ca.gc.cra.aoef.domain;

import java.util.Objects;
import java.util.UUID;

/**
 * Person who owns a recording, wrote a note, or created an annotation.
 *
 * @param uuid user identifier; never {@code null}
 * @param username login name; may be {@code null}
 * @param email email address; may be {@code null}
 * @param name display name; may be {@code null}
 * @param institution affiliation; may be {@code null}
 * @since 0.1.0
 */
public record User(UUID uuid, String username, String email, String name, String institution)
    implements Identified {
  public User {
    Objects.requireNonNull(uuid, "uuid");
  }
}
