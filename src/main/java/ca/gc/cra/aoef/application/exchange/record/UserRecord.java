package ca.gc.cra.aoef.application.exchange.record;

import java.util.UUID;

/**
 * Exchange form of a user.
 *
 * @param id document-local integer id used by {@code owners}, {@code created_by} and badge owners
 * @param uuid user identifier
 * @param username login name; may be {@code null}
 * @param email email address; may be {@code null}
 * @param name display name; may be {@code null}
 * @param institution affiliation; may be {@code null}
 */
public record UserRecord(int id, UUID uuid, String username, String email, String name, String institution) {}
