package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.domain.Identified;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Adapter for entities identified by uuid: the uuid is both the identity key and the record id.
 *
 * @param <D> domain type
 * @param <R> exchange record type
 * @since 0.1.0
 */
public abstract class UuidExchangeAdapter<D extends Identified, R> extends ExchangeAdapter<D, R, UUID> {

  protected UuidExchangeAdapter(String entityName) {
    super(entityName, Identified::uuid);
  }

  @Override
  protected UUID newId(D obj) {
    return obj.uuid();
  }

  /** Exports {@code objects} and returns their uuids in order. */
  public List<UUID> toUuids(List<? extends D> objects) {
    List<UUID> ids = new ArrayList<>(objects.size());
    for (D obj : objects) {
      ids.add(newId(obj));
      toExchange(obj);
    }
    return ids;
  }

  /** Resolves uuids referenced by {@code referencedBy}. */
  public List<D> fromUuids(List<UUID> ids, String referencedBy) {
    List<D> objects = new ArrayList<>(ids.size());
    for (UUID id : ids) {
      objects.add(require(id, referencedBy));
    }
    return objects;
  }

  /** Describes a record for error messages, for example {@code clip 5c1e...}. */
  protected String describe(UUID uuid) {
    return entityName() + " " + uuid;
  }
}
