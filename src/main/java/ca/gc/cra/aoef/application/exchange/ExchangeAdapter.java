package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.error.MissingReferenceException;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * <strong>What:</strong> Converts one domain entity type to and from its exchange record.
 * <p><strong>Why:</strong> Each adapter owns exactly one entity type and resolves nested references through
 * child adapters, so records stay flat and reference other records only by id.</p>
 * <p><strong>Role:</strong> Base class of every table-backed adapter in the {@link AdapterTree}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; instances live for one conversion call.</p>
 *
 * @param <D> domain type
 * @param <R> exchange record type
 * @param <I> record id type
 * @since 0.1.0
 */
public abstract class ExchangeAdapter<D, R, I> {
  private final String entityName;
  private final IdentityStore<D, R, I> store;

  /**
   * Creates the adapter.
   *
   * @param entityName name used in error messages (for example {@code recording})
   * @param keyFunction identity key of a domain object
   */
  protected ExchangeAdapter(String entityName, Function<? super D, ?> keyFunction) {
    this.entityName = entityName;
    this.store = new IdentityStore<>(keyFunction, this::recordId);
  }

  /**
   * Returns the (possibly cached) exchange record of {@code obj}.
   *
   * @param obj domain object
   * @return record
   */
  public R toExchange(D obj) {
    return store.toExchange(obj, this::newId, this::assembleExchange);
  }

  /**
   * Returns the (possibly cached) domain object of {@code record}.
   *
   * @param record exchange record
   * @return domain object
   * @throws MissingReferenceException if the record references an id that was not hydrated
   */
  public D toDomain(R record) {
    return store.toDomain(record, this::assembleDomain);
  }

  /**
   * Looks up a hydrated or exported object by record id.
   *
   * @param id record id
   * @return matching object, if any
   */
  public Optional<D> fromId(I id) {
    return store.fromId(id);
  }

  /**
   * Resolves {@code id}, failing when no record with that id was hydrated.
   *
   * @param id record id
   * @param referencedBy description of the referencing record, for the error message
   * @return resolved object
   * @throws MissingReferenceException if the id is unknown
   */
  public D require(I id, String referencedBy) {
    return store.fromId(id)
        .orElseThrow(() -> new MissingReferenceException(entityName, id, referencedBy));
  }

  /** @return records in first-seen order */
  public List<R> values() {
    return store.values();
  }

  /** @return name used for this entity in messages */
  public String entityName() {
    return entityName;
  }

  /** @return number of distinct objects seen */
  protected int size() {
    return store.size();
  }

  /** Allocates the id of a new record for {@code obj}. */
  protected abstract I newId(D obj);

  /** Reads the id of {@code record}. */
  protected abstract I recordId(R record);

  /** Builds the flat record, resolving nested references through child adapters. */
  protected abstract R assembleExchange(D obj, I id);

  /** Builds the domain object, resolving referenced ids through child adapters. */
  protected abstract D assembleDomain(R record);
}
