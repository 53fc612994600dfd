package ca.gc.cra.aoef.application.exchange;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * <strong>What:</strong> Memoizing two-way map between domain objects and their exchange records.
 * <p><strong>Why:</strong> Guarantees that, within one conversion, domain objects with equal identity keys
 * map to exactly one exchange record, which is what keeps documents deduplicated.</p>
 * <p><strong>Role:</strong> Backing store of every {@link ExchangeAdapter}; discarded after each call.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one instance belongs to one conversion call.</p>
 * <p><strong>Performance:</strong> Hash lookups; records are kept in first-seen order for emission.</p>
 *
 * @param <D> domain type
 * @param <R> exchange record type
 * @param <I> record id type ({@code Integer} or {@code UUID})
 * @since 0.1.0
 */
public final class IdentityStore<D, R, I> {
  private final Function<? super D, ?> keyFunction;
  private final Function<? super R, ? extends I> recordId;
  private final Map<Object, R> recordsByKey = new LinkedHashMap<>();
  private final Map<I, D> domainById = new HashMap<>();

  /**
   * Creates an empty store.
   *
   * @param keyFunction derives the identity key of a domain object; keys must honour {@code equals}
   * @param recordId reads the id of an exchange record
   */
  public IdentityStore(Function<? super D, ?> keyFunction, Function<? super R, ? extends I> recordId) {
    this.keyFunction = Objects.requireNonNull(keyFunction, "keyFunction");
    this.recordId = Objects.requireNonNull(recordId, "recordId");
  }

  /**
   * Returns the record for {@code obj}, assembling and caching it on first sight of its key.
   *
   * <p>Re-submitting a known key is a no-op that returns the cached record.</p>
   *
   * @param obj domain object
   * @param idAllocator allocates the id of a new record
   * @param assembler builds the record from the object and its id
   * @return cached or newly assembled record
   */
  public R toExchange(
      D obj, Function<? super D, ? extends I> idAllocator, BiFunction<? super D, ? super I, ? extends R> assembler) {
    Objects.requireNonNull(obj, "obj");
    Object key = keyFunction.apply(obj);
    R cached = recordsByKey.get(key);
    if (cached != null) {
      return cached;
    }
    I id = idAllocator.apply(obj);
    R record = assembler.apply(obj, id);
    recordsByKey.put(key, record);
    domainById.putIfAbsent(id, obj);
    return record;
  }

  /**
   * Returns the domain object for {@code record}, assembling and caching it on first sight of its id.
   *
   * @param record exchange record
   * @param assembler builds the domain object from the record
   * @return cached or newly assembled domain object
   */
  public D toDomain(R record, Function<? super R, ? extends D> assembler) {
    Objects.requireNonNull(record, "record");
    I id = recordId.apply(record);
    D cached = domainById.get(id);
    if (cached != null) {
      return cached;
    }
    D obj = assembler.apply(record);
    domainById.put(id, obj);
    recordsByKey.putIfAbsent(keyFunction.apply(obj), record);
    return obj;
  }

  /**
   * Looks up a domain object previously exchanged under {@code id}.
   *
   * @param id record id
   * @return the domain object, or empty when the id is unknown
   */
  public Optional<D> fromId(I id) {
    return Optional.ofNullable(domainById.get(id));
  }

  /**
   * Returns every record in first-seen order.
   *
   * @return snapshot of the records
   */
  public List<R> values() {
    return new ArrayList<>(recordsByKey.values());
  }

  /** @return number of distinct identity keys seen */
  public int size() {
    return recordsByKey.size();
  }
}
