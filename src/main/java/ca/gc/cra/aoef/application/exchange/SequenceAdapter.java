package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.application.exchange.record.SequenceRecord;
import ca.gc.cra.aoef.domain.Sequence;
import ca.gc.cra.aoef.error.MalformedDocumentException;
import ca.gc.cra.aoef.error.MissingReferenceException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * <strong>What:</strong> Converts sequences, including their {@code parent} chain.
 * <p><strong>Traversal:</strong> Parent chains are walked with an explicit stack in both directions, so chain
 * length never grows the call stack. Ancestors are emitted before their descendants.</p>
 * <p><strong>Cycles:</strong> A parent cycle in an imported document fails with
 * {@link MalformedDocumentException}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class SequenceAdapter extends UuidExchangeAdapter<Sequence, SequenceRecord> {
  private final SoundEventAdapter soundEvents;

  public SequenceAdapter(SoundEventAdapter soundEvents) {
    super("sequence");
    this.soundEvents = Objects.requireNonNull(soundEvents, "soundEvents");
  }

  @Override
  public SequenceRecord toExchange(Sequence sequence) {
    Deque<Sequence> ancestors = new ArrayDeque<>();
    for (Sequence parent = sequence.parent();
        parent != null && fromId(parent.uuid()).isEmpty();
        parent = parent.parent()) {
      ancestors.push(parent);
    }
    while (!ancestors.isEmpty()) {
      super.toExchange(ancestors.pop());
    }
    return super.toExchange(sequence);
  }

  /**
   * Hydrates a whole sequence table, resolving parents that appear later in the table first.
   *
   * @param records sequence records in document order
   * @throws MissingReferenceException if a parent or member sound event is not defined
   * @throws MalformedDocumentException if parents form a cycle
   */
  public void hydrateAll(List<SequenceRecord> records) {
    Map<UUID, SequenceRecord> byUuid = new LinkedHashMap<>();
    for (SequenceRecord record : records) {
      byUuid.put(record.uuid(), record);
    }
    for (SequenceRecord record : records) {
      hydrateChain(record, byUuid);
    }
  }

  private void hydrateChain(SequenceRecord record, Map<UUID, SequenceRecord> byUuid) {
    Deque<SequenceRecord> chain = new ArrayDeque<>();
    Set<UUID> visiting = new HashSet<>();
    SequenceRecord current = record;
    while (current != null && fromId(current.uuid()).isEmpty()) {
      if (!visiting.add(current.uuid())) {
        throw new MalformedDocumentException("data.sequences", "parent cycle through sequence " + current.uuid());
      }
      chain.push(current);
      UUID parentId = current.parent();
      if (parentId == null || fromId(parentId).isPresent()) {
        current = null;
      } else {
        current = byUuid.get(parentId);
        if (current == null) {
          throw new MissingReferenceException("sequence", parentId, describe(chain.peek().uuid()));
        }
      }
    }
    while (!chain.isEmpty()) {
      toDomain(chain.pop());
    }
  }

  @Override
  protected UUID recordId(SequenceRecord record) {
    return record.uuid();
  }

  @Override
  protected SequenceRecord assembleExchange(Sequence obj, UUID id) {
    UUID parent = obj.parent() == null ? null : obj.parent().uuid();
    return new SequenceRecord(id, soundEvents.toUuids(obj.soundEvents()), Features.toMap(obj.features()), parent);
  }

  @Override
  protected Sequence assembleDomain(SequenceRecord record) {
    String owner = describe(record.uuid());
    Sequence parent = record.parent() == null ? null : require(record.parent(), owner);
    return new Sequence(
        record.uuid(), soundEvents.fromUuids(record.soundEvents(), owner), Features.fromMap(record.features()), parent);
  }
}
