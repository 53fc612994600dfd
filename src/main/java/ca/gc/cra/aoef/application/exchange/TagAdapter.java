package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.application.exchange.record.PredictedTagRecord;
import ca.gc.cra.aoef.application.exchange.record.TagRecord;
import ca.gc.cra.aoef.domain.PredictedTag;
import ca.gc.cra.aoef.domain.Tag;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Deduplicates tags by {@code (key, value)} and numbers them 0, 1, 2... in first-seen order.
 *
 * @since 0.1.0
 */
public final class TagAdapter extends ExchangeAdapter<Tag, TagRecord, Integer> {

  public TagAdapter() {
    super("tag", tag -> Map.entry(tag.key(), tag.value()));
  }

  @Override
  protected Integer newId(Tag obj) {
    return size();
  }

  @Override
  protected Integer recordId(TagRecord record) {
    return record.id();
  }

  @Override
  protected TagRecord assembleExchange(Tag obj, Integer id) {
    return new TagRecord(id, obj.key(), obj.value());
  }

  @Override
  protected Tag assembleDomain(TagRecord record) {
    return new Tag(record.key(), record.value());
  }

  /** Exports tags as their ids. */
  public List<Integer> toIds(List<Tag> tags) {
    List<Integer> ids = new ArrayList<>(tags.size());
    for (Tag tag : tags) {
      ids.add(toExchange(tag).id());
    }
    return ids;
  }

  /** Resolves tag ids referenced by {@code referencedBy}. */
  public List<Tag> fromIds(List<Integer> ids, String referencedBy) {
    List<Tag> tags = new ArrayList<>(ids.size());
    for (Integer id : ids) {
      tags.add(require(id, referencedBy));
    }
    return tags;
  }

  /** Exports predicted tags as {@code (tag id, score)} pairs. */
  public List<PredictedTagRecord> toPredicted(List<PredictedTag> predicted) {
    List<PredictedTagRecord> records = new ArrayList<>(predicted.size());
    for (PredictedTag tag : predicted) {
      records.add(new PredictedTagRecord(toExchange(tag.tag()).id(), tag.score()));
    }
    return records;
  }

  /** Resolves predicted tag pairs referenced by {@code referencedBy}. */
  public List<PredictedTag> fromPredicted(List<PredictedTagRecord> records, String referencedBy) {
    List<PredictedTag> predicted = new ArrayList<>(records.size());
    for (PredictedTagRecord record : records) {
      predicted.add(new PredictedTag(require(record.tag(), referencedBy), record.score()));
    }
    return predicted;
  }
}
