package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.application.exchange.record.UserRecord;
import ca.gc.cra.aoef.domain.User;
import java.util.ArrayList;
import java.util.List;

/**
 * Deduplicates users by content and numbers them in first-seen order.
 *
 * @since 0.1.0
 */
public final class UserAdapter extends ExchangeAdapter<User, UserRecord, Integer> {

  public UserAdapter() {
    super("user", user -> user);
  }

  @Override
  protected Integer newId(User obj) {
    return size();
  }

  @Override
  protected Integer recordId(UserRecord record) {
    return record.id();
  }

  @Override
  protected UserRecord assembleExchange(User obj, Integer id) {
    return new UserRecord(id, obj.uuid(), obj.username(), obj.email(), obj.name(), obj.institution());
  }

  @Override
  protected User assembleDomain(UserRecord record) {
    return new User(record.uuid(), record.username(), record.email(), record.name(), record.institution());
  }

  /** Exports an optional user as its id, or {@code null}. */
  public Integer toOptionalId(User user) {
    return user == null ? null : toExchange(user).id();
  }

  /** Resolves an optional user id, or returns {@code null}. */
  public User fromOptionalId(Integer id, String referencedBy) {
    return id == null ? null : require(id, referencedBy);
  }

  /** Exports users as their ids. */
  public List<Integer> toIds(List<User> users) {
    List<Integer> ids = new ArrayList<>(users.size());
    for (User user : users) {
      ids.add(toExchange(user).id());
    }
    return ids;
  }

  /** Resolves user ids referenced by {@code referencedBy}. */
  public List<User> fromIds(List<Integer> ids, String referencedBy) {
    List<User> users = new ArrayList<>(ids.size());
    for (Integer id : ids) {
      users.add(require(id, referencedBy));
    }
    return users;
  }
}
