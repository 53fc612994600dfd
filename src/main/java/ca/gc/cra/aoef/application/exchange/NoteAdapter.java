package ca.gc.cra.aoef.application.exchange;

import ca.gc.cra.aoef.application.exchange.record.NoteRecord;
import ca.gc.cra.aoef.domain.Note;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts notes inline. Notes are embedded in their owner's record, so this adapter keeps no
 * identity map; only the author is routed through the {@link UserAdapter}.
 *
 * @since 0.1.0
 */
public final class NoteAdapter {
  private final UserAdapter users;

  public NoteAdapter(UserAdapter users) {
    this.users = Objects.requireNonNull(users, "users");
  }

  public NoteRecord toExchange(Note note) {
    return new NoteRecord(
        note.uuid(), note.message(), users.toOptionalId(note.createdBy()), note.issue(), note.createdOn());
  }

  public Note toDomain(NoteRecord record, String referencedBy) {
    String owner = "note " + record.uuid() + " of " + referencedBy;
    return new Note(
        record.uuid(),
        record.message(),
        users.fromOptionalId(record.createdBy(), owner),
        record.issue(),
        record.createdOn());
  }

  public List<NoteRecord> toExchange(List<Note> notes) {
    List<NoteRecord> records = new ArrayList<>(notes.size());
    for (Note note : notes) {
      records.add(toExchange(note));
    }
    return records;
  }

  public List<Note> toDomain(List<NoteRecord> records, String referencedBy) {
    List<Note> notes = new ArrayList<>(records.size());
    for (NoteRecord record : records) {
      notes.add(toDomain(record, referencedBy));
    }
    return notes;
  }
}
