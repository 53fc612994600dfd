package ca.gc.cra.aoef.domain.collection;

import ca.gc.cra.aoef.domain.Identified;
import java.time.LocalDateTime;

/**
 * <strong>What:</strong> Top-level object that can be saved as one AOEF document.
 * <p><strong>Why:</strong> Gives the document envelope a single type to dispatch on.</p>
 * <p><strong>Role:</strong> Implemented by the eight collection classes; subclasses extend their base
 * collection (for example {@link Dataset} extends {@link RecordingSet}).</p>
 * <p><strong>Thread-safety:</strong> Implementations are immutable.</p>
 *
 * @since 0.1.0
 */
public interface DataCollection extends Identified {
  /**
   * Returns when the collection was created.
   *
   * @return creation time; never {@code null}
   */
  LocalDateTime createdOn();
}
