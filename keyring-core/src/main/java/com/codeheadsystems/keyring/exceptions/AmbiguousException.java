package com.codeheadsystems.keyring.exceptions;

import com.codeheadsystems.keyring.Entry;
import java.util.List;

/**
 * The entry's specification matches more than one credential.
 * <p>
 * The exception carries one wrapper {@link Entry} per matching credential. Operating on one
 * of those entries pins the operation to a single credential, which is the only way to
 * read, write or delete through an ambiguous specification.
 */
public class AmbiguousException extends KeyringException {

  private final transient List<Entry> entries;

  /**
   * Instantiates a new Ambiguous exception.
   *
   * @param entries wrappers for every matching credential
   */
  public AmbiguousException(final List<Entry> entries) {
    super("Entry is matched by " + entries.size() + " credentials: " + entries);
    this.entries = List.copyOf(entries);
  }

  /**
   * The wrappers of the matching credentials.
   *
   * @return an immutable list, never empty
   */
  public List<Entry> entries() {
    return entries;
  }
}
