package wiretx.tx;

import wiretx.ServerError;

/**
 * One live savepoint: a query-level savepoint or the anchor of a naive transaction.
 *
 * <p>A frame is <em>inactive</em> when no {@code SAVEPOINT} was sent because its parent had
 * already failed, and <em>unopened</em> when the {@code SAVEPOINT} command itself failed.
 * Neither has anything to release.
 */
final class SavepointFrame {
  private final String name;
  private final TransactionContext parent;
  private final boolean active;
  private final ServerError openError;
  private boolean released;

  private SavepointFrame(String name, TransactionContext parent, boolean active, ServerError openError) {
    this.name = name;
    this.parent = parent;
    this.active = active;
    this.openError = openError;
  }

  static SavepointFrame opened(String name, TransactionContext parent) {
    return new SavepointFrame(name, parent, true, null);
  }

  static SavepointFrame skipped(String name, TransactionContext parent) {
    return new SavepointFrame(name, parent, false, null);
  }

  static SavepointFrame unopened(String name, TransactionContext parent, ServerError error) {
    return new SavepointFrame(name, parent, false, error);
  }

  String name() {
    return name;
  }

  /**
   * The context whose rollback boundary this savepoint protects, or {@code null} for the anchor
   * of a transaction opened outside this library.
   */
  TransactionContext parent() {
    return parent;
  }

  boolean isActive() {
    return active;
  }

  ServerError openError() {
    return openError;
  }

  boolean isReleased() {
    return released;
  }

  void markReleased() {
    released = true;
  }
}
