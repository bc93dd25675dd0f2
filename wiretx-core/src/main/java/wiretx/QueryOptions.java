package wiretx;

/**
 * Per-call options for a query.
 *
 * @param savepoint run the query inside its own savepoint, so that a failure rolls back to
 *                  the savepoint instead of failing the enclosing transaction
 */
public record QueryOptions(boolean savepoint) {

  public static final QueryOptions DEFAULT = new QueryOptions(false);

  private static final QueryOptions SAVEPOINT = new QueryOptions(true);

  public static QueryOptions defaults() {
    return DEFAULT;
  }

  public static QueryOptions withSavepoint() {
    return SAVEPOINT;
  }
}
