package wiretx;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Rows and metadata of a successfully executed command.
 *
 * @param command  command tag, e.g. {@code SELECT} or {@code BEGIN}
 * @param columns  column names, empty for commands without a result set
 * @param rows     result rows, each a list of column values
 * @param rowCount rows returned or affected
 */
public record QueryResult(String command, List<String> columns, List<List<Object>> rows, long rowCount) {

  public QueryResult {
    Objects.requireNonNull(command, "command");
    columns = List.copyOf(columns);
    List<List<Object>> copied = new ArrayList<>(rows.size());
    for (List<Object> row : rows) {
      // column values may be SQL NULL, so List.copyOf cannot be used here
      copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
    }
    rows = Collections.unmodifiableList(copied);
  }

  /**
   * A result for a command that returns no rows.
   */
  public static QueryResult command(String command, long rowCount) {
    return new QueryResult(command, List.of(), List.of(), rowCount);
  }
}
