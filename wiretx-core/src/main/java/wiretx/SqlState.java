package wiretx;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * SQLSTATE codes this library refers to by name, with their PostgreSQL condition names.
 *
 * <p>Only the conditions the transaction core and its configuration deal with are listed.
 * Unknown codes are carried through untouched.
 */
public final class SqlState {
  public static final String UNIQUE_VIOLATION = "23505";
  public static final String INVALID_TEXT_REPRESENTATION = "22P02";
  public static final String ACTIVE_SQL_TRANSACTION = "25001";
  public static final String READ_ONLY_SQL_TRANSACTION = "25006";
  public static final String NO_ACTIVE_SQL_TRANSACTION = "25P01";
  public static final String IN_FAILED_SQL_TRANSACTION = "25P02";
  public static final String INVALID_SAVEPOINT_SPECIFICATION = "3B001";
  public static final String SERIALIZATION_FAILURE = "40001";
  public static final String DEADLOCK_DETECTED = "40P01";
  public static final String ADMIN_SHUTDOWN = "57P01";
  public static final String CRASH_SHUTDOWN = "57P02";
  public static final String CANNOT_CONNECT_NOW = "57P03";
  public static final String SYNTAX_ERROR = "42601";
  public static final String UNDEFINED_TABLE = "42P01";

  private static final Map<String, String> NAMES_BY_CODE;
  private static final Map<String, String> CODES_BY_NAME;

  static {
    Map<String, String> names = new HashMap<>();
    names.put(UNIQUE_VIOLATION, "unique_violation");
    names.put(INVALID_TEXT_REPRESENTATION, "invalid_text_representation");
    names.put(ACTIVE_SQL_TRANSACTION, "active_sql_transaction");
    names.put(READ_ONLY_SQL_TRANSACTION, "read_only_sql_transaction");
    names.put(NO_ACTIVE_SQL_TRANSACTION, "no_active_sql_transaction");
    names.put(IN_FAILED_SQL_TRANSACTION, "in_failed_sql_transaction");
    names.put(INVALID_SAVEPOINT_SPECIFICATION, "invalid_savepoint_specification");
    names.put(SERIALIZATION_FAILURE, "serialization_failure");
    names.put(DEADLOCK_DETECTED, "deadlock_detected");
    names.put(ADMIN_SHUTDOWN, "admin_shutdown");
    names.put(CRASH_SHUTDOWN, "crash_shutdown");
    names.put(CANNOT_CONNECT_NOW, "cannot_connect_now");
    names.put(SYNTAX_ERROR, "syntax_error");
    names.put(UNDEFINED_TABLE, "undefined_table");
    Map<String, String> codes = new HashMap<>();
    names.forEach((code, name) -> codes.put(name, code));
    NAMES_BY_CODE = Collections.unmodifiableMap(names);
    CODES_BY_NAME = Collections.unmodifiableMap(codes);
  }

  /**
   * Returns the condition name for a SQLSTATE code, or {@code null} if it is not listed.
   */
  public static String nameOf(String code) {
    return code == null ? null : NAMES_BY_CODE.get(code.toUpperCase(Locale.ROOT));
  }

  /**
   * Resolves a SQLSTATE code or condition name to a five-character code.
   *
   * @param codeOrName e.g. {@code "25006"} or {@code "read_only_sql_transaction"}
   * @return the SQLSTATE code
   * @throws IllegalArgumentException if the value is neither a known name nor a
   *     five-character code
   */
  public static String resolve(String codeOrName) {
    Objects.requireNonNull(codeOrName, "codeOrName");
    String trimmed = codeOrName.trim();
    String byName = CODES_BY_NAME.get(trimmed.toLowerCase(Locale.ROOT));
    if (byName != null) {
      return byName;
    }
    if (trimmed.length() == 5 && trimmed.chars().allMatch(Character::isLetterOrDigit)) {
      return trimmed.toUpperCase(Locale.ROOT);
    }
    throw new IllegalArgumentException("Unknown SQLSTATE code or condition name: " + codeOrName);
  }

  private SqlState() {}
}
