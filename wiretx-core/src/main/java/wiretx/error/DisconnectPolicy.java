package wiretx.error;

import wiretx.SqlState;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable set of SQLSTATE codes after which the connection must be dropped, e.g.
 * {@code read_only_sql_transaction} when a primary has been demoted to a replica.
 */
public final class DisconnectPolicy {

  /** Policy that never disconnects. */
  public static final DisconnectPolicy NONE = new DisconnectPolicy(Set.of());

  private final Set<String> codes;

  private DisconnectPolicy(Set<String> codes) {
    this.codes = codes;
  }

  /**
   * Creates a policy from SQLSTATE codes or condition names.
   *
   * @param codesOrNames e.g. {@code "25006"} or {@code "read_only_sql_transaction"}
   * @throws IllegalArgumentException if a value is neither a known name nor a SQLSTATE code
   */
  public static DisconnectPolicy of(String... codesOrNames) {
    return of(Arrays.asList(codesOrNames));
  }

  public static DisconnectPolicy of(Collection<String> codesOrNames) {
    Objects.requireNonNull(codesOrNames, "codesOrNames");
    if (codesOrNames.isEmpty()) {
      return NONE;
    }
    Set<String> resolved = new LinkedHashSet<>();
    for (String value : codesOrNames) {
      resolved.add(SqlState.resolve(value));
    }
    return new DisconnectPolicy(Set.copyOf(resolved));
  }

  public boolean contains(String sqlState) {
    return sqlState != null && codes.contains(sqlState);
  }

  public Set<String> codes() {
    return codes;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof DisconnectPolicy other && codes.equals(other.codes);
  }

  @Override
  public int hashCode() {
    return codes.hashCode();
  }

  @Override
  public String toString() {
    return "DisconnectPolicy" + codes;
  }
}
