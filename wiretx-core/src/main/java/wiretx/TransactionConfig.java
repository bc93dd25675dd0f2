package wiretx;

import wiretx.error.DisconnectPolicy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class TransactionConfig {
  public static final String DEFAULT_QUERY_SAVEPOINT = "wiretx_query";
  public static final String DEFAULT_TRANSACTION_SAVEPOINT = "wiretx_savepoint";

  private TransactionStrategy strategy = TransactionStrategy.STRICT;
  private List<String> disconnectOnErrorCodes = new ArrayList<>();
  private String querySavepointName = DEFAULT_QUERY_SAVEPOINT;
  private String transactionSavepointName = DEFAULT_TRANSACTION_SAVEPOINT;

  public TransactionStrategy getStrategy() {
    return strategy;
  }

  public TransactionConfig setStrategy(TransactionStrategy strategy) {
    this.strategy = Objects.requireNonNull(strategy, "strategy");
    return this;
  }

  public List<String> getDisconnectOnErrorCodes() {
    return disconnectOnErrorCodes;
  }

  public TransactionConfig setDisconnectOnErrorCodes(List<String> disconnectOnErrorCodes) {
    this.disconnectOnErrorCodes = new ArrayList<>(
        Objects.requireNonNull(disconnectOnErrorCodes, "disconnectOnErrorCodes"));
    return this;
  }

  public String getQuerySavepointName() {
    return querySavepointName;
  }

  public TransactionConfig setQuerySavepointName(String querySavepointName) {
    this.querySavepointName = validateName(querySavepointName, "querySavepointName");
    return this;
  }

  public String getTransactionSavepointName() {
    return transactionSavepointName;
  }

  public TransactionConfig setTransactionSavepointName(String transactionSavepointName) {
    this.transactionSavepointName = validateName(transactionSavepointName, "transactionSavepointName");
    return this;
  }

  /**
   * Resolves the configured error codes into a policy.
   *
   * @throws IllegalArgumentException if a configured value is not a SQLSTATE code or a known
   *     condition name
   */
  public DisconnectPolicy disconnectPolicy() {
    return DisconnectPolicy.of(disconnectOnErrorCodes);
  }

  // savepoint names are spliced into SQL text unquoted
  private static String validateName(String name, String field) {
    Objects.requireNonNull(name, field);
    if (!name.matches("[A-Za-z_][A-Za-z0-9_]{0,62}")) {
      throw new IllegalArgumentException(field + " must be a plain SQL identifier: " + name);
    }
    return name;
  }
}
