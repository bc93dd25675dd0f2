package wiretx;

/**
 * Transaction status reported by the server on every ready-for-query message.
 *
 * <p>The status carried on the most recent server response is the single source of truth;
 * the client only ever holds a belief about it.
 */
public enum TransactionStatus {
  /** Not in a transaction block. */
  IDLE('I', "idle"),
  /** In a transaction block. */
  IN_TRANSACTION('T', "in_transaction"),
  /** In a failed transaction block; only rollback is accepted. */
  FAILED('E', "failed");

  private final char indicator;
  private final String label;

  TransactionStatus(char indicator, String label) {
    this.indicator = indicator;
    this.label = label;
  }

  /**
   * Returns the status byte as sent in the ready-for-query message.
   */
  public char indicator() {
    return indicator;
  }

  public String label() {
    return label;
  }

  /**
   * Decodes a ready-for-query status byte.
   *
   * @param indicator {@code 'I'}, {@code 'T'} or {@code 'E'}
   * @return the matching status
   * @throws IllegalArgumentException if the byte is not a known status
   */
  public static TransactionStatus fromIndicator(char indicator) {
    for (TransactionStatus status : values()) {
      if (status.indicator == indicator) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown transaction status indicator: " + indicator);
  }
}
