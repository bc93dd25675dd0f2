package wiretx.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;
import wiretx.TransactionConfig;
import wiretx.TransactionStrategy;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for wiretx connections.
 *
 * @see WiretxAutoConfiguration
 */
@ConfigurationProperties(prefix = "wiretx")
public class WiretxProperties {

    /**
     * Transaction strategy: STRICT issues BEGIN/COMMIT itself, NAIVE anchors each
     * transaction with a savepoint inside a transaction opened by the caller.
     */
    private TransactionStrategy strategy = TransactionStrategy.STRICT;

    /**
     * SQLSTATE codes or condition names after which a connection is dropped,
     * e.g. read_only_sql_transaction.
     */
    private List<String> disconnectOnErrorCodes = new ArrayList<>();

    private final Savepoint savepoint = new Savepoint();
    private final Metrics metrics = new Metrics();

    public TransactionStrategy getStrategy() {
        return strategy;
    }

    public void setStrategy(TransactionStrategy strategy) {
        this.strategy = strategy;
    }

    public List<String> getDisconnectOnErrorCodes() {
        return disconnectOnErrorCodes;
    }

    public void setDisconnectOnErrorCodes(List<String> disconnectOnErrorCodes) {
        this.disconnectOnErrorCodes = disconnectOnErrorCodes;
    }

    public Savepoint getSavepoint() {
        return savepoint;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    /**
     * Builds the core configuration from these properties.
     */
    public TransactionConfig toTransactionConfig() {
        return new TransactionConfig()
                .setStrategy(strategy)
                .setDisconnectOnErrorCodes(disconnectOnErrorCodes)
                .setQuerySavepointName(savepoint.getQueryName())
                .setTransactionSavepointName(savepoint.getTransactionName());
    }

    public static class Savepoint {
        /**
         * Savepoint guarding single queries run with the savepoint option.
         */
        private String queryName = TransactionConfig.DEFAULT_QUERY_SAVEPOINT;

        /**
         * Savepoint anchoring naive transactions; nested levels append their depth.
         */
        private String transactionName = TransactionConfig.DEFAULT_TRANSACTION_SAVEPOINT;

        public String getQueryName() {
            return queryName;
        }

        public void setQueryName(String queryName) {
            this.queryName = queryName;
        }

        public String getTransactionName() {
            return transactionName;
        }

        public void setTransactionName(String transactionName) {
            this.transactionName = transactionName;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "wiretx";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
