package wiretx.spring.boot;

import org.junit.jupiter.api.Test;
import wiretx.TransactionConfig;
import wiretx.TransactionStrategy;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WiretxPropertiesTest {

    @Test
    void defaults() {
        WiretxProperties props = new WiretxProperties();

        assertEquals(TransactionStrategy.STRICT, props.getStrategy());
        assertTrue(props.getDisconnectOnErrorCodes().isEmpty());
        assertEquals("wiretx_query", props.getSavepoint().getQueryName());
        assertEquals("wiretx_savepoint", props.getSavepoint().getTransactionName());
        assertTrue(props.getMetrics().isEnabled());
        assertEquals("wiretx", props.getMetrics().getNamePrefix());
    }

    @Test
    void toTransactionConfig() {
        WiretxProperties props = new WiretxProperties();
        props.setStrategy(TransactionStrategy.NAIVE);
        props.setDisconnectOnErrorCodes(List.of("25006"));
        props.getSavepoint().setQueryName("q");
        props.getSavepoint().setTransactionName("t");

        TransactionConfig config = props.toTransactionConfig();

        assertEquals(TransactionStrategy.NAIVE, config.getStrategy());
        assertEquals(List.of("25006"), config.getDisconnectOnErrorCodes());
        assertEquals("q", config.getQuerySavepointName());
        assertEquals("t", config.getTransactionSavepointName());
    }
}
