package wiretx.error;

import org.junit.jupiter.api.Test;
import wiretx.SqlState;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DisconnectPolicyTest {

    @Test
    void resolvesNamesAndCodes() {
        DisconnectPolicy policy = DisconnectPolicy.of("read_only_sql_transaction", "57p01");

        assertEquals(Set.of(SqlState.READ_ONLY_SQL_TRANSACTION, SqlState.ADMIN_SHUTDOWN), policy.codes());
        assertTrue(policy.contains("25006"));
        assertTrue(policy.contains("57P01"));
        assertFalse(policy.contains(SqlState.UNIQUE_VIOLATION));
        assertFalse(policy.contains(null));
    }

    @Test
    void namesAreCaseInsensitive() {
        assertEquals(DisconnectPolicy.of("25006"), DisconnectPolicy.of("READ_ONLY_SQL_TRANSACTION"));
    }

    @Test
    void unlistedCodesAreAcceptedVerbatim() {
        assertTrue(DisconnectPolicy.of("XX000").contains("XX000"));
    }

    @Test
    void rejectsUnknownNames() {
        assertThrows(IllegalArgumentException.class, () -> DisconnectPolicy.of("not_a_condition"));
        assertThrows(IllegalArgumentException.class, () -> DisconnectPolicy.of("2500"));
    }

    @Test
    void emptyIsNone() {
        assertSame(DisconnectPolicy.NONE, DisconnectPolicy.of(List.of()));
        assertTrue(DisconnectPolicy.NONE.codes().isEmpty());
    }
}
