package in.optiontick.domain.data;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldNameTest {

    @Test
    void parse_acceptsEnumNamesColumnsAndFeedPaths() {
        assertEquals(Optional.of(FieldName.LAST_PRICE), FieldName.parse("last_price"));
        assertEquals(Optional.of(FieldName.LAST_PRICE), FieldName.parse("LTP"));
        assertEquals(Optional.of(FieldName.LAST_PRICE), FieldName.parse("ltpc.ltp"));
        assertEquals(Optional.of(FieldName.PREV_CLOSE), FieldName.parse(" cp "));
        assertEquals(Optional.of(FieldName.IMPLIED_VOL), FieldName.parse("iv"));
        assertEquals(Optional.of(FieldName.THETA), FieldName.parse("optionGreeks.theta"));
        assertEquals(Optional.of(FieldName.CHANGE_PERCENT), FieldName.parse("change_pct"));
    }

    @Test
    void parse_unknownIsEmpty() {
        assertTrue(FieldName.parse("volume").isEmpty());
        assertTrue(FieldName.parse("").isEmpty());
        assertTrue(FieldName.parse(null).isEmpty());
    }

    @Test
    void valueOf_readsObservation() {
        Observation o = new Observation(Instant.EPOCH, "X", 110, 100, 5000, 14.5, 0.4, 0.002, 9.1, -3.2);

        assertEquals(5000, FieldName.OPEN_INTEREST.valueOf(o));
        assertEquals(-3.2, FieldName.THETA.valueOf(o));
        assertEquals(10.0, FieldName.CHANGE_PERCENT.valueOf(o), 1e-9);
        assertTrue(FieldName.CHANGE_PERCENT.isDerived());
        assertNull(FieldName.CHANGE_PERCENT.column());
        assertEquals("gamma", FieldName.GAMMA.column());
    }
}
