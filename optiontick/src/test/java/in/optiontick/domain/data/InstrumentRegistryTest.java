package in.optiontick.domain.data;

import in.optiontick.domain.data.InstrumentRegistry.OptionSide;
import in.optiontick.domain.data.InstrumentRegistry.Position;
import in.optiontick.domain.data.InstrumentRegistry.StrikePair;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InstrumentRegistryTest {

    private static InstrumentRegistry registry() {
        Map<String, StrikePair> strikes = new LinkedHashMap<>();
        strikes.put("9500", new StrikePair("CE95", "PE95"));
        strikes.put("10000", new StrikePair("CE100", "PE100"));
        strikes.put("9750.5", new StrikePair(null, "PE975"));
        strikes.put("weekly", new StrikePair("CEW", null));
        return new InstrumentRegistry(strikes);
    }

    @Test
    void strikes_orderedNumericallyThenLexically() {
        assertEquals(List.of("9500", "9750.5", "10000", "weekly"), List.copyOf(registry().strikes().keySet()));
    }

    @Test
    void subscriptionSet_callsBeforePutsPerStrike() {
        assertEquals(List.of("CE95", "PE95", "PE975", "CE100", "PE100", "CEW"),
            List.copyOf(registry().subscriptionSet()));
    }

    @Test
    void resolve_findsStrikeAndSide() {
        InstrumentRegistry registry = registry();

        assertEquals(Optional.of(new Position("10000", OptionSide.PE)), registry.resolve("PE100"));
        assertEquals(Optional.of(new Position("weekly", OptionSide.CE)), registry.resolve("CEW"));
        assertTrue(registry.resolve("UNKNOWN").isEmpty());
        assertEquals("CE95", registry.strikes().get("9500").key(OptionSide.CE));
    }

    @Test
    void empty_hasNoInstruments() {
        assertTrue(InstrumentRegistry.empty().isEmpty());
        assertTrue(InstrumentRegistry.empty().subscriptionSet().isEmpty());
    }
}
