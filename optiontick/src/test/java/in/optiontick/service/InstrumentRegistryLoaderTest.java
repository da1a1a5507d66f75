package in.optiontick.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import in.optiontick.domain.data.ChainCatalog;
import in.optiontick.domain.data.InstrumentRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InstrumentRegistryLoaderTest {

    private final InstrumentRegistryLoader loader = new InstrumentRegistryLoader(new ObjectMapper());

    @TempDir
    Path tempDir;

    @Test
    void load_readsStrikesAndSkipsUnusableEntries() throws Exception {
        Path file = tempDir.resolve("chain.json");
        Files.writeString(file, """
            {
              "23500": {"CE": "NSE_FO|45001", "PE": "NSE_FO|45002"},
              "23450": {"CE": "NSE_FO|45003", "PE": null},
              "23550": "NSE_FO|45004",
              "23600": {"FUT": "NSE_FO|45005"}
            }
            """);

        InstrumentRegistry registry = loader.load(file);

        assertEquals(List.of("23450", "23500"), List.copyOf(registry.strikes().keySet()));
        assertNull(registry.strikes().get("23450").put());
        assertEquals(List.of("NSE_FO|45003", "NSE_FO|45001", "NSE_FO|45002"),
            List.copyOf(registry.subscriptionSet()));
    }

    @Test
    void load_missingFileFails() {
        assertThrows(UncheckedIOException.class, () -> loader.load(tempDir.resolve("absent.json")));
    }

    @Test
    void loadCatalog_readsEveryChainFileInDirectory() throws Exception {
        Files.writeString(tempDir.resolve("nifty_50-16-01-2025.json"),
            "{\"23500\": {\"CE\": \"NSE_FO|1\", \"PE\": \"NSE_FO|2\"}}");
        Files.writeString(tempDir.resolve("nifty_bank-15-01-2025.json"),
            "{\"49000\": {\"CE\": \"NSE_FO|3\", \"PE\": \"NSE_FO|2\"}}");
        Files.writeString(tempDir.resolve("instruments_details.json"),
            "{\"1\": {\"CE\": \"NSE_FO|9\"}}");

        ChainCatalog catalog = loader.loadCatalog(tempDir);

        assertEquals(List.of("nifty_50-16-01-2025", "nifty_bank-15-01-2025"),
            List.copyOf(catalog.chains().keySet()), "Only <underlying>-<DD>-<MM>-<YYYY>.json files are chains");
        assertEquals(List.of("NSE_FO|1", "NSE_FO|2", "NSE_FO|3"), List.copyOf(catalog.subscriptionSet()));
    }

    @Test
    void loadCatalog_skipsBrokenChainFile() throws Exception {
        Files.writeString(tempDir.resolve("nifty_50-16-01-2025.json"),
            "{\"23500\": {\"CE\": \"NSE_FO|1\"}}");
        Files.writeString(tempDir.resolve("sensex-17-01-2025.json"), "[1, 2]");
        Files.writeString(tempDir.resolve("finnifty-21-01-2025.json"), "{not json");

        ChainCatalog catalog = loader.loadCatalog(tempDir);

        assertEquals(List.of("nifty_50-16-01-2025"), List.copyOf(catalog.chains().keySet()));
    }

    @Test
    void loadCatalog_singleFileIsOneChain() throws Exception {
        Path file = tempDir.resolve("chain.json");
        Files.writeString(file, "{\"23500\": {\"CE\": \"NSE_FO|1\"}}");

        ChainCatalog catalog = loader.loadCatalog(file);

        assertEquals(List.of("chain"), List.copyOf(catalog.chains().keySet()));
        assertEquals(1, catalog.subscriptionSet().size());
    }

    @Test
    void loadCatalog_missingPathIsEmpty() {
        assertTrue(loader.loadCatalog(tempDir.resolve("absent")).isEmpty());
    }

    @Test
    void load_rejectsNonObjectRoot() throws Exception {
        Path file = tempDir.resolve("chain.json");
        Files.writeString(file, "[\"NSE_FO|1\"]");

        assertThrows(IllegalArgumentException.class, () -> loader.load(file));
    }
}
