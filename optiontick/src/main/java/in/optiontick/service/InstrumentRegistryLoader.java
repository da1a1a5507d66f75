package in.optiontick.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.optiontick.domain.data.ChainCatalog;
import in.optiontick.domain.data.InstrumentRegistry;
import in.optiontick.domain.data.InstrumentRegistry.StrikePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Loads option chain files: {@code {"<strike>": {"CE": "<key>", "PE": "<key>"}}}.
 *
 * Either side may be missing or null. Entries that are not objects are skipped.
 * A chain directory holds one file per underlying and expiry, named
 * {@code <underlying>-<DD>-<MM>-<YYYY>.json}.
 */
public final class InstrumentRegistryLoader {
    private static final Logger log = LoggerFactory.getLogger(InstrumentRegistryLoader.class);

    static final String CHAIN_FILE_GLOB = "*-*-*.json";

    private final ObjectMapper objectMapper;

    public InstrumentRegistryLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public InstrumentRegistry load(Path file) {
        try {
            InstrumentRegistry registry = parse(objectMapper.readTree(file.toFile()));
            log.info("[REGISTRY] Loaded {} strikes ({} instruments) from {}",
                registry.size(), registry.subscriptionSet().size(), file);
            return registry;
        } catch (IOException e) {
            log.error("[REGISTRY] Failed to read {}: {}", file, e.getMessage());
            throw new UncheckedIOException("Failed to read instrument registry " + file, e);
        }
    }

    /**
     * Load every chain file in a directory into a catalog keyed by chain name.
     *
     * A regular file is loaded as a catalog of one chain. A missing path gives an
     * empty catalog. A chain file that cannot be read or parsed is logged and skipped.
     */
    public ChainCatalog loadCatalog(Path path) {
        if (Files.isRegularFile(path)) {
            return ChainCatalog.of(path.getFileName().toString(), load(path));
        }
        if (!Files.isDirectory(path)) {
            log.warn("[REGISTRY] No chain directory at {}, chain view is empty", path);
            return ChainCatalog.empty();
        }

        Map<String, InstrumentRegistry> chains = new TreeMap<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(path, CHAIN_FILE_GLOB)) {
            for (Path file : files) {
                if (!Files.isRegularFile(file)) {
                    continue;
                }
                try {
                    chains.put(file.getFileName().toString(), load(file));
                } catch (UncheckedIOException | IllegalArgumentException e) {
                    log.warn("[REGISTRY] Skipping chain file {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            log.error("[REGISTRY] Failed to scan {}: {}", path, e.getMessage());
            throw new UncheckedIOException("Failed to scan chain directory " + path, e);
        }

        ChainCatalog catalog = new ChainCatalog(chains);
        log.info("[REGISTRY] {} chains ({} instruments) in {}",
            catalog.size(), catalog.subscriptionSet().size(), path);
        return catalog;
    }

    InstrumentRegistry parse(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Instrument registry must be a JSON object of strikes");
        }

        Map<String, StrikePair> strikes = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode sides = entry.getValue();
            if (!sides.isObject()) {
                log.warn("[REGISTRY] Skipping strike {}: not an object", entry.getKey());
                continue;
            }
            String call = text(sides, "CE");
            String put = text(sides, "PE");
            if (call == null && put == null) {
                log.warn("[REGISTRY] Skipping strike {}: no CE or PE key", entry.getKey());
                continue;
            }
            strikes.put(entry.getKey(), new StrikePair(call, put));
        }
        return new InstrumentRegistry(strikes);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText().trim();
    }
}
