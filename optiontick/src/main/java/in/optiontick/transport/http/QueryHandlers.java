package in.optiontick.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import in.optiontick.domain.data.ChainCatalog;
import in.optiontick.domain.data.FieldName;
import in.optiontick.domain.data.InstrumentRegistry;
import in.optiontick.domain.data.Observation;
import in.optiontick.domain.data.SeriesPoint;
import in.optiontick.domain.data.SnapshotRow;
import in.optiontick.domain.data.TimeWindow;
import in.optiontick.repository.TickStorageException;
import in.optiontick.service.query.InvalidQueryException;
import in.optiontick.service.query.OptionChainService;
import in.optiontick.service.query.OptionChainService.ChainRow;
import in.optiontick.service.query.RangeQueryService;
import in.optiontick.service.query.SessionClock;
import in.optiontick.service.query.SnapshotQueryService;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.Handlers;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Read-only JSON endpoints over the tick store.
 *
 * GET /api/snapshot?keys=a,b&start=..&end=..   (or &asOf=..)
 * GET /api/range?key=..&field=..&start=..&end=..   (or &minutes=N[&date=..], or &date=..)
 * GET /api/chains
 * GET /api/chain[?chain=..][&asOf=..]
 * GET /health
 * GET /metrics[?name[]=..]
 *
 * Instants are ISO-8601 (e.g. 2025-01-10T03:45:00Z), dates are YYYY-MM-DD.
 */
public final class QueryHandlers {
    private static final Logger log = LoggerFactory.getLogger(QueryHandlers.class);
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private static final String JSON_DATA = "data";
    private static final String JSON_ERROR = "error";

    private final SnapshotQueryService snapshotService;
    private final RangeQueryService rangeService;
    private final OptionChainService chainService;
    private final ChainCatalog chains;
    private final Supplier<String> pipelineState;
    private final Clock clock;

    public QueryHandlers(SnapshotQueryService snapshotService,
                         RangeQueryService rangeService,
                         OptionChainService chainService,
                         ChainCatalog chains,
                         Supplier<String> pipelineState,
                         Clock clock) {
        this.snapshotService = snapshotService;
        this.rangeService = rangeService;
        this.chainService = chainService;
        this.chains = chains;
        this.pipelineState = pipelineState;
        this.clock = clock;
    }

    /**
     * All query routes plus /metrics. Store reads run off the IO threads.
     */
    public RoutingHandler routes(CollectorRegistry metricsRegistry) {
        return Handlers.routing()
            .get("/api/snapshot", new BlockingHandler(this::snapshot))
            .get("/api/range", new BlockingHandler(this::range))
            .get("/api/chain", new BlockingHandler(this::chain))
            .get("/api/chains", this::listChains)
            .get("/health", this::health)
            .get("/metrics", exchange -> metrics(exchange, metricsRegistry))
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(StatusCodes.NOT_FOUND);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "OptionTick\n\n" +
                    "GET /api/snapshot?keys=..&start=..&end=..  (or &asOf=..)\n" +
                    "GET /api/range?key=..&field=..&start=..&end=..  (or &minutes=N[&date=..], or &date=..)\n" +
                    "GET /api/chains, /api/chain[?chain=..][&asOf=..]\n" +
                    "GET /health, /metrics\n");
            });
    }

    /**
     * GET /api/snapshot
     */
    public void snapshot(HttpServerExchange exchange) {
        try {
            Set<String> keys = parseKeys(param(exchange, "keys"));
            String asOf = param(exchange, "asOf");

            Map<String, SnapshotRow> rows = asOf != null
                ? snapshotService.latest(keys, parseInstant("asOf", asOf))
                : snapshotService.snapshot(keys,
                    parseInstant("start", required(exchange, "start")),
                    parseInstant("end", required(exchange, "end")));

            Map<String, Object> data = new LinkedHashMap<>();
            for (Map.Entry<String, SnapshotRow> e : rows.entrySet()) {
                data.put(e.getKey(), rowJson(e.getValue()));
            }
            sendJson(exchange, Map.of(JSON_DATA, data));

        } catch (InvalidQueryException e) {
            badRequest(exchange, e.getMessage());
        } catch (TickStorageException e) {
            serverError(exchange, e);
        }
    }

    /**
     * GET /api/range
     */
    public void range(HttpServerExchange exchange) {
        try {
            String key = required(exchange, "key");
            String fieldParam = required(exchange, "field");
            FieldName field = FieldName.parse(fieldParam)
                .orElseThrow(() -> new InvalidQueryException("Unknown field: " + fieldParam));
            TimeWindow window = parseWindow(exchange);

            List<SeriesPoint> points = rangeService.range(key, field, window);

            List<Map<String, Object>> data = new ArrayList<>(points.size());
            for (SeriesPoint p : points) {
                Map<String, Object> point = new LinkedHashMap<>();
                point.put("t", p.timestamp());
                point.put("v", p.value());
                data.add(point);
            }

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("key", key);
            response.put("field", field.name());
            response.put(JSON_DATA, data);
            sendJson(exchange, response);

        } catch (InvalidQueryException e) {
            badRequest(exchange, e.getMessage());
        } catch (TickStorageException e) {
            serverError(exchange, e);
        }
    }

    /**
     * GET /api/chain
     */
    public void chain(HttpServerExchange exchange) {
        try {
            String name = param(exchange, "chain");
            if (name == null) {
                name = chains.defaultChain().orElse(null);
            }
            Optional<InstrumentRegistry> registry = chains.get(name);
            if (name != null && registry.isEmpty()) {
                send(exchange, StatusCodes.NOT_FOUND, Map.of(JSON_ERROR, "Unknown chain: " + name));
                return;
            }
            String asOfParam = param(exchange, "asOf");
            Instant asOf = asOfParam != null ? parseInstant("asOf", asOfParam) : clock.instant();

            List<Map<String, Object>> data = new ArrayList<>();
            for (ChainRow row : chainService.chain(registry.orElse(InstrumentRegistry.empty()), asOf)) {
                Map<String, Object> strike = new LinkedHashMap<>();
                strike.put("strike", row.strike());
                strike.put("CE", sideJson(row.callKey(), row.call()));
                strike.put("PE", sideJson(row.putKey(), row.put()));
                data.add(strike);
            }

            Map<String, Object> response = new LinkedHashMap<>();
            response.put("chain", name != null ? ChainCatalog.chainName(name) : null);
            response.put("asOf", asOf);
            response.put(JSON_DATA, data);
            sendJson(exchange, response);

        } catch (InvalidQueryException e) {
            badRequest(exchange, e.getMessage());
        } catch (TickStorageException e) {
            serverError(exchange, e);
        }
    }

    /**
     * GET /api/chains, in name order; the first is the default for /api/chain.
     */
    public void listChains(HttpServerExchange exchange) {
        List<Map<String, Object>> data = new ArrayList<>(chains.size());
        for (Map.Entry<String, InstrumentRegistry> e : chains.chains().entrySet()) {
            Map<String, Object> chain = new LinkedHashMap<>();
            chain.put("name", e.getKey());
            chain.put("strikes", e.getValue().size());
            chain.put("instruments", e.getValue().subscriptionSet().size());
            data.add(chain);
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("default", chains.defaultChain().orElse(null));
        response.put(JSON_DATA, data);
        sendJson(exchange, response);
    }

    /**
     * GET /health
     */
    public void health(HttpServerExchange exchange) {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("pipeline", pipelineState.get());
        health.put("chains", chains.size());
        health.put("instruments", chains.subscriptionSet().size());
        health.put("time", clock.instant());
        sendJson(exchange, health);
    }

    /**
     * GET /metrics in the exposition format the scraper asks for. Repeated
     * {@code name[]} parameters restrict the output to those families.
     */
    public void metrics(HttpServerExchange exchange, CollectorRegistry metricsRegistry) {
        String contentType = TextFormat.chooseContentType(
            exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        Deque<String> names = exchange.getQueryParameters().get("name[]");
        Set<String> filter = names != null ? new HashSet<>(names) : Set.of();

        StringWriter body = new StringWriter();
        try {
            TextFormat.writeFormat(contentType, body, filter.isEmpty()
                ? metricsRegistry.metricFamilySamples()
                : metricsRegistry.filteredMetricFamilySamples(filter));
        } catch (IOException e) {
            log.error("[METRICS] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
            exchange.getResponseSender().send("Metrics export failed");
            return;
        }
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
        log.debug("[METRICS] Served {} chars as {}", body.getBuffer().length(), contentType);
    }

    private TimeWindow parseWindow(HttpServerExchange exchange) {
        String start = param(exchange, "start");
        String end = param(exchange, "end");
        String minutes = param(exchange, "minutes");
        String date = param(exchange, "date");

        if (start != null || end != null) {
            if (start == null || end == null) {
                throw new InvalidQueryException("Both start and end are required");
            }
            return TimeWindow.between(parseInstant("start", start), parseInstant("end", end));
        }
        if (minutes != null) {
            int n;
            try {
                n = Integer.parseInt(minutes.trim());
            } catch (NumberFormatException e) {
                throw new InvalidQueryException("minutes must be an integer: " + minutes);
            }
            return TimeWindow.lastMinutes(n, date != null ? parseDate(date) : SessionClock.today(clock));
        }
        if (date != null) {
            return TimeWindow.wholeDay(parseDate(date));
        }
        throw new InvalidQueryException("Window required: start/end, minutes[/date] or date");
    }

    private static Map<String, Object> sideJson(String key, SnapshotRow row) {
        if (key == null) {
            return null;
        }
        Map<String, Object> side = row != null ? rowJson(row) : new LinkedHashMap<>();
        side.put("key", key);
        return side;
    }

    private static Map<String, Object> rowJson(SnapshotRow row) {
        Observation o = row.observation();
        Map<String, Object> json = new LinkedHashMap<>();
        json.put("timestamp", o.timestamp());
        json.put("ltp", o.lastPrice());
        json.put("cp", o.prevClose());
        json.put("changePercent", row.changePercent());
        json.put("oi", o.openInterest());
        json.put("iv", o.impliedVol());
        json.put("delta", o.delta());
        json.put("gamma", o.gamma());
        json.put("vega", o.vega());
        json.put("theta", o.theta());
        return json;
    }

    private static Set<String> parseKeys(String raw) {
        Set<String> keys = new LinkedHashSet<>();
        if (raw == null) {
            return keys;
        }
        for (String part : raw.split(",")) {
            String key = part.trim();
            if (!key.isEmpty()) {
                keys.add(key);
            }
        }
        return keys;
    }

    private static Instant parseInstant(String name, String value) {
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidQueryException(name + " must be an ISO-8601 instant: " + value);
        }
    }

    private static LocalDate parseDate(String value) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidQueryException("date must be YYYY-MM-DD: " + value);
        }
    }

    private static String param(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        if (values == null || values.isEmpty() || values.getFirst().isBlank()) {
            return null;
        }
        return values.getFirst();
    }

    private static String required(HttpServerExchange exchange, String name) {
        String value = param(exchange, name);
        if (value == null) {
            throw new InvalidQueryException("Missing parameter: " + name);
        }
        return value;
    }

    private void sendJson(HttpServerExchange exchange, Object data) {
        send(exchange, StatusCodes.OK, data);
    }

    private void badRequest(HttpServerExchange exchange, String message) {
        log.debug("[QUERY] Rejected {}: {}", exchange.getRequestPath(), message);
        send(exchange, StatusCodes.BAD_REQUEST, Map.of(JSON_ERROR, message));
    }

    private void serverError(HttpServerExchange exchange, TickStorageException e) {
        log.error("[QUERY] {} failed: {}", exchange.getRequestPath(), e.getMessage());
        send(exchange, StatusCodes.INTERNAL_SERVER_ERROR, Map.of(JSON_ERROR, "Storage error"));
    }

    private void send(HttpServerExchange exchange, int status, Object body) {
        String json;
        try {
            json = MAPPER.writeValueAsString(body);
        } catch (Exception e) {
            log.error("[QUERY] Failed to serialize response: {}", e.getMessage(), e);
            status = StatusCodes.INTERNAL_SERVER_ERROR;
            json = "{\"error\":\"Serialization failed\"}";
        }
        exchange.setStatusCode(status);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(json, StandardCharsets.UTF_8);
    }
}
