package in.questkeeper.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Serves GET /metrics in the Prometheus text format.
 *
 * Honours the Accept header (plain 0.0.4 or OpenMetrics) and an optional
 * repeated {@code name[]} query parameter restricting the families written:
 * <pre>
 * GET /metrics?name[]=questkeeper_exports_total
 * # HELP questkeeper_exports_total Encounter exports by format and outcome
 * # TYPE questkeeper_exports_total counter
 * questkeeper_exports_total{format="json",outcome="success"} 12.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        String contentType = TextFormat.chooseContentType(exchange.getRequestHeaders().getFirst(Headers.ACCEPT));
        Set<String> names = requestedNames(exchange);

        StringWriter body = new StringWriter();
        try {
            TextFormat.writeFormat(contentType, body, registry.filteredMetricFamilySamples(names));
        } catch (IOException e) {
            log.error("Failed to render metrics", e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("Failed to render metrics");
            return;
        }

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, contentType);
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseSender().send(body.toString());
    }

    // Empty set means every family.
    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get("name[]");
        return values == null ? Set.of() : new HashSet<>(values);
    }
}
