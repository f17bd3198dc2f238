package banksia.adapter.out.telemetry;

import java.util.Locale;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import banksia.core.model.oauth.OAuth2ErrorCode;
import banksia.core.port.out.OAuth2Metrics;

/**
 * Micrometer metrics for the authorization server.
 *
 * <p>Records metrics for:
 * <ul>
 *   <li>{@code banksia.oauth2.tokens.issued} - Successful grants by flow</li>
 *   <li>{@code banksia.oauth2.errors} - Protocol errors by endpoint and error code</li>
 *   <li>{@code banksia.oauth2.code.replays} - Replayed authorization codes</li>
 *   <li>{@code banksia.oauth2.bearer.rejected} - Rejected bearer tokens by reason</li>
 * </ul>
 */
@ApplicationScoped
public class MicrometerOAuth2Metrics implements OAuth2Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public MicrometerOAuth2Metrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.enabled() && config.metrics().enabled();
    }

    /**
     * Check if metrics recording is enabled.
     *
     * @return true if metrics are enabled
     */
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordIssued(String flow) {
        if (!enabled) {
            return;
        }

        Counter.builder("banksia.oauth2.tokens.issued")
                .description("Successful OAuth2 grants")
                .tag("grant_type", nullSafe(flow))
                .register(registry)
                .increment();
    }

    @Override
    public void recordError(String endpoint, OAuth2ErrorCode code) {
        if (!enabled) {
            return;
        }

        Counter.builder("banksia.oauth2.errors")
                .description("OAuth2 protocol errors returned to clients")
                .tag("endpoint", nullSafe(endpoint))
                .tag("error", code == null ? "unknown" : code.code())
                .register(registry)
                .increment();
    }

    @Override
    public void recordCodeReplay() {
        if (!enabled) {
            return;
        }

        Counter.builder("banksia.oauth2.code.replays")
                .description("Authorization codes presented more than once")
                .register(registry)
                .increment();
    }

    @Override
    public void recordBearerRejected(String reason) {
        if (!enabled) {
            return;
        }

        Counter.builder("banksia.oauth2.bearer.rejected")
                .description("Bearer tokens rejected by protected resources")
                .tag("reason", nullSafe(reason).toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
