package banksia.adapter.out.telemetry;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for telemetry features.
 *
 * <p>Metrics are disabled by default. Example configuration:
 * <pre>{@code
 * banksia.telemetry.enabled=true
 * banksia.telemetry.metrics.enabled=true
 * }</pre>
 */
@ConfigMapping(prefix = "banksia.telemetry")
public interface TelemetryConfig {

    /**
     * Master toggle for all telemetry features.
     * When disabled, all sub-features are also disabled regardless of their individual settings.
     */
    @WithDefault("false")
    boolean enabled();

    /**
     * Metrics configuration for Micrometer metrics collection.
     */
    MetricsConfig metrics();

    interface MetricsConfig {
        /**
         * Enable Micrometer metrics.
         * Requires banksia.telemetry.enabled=true to take effect.
         */
        @WithDefault("false")
        boolean enabled();
    }
}
