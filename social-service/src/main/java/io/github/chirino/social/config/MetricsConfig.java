package io.github.chirino.social.config;

import io.github.chirino.social.service.SocialOperations;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;

/**
 * Meter filters for the social endpoints and engine timers ({@code social_operation_seconds_*}).
 */
@ApplicationScoped
public class MetricsConfig {

    /** Upper bound on distinct {@code operation} tag values; the verb set is closed. */
    static final int MAX_OPERATION_TAGS = 64;

    @ConfigProperty(name = "quarkus.application.name", defaultValue = "social-service")
    String applicationName = "social-service";

    @Produces
    @Singleton
    public MeterFilter commonTags() {
        return MeterFilter.commonTags(Tags.of("application", applicationName));
    }

    @Produces
    @Singleton
    public MeterFilter operationTagLimit() {
        return MeterFilter.maximumAllowableTags(
                SocialOperations.TIMER_NAME, "operation", MAX_OPERATION_TAGS, MeterFilter.deny());
    }

    @Produces
    @Singleton
    public MeterFilter latencyDistribution() {
        return new MeterFilter() {
            @Override
            public DistributionStatisticConfig configure(
                    Meter.Id id, DistributionStatisticConfig config) {
                if (!isTimed(id.getName())) {
                    return config;
                }
                return DistributionStatisticConfig.builder()
                        .percentilesHistogram(true)
                        .percentiles(0.5, 0.95, 0.99)
                        .build()
                        .merge(config);
            }
        };
    }

    static boolean isTimed(String meterName) {
        return meterName.equals(SocialOperations.TIMER_NAME)
                || meterName.startsWith("http.server.requests");
    }
}
