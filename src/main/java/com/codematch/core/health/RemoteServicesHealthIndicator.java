package com.codematch.core.health;

import com.codematch.core.config.CodematchProperties;
import com.codematch.core.session.SessionStore;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicator for the verification pipeline.
 * <p>
 * Reports DOWN when either external service has no URL configured, since no upload can
 * then be assembled or verified. Includes the live session count.
 */
@Component("verificationPipelineHealthIndicator")
public class RemoteServicesHealthIndicator implements HealthIndicator {

    private final CodematchProperties properties;
    private final SessionStore sessionStore;

    public RemoteServicesHealthIndicator(CodematchProperties properties, SessionStore sessionStore) {
        this.properties = properties;
        this.sessionStore = sessionStore;
    }

    @Override
    public Health health() {
        var validation = properties.getValidation();
        var matching = properties.getMatching();

        var builder = (validation.isConfigured() && matching.isConfigured()) ? Health.up() : Health.down();
        return builder
                .withDetail("validation.url", validation.isConfigured() ? validation.getUrl() : "not configured")
                .withDetail("matching.url", matching.isConfigured() ? matching.getUrl() : "not configured")
                .withDetail("sessions", sessionStore.size())
                .build();
    }
}
