package com.phillippitts.affectsignal.service.health;

import com.phillippitts.affectsignal.config.properties.InferenceProperties;
import com.phillippitts.affectsignal.service.pipeline.SessionRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether real inference is available.
 *
 * <ul>
 *   <li>UP: an API key is configured</li>
 *   <li>DEGRADED: no API key; every capture resolves to a synthetic vector</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health.
 */
@Component
public class InferenceHealthIndicator implements HealthIndicator {

    private final InferenceProperties props;
    private final SessionRegistry sessions;

    public InferenceHealthIndicator(InferenceProperties props, SessionRegistry sessions) {
        this.props = props;
        this.sessions = sessions;
    }

    @Override
    public Health health() {
        Health.Builder builder = props.hasApiKey()
                ? Health.up().withDetail("status", "Remote inference configured")
                : Health.status("DEGRADED").withDetail("status", "No API key; synthetic vectors only");
        return builder
                .withDetail("baseUrl", props.getBaseUrl())
                .withDetail("openSessions", sessions.openCount())
                .build();
    }
}
