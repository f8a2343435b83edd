package com.connection.harness.health;

/**
 * A named check of one harness component.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
