package com.rostermate.backend.modules.assignment.application;

import java.time.Duration;

import com.rostermate.backend.modules.assignment.domain.ReassignmentPolicy;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "rostermate.assignment")
public record AssignmentProperties(
        Duration storeTimeout,
        ReassignmentPolicy reassignmentPolicy
) {

    public AssignmentProperties {
        if (storeTimeout == null || storeTimeout.isNegative() || storeTimeout.isZero()) {
            storeTimeout = Duration.ofSeconds(5);
        }
        if (reassignmentPolicy == null) {
            reassignmentPolicy = ReassignmentPolicy.REQUIRE_UNASSIGN;
        }
    }

    public int storeTimeoutSeconds() {
        return (int) Math.max(1, storeTimeout.toSeconds());
    }
}
