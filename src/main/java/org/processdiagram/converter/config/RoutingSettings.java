package org.processdiagram.converter.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class RoutingSettings {
    /**
     * Distance a self loop keeps from its node.
     */
    public double selfLoopOffset = 20;

    /**
     * Distance a detour keeps from the obstacles it avoids.
     */
    public double clearance = 15;

    /**
     * Candidate paths tried per flow before falling back to a straight line.
     */
    public int maxAttempts = 12;
}
