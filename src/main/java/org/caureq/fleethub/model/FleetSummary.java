package org.caureq.fleethub.model;

/**
 * Fleet-wide aggregate. {@code agentCount} counts every known agent; the averages only cover
 * agents that already reported a snapshot ({@code reportingAgents}).
 */
public record FleetSummary(int agentCount,
                           int reportingAgents,
                           double avgCpuPercent,
                           double memoryPercent,
                           long totalMemory,
                           long usedMemory) {
}
