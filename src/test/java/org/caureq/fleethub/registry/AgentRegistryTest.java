package org.caureq.fleethub.registry;

import org.caureq.fleethub.Snapshots;
import org.caureq.fleethub.error.ConflictException;
import org.caureq.fleethub.model.Agent;
import org.caureq.fleethub.model.MemoryStats;
import org.caureq.fleethub.model.TransportKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentRegistryTest {

    private final AgentRegistry registry = new AgentRegistry();

    private static Agent agent(String id, String conn, Instant heartbeat) {
        return Agent.builder().id(id).hostname(id).transport(TransportKind.WEBSOCKET)
                .connectionId(conn).connectedAt(heartbeat).lastHeartbeat(heartbeat).build();
    }

    @Test
    void latestAndSummaryForSingleAgent() {
        registry.registerAgent(agent("web-01", "c1", Snapshots.T0));
        registry.updateSnapshot(Snapshots.web01());

        assertThat(registry.latest("web-01")).contains(Snapshots.web01());
        var summary = registry.summary();
        assertThat(summary.agentCount()).isEqualTo(1);
        assertThat(summary.reportingAgents()).isEqualTo(1);
        assertThat(summary.avgCpuPercent()).isEqualTo(42.5);
        assertThat(summary.memoryPercent()).isEqualTo(50.0);
    }

    @Test
    void duplicateRegistrationIsAConflict() {
        registry.registerAgent(agent("web-01", "c1", Snapshots.T0));

        assertThatThrownBy(() -> registry.registerAgent(agent("web-01", "c2", Snapshots.T0)))
                .isInstanceOf(ConflictException.class);
        assertThat(registry.agent("web-01").orElseThrow().connectionId()).isEqualTo("c1");
    }

    @Test
    void unregisterRemovesAgentAndItsSnapshot() {
        registry.registerAgent(agent("web-01", "c1", Snapshots.T0));
        registry.updateSnapshot(Snapshots.web01());

        assertThat(registry.unregisterAgent("web-01", "c1")).isPresent();
        assertThat(registry.allLatest()).isEmpty();
        assertThat(registry.connectedCount()).isZero();
    }

    @Test
    void unregisterIgnoresStaleConnectionAndUnknownIds() {
        registry.registerAgent(agent("web-01", "c2", Snapshots.T0));

        assertThat(registry.unregisterAgent("web-01", "c1")).isEmpty();
        assertThat(registry.unregisterAgent("nope", null)).isEmpty();
        assertThat(registry.agent("web-01")).isPresent();
    }

    @Test
    void findStaleUsesStrictCutoff() {
        registry.registerAgent(agent("old", "c1", Snapshots.T0));
        registry.registerAgent(agent("fresh", "c2", Snapshots.T0.plusSeconds(100)));

        assertThat(registry.findStale(Snapshots.T0.plusSeconds(50))).extracting(Agent::id).containsExactly("old");
        assertThat(registry.findStale(Snapshots.T0)).isEmpty();
    }

    @Test
    void touchRefreshesHeartbeat() {
        registry.registerAgent(agent("web-01", "c1", Snapshots.T0));
        registry.touch("web-01", Snapshots.T0.plusSeconds(200));

        assertThat(registry.findStale(Snapshots.T0.plusSeconds(100))).isEmpty();
    }

    @Test
    void summarizeRestrictsToGivenIds() {
        registry.updateSnapshot(Snapshots.of("a", Snapshots.T0, 10, 1, 4));
        registry.updateSnapshot(Snapshots.of("b", Snapshots.T0, 30, 3, 4));

        var onlyA = registry.summarize(Set.of("a"));
        assertThat(onlyA.agentCount()).isEqualTo(1);
        assertThat(onlyA.avgCpuPercent()).isEqualTo(10.0);
        assertThat(registry.summary().avgCpuPercent()).isEqualTo(20.0);
        assertThat(registry.summary().memoryPercent()).isEqualTo(50.0);
    }

    @Test
    void agentWithoutSnapshotCountsButDoesNotReport() {
        registry.registerAgent(agent("quiet", "c1", Snapshots.T0));
        var s = registry.summary();
        assertThat(s.agentCount()).isEqualTo(1);
        assertThat(s.reportingAgents()).isZero();
        assertThat(s.avgCpuPercent()).isZero();
    }

    @Test
    void inventoryOnlyAgentIsNotReporting() {
        registry.registerAgent(agent("web-01", "c1", Snapshots.T0));
        registry.registerAgent(agent("db-02", "c2", Snapshots.T0));
        registry.updateSnapshot(Snapshots.web01());
        registry.mergeStatic("db-02", StaticUpdate.builder()
                .memory(MemoryStats.builder().total(16_000_000_000L).build())
                .build(), Snapshots.T0);

        var s = registry.summary();
        assertThat(s.agentCount()).isEqualTo(2);
        assertThat(s.reportingAgents()).isEqualTo(1);
        assertThat(s.avgCpuPercent()).isEqualTo(42.5);
        assertThat(s.memoryPercent()).isEqualTo(50.0);
        assertThat(registry.latest("db-02")).isEmpty();
        assertThat(registry.allLatest()).containsOnlyKeys("web-01");
    }

    @Test
    void realtimeMergeKeepsStaticFields() {
        registry.mergeStatic("web-01", StaticUpdate.builder()
                .memory(Snapshots.web01().memory())
                .cpu(Snapshots.web01().cpu().withModel("Xeon"))
                .build(), Snapshots.T0);

        var merged = registry.mergeRealtime("web-01", RealtimeUpdate.builder()
                .cpuUsage(77.0).memoryUsed(2_000_000_000L).build(), Snapshots.T0.plusSeconds(1));

        assertThat(merged.timestamp()).isEqualTo(Snapshots.T0.plusSeconds(1));
        assertThat(merged.cpu().model()).isEqualTo("Xeon");
        assertThat(merged.cpu().usagePercent()).isEqualTo(77.0);
        assertThat(merged.memory().usedPercent()).isEqualTo(25.0);
        assertThat(registry.latest("web-01")).contains(merged);
    }

    @Test
    void allLatestIsSortedCopy() {
        registry.updateSnapshot(Snapshots.of("b", Snapshots.T0, 1, 1, 2));
        registry.updateSnapshot(Snapshots.of("a", Snapshots.T0, 1, 1, 2));

        var all = registry.allLatest();
        assertThat(all.keySet()).containsExactly("a", "b");
        all.clear();
        assertThat(registry.allLatest()).hasSize(2);
    }
}
