package org.caureq.fleethub.gateway;

import org.caureq.fleethub.Json;
import org.caureq.fleethub.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrameDecoderTest {

    private final FrameDecoder decoder = new FrameDecoder(Json.mapper());

    @Test
    void decodesAuthWithHostnameFallback() {
        var frame = decoder.decode("""
                {"type":"auth","payload":{"token":"t","hostname":" web-01 ","os":"linux","extra":1}}
                """);

        assertThat(frame).isInstanceOfSatisfying(InboundFrame.Auth.class, a -> {
            assertThat(a.token()).isEqualTo("t");
            assertThat(a.effectiveId()).isEqualTo("web-01");
        });
    }

    @Test
    void normalizesLegacyFieldNamesInSnapshots() {
        var frame = decoder.decode("""
                {"type":"metrics","payload":{
                  "cpu":{"percent":42.5},
                  "memory":{"total":8000000000,"used":4000000000},
                  "disk":[{"mount":"/","readBytesSec":10}],
                  "network":[{"name":"eth0","bytesRecv":5,"isUp":true}]
                }}""");

        var s = ((InboundFrame.Snapshot) frame).snapshot();
        assertThat(s.cpu().usagePercent()).isEqualTo(42.5);
        assertThat(s.memory().usedPercent()).isEqualTo(50.0);
        assertThat(s.disks()).singleElement().satisfies(d -> {
            assertThat(d.mountPoint()).isEqualTo("/");
            assertThat(d.readBytesPerSec()).isEqualTo(10);
        });
        assertThat(s.networks()).singleElement().satisfies(n -> {
            assertThat(n.iface()).isEqualTo("eth0");
            assertThat(n.rxBytesPerSec()).isEqualTo(5);
            assertThat(n.up()).isTrue();
        });
    }

    @Test
    void aliasAndCanonicalWithSameValueAreAccepted() {
        var frame = decoder.decode("""
                {"type":"metrics","payload":{"cpu":{"usagePercent":10,"percent":10.0}}}""");
        assertThat(((InboundFrame.Snapshot) frame).snapshot().cpu().usagePercent()).isEqualTo(10.0);
    }

    @Test
    void conflictingAliasValuesAreRejected() {
        assertThatThrownBy(() -> decoder.decode("""
                {"type":"metrics","payload":{"cpu":{"usagePercent":10,"percent":20}}}"""))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("metrics.cpu.usagePercent");
    }

    @Test
    void realtimeAliases() {
        var frame = decoder.decode("""
                {"type":"realtime","payload":{"cpuUsage":12.5,"memoryUsed":7,
                  "networkIO":[{"interface":"eth0","rxBytesSec":3}],"gpuUsage":[{"index":0,"percent":80}]}}""");

        var u = ((InboundFrame.Realtime) frame).update();
        assertThat(u.cpuUsage()).isEqualTo(12.5);
        assertThat(u.networkIo()).singleElement().satisfies(n -> assertThat(n.rxBytesPerSec()).isEqualTo(3));
        assertThat(u.gpus()).singleElement().satisfies(g -> assertThat(g.usagePercent()).isEqualTo(80.0));
    }

    @Test
    void heartbeatWithAndWithoutTimestamp() {
        var withTs = decoder.decode("{\"type\":\"heartbeat\",\"payload\":{\"timestamp\":\"2026-01-15T10:00:00Z\"}}");
        assertThat(((InboundFrame.Heartbeat) withTs).sentAt()).isEqualTo(Instant.parse("2026-01-15T10:00:00Z"));

        var bare = decoder.decode("{\"type\":\"heartbeat\"}");
        assertThat(((InboundFrame.Heartbeat) bare).sentAt()).isNull();
    }

    @Test
    void commandResultNeedsId() {
        assertThatThrownBy(() -> decoder.decode("{\"type\":\"command_result\",\"payload\":{\"success\":true}}"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("commandId");

        var ok = decoder.decode("{\"type\":\"command_result\",\"payload\":{\"commandId\":\"c1\",\"success\":false,\"exitCode\":3}}");
        assertThat(ok).isEqualTo(new InboundFrame.CommandResult("c1", false, null, null, 3));
    }

    @Test
    void rejectsMalformedInput() {
        assertThatThrownBy(() -> decoder.decode("{not json")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> decoder.decode("[1,2]")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> decoder.decode("{\"payload\":{}}")).hasMessage("frame without type");
        assertThatThrownBy(() -> decoder.decode("{\"type\":\"bogus\"}")).hasMessage("unknown frame type: bogus");
        assertThatThrownBy(() -> decoder.decode("{\"type\":\"metrics\",\"payload\":5}"))
                .isInstanceOf(ValidationException.class);
    }
}
