package org.caureq.fleethub.command;

import org.caureq.fleethub.error.NotFoundException;
import org.caureq.fleethub.gateway.InboundFrame;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PendingCommandsTest {

    private final PendingCommands pending = new PendingCommands();

    private static InboundFrame.CommandResult ok(String id) {
        return new InboundFrame.CommandResult(id, true, "", null, 0);
    }

    @Test
    void completesOnlyFromTheOwningAgent() {
        var f = pending.register("c1", "web-01");

        assertThat(pending.complete("web-02", ok("c1"))).isFalse();
        assertThat(f).isNotDone();
        assertThat(pending.complete("web-01", ok("c1"))).isTrue();
        assertThat(f).isCompleted();
        assertThat(pending.size()).isZero();
    }

    @Test
    void lateRepliesAreIgnored() {
        pending.register("c1", "web-01");
        pending.forget("c1");

        assertThat(pending.complete("web-01", ok("c1"))).isFalse();
    }

    @Test
    void duplicateIdsAreRefused() {
        pending.register("c1", "web-01");
        assertThatThrownBy(() -> pending.register("c1", "web-01")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failAllOnlyTouchesThatAgent() {
        var mine = pending.register("c1", "web-01");
        var other = pending.register("c2", "web-02");

        assertThat(pending.failAll("web-01", "lost")).isEqualTo(1);
        assertThatThrownBy(mine::get).isInstanceOf(ExecutionException.class).hasCauseInstanceOf(NotFoundException.class);
        assertThat(other).isNotDone();
    }
}
