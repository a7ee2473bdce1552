package org.caureq.fleethub.api;

import lombok.RequiredArgsConstructor;
import org.caureq.fleethub.api.dto.HealthDTO;
import org.caureq.fleethub.gateway.EventBus;
import org.caureq.fleethub.registry.AgentRegistry;
import org.caureq.fleethub.service.StorageHealth;
import org.caureq.fleethub.storage.TimeSeriesStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/** Liveness. Always UP while the process serves requests; storage trouble is reported, not fatal. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class HealthController {
    private final AgentRegistry registry;
    private final EventBus bus;
    private final TimeSeriesStore store;
    private final StorageHealth storage;
    private final Clock clock;

    @GetMapping("/health")
    public HealthDTO health() {
        var last = storage.lastFailure();
        return new HealthDTO("UP", clock.instant(), registry.connectedCount(), bus.subscriberCount(),
                store.name(), storage.degraded(), storage.failures(),
                last == null ? null : last.backend() + ": " + last.message());
    }
}
