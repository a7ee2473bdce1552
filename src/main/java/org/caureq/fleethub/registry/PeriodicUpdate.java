package org.caureq.fleethub.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import org.caureq.fleethub.model.DiskStats;
import org.caureq.fleethub.model.NetworkStats;
import org.caureq.fleethub.model.SystemInfo;
import org.caureq.fleethub.model.UserSession;

import java.util.List;

/** Slow-moving data: disk usage, sessions, interface addresses. */
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public record PeriodicUpdate(List<DiskStats> diskUsage,
                             List<UserSession> userSessions,
                             List<NetworkStats> networkUpdates,
                             SystemInfo systemInfo) {
    public PeriodicUpdate {
        diskUsage = diskUsage == null ? List.of() : diskUsage;
        userSessions = userSessions == null ? List.of() : userSessions;
        networkUpdates = networkUpdates == null ? List.of() : networkUpdates;
    }
}
