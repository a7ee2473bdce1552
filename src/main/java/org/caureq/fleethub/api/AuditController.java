package org.caureq.fleethub.api;

import lombok.RequiredArgsConstructor;
import org.caureq.fleethub.api.dto.AuditEntryDTO;
import org.caureq.fleethub.api.dto.AuditStatsDTO;
import org.caureq.fleethub.api.dto.PageDTO;
import org.caureq.fleethub.service.AuditService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;

@RestController
@RequestMapping("/api/admin/audit")
@RequiredArgsConstructor
public class AuditController {
    private final AuditService audit;

    /** Newest first. All filters are optional. */
    @GetMapping
    public PageDTO<AuditEntryDTO> search(
            @RequestParam(value = "userId", required = false) Long userId,
            @RequestParam(value = "agentId", required = false) String agentId,
            @RequestParam(value = "commandType", required = false) String commandType,
            @RequestParam(value = "status", required = false) String status,
            @RequestParam(value = "page", required = false) Integer page,
            @RequestParam(value = "size", required = false) Integer size) {
        return audit.search(userId, agentId, commandType, status, page, size);
    }

    @GetMapping("/stats")
    public AuditStatsDTO stats(
            @RequestParam(value = "since", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant since) {
        return audit.stats(since);
    }
}
