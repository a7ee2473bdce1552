package org.caureq.fleethub.api;

import lombok.RequiredArgsConstructor;
import org.caureq.fleethub.api.dto.AgentDTO;
import org.caureq.fleethub.security.AuthenticatedUser;
import org.caureq.fleethub.service.AgentQueryService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/** Connected agents, filtered to what the caller may see. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class AgentController {
    private final AgentQueryService service;

    @GetMapping("/agents")
    public List<AgentDTO> list(@RequestAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE) AuthenticatedUser user) {
        return service.list(user);
    }

    /** 404 both for unknown agents and for agents the caller cannot see. */
    @GetMapping("/agents/{id}")
    public AgentDTO get(@RequestAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE) AuthenticatedUser user,
                        @PathVariable String id) {
        return service.get(user, id);
    }
}
