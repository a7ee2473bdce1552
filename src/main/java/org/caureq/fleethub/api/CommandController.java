package org.caureq.fleethub.api;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.fleethub.command.CommandDispatcher;
import org.caureq.fleethub.command.CommandRequest;
import org.caureq.fleethub.command.CommandResult;
import org.caureq.fleethub.security.AuthenticatedUser;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class CommandController {
    private final CommandDispatcher dispatcher;

    /**
     * Runs a command on the agent and waits for its answer. An agent-side failure is a normal
     * response with {@code success=false}; no answer in time is a 504.
     */
    @PostMapping("/agents/{id}/commands")
    public CommandResult submit(@RequestAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE) AuthenticatedUser user,
                                @PathVariable String id,
                                @Valid @RequestBody CommandRequest body,
                                @RequestHeader(value = "X-Elevated-Token", required = false) String elevatedToken,
                                HttpServletRequest req) {
        return dispatcher.dispatch(user, req.getRemoteAddr(), id, body, elevatedToken);
    }
}
