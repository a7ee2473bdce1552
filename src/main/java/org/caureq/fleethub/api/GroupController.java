package org.caureq.fleethub.api;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.caureq.fleethub.api.dto.BindingRequest;
import org.caureq.fleethub.api.dto.GroupDTO;
import org.caureq.fleethub.api.dto.GroupRequest;
import org.caureq.fleethub.api.dto.MemberRequest;
import org.caureq.fleethub.service.AccessControlService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/** Group administration (superadmin only, enforced by the admin filter). */
@RestController
@RequestMapping("/api/admin/groups")
@RequiredArgsConstructor
public class GroupController {
    private final AccessControlService service;

    @GetMapping
    public List<GroupDTO> list() {
        return service.listGroups();
    }

    @GetMapping("/{groupId}")
    public GroupDTO get(@PathVariable long groupId) {
        return service.getGroup(groupId);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public GroupDTO create(@Valid @RequestBody GroupRequest body) {
        return service.createGroup(body);
    }

    @PutMapping("/{groupId}")
    public GroupDTO update(@PathVariable long groupId, @Valid @RequestBody GroupRequest body) {
        return service.updateGroup(groupId, body);
    }

    @DeleteMapping("/{groupId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable long groupId) {
        service.deleteGroup(groupId);
    }

    @PostMapping("/{groupId}/members")
    public GroupDTO addMember(@PathVariable long groupId, @Valid @RequestBody MemberRequest body) {
        return service.addMember(groupId, body.userId());
    }

    @DeleteMapping("/{groupId}/members/{userId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void removeMember(@PathVariable long groupId, @PathVariable long userId) {
        service.removeMember(groupId, userId);
    }

    @PutMapping("/{groupId}/agents")
    public GroupDTO bind(@PathVariable long groupId, @Valid @RequestBody BindingRequest body) {
        return service.bindAgent(groupId, body.agentId(), body.level());
    }

    @DeleteMapping("/{groupId}/agents/{agentId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void unbind(@PathVariable long groupId, @PathVariable String agentId) {
        service.unbindAgent(groupId, agentId);
    }
}
