package org.caureq.fleethub.api.dto;

import java.time.Instant;
import java.util.List;

public record GroupDTO(Long id, String name, String description, Instant createdAt,
                       List<MemberDTO> members, List<BindingDTO> agents) {}
