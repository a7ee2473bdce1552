package org.caureq.fleethub.api.dto;

import java.util.List;

public record PageDTO<T>(List<T> items, int page, int size, long total) {}
