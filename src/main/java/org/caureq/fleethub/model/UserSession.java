package org.caureq.fleethub.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record UserSession(String username, String tty, long loginTime, String remoteHost, long idleSeconds) {
}
