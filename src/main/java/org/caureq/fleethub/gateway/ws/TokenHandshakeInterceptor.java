package org.caureq.fleethub.gateway.ws;

import org.springframework.http.HttpHeaders;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Map;

/**
 * Copies the credential ({@code ?token=} or a bearer header) and the peer address into the
 * session attributes. The handshake always proceeds; handlers decide what the token is worth.
 */
@Component
public class TokenHandshakeInterceptor implements HandshakeInterceptor {
    static final String TOKEN_ATTR = "fleethub.token";
    static final String REMOTE_ATTR = "fleethub.remoteAddr";

    @Override
    public boolean beforeHandshake(@NonNull ServerHttpRequest request,
                                   @NonNull ServerHttpResponse response,
                                   @NonNull WebSocketHandler wsHandler,
                                   @NonNull Map<String, Object> attributes) {
        var token = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams().getFirst("token");
        if (token == null) {
            var auth = request.getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
            if (auth != null && auth.regionMatches(true, 0, "Bearer ", 0, 7)) {
                token = auth.substring(7).trim();
            }
        }
        if (token != null && !token.isBlank()) attributes.put(TOKEN_ATTR, token);

        var forwarded = request.getHeaders().getFirst("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            attributes.put(REMOTE_ATTR, forwarded.split(",")[0].trim());
        } else if (request.getRemoteAddress() != null) {
            attributes.put(REMOTE_ATTR, request.getRemoteAddress().getAddress().getHostAddress());
        }
        return true;
    }

    @Override
    public void afterHandshake(@NonNull ServerHttpRequest request,
                               @NonNull ServerHttpResponse response,
                               @NonNull WebSocketHandler wsHandler,
                               @Nullable Exception exception) {
        // nothing to do
    }
}
