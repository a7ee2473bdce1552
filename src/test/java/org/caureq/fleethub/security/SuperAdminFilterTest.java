package org.caureq.fleethub.security;

import org.caureq.fleethub.permission.PermissionResolver;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SuperAdminFilterTest {

    private final PermissionResolver resolver = mock(PermissionResolver.class);
    private final SuperAdminFilter filter = new SuperAdminFilter(resolver);

    private static MockHttpServletRequest as(AuthenticatedUser user) {
        var req = new MockHttpServletRequest("GET", "/api/admin/users");
        if (user != null) req.setAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE, user);
        return req;
    }

    @Test
    void superAdminPasses() throws Exception {
        when(resolver.isSuperAdmin(1)).thenReturn(true);
        var chain = new MockFilterChain();

        filter.doFilter(as(new AuthenticatedUser(1, "root")), new MockHttpServletResponse(), chain);

        assertThat(chain.getRequest()).isNotNull();
    }

    @Test
    void regularUserIsForbidden() throws Exception {
        var res = new MockHttpServletResponse();
        var chain = new MockFilterChain();

        filter.doFilter(as(new AuthenticatedUser(2, "alice")), res, chain);

        assertThat(res.getStatus()).isEqualTo(403);
        assertThat(res.getContentAsString()).contains("PERMISSION_DENIED");
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void anonymousIsUnauthorized() throws Exception {
        var res = new MockHttpServletResponse();
        filter.doFilter(as(null), res, new MockFilterChain());
        assertThat(res.getStatus()).isEqualTo(401);
    }
}
