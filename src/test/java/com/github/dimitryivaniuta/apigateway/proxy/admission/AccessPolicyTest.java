package com.github.dimitryivaniuta.apigateway.proxy.admission;

import com.github.dimitryivaniuta.apigateway.proxy.GatewayProperties;
import com.github.dimitryivaniuta.apigateway.proxy.auth.AuthenticatedPrincipal;
import com.github.dimitryivaniuta.apigateway.proxy.error.ForbiddenException;
import com.github.dimitryivaniuta.apigateway.proxy.ratelimit.RateLimitTier;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AccessPolicyTest {

    private final AccessPolicy policy = new AccessPolicy(new GatewayProperties());

    private static AuthenticatedPrincipal principal(String subject, String... roles) {
        return new AuthenticatedPrincipal(subject, RateLimitTier.STANDARD, Set.of(roles), null);
    }

    @Test
    void adminPaths_shouldRequireAdminRole() {
        assertThatCode(() -> policy.check(principal("1", "admin"), "/api/admin/stats")).doesNotThrowAnyException();
        assertThatThrownBy(() -> policy.check(principal("1", "user"), "/api/admin/stats"))
                .isInstanceOf(ForbiddenException.class)
                .hasMessage("Insufficient permissions");
    }

    @Test
    void userPaths_shouldRequireUserOrAdmin() {
        assertThatCode(() -> policy.check(principal("1", "user"), "/api/user")).doesNotThrowAnyException();
        assertThatThrownBy(() -> policy.check(principal("1", "guest"), "/api/user"))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void ownerScopedPaths_shouldOnlyAdmitOwner() {
        assertThatCode(() -> policy.check(principal("42", "user"), "/api/user/42/orders")).doesNotThrowAnyException();
        assertThatThrownBy(() -> policy.check(principal("42", "user"), "/api/user/43"))
                .isInstanceOf(ForbiddenException.class)
                .hasMessageContaining("ownership");
    }

    @Test
    void rulePrefix_shouldOnlyGovernWholeSegments() {
        assertThatCode(() -> policy.check(principal("1", "guest"), "/api/users/list")).doesNotThrowAnyException();
        assertThatCode(() -> policy.check(principal("1", "guest"), "/api/administrators")).doesNotThrowAnyException();
        assertThatThrownBy(() -> policy.check(principal("1", "guest"), "/api/admin"))
                .isInstanceOf(ForbiddenException.class);
    }

    @Test
    void rulePrefixWithTrailingSlash_shouldStillCoverItsRoot() {
        GatewayProperties props = new GatewayProperties();
        props.getAccess().getRules().clear();
        props.getAccess().getRules().add(new GatewayProperties.AccessRule("/api/reports/", List.of("analyst")));
        AccessPolicy slashed = new AccessPolicy(props);

        assertThatThrownBy(() -> slashed.check(principal("1", "user"), "/api/reports"))
                .isInstanceOf(ForbiddenException.class);
        assertThatCode(() -> slashed.check(principal("1", "user"), "/api/reportsx")).doesNotThrowAnyException();
    }

    @Test
    void unruledPaths_shouldBeOpenToAnyCaller() {
        assertThatCode(() -> policy.check(AuthenticatedPrincipal.anonymous(), "/api/public/info")).doesNotThrowAnyException();
        assertThatCode(() -> policy.check(principal("1"), "/api/order/1")).doesNotThrowAnyException();
    }
}
