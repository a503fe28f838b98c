package com.github.dimitryivaniuta.apigateway.proxy.admission;

import com.github.dimitryivaniuta.apigateway.proxy.auth.AuthenticatedPrincipal;
import com.github.dimitryivaniuta.apigateway.proxy.ratelimit.ClientIdentity;
import org.springframework.stereotype.Component;

/** Rate-limit key: the subject of an authenticated caller, else its normalized source address. */
@Component
public class ClientIdentityResolver {

    public ClientIdentity resolve(AuthenticatedPrincipal principal, String clientIp) {
        if (principal != null && !principal.isAnonymous()) {
            return ClientIdentity.user(principal.subject());
        }
        return ClientIdentity.ip(clientIp);
    }
}
