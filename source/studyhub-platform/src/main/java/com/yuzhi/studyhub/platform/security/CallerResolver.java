package com.yuzhi.studyhub.platform.security;

import com.yuzhi.studyhub.common.error.InvalidTokenException;
import com.yuzhi.studyhub.common.security.Caller;
import com.yuzhi.studyhub.common.security.GrantClaimsParser;
import java.util.Optional;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;

/**
 * Builds the request's {@link Caller} from the verified bearer token in the security context.
 */
@Component
public class CallerResolver {

    private final GrantClaimsParser grantClaimsParser;

    public CallerResolver(GrantClaimsParser grantClaimsParser) {
        this.grantClaimsParser = grantClaimsParser;
    }

    public Optional<Caller> currentCaller() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication instanceof JwtAuthenticationToken token && token.isAuthenticated()) {
            return Optional.of(fromJwt(token.getToken()));
        }
        return Optional.empty();
    }

    public Caller requireCurrentCaller() {
        return currentCaller().orElseThrow(() -> new InvalidTokenException("Unauthorized"));
    }

    public Caller fromJwt(Jwt jwt) {
        return grantClaimsParser.parse(jwt.getClaims());
    }
}
