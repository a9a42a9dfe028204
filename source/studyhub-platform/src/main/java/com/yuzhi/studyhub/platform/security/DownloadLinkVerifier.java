package com.yuzhi.studyhub.platform.security;

import com.yuzhi.studyhub.common.error.InvalidTokenException;
import com.yuzhi.studyhub.common.security.Caller;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;

/**
 * Rebuilds a caller from a signed link token passed as a query parameter, so a browser can
 * download a dataset file without setting an Authorization header. The token carries the same
 * claims as a bearer token and is checked by the same decoder.
 */
@Component
public class DownloadLinkVerifier {

    private static final Logger log = LoggerFactory.getLogger(DownloadLinkVerifier.class);

    private final JwtDecoder jwtDecoder;
    private final CallerResolver callerResolver;

    public DownloadLinkVerifier(JwtDecoder jwtDecoder, CallerResolver callerResolver) {
        this.jwtDecoder = jwtDecoder;
        this.callerResolver = callerResolver;
    }

    public Caller verify(String token) {
        if (StringUtils.isBlank(token)) {
            throw new InvalidTokenException("Unauthorized");
        }
        Jwt jwt;
        try {
            jwt = jwtDecoder.decode(token);
        } catch (JwtException ex) {
            log.warn("Rejected download link token: {}", ex.getMessage());
            throw new InvalidTokenException("Invalid token", ex);
        }
        return callerResolver.fromJwt(jwt);
    }
}
