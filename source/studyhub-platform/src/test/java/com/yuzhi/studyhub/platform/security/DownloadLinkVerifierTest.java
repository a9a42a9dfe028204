package com.yuzhi.studyhub.platform.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yuzhi.studyhub.common.error.InvalidTokenException;
import com.yuzhi.studyhub.common.security.Caller;
import com.yuzhi.studyhub.common.security.GrantClaimsParser;
import com.yuzhi.studyhub.common.security.GrantMergePolicy;
import com.yuzhi.studyhub.common.security.StudyGrant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtDecoder;

@ExtendWith(MockitoExtension.class)
class DownloadLinkVerifierTest {

    @Mock
    private JwtDecoder jwtDecoder;

    private DownloadLinkVerifier verifier;

    @BeforeEach
    void setUp() {
        CallerResolver callerResolver = new CallerResolver(new GrantClaimsParser(new ObjectMapper(), GrantMergePolicy.INDEPENDENT));
        verifier = new DownloadLinkVerifier(jwtDecoder, callerResolver);
    }

    @Test
    void validLinkTokenYieldsCaller() {
        Jwt jwt = Jwt
            .withTokenValue("link")
            .header("alg", "HS256")
            .claim("userId", "u-9")
            .claim("studyAccess", List.of(Map.of("studyId", "A", "role", "VIEWER")))
            .build();
        when(jwtDecoder.decode("link")).thenReturn(jwt);

        Caller caller = verifier.verify("link");

        assertThat(caller.id()).isEqualTo("u-9");
        assertThat(caller.grants()).containsExactly(StudyGrant.viewer("A"));
    }

    @Test
    void badSignatureIsInvalidToken() {
        when(jwtDecoder.decode("forged")).thenThrow(new BadJwtException("Signed JWT rejected"));

        assertThatThrownBy(() -> verifier.verify("forged"))
            .isInstanceOf(InvalidTokenException.class)
            .hasMessage("Invalid token")
            .hasCauseInstanceOf(BadJwtException.class);
    }

    @Test
    void missingTokenIsUnauthorized() {
        assertThatThrownBy(() -> verifier.verify(null)).isInstanceOf(InvalidTokenException.class).hasMessage("Unauthorized");
        assertThatThrownBy(() -> verifier.verify("")).isInstanceOf(InvalidTokenException.class);
        verifyNoInteractions(jwtDecoder);
    }
}
