package com.yuzhi.studyhub.platform.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "studyhub.platform.security")
public class TokenProperties {

    /** Shared HS256 secret the identity provider signs bearer tokens and download links with. */
    private String jwtSecret;

    public String getJwtSecret() {
        return jwtSecret;
    }

    public void setJwtSecret(String jwtSecret) {
        this.jwtSecret = jwtSecret;
    }
}
