package com.nursery.service;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.nursery.config.NurseryProperties;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies stateless HS256 bearer tokens.
 * <p>
 * A token carries the username as {@code sub} and an {@code exp} of issue time plus the
 * configured TTL. Nothing is stored server side, so a token stays valid until it expires.
 */
@Service
public class TokenService {

    private static final int MIN_SECRET_BYTES = 32;

    private final JWSSigner signer;
    private final JWSVerifier verifier;
    private final Duration ttl;
    private final Clock clock;

    public TokenService(NurseryProperties properties, Clock clock) {
        String secret = properties.getSecurity().getTokenSecret();
        if (!StringUtils.hasText(secret) || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                "nursery.security.token-secret must be set to at least " + MIN_SECRET_BYTES + " bytes");
        }
        byte[] key = secret.getBytes(StandardCharsets.UTF_8);
        try {
            this.signer = new MACSigner(key);
            this.verifier = new MACVerifier(key);
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to initialise token signing key", e);
        }
        this.ttl = properties.getSecurity().getTokenTtl();
        this.clock = clock;
    }

    public String issueToken(String username) {
        Instant now = clock.instant();
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
            .subject(username)
            .issueTime(Date.from(now))
            .expirationTime(Date.from(now.plus(ttl)))
            .build();

        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.HS256), claims);
        try {
            jwt.sign(signer);
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to sign access token", e);
        }
        return jwt.serialize();
    }

    /**
     * @return the username the token was issued to
     * @throws TokenVerificationException {@code TokenExpired} once past {@code exp},
     *         {@code TokenInvalid} for a malformed, foreign or subject-less token
     */
    public String verifyToken(String token) {
        SignedJWT jwt;
        JWTClaimsSet claims;
        try {
            jwt = SignedJWT.parse(token);
            claims = jwt.getJWTClaimsSet();
        } catch (ParseException e) {
            throw TokenVerificationException.invalid(e);
        }

        if (!JWSAlgorithm.HS256.equals(jwt.getHeader().getAlgorithm())) {
            throw TokenVerificationException.invalid();
        }
        try {
            if (!jwt.verify(verifier)) {
                throw TokenVerificationException.invalid();
            }
        } catch (JOSEException e) {
            throw TokenVerificationException.invalid(e);
        }

        Date expiry = claims.getExpirationTime();
        if (expiry != null && !clock.instant().isBefore(expiry.toInstant())) {
            throw TokenVerificationException.expired();
        }

        String subject = claims.getSubject();
        if (!StringUtils.hasText(subject)) {
            throw TokenVerificationException.invalid();
        }
        return subject;
    }
}
