package com.streamhub.auth;

import com.streamhub.exception.UnauthorizedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Verifies HS256 JWTs issued by the account service. The token subject is the peer id.
 *
 * <p>The secret comes from {@code streamhub.auth.jwt-secret} and must be at least 32 bytes.
 */
@Service
public class JwtPeerIdentityVerifier implements PeerIdentityVerifier {

    private static final Logger log = LoggerFactory.getLogger(JwtPeerIdentityVerifier.class);

    private final SecretKey secretKey;
    private final Clock clock;

    public JwtPeerIdentityVerifier(@Value("${streamhub.auth.jwt-secret}") String jwtSecret, Clock clock) {
        this.secretKey = new SecretKeySpec(jwtSecret.getBytes(StandardCharsets.UTF_8), "HmacSHA256");
        this.clock = clock;
    }

    @Override
    public String verifyCaller(String credential) {
        if (credential == null || credential.isBlank()) {
            throw new UnauthorizedException("Missing credential");
        }
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(credential)
                    .getPayload();
            String peerId = claims.getSubject();
            if (peerId == null || peerId.isBlank()) {
                throw new UnauthorizedException("Token has no subject");
            }
            return peerId;
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("JWT validation failed: {}", e.getMessage());
            throw new UnauthorizedException("Invalid or expired token", e);
        }
    }

    /**
     * Signs a token for the given peer. Used by tooling and tests; production tokens come from
     * the account service.
     */
    public String issueToken(String peerId, Duration validity) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(peerId)
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(validity)))
                .signWith(secretKey)
                .compact();
    }
}
