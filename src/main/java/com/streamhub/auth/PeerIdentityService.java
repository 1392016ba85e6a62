package com.streamhub.auth;

import com.streamhub.config.StreamHubProperties;
import com.streamhub.exception.UnauthorizedException;
import java.util.UUID;
import org.springframework.stereotype.Service;

/**
 * Resolves the peer id of a subscriber or sender.
 *
 * <p>Public market rooms admit callers without a credential under a synthesized
 * {@code anon-<uuid>} peer id. A credential, when presented, is always verified.
 */
@Service
public class PeerIdentityService {

    public static final String ANONYMOUS_PREFIX = "anon-";

    private final PeerIdentityVerifier peerIdentityVerifier;
    private final StreamHubProperties properties;

    public PeerIdentityService(PeerIdentityVerifier peerIdentityVerifier, StreamHubProperties properties) {
        this.peerIdentityVerifier = peerIdentityVerifier;
        this.properties = properties;
    }

    /**
     * @throws UnauthorizedException if the room requires a credential and none or an invalid one was given
     */
    public String resolvePeerId(String roomId, String credential) {
        if (credential != null && !credential.isBlank()) {
            return peerIdentityVerifier.verifyCaller(credential);
        }
        if (allowsAnonymous(roomId)) {
            return ANONYMOUS_PREFIX + UUID.randomUUID();
        }
        throw UnauthorizedException.tokenRequired(roomId);
    }

    /** Verifies a credential without any anonymous fallback. */
    public String requirePeerId(String credential) {
        return peerIdentityVerifier.verifyCaller(credential);
    }

    public boolean allowsAnonymous(String roomId) {
        return roomId != null
                && properties.getSse().getAnonymousRoomPrefixes().stream().anyMatch(roomId::startsWith);
    }

    /**
     * Extracts the token from a {@code Bearer} header, falling back to the query parameter
     * (EventSource cannot set headers).
     */
    public static String extractCredential(String authorizationHeader, String tokenParam) {
        if (authorizationHeader != null && authorizationHeader.startsWith("Bearer ")) {
            return authorizationHeader.substring("Bearer ".length()).trim();
        }
        return tokenParam;
    }
}
