package com.streamhub.auth;

/**
 * Maps a caller credential to a stable peer id.
 */
public interface PeerIdentityVerifier {

    /**
     * @throws com.streamhub.exception.UnauthorizedException if the credential is missing, invalid or expired
     */
    String verifyCaller(String credential);
}
