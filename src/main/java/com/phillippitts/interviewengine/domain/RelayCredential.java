package com.phillippitts.interviewengine.domain;

import java.time.Instant;
import java.util.List;

/**
 * Time-limited TURN relay credential plus the ICE server list a client should use with it.
 *
 * @param username   {@code "<expiryUnixSeconds>:<identity>"}
 * @param credential base64 HMAC-SHA1 of the username under the shared secret
 * @param ttlSeconds lifetime the credential was issued with
 * @param expiresAt  expiry instant encoded in the username
 * @param validUntil ISO-8601 rendering of {@code expiresAt}
 * @param iceServers STUN and TURN entries for the relay host
 */
public record RelayCredential(
        String username,
        String credential,
        long ttlSeconds,
        Instant expiresAt,
        String validUntil,
        List<IceServer> iceServers
) {

    public RelayCredential {
        iceServers = List.copyOf(iceServers);
    }
}
