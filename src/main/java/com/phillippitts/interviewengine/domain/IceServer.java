package com.phillippitts.interviewengine.domain;

import java.util.List;

/**
 * One WebRTC ICE server entry. STUN entries carry no credentials.
 */
public record IceServer(List<String> urls, String username, String credential) {

    public IceServer {
        urls = List.copyOf(urls);
    }

    public static IceServer stun(String url) {
        return new IceServer(List.of(url), null, null);
    }
}
