package com.forrestgump.contactapi.interfaces.rest;

import com.forrestgump.contactapi.domain.service.SubmissionNormalizer;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;
import java.util.List;

/**
 * Picks the caller's network origin.
 *
 * <p>Only the last {@code X-Forwarded-For} entry is used: it is the one appended by the front door in
 * front of this service. Earlier entries come from the client and can be anything. Without the header
 * the peer address of the connection is used.
 */
@Component
public class SourceIdentityResolver {

    static final String FORWARDED_FOR = "X-Forwarded-For";

    public String resolve(ServerHttpRequest request) {
        String appended = lastForwardedEntry(request.getHeaders().get(FORWARDED_FOR));
        if (appended != null) {
            return appended;
        }

        InetSocketAddress remoteAddress = request.getRemoteAddress();
        if (remoteAddress != null && remoteAddress.getAddress() != null) {
            return remoteAddress.getAddress().getHostAddress();
        }
        return SubmissionNormalizer.UNKNOWN_SOURCE;
    }

    private static String lastForwardedEntry(List<String> headerValues) {
        if (headerValues == null || headerValues.isEmpty()) {
            return null;
        }
        // Repeated headers are concatenated in arrival order.
        String[] entries = String.join(",", headerValues).split(",");
        for (int i = entries.length - 1; i >= 0; i--) {
            String entry = entries[i].strip();
            if (!entry.isEmpty()) {
                return entry;
            }
        }
        return null;
    }
}
