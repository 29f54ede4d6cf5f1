package com.vybe.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Client address used to key per-IP rate limits.
 * <p>
 * Only the connection's remote address is read. Behind a load balancer the servlet container rewrites it
 * from {@code X-Forwarded-For}, and only when the hop belongs to a trusted proxy
 * ({@code server.forward-headers-strategy=native}, {@code server.tomcat.remoteip.internal-proxies}).
 * A client talking to the service directly cannot pick its own address by sending the header.
 */
public final class ClientIpResolver {

    private static final int MAX_LENGTH = 64;

    private ClientIpResolver() {
    }

    public static String resolve(HttpServletRequest request) {
        String address = request.getRemoteAddr();
        if (address == null) {
            return null;
        }
        return address.length() > MAX_LENGTH ? address.substring(0, MAX_LENGTH) : address;
    }
}
