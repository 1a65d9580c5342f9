package com.example.products.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * HTTPS redirect stage of the pipeline.
 *
 * Insecure requests are answered with a redirect to the same host, path and
 * query on the HTTPS port; secure requests continue down the chain. When no
 * HTTPS port is configured the stage cannot build a target URL, so it warns
 * once and lets every request through.
 */
public class HttpsRedirectFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(HttpsRedirectFilter.class);

    private static final int DEFAULT_HTTPS_PORT = 443;

    private final Integer httpsPort;
    private final int redirectStatus;
    private final AtomicBoolean portWarningLogged = new AtomicBoolean(false);

    public HttpsRedirectFilter(Integer httpsPort, int redirectStatus) {
        if (redirectStatus < 300 || redirectStatus > 399) {
            throw new IllegalArgumentException("Redirect status must be 3xx, got " + redirectStatus);
        }
        if (httpsPort != null && (httpsPort < 1 || httpsPort > 65535)) {
            throw new IllegalArgumentException("HTTPS port must be in 1..65535, got " + httpsPort);
        }
        this.httpsPort = httpsPort;
        this.redirectStatus = redirectStatus;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        if (request.isSecure()) {
            filterChain.doFilter(request, response);
            return;
        }

        if (httpsPort == null) {
            if (portWarningLogged.compareAndSet(false, true)) {
                log.warn("Failed to determine the https port for redirect. "
                    + "Set app.https-redirect.port to enable the HTTPS redirect stage.");
            }
            filterChain.doFilter(request, response);
            return;
        }

        String location = buildLocation(request);
        log.debug("[{}] Redirecting {} {} to {}",
            Thread.currentThread().getName(), request.getMethod(), request.getRequestURI(), location);

        response.setStatus(redirectStatus);
        response.setHeader(HttpHeaders.LOCATION, location);
    }

    String buildLocation(HttpServletRequest request) {
        StringBuilder location = new StringBuilder("https://").append(request.getServerName());
        if (httpsPort != DEFAULT_HTTPS_PORT) {
            location.append(':').append(httpsPort);
        }
        location.append(request.getRequestURI());

        String query = request.getQueryString();
        if (query != null && !query.isEmpty()) {
            location.append('?').append(query);
        }
        return location.toString();
    }
}
