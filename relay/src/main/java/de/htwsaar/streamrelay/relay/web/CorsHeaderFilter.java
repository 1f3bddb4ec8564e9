package de.htwsaar.streamrelay.relay.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.http.HttpHeaders;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Setzt offene CORS-Header auf jede Antwort und beantwortet Preflight-Anfragen direkt mit 204.
 * Player laufen auf fremden Origins und lesen Range-Header mit.
 */
public class CorsHeaderFilter extends OncePerRequestFilter {

    static final String EXPOSED_HEADERS = "Content-Length, Content-Range, Accept-Ranges";
    static final String PREFLIGHT_MAX_AGE = "86400";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
        response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS, "GET, OPTIONS");
        response.setHeader(HttpHeaders.ACCESS_CONTROL_ALLOW_HEADERS, "*");
        response.setHeader(HttpHeaders.ACCESS_CONTROL_EXPOSE_HEADERS, EXPOSED_HEADERS);
        response.setHeader("Cross-Origin-Resource-Policy", "cross-origin");

        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            response.setHeader(HttpHeaders.ACCESS_CONTROL_MAX_AGE, PREFLIGHT_MAX_AGE);
            response.setStatus(HttpServletResponse.SC_NO_CONTENT);
            return;
        }
        filterChain.doFilter(request, response);
    }
}
