package com.gamezip.dispatch.api;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Adds CORS headers before any handler runs, so error responses carry them too,
 * and answers every {@code OPTIONS} request as a preflight.
 */
@Component
@Order(1)
public class CorsFilter implements Filter {

    static final String ALLOWED_METHODS = "GET, POST, DELETE, OPTIONS";

    private final GatewayProperties properties;

    public CorsFilter(GatewayProperties properties) {
        this.properties = properties;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        if (properties.isAllowCrossDomain()) {
            httpResponse.setHeader("Access-Control-Allow-Origin", "*");
            httpResponse.setHeader("Access-Control-Allow-Methods", ALLOWED_METHODS);
            httpResponse.setHeader("Access-Control-Allow-Headers", "*");
        }

        if ("OPTIONS".equalsIgnoreCase(httpRequest.getMethod())) {
            if (properties.isAllowCrossDomain()) {
                httpResponse.setHeader("Access-Control-Max-Age", String.valueOf(properties.getPreflightMaxAge()));
            }
            httpResponse.setStatus(HttpServletResponse.SC_NO_CONTENT);
            return;
        }

        chain.doFilter(request, response);
    }
}
