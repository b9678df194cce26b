package com.gamezip.dispatch.api;

import com.gamezip.core.logging.MdcContext;
import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Last line of defence: tags the request for logging and turns anything that
 * escapes the dispatcher into a bare 500 without internals.
 */
@Component
@Order(2)
public class RequestGuardFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(RequestGuardFilter.class);

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest httpRequest = (HttpServletRequest) request;
        HttpServletResponse httpResponse = (HttpServletResponse) response;

        MdcContext.setRequest(UUID.randomUUID().toString().substring(0, 8));
        try {
            log.info("{} {}", httpRequest.getMethod(), httpRequest.getRequestURI());
            chain.doFilter(request, response);
        } catch (Exception e) {
            log.error("Unhandled error for {} {}", httpRequest.getMethod(), httpRequest.getRequestURI(), e);
            if (!httpResponse.isCommitted()) {
                httpResponse.resetBuffer();
                httpResponse.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
                httpResponse.setContentType("text/plain");
                httpResponse.getOutputStream().write("Internal Server Error".getBytes(StandardCharsets.UTF_8));
            }
        } finally {
            MdcContext.clear();
        }
    }
}
