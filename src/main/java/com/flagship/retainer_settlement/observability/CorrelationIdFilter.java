package com.flagship.retainer_settlement.observability;

import com.flagship.retainer_settlement.identity.CallerIdentity;
import com.flagship.retainer_settlement.identity.CallerRole;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Sets up the logging context of an API request: correlation ID (also echoed in the response)
 * and the caller's role. Removes every MDC key this service uses when the request ends.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = CorrelationContext.resolve(request.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
        CallerRole.fromValue(request.getHeader(CallerIdentity.ROLE_HEADER))
                .ifPresent(role -> MDC.put(CorrelationContext.CALLER_MDC_KEY, role.getValue()));
        response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.CALLER_MDC_KEY);
            MDC.remove(CorrelationContext.DEAL_ID_MDC_KEY);
            MDC.remove(CorrelationContext.INVOICE_ID_MDC_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }
}
