package com.flagship.classroom_ledger.observability;

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
import java.util.List;

/**
 * Puts the caller's X-Correlation-ID (or a fresh one) and the X-Tenant-ID
 * header into the MDC for the duration of the request, and echoes the
 * trace id back on the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final String TENANT_HEADER = "X-Tenant-ID";

    private static final List<String> REQUEST_MDC_KEYS = List.of(
            CorrelationContext.CORRELATION_ID_MDC_KEY,
            CorrelationContext.TENANT_ID_MDC_KEY,
            CorrelationContext.CLAIM_ID_MDC_KEY,
            CorrelationContext.ENTRY_ID_MDC_KEY);

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        CorrelationContext.setCorrelationId(request.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        String traceId = CorrelationContext.getCorrelationId();
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, traceId);
        response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, traceId);

        // log field only; the header is validated into a TenantScope by the controller
        String tenantHeader = request.getHeader(TENANT_HEADER);
        if (tenantHeader != null && !tenantHeader.isBlank()) {
            MDC.put(CorrelationContext.TENANT_ID_MDC_KEY, tenantHeader);
        }

        try {
            chain.doFilter(request, response);
        } finally {
            REQUEST_MDC_KEYS.forEach(MDC::remove);
            CorrelationContext.clear();
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }
}
