package com.flagship.escrow_ledger.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.regex.Pattern;

/**
 * Binds a correlation ID to every escrow and settlement API call.
 *
 * The caller's X-Correlation-ID is reused when it is a short token of
 * letters, digits and {@code . _ : -}; anything else is replaced so it
 * cannot break the log lines it is written into.
 * The ID is echoed back on the response. The escrow and settlement MDC keys
 * set by handlers are dropped when the request ends.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {
        String correlationId = resolveCorrelationId(request.getHeader(CorrelationContext.CORRELATION_ID_HEADER));

        CorrelationContext.setCorrelationId(correlationId);
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);
        response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContext.clear();
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.ESCROW_PAYMENT_ID_MDC_KEY);
            MDC.remove(CorrelationContext.SETTLEMENT_ID_MDC_KEY);
        }
    }

    String resolveCorrelationId(String inbound) {
        if (inbound == null || inbound.isBlank()) {
            return CorrelationContext.generateCorrelationId();
        }
        String candidate = inbound.trim();
        if (ACCEPTED_ID.matcher(candidate).matches()) {
            return candidate;
        }
        String replacement = CorrelationContext.generateCorrelationId();
        log.debug("Replacing unusable {} header ({} chars) with {}",
                CorrelationContext.CORRELATION_ID_HEADER, candidate.length(), replacement);
        return replacement;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }
}
