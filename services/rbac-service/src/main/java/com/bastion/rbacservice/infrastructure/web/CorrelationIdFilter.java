package com.bastion.rbacservice.infrastructure.web;

import com.bastion.observability.CorrelationContext;
import com.bastion.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Propagates or generates a correlation ID for every HTTP request.
 *
 * <p>The ID flows from the {@code X-Correlation-ID} request header into {@link
 * CorrelationContextHolder}, from there into SLF4J MDC and every audit entry written during the
 * request, and back out in the response header. A missing or malformed header gets a fresh UUID.
 *
 * <p>Runs at {@link Ordered#HIGHEST_PRECEDENCE} so correlation is available to all subsequent
 * filters and handlers.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    /** Accepted inbound IDs; anything else is replaced with a fresh UUID. */
    private static final Pattern ACCEPTED = Pattern.compile("^[A-Za-z0-9._:-]{1,128}$");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String correlationId = acceptOrMint(request.getHeader(CORRELATION_ID_HEADER));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        // tenant stays null until the controller has parsed the path
        CorrelationContextHolder.set(new CorrelationContext(correlationId, null));
        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContextHolder.clear();
        }
    }

    /** Returns {@code inbound} when it is an acceptable ID, otherwise a fresh UUID. */
    static String acceptOrMint(String inbound) {
        if (inbound != null && ACCEPTED.matcher(inbound).matches()) {
            return inbound;
        }
        return UUID.randomUUID().toString();
    }
}
