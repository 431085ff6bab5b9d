package com.phillippitts.voiceanalysis.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Puts request correlation values into the Log4j2 ThreadContext for the duration of a request.
 *
 * <p>Keys: {@code requestId} (X-Request-ID header or a new UUID, echoed back on the response),
 * {@code method}, {@code uri}, and {@code analysisId} for {@code /api/analyses/{id}...} paths.
 * The context is cleared when the request completes, even if the chain throws.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    private static final Pattern ANALYSIS_PATH = Pattern.compile("^/api/analyses/(\\d+)(/.*)?$");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain chain) throws ServletException, IOException {
        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        String uri = request.getRequestURI();
        try {
            ThreadContext.put("requestId", requestId);
            ThreadContext.put("method", request.getMethod());
            ThreadContext.put("uri", uri);
            analysisIdOf(uri).ifPresent(id -> ThreadContext.put("analysisId", id));
            response.setHeader(REQUEST_ID_HEADER, requestId);

            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    static Optional<String> analysisIdOf(String uri) {
        if (uri == null) {
            return Optional.empty();
        }
        Matcher m = ANALYSIS_PATH.matcher(uri);
        return m.matches() ? Optional.of(m.group(1)) : Optional.empty();
    }
}
