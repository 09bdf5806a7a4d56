package by.greenmobile.productionplan.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.UUID;

/**
 * Correlates the log lines of one plan calculation. The caller's X-Request-Id is reused when
 * present (a short random id otherwise) and returned on the response, so a client can quote it
 * when reporting an infeasible or rejected plan. The id goes into the MDC as {@code rid}, next to
 * the HTTP method and path.
 */
@Component
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";

    private static final String MDC_RID = "rid";
    private static final String MDC_METHOD = "method";
    private static final String MDC_PATH = "path";
    private static final List<String> MDC_KEYS = List.of(MDC_RID, MDC_METHOD, MDC_PATH);

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String rid = resolveRequestId(request);
        response.setHeader(HEADER, rid);

        MDC.put(MDC_RID, rid);
        MDC.put(MDC_METHOD, request.getMethod());
        MDC.put(MDC_PATH, request.getRequestURI());
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC_KEYS.forEach(MDC::remove);
        }
    }

    static String resolveRequestId(HttpServletRequest request) {
        String incoming = request.getHeader(HEADER);
        if (incoming != null && !incoming.isBlank()) {
            return incoming.trim();
        }
        return UUID.randomUUID().toString().substring(0, 8);
    }
}
