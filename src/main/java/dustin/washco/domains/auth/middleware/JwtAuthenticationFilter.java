package dustin.washco.domains.auth.middleware;

import dustin.washco.domains.auth.exception.AuthErrorCode;
import dustin.washco.domains.auth.exception.AuthException;
import dustin.washco.domains.auth.model.token.AccessTokenClaims;
import dustin.washco.domains.auth.service.AuthService;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JWT 인증 필터
 * JWT Authentication Filter
 *
 * 공개 경로를 제외한 모든 요청에 Bearer Access Token을 요구하고,
 * 검증된 사용자 정보를 Request Attribute로 전달
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    public static final String ATTR_USER_ID = "userId";
    public static final String ATTR_EMAIL = "email";
    public static final String ATTR_ROLE = "role";
    public static final String ATTR_TENANT_ID = "tenantId";

    private static final String BEARER_PREFIX = "Bearer ";

    private static final List<String> PUBLIC_PATH_PREFIXES = List.of(
            "/swagger-ui",
            "/api-docs",
            "/v3/api-docs",
            "/swagger-resources",
            "/webjars",
            "/error",
            // Auth API 중 인증 불필요한 것들
            "/api/auth/register",
            "/api/auth/login",
            "/api/auth/google",
            "/api/auth/refresh"
    );

    private final AuthService authService;
    private final ObjectMapper objectMapper;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        // logout 은 공개, logout-all 은 인증 필요
        if (path.equals("/api/auth/logout")) {
            return true;
        }
        return PUBLIC_PATH_PREFIXES.stream().anyMatch(path::startsWith);
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        // Authorization 헤더에서 토큰 추출
        String authHeader = request.getHeader("Authorization");

        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            writeError(response, AuthErrorCode.INVALID_ACCESS_TOKEN, "Missing or invalid authorization header");
            return;
        }

        String token = authHeader.substring(BEARER_PREFIX.length());

        AccessTokenClaims claims;
        try {
            claims = authService.authenticate(token);
        } catch (AuthException e) {
            writeError(response, e.getErrorCode(), e.getMessage());
            return;
        }

        // 사용자 정보를 Request Attribute에 저장 (Controller에서 사용)
        request.setAttribute(ATTR_USER_ID, claims.getUserId());
        request.setAttribute(ATTR_EMAIL, claims.getEmail());
        request.setAttribute(ATTR_ROLE, claims.getRole());
        request.setAttribute(ATTR_TENANT_ID, claims.getTenantId());

        filterChain.doFilter(request, response);
    }

    private void writeError(HttpServletResponse response, AuthErrorCode code, String message) throws IOException {
        if (response.isCommitted()) {
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code.name());
        body.put("message", message);

        response.setStatus(code.getStatus().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), body);
    }
}
