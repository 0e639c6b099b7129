package dustin.washco.domains.auth.controller;

import java.util.Map;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import dustin.washco.domains.auth.exception.AuthErrorCode;
import dustin.washco.domains.auth.exception.AuthException;
import dustin.washco.domains.auth.middleware.JwtAuthenticationFilter;
import dustin.washco.domains.auth.model.dto.ChangePasswordRequest;
import dustin.washco.domains.auth.model.dto.GoogleLoginRequest;
import dustin.washco.domains.auth.model.dto.LoginRequest;
import dustin.washco.domains.auth.model.dto.LoginResponse;
import dustin.washco.domains.auth.model.dto.LogoutRequest;
import dustin.washco.domains.auth.model.dto.ProfileResponse;
import dustin.washco.domains.auth.model.dto.RefreshTokenRequest;
import dustin.washco.domains.auth.model.dto.RefreshTokenResponse;
import dustin.washco.domains.auth.model.dto.RegisterRequest;
import dustin.washco.domains.auth.model.dto.RegisterResponse;
import dustin.washco.domains.auth.service.AuthService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;

import lombok.RequiredArgsConstructor;

/**
 * 인증 컨트롤러
 * Auth Controller
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Tag(name = "Auth", description = "Authentication API endpoints")
public class AuthController {

    private final AuthService authService;

    /**
     * 회원가입
     * Register
     */
    @Operation(
            summary = "회원가입",
            description = "이메일/비밀번호로 새 사용자 계정을 생성합니다"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "201",
                    description = "User created successfully",
                    content = @Content(schema = @Schema(implementation = RegisterResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Validation failed"),
            @ApiResponse(responseCode = "409", description = "Account already exists")
    })
    @PostMapping("/register")
    public ResponseEntity<RegisterResponse> register(@Valid @RequestBody RegisterRequest request) {
        RegisterResponse response = authService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * 로그인
     * Login
     */
    @Operation(
            summary = "로그인",
            description = "이메일 또는 전화번호와 비밀번호로 로그인하여 Access Token과 Refresh Token을 발급받습니다"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Login successful",
                    content = @Content(schema = @Schema(implementation = LoginResponse.class))
            ),
            @ApiResponse(responseCode = "401", description = "Invalid credentials")
    })
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    /**
     * Google 로그인
     * Google Sign-In
     */
    @Operation(
            summary = "Google 로그인",
            description = "Google ID 토큰을 검증하고 기존 계정 연동 또는 신규 계정 생성 후 토큰을 발급합니다"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Login successful",
                    content = @Content(schema = @Schema(implementation = LoginResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Google Sign-In not configured, or no email on the Google account"),
            @ApiResponse(responseCode = "401", description = "Invalid Google token")
    })
    @PostMapping("/google")
    public ResponseEntity<LoginResponse> google(@Valid @RequestBody GoogleLoginRequest request) {
        return ResponseEntity.ok(authService.googleLogin(request.getIdToken()));
    }

    /**
     * 토큰 갱신
     * Refresh token
     */
    @Operation(
            summary = "토큰 갱신",
            description = "Refresh Token으로 새 Access Token을 발급받습니다 (Refresh Token은 그대로 유지)"
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "Token refreshed successfully",
                    content = @Content(schema = @Schema(implementation = RefreshTokenResponse.class))
            ),
            @ApiResponse(responseCode = "401", description = "Missing, invalid, revoked or expired refresh token")
    })
    @PostMapping("/refresh")
    public ResponseEntity<RefreshTokenResponse> refresh(@RequestBody(required = false) RefreshTokenRequest request) {
        String refreshToken = request == null ? null : request.getRefreshToken();
        return ResponseEntity.ok(authService.refresh(refreshToken));
    }

    /**
     * 로그아웃
     * Logout
     */
    @Operation(
            summary = "로그아웃",
            description = "Refresh Token을 무효화합니다. 토큰이 없거나 이미 무효화된 경우에도 성공합니다"
    )
    @ApiResponse(responseCode = "200", description = "Logout successful")
    @PostMapping("/logout")
    public ResponseEntity<Map<String, String>> logout(@RequestBody(required = false) LogoutRequest request) {
        authService.logout(request == null ? null : request.getRefreshToken());
        return ResponseEntity.ok(Map.of("message", "Logged out successfully."));
    }

    /**
     * 모든 기기에서 로그아웃
     * Logout from all devices
     */
    @Operation(
            summary = "모든 기기에서 로그아웃",
            description = "현재 사용자의 모든 Refresh Token을 무효화합니다",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Logged out from all devices"),
            @ApiResponse(responseCode = "401", description = "Unauthorized")
    })
    @PostMapping("/logout-all")
    public ResponseEntity<Map<String, String>> logoutAll(HttpServletRequest request) {
        authService.logoutAll(currentUserId(request));
        return ResponseEntity.ok(Map.of("message", "Logged out from all devices."));
    }

    /**
     * 비밀번호 변경
     * Change password
     */
    @Operation(
            summary = "비밀번호 변경",
            description = "현재 비밀번호 확인 후 새 비밀번호로 변경합니다 (Google 전용 계정은 최초 설정)",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Password changed successfully"),
            @ApiResponse(responseCode = "401", description = "Current password is incorrect"),
            @ApiResponse(responseCode = "404", description = "User not found")
    })
    @PostMapping("/change-password")
    public ResponseEntity<Map<String, String>> changePassword(
            HttpServletRequest request,
            @Valid @RequestBody ChangePasswordRequest body
    ) {
        authService.changePassword(currentUserId(request), body);
        return ResponseEntity.ok(Map.of("message", "Password changed successfully."));
    }

    /**
     * 사용자 정보 조회
     * Get current user info
     */
    @Operation(
            summary = "사용자 정보 조회",
            description = "현재 로그인한 사용자의 정보를 조회합니다",
            security = @SecurityRequirement(name = "BearerAuth")
    )
    @ApiResponses({
            @ApiResponse(
                    responseCode = "200",
                    description = "User info retrieved successfully",
                    content = @Content(schema = @Schema(implementation = ProfileResponse.class))
            ),
            @ApiResponse(responseCode = "401", description = "Unauthorized"),
            @ApiResponse(responseCode = "404", description = "User not found")
    })
    @GetMapping("/me")
    public ResponseEntity<ProfileResponse> getMe(HttpServletRequest request) {
        return ResponseEntity.ok(authService.getProfile(currentUserId(request)));
    }

    // JWT 필터에서 설정한 사용자 ID
    private Long currentUserId(HttpServletRequest request) {
        Long userId = (Long) request.getAttribute(JwtAuthenticationFilter.ATTR_USER_ID);
        if (userId == null) {
            throw new AuthException(AuthErrorCode.INVALID_ACCESS_TOKEN, "Missing or invalid authorization header");
        }
        return userId;
    }
}
