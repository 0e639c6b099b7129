package dustin.washco.domains.auth.service;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Optional;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import dustin.washco.domains.auth.config.AuthProperties;
import dustin.washco.domains.auth.exception.AuthErrorCode;
import dustin.washco.domains.auth.exception.AuthException;
import dustin.washco.domains.auth.identity.IdentityVerifier;
import dustin.washco.domains.auth.identity.InvalidAssertionException;
import dustin.washco.domains.auth.identity.VerifiedIdentity;
import dustin.washco.domains.auth.model.dto.ChangePasswordRequest;
import dustin.washco.domains.auth.model.dto.LoginRequest;
import dustin.washco.domains.auth.model.dto.LoginResponse;
import dustin.washco.domains.auth.model.dto.ProfileResponse;
import dustin.washco.domains.auth.model.dto.RefreshTokenResponse;
import dustin.washco.domains.auth.model.dto.RegisterRequest;
import dustin.washco.domains.auth.model.dto.RegisterResponse;
import dustin.washco.domains.auth.model.dto.UserResponse;
import dustin.washco.domains.auth.model.entity.RefreshToken;
import dustin.washco.domains.auth.model.entity.User;
import dustin.washco.domains.auth.model.entity.UserRole;
import dustin.washco.domains.auth.model.event.AuthAuditAction;
import dustin.washco.domains.auth.model.token.AccessTokenClaims;
import dustin.washco.domains.auth.model.token.IssuedRefreshToken;
import dustin.washco.domains.auth.repository.UserRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 인증 서비스
 * Auth Service - handles authentication business logic
 *
 * 계정 식별:
 * - 이메일(소문자 정규화)이 기본 식별자
 * - googleId는 한 번 연동되면 이메일보다 우선
 *
 * 실패 처리:
 * - 존재하지 않는 사용자와 잘못된 비밀번호는 동일하게 INVALID_CREDENTIALS
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final UserRepository userRepository;
    private final RefreshTokenService refreshTokenService;
    private final JwtService jwtService;
    private final PasswordHasher passwordHasher;
    private final IdentityVerifier identityVerifier;
    private final AuthAuditPublisher auditPublisher;
    private final AuthProperties authProperties;

    /**
     * 회원가입
     * Register
     */
    @Transactional
    public RegisterResponse register(RegisterRequest request) {
        String email = normalizeEmail(request.getEmail());
        String phone = normalizePhone(request.getPhone());

        // 이메일 중복 확인
        if (userRepository.existsByEmail(email)) {
            throw new AuthException(AuthErrorCode.ACCOUNT_EXISTS, "An account with this email already exists.");
        }
        if (phone != null && userRepository.existsByPhone(phone)) {
            throw new AuthException(AuthErrorCode.ACCOUNT_EXISTS, "An account with this phone number already exists.");
        }

        // 자가 가입은 CUSTOMER, MANAGER만 허용
        UserRole role = request.getRole() != null && request.getRole().isSelfAssignable()
                ? request.getRole()
                : UserRole.CUSTOMER;

        User user = User.builder()
                .email(email)
                .passwordHash(passwordHasher.hash(request.getPassword()))
                .fullName(request.getFullName().trim())
                .phone(phone)
                .role(role)
                .verified(false)
                .build();

        user = saveNewUser(user);
        log.info("[AuthService] 회원가입 완료: userId={}, role={}", user.getId(), role);

        auditPublisher.publish(AuthAuditAction.REGISTER, user.getId(), user.getTenantId(), user.getEmail());

        return RegisterResponse.builder()
                .user(UserResponse.from(user))
                .message("Registration successful. Please verify your email.")
                .build();
    }

    /**
     * 로그인 (이메일 또는 전화번호)
     * Login with email or phone
     */
    @Transactional
    public LoginResponse login(LoginRequest request) {
        Optional<User> found = findByIdentifier(request.getIdentifier());

        if (found.isEmpty() || !found.get().hasPassword()) {
            // 사용자 존재 여부가 응답 시간으로 드러나지 않도록 동일한 비용의 검증 수행
            passwordHasher.verifyDummy(request.getPassword());
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS, "Invalid email or password.");
        }

        User user = found.get();
        if (!passwordHasher.verify(user.getPasswordHash(), request.getPassword())) {
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS, "Invalid email or password.");
        }

        LoginResponse response = issueSession(user);
        auditPublisher.publish(AuthAuditAction.LOGIN, user.getId(), user.getTenantId(), user.getEmail());
        return response;
    }

    /**
     * Google 로그인: ID 토큰 검증 후 사용자 조회/연동/생성
     * Google Sign-In: verify ID token, then find, link or create the user
     *
     * 조회 순서:
     * 1. googleId로 조회 -> 그대로 사용
     * 2. 이메일로 조회 -> 기존 계정에 googleId 연동 (비밀번호는 유지)
     * 3. 신규 생성
     */
    @Transactional
    public LoginResponse googleLogin(String idToken) {
        AuthProperties.Google google = authProperties.getGoogle();
        if (!google.isConfigured()) {
            throw new AuthException(AuthErrorCode.NOT_CONFIGURED);
        }

        VerifiedIdentity identity;
        try {
            identity = identityVerifier.verify(idToken, google.getClientId());
        } catch (InvalidAssertionException e) {
            log.info("[AuthService] Google ID 토큰 검증 실패: {}", e.getMessage());
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS, "Invalid Google token.");
        }

        if (identity.getEmail() == null || identity.getEmail().isBlank()) {
            throw new AuthException(AuthErrorCode.BAD_REQUEST, "Google account does not have an email address.");
        }

        User user = userRepository.findByGoogleId(identity.getSubject())
                .orElseGet(() -> linkOrCreate(identity));

        LoginResponse response = issueSession(user);
        auditPublisher.publish(AuthAuditAction.GOOGLE_LOGIN, user.getId(), user.getTenantId(), user.getEmail());
        return response;
    }

    /**
     * Refresh Token 검증 및 새 Access Token 발급
     * Verify refresh token and issue new access token
     *
     * Refresh Token은 교체하지 않음 (만료 또는 명시적 무효화 전까지 유효)
     */
    @Transactional(readOnly = true)
    public RefreshTokenResponse refresh(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            throw new AuthException(AuthErrorCode.UNAUTHORIZED);
        }

        RefreshToken storedToken = refreshTokenService.findByPlaintext(refreshToken)
                .orElseThrow(() -> new AuthException(AuthErrorCode.INVALID_TOKEN));

        if (Boolean.TRUE.equals(storedToken.getRevoked())) {
            throw new AuthException(AuthErrorCode.TOKEN_REVOKED);
        }
        if (storedToken.isExpiredAt(LocalDateTime.now())) {
            throw new AuthException(AuthErrorCode.TOKEN_EXPIRED);
        }

        User user = userRepository.findById(storedToken.getUserId())
                .orElseThrow(() -> new AuthException(AuthErrorCode.INVALID_TOKEN));

        // 현재 역할/테넌트 기준으로 Access Token 발급
        String accessToken = jwtService.issueAccessToken(user.getId(), user.getEmail(), user.getRole(), user.getTenantId());

        return RefreshTokenResponse.builder()
                .accessToken(accessToken)
                .user(UserResponse.from(user))
                .message("Token refreshed successfully")
                .build();
    }

    /**
     * 로그아웃 - Refresh Token 무효화 (토큰이 없거나 이미 무효화되어도 성공)
     * Logout - revoke refresh token; idempotent
     */
    @Transactional
    public void logout(String refreshToken) {
        if (refreshToken == null || refreshToken.isBlank()) {
            return;
        }

        refreshTokenService.revoke(refreshToken)
                .ifPresent(userId -> auditPublisher.publish(AuthAuditAction.LOGOUT, userId, null, null));
    }

    /**
     * 사용자의 모든 Refresh Token 무효화 (모든 기기에서 로그아웃)
     * Revoke all refresh tokens for user (logout from all devices)
     */
    @Transactional
    public void logoutAll(Long userId) {
        int revoked = refreshTokenService.revokeAll(userId);
        log.info("[AuthService] 전체 로그아웃: userId={}, revoked={}", userId, revoked);

        auditPublisher.publish(AuthAuditAction.LOGOUT_ALL, userId, null, null);
    }

    /**
     * 비밀번호 변경
     * Change password
     *
     * 비밀번호가 없는 Google 전용 계정은 현재 비밀번호 확인 없이 최초 설정 가능
     * 기존 Refresh Token은 무효화하지 않음
     */
    @Transactional
    public void changePassword(Long userId, ChangePasswordRequest request) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new AuthException(AuthErrorCode.NOT_FOUND));

        if (user.hasPassword() && !passwordHasher.verify(user.getPasswordHash(), request.getCurrentPassword())) {
            throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS, "Current password is incorrect.");
        }

        user.setPasswordHash(passwordHasher.hash(request.getNewPassword()));
        userRepository.save(user);
        log.info("[AuthService] 비밀번호 변경 완료: userId={}", userId);

        auditPublisher.publish(AuthAuditAction.PASSWORD_CHANGED, user.getId(), user.getTenantId(), user.getEmail());
    }

    /**
     * 사용자 정보 조회
     * Get user profile
     */
    @Transactional(readOnly = true)
    public ProfileResponse getProfile(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new AuthException(AuthErrorCode.NOT_FOUND));

        return ProfileResponse.builder()
                .id(user.getId())
                .email(user.getEmail())
                .fullName(user.getFullName())
                .phone(user.getPhone())
                .role(user.getRole())
                .tenantId(user.getTenantId())
                .verified(user.getVerified())
                .avatarUrl(user.getAvatarUrl())
                .hasPassword(user.hasPassword())
                .googleLinked(user.getGoogleId() != null)
                .activeSessions(refreshTokenService.countActive(user.getId()))
                .createdAt(user.getCreatedAt())
                .build();
    }

    /**
     * Access Token 검증 (HTTP 필터용)
     * Verify an access token for the HTTP filter
     */
    public AccessTokenClaims authenticate(String accessToken) {
        return jwtService.verifyAccessToken(accessToken);
    }

    private LoginResponse issueSession(User user) {
        String accessToken = jwtService.issueAccessToken(user.getId(), user.getEmail(), user.getRole(), user.getTenantId());
        IssuedRefreshToken refreshToken = refreshTokenService.issue(user.getId());

        return LoginResponse.builder()
                .user(UserResponse.from(user))
                .accessToken(accessToken)
                .refreshToken(refreshToken.getPlaintext())
                .refreshTokenExpiresAt(refreshToken.getExpiresAt())
                .message("Login successful")
                .build();
    }

    private User linkOrCreate(VerifiedIdentity identity) {
        String email = normalizeEmail(identity.getEmail());
        Optional<User> byEmail = userRepository.findByEmail(email);

        if (byEmail.isPresent()) {
            User user = byEmail.get();
            if (user.getGoogleId() != null && !user.getGoogleId().equals(identity.getSubject())) {
                // 이미 다른 Google 계정과 연동된 이메일
                log.warn("[AuthService] 다른 Google 계정에 연동된 사용자: userId={}", user.getId());
                throw new AuthException(AuthErrorCode.INVALID_CREDENTIALS, "Invalid Google token.");
            }

            user.setGoogleId(identity.getSubject());
            user.setVerified(true);
            if (user.getAvatarUrl() == null && identity.getPictureUrl() != null) {
                user.setAvatarUrl(identity.getPictureUrl());
            }
            log.info("[AuthService] Google 계정 연동: userId={}", user.getId());
            return userRepository.save(user);
        }

        String displayName = identity.getDisplayName() != null && !identity.getDisplayName().isBlank()
                ? identity.getDisplayName()
                : localPart(email);

        User created = saveNewUser(User.builder()
                .email(email)
                .fullName(displayName)
                .role(UserRole.CUSTOMER)
                .googleId(identity.getSubject())
                .verified(true)
                .avatarUrl(identity.getPictureUrl())
                .build());
        log.info("[AuthService] Google 계정으로 신규 가입: userId={}", created.getId());
        return created;
    }

    /**
     * 동시 가입 등으로 유니크 제약 위반 시 ACCOUNT_EXISTS
     * Maps a store uniqueness violation to ACCOUNT_EXISTS
     */
    private User saveNewUser(User user) {
        try {
            return userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            throw new AuthException(AuthErrorCode.ACCOUNT_EXISTS, "An account with this email or phone already exists.", e);
        }
    }

    private Optional<User> findByIdentifier(String identifier) {
        if (identifier == null || identifier.isBlank()) {
            return Optional.empty();
        }
        if (identifier.contains("@")) {
            return userRepository.findByEmail(normalizeEmail(identifier));
        }
        return userRepository.findByPhone(identifier.trim());
    }

    // '@'가 없으면 전체 문자열
    private static String localPart(String email) {
        int at = email.indexOf('@');
        return at > 0 ? email.substring(0, at) : email;
    }

    private static String normalizeEmail(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }

    private static String normalizePhone(String phone) {
        if (phone == null || phone.isBlank()) {
            return null;
        }
        return phone.trim();
    }
}
