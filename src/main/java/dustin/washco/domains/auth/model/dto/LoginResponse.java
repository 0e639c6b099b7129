package dustin.washco.domains.auth.model.dto;

import java.time.LocalDateTime;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 로그인 응답 DTO (이메일/비밀번호, Google 공통)
 * Login Response DTO (password and Google sign-in)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "로그인 응답")
public class LoginResponse {
    @Schema(description = "사용자 정보 (비밀번호 제외)")
    private UserResponse user;
    
    @Schema(description = "JWT Access Token (짧은 수명)", example = "eyJhbGciOiJIUzI1NiIsInR5cCI6IkpXVCJ9...")
    @ToString.Exclude
    private String accessToken;
    
    @Schema(description = "Refresh Token (긴 수명, DB에는 해시만 저장)", example = "abc123def456...")
    @ToString.Exclude
    private String refreshToken;
    
    @Schema(description = "Refresh Token 만료 시간")
    private LocalDateTime refreshTokenExpiresAt;
    
    @Schema(description = "성공 메시지", example = "Login successful")
    private String message;
}
