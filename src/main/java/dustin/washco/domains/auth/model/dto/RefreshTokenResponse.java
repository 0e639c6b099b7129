package dustin.washco.domains.auth.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 토큰 갱신 응답 DTO
 * Refresh Token Response DTO
 *
 * Refresh Token은 교체하지 않으므로 새 Access Token만 반환
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "토큰 갱신 응답")
public class RefreshTokenResponse {
    @Schema(description = "새 Access Token", example = "eyJhbGciOiJIUzI1NiIsInR5cCI6IkpXVCJ9...")
    @ToString.Exclude
    private String accessToken;
    
    @Schema(description = "사용자 정보")
    private UserResponse user;
    
    @Schema(description = "성공 메시지", example = "Token refreshed successfully")
    private String message;
}
