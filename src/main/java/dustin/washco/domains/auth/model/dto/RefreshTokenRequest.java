package dustin.washco.domains.auth.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 토큰 갱신 요청 DTO
 * Refresh Token Request DTO
 *
 * 토큰 누락은 검증 오류가 아닌 UNAUTHORIZED로 처리 (서비스에서 판단)
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "토큰 갱신 요청")
public class RefreshTokenRequest {
    
    @Schema(description = "Refresh Token", example = "abc123def456...", required = true)
    private String refreshToken;
}
