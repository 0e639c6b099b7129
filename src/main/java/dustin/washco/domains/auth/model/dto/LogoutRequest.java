package dustin.washco.domains.auth.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 로그아웃 요청 DTO
 * Logout Request DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "로그아웃 요청")
public class LogoutRequest {
    
    @Schema(description = "Refresh Token (없으면 아무 작업도 하지 않음)", example = "abc123def456...")
    private String refreshToken;
}
