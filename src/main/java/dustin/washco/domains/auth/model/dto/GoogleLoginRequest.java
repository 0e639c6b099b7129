package dustin.washco.domains.auth.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Google 로그인 요청 DTO
 * Google Sign-In Request DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Google 로그인 요청")
public class GoogleLoginRequest {
    
    @Schema(description = "Google Identity Services가 발급한 ID 토큰", required = true)
    @NotBlank(message = "ID 토큰은 필수입니다")
    private String idToken;
}
