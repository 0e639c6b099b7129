package dustin.washco.domains.auth.model.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 비밀번호 변경 요청 DTO
 * Change Password Request DTO
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@ToString(onlyExplicitlyIncluded = true)
@Schema(description = "비밀번호 변경 요청")
public class ChangePasswordRequest {
    
    @Schema(description = "현재 비밀번호 (Google 전용 계정은 생략 가능)", example = "password123")
    private String currentPassword;
    
    @Schema(description = "새 비밀번호", example = "newPassword456", required = true)
    @NotBlank(message = "새 비밀번호는 필수입니다")
    @Size(min = 8, max = 128, message = "비밀번호는 8자 이상 128자 이하여야 합니다")
    private String newPassword;
}
