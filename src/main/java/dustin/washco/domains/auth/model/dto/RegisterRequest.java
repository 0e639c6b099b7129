package dustin.washco.domains.auth.model.dto;

import dustin.washco.domains.auth.model.entity.UserRole;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * 회원가입 요청 DTO
 * Register Request DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "회원가입 요청")
public class RegisterRequest {
    
    @Schema(description = "이메일 주소", example = "user@example.com", required = true)
    @NotBlank(message = "이메일은 필수입니다")
    @Email(message = "유효한 이메일 형식이 아닙니다")
    private String email;
    
    @Schema(description = "비밀번호", example = "password123", required = true)
    @NotBlank(message = "비밀번호는 필수입니다")
    @Size(min = 8, max = 128, message = "비밀번호는 8자 이상 128자 이하여야 합니다")
    @ToString.Exclude
    private String password;
    
    @Schema(description = "이름", example = "Kim Dustin", required = true)
    @NotBlank(message = "이름은 필수입니다")
    @Size(min = 2, max = 100, message = "이름은 2자 이상 100자 이하여야 합니다")
    private String fullName;
    
    @Schema(description = "전화번호 (선택사항)", example = "+82 10-1234-5678")
    @Pattern(regexp = "^\\+?[\\d\\s-]{8,20}$", message = "전화번호는 8~20자리 숫자여야 합니다")
    private String phone;
    
    @Schema(description = "역할 (CUSTOMER 또는 MANAGER, 기본값 CUSTOMER)", example = "CUSTOMER")
    private UserRole role;
}
