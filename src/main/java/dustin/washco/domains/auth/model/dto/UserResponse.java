package dustin.washco.domains.auth.model.dto;

import dustin.washco.domains.auth.model.entity.User;
import dustin.washco.domains.auth.model.entity.UserRole;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 사용자 응답 DTO (비밀번호 제외)
 * User Response DTO (without password)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "사용자 정보 응답 (비밀번호 제외)")
public class UserResponse {
    @Schema(description = "사용자 ID", example = "1")
    private Long id;
    
    @Schema(description = "이메일 주소", example = "user@example.com")
    private String email;
    
    @Schema(description = "이름", example = "Kim Dustin")
    private String fullName;
    
    @Schema(description = "역할", example = "CUSTOMER")
    private UserRole role;
    
    @Schema(description = "소속 테넌트 ID (관리자만)", example = "3")
    private Long tenantId;
    
    @Schema(description = "프로필 이미지 URL")
    private String avatarUrl;
    
    public static UserResponse from(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .email(user.getEmail())
                .fullName(user.getFullName())
                .role(user.getRole())
                .tenantId(user.getTenantId())
                .avatarUrl(user.getAvatarUrl())
                .build();
    }
}
