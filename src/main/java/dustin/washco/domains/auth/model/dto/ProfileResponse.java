package dustin.washco.domains.auth.model.dto;

import java.time.LocalDateTime;

import dustin.washco.domains.auth.model.entity.UserRole;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 내 정보 응답 DTO
 * Profile Response DTO
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "내 정보 응답")
public class ProfileResponse {
    @Schema(description = "사용자 ID", example = "1")
    private Long id;
    
    @Schema(description = "이메일 주소", example = "user@example.com")
    private String email;
    
    @Schema(description = "이름", example = "Kim Dustin")
    private String fullName;
    
    @Schema(description = "전화번호", example = "+82 10-1234-5678")
    private String phone;
    
    @Schema(description = "역할", example = "CUSTOMER")
    private UserRole role;
    
    @Schema(description = "소속 테넌트 ID")
    private Long tenantId;
    
    @Schema(description = "이메일 인증 여부")
    private Boolean verified;
    
    @Schema(description = "프로필 이미지 URL")
    private String avatarUrl;
    
    @Schema(description = "비밀번호 설정 여부 (Google 전용 계정은 false)")
    private Boolean hasPassword;
    
    @Schema(description = "Google 계정 연동 여부")
    private Boolean googleLinked;
    
    @Schema(description = "유효한 로그인 세션 수", example = "2")
    private Long activeSessions;
    
    @Schema(description = "계정 생성 시간")
    private LocalDateTime createdAt;
}
