package dustin.washco.domains.auth.model.entity;

/**
 * 사용자 역할
 * User role
 */
public enum UserRole {
    /**
     * 일반 고객 (기본값)
     * Customer (default)
     */
    CUSTOMER,

    /**
     * 세차장 관리자 (테넌트 소속)
     * Car-wash manager, scoped to a tenant
     */
    MANAGER,

    /**
     * 플랫폼 관리자
     * Platform administrator
     */
    SUPER_ADMIN;

    /**
     * 자가 가입 가능한 역할인지 여부
     * Whether the role may be chosen at self-registration
     */
    public boolean isSelfAssignable() {
        return this == CUSTOMER || this == MANAGER;
    }
}
