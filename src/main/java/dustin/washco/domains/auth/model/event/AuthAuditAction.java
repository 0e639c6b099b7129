package dustin.washco.domains.auth.model.event;

/**
 * 감사 대상 인증 동작
 * Audited authentication actions
 */
public enum AuthAuditAction {
    REGISTER,
    LOGIN,
    GOOGLE_LOGIN,
    LOGOUT,
    LOGOUT_ALL,
    PASSWORD_CHANGED
}
