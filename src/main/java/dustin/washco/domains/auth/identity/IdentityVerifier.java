package dustin.washco.domains.auth.identity;

/**
 * 외부 ID 제공자(Google 등)가 발급한 ID 토큰 검증
 * Verifies identity assertions issued by an external provider
 *
 * 구현체는 서명, 발급자, audience, 만료를 모두 검증한 뒤에만 클레임을 반환해야 하며,
 * 어떤 실패든 {@link InvalidAssertionException} 하나로 보고한다.
 */
public interface IdentityVerifier {

    /**
     * @param rawAssertion 클라이언트가 전달한 원본 ID 토큰
     * @param expectedAudience 이 서비스의 OAuth client id
     * @return 검증된 신원 정보
     * @throws InvalidAssertionException 검증 실패 시
     */
    VerifiedIdentity verify(String rawAssertion, String expectedAudience);
}
