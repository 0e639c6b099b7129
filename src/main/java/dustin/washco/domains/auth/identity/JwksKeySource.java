package dustin.washco.domains.auth.identity;

import java.security.PublicKey;
import java.util.Optional;

/**
 * key id(kid)로 서명 검증용 공개키 조회
 * Resolves signature verification keys by key id
 */
@FunctionalInterface
public interface JwksKeySource {

    /**
     * @throws InvalidAssertionException 키 목록을 가져올 수 없는 경우
     */
    Optional<PublicKey> findKey(String keyId);
}
