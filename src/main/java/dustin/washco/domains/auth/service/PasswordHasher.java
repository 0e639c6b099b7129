package dustin.washco.domains.auth.service;

import de.mkammerer.argon2.Argon2;
import de.mkammerer.argon2.Argon2Factory;
import de.mkammerer.argon2.Argon2Factory.Argon2Types;

import dustin.washco.domains.auth.config.AuthProperties;

import org.springframework.stereotype.Component;

import lombok.extern.slf4j.Slf4j;

/**
 * 비밀번호 해셔 (Argon2id)
 * Password hasher (Argon2id)
 *
 * 해시 문자열에 파라미터가 포함되므로 검증 시 별도 설정이 필요 없음
 */
@Slf4j
@Component
public class PasswordHasher {
    
    private static final String DUMMY_PASSWORD = "washco-dummy-password";
    
    private final Argon2 argon2;
    private final int iterations;
    private final int memoryKb;
    private final int parallelism;
    private final String dummyHash;
    
    public PasswordHasher(AuthProperties authProperties) {
        AuthProperties.Password config = authProperties.getPassword();
        this.argon2 = Argon2Factory.create(Argon2Types.ARGON2id);
        this.iterations = config.getIterations();
        this.memoryKb = config.getMemoryKb();
        this.parallelism = config.getParallelism();
        this.dummyHash = hash(DUMMY_PASSWORD);
    }
    
    /**
     * 비밀번호 해싱
     * Hash password
     */
    public String hash(String password) {
        char[] chars = password.toCharArray();
        try {
            return argon2.hash(iterations, memoryKb, parallelism, chars);
        } finally {
            argon2.wipeArray(chars);
        }
    }
    
    /**
     * 비밀번호 검증 (형식이 잘못된 해시는 false)
     * Verify password; a malformed hash yields false
     */
    public boolean verify(String passwordHash, String password) {
        if (passwordHash == null || password == null) {
            return false;
        }
        char[] chars = password.toCharArray();
        try {
            return argon2.verify(passwordHash, chars);
        } catch (RuntimeException e) {
            log.warn("[PasswordHasher] 해시 검증 실패 (잘못된 해시 형식): {}", e.getClass().getSimpleName());
            return false;
        } finally {
            argon2.wipeArray(chars);
        }
    }
    
    /**
     * 존재하지 않는 사용자에 대해서도 동일한 비용의 검증을 수행
     * Spend one verification so a missing account costs the same as a wrong password
     */
    public void verifyDummy(String password) {
        verify(dummyHash, password == null ? "" : password);
    }
}
