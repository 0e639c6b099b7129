package dustin.washco.domains.auth.repository;

import dustin.washco.domains.auth.model.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * 사용자 Repository
 * User Repository
 *
 * 이메일은 항상 소문자로 정규화된 값으로 조회
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {
    
    /**
     * 이메일로 사용자 조회
     * Find user by email
     */
    Optional<User> findByEmail(String email);
    
    /**
     * 이메일 존재 여부 확인
     * Check if email exists
     */
    boolean existsByEmail(String email);
    
    /**
     * Google 계정 ID로 사용자 조회
     * Find user by Google subject id
     */
    Optional<User> findByGoogleId(String googleId);
    
    /**
     * 전화번호로 사용자 조회 (전화번호 로그인)
     * Find user by phone (phone-based login)
     */
    Optional<User> findByPhone(String phone);
    
    boolean existsByPhone(String phone);
}
