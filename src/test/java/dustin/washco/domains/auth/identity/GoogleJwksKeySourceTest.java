package dustin.washco.domains.auth.identity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.ExpectedCount.once;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import java.security.KeyPair;
import java.security.PublicKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.washco.domains.auth.config.AuthProperties;
import io.jsonwebtoken.Jwts;

/**
 * Google JWKS 키 소스 테스트
 * GoogleJwksKeySource test
 *
 * 테스트 항목:
 * 1. JWKS 조회 후 캐시 사용
 * 2. 모르는 kid 요청 시 재조회 (키 교체), 최소 재조회 간격
 * 3. 조회 실패 / 잘못된 형식은 InvalidAssertionException
 */
class GoogleJwksKeySourceTest {

    private static final String JWKS_URI = "https://jwks.test/oauth2/v3/certs";

    private final ObjectMapper objectMapper = new ObjectMapper();

    private RestTemplate restTemplate;
    private MockRestServiceServer server;
    private GoogleJwksKeySource keySource;
    private KeyPair first;
    private KeyPair second;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        keySource = keySource(Duration.ZERO);

        first = Jwts.SIG.RS256.keyPair().build();
        second = Jwts.SIG.RS256.keyPair().build();
    }

    @Test
    @DisplayName("최초 조회 시 JWKS를 가져오고 이후에는 캐시를 사용한다")
    void fetchOnceThenCache() {
        server.expect(once(), requestTo(JWKS_URI))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(jwks(Map.of("k1", first)), MediaType.APPLICATION_JSON));

        assertThat(encoded(keySource.findKey("k1"))).isEqualTo(first.getPublic().getEncoded());
        assertThat(encoded(keySource.findKey("k1"))).isEqualTo(first.getPublic().getEncoded());

        server.verify();
    }

    @Test
    @DisplayName("캐시에 없는 kid는 JWKS를 다시 조회해서 찾는다")
    void refetchOnUnknownKid() {
        server.expect(once(), requestTo(JWKS_URI))
                .andRespond(withSuccess(jwks(Map.of("k1", first)), MediaType.APPLICATION_JSON));
        server.expect(once(), requestTo(JWKS_URI))
                .andRespond(withSuccess(jwks(Map.of("k1", first, "k2", second)), MediaType.APPLICATION_JSON));

        assertThat(encoded(keySource.findKey("k1"))).isEqualTo(first.getPublic().getEncoded());
        assertThat(encoded(keySource.findKey("k2"))).isEqualTo(second.getPublic().getEncoded());

        server.verify();
    }

    @Test
    @DisplayName("재조회 후에도 없는 kid는 empty")
    void unknownKidAfterRefetch() {
        server.expect(once(), requestTo(JWKS_URI))
                .andRespond(withSuccess(jwks(Map.of("k1", first)), MediaType.APPLICATION_JSON));
        server.expect(once(), requestTo(JWKS_URI))
                .andRespond(withSuccess(jwks(Map.of("k1", first)), MediaType.APPLICATION_JSON));

        assertThat(keySource.findKey("missing")).isEmpty();

        server.verify();
    }

    @Test
    @DisplayName("최소 재조회 간격 이내에는 모르는 kid가 와도 JWKS를 다시 조회하지 않는다")
    void unknownKidWithinMinRefreshInterval() {
        GoogleJwksKeySource throttled = keySource(Duration.ofMinutes(1));
        server.expect(once(), requestTo(JWKS_URI))
                .andRespond(withSuccess(jwks(Map.of("k1", first)), MediaType.APPLICATION_JSON));

        assertThat(encoded(throttled.findKey("k1"))).isEqualTo(first.getPublic().getEncoded());
        for (int i = 0; i < 5; i++) {
            assertThat(throttled.findKey("attacker-kid-" + i)).isEmpty();
        }

        server.verify();
    }

    @Test
    @DisplayName("kid가 없으면 조회하지 않고 empty")
    void blankKid() {
        assertThat(keySource.findKey(null)).isEmpty();
        assertThat(keySource.findKey(" ")).isEmpty();

        server.verify();
    }

    @Test
    @DisplayName("JWKS 조회 실패 시 InvalidAssertionException")
    void fetchFailure() {
        server.expect(once(), requestTo(JWKS_URI)).andRespond(withServerError());

        assertThatThrownBy(() -> keySource.findKey("k1"))
                .isInstanceOf(InvalidAssertionException.class)
                .hasMessageContaining(JWKS_URI);
    }

    @Test
    @DisplayName("keys 배열이 없는 응답은 InvalidAssertionException")
    void malformedJwks() {
        assertThatThrownBy(() -> keySource.parseKeys("{\"not-keys\": []}"))
                .isInstanceOf(InvalidAssertionException.class);
        assertThatThrownBy(() -> keySource.parseKeys("not json"))
                .isInstanceOf(InvalidAssertionException.class);
    }

    @Test
    @DisplayName("RSA가 아니거나 kid가 없는 키는 건너뛴다")
    void skipsUnsupportedKeys() {
        String json = "{\"keys\": ["
                + "{\"kty\": \"EC\", \"kid\": \"ec-1\", \"crv\": \"P-256\"},"
                + "{\"kty\": \"RSA\", \"n\": \"AQAB\", \"e\": \"AQAB\"}"
                + "]}";

        Map<String, PublicKey> keys = keySource.parseKeys(json);

        assertThat(keys).isEmpty();
    }

    private GoogleJwksKeySource keySource(Duration minRefreshInterval) {
        AuthProperties authProperties = new AuthProperties();
        authProperties.getGoogle().setJwksUri(JWKS_URI);
        authProperties.getGoogle().setJwksMinRefreshInterval(minRefreshInterval);
        return new GoogleJwksKeySource(restTemplate, objectMapper, authProperties);
    }

    private String jwks(Map<String, KeyPair> keyPairs) {
        StringBuilder json = new StringBuilder("{\"keys\": [");
        String separator = "";
        for (Map.Entry<String, KeyPair> entry : keyPairs.entrySet()) {
            RSAPublicKey publicKey = (RSAPublicKey) entry.getValue().getPublic();
            json.append(separator)
                    .append("{\"kty\": \"RSA\", \"alg\": \"RS256\", \"use\": \"sig\", ")
                    .append("\"kid\": \"").append(entry.getKey()).append("\", ")
                    .append("\"n\": \"").append(base64Url(publicKey.getModulus().toByteArray())).append("\", ")
                    .append("\"e\": \"").append(base64Url(publicKey.getPublicExponent().toByteArray())).append("\"}");
            separator = ",";
        }
        return json.append("]}").toString();
    }

    private static byte[] encoded(Optional<PublicKey> key) {
        return key.orElseThrow().getEncoded();
    }

    private static String base64Url(byte[] bytes) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
