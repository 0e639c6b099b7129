package dustin.washco.domains.auth.identity;

import java.math.BigInteger;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.spec.RSAPublicKeySpec;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import dustin.washco.domains.auth.config.AuthProperties;
import lombok.extern.slf4j.Slf4j;

/**
 * Google JWKS 공개키 조회 및 캐시
 * Google JWKS public key source
 *
 * 처리 흐름:
 * 1. 캐시가 유효하면 캐시에서 kid 조회
 * 2. 캐시 만료 또는 kid 미존재(키 교체) 시 JWKS 재조회 후 다시 조회
 *
 * kid 미존재로 인한 재조회는 jwksMinRefreshInterval 이내에 반복하지 않음
 */
@Slf4j
@Component
public class GoogleJwksKeySource implements JwksKeySource {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String jwksUri;
    private final Duration cacheTtl;
    private final Duration minRefreshInterval;

    private volatile Map<String, PublicKey> keys = Map.of();
    private volatile Instant fetchedAt = Instant.EPOCH;

    public GoogleJwksKeySource(RestTemplate jwksRestTemplate, ObjectMapper objectMapper, AuthProperties authProperties) {
        this.restTemplate = jwksRestTemplate;
        this.objectMapper = objectMapper;
        this.jwksUri = authProperties.getGoogle().getJwksUri();
        this.cacheTtl = authProperties.getGoogle().getJwksCacheTtl();
        this.minRefreshInterval = authProperties.getGoogle().getJwksMinRefreshInterval();
    }

    @Override
    public Optional<PublicKey> findKey(String keyId) {
        if (keyId == null || keyId.isBlank()) {
            return Optional.empty();
        }
        if (isStale()) {
            refresh();
        }

        PublicKey key = keys.get(keyId);
        if (key == null) {
            if (!canForceRefresh()) {
                log.debug("[GoogleJwksKeySource] kid={} 미존재, 최근에 조회하여 재조회 생략", keyId);
                return Optional.empty();
            }
            log.info("[GoogleJwksKeySource] kid={} 가 캐시에 없어 JWKS 재조회", keyId);
            forceRefresh();
            key = keys.get(keyId);
        }
        return Optional.ofNullable(key);
    }

    // 동시에 들어온 요청은 한 번만 재조회
    private synchronized void forceRefresh() {
        if (canForceRefresh()) {
            refresh();
        }
    }

    private boolean canForceRefresh() {
        return !Instant.now().isBefore(fetchedAt.plus(minRefreshInterval));
    }

    private boolean isStale() {
        return keys.isEmpty() || Instant.now().isAfter(fetchedAt.plus(cacheTtl));
    }

    private synchronized void refresh() {
        String body;
        try {
            body = restTemplate.getForObject(jwksUri, String.class);
        } catch (RestClientException e) {
            throw new InvalidAssertionException("Failed to fetch JWKS from " + jwksUri, e);
        }
        if (body == null) {
            throw new InvalidAssertionException("Empty JWKS response from " + jwksUri);
        }

        this.keys = parseKeys(body);
        this.fetchedAt = Instant.now();
        log.debug("[GoogleJwksKeySource] JWKS 갱신 완료: keys={}", keys.keySet());
    }

    Map<String, PublicKey> parseKeys(String jwksJson) {
        try {
            JsonNode root = objectMapper.readTree(jwksJson);
            JsonNode keyArray = root.path("keys");
            if (!keyArray.isArray()) {
                throw new InvalidAssertionException("Invalid JWKS format - missing 'keys' array");
            }

            Map<String, PublicKey> parsed = new HashMap<>();
            KeyFactory keyFactory = KeyFactory.getInstance("RSA");
            for (JsonNode jwk : keyArray) {
                if (!"RSA".equals(jwk.path("kty").asText()) || !jwk.hasNonNull("kid")) {
                    continue;
                }
                BigInteger modulus = new BigInteger(1, Base64.getUrlDecoder().decode(jwk.path("n").asText()));
                BigInteger exponent = new BigInteger(1, Base64.getUrlDecoder().decode(jwk.path("e").asText()));
                parsed.put(jwk.get("kid").asText(), keyFactory.generatePublic(new RSAPublicKeySpec(modulus, exponent)));
            }
            return Map.copyOf(parsed);
        } catch (InvalidAssertionException e) {
            throw e;
        } catch (Exception e) {
            throw new InvalidAssertionException("Failed to parse JWKS: " + e.getMessage(), e);
        }
    }
}
