package com.roombroker.domain.auth.service;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.Claim;
import com.auth0.jwt.interfaces.DecodedJWT;
import com.roombroker.domain.auth.dto.AuthResult;
import com.roombroker.global.config.CredentialProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * 공유 비밀키(HS256)로 베어러 토큰 서명을 검증하고 userId 클레임을 꺼낸다.
 * 네트워크나 저장소에 접근하지 않는 순수 계산이다.
 * 기본 모드는 서명만 확인하며, require-expiry가 켜져 있을 때만 exp/nbf/iat를 검사한다.
 */
@Service
public class CredentialValidator {

    public static final String INVALID_TOKEN = "invalid token";
    public static final String MISSING_IDENTITY_CLAIM = "missing identity claim";
    public static final String MISSING_EXPIRY_CLAIM = "missing expiry claim";

    static final String USER_ID_CLAIM = "userId";
    private static final String BEARER_PREFIX = "Bearer ";

    private static final Logger log = LoggerFactory.getLogger(CredentialValidator.class);

    private final Algorithm algorithm;
    private final JWTVerifier timeBoundVerifier;
    private final boolean requireExpiry;

    public CredentialValidator(CredentialProperties properties) {
        this.algorithm = Algorithm.HMAC256(properties.getSecretBytes());
        this.timeBoundVerifier = JWT.require(algorithm)
                .acceptLeeway(properties.getLeewaySeconds())
                .build();
        this.requireExpiry = properties.isRequireExpiry();
    }

    public AuthResult validate(String credential) {
        String token = stripBearer(credential);
        if (token == null || token.isBlank()) {
            return AuthResult.failure(INVALID_TOKEN);
        }
        DecodedJWT decoded;
        try {
            decoded = requireExpiry ? timeBoundVerifier.verify(token) : verifySignatureOnly(token);
        } catch (JWTVerificationException ex) {
            log.debug("Credential rejected: {}", ex.getClass().getSimpleName());
            return AuthResult.failure(INVALID_TOKEN);
        }
        if (requireExpiry && decoded.getExpiresAtAsInstant() == null) {
            return AuthResult.failure(MISSING_EXPIRY_CLAIM);
        }
        Claim claim = decoded.getClaim(USER_ID_CLAIM);
        String userId = claim.isMissing() || claim.isNull() ? null : claim.asString();
        if (userId == null || userId.isBlank()) {
            return AuthResult.failure(MISSING_IDENTITY_CLAIM);
        }
        return AuthResult.success(userId);
    }

    private DecodedJWT verifySignatureOnly(String token) {
        // JWTDecodeException, SignatureVerificationException 모두 JWTVerificationException 하위 타입이다.
        DecodedJWT decoded = JWT.decode(token);
        if (!algorithm.getName().equals(decoded.getAlgorithm())) {
            throw new JWTVerificationException("Unexpected algorithm " + decoded.getAlgorithm());
        }
        algorithm.verify(decoded);
        return decoded;
    }

    private String stripBearer(String credential) {
        if (credential == null) {
            return null;
        }
        String trimmed = credential.trim();
        if (trimmed.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return trimmed.substring(BEARER_PREFIX.length()).trim();
        }
        return trimmed;
    }
}
