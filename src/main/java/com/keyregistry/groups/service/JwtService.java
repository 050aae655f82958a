package com.keyregistry.groups.service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * HS256 bearer tokens whose subject is the caller's identity.
 * Tokens are issued by the identity provider in front of the registry; {@link #generateToken}
 * exists for local runs and tests.
 */
@Service
public class JwtService {

    /**
     * Signing secret from 'jwt.secret'. The default only lets local runs and builds start;
     * deployed environments override it.
     */
    @Value("${jwt.secret:default_secret_for_local_development_only_12345}")
    private String secretKey;

    private static final long ACCESS_TOKEN_EXPIRATION = 1800000; // 30 minutes

    private SecretKey key;

    @PostConstruct
    public void init() {
        // Ensure secret key has proper entropy
        if (secretKey.length() < 32) {
            throw new IllegalArgumentException("JWT secret key must be at least 32 characters (was " + secretKey.length() + ")");
        }
        this.key = Keys.hmacShaKeyFor(secretKey.getBytes(StandardCharsets.UTF_8));
    }

    public String generateToken(String userId) {
        return Jwts.builder()
                .subject(userId)
                .issuedAt(new Date())
                .expiration(new Date(System.currentTimeMillis() + ACCESS_TOKEN_EXPIRATION))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    public String extractUserId(String token) {
        return extractClaims(token).getSubject();
    }

    public boolean isTokenValid(String token) {
        try {
            Claims claims = extractClaims(token);
            return claims.getSubject() != null && claims.getExpiration() != null
                && !claims.getExpiration().before(new Date());
        } catch (JwtException | IllegalArgumentException e) {
            return false;
        }
    }

    private Claims extractClaims(String token) {
        return Jwts.parser()
                .verifyWith(key)
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }
}
