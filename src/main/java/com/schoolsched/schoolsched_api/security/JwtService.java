package com.schoolsched.schoolsched_api.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import com.schoolsched.schoolsched_api.model.Role;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;

/**
 * Reads the bearer tokens issued by the school's identity service. The subject is the user name,
 * the {@code role} claim a comma-separated authority list.
 */
@Service
public class JwtService {

    private static final Logger logger = LoggerFactory.getLogger(JwtService.class);

    static final String ROLE_CLAIM = "role";
    private static final long EXPIRATION_TIME_MS = 1000 * 60 * 60 * 24; // 24 hours

    @Value("${jwt.secret}")
    private String secretKeyString;

    public String extractUsername(String token) {
        return extractClaim(token, Claims::getSubject);
    }

    /**
     * Known roles of the token. Unknown entries are ignored.
     */
    public List<Role> extractRoles(String token) {
        String roles = extractClaim(token, claims -> claims.get(ROLE_CLAIM, String.class));
        List<Role> result = new ArrayList<>();
        if (roles == null) {
            return result;
        }
        for (String role : roles.split(",")) {
            String name = role.trim();
            try {
                result.add(Role.valueOf(name));
            } catch (IllegalArgumentException e) {
                logger.warn("Ignoring unknown role '{}' in token", name);
            }
        }
        return result;
    }

    public <T> T extractClaim(String token, Function<Claims, T> claimsResolver) {
        final Claims claims = extractAllClaims(token);
        return claimsResolver.apply(claims);
    }

    public String generateToken(String username, Collection<Role> roles) {
        long now = System.currentTimeMillis();
        String roleClaim = roles.stream().map(Role::name).collect(Collectors.joining(","));
        return Jwts.builder()
                .claim(ROLE_CLAIM, roleClaim)
                .subject(username)
                .issuedAt(new Date(now))
                .expiration(new Date(now + EXPIRATION_TIME_MS))
                .signWith(getSigningKey())
                .compact();
    }

    public boolean isTokenValid(String token) {
        try {
            final String username = extractUsername(token);
            boolean isValid = username != null && !username.isBlank() && !isTokenExpired(token);
            if (!isValid) {
                logger.warn("Token validation failed. Subject present: {}", username != null);
            }
            return isValid;
        } catch (SignatureException e) {
            logger.error("Invalid JWT signature: {}", e.getMessage());
        } catch (MalformedJwtException e) {
            logger.error("Invalid JWT token format: {}", e.getMessage());
        } catch (ExpiredJwtException e) {
            logger.warn("Expired JWT token: {}", e.getMessage());
        } catch (UnsupportedJwtException e) {
            logger.error("Unsupported JWT token: {}", e.getMessage());
        } catch (JwtException e) {
            logger.error("JWT could not be processed: {}", e.getMessage());
        } catch (IllegalArgumentException e) {
            logger.error("JWT claims string is empty or argument is invalid: {}", e.getMessage());
        }
        return false;
    }

    private boolean isTokenExpired(String token) {
        return extractClaim(token, Claims::getExpiration).before(new Date());
    }

    private Claims extractAllClaims(String token) {
        return Jwts.parser()
                .verifyWith(getSigningKey())
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    /**
     * Accepts any configured string and derives a 32-byte HMAC key from it with SHA-256.
     */
    private SecretKey getSigningKey() {
        if (secretKeyString == null || secretKeyString.isEmpty()) {
            logger.error("FATAL: JWT Secret Key (jwt.secret) is not configured!");
            throw new IllegalStateException("JWT Secret Key is missing. Please set JWT_SECRET environment variable.");
        }
        if (secretKeyString.length() < 8) {
            logger.warn("JWT Secret is too short ({} characters). Consider using at least 16 characters.",
                    secretKeyString.length());
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return Keys.hmacShaKeyFor(digest.digest(secretKeyString.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            logger.error("FATAL: SHA-256 algorithm not available: {}", e.getMessage());
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
