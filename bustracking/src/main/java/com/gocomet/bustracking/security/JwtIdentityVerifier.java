package com.gocomet.bustracking.security;

import com.gocomet.bustracking.common.exception.UnauthorizedException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Date;

/**
 * HS256 bearer tokens: subject is the principal id, {@code role} holds a {@link Role}
 * name and {@code name} the display name.
 */
@Service
public class JwtIdentityVerifier implements IdentityVerifier {

    private static final String BEARER_PREFIX = "Bearer ";

    private final Clock clock;

    @Value("${jwt.secret:default_secret_for_local_development_only_12345}")
    private String secretKey;

    private SecretKey key;

    public JwtIdentityVerifier(Clock clock) {
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (secretKey.length() < 32) {
            throw new IllegalArgumentException("JWT secret key must be at least 32 characters (was " + secretKey.length() + ")");
        }
        this.key = Keys.hmacShaKeyFor(secretKey.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Issue a token for a principal. Used by the identity provider integration and tests.
     */
    public String issueToken(String principalId, Role role, String name, Duration ttl) {
        Date now = Date.from(clock.instant());
        return Jwts.builder()
                .subject(principalId)
                .claim("role", role.name())
                .claim("name", name)
                .issuedAt(now)
                .expiration(Date.from(clock.instant().plus(ttl)))
                .signWith(key, Jwts.SIG.HS256)
                .compact();
    }

    @Override
    public AuthPrincipal verify(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.startsWith(BEARER_PREFIX)) {
            throw new UnauthorizedException("Missing bearer token");
        }
        String token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new UnauthorizedException("Invalid or expired token", e);
        }

        String roleClaim = claims.get("role", String.class);
        if (roleClaim == null) {
            throw new UnauthorizedException("Token carries no role");
        }
        Role role;
        try {
            role = Role.valueOf(roleClaim);
        } catch (IllegalArgumentException e) {
            throw new UnauthorizedException("Token carries an unknown role", e);
        }
        return new AuthPrincipal(claims.getSubject(), role, claims.get("name", String.class));
    }

    @Override
    public AuthPrincipal verify(String authorizationHeader, Role... allowedRoles) {
        AuthPrincipal principal = verify(authorizationHeader);
        if (allowedRoles.length > 0 && Arrays.stream(allowedRoles).noneMatch(r -> r == principal.getRole())) {
            throw new UnauthorizedException("Role " + principal.getRole() + " may not perform this action");
        }
        return principal;
    }
}
