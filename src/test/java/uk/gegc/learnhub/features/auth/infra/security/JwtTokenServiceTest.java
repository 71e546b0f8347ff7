package uk.gegc.learnhub.features.auth.infra.security;

import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.test.util.ReflectionTestUtils;
import uk.gegc.learnhub.BaseUnitTest;

import javax.crypto.SecretKey;
import java.util.Date;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.when;

class JwtTokenServiceTest extends BaseUnitTest {

    private static final String SECRET = "dGVzdC1zZWNyZXQta2V5LWZvci1sZWFybmh1Yi1pbnRlZ3JhdGlvbi10ZXN0cy0xMjM0NTY3ODkw";

    @Mock
    private UserDetailsService userDetailsService;

    private JwtTokenService tokenService;
    private SecretKey key;

    @BeforeEach
    void setUp() {
        tokenService = new JwtTokenService(userDetailsService);
        ReflectionTestUtils.setField(tokenService, "base64secret", SECRET);
        tokenService.init();
        key = Keys.hmacShaKeyFor(Decoders.BASE64.decode(SECRET));
    }

    private String token(String subject, String type, Date expiration, SecretKey signingKey) {
        JwtBuilder builder = Jwts.builder().subject(subject).issuedAt(new Date());
        if (type != null) {
            builder.claim("type", type);
        }
        if (expiration != null) {
            builder.expiration(expiration);
        }
        return builder.signWith(signingKey).compact();
    }

    @Test
    @DisplayName("Access tokens signed with the configured key are valid")
    void validAccessToken() {
        assertTrue(tokenService.validateToken(token("alice", "access", null, key)));
        assertTrue(tokenService.validateToken(token("alice", null, null, key)));
    }

    @Test
    @DisplayName("Refresh tokens, expired tokens and foreign signatures are rejected")
    void rejectedTokens() {
        SecretKey otherKey = Keys.hmacShaKeyFor("another-secret-key-of-sufficient-length-for-hs256!".getBytes());

        assertFalse(tokenService.validateToken(token("alice", "refresh", null, key)));
        assertFalse(tokenService.validateToken(token("alice", "access", new Date(System.currentTimeMillis() - 60_000), key)));
        assertFalse(tokenService.validateToken(token("alice", "access", null, otherKey)));
        assertFalse(tokenService.validateToken("not-a-jwt"));
        assertFalse(tokenService.validateToken(""));
    }

    @Test
    @DisplayName("Authentication carries the user's authorities")
    void authenticationFromToken() {
        when(userDetailsService.loadUserByUsername("alice")).thenReturn(
                new User("alice", "", List.of(new SimpleGrantedAuthority("ROLE_STUDENT"))));

        Authentication authentication = tokenService.getAuthentication(token("alice", "access", null, key));

        assertThat(authentication.getName()).isEqualTo("alice");
        assertThat(authentication.getAuthorities()).extracting("authority").containsExactly("ROLE_STUDENT");
    }
}
