package uk.gegc.learnhub.features.user.application;

import lombok.RequiredArgsConstructor;
import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.learnhub.features.user.domain.model.RoleName;
import uk.gegc.learnhub.features.user.domain.model.User;
import uk.gegc.learnhub.features.user.domain.repository.UserRepository;
import uk.gegc.learnhub.shared.exception.UnauthorizedException;

import java.util.UUID;

/**
 * Maps the authenticated principal to the caller's account.
 * The principal name may be a user id, a username or an email.
 */
@Component
@RequiredArgsConstructor
public class AuthenticatedUserResolver {

    private final UserRepository userRepository;

    @Transactional(readOnly = true)
    public CurrentUser resolve(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            throw new UnauthorizedException("Authentication required");
        }
        String principal = authentication.getName();
        User user = findByPrincipal(principal);
        if (!user.isActive()) {
            throw new UnauthorizedException("User account is disabled");
        }
        return new CurrentUser(user.getId(), user.getRole());
    }

    private User findByPrincipal(String principal) {
        try {
            UUID id = UUID.fromString(principal);
            return userRepository.findById(id)
                    .orElseThrow(() -> new UnauthorizedException("Unknown principal"));
        } catch (IllegalArgumentException ignored) {
            return userRepository.findByUsername(principal)
                    .or(() -> userRepository.findByEmail(principal))
                    .orElseThrow(() -> new UnauthorizedException("Unknown principal"));
        }
    }

    public record CurrentUser(UUID id, RoleName role) {

        public boolean isAdmin() {
            return role == RoleName.ADMIN;
        }

        public boolean isStaff() {
            return role == RoleName.ADMIN || role == RoleName.INSTRUCTOR;
        }
    }
}
