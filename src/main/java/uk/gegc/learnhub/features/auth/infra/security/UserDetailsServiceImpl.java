package uk.gegc.learnhub.features.auth.infra.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.learnhub.features.user.domain.model.User;
import uk.gegc.learnhub.features.user.domain.repository.UserRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserDetailsServiceImpl implements UserDetailsService {

    private final UserRepository userRepository;

    @Override
    @Transactional(readOnly = true)
    public UserDetails loadUserByUsername(String identifier) throws UsernameNotFoundException {
        User user = userRepository.findByUsername(identifier)
                .or(() -> userRepository.findByEmail(identifier))
                .or(() -> findById(identifier))
                .orElseThrow(() -> new UsernameNotFoundException("User not found: " + identifier));

        if (!user.isActive()) {
            throw new UsernameNotFoundException("User is disabled: " + identifier);
        }

        log.debug("User '{}' authenticated with role {}", user.getUsername(), user.getRole());

        // Tokens are verified upstream; no password is held here.
        return new org.springframework.security.core.userdetails.User(
                user.getUsername(),
                "",
                true,
                true,
                true,
                true,
                List.of(new SimpleGrantedAuthority(user.getRole().authority()))
        );
    }

    private Optional<User> findById(String identifier) {
        try {
            return userRepository.findById(UUID.fromString(identifier));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }
}
