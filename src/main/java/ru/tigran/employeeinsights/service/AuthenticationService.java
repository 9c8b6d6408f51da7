package ru.tigran.employeeinsights.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.tigran.employeeinsights.dto.AuthenticationResponse;
import ru.tigran.employeeinsights.dto.CurrentUserResponse;
import ru.tigran.employeeinsights.dto.LoginRequest;
import ru.tigran.employeeinsights.exception.ErrorCode;
import ru.tigran.employeeinsights.exception.UnauthorizedException;
import ru.tigran.employeeinsights.model.User;
import ru.tigran.employeeinsights.repository.UserRepository;
import ru.tigran.employeeinsights.security.AuthenticatedUser;
import ru.tigran.employeeinsights.security.JwtTokenProvider;

import java.util.Optional;

/**
 * Service for dashboard user authentication.
 * Verifies BCrypt password hashes and issues JWT tokens.
 */
@Slf4j
@Service
public class AuthenticationService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;

    public AuthenticationService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenProvider jwtTokenProvider
    ) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenProvider = jwtTokenProvider;
    }

    /**
     * Authenticates user with username and password.
     *
     * @return Authentication response with access token
     * @throws UnauthorizedException if credentials are invalid or the account is inactive
     */
    @Transactional(readOnly = true)
    public AuthenticationResponse login(LoginRequest request) {
        log.info("User login attempt for username: {}", request.username());

        User user = userRepository.findByUsername(request.username())
                .orElseThrow(() -> {
                    log.warn("Login failed: user not found: {}", request.username());
                    return new UnauthorizedException(ErrorCode.INVALID_CREDENTIALS);
                });

        if (!Boolean.TRUE.equals(user.getIsActive())) {
            log.warn("Login failed: user is inactive: {}", user.getId());
            throw new UnauthorizedException(ErrorCode.USER_INACTIVE);
        }

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            log.warn("Login failed: invalid password for user: {}", user.getId());
            throw new UnauthorizedException(ErrorCode.INVALID_CREDENTIALS);
        }

        log.info("User logged in successfully: {}", user.getId());

        String token = jwtTokenProvider.generateToken(user);
        return new AuthenticationResponse(user.getId(), user.getUsername(), user.getRole().name(), token);
    }

    /**
     * Returns the principal of the current request.
     *
     * @throws UnauthorizedException if the request is not authenticated with a JWT
     */
    public CurrentUserResponse currentUser() {
        AuthenticatedUser user = Optional
                .ofNullable(SecurityContextHolder.getContext().getAuthentication())
                .map(Authentication::getPrincipal)
                .filter(AuthenticatedUser.class::isInstance)
                .map(AuthenticatedUser.class::cast)
                .orElseThrow(() -> new UnauthorizedException(ErrorCode.MISSING_AUTHENTICATION));
        return new CurrentUserResponse(user.userId(), user.username(), user.role().name());
    }
}
