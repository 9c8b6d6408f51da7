package ru.tigran.employeeinsights.security;

import ru.tigran.employeeinsights.model.User;

/**
 * Principal stored in the SecurityContext for a request carrying a valid JWT.
 */
public record AuthenticatedUser(Long userId, String username, User.Role role) {
}
