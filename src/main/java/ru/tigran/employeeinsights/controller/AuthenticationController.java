package ru.tigran.employeeinsights.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.security.SecurityRequirements;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.tigran.employeeinsights.dto.AuthenticationResponse;
import ru.tigran.employeeinsights.dto.CommonResponse;
import ru.tigran.employeeinsights.dto.CurrentUserResponse;
import ru.tigran.employeeinsights.dto.LoginRequest;
import ru.tigran.employeeinsights.service.AuthenticationService;

/**
 * REST API for dashboard user login and token validation.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/auth")
@Tag(name = "Authentication", description = "Логин пользователей дашборда")
public class AuthenticationController {

    private final AuthenticationService authenticationService;

    public AuthenticationController(AuthenticationService authenticationService) {
        this.authenticationService = authenticationService;
    }

    /**
     * Login with username and password.
     *
     * @return 200 OK with user ID, role and JWT access token
     */
    @PostMapping("/login")
    @SecurityRequirements()
    @Operation(
            summary = "Логин пользователя",
            description = "Проверяет имя пользователя и пароль, возвращает JWT токен. " +
                    "Токен необходимо включать в заголовок Authorization: Bearer <token>"
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Успешная аутентификация",
                    content = @Content(schema = @Schema(implementation = AuthenticationResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Пустое имя пользователя или пароль"),
            @ApiResponse(responseCode = "401", description = "Неверные учетные данные или пользователь деактивирован")
    })
    public ResponseEntity<CommonResponse<AuthenticationResponse>> login(@Valid @RequestBody LoginRequest request) {
        log.info("POST /api/v1/auth/login - username: {}", request.username());

        AuthenticationResponse response = authenticationService.login(request);

        return ResponseEntity.ok(CommonResponse.ok(response, "Login successful"));
    }

    @GetMapping("/validate")
    @SecurityRequirement(name = "bearer-jwt")
    @Operation(summary = "Проверить токен", description = "Возвращает пользователя, которому принадлежит токен")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Токен действителен"),
            @ApiResponse(responseCode = "401", description = "Токен отсутствует или невалиден")
    })
    public ResponseEntity<CommonResponse<CurrentUserResponse>> validate() {
        log.debug("GET /api/v1/auth/validate");
        return ResponseEntity.ok(CommonResponse.ok(authenticationService.currentUser()));
    }
}
