package com.vybe.backend.modules.auth.presentation;

import com.vybe.backend.global.security.SecurityUtils;
import com.vybe.backend.global.web.ClientIpResolver;
import com.vybe.backend.modules.auth.application.AuthService;
import com.vybe.backend.modules.auth.presentation.dto.AccountSummaryResponse;
import com.vybe.backend.modules.auth.presentation.dto.AppleAuthRequest;
import com.vybe.backend.modules.auth.presentation.dto.AuthResponse;
import com.vybe.backend.modules.auth.presentation.dto.GoogleAuthRequest;
import com.vybe.backend.modules.auth.presentation.dto.RefreshRequest;
import com.vybe.backend.modules.auth.presentation.dto.SendCodeRequest;
import com.vybe.backend.modules.auth.presentation.dto.SendCodeResponse;
import com.vybe.backend.modules.auth.presentation.dto.TokenPairResponse;
import com.vybe.backend.modules.auth.presentation.dto.VerifyPhoneRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @Operation(
            summary = "Send a phone verification code",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Code issued"),
                    @ApiResponse(responseCode = "429", description = "Too many code requests")
            }
    )
    @PostMapping("/auth/phone/send-code")
    public ResponseEntity<SendCodeResponse> sendCode(
            @Valid @RequestBody SendCodeRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(authService.sendVerificationCode(request.phone(), ClientIpResolver.resolve(httpRequest)));
    }

    @Operation(summary = "Sign in with a phone verification code")
    @PostMapping("/auth/phone/verify")
    public ResponseEntity<AuthResponse> verifyPhone(
            @Valid @RequestBody VerifyPhoneRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(authService.verifyPhoneCode(
                request.phone(),
                request.code(),
                request.deviceType(),
                ClientIpResolver.resolve(httpRequest)
        ));
    }

    @Operation(summary = "Sign in with a Google ID token")
    @PostMapping("/auth/google")
    public ResponseEntity<AuthResponse> google(
            @Valid @RequestBody GoogleAuthRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(authService.authenticateWithGoogle(
                request.idToken(),
                request.deviceType(),
                ClientIpResolver.resolve(httpRequest)
        ));
    }

    @Operation(summary = "Sign in with an Apple identity token")
    @PostMapping("/auth/apple")
    public ResponseEntity<AuthResponse> apple(
            @Valid @RequestBody AppleAuthRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(authService.authenticateWithApple(
                request.identityToken(),
                request.givenName(),
                request.familyName(),
                request.deviceType(),
                ClientIpResolver.resolve(httpRequest)
        ));
    }

    @Operation(
            summary = "Rotate the refresh token",
            description = "Presenting a refresh token that was already rotated revokes every session of the account.",
            responses = {
                    @ApiResponse(responseCode = "200", description = "New token pair"),
                    @ApiResponse(responseCode = "401", description = "INVALID_REFRESH_TOKEN or SESSION_COMPROMISED")
            }
    )
    @PostMapping("/auth/refresh")
    public ResponseEntity<TokenPairResponse> refresh(
            @Valid @RequestBody RefreshRequest request,
            HttpServletRequest httpRequest
    ) {
        return ResponseEntity.ok(authService.refresh(request.refreshToken(), ClientIpResolver.resolve(httpRequest)));
    }

    @Operation(summary = "Revoke the current session")
    @PostMapping("/auth/logout")
    public ResponseEntity<Void> logout() {
        authService.logout(SecurityUtils.getCurrentSessionId());
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Profile of the signed-in account")
    @GetMapping("/auth/me")
    public ResponseEntity<AccountSummaryResponse> me() {
        return ResponseEntity.ok(authService.loadAccount(SecurityUtils.getCurrentUserId()));
    }
}
