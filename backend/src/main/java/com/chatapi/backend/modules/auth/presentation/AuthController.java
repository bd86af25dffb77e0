package com.chatapi.backend.modules.auth.presentation;

import com.chatapi.backend.global.error.ProblemException;
import com.chatapi.backend.global.security.AuthCookies;
import com.chatapi.backend.global.security.RefreshTokenGuard;
import com.chatapi.backend.global.security.SecurityUtils;
import com.chatapi.backend.modules.auth.application.AuthService;
import com.chatapi.backend.modules.auth.application.AuthenticatedSession;
import com.chatapi.backend.modules.auth.application.ClientMetadata;
import com.chatapi.backend.modules.auth.presentation.dto.AuthResponse;
import com.chatapi.backend.modules.auth.presentation.dto.ChangePasswordRequest;
import com.chatapi.backend.modules.auth.presentation.dto.DeleteAccountRequest;
import com.chatapi.backend.modules.auth.presentation.dto.LoginRequest;
import com.chatapi.backend.modules.auth.presentation.dto.MessageResponse;
import com.chatapi.backend.modules.auth.presentation.dto.PasswordChangeResponse;
import com.chatapi.backend.modules.auth.presentation.dto.SignupRequest;
import com.chatapi.backend.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/auth")
public class AuthController {

    private final AuthService authService;
    private final AuthCookies authCookies;
    private final RefreshTokenGuard refreshTokenGuard;

    public AuthController(AuthService authService, AuthCookies authCookies, RefreshTokenGuard refreshTokenGuard) {
        this.authService = authService;
        this.authCookies = authCookies;
        this.refreshTokenGuard = refreshTokenGuard;
    }

    @Operation(summary = "회원 가입", description = "이메일/비밀번호/닉네임으로 계정을 만든다. 토큰은 발급하지 않는다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "가입 성공"),
            @ApiResponse(responseCode = "400", description = "입력값 오류"),
            @ApiResponse(responseCode = "409", description = "이미 가입된 이메일")
    })
    @PostMapping("/signup")
    public ResponseEntity<UserProfileResponse> signup(@Valid @RequestBody SignupRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.signUp(request));
    }

    @Operation(summary = "로그인", description = "액세스 토큰을 본문과 jwt 쿠키로, 리프레시 토큰을 refresh_token 쿠키로 내려준다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "로그인 성공"),
            @ApiResponse(responseCode = "401", description = "이메일 또는 비밀번호 불일치")
    })
    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request,
                                              HttpServletRequest httpRequest,
                                              HttpServletResponse httpResponse) {
        AuthenticatedSession session = authService.login(request, clientMetadata(httpRequest));
        authCookies.write(httpResponse, session);
        return ResponseEntity.status(HttpStatus.CREATED).body(new AuthResponse(session.accessToken(), session.user()));
    }

    @Operation(summary = "토큰 갱신", description = "refresh_token 쿠키를 한 번 사용하고 새 토큰 쌍으로 교체한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "갱신 성공"),
            @ApiResponse(responseCode = "401", description = "리프레시 토큰 없음/만료/폐기/재사용")
    })
    @PostMapping("/refresh")
    public ResponseEntity<AuthResponse> refresh(HttpServletRequest httpRequest, HttpServletResponse httpResponse) {
        AuthenticatedSession session;
        try {
            String refreshToken = refreshTokenGuard.requireRefreshToken(httpRequest);
            session = authService.refresh(refreshToken, clientMetadata(httpRequest));
        } catch (ProblemException ex) {
            authCookies.clear(httpResponse);
            throw ex;
        }
        authCookies.write(httpResponse, session);
        return ResponseEntity.status(HttpStatus.CREATED).body(new AuthResponse(session.accessToken(), session.user()));
    }

    @Operation(summary = "로그아웃", description = "현재 액세스 토큰을 폐기하고 연결된 리프레시 세션을 종료한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "로그아웃 성공"),
            @ApiResponse(responseCode = "401", description = "인증 필요")
    })
    @PostMapping("/logout")
    public ResponseEntity<MessageResponse> logout(HttpServletRequest httpRequest, HttpServletResponse httpResponse) {
        authService.logout(SecurityUtils.getCurrentAccessToken(), refreshTokenGuard.findRefreshToken(httpRequest));
        authCookies.clear(httpResponse);
        return ResponseEntity.ok(new MessageResponse("Logged out successfully"));
    }

    @Operation(summary = "회원 탈퇴", description = "비밀번호 확인 후 모든 세션을 폐기하고 계정을 삭제한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "탈퇴 성공"),
            @ApiResponse(responseCode = "401", description = "인증 필요 또는 비밀번호 불일치")
    })
    @DeleteMapping("/signout")
    public ResponseEntity<MessageResponse> signout(@Valid @RequestBody DeleteAccountRequest request,
                                                   HttpServletResponse httpResponse) {
        authService.deleteAccount(
                SecurityUtils.getCurrentUserId(),
                request.password(),
                SecurityUtils.getCurrentAccessToken()
        );
        authCookies.clear(httpResponse);
        return ResponseEntity.ok(new MessageResponse("Account deleted successfully"));
    }

    @Operation(summary = "비밀번호 변경", description = "변경 후 모든 세션이 종료되므로 다시 로그인해야 한다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "변경 성공"),
            @ApiResponse(responseCode = "401", description = "인증 필요 또는 현재 비밀번호 불일치")
    })
    @PatchMapping("/password")
    public ResponseEntity<PasswordChangeResponse> changePassword(@Valid @RequestBody ChangePasswordRequest request,
                                                                 HttpServletResponse httpResponse) {
        authService.changePassword(
                SecurityUtils.getCurrentUserId(),
                request.currentPassword(),
                request.newPassword(),
                SecurityUtils.getCurrentAccessToken()
        );
        authCookies.clear(httpResponse);
        return ResponseEntity.ok(new PasswordChangeResponse(true));
    }

    private static ClientMetadata clientMetadata(HttpServletRequest request) {
        return ClientMetadata.of(request.getHeader(HttpHeaders.USER_AGENT), request.getRemoteAddr());
    }
}
