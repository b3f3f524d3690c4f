package my.projectalpha.app.api;

import jakarta.validation.Valid;
import my.projectalpha.app.dto.AuthRequest;
import my.projectalpha.app.dto.AuthResponse;
import my.projectalpha.app.service.AccessTokenService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.authentication.AuthenticationManager;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

/**
 * Exchanges the admin credentials for a bearer token. Logout answers 401 with a fresh realm so
 * browsers drop cached basic credentials.
 */
@RestController
@RequestMapping({"/api/auth", "/auth"})
public class AuthController {
	private static final String LOGOUT_REALM = "Project Alpha (Logged out)";
	private final AuthenticationManager authenticationManager;
	private final AccessTokenService tokenService;

	public AuthController(AuthenticationManager authenticationManager, AccessTokenService tokenService) {
		this.authenticationManager = authenticationManager;
		this.tokenService = tokenService;
	}

	@PostMapping("/token")
	public AuthResponse token(@Valid @RequestBody AuthRequest request) {
		Authentication authentication;
		try {
			authentication = authenticationManager.authenticate(
					new UsernamePasswordAuthenticationToken(request.username(), request.password()));
		} catch (AuthenticationException ex) {
			throw new IllegalArgumentException("Invalid credentials", ex);
		}
		return tokenService.issue(authentication);
	}

	@RequestMapping(value = "/logout", method = {RequestMethod.GET, RequestMethod.POST})
	public ResponseEntity<Void> logout() {
		HttpHeaders headers = new HttpHeaders();
		headers.add(HttpHeaders.WWW_AUTHENTICATE, "Basic realm=\"" + LOGOUT_REALM + "\"");
		headers.add(HttpHeaders.CACHE_CONTROL, "no-store");
		headers.add(HttpHeaders.PRAGMA, "no-cache");
		return new ResponseEntity<>(headers, HttpStatus.UNAUTHORIZED);
	}
}
