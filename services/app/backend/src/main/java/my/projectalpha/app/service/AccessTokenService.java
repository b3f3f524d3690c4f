package my.projectalpha.app.service;

import my.projectalpha.app.config.AppProperties;
import my.projectalpha.app.dto.AuthResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Mints HS256 bearer tokens for an authenticated user. The roles claim carries the user's roles
 * without the {@code ROLE_} prefix.
 */
@Service
public class AccessTokenService {
	private static final Logger logger = LoggerFactory.getLogger(AccessTokenService.class);
	static final String TOKEN_TYPE = "Bearer";
	private static final String ROLE_PREFIX = "ROLE_";
	private final JwtEncoder jwtEncoder;
	private final AppProperties.Jwt settings;

	public AccessTokenService(JwtEncoder jwtEncoder, AppProperties properties) {
		this.jwtEncoder = jwtEncoder;
		this.settings = properties.jwt();
	}

	public AuthResponse issue(Authentication authentication) {
		long ttl = settings.resolvedTtlSeconds();
		List<String> roles = authentication.getAuthorities().stream()
				.map(GrantedAuthority::getAuthority)
				.filter(authority -> authority != null && authority.startsWith(ROLE_PREFIX))
				.map(authority -> authority.substring(ROLE_PREFIX.length()))
				.toList();
		Instant now = Instant.now();
		JwtClaimsSet claims = JwtClaimsSet.builder()
				.issuer(settings.issuer())
				.subject(authentication.getName())
				.issuedAt(now)
				.expiresAt(now.plusSeconds(ttl))
				.claim("roles", roles)
				.build();
		JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
		String token = jwtEncoder.encode(JwtEncoderParameters.from(header, claims)).getTokenValue();
		logger.info("Issued access token for {} with roles {} (ttl {} s).", authentication.getName(), roles, ttl);
		return new AuthResponse(token, TOKEN_TYPE, ttl);
	}
}
