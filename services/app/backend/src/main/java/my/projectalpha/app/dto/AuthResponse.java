package my.projectalpha.app.dto;

public record AuthResponse(String token, String tokenType, long expiresIn) {
}
