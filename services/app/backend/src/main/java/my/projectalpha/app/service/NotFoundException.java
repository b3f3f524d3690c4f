package my.projectalpha.app.service;

/**
 * A referenced row does not exist. Mapped to 404.
 */
public class NotFoundException extends RuntimeException {
	public NotFoundException(String message) {
		super(message);
	}

	public static NotFoundException of(String entity, Object id) {
		return new NotFoundException(entity + " not found: " + id);
	}
}
