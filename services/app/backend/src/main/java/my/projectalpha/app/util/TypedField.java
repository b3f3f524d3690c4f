package my.projectalpha.app.util;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Binds an external field name (tape header, extraction key, API key) to a typed entity property.
 */
public record TypedField<T>(String name,
							FieldType type,
							Integer maxLength,
							Function<T, Object> getter,
							BiConsumer<T, Object> setter) {

	public static <T> TypedField<T> string(String name, int maxLength, Function<T, Object> getter, BiConsumer<T, Object> setter) {
		return new TypedField<>(name, FieldType.STRING, maxLength, getter, setter);
	}

	public static <T> TypedField<T> of(String name, FieldType type, Function<T, Object> getter, BiConsumer<T, Object> setter) {
		return new TypedField<>(name, type, null, getter, setter);
	}

	public Object read(T target) {
		return getter.apply(target);
	}

	public void write(T target, Object value) {
		setter.accept(target, value);
	}

	public boolean exceedsMaxLength(Object value) {
		return maxLength != null && value instanceof String text && text.length() > maxLength;
	}
}
