package my.portfolioanalyst.app.model;

import java.util.Locale;
import java.util.Optional;

public enum Recommendation {
	BUY,
	SELL,
	RETAIN;

	public static Optional<Recommendation> parse(String raw) {
		if (raw == null || raw.isBlank()) {
			return Optional.empty();
		}
		String normalized = raw.trim().toUpperCase(Locale.ROOT);
		for (Recommendation value : values()) {
			if (value.name().equals(normalized)) {
				return Optional.of(value);
			}
		}
		return Optional.empty();
	}
}
