package org.javai.nlrecon.intent.extract;

/**
 * A table mention proposed by an extractor for one slot of the intent.
 */
public record ExtractedEntity(Role role, String mention, double confidence) {

	public enum Role {
		SOURCE,
		TARGET,
		ADDITIONAL
	}

	public ExtractedEntity {
		if (role == null) {
			throw new IllegalArgumentException("role must not be null");
		}
		if (mention == null || mention.isBlank()) {
			throw new IllegalArgumentException("mention must not be blank");
		}
		confidence = clamp(confidence);
	}

	static double clamp(double value) {
		if (Double.isNaN(value)) {
			return 0.0;
		}
		return Math.max(0.0, Math.min(1.0, value));
	}
}
