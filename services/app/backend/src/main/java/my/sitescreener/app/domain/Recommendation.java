package my.sitescreener.app.domain;

public enum Recommendation {
	STRONG_PURSUE("strong_pursue"),
	PURSUE("pursue"),
	MONITOR("monitor"),
	AVOID("avoid");

	private final String label;

	Recommendation(String label) {
		this.label = label;
	}

	public String getLabel() {
		return label;
	}

	public static Recommendation fromLabel(String label) {
		for (Recommendation recommendation : values()) {
			if (recommendation.label.equals(label)) {
				return recommendation;
			}
		}
		throw new IllegalArgumentException("Unknown recommendation: " + label);
	}

	public static Recommendation of(Tier tier, boolean fatalFlaw) {
		if (fatalFlaw || tier == null) {
			return AVOID;
		}
		return switch (tier) {
			case A -> STRONG_PURSUE;
			case B -> PURSUE;
			case C -> MONITOR;
			case D, F -> AVOID;
		};
	}
}
