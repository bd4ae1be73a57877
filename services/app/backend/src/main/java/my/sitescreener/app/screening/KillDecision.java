package my.sitescreener.app.screening;

public record KillDecision(
		boolean killed,
		String ruleId,
		String reason,
		Double threshold,
		Double observedValue
) {
	private static final KillDecision PASS = new KillDecision(false, null, null, null, null);

	public static KillDecision pass() {
		return PASS;
	}

	public static KillDecision kill(String ruleId, String reason, Double threshold, Double observedValue) {
		return new KillDecision(true, ruleId, reason, threshold, observedValue);
	}
}
