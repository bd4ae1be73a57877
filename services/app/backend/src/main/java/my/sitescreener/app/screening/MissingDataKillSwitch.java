package my.sitescreener.app.screening;

/**
 * Kills candidates the provider knows nothing about for the current stage.
 */
public class MissingDataKillSwitch implements KillSwitch {
	private final String ruleId;
	private final String reason;

	public MissingDataKillSwitch(String ruleId, String reason) {
		this.ruleId = ruleId;
		this.reason = reason;
	}

	@Override
	public String ruleId() {
		return ruleId;
	}

	@Override
	public KillDecision evaluate(CandidateContext candidate) {
		if (candidate.facts().isEmpty()) {
			return KillDecision.kill(ruleId, reason, null, null);
		}
		return KillDecision.pass();
	}
}
