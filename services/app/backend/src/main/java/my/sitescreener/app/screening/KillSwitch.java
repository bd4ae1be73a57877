package my.sitescreener.app.screening;

/**
 * Pure predicate over one candidate. Implementations must not touch any store.
 */
public interface KillSwitch {
	String ruleId();

	KillDecision evaluate(CandidateContext candidate);
}
