package my.sitescreener.app.screening;

import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Kills when a numeric field crosses a bound. An unknown value passes.
 */
public class ThresholdKillSwitch implements KillSwitch {
	public enum Bound {
		/** kill when the observed value is strictly greater than the threshold */
		MAX,
		/** kill when the observed value is strictly less than the threshold */
		MIN
	}

	private final String ruleId;
	private final String field;
	private final Bound bound;
	private final double threshold;
	private final String reasonFormat;

	/**
	 * @param reasonFormat format string receiving the observed value and the threshold, in that order
	 */
	public ThresholdKillSwitch(String ruleId, String field, Bound bound, double threshold, String reasonFormat) {
		this.ruleId = ruleId;
		this.field = field;
		this.bound = bound;
		this.threshold = threshold;
		this.reasonFormat = reasonFormat;
	}

	@Override
	public String ruleId() {
		return ruleId;
	}

	@Override
	public KillDecision evaluate(CandidateContext candidate) {
		OptionalDouble observed = candidate.number(field);
		if (observed.isEmpty()) {
			return KillDecision.pass();
		}
		double value = observed.getAsDouble();
		boolean crossed = bound == Bound.MAX ? value > threshold : value < threshold;
		if (!crossed) {
			return KillDecision.pass();
		}
		String reason = String.format(Locale.US, reasonFormat, value, threshold);
		return KillDecision.kill(ruleId, reason, threshold, value);
	}
}
