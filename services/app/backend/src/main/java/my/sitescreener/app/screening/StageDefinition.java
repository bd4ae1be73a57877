package my.sitescreener.app.screening;

import my.sitescreener.app.provider.FactSet;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * One screening stage. Kill switches run in list order and the first kill wins; survivors get
 * the metrics produced by {@code survivorMetrics}.
 */
public record StageDefinition(
		int stage,
		String name,
		FactSet factSet,
		List<KillSwitch> killSwitches,
		Function<CandidateContext, Map<String, Object>> survivorMetrics
) {
	public StageDefinition {
		killSwitches = List.copyOf(killSwitches);
	}

	public KillDecision evaluate(CandidateContext candidate) {
		for (KillSwitch killSwitch : killSwitches) {
			KillDecision decision = killSwitch.evaluate(candidate);
			if (decision.killed()) {
				return decision;
			}
		}
		return KillDecision.pass();
	}

	public List<String> ruleIds() {
		return killSwitches.stream().map(KillSwitch::ruleId).toList();
	}
}
