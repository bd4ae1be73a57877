package my.sitescreener.app.screening;

import my.sitescreener.app.provider.FactFields;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Heuristic central-city check: the candidate sits in a configured urban core city and is
 * either populous or dense enough to count as the metro core.
 */
public class MsaCoreKillSwitch implements KillSwitch {
	private final String ruleId;
	private final Set<String> urbanCores;
	private final double populationThreshold;
	private final double densityThreshold;

	public MsaCoreKillSwitch(String ruleId, Collection<String> urbanCores, double populationThreshold, double densityThreshold) {
		this.ruleId = ruleId;
		this.urbanCores = urbanCores == null ? Set.of() : urbanCores.stream()
				.map(city -> city.trim().toLowerCase(Locale.ROOT))
				.collect(Collectors.toUnmodifiableSet());
		this.populationThreshold = populationThreshold;
		this.densityThreshold = densityThreshold;
	}

	@Override
	public String ruleId() {
		return ruleId;
	}

	@Override
	public KillDecision evaluate(CandidateContext candidate) {
		Optional<String> city = candidate.text(FactFields.CITY);
		if (city.isEmpty() || !urbanCores.contains(city.get().toLowerCase(Locale.ROOT))) {
			return KillDecision.pass();
		}
		OptionalDouble population = candidate.number(FactFields.POPULATION);
		OptionalDouble density = candidate.number(FactFields.DENSITY);
		boolean populous = population.isPresent() && population.getAsDouble() > populationThreshold;
		boolean dense = density.isPresent() && density.getAsDouble() > densityThreshold;
		if (!populous && !dense) {
			return KillDecision.pass();
		}
		String reason = String.format(Locale.US, "MSA core: %s (pop %,.0f, density %.0f)",
				city.get(), population.orElse(0), density.orElse(0));
		if (populous) {
			return KillDecision.kill(ruleId, reason, populationThreshold, population.getAsDouble());
		}
		return KillDecision.kill(ruleId, reason, densityThreshold, density.getAsDouble());
	}
}
