package my.sitescreener.app.screening;

import my.sitescreener.app.provider.FactFields;

import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

public class DriveTimeKillSwitch implements KillSwitch {
	private final String ruleId;
	private final DriveTimeEstimator estimator;
	private final double maxMinutes;

	public DriveTimeKillSwitch(String ruleId, DriveTimeEstimator estimator, double maxMinutes) {
		this.ruleId = ruleId;
		this.estimator = estimator;
		this.maxMinutes = maxMinutes;
	}

	@Override
	public String ruleId() {
		return ruleId;
	}

	@Override
	public KillDecision evaluate(CandidateContext candidate) {
		OptionalDouble latitude = candidate.number(FactFields.LATITUDE);
		OptionalDouble longitude = candidate.number(FactFields.LONGITUDE);
		if (latitude.isEmpty() || longitude.isEmpty()) {
			return KillDecision.pass();
		}
		Optional<DriveTimeEstimator.DriveTime> driveTime = estimator.nearest(latitude.getAsDouble(), longitude.getAsDouble());
		if (driveTime.isEmpty() || driveTime.get().minutes() <= maxMinutes) {
			return KillDecision.pass();
		}
		DriveTimeEstimator.DriveTime nearest = driveTime.get();
		String reason = String.format(Locale.US, "Drive time %.0f min to %s exceeds %.0f",
				nearest.minutes(), nearest.metro(), maxMinutes);
		return KillDecision.kill(ruleId, reason, maxMinutes, nearest.minutes());
	}
}
