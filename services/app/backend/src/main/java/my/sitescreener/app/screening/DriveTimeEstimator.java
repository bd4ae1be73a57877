package my.sitescreener.app.screening;

import my.sitescreener.app.config.AppProperties;

import java.util.List;
import java.util.Optional;

/**
 * Straight-line distance to the nearest configured metro, stretched by a road factor and
 * converted to minutes at an average speed.
 */
public class DriveTimeEstimator {
	private static final double EARTH_RADIUS_MILES = 3959.0;

	private final List<AppProperties.Screening.Metro> metros;
	private final double roadFactor;
	private final double averageSpeedMph;

	public DriveTimeEstimator(List<AppProperties.Screening.Metro> metros, double roadFactor, double averageSpeedMph) {
		this.metros = metros == null ? List.of() : List.copyOf(metros);
		this.roadFactor = roadFactor;
		this.averageSpeedMph = averageSpeedMph;
	}

	public Optional<DriveTime> nearest(double latitude, double longitude) {
		DriveTime best = null;
		for (AppProperties.Screening.Metro metro : metros) {
			double miles = haversineMiles(latitude, longitude, metro.latitude(), metro.longitude());
			double minutes = miles * roadFactor / averageSpeedMph * 60.0;
			if (best == null || minutes < best.minutes()) {
				best = new DriveTime(minutes, metro.name());
			}
		}
		return Optional.ofNullable(best);
	}

	static double haversineMiles(double lat1, double lon1, double lat2, double lon2) {
		double deltaLat = Math.toRadians(lat2 - lat1);
		double deltaLon = Math.toRadians(lon2 - lon1);
		double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2)
				+ Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
				* Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);
		double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
		return EARTH_RADIUS_MILES * c;
	}

	public record DriveTime(double minutes, String metro) {
	}
}
