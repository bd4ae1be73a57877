package my.sitescreener.app.support;

import my.sitescreener.app.domain.WeightProfile;
import my.sitescreener.app.dto.WeightProfileRequest;

import java.time.LocalDateTime;

public final class TestProfiles {
	private TestProfiles() {
	}

	public static WeightProfile balanced() {
		WeightProfile profile = new WeightProfile();
		profile.setId(1L);
		profile.setName("default");
		profile.setVersion(1);
		profile.setFinancialWeight(0.35);
		profile.setMarketWeight(0.25);
		profile.setTrajectoryWeight(0.20);
		profile.setCatalystWeight(0.10);
		profile.setRegulationWeight(0.10);
		profile.setYieldWeight(0.40);
		profile.setCushionWeight(0.30);
		profile.setBreakevenWeight(0.30);
		profile.setSaturationWeight(0.35);
		profile.setRentWeight(0.35);
		profile.setDemandWeight(0.30);
		profile.setPopulationGrowthWeight(0.40);
		profile.setIncomeGrowthWeight(0.30);
		profile.setHousingGrowthWeight(0.30);
		profile.setTierAThreshold(80.0);
		profile.setTierBThreshold(65.0);
		profile.setTierCThreshold(50.0);
		profile.setTierDThreshold(35.0);
		profile.setMinYieldThreshold(10.0);
		profile.setMaxSaturationThreshold(12.0);
		profile.setMinCushionThreshold(0.0);
		profile.setActive(true);
		profile.setCreatedAt(LocalDateTime.of(2026, 1, 1, 0, 0));
		profile.setUpdatedAt(LocalDateTime.of(2026, 1, 1, 0, 0));
		return profile;
	}

	public static WeightProfileRequest balancedRequest(String name, boolean activate) {
		return new WeightProfileRequest(name, "balanced",
				0.35, 0.25, 0.20, 0.10, 0.10,
				0.40, 0.30, 0.30,
				0.35, 0.35, 0.30,
				0.40, 0.30, 0.30,
				80.0, 65.0, 50.0, 35.0,
				10.0, 12.0, 0.0,
				activate);
	}
}
