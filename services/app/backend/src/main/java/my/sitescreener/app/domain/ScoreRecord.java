package my.sitescreener.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

@Entity
@Table(name = "score_records", uniqueConstraints = @UniqueConstraint(columnNames = {"county_fips", "weight_profile_id"}))
public class ScoreRecord {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "id")
	private Long id;

	@Column(name = "county_fips", nullable = false)
	private String countyFips;

	@Column(name = "weight_profile_id", nullable = false)
	private Long weightProfileId;

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "raw_inputs", nullable = false)
	private Map<String, Object> rawInputs;

	@Column(name = "yield_score", nullable = false)
	private Double yieldScore;

	@Column(name = "cushion_score", nullable = false)
	private Double cushionScore;

	@Column(name = "breakeven_score", nullable = false)
	private Double breakevenScore;

	@Column(name = "saturation_score", nullable = false)
	private Double saturationScore;

	@Column(name = "rent_score", nullable = false)
	private Double rentScore;

	@Column(name = "demand_score", nullable = false)
	private Double demandScore;

	@Column(name = "population_growth_score", nullable = false)
	private Double populationGrowthScore;

	@Column(name = "income_growth_score", nullable = false)
	private Double incomeGrowthScore;

	@Column(name = "housing_growth_score", nullable = false)
	private Double housingGrowthScore;

	@Column(name = "financial_score", nullable = false)
	private Double financialScore;

	@Column(name = "market_score", nullable = false)
	private Double marketScore;

	@Column(name = "trajectory_score", nullable = false)
	private Double trajectoryScore;

	@Column(name = "catalyst_score", nullable = false)
	private Double catalystScore;

	@Column(name = "regulation_score", nullable = false)
	private Double regulationScore;

	@Column(name = "composite_score", nullable = false)
	private Double compositeScore;

	@Column(name = "has_fatal_flaw", nullable = false)
	private boolean hasFatalFlaw;

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "fatal_flaw_reasons", nullable = false)
	private List<String> fatalFlawReasons;

	@Enumerated(EnumType.STRING)
	@Column(name = "tier", nullable = false)
	private Tier tier;

	@Convert(converter = RecommendationConverter.class)
	@Column(name = "recommendation", nullable = false)
	private Recommendation recommendation;

	@Column(name = "market_rank")
	private Integer marketRank;

	@Column(name = "scored_at", nullable = false)
	private LocalDateTime scoredAt;

	@Column(name = "data_freshness_days")
	private Integer dataFreshnessDays;

	public Long getId() {
		return id;
	}

	public void setId(Long id) {
		this.id = id;
	}

	public String getCountyFips() {
		return countyFips;
	}

	public void setCountyFips(String countyFips) {
		this.countyFips = countyFips;
	}

	public Long getWeightProfileId() {
		return weightProfileId;
	}

	public void setWeightProfileId(Long weightProfileId) {
		this.weightProfileId = weightProfileId;
	}

	public Map<String, Object> getRawInputs() {
		return rawInputs;
	}

	public void setRawInputs(Map<String, Object> rawInputs) {
		this.rawInputs = rawInputs;
	}

	public Double getYieldScore() {
		return yieldScore;
	}

	public void setYieldScore(Double yieldScore) {
		this.yieldScore = yieldScore;
	}

	public Double getCushionScore() {
		return cushionScore;
	}

	public void setCushionScore(Double cushionScore) {
		this.cushionScore = cushionScore;
	}

	public Double getBreakevenScore() {
		return breakevenScore;
	}

	public void setBreakevenScore(Double breakevenScore) {
		this.breakevenScore = breakevenScore;
	}

	public Double getSaturationScore() {
		return saturationScore;
	}

	public void setSaturationScore(Double saturationScore) {
		this.saturationScore = saturationScore;
	}

	public Double getRentScore() {
		return rentScore;
	}

	public void setRentScore(Double rentScore) {
		this.rentScore = rentScore;
	}

	public Double getDemandScore() {
		return demandScore;
	}

	public void setDemandScore(Double demandScore) {
		this.demandScore = demandScore;
	}

	public Double getPopulationGrowthScore() {
		return populationGrowthScore;
	}

	public void setPopulationGrowthScore(Double populationGrowthScore) {
		this.populationGrowthScore = populationGrowthScore;
	}

	public Double getIncomeGrowthScore() {
		return incomeGrowthScore;
	}

	public void setIncomeGrowthScore(Double incomeGrowthScore) {
		this.incomeGrowthScore = incomeGrowthScore;
	}

	public Double getHousingGrowthScore() {
		return housingGrowthScore;
	}

	public void setHousingGrowthScore(Double housingGrowthScore) {
		this.housingGrowthScore = housingGrowthScore;
	}

	public Double getFinancialScore() {
		return financialScore;
	}

	public void setFinancialScore(Double financialScore) {
		this.financialScore = financialScore;
	}

	public Double getMarketScore() {
		return marketScore;
	}

	public void setMarketScore(Double marketScore) {
		this.marketScore = marketScore;
	}

	public Double getTrajectoryScore() {
		return trajectoryScore;
	}

	public void setTrajectoryScore(Double trajectoryScore) {
		this.trajectoryScore = trajectoryScore;
	}

	public Double getCatalystScore() {
		return catalystScore;
	}

	public void setCatalystScore(Double catalystScore) {
		this.catalystScore = catalystScore;
	}

	public Double getRegulationScore() {
		return regulationScore;
	}

	public void setRegulationScore(Double regulationScore) {
		this.regulationScore = regulationScore;
	}

	public Double getCompositeScore() {
		return compositeScore;
	}

	public void setCompositeScore(Double compositeScore) {
		this.compositeScore = compositeScore;
	}

	public boolean hasFatalFlaw() {
		return hasFatalFlaw;
	}

	public void setHasFatalFlaw(boolean hasFatalFlaw) {
		this.hasFatalFlaw = hasFatalFlaw;
	}

	public List<String> getFatalFlawReasons() {
		return fatalFlawReasons;
	}

	public void setFatalFlawReasons(List<String> fatalFlawReasons) {
		this.fatalFlawReasons = fatalFlawReasons;
	}

	public Tier getTier() {
		return tier;
	}

	public void setTier(Tier tier) {
		this.tier = tier;
	}

	public Recommendation getRecommendation() {
		return recommendation;
	}

	public void setRecommendation(Recommendation recommendation) {
		this.recommendation = recommendation;
	}

	public Integer getMarketRank() {
		return marketRank;
	}

	public void setMarketRank(Integer marketRank) {
		this.marketRank = marketRank;
	}

	public LocalDateTime getScoredAt() {
		return scoredAt;
	}

	public void setScoredAt(LocalDateTime scoredAt) {
		this.scoredAt = scoredAt;
	}

	public Integer getDataFreshnessDays() {
		return dataFreshnessDays;
	}

	public void setDataFreshnessDays(Integer dataFreshnessDays) {
		this.dataFreshnessDays = dataFreshnessDays;
	}
}
