package my.sitescreener.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import java.time.LocalDateTime;

/**
 * Named, versioned scoring configuration. A stored profile never changes its weights or
 * thresholds; edits are stored as a new version of the same name. Only {@code active} and
 * {@code updatedAt} move after creation.
 */
@Entity
@Table(name = "weight_profiles", uniqueConstraints = @UniqueConstraint(columnNames = {"name", "version"}))
public class WeightProfile {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "id")
	private Long id;

	@Column(name = "name", nullable = false)
	private String name;

	@Column(name = "version", nullable = false)
	private Integer version;

	@Column(name = "description", columnDefinition = "TEXT")
	private String description;

	@Column(name = "financial_weight", nullable = false)
	private Double financialWeight;

	@Column(name = "market_weight", nullable = false)
	private Double marketWeight;

	@Column(name = "trajectory_weight", nullable = false)
	private Double trajectoryWeight;

	@Column(name = "catalyst_weight", nullable = false)
	private Double catalystWeight;

	@Column(name = "regulation_weight", nullable = false)
	private Double regulationWeight;

	@Column(name = "yield_weight", nullable = false)
	private Double yieldWeight;

	@Column(name = "cushion_weight", nullable = false)
	private Double cushionWeight;

	@Column(name = "breakeven_weight", nullable = false)
	private Double breakevenWeight;

	@Column(name = "saturation_weight", nullable = false)
	private Double saturationWeight;

	@Column(name = "rent_weight", nullable = false)
	private Double rentWeight;

	@Column(name = "demand_weight", nullable = false)
	private Double demandWeight;

	@Column(name = "population_growth_weight", nullable = false)
	private Double populationGrowthWeight;

	@Column(name = "income_growth_weight", nullable = false)
	private Double incomeGrowthWeight;

	@Column(name = "housing_growth_weight", nullable = false)
	private Double housingGrowthWeight;

	@Column(name = "tier_a_threshold", nullable = false)
	private Double tierAThreshold;

	@Column(name = "tier_b_threshold", nullable = false)
	private Double tierBThreshold;

	@Column(name = "tier_c_threshold", nullable = false)
	private Double tierCThreshold;

	@Column(name = "tier_d_threshold", nullable = false)
	private Double tierDThreshold;

	@Column(name = "min_yield_threshold", nullable = false)
	private Double minYieldThreshold;

	@Column(name = "max_saturation_threshold", nullable = false)
	private Double maxSaturationThreshold;

	@Column(name = "min_cushion_threshold", nullable = false)
	private Double minCushionThreshold;

	@Column(name = "active", nullable = false)
	private boolean active;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@Column(name = "updated_at", nullable = false)
	private LocalDateTime updatedAt;

	public Long getId() {
		return id;
	}

	public void setId(Long id) {
		this.id = id;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public Integer getVersion() {
		return version;
	}

	public void setVersion(Integer version) {
		this.version = version;
	}

	public String getDescription() {
		return description;
	}

	public void setDescription(String description) {
		this.description = description;
	}

	public Double getFinancialWeight() {
		return financialWeight;
	}

	public void setFinancialWeight(Double financialWeight) {
		this.financialWeight = financialWeight;
	}

	public Double getMarketWeight() {
		return marketWeight;
	}

	public void setMarketWeight(Double marketWeight) {
		this.marketWeight = marketWeight;
	}

	public Double getTrajectoryWeight() {
		return trajectoryWeight;
	}

	public void setTrajectoryWeight(Double trajectoryWeight) {
		this.trajectoryWeight = trajectoryWeight;
	}

	public Double getCatalystWeight() {
		return catalystWeight;
	}

	public void setCatalystWeight(Double catalystWeight) {
		this.catalystWeight = catalystWeight;
	}

	public Double getRegulationWeight() {
		return regulationWeight;
	}

	public void setRegulationWeight(Double regulationWeight) {
		this.regulationWeight = regulationWeight;
	}

	public Double getYieldWeight() {
		return yieldWeight;
	}

	public void setYieldWeight(Double yieldWeight) {
		this.yieldWeight = yieldWeight;
	}

	public Double getCushionWeight() {
		return cushionWeight;
	}

	public void setCushionWeight(Double cushionWeight) {
		this.cushionWeight = cushionWeight;
	}

	public Double getBreakevenWeight() {
		return breakevenWeight;
	}

	public void setBreakevenWeight(Double breakevenWeight) {
		this.breakevenWeight = breakevenWeight;
	}

	public Double getSaturationWeight() {
		return saturationWeight;
	}

	public void setSaturationWeight(Double saturationWeight) {
		this.saturationWeight = saturationWeight;
	}

	public Double getRentWeight() {
		return rentWeight;
	}

	public void setRentWeight(Double rentWeight) {
		this.rentWeight = rentWeight;
	}

	public Double getDemandWeight() {
		return demandWeight;
	}

	public void setDemandWeight(Double demandWeight) {
		this.demandWeight = demandWeight;
	}

	public Double getPopulationGrowthWeight() {
		return populationGrowthWeight;
	}

	public void setPopulationGrowthWeight(Double populationGrowthWeight) {
		this.populationGrowthWeight = populationGrowthWeight;
	}

	public Double getIncomeGrowthWeight() {
		return incomeGrowthWeight;
	}

	public void setIncomeGrowthWeight(Double incomeGrowthWeight) {
		this.incomeGrowthWeight = incomeGrowthWeight;
	}

	public Double getHousingGrowthWeight() {
		return housingGrowthWeight;
	}

	public void setHousingGrowthWeight(Double housingGrowthWeight) {
		this.housingGrowthWeight = housingGrowthWeight;
	}

	public Double getTierAThreshold() {
		return tierAThreshold;
	}

	public void setTierAThreshold(Double tierAThreshold) {
		this.tierAThreshold = tierAThreshold;
	}

	public Double getTierBThreshold() {
		return tierBThreshold;
	}

	public void setTierBThreshold(Double tierBThreshold) {
		this.tierBThreshold = tierBThreshold;
	}

	public Double getTierCThreshold() {
		return tierCThreshold;
	}

	public void setTierCThreshold(Double tierCThreshold) {
		this.tierCThreshold = tierCThreshold;
	}

	public Double getTierDThreshold() {
		return tierDThreshold;
	}

	public void setTierDThreshold(Double tierDThreshold) {
		this.tierDThreshold = tierDThreshold;
	}

	public Double getMinYieldThreshold() {
		return minYieldThreshold;
	}

	public void setMinYieldThreshold(Double minYieldThreshold) {
		this.minYieldThreshold = minYieldThreshold;
	}

	public Double getMaxSaturationThreshold() {
		return maxSaturationThreshold;
	}

	public void setMaxSaturationThreshold(Double maxSaturationThreshold) {
		this.maxSaturationThreshold = maxSaturationThreshold;
	}

	public Double getMinCushionThreshold() {
		return minCushionThreshold;
	}

	public void setMinCushionThreshold(Double minCushionThreshold) {
		this.minCushionThreshold = minCushionThreshold;
	}

	public boolean isActive() {
		return active;
	}

	public void setActive(boolean active) {
		this.active = active;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}

	public LocalDateTime getUpdatedAt() {
		return updatedAt;
	}

	public void setUpdatedAt(LocalDateTime updatedAt) {
		this.updatedAt = updatedAt;
	}
}
