package my.sitescreener.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * County roll-up of the surviving ZIPs of one run. Rows are derived data: the roll-up deletes
 * and rebuilds the whole table, so nothing here is carried between runs.
 */
@Entity
@Table(name = "county_aggregates")
public class CountyAggregate {
	@Id
	@Column(name = "county_fips", length = 5)
	private String countyFips;

	@Column(name = "state", nullable = false, length = 2)
	private String state;

	@Column(name = "county_name")
	private String countyName;

	@Column(name = "source_run_id", nullable = false)
	private UUID sourceRunId;

	@Column(name = "surviving_zips", nullable = false)
	private Integer survivingZips;

	@Column(name = "total_population", nullable = false)
	private Long totalPopulation;

	@Column(name = "total_housing_units", nullable = false)
	private Long totalHousingUnits;

	@Column(name = "total_sfh", nullable = false)
	private Long totalSfh;

	@Column(name = "total_townhome", nullable = false)
	private Long totalTownhome;

	@Column(name = "total_apartment", nullable = false)
	private Long totalApartment;

	@Column(name = "total_mobile_home", nullable = false)
	private Long totalMobileHome;

	@Column(name = "avg_income")
	private Double avgIncome;

	@Column(name = "avg_poverty")
	private Double avgPoverty;

	@Column(name = "avg_renter_pct")
	private Double avgRenterPct;

	@Column(name = "avg_density")
	private Double avgDensity;

	@Column(name = "demand_sqft", nullable = false)
	private Long demandSqft;

	@Column(name = "high_demand_units", nullable = false)
	private Long highDemandUnits;

	@Column(name = "passed", nullable = false)
	private boolean passed;

	@Column(name = "kill_reason", columnDefinition = "TEXT")
	private String killReason;

	@Column(name = "built_at", nullable = false)
	private LocalDateTime builtAt;

	public String getCountyFips() {
		return countyFips;
	}

	public void setCountyFips(String countyFips) {
		this.countyFips = countyFips;
	}

	public String getState() {
		return state;
	}

	public void setState(String state) {
		this.state = state;
	}

	public String getCountyName() {
		return countyName;
	}

	public void setCountyName(String countyName) {
		this.countyName = countyName;
	}

	public UUID getSourceRunId() {
		return sourceRunId;
	}

	public void setSourceRunId(UUID sourceRunId) {
		this.sourceRunId = sourceRunId;
	}

	public Integer getSurvivingZips() {
		return survivingZips;
	}

	public void setSurvivingZips(Integer survivingZips) {
		this.survivingZips = survivingZips;
	}

	public Long getTotalPopulation() {
		return totalPopulation;
	}

	public void setTotalPopulation(Long totalPopulation) {
		this.totalPopulation = totalPopulation;
	}

	public Long getTotalHousingUnits() {
		return totalHousingUnits;
	}

	public void setTotalHousingUnits(Long totalHousingUnits) {
		this.totalHousingUnits = totalHousingUnits;
	}

	public Long getTotalSfh() {
		return totalSfh;
	}

	public void setTotalSfh(Long totalSfh) {
		this.totalSfh = totalSfh;
	}

	public Long getTotalTownhome() {
		return totalTownhome;
	}

	public void setTotalTownhome(Long totalTownhome) {
		this.totalTownhome = totalTownhome;
	}

	public Long getTotalApartment() {
		return totalApartment;
	}

	public void setTotalApartment(Long totalApartment) {
		this.totalApartment = totalApartment;
	}

	public Long getTotalMobileHome() {
		return totalMobileHome;
	}

	public void setTotalMobileHome(Long totalMobileHome) {
		this.totalMobileHome = totalMobileHome;
	}

	public Double getAvgIncome() {
		return avgIncome;
	}

	public void setAvgIncome(Double avgIncome) {
		this.avgIncome = avgIncome;
	}

	public Double getAvgPoverty() {
		return avgPoverty;
	}

	public void setAvgPoverty(Double avgPoverty) {
		this.avgPoverty = avgPoverty;
	}

	public Double getAvgRenterPct() {
		return avgRenterPct;
	}

	public void setAvgRenterPct(Double avgRenterPct) {
		this.avgRenterPct = avgRenterPct;
	}

	public Double getAvgDensity() {
		return avgDensity;
	}

	public void setAvgDensity(Double avgDensity) {
		this.avgDensity = avgDensity;
	}

	public Long getDemandSqft() {
		return demandSqft;
	}

	public void setDemandSqft(Long demandSqft) {
		this.demandSqft = demandSqft;
	}

	public Long getHighDemandUnits() {
		return highDemandUnits;
	}

	public void setHighDemandUnits(Long highDemandUnits) {
		this.highDemandUnits = highDemandUnits;
	}

	public boolean isPassed() {
		return passed;
	}

	public void setPassed(boolean passed) {
		this.passed = passed;
	}

	public String getKillReason() {
		return killReason;
	}

	public void setKillReason(String killReason) {
		this.killReason = killReason;
	}

	public LocalDateTime getBuiltAt() {
		return builtAt;
	}

	public void setBuiltAt(LocalDateTime builtAt) {
		this.builtAt = builtAt;
	}
}
