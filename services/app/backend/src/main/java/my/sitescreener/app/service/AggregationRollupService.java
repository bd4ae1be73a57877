package my.sitescreener.app.service;

import my.sitescreener.app.config.AppProperties;
import my.sitescreener.app.domain.CandidateRecord;
import my.sitescreener.app.domain.CountyAggregate;
import my.sitescreener.app.dto.RollupResultDto;
import my.sitescreener.app.provider.CatalogEntry;
import my.sitescreener.app.provider.FactFields;
import my.sitescreener.app.provider.FactProvider;
import my.sitescreener.app.repository.CandidateRecordRepository;
import my.sitescreener.app.repository.CountyAggregateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Rebuilds the county aggregates from the survivors of one run.
 */
@Service
public class AggregationRollupService {
	private static final Logger logger = LoggerFactory.getLogger(AggregationRollupService.class);
	private static final long SFH_SQFT_PER_UNIT = 4;
	private static final long HIGH_DEMAND_SQFT_PER_UNIT = 6;

	private final RunRegistryService runRegistry;
	private final CandidateRecordRepository candidateRepository;
	private final CountyAggregateRepository aggregateRepository;
	private final FactProvider factProvider;
	private final double countyDensityMax;

	public AggregationRollupService(RunRegistryService runRegistry,
									CandidateRecordRepository candidateRepository,
									CountyAggregateRepository aggregateRepository,
									FactProvider factProvider,
									AppProperties properties) {
		this.runRegistry = runRegistry;
		this.candidateRepository = candidateRepository;
		this.aggregateRepository = aggregateRepository;
		this.factProvider = factProvider;
		this.countyDensityMax = properties.rollup().countyDensityMax();
	}

	/**
	 * Replaces every county aggregate with the roll-up of this run's live candidates. Counties
	 * whose mean catalog density exceeds the ceiling are kept with {@code passed = false}.
	 */
	@Transactional
	public RollupResultDto rollupAggregates(UUID runId) {
		runRegistry.getRun(runId);
		List<CandidateRecord> survivors = candidateRepository.findByRunIdAndKilledFalseOrderByZipAsc(runId);
		Map<String, CatalogEntry> catalog = factProvider.catalogEntries(survivors.stream().map(CandidateRecord::getZip).toList());

		Map<String, CountyAccumulator> byCounty = new TreeMap<>();
		int unmapped = 0;
		for (CandidateRecord candidate : survivors) {
			CatalogEntry entry = catalog.get(candidate.getZip());
			if (entry == null || entry.countyFips() == null || entry.countyFips().isBlank()) {
				unmapped++;
				continue;
			}
			byCounty.computeIfAbsent(entry.countyFips(), fips -> new CountyAccumulator(entry)).add(candidate, entry);
		}
		if (unmapped > 0) {
			logger.warn("Roll-up of run {}: {} surviving ZIPs have no county in the catalog", runId, unmapped);
		}

		LocalDateTime builtAt = LocalDateTime.now();
		List<CountyAggregate> aggregates = new ArrayList<>();
		int failed = 0;
		for (Map.Entry<String, CountyAccumulator> entry : byCounty.entrySet()) {
			CountyAggregate aggregate = entry.getValue().build(entry.getKey(), runId, builtAt, countyDensityMax);
			if (!aggregate.isPassed()) {
				failed++;
			}
			aggregates.add(aggregate);
		}

		aggregateRepository.deleteAllInBatch();
		aggregateRepository.saveAll(aggregates);
		logger.info("Rolled up run {} into {} counties ({} passed, {} too urban)",
				runId, aggregates.size(), aggregates.size() - failed, failed);
		return new RollupResultDto(runId, aggregates.size(), aggregates.size() - failed, failed, unmapped, builtAt);
	}

	private static final class CountyAccumulator {
		private final String state;
		private final String countyName;
		private int zips;
		private long population;
		private long housingUnits;
		private long sfh;
		private long townhome;
		private long apartment;
		private long mobileHome;
		private final Mean income = new Mean();
		private final Mean poverty = new Mean();
		private final Mean renterPct = new Mean();
		private final Mean density = new Mean();

		private CountyAccumulator(CatalogEntry first) {
			this.state = first.state();
			this.countyName = first.countyName();
		}

		private void add(CandidateRecord candidate, CatalogEntry entry) {
			Map<String, Object> metrics = candidate.getMetrics() == null ? Map.of() : candidate.getMetrics();
			zips++;
			population += count(metrics, FactFields.POPULATION);
			housingUnits += count(metrics, FactFields.HOUSING_UNITS);
			sfh += count(metrics, FactFields.SFH_UNITS);
			townhome += count(metrics, FactFields.TOWNHOME_UNITS);
			apartment += count(metrics, FactFields.APARTMENT_UNITS);
			mobileHome += count(metrics, FactFields.MOBILE_HOME_UNITS);
			income.add(metrics.get(FactFields.MEDIAN_INCOME));
			poverty.add(metrics.get(FactFields.POVERTY_RATE));
			renterPct.add(metrics.get(FactFields.RENTER_PCT));
			density.add(entry.density());
		}

		private CountyAggregate build(String countyFips, UUID runId, LocalDateTime builtAt, double densityMax) {
			CountyAggregate aggregate = new CountyAggregate();
			aggregate.setCountyFips(countyFips);
			aggregate.setState(state);
			aggregate.setCountyName(countyName);
			aggregate.setSourceRunId(runId);
			aggregate.setSurvivingZips(zips);
			aggregate.setTotalPopulation(population);
			aggregate.setTotalHousingUnits(housingUnits);
			aggregate.setTotalSfh(sfh);
			aggregate.setTotalTownhome(townhome);
			aggregate.setTotalApartment(apartment);
			aggregate.setTotalMobileHome(mobileHome);
			aggregate.setAvgIncome(income.rounded(0));
			aggregate.setAvgPoverty(poverty.rounded(1));
			aggregate.setAvgRenterPct(renterPct.rounded(1));
			aggregate.setAvgDensity(density.rounded(0));
			long highDemandUnits = townhome + apartment + mobileHome;
			aggregate.setHighDemandUnits(highDemandUnits);
			aggregate.setDemandSqft(sfh * SFH_SQFT_PER_UNIT + highDemandUnits * HIGH_DEMAND_SQFT_PER_UNIT);
			Double meanDensity = density.value();
			boolean tooUrban = meanDensity != null && meanDensity > densityMax;
			aggregate.setPassed(!tooUrban);
			aggregate.setKillReason(tooUrban
					? String.format(Locale.US, "Density %.0f/sq mi > %.0f (too urban)", meanDensity, densityMax)
					: null);
			aggregate.setBuiltAt(builtAt);
			return aggregate;
		}

		private static long count(Map<String, Object> metrics, String field) {
			Object value = metrics.get(field);
			return value instanceof Number number ? Math.round(number.doubleValue()) : 0L;
		}
	}

	private static final class Mean {
		private double sum;
		private int count;

		private void add(Object value) {
			if (value instanceof Number number && !Double.isNaN(number.doubleValue())) {
				sum += number.doubleValue();
				count++;
			}
		}

		private Double value() {
			return count == 0 ? null : sum / count;
		}

		private Double rounded(int decimals) {
			Double mean = value();
			if (mean == null) {
				return null;
			}
			double factor = Math.pow(10, decimals);
			return Math.round(mean * factor) / factor;
		}
	}
}
