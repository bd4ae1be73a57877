package my.sitescreener.app.service;

import my.sitescreener.app.config.AppProperties;
import my.sitescreener.app.domain.WeightProfile;
import my.sitescreener.app.dto.WeightProfileDto;
import my.sitescreener.app.dto.WeightProfileRequest;
import my.sitescreener.app.dto.WeightProfileValidateResponse;
import my.sitescreener.app.repository.WeightProfileRepository;
import my.sitescreener.app.scoring.WeightProfileValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Service
public class WeightProfileService {
	private static final Logger logger = LoggerFactory.getLogger(WeightProfileService.class);

	private final WeightProfileRepository profileRepository;
	private final WeightProfileValidator validator;

	public WeightProfileService(WeightProfileRepository profileRepository, AppProperties properties) {
		this.profileRepository = profileRepository;
		this.validator = new WeightProfileValidator(properties.scoring().weightTolerance());
	}

	public WeightProfileValidateResponse validate(WeightProfileRequest request) {
		String name = request == null ? null : request.name();
		List<String> errors = validator.validate(toEntity(name, request));
		return new WeightProfileValidateResponse(errors.isEmpty(), errors);
	}

	/**
	 * Stores the first version of a new profile name.
	 *
	 * @throws IllegalArgumentException when the name already has versions
	 */
	@Transactional
	public WeightProfileDto createProfile(String name, WeightProfileRequest request) {
		if (name != null && !profileRepository.findByNameOrderByVersionDesc(name.trim()).isEmpty()) {
			throw new IllegalArgumentException("Weight profile already exists: " + name);
		}
		return createNewVersion(name, request);
	}

	/**
	 * Stores the request as the next version of {@code name}. Stored versions are never edited.
	 *
	 * @throws InvalidWeightProfileException listing every violation; nothing is stored
	 */
	@Transactional
	public WeightProfileDto createNewVersion(String name, WeightProfileRequest request) {
		String trimmedName = name == null ? null : name.trim();
		WeightProfile profile = toEntity(trimmedName, request);
		List<String> errors = validator.validate(profile);
		if (!errors.isEmpty()) {
			throw new InvalidWeightProfileException(errors);
		}
		int nextVersion = profileRepository.findByNameOrderByVersionDesc(trimmedName).stream()
				.map(WeightProfile::getVersion)
				.max(Comparator.naturalOrder())
				.orElse(0) + 1;
		boolean activate = request.activate() || profileRepository.findByActiveTrue().isEmpty();
		if (activate) {
			deactivateAll();
		}
		LocalDateTime now = LocalDateTime.now();
		profile.setVersion(nextVersion);
		profile.setActive(activate);
		profile.setCreatedAt(now);
		profile.setUpdatedAt(now);
		profileRepository.save(profile);
		logger.info("Stored weight profile {} v{} (active={})", trimmedName, nextVersion, activate);
		return toDto(profile);
	}

	/**
	 * Makes the profile the only active one.
	 */
	@Transactional
	public WeightProfileDto activate(Long profileId) {
		WeightProfile profile = profileRepository.findById(profileId)
				.orElseThrow(() -> new IllegalArgumentException("Weight profile not found: " + profileId));
		if (!profile.isActive()) {
			deactivateAll();
			profile.setActive(true);
			profile.setUpdatedAt(LocalDateTime.now());
			profileRepository.save(profile);
			logger.info("Activated weight profile {} v{}", profile.getName(), profile.getVersion());
		}
		return toDto(profile);
	}

	public List<WeightProfileDto> listProfiles() {
		return profileRepository.findAllOrderByNameAndVersion().stream()
				.map(this::toDto)
				.toList();
	}

	public Optional<WeightProfileDto> getActive() {
		return profileRepository.findFirstByActiveTrueOrderByUpdatedAtDesc().map(this::toDto);
	}

	private void deactivateAll() {
		LocalDateTime now = LocalDateTime.now();
		profileRepository.findByActiveTrue().forEach(active -> {
			active.setActive(false);
			active.setUpdatedAt(now);
			profileRepository.save(active);
		});
	}

	private WeightProfile toEntity(String name, WeightProfileRequest request) {
		WeightProfile profile = new WeightProfile();
		profile.setName(name);
		if (request == null) {
			return profile;
		}
		profile.setDescription(request.description());
		profile.setFinancialWeight(request.financialWeight());
		profile.setMarketWeight(request.marketWeight());
		profile.setTrajectoryWeight(request.trajectoryWeight());
		profile.setCatalystWeight(request.catalystWeight());
		profile.setRegulationWeight(request.regulationWeight());
		profile.setYieldWeight(request.yieldWeight());
		profile.setCushionWeight(request.cushionWeight());
		profile.setBreakevenWeight(request.breakevenWeight());
		profile.setSaturationWeight(request.saturationWeight());
		profile.setRentWeight(request.rentWeight());
		profile.setDemandWeight(request.demandWeight());
		profile.setPopulationGrowthWeight(request.populationGrowthWeight());
		profile.setIncomeGrowthWeight(request.incomeGrowthWeight());
		profile.setHousingGrowthWeight(request.housingGrowthWeight());
		profile.setTierAThreshold(request.tierAThreshold());
		profile.setTierBThreshold(request.tierBThreshold());
		profile.setTierCThreshold(request.tierCThreshold());
		profile.setTierDThreshold(request.tierDThreshold());
		profile.setMinYieldThreshold(request.minYieldThreshold());
		profile.setMaxSaturationThreshold(request.maxSaturationThreshold());
		profile.setMinCushionThreshold(request.minCushionThreshold());
		return profile;
	}

	WeightProfileDto toDto(WeightProfile profile) {
		return new WeightProfileDto(
				profile.getId(),
				profile.getName(),
				profile.getVersion(),
				profile.getDescription(),
				profile.getFinancialWeight(),
				profile.getMarketWeight(),
				profile.getTrajectoryWeight(),
				profile.getCatalystWeight(),
				profile.getRegulationWeight(),
				profile.getYieldWeight(),
				profile.getCushionWeight(),
				profile.getBreakevenWeight(),
				profile.getSaturationWeight(),
				profile.getRentWeight(),
				profile.getDemandWeight(),
				profile.getPopulationGrowthWeight(),
				profile.getIncomeGrowthWeight(),
				profile.getHousingGrowthWeight(),
				profile.getTierAThreshold(),
				profile.getTierBThreshold(),
				profile.getTierCThreshold(),
				profile.getTierDThreshold(),
				profile.getMinYieldThreshold(),
				profile.getMaxSaturationThreshold(),
				profile.getMinCushionThreshold(),
				profile.isActive(),
				profile.getCreatedAt(),
				profile.getUpdatedAt()
		);
	}
}
