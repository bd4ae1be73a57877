package my.sitescreener.app.config;

import my.sitescreener.app.dto.WeightProfileRequest;
import my.sitescreener.app.dto.WeightProfileValidateResponse;
import my.sitescreener.app.repository.WeightProfileRepository;
import my.sitescreener.app.service.WeightProfileService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.PropertyNamingStrategies;
import tools.jackson.databind.json.JsonMapper;

import java.io.InputStream;
import java.util.List;

/**
 * Seeds the standard weight profiles on an empty store. Only profiles flagged with
 * {@code activate} in the resource become active.
 */
@Component
public class WeightProfileSeeder implements ApplicationRunner {
	private static final Logger logger = LoggerFactory.getLogger(WeightProfileSeeder.class);
	static final String RESOURCE_PATH = "classpath:default_weight_profiles.json";

	private final WeightProfileRepository profileRepository;
	private final WeightProfileService profileService;
	private final ResourceLoader resourceLoader;
	private final ObjectMapper jsonMapper;

	public WeightProfileSeeder(WeightProfileRepository profileRepository,
							   WeightProfileService profileService,
							   ResourceLoader resourceLoader) {
		this.profileRepository = profileRepository;
		this.profileService = profileService;
		this.resourceLoader = resourceLoader;
		this.jsonMapper = JsonMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
	}

	@Override
	public void run(ApplicationArguments args) {
		if (profileRepository.count() > 0) {
			return;
		}
		Resource resource = resourceLoader.getResource(RESOURCE_PATH);
		if (!resource.exists()) {
			logger.warn("Default weight profiles resource not found: {}", RESOURCE_PATH);
			return;
		}
		List<WeightProfileRequest> profiles;
		try (InputStream inputStream = resource.getInputStream()) {
			profiles = jsonMapper.readValue(inputStream, new TypeReference<List<WeightProfileRequest>>() {
			});
		} catch (Exception ex) {
			logger.error("Failed to read default weight profiles from {}: {}", RESOURCE_PATH, ex.getMessage());
			return;
		}
		for (WeightProfileRequest profile : profiles) {
			WeightProfileValidateResponse validation = profileService.validate(profile);
			if (!validation.valid()) {
				logger.error("Default weight profile {} invalid: {}", profile.name(), String.join("; ", validation.errors()));
				continue;
			}
			profileService.createNewVersion(profile.name(), profile);
			logger.info("Seeded weight profile {} from {}", profile.name(), RESOURCE_PATH);
		}
	}
}
