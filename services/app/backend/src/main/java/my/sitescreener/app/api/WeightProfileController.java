package my.sitescreener.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.sitescreener.app.dto.WeightProfileDto;
import my.sitescreener.app.dto.WeightProfileRequest;
import my.sitescreener.app.dto.WeightProfileValidateResponse;
import my.sitescreener.app.service.WeightProfileService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/weight-profiles")
@Tag(name = "Weight Profiles")
public class WeightProfileController {
	private final WeightProfileService profileService;

	public WeightProfileController(WeightProfileService profileService) {
		this.profileService = profileService;
	}

	@GetMapping
	public List<WeightProfileDto> listProfiles() {
		return profileService.listProfiles();
	}

	@GetMapping("/active")
	public WeightProfileDto getActive() {
		return profileService.getActive()
				.orElseThrow(() -> new IllegalArgumentException("No active weight profile"));
	}

	@PostMapping("/validate")
	@Operation(summary = "Validate a weight profile without storing it")
	public WeightProfileValidateResponse validate(@RequestBody WeightProfileRequest request) {
		return profileService.validate(request);
	}

	@PutMapping("/{name}")
	@ResponseStatus(HttpStatus.CREATED)
	@Operation(summary = "Store a new version of the named weight profile")
	public WeightProfileDto upsertProfile(@PathVariable String name, @RequestBody WeightProfileRequest request) {
		return profileService.createNewVersion(name, request);
	}

	@PostMapping("/{profileId}/activate")
	public WeightProfileDto activate(@PathVariable Long profileId) {
		return profileService.activate(profileId);
	}
}
