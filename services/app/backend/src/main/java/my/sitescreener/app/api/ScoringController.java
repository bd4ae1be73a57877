package my.sitescreener.app.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import my.sitescreener.app.dto.ScoreBreakdownDto;
import my.sitescreener.app.dto.ScoreRecordDto;
import my.sitescreener.app.dto.ScoringResultDto;
import my.sitescreener.app.dto.TierSummaryItemDto;
import my.sitescreener.app.service.ScoringService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/scores")
@Tag(name = "Scoring")
public class ScoringController {
	private final ScoringService scoringService;

	public ScoringController(ScoringService scoringService) {
		this.scoringService = scoringService;
	}

	@PostMapping("/active")
	@Operation(summary = "Score all passed counties with the active weight profile")
	public ScoringResultDto scoreActive() {
		return scoringService.scoreAllActive();
	}

	@PostMapping("/{profileId}")
	@Operation(summary = "Score all passed counties with the given weight profile")
	public ScoringResultDto score(@PathVariable Long profileId) {
		return scoringService.scoreAll(profileId);
	}

	@GetMapping("/{profileId}")
	@Operation(summary = "County leaderboard for a weight profile")
	public List<ScoreRecordDto> leaderboard(@PathVariable Long profileId) {
		return scoringService.leaderboard(profileId);
	}

	@GetMapping("/{profileId}/counties/{countyFips}")
	@Operation(summary = "Sub-scores and raw inputs behind one county's score")
	public ScoreBreakdownDto breakdown(@PathVariable Long profileId, @PathVariable String countyFips) {
		return scoringService.breakdown(profileId, countyFips);
	}

	@GetMapping("/{profileId}/tiers")
	public List<TierSummaryItemDto> tierSummary(@PathVariable Long profileId) {
		return scoringService.tierSummary(profileId);
	}
}
