package my.sitescreener.app.api;

import my.sitescreener.app.domain.RunStatus;
import my.sitescreener.app.dto.RunDto;
import my.sitescreener.app.service.AggregationRollupService;
import my.sitescreener.app.service.CandidateTierService;
import my.sitescreener.app.service.ConfigurationException;
import my.sitescreener.app.service.PrecedenceViolationException;
import my.sitescreener.app.service.ProviderUnavailableException;
import my.sitescreener.app.service.RunRegistryService;
import my.sitescreener.app.service.StageExecutorService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class RunControllerTest {
	private RunRegistryService runRegistry;
	private StageExecutorService stageExecutor;
	private MockMvc mockMvc;

	@BeforeEach
	void setUp() {
		runRegistry = mock(RunRegistryService.class);
		stageExecutor = mock(StageExecutorService.class);
		RunController controller = new RunController(runRegistry, stageExecutor,
				mock(AggregationRollupService.class), mock(CandidateTierService.class));
		mockMvc = MockMvcBuilders.standaloneSetup(controller)
				.setControllerAdvice(new RestExceptionHandler())
				.build();
	}

	@Test
	void startRunReturnsCreatedRun() throws Exception {
		UUID runId = UUID.randomUUID();
		when(runRegistry.startRun(eq(List.of("WV")), any(), eq("analyst"))).thenReturn(new RunDto(runId,
				LocalDateTime.of(2026, 10, 1, 8, 0), "analyst", List.of("WV"), Map.of(), RunStatus.RUNNING, null, 12, 12, null, null));

		mockMvc.perform(post("/api/runs")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"targetStates\":[\"WV\"],\"createdBy\":\"analyst\"}"))
				.andExpect(status().isCreated())
				.andExpect(jsonPath("$.runId").value(runId.toString()))
				.andExpect(jsonPath("$.totalZips").value(12));
	}

	@Test
	void startRunWithoutStatesIsBadRequest() throws Exception {
		mockMvc.perform(post("/api/runs")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"targetStates\":[]}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.path").value("/api/runs"));
		verifyNoInteractions(runRegistry);
	}

	@Test
	void emptyUniverseIsBadRequest() throws Exception {
		when(runRegistry.startRun(any(), any(), any())).thenThrow(new ConfigurationException("No candidate ZIPs found for states [WV]"));

		mockMvc.perform(post("/api/runs")
						.contentType(MediaType.APPLICATION_JSON)
						.content("{\"targetStates\":[\"WV\"]}"))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.detail").value("No candidate ZIPs found for states [WV]"));
	}

	@Test
	void outOfOrderStageIsConflict() throws Exception {
		UUID runId = UUID.randomUUID();
		when(stageExecutor.executeStage(runId, 1))
				.thenThrow(new PrecedenceViolationException(runId, 1, "Stage 1 requires stage 0 to be executed first"));

		mockMvc.perform(post("/api/runs/{runId}/stages/{stage}", runId, 1))
				.andExpect(status().isConflict())
				.andExpect(jsonPath("$.stage").value(1));
	}

	@Test
	void providerOutageIsServiceUnavailable() throws Exception {
		UUID runId = UUID.randomUUID();
		when(stageExecutor.executeStage(runId, 0))
				.thenThrow(new ProviderUnavailableException("26501", "connection refused", null));

		mockMvc.perform(post("/api/runs/{runId}/stages/{stage}", runId, 0))
				.andExpect(status().isServiceUnavailable());
	}

	@Test
	void unknownRunIsBadRequest() throws Exception {
		UUID runId = UUID.randomUUID();
		when(runRegistry.getRun(runId)).thenThrow(new IllegalArgumentException("Run not found: " + runId));

		mockMvc.perform(get("/api/runs/{runId}", runId))
				.andExpect(status().isBadRequest())
				.andExpect(jsonPath("$.detail").value("Run not found: " + runId));
	}
}
