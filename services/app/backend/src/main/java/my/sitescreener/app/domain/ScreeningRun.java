package my.sitescreener.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "runs")
public class ScreeningRun {
	@Id
	@Column(name = "run_id")
	private UUID runId;

	@Column(name = "created_at", nullable = false)
	private LocalDateTime createdAt;

	@Column(name = "created_by")
	private String createdBy;

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "target_states", nullable = false)
	private List<String> targetStates;

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "config", nullable = false)
	private Map<String, Object> config;

	@Enumerated(EnumType.STRING)
	@Column(name = "status", nullable = false)
	private RunStatus status;

	@Column(name = "current_stage")
	private Integer currentStage;

	@Column(name = "total_zips", nullable = false)
	private Integer totalZips;

	@Column(name = "surviving_zips")
	private Integer survivingZips;

	@Column(name = "completed_at")
	private LocalDateTime completedAt;

	@Column(name = "error_message", columnDefinition = "TEXT")
	private String errorMessage;

	public UUID getRunId() {
		return runId;
	}

	public void setRunId(UUID runId) {
		this.runId = runId;
	}

	public LocalDateTime getCreatedAt() {
		return createdAt;
	}

	public void setCreatedAt(LocalDateTime createdAt) {
		this.createdAt = createdAt;
	}

	public String getCreatedBy() {
		return createdBy;
	}

	public void setCreatedBy(String createdBy) {
		this.createdBy = createdBy;
	}

	public List<String> getTargetStates() {
		return targetStates;
	}

	public void setTargetStates(List<String> targetStates) {
		this.targetStates = targetStates;
	}

	public Map<String, Object> getConfig() {
		return config;
	}

	public void setConfig(Map<String, Object> config) {
		this.config = config;
	}

	public RunStatus getStatus() {
		return status;
	}

	public void setStatus(RunStatus status) {
		this.status = status;
	}

	public Integer getCurrentStage() {
		return currentStage;
	}

	public void setCurrentStage(Integer currentStage) {
		this.currentStage = currentStage;
	}

	public Integer getTotalZips() {
		return totalZips;
	}

	public void setTotalZips(Integer totalZips) {
		this.totalZips = totalZips;
	}

	public Integer getSurvivingZips() {
		return survivingZips;
	}

	public void setSurvivingZips(Integer survivingZips) {
		this.survivingZips = survivingZips;
	}

	public LocalDateTime getCompletedAt() {
		return completedAt;
	}

	public void setCompletedAt(LocalDateTime completedAt) {
		this.completedAt = completedAt;
	}

	public String getErrorMessage() {
		return errorMessage;
	}

	public void setErrorMessage(String errorMessage) {
		this.errorMessage = errorMessage;
	}
}
