package my.sitescreener.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Immutable
@Table(name = "stage_log")
public class StageLogEntry {
	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "id")
	private Long id;

	@Column(name = "run_id", nullable = false)
	private UUID runId;

	@Column(name = "stage", nullable = false)
	private Integer stage;

	@Column(name = "started_at", nullable = false)
	private LocalDateTime startedAt;

	@Column(name = "completed_at")
	private LocalDateTime completedAt;

	@Column(name = "zips_input", nullable = false)
	private Integer zipsInput;

	@Column(name = "zips_output", nullable = false)
	private Integer zipsOutput;

	@Column(name = "zips_killed", nullable = false)
	private Integer zipsKilled;

	@Enumerated(EnumType.STRING)
	@Column(name = "status", nullable = false)
	private StageStatus status;

	public Long getId() {
		return id;
	}

	public void setId(Long id) {
		this.id = id;
	}

	public UUID getRunId() {
		return runId;
	}

	public void setRunId(UUID runId) {
		this.runId = runId;
	}

	public Integer getStage() {
		return stage;
	}

	public void setStage(Integer stage) {
		this.stage = stage;
	}

	public LocalDateTime getStartedAt() {
		return startedAt;
	}

	public void setStartedAt(LocalDateTime startedAt) {
		this.startedAt = startedAt;
	}

	public LocalDateTime getCompletedAt() {
		return completedAt;
	}

	public void setCompletedAt(LocalDateTime completedAt) {
		this.completedAt = completedAt;
	}

	public Integer getZipsInput() {
		return zipsInput;
	}

	public void setZipsInput(Integer zipsInput) {
		this.zipsInput = zipsInput;
	}

	public Integer getZipsOutput() {
		return zipsOutput;
	}

	public void setZipsOutput(Integer zipsOutput) {
		this.zipsOutput = zipsOutput;
	}

	public Integer getZipsKilled() {
		return zipsKilled;
	}

	public void setZipsKilled(Integer zipsKilled) {
		this.zipsKilled = zipsKilled;
	}

	public StageStatus getStatus() {
		return status;
	}

	public void setStatus(StageStatus status) {
		this.status = status;
	}
}
