package my.sitescreener.app.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Per-run state of one candidate ZIP. Once {@code killed} is set the record is frozen:
 * neither metrics nor {@code stageReached} change afterwards.
 */
@Entity
@Table(name = "candidate_records", uniqueConstraints = @UniqueConstraint(columnNames = {"run_id", "zip"}))
public class CandidateRecord {
	public static final int NOT_STARTED = -1;

	@Id
	@GeneratedValue(strategy = GenerationType.IDENTITY)
	@Column(name = "id")
	private Long id;

	@Column(name = "run_id", nullable = false, updatable = false)
	private UUID runId;

	@Column(name = "zip", nullable = false, updatable = false, length = 5)
	private String zip;

	@Column(name = "stage_reached", nullable = false)
	private int stageReached = NOT_STARTED;

	@Column(name = "killed", nullable = false)
	private boolean killed;

	@Column(name = "kill_stage")
	private Integer killStage;

	@Column(name = "kill_rule_id", length = 20)
	private String killRuleId;

	@Column(name = "kill_reason", columnDefinition = "TEXT")
	private String killReason;

	@Column(name = "kill_threshold")
	private Double killThreshold;

	@Column(name = "kill_value")
	private Double killValue;

	@JdbcTypeCode(SqlTypes.JSON)
	@Column(name = "metrics", nullable = false)
	private Map<String, Object> metrics = new LinkedHashMap<>();

	@Column(name = "final_score")
	private Double finalScore;

	@Column(name = "tier")
	private Integer tier;

	@Column(name = "rank")
	private Integer rank;

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

	public UUID getRunId() {
		return runId;
	}

	public void setRunId(UUID runId) {
		this.runId = runId;
	}

	public String getZip() {
		return zip;
	}

	public void setZip(String zip) {
		this.zip = zip;
	}

	public int getStageReached() {
		return stageReached;
	}

	public void setStageReached(int stageReached) {
		this.stageReached = stageReached;
	}

	public boolean isKilled() {
		return killed;
	}

	public void setKilled(boolean killed) {
		this.killed = killed;
	}

	public Integer getKillStage() {
		return killStage;
	}

	public void setKillStage(Integer killStage) {
		this.killStage = killStage;
	}

	public String getKillRuleId() {
		return killRuleId;
	}

	public void setKillRuleId(String killRuleId) {
		this.killRuleId = killRuleId;
	}

	public String getKillReason() {
		return killReason;
	}

	public void setKillReason(String killReason) {
		this.killReason = killReason;
	}

	public Double getKillThreshold() {
		return killThreshold;
	}

	public void setKillThreshold(Double killThreshold) {
		this.killThreshold = killThreshold;
	}

	public Double getKillValue() {
		return killValue;
	}

	public void setKillValue(Double killValue) {
		this.killValue = killValue;
	}

	public Map<String, Object> getMetrics() {
		return metrics;
	}

	public void setMetrics(Map<String, Object> metrics) {
		this.metrics = metrics;
	}

	public Double getFinalScore() {
		return finalScore;
	}

	public void setFinalScore(Double finalScore) {
		this.finalScore = finalScore;
	}

	public Integer getTier() {
		return tier;
	}

	public void setTier(Integer tier) {
		this.tier = tier;
	}

	public Integer getRank() {
		return rank;
	}

	public void setRank(Integer rank) {
		this.rank = rank;
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
