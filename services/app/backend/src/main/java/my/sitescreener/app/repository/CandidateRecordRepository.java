package my.sitescreener.app.repository;

import jakarta.persistence.LockModeType;
import my.sitescreener.app.domain.CandidateRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CandidateRecordRepository extends JpaRepository<CandidateRecord, Long> {
	// row lock held until the caller's transaction ends; kill and merge on one record serialize
	@Lock(LockModeType.PESSIMISTIC_WRITE)
	Optional<CandidateRecord> findByRunIdAndZip(UUID runId, String zip);

	List<CandidateRecord> findByRunIdAndKilledFalseOrderByZipAsc(UUID runId);

	long countByRunIdAndKilledFalse(UUID runId);

	@Query("""
		select c.stageReached, count(c) from CandidateRecord c
		where c.runId = :runId
		group by c.stageReached
		order by c.stageReached
		""")
	List<Object[]> stageHistogram(@Param("runId") UUID runId);

	@Query("""
		select c.killStage, c.killRuleId, count(c), avg(c.killValue) from CandidateRecord c
		where c.runId = :runId and c.killed = true
		group by c.killStage, c.killRuleId
		order by c.killStage, c.killRuleId
		""")
	List<Object[]> killSummary(@Param("runId") UUID runId);

	@Modifying
	@Query("update CandidateRecord c set c.finalScore = null, c.tier = null, c.rank = null where c.runId = :runId and c.killed = false")
	int clearTiers(@Param("runId") UUID runId);
}
