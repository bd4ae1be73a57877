package my.sitescreener.app.repository;

import my.sitescreener.app.domain.StageLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface StageLogRepository extends JpaRepository<StageLogEntry, Long> {
	boolean existsByRunIdAndStage(UUID runId, Integer stage);

	List<StageLogEntry> findByRunIdOrderByStartedAtAsc(UUID runId);
}
