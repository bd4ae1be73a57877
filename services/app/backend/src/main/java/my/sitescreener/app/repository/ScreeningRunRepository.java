package my.sitescreener.app.repository;

import my.sitescreener.app.domain.RunStatus;
import my.sitescreener.app.domain.ScreeningRun;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.UUID;

public interface ScreeningRunRepository extends JpaRepository<ScreeningRun, UUID> {
	@Query("""
		select r from ScreeningRun r
		where (:status is null or r.status = :status)
		order by r.createdAt desc
		""")
	Page<ScreeningRun> search(@Param("status") RunStatus status, Pageable pageable);
}
