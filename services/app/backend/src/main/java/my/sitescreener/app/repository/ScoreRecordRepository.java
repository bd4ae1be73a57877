package my.sitescreener.app.repository;

import my.sitescreener.app.domain.ScoreRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface ScoreRecordRepository extends JpaRepository<ScoreRecord, Long> {
	@Modifying
	@Query("delete from ScoreRecord s where s.weightProfileId = :profileId")
	int deleteByWeightProfileId(@Param("profileId") Long profileId);

	List<ScoreRecord> findByWeightProfileIdOrderByCompositeScoreDesc(Long weightProfileId);

	Optional<ScoreRecord> findByWeightProfileIdAndCountyFips(Long weightProfileId, String countyFips);

	@Query("""
		select s.tier, count(s), avg(s.compositeScore), min(s.compositeScore), max(s.compositeScore)
		from ScoreRecord s
		where s.weightProfileId = :profileId
		group by s.tier
		order by s.tier
		""")
	List<Object[]> tierSummary(@Param("profileId") Long profileId);
}
