package my.sitescreener.app.repository;

import my.sitescreener.app.domain.WeightProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;

public interface WeightProfileRepository extends JpaRepository<WeightProfile, Long> {
	List<WeightProfile> findByNameOrderByVersionDesc(String name);

	List<WeightProfile> findByActiveTrue();

	Optional<WeightProfile> findFirstByActiveTrueOrderByUpdatedAtDesc();

	@Query("select p from WeightProfile p order by p.name asc, p.version desc")
	List<WeightProfile> findAllOrderByNameAndVersion();
}
