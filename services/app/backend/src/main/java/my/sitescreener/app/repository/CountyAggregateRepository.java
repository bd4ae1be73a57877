package my.sitescreener.app.repository;

import my.sitescreener.app.domain.CountyAggregate;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CountyAggregateRepository extends JpaRepository<CountyAggregate, String> {
	List<CountyAggregate> findByPassedTrueOrderByCountyFipsAsc();
}
