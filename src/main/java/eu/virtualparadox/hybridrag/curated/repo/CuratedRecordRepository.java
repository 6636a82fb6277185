package eu.virtualparadox.hybridrag.curated.repo;

import eu.virtualparadox.hybridrag.curated.entity.CuratedRecordEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CuratedRecordRepository extends JpaRepository<CuratedRecordEntity, Long> {

    List<CuratedRecordEntity> findAllByOrderByIdAsc();
}
