package uk.gegc.scriptflow.features.screenplay.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.scriptflow.features.screenplay.domain.model.Screenplay;

import java.util.List;
import java.util.UUID;

@Repository
public interface ScreenplayRepository extends JpaRepository<Screenplay, UUID> {

    List<Screenplay> findByParentIdOrderByPositionAsc(UUID parentId);

    boolean existsByIdAndParentId(UUID id, UUID parentId);

    @Query("SELECT COALESCE(MAX(s.position), -1) FROM Screenplay s WHERE s.parentId = :parentId")
    int findMaxChildPosition(@Param("parentId") UUID parentId);
}
