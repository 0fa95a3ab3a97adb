package uk.gegc.scriptflow.features.screenplay.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.scriptflow.features.screenplay.domain.model.ScreenplayElement;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface ScreenplayElementRepository extends JpaRepository<ScreenplayElement, UUID> {

    List<ScreenplayElement> findByScreenplayIdOrderByPositionAsc(UUID screenplayId);

    List<ScreenplayElement> findByScreenplayIdInAndLinkedNodeIdIsNotNull(Collection<UUID> screenplayIds);

    List<ScreenplayElement> findByLinkedNodeIdIn(Collection<UUID> nodeIds);
}
