package uk.gegc.scriptflow.features.flow.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.scriptflow.features.flow.domain.model.Flow;

import java.util.UUID;

@Repository
public interface FlowRepository extends JpaRepository<Flow, UUID> {
}
