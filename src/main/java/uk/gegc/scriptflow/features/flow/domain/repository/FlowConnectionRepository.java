package uk.gegc.scriptflow.features.flow.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.scriptflow.features.flow.domain.model.FlowConnection;

import java.util.List;
import java.util.UUID;

@Repository
public interface FlowConnectionRepository extends JpaRepository<FlowConnection, UUID> {

    List<FlowConnection> findByFlowId(UUID flowId);
}
