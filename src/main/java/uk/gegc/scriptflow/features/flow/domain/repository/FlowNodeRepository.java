package uk.gegc.scriptflow.features.flow.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.scriptflow.features.flow.domain.model.FlowNode;

import java.util.List;
import java.util.UUID;

@Repository
public interface FlowNodeRepository extends JpaRepository<FlowNode, UUID> {

    List<FlowNode> findByFlowId(UUID flowId);
}
