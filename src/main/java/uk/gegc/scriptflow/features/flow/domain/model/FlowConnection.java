package uk.gegc.scriptflow.features.flow.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.UUID;

@Entity
@Table(name = "flow_connections")
@Getter
@Setter
@NoArgsConstructor
public class FlowConnection {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "connection_id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "flow_id", nullable = false)
    private UUID flowId;

    @Column(name = "source_node_id", nullable = false)
    private UUID sourceNodeId;

    @Column(name = "source_pin", nullable = false, length = 100)
    private String sourcePin;

    @Column(name = "target_node_id", nullable = false)
    private UUID targetNodeId;

    @Column(name = "target_pin", nullable = false, length = 100)
    private String targetPin;

    public FlowConnection(UUID flowId, UUID sourceNodeId, String sourcePin, UUID targetNodeId, String targetPin) {
        this.flowId = flowId;
        this.sourceNodeId = sourceNodeId;
        this.sourcePin = sourcePin;
        this.targetNodeId = targetNodeId;
        this.targetPin = targetPin;
    }

    public boolean touches(UUID nodeId) {
        return nodeId.equals(sourceNodeId) || nodeId.equals(targetNodeId);
    }
}
