package uk.gegc.scriptflow.features.flow.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.scriptflow.shared.persistence.JsonNodeConverter;

import java.util.UUID;

/**
 * A vertex of a dialogue flow graph. The canvas position belongs to the author once the node
 * exists; synchronization only sets it on creation.
 */
@Entity
@Table(name = "flow_nodes")
@Getter
@Setter
@NoArgsConstructor
public class FlowNode {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "node_id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "flow_id", nullable = false)
    private UUID flowId;

    @Column(name = "node_type", nullable = false, length = 32)
    private FlowNodeType type;

    @Convert(converter = JsonNodeConverter.class)
    @Column(name = "node_data", columnDefinition = "TEXT")
    private JsonNode data;

    @Column(name = "position_x", nullable = false)
    private double positionX;

    @Column(name = "position_y", nullable = false)
    private double positionY;

    @Column(name = "source", nullable = false, length = 32)
    private NodeSource source = NodeSource.MANUAL;

    public FlowNode(UUID flowId, FlowNodeType type, JsonNode data, double positionX, double positionY, NodeSource source) {
        this.flowId = flowId;
        this.type = type;
        this.data = data;
        this.positionX = positionX;
        this.positionY = positionY;
        this.source = source;
    }

    public boolean isManaged() {
        return source == NodeSource.SCREENPLAY_SYNC;
    }
}
