package uk.gegc.scriptflow.features.screenplay.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.scriptflow.shared.persistence.JsonNodeConverter;

import java.util.UUID;

@Entity
@Table(name = "screenplay_elements")
@Getter
@Setter
@NoArgsConstructor
public class ScreenplayElement {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "element_id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "screenplay_id", nullable = false)
    private UUID screenplayId;

    @Column(name = "element_type", nullable = false, length = 32)
    private ElementType type;

    @Column(name = "content", columnDefinition = "TEXT")
    private String content;

    @Convert(converter = JsonNodeConverter.class)
    @Column(name = "element_data", columnDefinition = "TEXT")
    private JsonNode data;

    @Column(name = "position", nullable = false)
    private Integer position;

    /**
     * Node last produced from (push) or for (pull) this element. {@code null} means the element
     * was written by hand or has never been synchronized.
     */
    @Column(name = "linked_node_id")
    private UUID linkedNodeId;

    public ScreenplayElement(UUID screenplayId, ElementType type, String content, JsonNode data, Integer position) {
        this.screenplayId = screenplayId;
        this.type = type;
        this.content = content;
        this.data = data;
        this.position = position;
    }
}
