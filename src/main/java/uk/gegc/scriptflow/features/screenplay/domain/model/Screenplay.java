package uk.gegc.scriptflow.features.screenplay.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.UUID;

/**
 * One page of a screenplay document. Pages form a tree through {@code parentId}; a response
 * choice may additionally point at a child page through its {@code linked_screenplay_id}.
 */
@Entity
@Table(name = "screenplays")
@Getter
@Setter
@NoArgsConstructor
public class Screenplay {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "screenplay_id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "parent_id")
    private UUID parentId;

    @Column(name = "position", nullable = false)
    private Integer position;

    @Column(name = "linked_flow_id")
    private UUID linkedFlowId;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false, nullable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    public void prePersist() {
        if (position == null) {
            position = 0;
        }
    }
}
