package tech.noetzold.coverage_api.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "capability_selections",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_capability_selection", columnNames = {"scenario_id", "capability_id"})
        },
        indexes = {
                @Index(name = "idx_selection_scenario", columnList = "scenario_id")
        })
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CapabilitySelection {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "selection_id")
    private Long selectionId;

    @Column(name = "scenario_id", nullable = false)
    private Long scenarioId;

    @Column(name = "capability_id", nullable = false)
    private String capabilityId;

    @Column(name = "is_active", nullable = false)
    private boolean isActive;
}
