package tech.noetzold.coverage_api.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "control_selections",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_control_selection", columnNames = {"scenario_id", "control_id"})
        },
        indexes = {
                @Index(name = "idx_control_selection_scenario", columnList = "scenario_id")
        })
@Getter @Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ControlSelection {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "selection_id")
    private Long selectionId;

    @Column(name = "scenario_id", nullable = false)
    private Long scenarioId;

    @Column(name = "control_id", nullable = false)
    private String controlId;

    @Column(name = "is_active", nullable = false)
    private boolean isActive;
}
