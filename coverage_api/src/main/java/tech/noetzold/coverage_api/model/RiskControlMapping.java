package tech.noetzold.coverage_api.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "risk_control_mapping", uniqueConstraints = {
        @UniqueConstraint(name = "uk_risk_control", columnNames = {"risk_id", "control_id"})
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RiskControlMapping {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "risk_id", nullable = false)
    private String riskId;

    @Column(name = "control_id", nullable = false)
    private String controlId;
}
