package tech.noetzold.coverage_api.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "capability_control_mapping", uniqueConstraints = {
        @UniqueConstraint(name = "uk_capability_control", columnNames = {"capability_id", "control_id"})
})
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CapabilityControlMapping {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "capability_id", nullable = false)
    private String capabilityId;

    @Column(name = "control_id", nullable = false)
    private String controlId;
}
