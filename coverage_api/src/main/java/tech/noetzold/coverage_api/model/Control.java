package tech.noetzold.coverage_api.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "controls")
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Control {

    @Id
    @Column(name = "control_id", nullable = false)
    private String controlId;

    @Column(name = "control_title", nullable = false)
    private String controlTitle;

    @Column(name = "control_description", columnDefinition = "text")
    private String controlDescription;

    @Column(name = "security_function")
    private String securityFunction; // Identify, Protect, Detect, Respond, Recover

    @Column(name = "control_type")
    private String controlType;

    @Column(name = "maturity_level")
    private String maturityLevel;

    @Column(name = "asset_type")
    private String assetType;
}
