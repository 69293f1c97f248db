package tech.noetzold.coverage_api.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "risks")
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Risk {

    @Id
    @Column(name = "risk_id", nullable = false)
    private String riskId;

    @Column(name = "risk_title", nullable = false)
    private String riskTitle;

    @Column(name = "risk_description", columnDefinition = "text")
    private String riskDescription;
}
