package tech.noetzold.coverage_api.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.Immutable;

@Entity
@Immutable
@Table(name = "capabilities")
@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Capability {

    @Id
    @Column(name = "capability_id", nullable = false)
    private String capabilityId;

    @Column(name = "capability_name", nullable = false)
    private String capabilityName;

    @Column(name = "capability_type", nullable = false)
    private String capabilityType; // technical, non-technical

    @Column(name = "capability_domain")
    private String capabilityDomain;

    @Column(name = "capability_definition", columnDefinition = "text")
    private String capabilityDefinition;

    @Column(name = "candidate_products", columnDefinition = "text")
    private String candidateProducts;

    @Column(name = "notes", columnDefinition = "text")
    private String notes;
}
