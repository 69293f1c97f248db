package tech.noetzold.coverage_api.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import tech.noetzold.coverage_api.model.Control;

public interface ControlRepository extends JpaRepository<Control, String> {
}
