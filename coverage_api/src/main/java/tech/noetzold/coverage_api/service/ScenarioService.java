package tech.noetzold.coverage_api.service;

import lombok.extern.slf4j.Slf4j;
import org.hibernate.exception.ConstraintViolationException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import tech.noetzold.coverage_api.exception.CoverageApiException;
import tech.noetzold.coverage_api.model.*;
import tech.noetzold.coverage_api.repository.CapabilityScenarioRepository;
import tech.noetzold.coverage_api.repository.CapabilitySelectionRepository;
import tech.noetzold.coverage_api.repository.ControlSelectionRepository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * CRUD over user scenarios and their capability/control selections.
 * <p>
 * Ownership is only enforced when the caller passes a {@code userId}; a null
 * {@code userId} skips the check. Selection writes replace the whole set for the
 * scenario inside the surrounding transaction. Concurrent writers are not
 * serialized: the last committed replace wins.
 */
@Slf4j
@Service
public class ScenarioService {

    static final int MAX_NAME_LENGTH = 255;

    private final CapabilityScenarioRepository scenarioRepo;
    private final CapabilitySelectionRepository capabilitySelectionRepo;
    private final ControlSelectionRepository controlSelectionRepo;
    private final CoverageAnalyzer analyzer;

    public ScenarioService(CapabilityScenarioRepository scenarioRepo,
                           CapabilitySelectionRepository capabilitySelectionRepo,
                           ControlSelectionRepository controlSelectionRepo,
                           CoverageAnalyzer analyzer) {
        this.scenarioRepo = scenarioRepo;
        this.capabilitySelectionRepo = capabilitySelectionRepo;
        this.controlSelectionRepo = controlSelectionRepo;
        this.analyzer = analyzer;
    }

    @Transactional(readOnly = true)
    public List<ScenarioResponse> listForUser(Long userId) {
        return scenarioRepo.findByUserIdOrderByIsDefaultDescUpdatedAtDesc(userId).stream()
                .map(ScenarioResponse::fromEntity)
                .toList();
    }

    @Transactional
    public ScenarioResponse create(ScenarioCreateRequest req) {
        String name = requireName(req.scenarioName());
        if (scenarioRepo.existsByUserIdAndScenarioName(req.userId(), name)) {
            throw CoverageApiException.duplicateName(name);
        }

        if (req.defaultRequested()) {
            int cleared = scenarioRepo.clearDefaults(req.userId());
            log.debug("Cleared {} default scenario(s) for user {}", cleared, req.userId());
        }

        CapabilityScenario entity = CapabilityScenario.builder()
                .userId(req.userId())
                .scenarioName(name)
                .isDefault(req.defaultRequested())
                .build();

        try {
            entity = scenarioRepo.saveAndFlush(entity);
        } catch (DataIntegrityViolationException e) {
            if (isNameConflict(e)) {
                // lost a race against another insert of the same (user, name)
                log.warn("Unique constraint hit creating scenario '{}' for user {}", name, req.userId());
                throw CoverageApiException.duplicateName(name);
            }
            throw CoverageApiException.storage("creating scenario for user " + req.userId(), e);
        }

        log.info("Scenario {} '{}' created for user {} (default={})",
                entity.getScenarioId(), name, entity.getUserId(), entity.isDefault());
        return ScenarioResponse.fromEntity(entity);
    }

    @Transactional(readOnly = true)
    public ScenarioDetailResponse get(Long scenarioId, Long userId) {
        CapabilityScenario scenario = loadChecked(scenarioId, userId);
        return ScenarioDetailResponse.of(scenario,
                capabilitySelections(scenarioId),
                controlSelections(scenarioId));
    }

    @Transactional
    public ScenarioResponse update(Long scenarioId, ScenarioUpdateRequest req, Long userId) {
        CapabilityScenario scenario = loadChecked(scenarioId, userId);
        Long owner = scenario.getUserId();

        if (req.scenarioName() != null) {
            String name = requireName(req.scenarioName());
            if (!name.equals(scenario.getScenarioName())
                    && scenarioRepo.existsByUserIdAndScenarioNameAndScenarioIdNot(owner, name, scenarioId)) {
                throw CoverageApiException.duplicateName(name);
            }
            scenario.setScenarioName(name);
        }

        if (req.isDefault() != null) {
            if (req.isDefault()) {
                scenarioRepo.clearDefaultsExcept(owner, scenarioId);
            }
            scenario.setDefault(req.isDefault());
        }

        if (req.selections() != null) {
            replaceCapabilitySelections(scenarioId, req.selections());
        }
        if (req.controlSelections() != null) {
            log.info("Updating control selections for scenario {}: {} selections",
                    scenarioId, req.controlSelections().size());
            replaceControlSelections(scenarioId, req.controlSelections());
        }

        scenario.touch();
        try {
            scenario = scenarioRepo.saveAndFlush(scenario);
        } catch (DataIntegrityViolationException e) {
            if (isNameConflict(e)) {
                log.warn("Unique constraint hit renaming scenario {}", scenarioId);
                throw CoverageApiException.duplicateName(scenario.getScenarioName());
            }
            throw CoverageApiException.storage("updating scenario " + scenarioId, e);
        }
        return ScenarioResponse.fromEntity(scenario);
    }

    @Transactional
    public void delete(Long scenarioId, Long userId) {
        CapabilityScenario scenario = loadChecked(scenarioId, userId);
        int caps = capabilitySelectionRepo.deleteAllForScenario(scenarioId);
        int ctrls = controlSelectionRepo.deleteAllForScenario(scenarioId);
        scenarioRepo.delete(scenario);
        log.info("Scenario {} deleted with {} capability and {} control selections", scenarioId, caps, ctrls);
    }

    @Transactional
    public SaveSelectionsResponse saveCapabilitySelections(CapabilitySelectionsRequest req) {
        CapabilityScenario scenario = loadChecked(req.scenarioId(), req.userId());
        int saved = replaceCapabilitySelections(scenario.getScenarioId(), req.selections());
        scenario.touch();
        scenarioRepo.save(scenario);
        return new SaveSelectionsResponse("Selections saved successfully", saved);
    }

    @Transactional(readOnly = true)
    public List<CapabilitySelectionEntry> getCapabilitySelections(Long scenarioId, Long userId) {
        loadChecked(scenarioId, userId);
        return capabilitySelections(scenarioId);
    }

    @Transactional
    public SaveSelectionsResponse saveControlSelections(ControlSelectionsRequest req) {
        CapabilityScenario scenario = loadChecked(req.scenarioId(), req.userId());
        int saved = replaceControlSelections(scenario.getScenarioId(), req.selections());
        scenario.touch();
        scenarioRepo.save(scenario);
        return new SaveSelectionsResponse("Control selections saved successfully", saved);
    }

    @Transactional(readOnly = true)
    public List<ControlSelectionEntry> getControlSelections(Long scenarioId, Long userId) {
        loadChecked(scenarioId, userId);
        return controlSelections(scenarioId);
    }

    /**
     * Runs the coverage analysis for the scenario's active selections. Control
     * selections act as an override only when at least one of them is active.
     */
    @Transactional(readOnly = true)
    public CoverageReport analyze(Long scenarioId, Long userId) {
        loadChecked(scenarioId, userId);

        List<String> activeCapabilities = capabilitySelectionRepo.findByScenarioId(scenarioId).stream()
                .filter(CapabilitySelection::isActive)
                .map(CapabilitySelection::getCapabilityId)
                .toList();

        List<String> activeControls = controlSelectionRepo.findByScenarioId(scenarioId).stream()
                .filter(ControlSelection::isActive)
                .map(ControlSelection::getControlId)
                .toList();
        List<String> controlOverride = activeControls.isEmpty() ? null : activeControls;

        return analyzer.analyze(activeCapabilities, controlOverride);
    }

    private CapabilityScenario loadChecked(Long scenarioId, Long userId) {
        if (scenarioId == null) {
            throw CoverageApiException.validation("scenario_id", "must be provided");
        }
        CapabilityScenario scenario = scenarioRepo.findById(scenarioId)
                .orElseThrow(() -> CoverageApiException.scenarioNotFound(scenarioId));
        if (userId != null && !scenario.isOwnedBy(userId)) {
            log.warn("User {} denied access to scenario {} owned by {}", userId, scenarioId, scenario.getUserId());
            throw CoverageApiException.forbidden();
        }
        return scenario;
    }

    private int replaceCapabilitySelections(Long scenarioId, List<CapabilitySelectionEntry> entries) {
        Map<String, Boolean> byId = new LinkedHashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            CapabilitySelectionEntry e = entries.get(i);
            if (e == null || e.capabilityId() == null || e.capabilityId().isBlank()) {
                throw CoverageApiException.validation("selections[" + i + "].capability_id", "missing capability_id");
            }
            if (e.isActive() == null) {
                throw CoverageApiException.validation("selections[" + i + "].is_active", "missing is_active");
            }
            byId.put(e.capabilityId(), e.isActive());
        }

        List<CapabilitySelection> rows = new ArrayList<>(byId.size());
        byId.forEach((id, active) -> rows.add(CapabilitySelection.builder()
                .scenarioId(scenarioId)
                .capabilityId(id)
                .isActive(active)
                .build()));
        try {
            capabilitySelectionRepo.deleteAllForScenario(scenarioId);
            capabilitySelectionRepo.saveAll(rows);
        } catch (DataAccessException e) {
            throw CoverageApiException.storage("replacing capability selections of scenario " + scenarioId, e);
        }
        return rows.size();
    }

    private int replaceControlSelections(Long scenarioId, List<ControlSelectionEntry> entries) {
        Map<String, Boolean> byId = new LinkedHashMap<>();
        for (int i = 0; i < entries.size(); i++) {
            ControlSelectionEntry e = entries.get(i);
            if (e == null || e.controlId() == null || e.controlId().isBlank()) {
                log.error("Invalid control selection at index {} for scenario {}: missing control_id", i, scenarioId);
                throw CoverageApiException.validation("control_selections[" + i + "].control_id", "missing control_id");
            }
            if (e.isActive() == null) {
                throw CoverageApiException.validation("control_selections[" + i + "].is_active", "missing is_active");
            }
            byId.put(e.controlId(), e.isActive());
        }

        List<ControlSelection> rows = new ArrayList<>(byId.size());
        byId.forEach((id, active) -> rows.add(ControlSelection.builder()
                .scenarioId(scenarioId)
                .controlId(id)
                .isActive(active)
                .build()));
        try {
            controlSelectionRepo.deleteAllForScenario(scenarioId);
            controlSelectionRepo.saveAll(rows);
        } catch (DataAccessException e) {
            throw CoverageApiException.storage("replacing control selections of scenario " + scenarioId, e);
        }
        return rows.size();
    }

    private List<CapabilitySelectionEntry> capabilitySelections(Long scenarioId) {
        return capabilitySelectionRepo.findByScenarioId(scenarioId).stream()
                .map(CapabilitySelectionEntry::fromEntity)
                .toList();
    }

    private List<ControlSelectionEntry> controlSelections(Long scenarioId) {
        return controlSelectionRepo.findByScenarioId(scenarioId).stream()
                .map(ControlSelectionEntry::fromEntity)
                .toList();
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw CoverageApiException.validation("scenario_name", "must not be blank");
        }
        if (name.length() > MAX_NAME_LENGTH) {
            throw CoverageApiException.validation("scenario_name", "must be at most " + MAX_NAME_LENGTH + " characters");
        }
        return name;
    }

    /**
     * True only when the violated constraint is the (user, name) unique key.
     * Other integrity failures (length, not-null) are storage errors.
     */
    static boolean isNameConflict(DataIntegrityViolationException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ConstraintViolationException cve) {
                String constraint = cve.getConstraintName();
                return constraint != null
                        && constraint.toLowerCase(Locale.ROOT).contains(CapabilityScenario.NAME_CONSTRAINT);
            }
        }
        return false;
    }
}
