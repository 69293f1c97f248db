package tech.noetzold.coverage_api.model;

import java.util.List;
import java.util.Map;

/**
 * Capabilities that own at least one control no other capability maps.
 * Deactivating one of these actually lowers the active control count.
 */
public record UniqueControlsResponse(
        List<String> capabilitiesWithUniqueControls,
        int count,
        Map<String, Integer> uniqueControlCounts,
        Map<String, List<String>> uniqueControlIds
) {}
