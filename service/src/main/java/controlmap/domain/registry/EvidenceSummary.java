package controlmap.domain.registry;

import java.util.Map;

/**
 * Statistics over every entry in the evidence registry.
 *
 * @param total             The number of entries
 * @param valid             The number of valid entries
 * @param invalid           The number of entries that are not valid, including failures
 * @param uniqueControls    The number of distinct controls evidence was submitted for
 * @param averageConfidence The mean confidence of all entries, or 0 when there are none
 * @param countPerControl   The number of entries per control id, sorted by control id
 */
public record EvidenceSummary(int total,
                              int valid,
                              int invalid,
                              int uniqueControls,
                              double averageConfidence,
                              Map<String, Long> countPerControl) {
}
