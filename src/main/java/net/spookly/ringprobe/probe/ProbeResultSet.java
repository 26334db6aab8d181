package net.spookly.ringprobe.probe;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-point results of one probe call, in the order the points were given.
 */
public final class ProbeResultSet {
    private final String target;
    private final List<ProbeResult> results;

    public ProbeResultSet(String target, List<ProbeResult> results) {
        this.target = target;
        this.results = Collections.unmodifiableList(results);
    }

    public String target() {
        return target;
    }

    public List<ProbeResult> results() {
        return results;
    }

    public int size() {
        return results.size();
    }

    public int successCount() {
        int count = 0;
        for (ProbeResult result : results) {
            if (result.success()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Results keyed by point id, iterating in input order.
     */
    public Map<String, ProbeResult> byPoint() {
        Map<String, ProbeResult> map = new LinkedHashMap<>();
        for (ProbeResult result : results) {
            map.put(result.pointId(), result);
        }
        return map;
    }
}
