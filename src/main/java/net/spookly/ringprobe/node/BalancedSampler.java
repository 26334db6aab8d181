package net.spookly.ringprobe.node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;

/**
 * Draws a limited sample of vantage points without letting one large group dominate.
 *
 * <p>Points are partitioned by the combined values of the grouping fields, each partition is
 * shuffled, and the sample is drawn round-robin across partitions in shuffled order, skipping
 * exhausted partitions. With no grouping fields the draw is uniform.
 */
public final class BalancedSampler {
    private BalancedSampler() {
    }

    /**
     * @return {@code min(limit, points.size())} points; the input list is not modified
     */
    public static List<VantagePoint> sample(List<VantagePoint> points,
                                            int limit,
                                            List<FilterField> groupingFields,
                                            Random random) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        if (limit >= points.size()) {
            return new ArrayList<>(points);
        }
        if (groupingFields == null || groupingFields.isEmpty()) {
            List<VantagePoint> shuffled = new ArrayList<>(points);
            Collections.shuffle(shuffled, random);
            return new ArrayList<>(shuffled.subList(0, limit));
        }

        Map<List<String>, List<VantagePoint>> groups = new LinkedHashMap<>();
        for (VantagePoint point : points) {
            groups.computeIfAbsent(groupKey(point, groupingFields), key -> new ArrayList<>()).add(point);
        }
        List<Iterator<VantagePoint>> cursors = new ArrayList<>(groups.size());
        for (List<VantagePoint> members : groups.values()) {
            Collections.shuffle(members, random);
            cursors.add(members.iterator());
        }
        Collections.shuffle(cursors, random);

        List<VantagePoint> sample = new ArrayList<>(limit);
        while (sample.size() < limit && !cursors.isEmpty()) {
            Iterator<Iterator<VantagePoint>> round = cursors.iterator();
            while (round.hasNext() && sample.size() < limit) {
                Iterator<VantagePoint> cursor = round.next();
                if (!cursor.hasNext()) {
                    round.remove();
                    continue;
                }
                sample.add(cursor.next());
            }
        }
        return sample;
    }

    /**
     * Number of distinct groups the points fall into for the given fields.
     */
    public static int groupCount(List<VantagePoint> points, List<FilterField> groupingFields) {
        if (groupingFields == null || groupingFields.isEmpty()) {
            return points.isEmpty() ? 0 : 1;
        }
        Map<List<String>, Boolean> seen = new LinkedHashMap<>();
        for (VantagePoint point : points) {
            seen.put(groupKey(point, groupingFields), Boolean.TRUE);
        }
        return seen.size();
    }

    private static List<String> groupKey(VantagePoint point, List<FilterField> fields) {
        List<String> key = new ArrayList<>(fields.size());
        for (FilterField field : fields) {
            String value = field.valueOf(point);
            key.add(value == null ? "" : value.toLowerCase(Locale.ROOT));
        }
        return key;
    }
}
