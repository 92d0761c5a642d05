package com.grorchestrator.orchestration.util;

import com.grorchestrator.orchestration.exception.InvalidArgumentException;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Operations over GTID sets in the engine text format, e.g. {@code 3e11fa47-71ca-11e1-9e33-c80aa9429562:1-5:11-18,uuid2:1-3}.
 * Tagged GTIDs ({@code uuid:tag:1-5}) are treated as a separate source.
 */
public class GtidSetUtils {

    private GtidSetUtils() {
    }

    /**
     * @return true if every transaction of subset is also contained in superset
     * @throws InvalidArgumentException if either set is malformed
     */
    public static boolean isSubset(String subset, String superset) {
        Map<String, List<long[]>> sub = parse(subset);
        Map<String, List<long[]>> sup = parse(superset);

        for (Map.Entry<String, List<long[]>> entry : sub.entrySet()) {
            List<long[]> superIntervals = sup.get(entry.getKey());
            for (long[] interval : entry.getValue()) {
                if (superIntervals == null || !covered(interval, superIntervals)) {
                    return false;
                }
            }
        }
        return true;
    }

    public static long countTransactions(String gtidSet) {
        long count = 0;
        for (List<long[]> intervals : parse(gtidSet).values()) {
            for (long[] interval : intervals) {
                count += interval[1] - interval[0] + 1;
            }
        }
        return count;
    }

    static Map<String, List<long[]>> parse(String gtidSet) {
        Map<String, List<long[]>> result = new TreeMap<>();
        if (StringUtils.isBlank(gtidSet)) {
            return result;
        }

        for (String sidBlock : StringUtils.deleteWhitespace(gtidSet).split(",")) {
            if (sidBlock.isEmpty()) {
                continue;
            }
            String[] parts = sidBlock.split(":");
            if (parts[0].isEmpty()) {
                throw new InvalidArgumentException("GTID set '" + gtidSet + "' has a block without source");
            }
            String source = parts[0].toLowerCase();
            for (int i = 1; i < parts.length; i++) {
                String part = parts[i];
                if (part.isEmpty()) {
                    continue;
                }
                if (!Character.isDigit(part.charAt(0))) {
                    // tag
                    source = parts[0].toLowerCase() + ":" + part.toLowerCase();
                    continue;
                }
                long[] interval = parseInterval(part);
                result.computeIfAbsent(source, key -> new ArrayList<>()).add(interval);
            }
        }
        return result;
    }

    private static long[] parseInterval(String part) {
        int dash = part.indexOf('-');
        long[] interval;
        try {
            if (dash < 0) {
                long value = Long.parseLong(part);
                interval = new long[]{value, value};
            } else {
                interval = new long[]{Long.parseLong(part.substring(0, dash)), Long.parseLong(part.substring(dash + 1))};
            }
        } catch (NumberFormatException e) {
            throw new InvalidArgumentException("Invalid GTID interval '" + part + "'", e);
        }
        if (interval[0] > interval[1]) {
            throw new InvalidArgumentException("Invalid GTID interval '" + part + "', start is after end");
        }
        return interval;
    }

    private static boolean covered(long[] interval, List<long[]> intervals) {
        // intervals of the same source may be adjacent, so walk through them from the start of the checked interval
        long next = interval[0];
        boolean progress = true;
        while (next <= interval[1] && progress) {
            progress = false;
            for (long[] candidate : intervals) {
                if (candidate[0] <= next && candidate[1] >= next) {
                    next = candidate[1] + 1;
                    progress = true;
                }
            }
        }
        return next > interval[1];
    }
}
