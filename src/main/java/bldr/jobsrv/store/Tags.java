package bldr.jobsrv.store;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Column encoding for tag sets: sorted, comma separated.
 */
final class Tags {

    private Tags() {
    }

    static String encode(Set<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return "";
        }
        return String.join(",", new TreeSet<>(tags));
    }

    static Set<String> decode(String column) {
        if (column == null || column.isBlank()) {
            return Collections.emptySet();
        }
        return Arrays.stream(column.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
