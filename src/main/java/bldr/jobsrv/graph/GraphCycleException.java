package bldr.jobsrv.graph;

import java.util.List;

/**
 * The dependency graph contains a cycle. {@link #projects()} lists its members
 * in cycle order.
 */
public class GraphCycleException extends GraphValidationException {

    public GraphCycleException(List<String> cycle) {
        super("Dependency cycle: " + String.join(" -> ", cycle) + " -> " + cycle.get(0), cycle);
    }

    @Override
    public String kind() {
        return "cycle";
    }
}
