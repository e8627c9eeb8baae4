package bldr.jobsrv.graph;

import java.util.List;

/**
 * A submission that cannot be turned into a build graph. Nothing is persisted
 * when this is thrown.
 */
public abstract class GraphValidationException extends RuntimeException {

    private final List<String> projects;

    protected GraphValidationException(String message, List<String> projects) {
        super(message);
        this.projects = List.copyOf(projects);
    }

    /** Short machine-readable kind: {@code cycle}, {@code duplicate} or {@code malformed} */
    public abstract String kind();

    /** Project references involved in the error, possibly empty */
    public List<String> projects() {
        return projects;
    }
}
