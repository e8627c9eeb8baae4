package bldr.jobsrv.graph;

import java.util.List;

public class DuplicateProjectException extends GraphValidationException {

    public DuplicateProjectException(String projectRef) {
        super("Project submitted more than once: " + projectRef, List.of(projectRef));
    }

    @Override
    public String kind() {
        return "duplicate";
    }
}
