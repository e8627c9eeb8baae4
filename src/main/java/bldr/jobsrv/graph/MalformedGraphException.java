package bldr.jobsrv.graph;

import java.util.List;

public class MalformedGraphException extends GraphValidationException {

    public MalformedGraphException(String message) {
        super(message, List.of());
    }

    public MalformedGraphException(String message, List<String> projects) {
        super(message, projects);
    }

    @Override
    public String kind() {
        return "malformed";
    }
}
