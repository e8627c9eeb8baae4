package bldr.jobsrv.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import bldr.jobsrv.graph.GraphValidationException;

import java.util.List;

/**
 * 400 body for a submission rejected by graph validation.
 */
public record ValidationErrorResponse(
        @JsonProperty("error") String error,
        @JsonProperty("kind") String kind,
        @JsonProperty("projects") List<String> projects) {

    public static ValidationErrorResponse from(GraphValidationException e) {
        return new ValidationErrorResponse(e.getMessage(), e.kind(), e.projects());
    }
}
