package bldr.jobsrv.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import bldr.jobsrv.graph.ProjectSpec;

import java.util.List;
import java.util.Set;

/**
 * Request DTO for submitting a build group.
 * POST /api/v1/groups
 */
public record SubmitGroupRequest(
        @JsonProperty("target") String target,
        @JsonProperty("projects") List<ProjectRequest> projects) {

    /**
     * One project to build. {@code target} defaults to the group target and
     * dependencies are {@code name} or {@code name@target} references.
     */
    public record ProjectRequest(
            @JsonProperty("name") String name,
            @JsonProperty("target") String target,
            @JsonProperty("dependencies") List<String> dependencies,
            @JsonProperty("inputsRef") String inputsRef,
            @JsonProperty("tags") Set<String> tags) {

        public ProjectSpec toSpec() {
            return new ProjectSpec(name, target, dependencies, inputsRef, tags);
        }
    }

    /** Validate the request shape; graph rules are checked by the graph builder */
    public void validate() {
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("target is required");
        }
        if (projects == null || projects.isEmpty()) {
            throw new IllegalArgumentException("projects must not be empty");
        }
        for (ProjectRequest project : projects) {
            if (project == null) {
                throw new IllegalArgumentException("projects must not contain null");
            }
            if (project.dependencies() != null && project.dependencies().stream().anyMatch(d -> d == null || d.isBlank())) {
                throw new IllegalArgumentException("dependency references must not be blank");
            }
        }
    }

    public List<ProjectSpec> toSpecs() {
        return projects.stream().map(ProjectRequest::toSpec).toList();
    }
}
