package bldr.jobsrv.graph;

import java.util.List;
import java.util.Set;

/**
 * One project of a submission, as delivered by the metadata collaborator.
 *
 * @param name         package name, e.g. {@code core/openssl}
 * @param target       target platform, null for the group target
 * @param dependencies direct dependency references ({@code name} or {@code name@target})
 * @param inputsRef    opaque artifact store key for the build inputs
 * @param tags         worker tags required on top of the target
 */
public record ProjectSpec(String name, String target, List<String> dependencies, String inputsRef, Set<String> tags) {

    public ProjectSpec {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public static ProjectSpec of(String name, String... dependencies) {
        return new ProjectSpec(name, null, List.of(dependencies), null, Set.of());
    }
}
