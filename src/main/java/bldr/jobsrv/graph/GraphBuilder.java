package bldr.jobsrv.graph;

import bldr.jobsrv.model.Job;
import bldr.jobsrv.model.JobGroup;
import bldr.jobsrv.model.JobState;
import bldr.jobsrv.model.Project;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Turns a submission into a validated {@link BuildGraph}.
 *
 * <p>
 * Validation covers blank names, duplicate projects, dependencies on projects
 * outside the submission and cycles (three-colour depth-first search). Building
 * has no side effects: the caller persists the result separately, so a rejected
 * submission never touches the store.
 */
public class GraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private enum Colour {
        WHITE, GRAY, BLACK
    }

    private final int maxRetries;

    /**
     * @param maxRetries retry budget captured into every job
     */
    public GraphBuilder(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
    }

    /**
     * Build the graph for one submission.
     *
     * @param target   group target tag, default target of every project
     * @param projects projects with their direct dependencies
     * @return the validated graph with a new QUEUED group
     * @throws GraphCycleException        if the dependencies form a cycle
     * @throws DuplicateProjectException  if a project appears twice
     * @throws MalformedGraphException    for blank names, empty input or unknown dependencies
     */
    public BuildGraph build(String target, List<ProjectSpec> projects) {
        if (target == null || target.isBlank()) {
            throw new MalformedGraphException("Group target is required");
        }
        if (projects == null || projects.isEmpty()) {
            throw new MalformedGraphException("At least one project is required");
        }

        Map<String, ProjectSpec> specs = new LinkedHashMap<>();
        Map<String, Project> nodes = new LinkedHashMap<>();
        for (ProjectSpec spec : projects) {
            if (spec == null || spec.name() == null || spec.name().isBlank()) {
                throw new MalformedGraphException("Project name must not be blank");
            }
            String projectTarget = spec.target() == null || spec.target().isBlank() ? target : spec.target().trim();
            Project project = new Project(spec.name().trim(), projectTarget);
            if (nodes.putIfAbsent(project.ref(), project) != null) {
                throw new DuplicateProjectException(project.ref());
            }
            specs.put(project.ref(), spec);
        }

        Map<String, List<String>> edges = resolveEdges(specs, nodes);
        List<String> order = topologicalOrder(edges);

        String groupId = UUID.randomUUID().toString();
        Instant now = Instant.now();
        Map<String, String> jobIdByRef = new HashMap<>();
        List<Job> jobs = new ArrayList<>(order.size());

        for (String ref : order) {
            String jobId = UUID.randomUUID().toString();
            jobIdByRef.put(ref, jobId);

            List<String> dependencyIds = edges.get(ref).stream().map(jobIdByRef::get).toList();
            ProjectSpec spec = specs.get(ref);
            Project project = nodes.get(ref);

            Set<String> requiredTags = new LinkedHashSet<>();
            requiredTags.add(project.target());
            requiredTags.addAll(spec.tags());

            jobs.add(Job.builder()
                    .id(jobId)
                    .groupId(groupId)
                    .project(project)
                    .dependencies(dependencyIds)
                    .requiredTags(requiredTags)
                    .inputsRef(spec.inputsRef())
                    .state(dependencyIds.isEmpty() ? JobState.READY : JobState.PENDING)
                    .maxRetries(maxRetries)
                    .createdAt(now)
                    .build());
        }

        JobGroup group = JobGroup.builder()
                .id(groupId)
                .target(target)
                .jobIds(jobs.stream().map(Job::id).toList())
                .createdAt(now)
                .build();

        log.debug("Built graph for group {}: {} jobs", groupId, jobs.size());
        return new BuildGraph(group, jobs);
    }

    private Map<String, List<String>> resolveEdges(Map<String, ProjectSpec> specs, Map<String, Project> nodes) {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        for (Map.Entry<String, ProjectSpec> entry : specs.entrySet()) {
            String ref = entry.getKey();
            String defaultTarget = nodes.get(ref).target();
            Set<String> deps = new LinkedHashSet<>();
            for (String raw : entry.getValue().dependencies()) {
                if (raw == null || raw.isBlank()) {
                    throw new MalformedGraphException("Blank dependency of " + ref, List.of(ref));
                }
                String depRef = Project.parse(raw.trim(), defaultTarget).ref();
                if (!nodes.containsKey(depRef)) {
                    throw new MalformedGraphException(
                            "Dependency " + depRef + " of " + ref + " is not part of the submission",
                            List.of(ref, depRef));
                }
                deps.add(depRef);
            }
            edges.put(ref, List.copyOf(deps));
        }
        return edges;
    }

    /**
     * Depth-first three-colour search. Returns projects with dependencies before
     * dependents, or throws on the first back edge.
     */
    private List<String> topologicalOrder(Map<String, List<String>> edges) {
        Map<String, Colour> colour = new HashMap<>();
        edges.keySet().forEach(ref -> colour.put(ref, Colour.WHITE));

        List<String> order = new ArrayList<>(edges.size());
        Set<String> emitted = new HashSet<>();

        for (String root : edges.keySet()) {
            if (colour.get(root) != Colour.WHITE) {
                continue;
            }
            // Explicit stack: long dependency chains must not exhaust the call stack
            Deque<Frame> stack = new ArrayDeque<>();
            List<String> path = new ArrayList<>();
            stack.push(new Frame(root));
            colour.put(root, Colour.GRAY);
            path.add(root);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                List<String> deps = edges.get(frame.ref);
                if (frame.next < deps.size()) {
                    String dep = deps.get(frame.next++);
                    Colour c = colour.get(dep);
                    if (c == Colour.GRAY) {
                        throw new GraphCycleException(List.copyOf(path.subList(path.indexOf(dep), path.size())));
                    }
                    if (c == Colour.WHITE) {
                        colour.put(dep, Colour.GRAY);
                        path.add(dep);
                        stack.push(new Frame(dep));
                    }
                } else {
                    stack.pop();
                    path.remove(path.size() - 1);
                    colour.put(frame.ref, Colour.BLACK);
                    if (emitted.add(frame.ref)) {
                        order.add(frame.ref);
                    }
                }
            }
        }
        return order;
    }

    private static final class Frame {
        final String ref;
        int next;

        Frame(String ref) {
            this.ref = ref;
        }
    }
}
