package bldr.jobsrv.model;

import java.util.Objects;

/**
 * A buildable unit: package name plus target platform.
 */
public record Project(String name, String target) {

    public Project {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(target, "target is required");
    }

    /** Reference string used in dependency lists and assignments, e.g. {@code core/zlib@x86_64-linux} */
    public String ref() {
        return name + "@" + target;
    }

    /**
     * Parse a reference produced by {@link #ref()}. A reference without a target
     * takes the given default.
     */
    public static Project parse(String ref, String defaultTarget) {
        int at = ref.lastIndexOf('@');
        if (at < 0) {
            return new Project(ref, defaultTarget);
        }
        return new Project(ref.substring(0, at), ref.substring(at + 1));
    }

    @Override
    public String toString() {
        return ref();
    }
}
