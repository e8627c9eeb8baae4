package bldr.jobsrv.model;

/**
 * Assignment message sent to a worker.
 *
 * @param jobId      job to build
 * @param projectRef project reference, {@code name@target}
 * @param inputsRef  opaque artifact store key, may be null
 */
public record JobAssignment(String jobId, String projectRef, String inputsRef) {

    public static JobAssignment forJob(Job job) {
        return new JobAssignment(job.id(), job.project().ref(), job.inputsRef());
    }
}
