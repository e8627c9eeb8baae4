package bldr.jobsrv.dispatch;

/**
 * Counters of one dispatch pass.
 *
 * @param ready        READY jobs considered
 * @param dispatched   assignments sent and recorded
 * @param unmatched    jobs left READY without a send: no worker fits, or an
 *                     earlier send to the same worker failed
 * @param sendFailures assignments a worker did not accept
 * @param lostRaces    assignments sent but not recorded; the worker got an abort
 */
public record DispatchResult(int ready, int dispatched, int unmatched, int sendFailures, int lostRaces) {

    public static final DispatchResult EMPTY = new DispatchResult(0, 0, 0, 0, 0);

    public DispatchResult plus(DispatchResult other) {
        return new DispatchResult(ready + other.ready, dispatched + other.dispatched,
                unmatched + other.unmatched, sendFailures + other.sendFailures, lostRaces + other.lostRaces);
    }
}
