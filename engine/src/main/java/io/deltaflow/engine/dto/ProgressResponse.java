package io.deltaflow.engine.dto;

import java.util.Map;

/**
 * JSON response for GET /admin/progress.
 * Example:
 *   {
 *     "state": "RUNNING",
 *     "currentEpoch": 12,
 *     "closedThrough": 11,
 *     "committedEpoch": 11,
 *     "frontiers": { "orders": 12, "totals": 12, "out": 12 },
 *     "failure": null
 *   }
 */
public class ProgressResponse {
    public String state;
    public long currentEpoch;
    public long closedThrough;
    public long committedEpoch;
    public Map<String, Long> frontiers;
    public FailureView failure;

    /** The first operator failure, if the dataflow failed. */
    public static class FailureView {
        public String operatorId;
        public int shard;
        public long epoch;
        public String error;
    }
}
