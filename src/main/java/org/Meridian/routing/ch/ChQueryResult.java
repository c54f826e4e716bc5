package org.Meridian.routing.ch;

/**
 * Outcome of one hierarchy query.
 *
 * @param distance shortest-path cost.
 * @param meetingNode highest-rank node on the path where both searches met.
 * @param arcPath packed path as arc ids (edges and shortcuts) from source to target.
 * @param settledNodes nodes settled by both directions together.
 */
public record ChQueryResult(double distance, int meetingNode, int[] arcPath, int settledNodes) {

    public int arcCount() {
        return arcPath.length;
    }
}
