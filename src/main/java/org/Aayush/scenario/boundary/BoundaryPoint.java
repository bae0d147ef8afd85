package org.Aayush.scenario.boundary;

/**
 * Candidate insertion or removal point: the edge id plus the coordinate of its dangling node.
 *
 * @param id edge id.
 * @param x planar x of the open-end node, or 0 when that node is unknown.
 * @param y planar y of the open-end node, or 0 when that node is unknown.
 */
public record BoundaryPoint(String id, double x, double y) {

    /**
     * Display label for selection lists; the edge id.
     */
    public String name() {
        return id;
    }
}
