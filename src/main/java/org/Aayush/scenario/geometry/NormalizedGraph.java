package org.Aayush.scenario.geometry;

import lombok.Value;
import org.Aayush.scenario.network.Graph;

/**
 * Output of {@link GeometryNormalizer}: display-space graph and its declared bounds.
 */
@Value
public class NormalizedGraph {
    Graph graph;
    PlanarBounds bounds;
    /** True when coordinates were rescaled; false for degenerate or empty inputs. */
    boolean scaled;
}
