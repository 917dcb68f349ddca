package com.koni.vitals.infrastructure.classifier;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * One isolation tree in the flat array layout exported by scikit-learn.
 * Node i is a leaf when children_left[i] == -1.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class IsolationTree {

    static final int LEAF = -1;

    @JsonProperty("children_left")
    private int[] childrenLeft;

    @JsonProperty("children_right")
    private int[] childrenRight;

    @JsonProperty("feature")
    private int[] feature;

    @JsonProperty("threshold")
    private double[] threshold;

    @JsonProperty("n_node_samples")
    private int[] nodeSamples;

    /**
     * Path length of a sample: depth of the leaf it falls into, plus the expected
     * depth of the unbuilt subtree below that leaf.
     *
     * @param sample a scaled feature vector
     */
    double pathLength(double[] sample) {
        int node = 0;
        int depth = 0;
        while (childrenLeft[node] != LEAF) {
            node = sample[feature[node]] <= threshold[node] ? childrenLeft[node] : childrenRight[node];
            depth++;
        }
        return depth + IsolationForestModel.averagePathLength(nodeSamples[node]);
    }

    void validate(int featureCount) {
        if (childrenLeft == null || childrenRight == null || feature == null
                || threshold == null || nodeSamples == null) {
            throw new IllegalStateException("Tree is missing node arrays");
        }
        int nodes = childrenLeft.length;
        if (nodes == 0 || childrenRight.length != nodes || feature.length != nodes
                || threshold.length != nodes || nodeSamples.length != nodes) {
            throw new IllegalStateException("Tree node arrays must be non-empty and of equal length");
        }
        for (int i = 0; i < nodes; i++) {
            if (childrenLeft[i] == LEAF) {
                continue;
            }
            if (childrenLeft[i] <= i || childrenLeft[i] >= nodes || childrenRight[i] <= i || childrenRight[i] >= nodes) {
                throw new IllegalStateException("Tree node " + i + " has an invalid child index");
            }
            if (feature[i] < 0 || feature[i] >= featureCount) {
                throw new IllegalStateException("Tree node " + i + " splits on unknown feature " + feature[i]);
            }
        }
    }
}
