package com.finance.anomaly.engine.timeseries;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class KMeansClustererTest {

    private final KMeansClusterer clusterer = new KMeansClusterer(100, 42L);

    @Test
    void cluster_separatedGroups_areKeptApart() {
        double[][] points = {
                {0.0, 0.0}, {0.02, 0.01}, {0.01, 0.03},
                {1.0, 1.0}, {0.98, 0.99}, {0.97, 1.0}
        };

        KMeansClusterer.Result result = clusterer.cluster(points, 2);

        int[] a = result.getAssignments();
        assertThat(result.clusterCount()).isEqualTo(2);
        assertThat(a[0]).isEqualTo(a[1]).isEqualTo(a[2]);
        assertThat(a[3]).isEqualTo(a[4]).isEqualTo(a[5]);
        assertThat(a[0]).isNotEqualTo(a[3]);
        assertThat(result.size(a[0])).isEqualTo(3);
    }

    @Test
    void cluster_kLargerThanDistinctPoints_isReduced() {
        double[][] points = {{1.0}, {1.0}, {2.0}, {2.0}};

        KMeansClusterer.Result result = clusterer.cluster(points, 4);

        assertThat(result.clusterCount()).isEqualTo(2);
        assertThat(result.getDistances()).containsOnly(0.0);
    }

    @Test
    void cluster_sameSeed_isDeterministic() {
        double[][] points = {{0.1, 0.9}, {0.4, 0.2}, {0.8, 0.5}, {0.3, 0.3}, {0.9, 0.9}, {0.2, 0.7}};

        int[] first = new KMeansClusterer(100, 7L).cluster(points, 3).getAssignments();
        int[] second = new KMeansClusterer(100, 7L).cluster(points, 3).getAssignments();

        assertThat(first).containsExactly(second);
    }
}
