package com.hyperunmix.server.unmixing;

import com.hyperunmix.server.unmixing.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

public class EndmemberVisualizerTest {

    private static Endmember cluster(int index, double[]... members) {
        int[] pixels = new int[members.length];
        for (int m = 0; m < members.length; m++) {
            pixels[m] = index * 10 + m;
        }
        return new Endmember(members[0], pixels[0], 5, index, pixels, members);
    }

    private static EndmemberSet twoClusters() {
        Endmember low = cluster(0,
                new double[] { 1.0, 0.0, 0.0, 0.1 },
                new double[] { 1.1, 0.0, 0.1, 0.1 },
                new double[] { 0.9, 0.1, 0.0, 0.1 });
        Endmember high = cluster(1,
                new double[] { 0.0, 0.0, 1.0, 0.9 },
                new double[] { 0.1, 0.0, 1.1, 0.9 },
                new double[] { 0.0, 0.1, 0.9, 1.0 });
        return new EndmemberSet(Arrays.asList(low, high), new int[20], 4, 5, 5.0);
    }

    @Test
    public void testProjectionSeparatesClusters() {
        NdProjection projection = new EndmemberVisualizer().project(twoClusters(), 2);

        assertEquals(2, projection.getComponents());
        assertEquals(2, projection.getEndmemberPoints().size());
        assertEquals(3, projection.getClusterPoints().get(0).length);
        assertEquals(2, projection.getClusterPoints().get(1)[0].length);

        double[] variances = projection.getVariances();
        assertTrue(variances[0] >= variances[1]);

        // The cluster contrast is the leading direction
        double a = projection.getEndmemberPoints().get(0)[0];
        double b = projection.getEndmemberPoints().get(1)[0];
        assertTrue(a * b < 0, "Clusters should fall on opposite sides of the first component");
    }

    @Test
    public void testProjectionIsNotShared() {
        NdProjection projection = new EndmemberVisualizer().project(twoClusters(), 2);
        double cluster = projection.getClusterPoints().get(0)[0][0];
        double endmember = projection.getEndmemberPoints().get(0)[0];

        projection.getClusterPoints().get(0)[0][0] = 42.0;
        projection.getEndmemberPoints().get(0)[0] = 42.0;

        assertEquals(cluster, projection.getClusterPoints().get(0)[0][0], 0.0);
        assertEquals(endmember, projection.getEndmemberPoints().get(0)[0], 0.0);
    }

    @Test
    public void testMemberSpectraAreCopied() {
        double[][] members = { { 1.0, 0.0 }, { 0.9, 0.1 } };
        Endmember em = new Endmember(members[0], 0, 3, 1, new int[] { 0, 1 }, members);

        members[1][0] = 42.0;
        em.getMemberSpectra()[1][1] = 42.0;

        assertArrayEquals(new double[] { 0.9, 0.1 }, em.getMemberSpectra()[1], 0.0);
        assertEquals(1, em.getClusterIndex());
    }

    @Test
    public void testDefaultComponentCount() {
        NdProjection projection = new EndmemberVisualizer().project(twoClusters(),
                EndmemberVisualizer.DEFAULT_COMPONENTS);
        assertEquals(3, projection.getEndmemberPoints().get(0).length);
    }

    @Test
    public void testInvalidRequests() {
        EndmemberVisualizer visualizer = new EndmemberVisualizer();
        assertThrows(ValidationException.class, () -> visualizer.project(twoClusters(), 5));
        assertThrows(ValidationException.class, () -> visualizer.project(null, 2));
        EndmemberSet empty = new EndmemberSet(Collections.emptyList(), new int[0], 0, 0, 0.0);
        assertThrows(ValidationException.class, () -> visualizer.project(empty, 2));
    }
}
