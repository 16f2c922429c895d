package guraa.uicompare.visual;

import org.springframework.stereotype.Component;

/**
 * Compares the binary Sobel edge maps of two images.
 * The score is the fraction of pixel positions where both maps agree.
 */
@Component
public class EdgeSimilarityCalculator {

    static final int EDGE_THRESHOLD = 128;

    private static final int[][] SOBEL_X = {
            {-1, 0, 1},
            {-2, 0, 2},
            {-1, 0, 1}
    };

    private static final int[][] SOBEL_Y = {
            {-1, -2, -1},
            {0, 0, 0},
            {1, 2, 1}
    };

    public double calculate(NormalizedImage image1, NormalizedImage image2) {
        boolean[] edges1 = detectEdges(image1);
        boolean[] edges2 = detectEdges(image2);

        int total = Math.min(edges1.length, edges2.length);
        if (total == 0) {
            return 0.0;
        }

        int matches = 0;
        for (int i = 0; i < total; i++) {
            if (edges1[i] == edges2[i]) {
                matches++;
            }
        }
        return (double) matches / total;
    }

    /**
     * Detect edges with a 3x3 Sobel operator on the luminance channel.
     * The outermost rows and columns are never edges.
     *
     * @param image The image
     * @return One flag per pixel, row-major
     */
    public boolean[] detectEdges(NormalizedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        boolean[] edges = new boolean[width * height];

        for (int y = 1; y < height - 1; y++) {
            for (int x = 1; x < width - 1; x++) {
                int gx = 0;
                int gy = 0;
                for (int ky = -1; ky <= 1; ky++) {
                    for (int kx = -1; kx <= 1; kx++) {
                        int pixel = image.luminanceAt(x + kx, y + ky);
                        gx += pixel * SOBEL_X[ky + 1][kx + 1];
                        gy += pixel * SOBEL_Y[ky + 1][kx + 1];
                    }
                }
                int magnitude = Math.min(255, (int) Math.sqrt(gx * gx + gy * gy));
                edges[y * width + x] = magnitude > EDGE_THRESHOLD;
            }
        }
        return edges;
    }
}
