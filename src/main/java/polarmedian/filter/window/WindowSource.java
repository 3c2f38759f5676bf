package polarmedian.filter.window;

import polarmedian.filter.BoundaryPolicy;

import java.util.Arrays;

/**
 * Read-only view of the input pixels as seen by square windows of a given radius, with out-of-range coordinates
 * resolved by the boundary policy. Safe to share between traversals because nothing here is mutated.
 */
final class WindowSource {

    private static final int[] EMPTY = new int[0];

    final int[] pixels;
    final int width;
    final int height;
    final int radius;
    final BoundaryPolicy boundary;

    WindowSource(int[] pixels, int width, int height, int radius, BoundaryPolicy boundary) {
        this.pixels = pixels;
        this.width = width;
        this.height = height;
        this.radius = radius;
        this.boundary = boundary;
    }

    int diameter() {
        return 2 * radius + 1;
    }

    /** Values of window column {@code x} for the window centred on row {@code y}, top to bottom. */
    int[] columnSamples(int x, int y) {
        final int sourceX = boundary.map(x, width);
        if (sourceX < 0)
            return EMPTY;

        final int[] buffer = new int[diameter()];
        int n = 0;
        for (int row = y - radius; row <= y + radius; row++) {
            final int sourceY = boundary.map(row, height);
            if (sourceY >= 0)
                buffer[n++] = pixels[sourceY * width + sourceX];
        }

        return n == buffer.length ? buffer : Arrays.copyOf(buffer, n);
    }

    /** Values of image row {@code row} covered by the window centred on column {@code x}, left to right. */
    int[] rowSamples(int row, int x) {
        final int sourceY = boundary.map(row, height);
        if (sourceY < 0)
            return EMPTY;

        final int[] buffer = new int[diameter()];
        int n = 0;
        for (int column = x - radius; column <= x + radius; column++) {
            final int sourceX = boundary.map(column, width);
            if (sourceX >= 0)
                buffer[n++] = pixels[sourceY * width + sourceX];
        }

        return n == buffer.length ? buffer : Arrays.copyOf(buffer, n);
    }
}
