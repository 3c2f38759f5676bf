package polarmedian.filter.histogram;

import org.jetbrains.annotations.NotNull;
import polarmedian.filter.BoundaryPolicy;

/**
 * Histogram of a square window that walks along one image row from left to right.
 */
public class PixelWindow {
    private final Histogram histogram;

    private final int[] pixels;
    private final int radius;
    private final BoundaryPolicy boundary;

    final int width;
    final int height;
    final int y;

    private int x = 0;

    public int getNumPixels() {
        return histogram.getNumPixels();
    }

    public int median() {
        return histogram.median();
    }

    private PixelWindow(
            final Histogram histogram,
            final int[] pixels,
            final int width,
            final int height,
            final int radius,
            final BoundaryPolicy boundary,
            final int y) {

        this.histogram = histogram;
        this.pixels = pixels;
        this.width = width;
        this.height = height;
        this.radius = radius;
        this.boundary = boundary;
        this.y = y;
    }

    /** Moves the window one pixel to the right. */
    void moveWindow() {
        final int oldX = boundary.map(x - radius, width);
        final int newX = boundary.map(x + radius + 1, width);

        for (int row = y - radius; row <= y + radius; row++) {
            final int currentY = boundary.map(row, height);
            if (currentY < 0)
                continue;

            if (oldX >= 0)
                histogram.decrement(pixels[to1d(oldX, currentY, width)]);

            if (newX >= 0)
                histogram.increment(pixels[to1d(newX, currentY, width)]);
        }

        x++;
    }

    private static int to1d(int x, int y, int width) {
        return y * width + x;
    }

    /**
     * Get the histogram for the window centred on pixel x=0 in row y. The histogram is reset first and stays owned
     * by the caller.
     */
    @NotNull
    static PixelWindow get(int[] pixels, int width, int height, int radius, BoundaryPolicy boundary, int y, Histogram histogram) {
        histogram.reset();

        for (int row = y - radius; row <= y + radius; row++) {
            final int currentY = boundary.map(row, height);
            if (currentY < 0)
                continue;

            for (int column = -radius; column <= radius; column++) {
                final int currentX = boundary.map(column, width);
                if (currentX >= 0)
                    histogram.increment(pixels[to1d(currentX, currentY, width)]);
            }
        }

        return new PixelWindow(histogram, pixels, width, height, radius, boundary, y);
    }
}
