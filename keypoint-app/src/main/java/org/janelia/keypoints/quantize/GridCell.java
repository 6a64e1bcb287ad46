package org.janelia.keypoints.quantize;

/**
 * Representative location of a quantization cell, used as a hash key.
 */
public class GridCell {

    private final double x;
    private final double y;

    public GridCell(final double x,
                    final double y) {
        // adding zero folds -0.0 into 0.0 so that equal cells hash equally
        this.x = x + 0.0;
        this.y = y + 0.0;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final GridCell that = (GridCell) o;
        return (Double.compare(x, that.x) == 0) && (Double.compare(y, that.y) == 0);
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
