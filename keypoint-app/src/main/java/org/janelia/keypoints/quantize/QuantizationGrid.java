package org.janelia.keypoints.quantize;

/**
 * Square grid that snaps pixel coordinates to cell representatives.
 *
 * Pixel centers are assumed to sit at integer coordinates, so the grid is shifted by half a pixel:
 * a coordinate p maps to round(round((p + 0.5) / spacing) * spacing - 0.5, 2).
 * Rounding is half-to-even and the final value is rounded to two decimals so that
 * representatives computed from different observations compare equal.
 * A grid with spacing zero leaves coordinates unchanged.
 */
public class QuantizationGrid {

    public static final QuantizationGrid UNQUANTIZED = new QuantizationGrid(0.0);

    private final double spacing;

    /**
     * @throws IllegalArgumentException
     *   if the spacing is negative or not a number.
     */
    public QuantizationGrid(final double spacing)
            throws IllegalArgumentException {
        if (! (spacing >= 0.0)) {
            throw new IllegalArgumentException("grid spacing must be non-negative but was " + spacing);
        }
        this.spacing = spacing;
    }

    public double getSpacing() {
        return spacing;
    }

    public boolean isUnquantized() {
        return spacing == 0.0;
    }

    public GridCell snap(final double x,
                         final double y) {
        return new GridCell(snap(x), snap(y));
    }

    public double snap(final double p) {
        if (spacing == 0.0) {
            return p;
        }
        final double cellRepresentative = Math.rint((p + 0.5) / spacing) * spacing - 0.5;
        return Math.rint(cellRepresentative * 100.0) / 100.0;
    }

    @Override
    public String toString() {
        return "{\"spacing\": " + spacing + "}";
    }
}
