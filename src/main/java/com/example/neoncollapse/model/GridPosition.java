package com.example.neoncollapse.model;

import java.util.Objects;

/**
 * Immutable tile coordinate on the combat grid.
 */
public final class GridPosition {

    private final int x;
    private final int y;

    public GridPosition(int x, int y) {
        this.x = x;
        this.y = y;
    }

    public int getX() { return x; }

    public int getY() { return y; }

    public GridPosition offset(int dx, int dy) {
        return new GridPosition(x + dx, y + dy);
    }

    /**
     * Manhattan distance, the single metric used for range, movement and AI target selection.
     */
    public int distanceTo(GridPosition other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GridPosition)) return false;
        GridPosition that = (GridPosition) o;
        return x == that.x && y == that.y;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
