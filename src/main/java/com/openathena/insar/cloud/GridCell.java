// GridCell.java

package com.openathena.insar.cloud;

/** A (row, col) index into a raster grid. */
public final class GridCell
{
    private final int row, col;

    public GridCell(int row, int col)
    {
        this.row = row;
        this.col = col;
    }

    public int getRow() { return row; }
    public int getCol() { return col; }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) return true;
        if (!(o instanceof GridCell)) return false;
        GridCell c = (GridCell) o;
        return row == c.row && col == c.col;
    }

    @Override
    public int hashCode()
    {
        return 31 * row + col;
    }

    @Override
    public String toString()
    {
        return "(" + row + "," + col + ")";
    }
}
