/*
Copyright 2013 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.picross.core;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.math.IntMath;

import java.util.AbstractList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.RandomAccess;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A fixed-size rectangular grid of {@linkplain Cell cells}, stored in row-major
 * order.  Row and column accessors return live views, not copies: they are
 * cheap to obtain and reflect later changes to the board.
 *
 * <p>A new board is all empty.  It does not know anything about the puzzle
 * being played on it.
 */
@NotThreadSafe
public final class Board<V> {

  private final Object[] cells;
  private final int width;
  private final int height;

  private Board(int width, int height) {
    this.width = width;
    this.height = height;
    this.cells = new Object[width * height];
    Arrays.fill(cells, Cell.empty());
  }

  /** Creates an empty board with the given number of columns and rows. */
  public static <V> Board<V> ofSize(int width, int height) {
    checkArgument(width > 0 && height > 0, "Bad board size %sx%s", width, height);
    try {
      IntMath.checkedMultiply(width, height);
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException(
          String.format("Board size %dx%d is too large", width, height), e);
    }
    return new Board<V>(width, height);
  }

  /** The number of columns. */
  public int width() {
    return width;
  }

  /** The number of rows. */
  public int height() {
    return height;
  }

  /** Returns the cell at the given row and column. */
  public Cell<V> get(int row, int column) {
    return cellAt(index(row, column));
  }

  /** Replaces the cell at the given row and column, returns the previous one. */
  public Cell<V> set(int row, int column, Cell<V> cell) {
    int index = index(row, column);
    Cell<V> previous = cellAt(index);
    cells[index] = checkNotNull(cell);
    return previous;
  }

  /** Returns a view of the row with the given index, left to right. */
  public List<Cell<V>> row(int row) {
    checkElementIndex(row, height, "row");
    return new Line(row * width, 1, width);
  }

  /** Returns a view of the column with the given index, top to bottom. */
  public List<Cell<V>> column(int column) {
    checkElementIndex(column, width, "column");
    return new Line(column, width, height);
  }

  /** Returns views of all the rows, top to bottom. */
  public Iterable<List<Cell<V>>> rows() {
    return new Iterable<List<Cell<V>>>() {
      @Override public Iterator<List<Cell<V>>> iterator() {
        return new LineIter(height, true);
      }
    };
  }

  /** Returns views of all the columns, left to right. */
  public Iterable<List<Cell<V>>> columns() {
    return new Iterable<List<Cell<V>>>() {
      @Override public Iterator<List<Cell<V>>> iterator() {
        return new LineIter(width, false);
      }
    };
  }

  /** Returns every cell along with its coordinates, in row-major order. */
  public Iterable<Entry<V>> cells() {
    return new Iterable<Entry<V>>() {
      @Override public Iterator<Entry<V>> iterator() {
        return new EntryIter();
      }
    };
  }

  /** One row of dots, slashes and values per board row. */
  @Override public String toString() {
    StringBuilder sb = new StringBuilder();
    for (List<Cell<V>> row : rows()) {
      for (Cell<V> cell : row)
        sb.append(cell);
      sb.append('\n');
    }
    return sb.toString();
  }

  private int index(int row, int column) {
    checkElementIndex(row, height, "row");
    checkElementIndex(column, width, "column");
    return row * width + column;
  }

  @SuppressWarnings("unchecked")  // Only Cell<V>s are ever stored.
  private Cell<V> cellAt(int index) {
    return (Cell<V>) cells[index];
  }

  /**
   * A cell on a board together with its position, as returned by
   * {@link Board#cells}.  A snapshot: it doesn't change if the board does.
   */
  @Immutable
  public static final class Entry<V> {
    public final int row;
    public final int column;
    public final Cell<V> cell;

    private Entry(int row, int column, Cell<V> cell) {
      this.row = row;
      this.column = column;
      this.cell = cell;
    }

    @Override public String toString() {
      return String.format("(%d, %d)=%s", row, column, cell);
    }
  }

  /** A strided view of the cells array. */
  private class Line extends AbstractList<Cell<V>> implements RandomAccess {
    private final int start;
    private final int stride;
    private final int size;

    private Line(int start, int stride, int size) {
      this.start = start;
      this.stride = stride;
      this.size = size;
    }

    @Override public Cell<V> get(int index) {
      checkElementIndex(index, size);
      return cellAt(start + index * stride);
    }

    @Override public int size() {
      return size;
    }
  }

  private class LineIter implements Iterator<List<Cell<V>>> {
    private final int count;
    private final boolean rows;
    private int next;

    private LineIter(int count, boolean rows) {
      this.count = count;
      this.rows = rows;
    }

    @Override public boolean hasNext() {
      return next < count;
    }

    @Override public List<Cell<V>> next() {
      if (next >= count)
        throw new NoSuchElementException();
      int index = next++;
      return rows ? row(index) : column(index);
    }

    @Override public void remove() {
      throw new UnsupportedOperationException();
    }
  }

  private class EntryIter implements Iterator<Entry<V>> {
    private int nextIndex;

    @Override public boolean hasNext() {
      return nextIndex < cells.length;
    }

    @Override public Entry<V> next() {
      if (nextIndex >= cells.length)
        throw new NoSuchElementException();
      int index = nextIndex++;
      return new Entry<V>(index / width, index % width, cellAt(index));
    }

    @Override public void remove() {
      throw new UnsupportedOperationException();
    }
  }
}
