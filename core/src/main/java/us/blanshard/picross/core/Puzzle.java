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

import javax.annotation.concurrent.Immutable;

/**
 * A Picross puzzle: the run constraints for every row and every column.  The
 * number of row constraints is the height of the board, the number of column
 * constraints its width.
 *
 * <p>Puzzles are not checked for solvability.
 */
@Immutable
public final class Puzzle<V> {

  private final ConstraintGroup<V> rowConstraints;
  private final ConstraintGroup<V> columnConstraints;

  private Puzzle(ConstraintGroup<V> rowConstraints, ConstraintGroup<V> columnConstraints) {
    this.rowConstraints = checkNotNull(rowConstraints);
    this.columnConstraints = checkNotNull(columnConstraints);
    checkArgument(rowConstraints.size() > 0, "A puzzle needs at least one row");
    checkArgument(columnConstraints.size() > 0, "A puzzle needs at least one column");
  }

  /** Creates a puzzle whose dimensions are given by the groups' sizes. */
  public static <V> Puzzle<V> of(ConstraintGroup<V> rowConstraints,
      ConstraintGroup<V> columnConstraints) {
    return new Puzzle<V>(rowConstraints, columnConstraints);
  }

  /**
   * Creates a puzzle with declared dimensions, which the groups' sizes must
   * match.
   */
  public static <V> Puzzle<V> create(int height, int width, ConstraintGroup<V> rowConstraints,
      ConstraintGroup<V> columnConstraints) {
    checkArgument(rowConstraints.size() == height,
        "Expected %s row constraints, got %s", height, rowConstraints.size());
    checkArgument(columnConstraints.size() == width,
        "Expected %s column constraints, got %s", width, columnConstraints.size());
    return of(rowConstraints, columnConstraints);
  }

  public ConstraintGroup<V> getRowConstraints() {
    return rowConstraints;
  }

  public ConstraintGroup<V> getColumnConstraints() {
    return columnConstraints;
  }

  public int height() {
    return rowConstraints.size();
  }

  public int width() {
    return columnConstraints.size();
  }

  /** Makes a new, empty board of the right size for this puzzle. */
  public Board<V> newBoard() {
    return Board.ofSize(width(), height());
  }

  /** Tells whether the given row of the board satisfies its constraint. */
  public boolean rowIsSolved(Board<V> board, int row) {
    checkElementIndex(row, height(), "row");
    return Runs.satisfies(rowConstraints.get(row), board.row(row));
  }

  /** Tells whether the given column of the board satisfies its constraint. */
  public boolean columnIsSolved(Board<V> board, int column) {
    checkElementIndex(column, width(), "column");
    return Runs.satisfies(columnConstraints.get(column), board.column(column));
  }

  /** Tells whether every row and every column of the board is solved. */
  public boolean isSolvedBy(Board<V> board) {
    checkArgument(board.width() == width() && board.height() == height(),
        "Board is %sx%s, puzzle is %sx%s", board.width(), board.height(), width(), height());
    for (int r = 0; r < height(); ++r)
      if (!rowIsSolved(board, r)) return false;
    for (int c = 0; c < width(); ++c)
      if (!columnIsSolved(board, c)) return false;
    return true;
  }

  @Override public String toString() {
    return "rows " + rowConstraints + ", columns " + columnConstraints;
  }
}
