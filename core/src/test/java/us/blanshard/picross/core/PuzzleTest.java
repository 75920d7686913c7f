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

import static org.junit.Assert.assertEquals;
import static us.blanshard.picross.core.TestHelper.FULL;
import static us.blanshard.picross.core.TestHelper.board;
import static us.blanshard.picross.core.TestHelper.group;
import static us.blanshard.picross.core.TestHelper.k;
import static us.blanshard.picross.core.TestHelper.smallPuzzle;

import us.blanshard.picross.core.TestHelper.Fill;

import org.junit.Test;

public class PuzzleTest {

  private final Puzzle<Fill> puzzle = smallPuzzle();

  @Test public void dimensions() {
    assertEquals(3, puzzle.height());
    assertEquals(5, puzzle.width());
    Board<Fill> board = puzzle.newBoard();
    assertEquals(5, board.width());
    assertEquals(3, board.height());
  }

  @Test public void solvedBy() {
    Board<Fill> board = board(
        ".##..",
        "#..#.",
        ".##..");
    assertEquals(true, puzzle.isSolvedBy(board));
  }

  @Test public void crossedOutCellsDoNotMatter() {
    Board<Fill> board = board(
        "/##//",
        "#//#/",
        "/##//");
    assertEquals(true, puzzle.isSolvedBy(board));
  }

  @Test public void notSolvedBy() {
    Board<Fill> board = board(
        ".##.#",
        "#..#.",
        ".##..");
    assertEquals(false, puzzle.isSolvedBy(board));
    assertEquals(false, puzzle.rowIsSolved(board, 0));
    assertEquals(true, puzzle.rowIsSolved(board, 1));
    assertEquals(false, puzzle.columnIsSolved(board, 4));
    assertEquals(true, puzzle.columnIsSolved(board, 0));
  }

  @Test public void solvedByIffEveryLineSolved() {
    Board<Fill> board = puzzle.newBoard();
    for (int i = 0; i < 15; ++i) {
      board.set(i / 5, i % 5, Cell.filled(FULL));
      boolean all = true;
      for (int r = 0; r < puzzle.height(); ++r)
        all &= puzzle.rowIsSolved(board, r);
      for (int c = 0; c < puzzle.width(); ++c)
        all &= puzzle.columnIsSolved(board, c);
      assertEquals(all, puzzle.isSolvedBy(board));
    }
  }

  @Test public void emptyLineSolvesEmptyConstraint() {
    assertEquals(true, puzzle.columnIsSolved(puzzle.newBoard(), 4));
  }

  @Test public void create() {
    Puzzle<Fill> p = Puzzle.create(3, 5, puzzle.getRowConstraints(), puzzle.getColumnConstraints());
    assertEquals(puzzle.getRowConstraints(), p.getRowConstraints());
    assertEquals(puzzle.getColumnConstraints(), p.getColumnConstraints());
  }

  @Test(expected = IllegalArgumentException.class)
  public void createWrongHeight() {
    Puzzle.create(4, 5, puzzle.getRowConstraints(), puzzle.getColumnConstraints());
  }

  @Test(expected = IllegalArgumentException.class)
  public void createWrongWidth() {
    Puzzle.create(3, 4, puzzle.getRowConstraints(), puzzle.getColumnConstraints());
  }

  @Test(expected = IllegalArgumentException.class)
  public void noRows() {
    Puzzle.of(group(), group(k(1)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void wrongBoardSize() {
    puzzle.isSolvedBy(Board.<Fill>ofSize(3, 5));
  }

  @Test(expected = IndexOutOfBoundsException.class)
  public void rowOutOfBounds() {
    puzzle.rowIsSolved(puzzle.newBoard(), 3);
  }
}
