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
package us.blanshard.picross.game;

import static com.google.common.base.Preconditions.checkElementIndex;
import static com.google.common.base.Preconditions.checkNotNull;

import us.blanshard.picross.core.Board;
import us.blanshard.picross.core.Cell;
import us.blanshard.picross.core.ConstraintGroup;
import us.blanshard.picross.core.Puzzle;

import java.util.BitSet;
import java.util.LinkedList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * The state of a Picross game: a puzzle, the board the player is marking, and
 * which rows and columns currently satisfy their constraints.  Not thread safe.
 *
 * <p>Every edit re-checks just the affected row and column.  When the
 * {@linkplain Options#autoCrossCompleted auto-cross} option is on, a solved line
 * has its remaining empty cells crossed out, and an unsolved line has its
 * crossed-out cells cleared unless the crossing line is itself solved.
 */
@NotThreadSafe
public final class Picross<V> {

  private static final Logger logger = Logger.getLogger(Picross.class.getName());

  private final Puzzle<V> puzzle;
  private final Board<V> board;
  private final Options options;
  private final Registry registry;

  /** Bit i is set iff row i satisfies its constraint. */
  private final BitSet rowStatus;

  /** Bit i is set iff column i satisfies its constraint. */
  private final BitSet columnStatus;

  /** False until construction is done, so listeners hear nothing before gameCreated. */
  private boolean started;

  public Picross(Puzzle<V> puzzle) {
    this(puzzle, Options.DEFAULT);
  }

  public Picross(Puzzle<V> puzzle, Options options) {
    this(puzzle, options, nullRegistry());
  }

  public Picross(Puzzle<V> puzzle, Options options, Registry registry) {
    this.puzzle = checkNotNull(puzzle);
    this.options = checkNotNull(options);
    this.registry = checkNotNull(registry);
    this.board = puzzle.newBoard();
    this.rowStatus = new BitSet(height());
    this.columnStatus = new BitSet(width());

    for (int r = 0; r < height(); ++r)
      rowStatus.set(r, puzzle.rowIsSolved(board, r));
    for (int c = 0; c < width(); ++c)
      columnStatus.set(c, puzzle.columnIsSolved(board, c));
    if (options.autoCrossCompleted) {
      for (int r = 0; r < height(); ++r)
        annotateRow(r);
      for (int c = 0; c < width(); ++c)
        annotateColumn(c);
    }

    started = true;
    logger.fine(String.format("Created %dx%d game", width(), height()));
    registry.asListener().gameCreated(this);
  }

  public Puzzle<V> getPuzzle() {
    return puzzle;
  }

  public Options getOptions() {
    return options;
  }

  public Registry getListenerRegistry() {
    return registry;
  }

  /** Returns a listener registry that refuses to take listeners. */
  public static Registry nullRegistry() {
    return NULL_REGISTRY;
  }

  /** Creates a registry that does the normal thing. */
  public static Registry newRegistry() {
    return new NormalRegistry();
  }

  public int width() {
    return board.width();
  }

  public int height() {
    return board.height();
  }

  public ConstraintGroup<V> getRowConstraints() {
    return puzzle.getRowConstraints();
  }

  public ConstraintGroup<V> getColumnConstraints() {
    return puzzle.getColumnConstraints();
  }

  /** Returns the cell at the given position. */
  public Cell<V> get(int row, int column) {
    return board.get(row, column);
  }

  /** Returns every cell with its position, in row-major order. */
  public Iterable<Board.Entry<V>> cells() {
    return board.cells();
  }

  /** Places the given value at the given position; tells whether the puzzle is now solved. */
  public boolean place(V value, int row, int column) {
    return edit(row, column, Cell.filled(value));
  }

  /** Crosses out the given position; tells whether the puzzle is now solved. */
  public boolean crossOut(int row, int column) {
    return edit(row, column, Cell.<V>crossedOut());
  }

  /** Empties the given position; tells whether the puzzle is now solved. */
  public boolean clear(int row, int column) {
    return edit(row, column, Cell.<V>empty());
  }

  /**
   * Recomputes the solved status of the given row and column, then applies the
   * auto-cross policy to both.  Both statuses are brought up to date before
   * either line is annotated.  Calling this again with no edit in between
   * changes nothing.  Tells whether the puzzle is solved.
   */
  public boolean recheck(int row, int column) {
    checkElementIndex(row, height(), "row");
    checkElementIndex(column, width(), "column");
    updateStatus(rowStatus, row, puzzle.rowIsSolved(board, row), "Row");
    updateStatus(columnStatus, column, puzzle.columnIsSolved(board, column), "Column");
    if (options.autoCrossCompleted) {
      annotateRow(row);
      annotateColumn(column);
    }
    return isSolved();
  }

  public boolean isRowSolved(int row) {
    checkElementIndex(row, height(), "row");
    return rowStatus.get(row);
  }

  public boolean isColumnSolved(int column) {
    checkElementIndex(column, width(), "column");
    return columnStatus.get(column);
  }

  /** Returns a copy of the row statuses: bit i is set iff row i is solved. */
  public BitSet getRowStatus() {
    return (BitSet) rowStatus.clone();
  }

  /** Returns a copy of the column statuses: bit i is set iff column i is solved. */
  public BitSet getColumnStatus() {
    return (BitSet) columnStatus.clone();
  }

  /** Tells whether every row and every column satisfies its constraint. */
  public boolean isSolved() {
    return rowStatus.cardinality() == height() && columnStatus.cardinality() == width();
  }

  @Override public String toString() {
    return board.toString();
  }

  private boolean edit(int row, int column, Cell<V> cell) {
    boolean wasSolved = isSolved();
    write(row, column, cell);
    boolean solved = recheck(row, column);
    if (solved && !wasSolved) {
      logger.fine("Puzzle solved");
      registry.asListener().gameSolved(this);
    }
    return solved;
  }

  private void write(int row, int column, Cell<V> cell) {
    Cell<V> previous = board.set(row, column, cell);
    if (started && !previous.equals(cell))
      registry.asListener().cellChanged(this, row, column);
  }

  private void updateStatus(BitSet status, int index, boolean solved, String what) {
    if (status.get(index) != solved && logger.isLoggable(Level.FINER))
      logger.finer(String.format("%s %d %s", what, index, solved ? "solved" : "unsolved"));
    status.set(index, solved);
  }

  // Annotation only swaps empty for crossed-out cells, which runs ignore, so it
  // never invalidates any line's status.

  private void annotateRow(int row) {
    boolean solved = rowStatus.get(row);
    for (int c = 0; c < width(); ++c)
      annotate(row, c, solved, columnStatus.get(c));
  }

  private void annotateColumn(int column) {
    boolean solved = columnStatus.get(column);
    for (int r = 0; r < height(); ++r)
      annotate(r, column, solved, rowStatus.get(r));
  }

  private void annotate(int row, int column, boolean lineSolved, boolean crossingSolved) {
    Cell<V> cell = board.get(row, column);
    if (lineSolved && cell.isEmpty()) {
      logAnnotation("Crossing out", row, column);
      write(row, column, Cell.<V>crossedOut());
    } else if (!lineSolved && cell.isCrossedOut() && !crossingSolved) {
      logAnnotation("Reverting", row, column);
      write(row, column, Cell.<V>empty());
    }
  }

  private static void logAnnotation(String action, int row, int column) {
    if (logger.isLoggable(Level.FINEST))
      logger.finest(String.format("%s (%d, %d)", action, row, column));
  }

  /**
   * Game configuration.
   */
  @Immutable
  public static final class Options {
    /** Auto-cross on, the way people normally play. */
    public static final Options DEFAULT = new Options(true);

    private static final Options NO_AUTO_CROSS = new Options(false);

    /**
     * Whether solving a line crosses out its empty cells, and unsolving it
     * clears crossed-out cells that no solved crossing line vouches for.
     */
    public final boolean autoCrossCompleted;

    private Options(boolean autoCrossCompleted) {
      this.autoCrossCompleted = autoCrossCompleted;
    }

    public Options withAutoCrossCompleted(boolean autoCrossCompleted) {
      return autoCrossCompleted ? DEFAULT : NO_AUTO_CROSS;
    }

    @Override public String toString() {
      return "Options{autoCrossCompleted=" + autoCrossCompleted + "}";
    }
  }

  /**
   * A callback interface for interested parties to find out what's going on in
   * a Picross game.
   */
  public interface Listener {
    /** Called when a new Picross instance is created. */
    void gameCreated(Picross<?> game);

    /**
     * Called whenever a cell's contents change, whether by the player or by
     * auto-crossing.
     */
    void cellChanged(Picross<?> game, int row, int column);

    /** Called when an edit leaves a previously unsolved puzzle solved. */
    void gameSolved(Picross<?> game);
  }

  /**
   * An object that keeps track of the {@linkplain Listener listeners} on behalf
   * of one or more games.
   */
  public abstract static class Registry {

    /** Adds a listener to the registry. */
    public abstract void addListener(Listener listener);

    /** Removes a listener from the registry. */
    public abstract void removeListener(Listener listener);

    /**
     * Exposes the registry as a listener itself, so the game has a single
     * instance to address.
     */
    protected abstract Listener asListener();
  }

  private static final Registry NULL_REGISTRY = new NullRegistry();

  /** Takes no listeners, so every event goes nowhere. */
  private static class NullRegistry extends Registry implements Listener {
    @Override public void addListener(Listener listener) {
      throw new UnsupportedOperationException();
    }
    @Override public void removeListener(Listener listener) {
      throw new UnsupportedOperationException();
    }
    @Override protected Listener asListener() { return this; }

    @Override public void gameCreated(Picross<?> game) {}
    @Override public void cellChanged(Picross<?> game, int row, int column) {}
    @Override public void gameSolved(Picross<?> game) {}
  }

  private static class NormalRegistry extends Registry implements Listener {
    private final List<Listener> listeners = new LinkedList<Listener>();

    @Override public void addListener(Listener listener) {
      listeners.add(checkNotNull(listener));
    }

    @Override public void removeListener(Listener listener) {
      listeners.remove(listener);
    }

    @Override protected Listener asListener() {
      return this;
    }

    @Override public void gameCreated(Picross<?> game) {
      for (Listener listener : listeners)
        listener.gameCreated(game);
    }

    @Override public void cellChanged(Picross<?> game, int row, int column) {
      for (Listener listener : listeners)
        listener.cellChanged(game, row, column);
    }

    @Override public void gameSolved(Picross<?> game) {
      for (Listener listener : listeners)
        listener.gameSolved(game);
    }
  }
}
