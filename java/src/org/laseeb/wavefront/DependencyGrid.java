/*
 * Copyright (c) 2015, Nuno Fachada
 * All rights reserved.
 * 
 * Redistribution and use in source and binary forms, with or without
 * modification, are permitted provided that the following conditions are met:
 *   * Redistributions of source code must retain the above copyright
 *     notice, this list of conditions and the following disclaimer.
 *   * Redistributions in binary form must reproduce the above copyright
 *     notice, this list of conditions and the following disclaimer in the
 *     documentation and/or other materials provided with the distribution.
 *   * Neither the name of the Instituto Superior Técnico nor the
 *     names of its contributors may be used to endorse or promote products
 *     derived from this software without specific prior written permission.
 *     
 * THIS SOFTWARE IS PROVIDED BY THE COPYRIGHT HOLDERS AND CONTRIBUTORS "AS IS" AND
 * ANY EXPRESS OR IMPLIED WARRANTIES, INCLUDING, BUT NOT LIMITED TO, THE IMPLIED
 * WARRANTIES OF MERCHANTABILITY AND FITNESS FOR A PARTICULAR PURPOSE ARE
 * DISCLAIMED. IN NO EVENT SHALL <COPYRIGHT HOLDER> BE LIABLE FOR ANY
 * DIRECT, INDIRECT, INCIDENTAL, SPECIAL, EXEMPLARY, OR CONSEQUENTIAL DAMAGES
 * (INCLUDING, BUT NOT LIMITED TO, PROCUREMENT OF SUBSTITUTE GOODS OR SERVICES;
 * LOSS OF USE, DATA, OR PROFITS; OR BUSINESS INTERRUPTION) HOWEVER CAUSED AND
 * ON ANY THEORY OF LIABILITY, WHETHER IN CONTRACT, STRICT LIABILITY, OR TORT
 * (INCLUDING NEGLIGENCE OR OTHERWISE) ARISING IN ANY WAY OUT OF THE USE OF THIS
 * SOFTWARE, EVEN IF ADVISED OF THE POSSIBILITY OF SUCH DAMAGE.
 */

package org.laseeb.wavefront;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Concrete dependency grid, one {@link Cell} per element.
 *
 * @author Nuno Fachada
 */
public class DependencyGrid implements IDependencyGrid {

	private static final Logger log = LogManager.getLogger(DependencyGrid.class);

	/* Grid cells, in row-major order. Null once destroyed. */
	private volatile ICell[] cells;

	/* Grid dimensions. */
	private final int rows;
	private final int cols;
	private final int size;

	/**
	 * Allocate a new grid with all cells unpublished and set to 0.
	 *
	 * @param rows Number of rows.
	 * @param cols Number of columns.
	 * @throws GridAllocationException If the dimensions are invalid or the
	 * storage cannot be obtained.
	 */
	public DependencyGrid(int rows, int cols) throws GridAllocationException {

		if (rows <= 0 || cols <= 0) {
			throw new GridAllocationException(
					"Invalid grid dimensions " + rows + " x " + cols + ".");
		}

		long len = (long) rows * cols;
		if (len > Integer.MAX_VALUE) {
			throw new GridAllocationException(
					"Grid of " + rows + " x " + cols + " cells is too large.");
		}

		this.rows = rows;
		this.cols = cols;
		this.size = (int) len;

		log.debug("Initializing grid. Size is {}", this.size);

		try {
			ICell[] storage = new ICell[this.size];
			for (int i = 0; i < this.size; i++) {
				storage[i] = new Cell();
			}
			this.cells = storage;
		} catch (OutOfMemoryError oome) {
			throw new GridAllocationException(
					"Unable to allocate grid of " + this.size + " cells.", oome);
		}
	}

	@Override
	public int index(int r, int c) {
		return r * this.cols + c;
	}

	@Override
	public int north(int idx) {
		return idx - this.cols;
	}

	@Override
	public int south(int idx) {
		return idx + this.cols;
	}

	@Override
	public int east(int idx) {
		return idx + 1;
	}

	@Override
	public int west(int idx) {
		return idx - 1;
	}

	@Override
	public int southEast(int idx) {
		return this.south(idx) + 1;
	}

	@Override
	public int rowOf(int idx) {
		return idx / this.cols;
	}

	@Override
	public int colOf(int idx) {
		return idx % this.cols;
	}

	@Override
	public boolean isBorder(int idx) {
		return this.rowOf(idx) == this.rows - 1 || this.colOf(idx) == this.cols - 1;
	}

	/**
	 * @see IDependencyGrid#waitForReady(int)
	 */
	@Override
	public long waitForReady(int idx) throws InterruptedWorkException {
		return this.cell(idx).waitForReady();
	}

	/**
	 * @see IDependencyGrid#publish(int, long)
	 */
	@Override
	public void publish(int idx, long value) {
		this.cell(idx).publish(value);
	}

	/**
	 * @see IDependencyGrid#getValue(int)
	 */
	@Override
	public long getValue(int idx) {
		return this.cell(idx).getValue();
	}

	/**
	 * @see IDependencyGrid#isReady(int)
	 */
	@Override
	public boolean isReady(int idx) {
		return this.cell(idx).isReady();
	}

	/**
	 * @see IDependencyGrid#reset()
	 */
	@Override
	public void reset() {

		ICell[] cells = this.checkedCells();

		/* Each cell resets under its own lock. */
		for (int i = 0; i < this.size; i++) {
			cells[i].reset();
		}
	}

	/**
	 * @see IDependencyGrid#seedBorders()
	 */
	@Override
	public void seedBorders() {

		ICell[] cells = this.checkedCells();

		log.debug("Seeding borders");

		/* Last column. */
		for (int r = 0; r < this.rows; r++) {
			cells[this.index(r, this.cols - 1)].publish(1);
		}

		/* Last row, without the corner already seeded above. */
		for (int c = 0; c < this.cols - 1; c++) {
			cells[this.index(this.rows - 1, c)].publish(1);
		}
	}

	/**
	 * @see IDependencyGrid#destroy()
	 */
	@Override
	public synchronized void destroy() {

		ICell[] cells = this.checkedCells();
		this.cells = null;

		for (ICell cell : cells) {
			cell.release();
		}

		log.debug("Grid destroyed");
	}

	@Override
	public int getNumRows() {
		return this.rows;
	}

	@Override
	public int getNumCols() {
		return this.cols;
	}

	@Override
	public int getSize() {
		return this.size;
	}

	/* Cell at the given index, failing if the grid was destroyed. */
	private ICell cell(int idx) {
		return this.checkedCells()[idx];
	}

	/* Cell storage, failing if the grid was destroyed. */
	private ICell[] checkedCells() {
		ICell[] cells = this.cells;
		if (cells == null) {
			throw new IllegalStateException("Grid has been destroyed.");
		}
		return cells;
	}

}
