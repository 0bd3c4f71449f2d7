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

/**
 * A rectangular grid of cells stored in row-major order, where each interior
 * cell depends on its east, south and south-east neighbors. Elements on the
 * last column and on the last row are border cells, seeded rather than
 * computed. For a 6 x 6 grid, with element 0 in the upper left:
 *
 * <pre>
 *          N
 *
 *      0 * * * * B
 *      * * * * * B
 *      * * * * * B
 * W    * * * * * B     E
 *      * * * * * B
 *      B B B B B B
 *
 *          S
 * </pre>
 *
 * Neighbor methods are pure index arithmetic and perform no bounds
 * checking.
 *
 * @author Nuno Fachada
 */
public interface IDependencyGrid {

	/**
	 * Map (row, column) coordinates to a cell index.
	 *
	 * @param r Row.
	 * @param c Column.
	 * @return Cell index.
	 */
	public int index(int r, int c);

	/**
	 * Index of the north neighbor.
	 *
	 * @param idx Cell index.
	 * @return Neighbor index.
	 */
	public int north(int idx);

	/**
	 * Index of the south neighbor.
	 *
	 * @param idx Cell index.
	 * @return Neighbor index.
	 */
	public int south(int idx);

	/**
	 * Index of the east neighbor.
	 *
	 * @param idx Cell index.
	 * @return Neighbor index.
	 */
	public int east(int idx);

	/**
	 * Index of the west neighbor.
	 *
	 * @param idx Cell index.
	 * @return Neighbor index.
	 */
	public int west(int idx);

	/**
	 * Index of the south-east neighbor.
	 *
	 * @param idx Cell index.
	 * @return Neighbor index.
	 */
	public int southEast(int idx);

	/**
	 * Row of the given cell index.
	 *
	 * @param idx Cell index.
	 * @return Row.
	 */
	public int rowOf(int idx);

	/**
	 * Column of the given cell index.
	 *
	 * @param idx Cell index.
	 * @return Column.
	 */
	public int colOf(int idx);

	/**
	 * Is the given cell on the last row or on the last column?
	 *
	 * @param idx Cell index.
	 * @return True if the cell is a border cell, false otherwise.
	 */
	public boolean isBorder(int idx);

	/**
	 * Block until the given cell is published for the current round.
	 *
	 * @param idx Cell index.
	 * @return The published value.
	 * @throws InterruptedWorkException If the waiting thread is interrupted.
	 */
	public long waitForReady(int idx) throws InterruptedWorkException;

	/**
	 * Publish the value of a cell and wake all of its dependents.
	 *
	 * @param idx Cell index.
	 * @param value Value to publish.
	 */
	public void publish(int idx, long value);

	/**
	 * Current value of a cell, published or not.
	 *
	 * @param idx Cell index.
	 * @return Cell value.
	 */
	public long getValue(int idx);

	/**
	 * Is the given cell published for the current round?
	 *
	 * @param idx Cell index.
	 * @return True if published, false otherwise.
	 */
	public boolean isReady(int idx);

	/**
	 * Clear every cell, border cells included. Only safe while no worker
	 * is reading or writing any cell.
	 */
	public void reset();

	/**
	 * Set every border cell to 1 and wake its waiters, which starts a new
	 * wave.
	 */
	public void seedBorders();

	/**
	 * Release the synchronization resources of every cell and the cell
	 * storage. May only be called once.
	 */
	public void destroy();

	/**
	 * @return Number of rows.
	 */
	public int getNumRows();

	/**
	 * @return Number of columns.
	 */
	public int getNumCols();

	/**
	 * @return Total number of cells.
	 */
	public int getSize();

}
