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

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Test;
import static org.junit.Assert.*;

public class DependencyGridTest {

	@Test
	public void testIndexArithmetic() throws Exception {
		DependencyGrid grid = new DependencyGrid(3, 4);

		int idx = grid.index(1, 2);
		assertEquals(6, idx);
		assertEquals(7, grid.east(idx));
		assertEquals(5, grid.west(idx));
		assertEquals(10, grid.south(idx));
		assertEquals(2, grid.north(idx));
		assertEquals(11, grid.southEast(idx));
		assertEquals(1, grid.rowOf(idx));
		assertEquals(2, grid.colOf(idx));
		assertEquals(12, grid.getSize());
		assertEquals(3, grid.getNumRows());
		assertEquals(4, grid.getNumCols());
	}

	@Test
	public void testBorderCellsAreLastRowAndLastColumn() throws Exception {
		DependencyGrid grid = new DependencyGrid(3, 3);

		boolean[] expected = {
				false, false, true,
				false, false, true,
				true, true, true };
		for (int i = 0; i < grid.getSize(); i++) {
			assertEquals("cell " + i, expected[i], grid.isBorder(i));
		}
	}

	@Test
	public void testNewGridIsUnpublished() throws Exception {
		DependencyGrid grid = new DependencyGrid(2, 5);
		for (int i = 0; i < grid.getSize(); i++) {
			assertFalse(grid.isReady(i));
			assertEquals(0, grid.getValue(i));
		}
	}

	@Test
	public void testSeedBordersPublishesOnlyBorderCells() throws Exception {
		DependencyGrid grid = new DependencyGrid(3, 4);
		grid.seedBorders();

		for (int i = 0; i < grid.getSize(); i++) {
			if (grid.isBorder(i)) {
				assertTrue("cell " + i, grid.isReady(i));
				assertEquals(1, grid.getValue(i));
			} else {
				assertFalse("cell " + i, grid.isReady(i));
				assertEquals(0, grid.getValue(i));
			}
		}
	}

	@Test
	public void testResetClearsEveryCell() throws Exception {
		DependencyGrid grid = new DependencyGrid(3, 3);
		grid.seedBorders();
		grid.publish(0, 13);

		grid.reset();

		for (int i = 0; i < grid.getSize(); i++) {
			assertFalse(grid.isReady(i));
			assertEquals(0, grid.getValue(i));
		}

		/* Cells can be published again after a reset. */
		grid.seedBorders();
		grid.publish(4, 3);
		assertEquals(3, grid.getValue(4));
	}

	@Test(timeout = 10000)
	public void testWaitForReadyBlocksUntilPublished() throws Exception {
		final DependencyGrid grid = new DependencyGrid(2, 2);
		final AtomicLong seen = new AtomicLong(-1);
		final CountDownLatch started = new CountDownLatch(1);

		Thread reader = new Thread(new Runnable() {
			@Override
			public void run() {
				started.countDown();
				try {
					seen.set(grid.waitForReady(0));
				} catch (InterruptedWorkException e) {
					seen.set(-2);
				}
			}
		});
		reader.start();
		started.await();

		/* Nothing published yet, reader must still be waiting. */
		Thread.sleep(100);
		assertTrue(reader.isAlive());
		assertEquals(-1, seen.get());

		grid.publish(0, 42);
		reader.join();
		assertEquals(42, seen.get());
	}

	@Test(timeout = 10000)
	public void testPublishWakesAllWaiters() throws Exception {
		final DependencyGrid grid = new DependencyGrid(3, 3);
		final long[] seen = new long[3];
		Thread[] readers = new Thread[3];

		for (int i = 0; i < readers.length; i++) {
			final int n = i;
			readers[i] = new Thread(new Runnable() {
				@Override
				public void run() {
					try {
						seen[n] = grid.waitForReady(4);
					} catch (InterruptedWorkException e) {
						seen[n] = -1;
					}
				}
			});
			readers[i].start();
		}

		/* Wait until every reader is blocked on the cell. */
		for (Thread reader : readers) {
			while (reader.getState() != Thread.State.WAITING) {
				Thread.sleep(5);
			}
		}

		grid.publish(4, 3);

		for (int i = 0; i < readers.length; i++) {
			readers[i].join();
			assertEquals(3, seen[i]);
		}
	}

	@Test(timeout = 10000)
	public void testPublishedZeroDoesNotBlockReaders() throws Exception {
		DependencyGrid grid = new DependencyGrid(2, 2);
		grid.publish(0, 0);
		assertTrue(grid.isReady(0));
		assertEquals(0, grid.waitForReady(0));
	}

	@Test(expected = IllegalStateException.class)
	public void testPublishTwiceInOneRoundFails() throws Exception {
		DependencyGrid grid = new DependencyGrid(2, 2);
		grid.publish(0, 3);
		grid.publish(0, 4);
	}

	@Test(timeout = 10000)
	public void testInterruptedWaitThrows() throws Exception {
		final DependencyGrid grid = new DependencyGrid(2, 2);
		final AtomicReference<Throwable> thrown = new AtomicReference<Throwable>();

		Thread reader = new Thread(new Runnable() {
			@Override
			public void run() {
				try {
					grid.waitForReady(0);
				} catch (InterruptedWorkException e) {
					thrown.set(e);
				}
			}
		});
		reader.start();
		while (reader.getState() != Thread.State.WAITING) {
			Thread.sleep(5);
		}

		reader.interrupt();
		reader.join();

		assertTrue(thrown.get() instanceof InterruptedWorkException);
		assertTrue(thrown.get().getCause() instanceof InterruptedException);
	}

	@Test
	public void testInvalidDimensionsFailAllocation() {
		int[][] dims = { {0, 3}, {3, 0}, {-1, 2}, {100000, 100000} };
		for (int[] d : dims) {
			try {
				new DependencyGrid(d[0], d[1]);
				fail("Should have failed for " + d[0] + " x " + d[1]);
			} catch (GridAllocationException e) {
				assertTrue(e.getMessage().contains(String.valueOf(d[0])));
			}
		}
	}

	@Test
	public void testSingleCellGridIsAllBorder() throws Exception {
		DependencyGrid grid = new DependencyGrid(1, 1);
		assertTrue(grid.isBorder(0));
		grid.seedBorders();
		assertEquals(1, grid.waitForReady(0));
	}

	@Test
	public void testDestroyReleasesOnlyOnce() throws Exception {
		DependencyGrid grid = new DependencyGrid(3, 3);
		grid.destroy();

		try {
			grid.destroy();
			fail("Second destroy should fail");
		} catch (IllegalStateException e) {
			assertTrue(e.getMessage().contains("destroyed"));
		}
	}

	@Test(expected = IllegalStateException.class)
	public void testUseAfterDestroyFails() throws Exception {
		DependencyGrid grid = new DependencyGrid(3, 3);
		grid.destroy();
		grid.seedBorders();
	}

}
