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

import java.util.ArrayList;
import java.util.List;

import org.junit.Test;
import static org.junit.Assert.*;

public class WavefrontWorkerTest {

	/* Controller stand-in which only records what workers report. */
	private static class RecordingController implements IController {

		volatile Throwable registered;
		volatile int stopCalls;

		@Override
		public void registerObserver(IRoundObserver observer) {
			throw new UnsupportedOperationException();
		}

		@Override
		public long[] run() {
			throw new UnsupportedOperationException();
		}

		@Override
		public void stopNow() {
			this.stopCalls++;
		}

		@Override
		public void registerException(Throwable t) {
			this.registered = t;
		}

		@Override
		public Throwable getLastThrowable() {
			return this.registered;
		}

		@Override
		public int getNumWorkers() {
			return 0;
		}
	}

	/* Barrier action which records cell 0 and reseeds the grid. */
	private static class ResetAction implements IBarrierAction {

		final IDependencyGrid grid;
		final List<Long> results = new ArrayList<Long>();

		ResetAction(IDependencyGrid grid) {
			this.grid = grid;
		}

		@Override
		public void onTrip(long generation) {
			this.results.add(this.grid.getValue(0));
			this.grid.reset();
			this.grid.seedBorders();
		}
	}

	@Test(timeout = 10000)
	public void testSingleWorkerComputesEachRound() throws Exception {
		DependencyGrid grid = new DependencyGrid(2, 2);
		ResetAction action = new ResetAction(grid);
		GenerationBarrier barrier = new GenerationBarrier(2, action);
		RecordingController controller = new RecordingController();

		WavefrontWorker worker = new WavefrontWorker(0, 3, grid, barrier, controller);
		assertEquals(WorkerPhase.CREATED, worker.getPhase());
		assertEquals(0, worker.getCellIndex());

		Thread thread = new Thread(worker);
		thread.start();

		grid.seedBorders();
		for (int round = 0; round < 3; round++) {
			barrier.syncNotify();
		}
		thread.join();

		assertEquals(WorkerPhase.FINISHED, worker.getPhase());
		assertEquals(3, worker.getCompletedRounds());
		assertEquals(3, action.results.size());
		for (Long result : action.results) {
			assertEquals(3L, result.longValue());
		}
		assertNull(controller.registered);
	}

	@Test(timeout = 10000)
	public void testWorkerWaitsForAllThreeNeighbors() throws Exception {
		DependencyGrid grid = new DependencyGrid(2, 2);
		GenerationBarrier barrier = new GenerationBarrier(2, null);
		WavefrontWorker worker = new WavefrontWorker(0, 1, grid, barrier, new RecordingController());

		Thread thread = new Thread(worker);
		thread.start();

		/* East and south published, south-east still missing. */
		grid.publish(1, 4);
		grid.publish(2, 5);
		Thread.sleep(100);
		assertEquals(WorkerPhase.AWAITING_INPUTS, worker.getPhase());
		assertFalse(grid.isReady(0));

		grid.publish(3, 6);
		while (worker.getPhase() != WorkerPhase.SYNCED) {
			Thread.sleep(5);
		}
		assertEquals(15, grid.getValue(0));

		barrier.syncNotify();
		thread.join();
		assertEquals(WorkerPhase.FINISHED, worker.getPhase());
	}

	@Test(timeout = 10000)
	public void testZeroInputsDoNotHangDependents() throws Exception {
		DependencyGrid grid = new DependencyGrid(2, 2);
		GenerationBarrier barrier = new GenerationBarrier(1, null);
		WavefrontWorker worker = new WavefrontWorker(0, 1, grid, barrier, new RecordingController());

		grid.publish(1, 0);
		grid.publish(2, 0);
		grid.publish(3, 0);

		worker.run();

		assertEquals(WorkerPhase.FINISHED, worker.getPhase());
		assertTrue(grid.isReady(0));
		assertEquals(0, grid.waitForReady(0));
	}

	@Test(timeout = 10000)
	public void testInterruptedWorkerStopsQuietly() throws Exception {
		DependencyGrid grid = new DependencyGrid(2, 2);
		GenerationBarrier barrier = new GenerationBarrier(2, null);
		RecordingController controller = new RecordingController();
		WavefrontWorker worker = new WavefrontWorker(0, 5, grid, barrier, controller);

		Thread thread = new Thread(worker);
		thread.start();

		/* Borders never seeded, the worker blocks on its first input. */
		while (thread.getState() != Thread.State.WAITING) {
			Thread.sleep(5);
		}
		assertEquals(WorkerPhase.AWAITING_INPUTS, worker.getPhase());

		thread.interrupt();
		thread.join();

		assertEquals(WorkerPhase.STOPPED, worker.getPhase());
		assertEquals(0, worker.getCompletedRounds());
		assertNull(controller.registered);
		assertEquals(0, controller.stopCalls);
	}

	@Test(timeout = 10000)
	public void testFailingWorkerNotifiesController() throws Exception {
		DependencyGrid grid = new DependencyGrid(2, 2);
		GenerationBarrier barrier = new GenerationBarrier(2, null);
		RecordingController controller = new RecordingController();
		WavefrontWorker worker = new WavefrontWorker(0, 1, grid, barrier, controller);

		/* Own cell already published, so the worker's publish fails. */
		grid.seedBorders();
		grid.publish(0, 99);

		worker.run();

		assertEquals(WorkerPhase.STOPPED, worker.getPhase());
		assertTrue(controller.registered instanceof IllegalStateException);
		assertEquals(1, controller.stopCalls);
	}

	@Test(timeout = 30000)
	public void testPublishHappensBeforeEveryRead() throws Exception {
		final int rows = 5;
		final int cols = 6;
		final int rounds = 20;

		final RecordingGrid grid = new RecordingGrid(rows, cols);
		ResetAction action = new ResetAction(grid);
		GenerationBarrier barrier = new GenerationBarrier((rows - 1) * (cols - 1) + 1, action);
		grid.setBarrier(barrier);
		RecordingController controller = new RecordingController();

		List<Thread> threads = new ArrayList<Thread>();
		for (int r = 0; r < rows - 1; r++) {
			for (int c = 0; c < cols - 1; c++) {
				Thread t = new Thread(new WavefrontWorker(grid.index(r, c), rounds, grid, barrier, controller));
				threads.add(t);
				t.start();
			}
		}

		grid.seedBorders();
		for (int round = 0; round < rounds; round++) {
			barrier.syncNotify();
		}
		for (Thread t : threads) {
			t.join();
		}

		assertNull(controller.registered);
		assertEquals(0, grid.getOrderingViolations());
		assertEquals(3 * (rows - 1) * (cols - 1) * rounds, grid.getReads());

		/* Delannoy number D(4, 5). */
		for (Long result : action.results) {
			assertEquals(681L, result.longValue());
		}
		assertEquals(rounds, action.results.size());

		/* One publish per round, plus the reseed after the last one for
		 * border cells. */
		assertEquals(rounds, grid.getPublishes(0));
		assertEquals(rounds + 1, grid.getPublishes(grid.index(rows - 1, 0)));
	}

}
