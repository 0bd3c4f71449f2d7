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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Wavefront controller. Creates the grid and the round barrier, starts one
 * worker thread per interior cell and takes part in the barrier itself, which
 * lets it read each round's result after the wave has finished and before the
 * next reset overwrites it.
 *
 * @author Nuno Fachada
 */
public class Controller implements IController {

	private static final Logger log = LogManager.getLogger(Controller.class);

	/* Run parameters. */
	private WavefrontParams params;

	/* Creates the grid. */
	private IGridFactory gridFactory;

	/* Creates and starts worker threads. */
	private IWorkerFactory workerFactory;

	/* Creates the round barrier. */
	private IBarrierFactory barrierFactory;

	/* Round observers. */
	private List<IRoundObserver> observers;

	/* Grid and barrier of the current run. */
	private volatile IDependencyGrid grid;
	private volatile ISyncPoint barrier;

	/* Started worker threads. */
	private List<Thread> workers;

	/* Last exception reported by a worker. */
	private volatile Throwable lastThrowable;

	/**
	 * Create a new controller which starts one platform thread per worker.
	 *
	 * @param params Run parameters.
	 */
	public Controller(WavefrontParams params) {
		this(params, new DependencyGridFactory(), new ThreadWorkerFactory(), new GenerationBarrierFactory());
	}

	/**
	 * Create a new controller.
	 *
	 * @param params Run parameters.
	 * @param gridFactory Creates the grid.
	 * @param workerFactory Creates and starts worker threads.
	 * @param barrierFactory Creates the round barrier.
	 */
	public Controller(WavefrontParams params, IGridFactory gridFactory,
			IWorkerFactory workerFactory, IBarrierFactory barrierFactory) {
		this.params = params;
		this.gridFactory = gridFactory;
		this.workerFactory = workerFactory;
		this.barrierFactory = barrierFactory;
		this.observers = new ArrayList<IRoundObserver>();
		this.workers = new ArrayList<Thread>();
	}

	/**
	 * @see IController#registerObserver(IRoundObserver)
	 */
	@Override
	public void registerObserver(IRoundObserver observer) {
		this.observers.add(observer);
	}

	/**
	 * @see IController#run()
	 */
	@Override
	public long[] run() throws WavefrontException {

		int rows = this.params.getRows();
		int cols = this.params.getCols();
		int rounds = this.params.getRounds();

		synchronized (this) {
			this.workers = new ArrayList<Thread>();
			this.lastThrowable = null;
		}

		/* Allocation failures abort before any thread is started. */
		final IDependencyGrid grid = this.gridFactory.createGrid(rows, cols);
		this.grid = grid;

		/* Result slot, only written by the barrier action. */
		final RoundResult result = new RoundResult();

		/* One party per worker, plus this thread. */
		try {
			this.barrier = this.barrierFactory.createBarrier(this.getNumWorkers() + 1, new IBarrierAction() {
				@Override
				public void onTrip(long generation) {
					result.set(generation, grid.getValue(0));
					grid.reset();
					grid.seedBorders();
				}
			});
		} catch (BarrierInitException bie) {
			grid.destroy();
			this.grid = null;
			throw bie;
		}

		boolean completed = false;
		boolean aborted = false;
		try {

			this.startWorkers(rounds);

			log.debug("Started wavefront with {} workers", this.workers.size());

			/* Kick off the first wave. */
			grid.seedBorders();

			long[] results = new long[rounds];
			for (int round = 0; round < rounds; round++) {

				this.barrier.syncNotify();
				results[round] = result.getValue();

				log.debug("Round {} completed", result.getRound());

				for (IRoundObserver observer : this.observers) {
					observer.roundCompleted(round, results[round]);
				}
			}

			this.joinWorkers();
			completed = true;
			return results;

		} catch (InterruptedWorkException iwe) {

			/* A worker failed and broke the barrier. Workers are joined
			 * first, so the failing one has reported its exception. */
			aborted = true;
			this.abort();
			Throwable cause = this.lastThrowable != null ? this.lastThrowable : iwe;
			throw new WavefrontException("Wavefront run stopped: " + cause.getMessage(), cause);

		} catch (RuntimeException re) {

			/* Barrier action failed while this thread was the last to
			 * arrive. */
			aborted = true;
			this.abort();
			throw new WavefrontException("Wavefront run failed: " + re.getMessage(), re);

		} finally {

			if (completed) {
				this.release();
			} else if (!aborted) {
				this.abort();
			}

		}
	}

	/**
	 * @see IController#stopNow()
	 */
	@Override
	public synchronized void stopNow() {

		/* Release parties waiting at the barrier. */
		if (this.barrier != null) {
			this.barrier.stopNow();
		}

		/* Release workers waiting on cells. */
		for (Thread worker : this.workers) {
			worker.interrupt();
		}
	}

	/**
	 * @see IController#registerException(Throwable)
	 */
	@Override
	public void registerException(Throwable t) {
		this.lastThrowable = t;
	}

	/**
	 * @see IController#getLastThrowable()
	 */
	@Override
	public Throwable getLastThrowable() {
		return this.lastThrowable;
	}

	/**
	 * @see IController#getNumWorkers()
	 */
	@Override
	public int getNumWorkers() {
		return (this.params.getRows() - 1) * (this.params.getCols() - 1);
	}

	/* Start one worker per interior cell, i.e. every cell except those on
	 * the last row and on the last column. */
	private void startWorkers(int rounds) throws WorkerStartException {

		for (int r = 0; r < this.grid.getNumRows() - 1; r++) {
			for (int c = 0; c < this.grid.getNumCols() - 1; c++) {

				WavefrontWorker worker = new WavefrontWorker(
						this.grid.index(r, c), rounds, this.grid, this.barrier, this);
				Thread thread = this.workerFactory.startWorker(worker);

				synchronized (this) {
					this.workers.add(thread);
				}
			}
		}
	}

	/* Wait for all workers to finish. */
	private void joinWorkers() throws WorkerJoinException {

		for (Thread worker : this.workers) {
			try {
				worker.join();
			} catch (InterruptedException e) {
				throw new WorkerJoinException("Interrupted while joining worker " + worker.getName() + ".", e);
			}
		}
	}

	/* Best-effort cleanup of a failed run. */
	private void abort() {

		log.debug("Aborting wavefront run");

		this.stopNow();

		for (Thread worker : this.workers) {
			try {
				worker.join();
			} catch (InterruptedException e) {
				log.warn("Interrupted while joining workers, some may still be running");
				Thread.currentThread().interrupt();
				break;
			}
		}

		try {
			this.release();
		} catch (IllegalStateException ise) {
			log.warn("Unable to release run resources: {}", ise.getMessage());
		}
	}

	/* Destroy the barrier and the grid. */
	private void release() {

		ISyncPoint barrier = this.barrier;
		IDependencyGrid grid = this.grid;
		this.barrier = null;
		this.grid = null;

		try {
			if (barrier != null) {
				barrier.destroy();
			}
		} finally {
			if (grid != null) {
				grid.destroy();
			}
		}
	}

}
