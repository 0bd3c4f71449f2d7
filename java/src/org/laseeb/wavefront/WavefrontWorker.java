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
 *  A wavefront worker, bound to one interior cell of the grid. Each round
 *  the worker waits for its east, south and south-east neighbors, publishes
 *  their sum in its own cell and then waits at the round barrier. Because
 *  the barrier resets and reseeds the grid before releasing anybody, a
 *  worker can never see a value from a previous round.
 *
 *  @author Nuno Fachada
 *  @see java.lang.Runnable
 * */
public class WavefrontWorker implements Runnable {

	private static final Logger log = LogManager.getLogger(WavefrontWorker.class);

	/* This worker's cell in the grid. */
	private final int cellIdx;

	/* Number of rounds to perform. */
	private final int rounds;

	/* Shared grid. */
	private final IDependencyGrid grid;

	/* Round barrier. */
	private final ISyncPoint barrier;

	/* Controller, notified of unexpected failures. */
	private final IController controller;

	/* Current phase. */
	private volatile WorkerPhase phase;

	/* Rounds completed so far. */
	private volatile int completedRounds;

	/**
	 * Create a new wavefront worker.
	 *
	 * @param cellIdx Index of the interior cell computed by this worker.
	 * @param rounds Number of rounds.
	 * @param grid The dependency grid.
	 * @param barrier The round barrier.
	 * @param controller The controller.
	 */
	public WavefrontWorker(int cellIdx, int rounds, IDependencyGrid grid,
			ISyncPoint barrier, IController controller) {
		this.cellIdx = cellIdx;
		this.rounds = rounds;
		this.grid = grid;
		this.barrier = barrier;
		this.controller = controller;
		this.phase = WorkerPhase.CREATED;
		this.completedRounds = 0;
	}

	/**
	 *  Perform the rounds.
	 *
	 *  @see java.lang.Runnable#run()
	 * */
	@Override
	public void run() {

		int eIdx = this.grid.east(this.cellIdx);
		int sIdx = this.grid.south(this.cellIdx);
		int seIdx = this.grid.southEast(this.cellIdx);

		try {

			for (int round = 0; round < this.rounds; round++) {

				/* The three reads are independent, any order will do. */
				this.phase = WorkerPhase.AWAITING_INPUTS;
				long east = this.grid.waitForReady(eIdx);
				long south = this.grid.waitForReady(sIdx);
				long southEast = this.grid.waitForReady(seIdx);

				this.phase = WorkerPhase.COMPUTING;
				long sum = east + south + southEast;

				this.phase = WorkerPhase.PUBLISHING;
				this.grid.publish(this.cellIdx, sum);

				/* Wait for everybody else, the grid is reset meanwhile. */
				this.phase = WorkerPhase.SYNCED;
				this.barrier.syncNotify();

				this.completedRounds++;
			}

			this.phase = WorkerPhase.FINISHED;

		} catch (InterruptedWorkException iwe) {

			/* Stopped by request of another thread, just let the thread
			 * finish. */
			this.phase = WorkerPhase.STOPPED;
			log.debug("Worker for cell {} stopped: {}", this.cellIdx, iwe.getMessage());

		} catch (Exception e) {

			this.phase = WorkerPhase.STOPPED;
			log.error("Worker for cell " + this.cellIdx + " failed", e);

			/* Notify controller, which stops all other workers. */
			this.controller.registerException(e);
			this.controller.stopNow();

		}
	}

	/**
	 * @return Index of the cell computed by this worker.
	 */
	public int getCellIndex() {
		return this.cellIdx;
	}

	/**
	 * @return Current phase of this worker.
	 */
	public WorkerPhase getPhase() {
		return this.phase;
	}

	/**
	 * @return Number of rounds completed.
	 */
	public int getCompletedRounds() {
		return this.completedRounds;
	}

}
