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
 * Interface for wavefront controllers, which own the grid, the round barrier
 * and the worker threads.
 *
 * @author Nuno Fachada
 */
public interface IController {

	/**
	 * Registers an observer of completed rounds.
	 *
	 * @param observer Observer to be registered.
	 */
	public void registerObserver(IRoundObserver observer);

	/**
	 * Run all rounds to completion: create the grid and the barrier, start one
	 * worker per interior cell, seed the borders, wait at the barrier once per
	 * round, join the workers and release all resources.
	 *
	 * @return The value of cell 0 at the end of each round.
	 * @throws GridAllocationException If the grid cannot be allocated.
	 * @throws BarrierInitException If the barrier cannot be created.
	 * @throws WorkerStartException If a worker thread cannot be started.
	 * @throws WorkerJoinException If joining the workers is interrupted.
	 * @throws WavefrontException If the run fails for another reason.
	 */
	public long[] run() throws WavefrontException;

	/**
	 * Stop the run as soon as possible: break the barrier and interrupt
	 * every worker.
	 */
	public void stopNow();

	/**
	 * Used by workers to report an unexpected exception.
	 *
	 * @param t The exception.
	 */
	public void registerException(Throwable t);

	/**
	 * @return The last exception reported by a worker, or null.
	 */
	public Throwable getLastThrowable();

	/**
	 * @return Number of worker threads, one per interior cell.
	 */
	public int getNumWorkers();

}
