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

import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A reusable barrier for a fixed number of parties. The last party to arrive
 * runs the completion action while holding the barrier lock, and only then
 * are the other parties released. Waiting parties are released when the
 * generation they entered with has advanced, so spurious wakeups are
 * harmless.
 *
 * @author Nuno Fachada
 */
public class GenerationBarrier implements ISyncPoint {

	private static final Logger log = LogManager.getLogger(GenerationBarrier.class);

	/* Barrier lock and the condition parties wait on. */
	private final ReentrantLock lock;
	private final Condition trip;

	/* Number of parties. */
	private final int parties;

	/* Completion action, may be null. */
	private final IBarrierAction action;

	/* The fields below are guarded by lock. */

	/* Parties which arrived in the current cycle. */
	private int arrived;

	/* Parties currently blocked in syncNotify(). */
	private int waiting;

	/* Completed cycles. */
	private long generation;

	/* Thread running the completion action, if any. */
	private Thread actionThread;

	/* Set by stopNow() or by a failed completion action. */
	private boolean broken;

	/* Set once destroy() is called. */
	private boolean destroyed;

	/**
	 * Create a new barrier.
	 *
	 * @param parties Number of parties, must be positive.
	 * @param action Completion action, or null for none.
	 * @throws BarrierInitException If the number of parties is not positive.
	 */
	public GenerationBarrier(int parties, IBarrierAction action) throws BarrierInitException {

		if (parties <= 0) {
			throw new BarrierInitException(
					"Barrier requires a positive number of parties, got " + parties + ".");
		}

		this.parties = parties;
		this.action = action;
		this.lock = new ReentrantLock();
		this.trip = this.lock.newCondition();
		this.arrived = 0;
		this.waiting = 0;
		this.generation = 0;
		this.broken = false;
		this.destroyed = false;
	}

	/**
	 * @see ISyncPoint#syncNotify()
	 */
	@Override
	public long syncNotify() throws InterruptedWorkException {

		this.lock.lock();
		try {

			if (this.destroyed) {
				throw new IllegalStateException("Barrier has been destroyed.");
			}
			if (this.actionThread == Thread.currentThread()) {
				throw new IllegalStateException("Barrier action must not wait on its own barrier.");
			}
			if (this.broken) {
				throw new InterruptedWorkException("Barrier is broken.");
			}

			/* Generation this party belongs to. */
			long gen = this.generation;

			this.arrived++;

			if (this.arrived == this.parties) {

				/* Last arriver: reset the count, open the next generation and
				 * run the action before anybody leaves. */
				this.arrived = 0;
				this.generation++;
				this.runAction(gen);
				this.trip.signalAll();
				return gen;

			}

			this.waiting++;
			try {
				while (this.generation == gen && !this.broken) {
					try {
						this.trip.await();
					} catch (InterruptedException e) {
						if (this.generation == gen && !this.broken) {
							this.breakBarrier();
							throw new InterruptedWorkException("Interrupted while waiting at barrier.", e);
						}
						/* Cycle already completed, keep the interrupt for
						 * whoever checks next. */
						Thread.currentThread().interrupt();
					}
				}
			} finally {
				this.waiting--;
			}

			if (this.broken) {
				throw new InterruptedWorkException("Barrier was broken while waiting.");
			}
			return gen;

		} finally {
			this.lock.unlock();
		}
	}

	/**
	 * @see ISyncPoint#stopNow()
	 */
	@Override
	public void stopNow() {

		this.lock.lock();
		try {
			this.breakBarrier();
		} finally {
			this.lock.unlock();
		}
	}

	/**
	 * @see ISyncPoint#destroy()
	 */
	@Override
	public void destroy() {

		this.lock.lock();
		try {
			if (this.destroyed) {
				throw new IllegalStateException("Barrier has already been destroyed.");
			}
			if (this.waiting > 0) {
				throw new IllegalStateException(
						"Cannot destroy barrier while " + this.waiting + " parties are waiting.");
			}
			this.destroyed = true;
		} finally {
			this.lock.unlock();
		}

		log.debug("Barrier destroyed after {} cycles", this.generation);
	}

	/**
	 * @see ISyncPoint#getGeneration()
	 */
	@Override
	public long getGeneration() {

		this.lock.lock();
		try {
			return this.generation;
		} finally {
			this.lock.unlock();
		}
	}

	/**
	 * @see ISyncPoint#getParties()
	 */
	@Override
	public int getParties() {
		return this.parties;
	}

	/**
	 * Is this barrier broken?
	 *
	 * @return True if broken, false otherwise.
	 */
	public boolean isBroken() {

		this.lock.lock();
		try {
			return this.broken;
		} finally {
			this.lock.unlock();
		}
	}

	/* Run the completion action, breaking the barrier if it fails. Must be
	 * called with the lock held. */
	private void runAction(long gen) {

		if (this.action == null) {
			return;
		}

		boolean ranAction = false;
		this.actionThread = Thread.currentThread();
		try {
			this.action.onTrip(gen);
			ranAction = true;
		} finally {
			this.actionThread = null;
			if (!ranAction) {
				log.error("Barrier action failed in generation {}", gen);
				this.breakBarrier();
			}
		}
	}

	/* Mark the barrier as broken and wake everybody. Must be called with
	 * the lock held. */
	private void breakBarrier() {
		this.broken = true;
		this.trip.signalAll();
	}

}
