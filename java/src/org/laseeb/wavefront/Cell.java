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

/**
 * Concrete dependency grid cell, guarded by its own lock and condition.
 *
 * @author Nuno Fachada
 */
public class Cell implements ICell {

	/* Cell lock. */
	private ReentrantLock lock;

	/* Signalled when the value is published. */
	private Condition published;

	/* Cell value, meaningful only while ready is set. */
	private long value;

	/* Was the value published in the current round? */
	private boolean ready;

	/**
	 * Create a new, unpublished cell with value 0.
	 */
	public Cell() {
		this.lock = new ReentrantLock();
		this.published = this.lock.newCondition();
		this.value = 0;
		this.ready = false;
	}

	/**
	 * @see ICell#waitForReady()
	 */
	@Override
	public long waitForReady() throws InterruptedWorkException {

		this.lock.lock();
		try {

			/* Loop on the predicate: a wakeup alone proves nothing. */
			while (!this.ready) {
				try {
					this.published.await();
				} catch (InterruptedException e) {
					throw new InterruptedWorkException("Interrupted while waiting for cell value.", e);
				}
			}
			return this.value;

		} finally {
			this.lock.unlock();
		}
	}

	/**
	 * @see ICell#publish(long)
	 */
	@Override
	public void publish(long value) {

		this.lock.lock();
		try {

			if (this.ready) {
				throw new IllegalStateException("Cell already published in this round.");
			}
			this.value = value;
			this.ready = true;

			/* More than one dependent may be blocked here. */
			this.published.signalAll();

		} finally {
			this.lock.unlock();
		}
	}

	/**
	 * @see ICell#reset()
	 */
	@Override
	public void reset() {

		this.lock.lock();
		try {
			this.value = 0;
			this.ready = false;
		} finally {
			this.lock.unlock();
		}
	}

	/**
	 * @see ICell#isReady()
	 */
	@Override
	public boolean isReady() {

		this.lock.lock();
		try {
			return this.ready;
		} finally {
			this.lock.unlock();
		}
	}

	/**
	 * @see ICell#getValue()
	 */
	@Override
	public long getValue() {

		this.lock.lock();
		try {
			return this.value;
		} finally {
			this.lock.unlock();
		}
	}

	/**
	 * @see ICell#release()
	 */
	@Override
	public void release() {
		this.published = null;
		this.lock = null;
	}

}
