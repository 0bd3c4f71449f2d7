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
 * Interface for a single cell of the dependency grid. A cell holds a value
 * together with a "ready" flag, and lets consumers block until the value
 * of the current round has been published.
 *
 * @author Nuno Fachada
 */
public interface ICell {

	/**
	 * Block until this cell's value is published for the current round and
	 * return it.
	 *
	 * @return The published value.
	 * @throws InterruptedWorkException If the waiting thread is interrupted.
	 */
	public long waitForReady() throws InterruptedWorkException;

	/**
	 * Publish a value and wake all threads waiting on this cell.
	 *
	 * @param value Value to publish.
	 * @throws IllegalStateException If the cell was already published in the
	 * current round.
	 */
	public void publish(long value);

	/**
	 * Clear the cell's value and ready flag.
	 */
	public void reset();

	/**
	 * Is the value published for the current round?
	 *
	 * @return True if the value is published, false otherwise.
	 */
	public boolean isReady();

	/**
	 * Return the current value, published or not.
	 *
	 * @return The current value.
	 */
	public long getValue();

	/**
	 * Release the synchronization resources held by this cell.
	 */
	public void release();

}
