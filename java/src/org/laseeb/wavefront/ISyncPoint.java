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
 * Synchronization points are used to synchronize wavefront workers and the
 * orchestrator at round boundaries. A synchronization point holds every
 * party until all of them have arrived, then runs its completion action
 * (serially, in the last arriving thread) and releases them.
 *
 * @author Nuno Fachada
 */
public interface ISyncPoint {

	/**
	 * Notify the synchronization point that a party has reached it, and
	 * block until all parties have.
	 *
	 * @return The generation completed by this call.
	 * @throws InterruptedWorkException If synchronization was interrupted or
	 * the synchronization point is broken.
	 */
	public long syncNotify() throws InterruptedWorkException;

	/**
	 * Break the synchronization point, releasing blocked parties with an
	 * {@link InterruptedWorkException}.
	 */
	public void stopNow();

	/**
	 * Release the resources of this synchronization point. No party may be
	 * blocked in {@link #syncNotify()}.
	 */
	public void destroy();

	/**
	 * @return Number of completed cycles.
	 */
	public long getGeneration();

	/**
	 * @return Number of parties.
	 */
	public int getParties();

}
