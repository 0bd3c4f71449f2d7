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

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileWriter;
import java.io.PrintStream;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

public class WavefrontTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private ByteArrayOutputStream out = new ByteArrayOutputStream();
	private ByteArrayOutputStream err = new ByteArrayOutputStream();

	private int run(String... args) throws Exception {
		return new Wavefront().doMain(args,
				new PrintStream(this.out, true, "UTF-8"),
				new PrintStream(this.err, true, "UTF-8"));
	}

	private String[] outLines() throws Exception {
		return this.out.toString("UTF-8").trim().split("\\r?\\n");
	}

	@Test(timeout = 20000)
	public void testPrintsOneLinePerRound() throws Exception {
		assertEquals(0, this.run("3", "3", "4"));

		String[] lines = this.outLines();
		assertEquals(4, lines.length);
		for (int i = 0; i < 4; i++) {
			assertEquals("Round " + i + ", result is 13", lines[i]);
		}
		assertEquals("", this.err.toString("UTF-8"));
	}

	@Test(timeout = 20000)
	public void testZeroRoundsPrintsNothing() throws Exception {
		assertEquals(0, this.run("4", "4", "0"));
		assertEquals("", this.out.toString("UTF-8"));
	}

	@Test(timeout = 20000)
	public void testParametersFromFile() throws Exception {
		File params = this.folder.newFile("wavefront.properties");
		FileWriter writer = new FileWriter(params);
		writer.write("# Wavefront parameters\nROWS=4\nCOLS=4\nROUNDS=2\n");
		writer.close();

		assertEquals(0, this.run("-p", params.getAbsolutePath()));

		String[] lines = this.outLines();
		assertArrayEquals(new String[] {
				"Round 0, result is 63",
				"Round 1, result is 63" }, lines);
	}

	@Test(timeout = 20000)
	public void testTimingLine() throws Exception {
		assertEquals(0, this.run("-t", "2", "2", "1"));

		String[] lines = this.outLines();
		assertEquals(2, lines.length);
		assertEquals("Round 0, result is 3", lines[0]);
		assertTrue(lines[1].startsWith("Total run time: "));
		assertTrue(lines[1].endsWith("s"));
	}

	@Test
	public void testHelpReturnsSuccess() throws Exception {
		assertEquals(0, this.run("-h"));
		assertEquals("", this.out.toString("UTF-8"));
	}

	@Test
	public void testWrongNumberOfArgumentsFails() throws Exception {
		assertEquals(1, this.run("3", "3"));
		assertTrue(this.err.toString("UTF-8").contains("nrows ncols reps"));
		assertEquals("", this.out.toString("UTF-8"));
	}

	@Test
	public void testNonIntegerArgumentFails() throws Exception {
		assertEquals(1, this.run("3", "three", "1"));
		assertTrue(this.err.toString("UTF-8").contains("ncols"));
	}

	@Test
	public void testOutOfRangeArgumentFails() throws Exception {
		assertEquals(1, this.run("0", "3", "1"));
		assertTrue(this.err.toString("UTF-8").contains("rows"));
		assertEquals("", this.out.toString("UTF-8"));
	}

	@Test
	public void testUnknownOptionFails() throws Exception {
		assertEquals(1, this.run("-x", "3", "3", "1"));
	}

	@Test
	public void testFileAndDimensionsTogetherFail() throws Exception {
		File params = this.folder.newFile("both.properties");
		assertEquals(1, this.run("-p", params.getAbsolutePath(), "3", "3", "1"));
		assertTrue(this.err.toString("UTF-8").contains("not both"));
	}

	@Test
	public void testMissingParametersFileFails() throws Exception {
		File missing = new File(this.folder.getRoot(), "missing.properties");
		assertEquals(1, this.run("-p", missing.getAbsolutePath()));
		assertEquals("", this.out.toString("UTF-8"));
	}

	@Test
	public void testTooLargeGridFails() throws Exception {
		assertEquals(1, this.run("100000", "100000", "1"));
		assertTrue(this.err.toString("UTF-8").contains("too large"));
	}

	@Test
	public void testDebugModeShowsStackTrace() throws Exception {
		assertEquals(1, this.run("-d", "100000", "100000", "1"));
		assertTrue(this.err.toString("UTF-8").contains(GridAllocationException.class.getName()));
	}

	/* Main class whose controller fails to start its second worker. */
	private static class FailingThreadsWavefront extends Wavefront {
		@Override
		IController createController(WavefrontParams params) {
			return new Controller(params, new DependencyGridFactory(), new IWorkerFactory() {
				private final IWorkerFactory delegate = new ThreadWorkerFactory();
				private int started = 0;
				@Override
				public Thread startWorker(WavefrontWorker worker) throws WorkerStartException {
					if (this.started == 1) {
						throw new WorkerStartException("Unable to start worker for cell " + worker.getCellIndex() + ".");
					}
					this.started++;
					return this.delegate.startWorker(worker);
				}
			}, new GenerationBarrierFactory());
		}
	}

	/* Main class whose controller fails to create the round barrier. */
	private static class FailingBarrierWavefront extends Wavefront {
		@Override
		IController createController(WavefrontParams params) {
			return new Controller(params, new DependencyGridFactory(), new ThreadWorkerFactory(),
					new IBarrierFactory() {
						@Override
						public ISyncPoint createBarrier(int parties, IBarrierAction action) throws BarrierInitException {
							throw new BarrierInitException("Unable to allocate barrier.");
						}
					});
		}
	}

	@Test(timeout = 20000)
	public void testThreadCreationFailureExitsWithOne() throws Exception {
		int code = new FailingThreadsWavefront().doMain(new String[] {"3", "3", "2"},
				new PrintStream(this.out, true, "UTF-8"),
				new PrintStream(this.err, true, "UTF-8"));

		assertEquals(1, code);
		assertEquals(Wavefront.Errors.THREAD.getValue(), code);
		assertTrue(this.err.toString("UTF-8").contains("Unable to start worker"));
		assertEquals("", this.out.toString("UTF-8"));
	}

	@Test(timeout = 20000)
	public void testBarrierInitFailureExitsWithOne() throws Exception {
		int code = new FailingBarrierWavefront().doMain(new String[] {"3", "3", "2"},
				new PrintStream(this.out, true, "UTF-8"),
				new PrintStream(this.err, true, "UTF-8"));

		assertEquals(1, code);
		assertEquals(Wavefront.Errors.BARRIER.getValue(), code);
		assertTrue(this.err.toString("UTF-8").contains("Unable to allocate barrier"));
		assertEquals("", this.out.toString("UTF-8"));
	}

	@Test(timeout = 20000)
	public void testDebugLevelIsRestoredAfterRun() throws Exception {
		String pkg = Wavefront.class.getPackage().getName();
		Level before = LogManager.getLogger(pkg).getLevel();
		assertNotEquals(Level.DEBUG, before);

		assertEquals(0, this.run("-d", "2", "2", "1"));

		assertEquals(before, LogManager.getLogger(pkg).getLevel());
	}

}
