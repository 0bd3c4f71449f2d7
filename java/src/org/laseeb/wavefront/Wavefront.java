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

/**
 * The wavefront package.
 */
package org.laseeb.wavefront;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;

/**
 * This class contains the main method for running a wavefront computation.
 * The main method creates a new instance of this class and calls the
 * {@link #doMain(String[], PrintStream, PrintStream)} method, which performs
 * the following steps:
 *
 * 1. Parses command-line options, keeping them in the created instance of
 * this class.
 * 2. Obtains the run parameters, either from the command-line or from a
 * parameters file.
 * 3. Creates a controller and registers a view which prints the result of
 * each round.
 * 4. Runs all rounds and returns the program exit code.
 *
 * Usage: nrows ncols reps, where nrows and ncols are the dimensions of the
 * grid and reps is the number of rounds. Each round is independent (and a
 * duplicate) of the other rounds.
 *
 * @author Nuno Fachada
 */
public class Wavefront {

	/**
	 *  Enumeration containing program errors.
	 * */
	public enum Errors {

		/** No error, successful program termination. */
		NONE(0),
		/** Error related with the specified command-line arguments. */
		ARGS(1),
		/** Unknown or invalid parameters file. */
		PARAMS(1),
		/** Grid storage could not be allocated. */
		ALLOC(1),
		/** Round barrier could not be initialized. */
		BARRIER(1),
		/** A worker thread could not be started. */
		THREAD(1),
		/** Worker threads could not be joined. */
		JOIN(1),
		/** Error during the run. */
		RUN(1);

		/* Error code. */
		private int value;

		/* Enumeration constructor. */
		private Errors(int value) { this.value = value; }

		/**
		 * Return code for specified error.
		 *
		 * @return Code for specified error.
		 */
		public int getValue() { return this.value; }
	}

	/* Grid dimensions and number of rounds. */
	@Parameter(description = "nrows ncols reps")
	private List<String> dims = new ArrayList<String>();

	/* File containing run parameters. */
	@Parameter(names = "-p", description = "File containing run parameters (ROWS, COLS, ROUNDS)")
	private String paramsFile = null;

	/* Show total run time. */
	@Parameter(names = "-t", description = "Show total run time")
	private boolean timing = false;

	/* Debug mode. */
	@Parameter(names = "-d", description = "Debug mode (show stack trace on error, debug logging)", hidden = true)
	private boolean debug = false;

	/* Help option. */
	@Parameter(names = {"--help", "-h", "-?"}, description = "Show options", help = true)
	private boolean help;

	/**
	 * Main method.
	 *
	 * @param args Command line arguments.
	 */
	public static void main(String[] args) {

		/* Create a new instance of this class and call the doMain method to
		 * perform the necessary steps to run the wavefront. */
		System.exit(new Wavefront().doMain(args, System.out, System.err));

	}

	/**
	 * Create a new main class object.
	 */
	public Wavefront() {}

	/**
	 * Perform the necessary steps to run the wavefront.
	 *
	 * @param args Command line arguments.
	 * @param out Where to print round results.
	 * @param err Where to print error messages.
	 * @return Program exit code.
	 */
	public int doMain(String[] args, PrintStream out, PrintStream err) {

		/* Setup command line options parser. */
		JCommander parser = new JCommander(this);
		parser.setProgramName("java " + Wavefront.class.getName());

		/* Parse command line options. */
		try {
			parser.parse(args);
		} catch (ParameterException pe) {
			/* On parsing error, show usage and return. */
			err.println(errMessage(pe));
			parser.usage();
			return Errors.ARGS.getValue();
		}

		/* If help option was passed, show help and quit. */
		if (this.help) {
			parser.usage();
			return Errors.NONE.getValue();
		}

		/* Debug logging only lasts while this run does. */
		String pkg = Wavefront.class.getPackage().getName();
		Level level = LogManager.getLogger(pkg).getLevel();
		if (this.debug) {
			Configurator.setLevel(pkg, Level.DEBUG);
		}
		try {
			return this.runWavefront(parser, out, err);
		} finally {
			if (this.debug) {
				Configurator.setLevel(pkg, level);
			}
		}
	}

	/**
	 * Create the controller which runs the wavefront.
	 *
	 * @param params Run parameters.
	 * @return A new controller.
	 */
	IController createController(WavefrontParams params) {
		return new Controller(params);
	}

	/* Get the run parameters and run all rounds. */
	private int runWavefront(JCommander parser, PrintStream out, PrintStream err) {

		/* Get run parameters. */
		WavefrontParams params;
		try {
			params = this.createParams();
		} catch (ParameterException pe) {
			err.println(errMessage(pe));
			parser.usage();
			return Errors.ARGS.getValue();
		} catch (IllegalArgumentException iae) {
			err.println(errMessage(iae));
			return Errors.ARGS.getValue();
		} catch (IOException ioe) {
			err.println(errMessage(ioe));
			return Errors.PARAMS.getValue();
		}

		/* Create the controller and the view. */
		IController controller = this.createController(params);
		controller.registerObserver(new RoundLineView(out));

		/* Run all rounds. */
		long start = System.currentTimeMillis();
		try {
			controller.run();
		} catch (GridAllocationException gae) {
			err.println(errMessage(gae));
			return Errors.ALLOC.getValue();
		} catch (BarrierInitException bie) {
			err.println(errMessage(bie));
			return Errors.BARRIER.getValue();
		} catch (WorkerStartException wse) {
			err.println(errMessage(wse));
			return Errors.THREAD.getValue();
		} catch (WorkerJoinException wje) {
			err.println(errMessage(wje));
			return Errors.JOIN.getValue();
		} catch (WavefrontException we) {
			err.println(errMessage(we));
			return Errors.RUN.getValue();
		}

		if (this.timing) {
			out.println("Total run time: " + ((System.currentTimeMillis() - start) / 1000.0f) + "s");
		}

		return Errors.NONE.getValue();
	}

	/**
	 * Show error message or stack trace, depending on debug parameter.
	 *
	 * @param t Exception which caused the error.
	 * @return The error message.
	 */
	public String errMessage(Throwable t) {

		String errMessage;

		if (this.debug) {
			StringWriter sw = new StringWriter();
			t.printStackTrace(new PrintWriter(sw));
			errMessage = sw.toString();
		} else {
			errMessage = t.getMessage();
		}

		return errMessage;
	}

	/**
	 * Create run parameters from the command-line values, or from a parameters
	 * file if one was given.
	 *
	 * @return The run parameters.
	 * @throws IOException If the parameters file cannot be read.
	 */
	private WavefrontParams createParams() throws IOException {

		if (this.paramsFile != null) {
			if (this.dims.size() > 0) {
				throw new ParameterException("Specify either a parameters file or nrows ncols reps, not both.");
			}
			return new WavefrontParams(this.paramsFile);
		}

		if (this.dims.size() != 3) {
			throw new ParameterException("Expected nrows ncols reps.");
		}

		return new WavefrontParams(
				parseInt(this.dims.get(0), "nrows"),
				parseInt(this.dims.get(1), "ncols"),
				parseInt(this.dims.get(2), "reps"));
	}

	/* Parse an integer main parameter. */
	private static int parseInt(String value, String name) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException nfe) {
			throw new ParameterException("\"" + name + "\": couldn't convert \"" + value + "\" to an integer");
		}
	}

}
