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

import java.io.FileReader;
import java.io.IOException;
import java.util.Properties;

/**
 * Wavefront run parameters: grid dimensions and number of rounds.
 *
 * @author Nuno Fachada
 */
public class WavefrontParams {

	/* Parameter keys in a parameters file. */
	public static final String ROWS_KEY = "ROWS";
	public static final String COLS_KEY = "COLS";
	public static final String ROUNDS_KEY = "ROUNDS";

	/*
	 * Run parameters.
	 */
	private int rows;
	private int cols;
	private int rounds;

	/**
	 * Create a parameters object with the given values.
	 *
	 * @param rows Number of grid rows, at least 1.
	 * @param cols Number of grid columns, at least 1.
	 * @param rounds Number of rounds, at least 0.
	 * @throws IllegalArgumentException If any of the values is out of range.
	 */
	public WavefrontParams(int rows, int cols, int rounds) {
		this.rows = rows;
		this.cols = cols;
		this.rounds = rounds;
		this.validate();
	}

	/**
	 * Create a parameters object by loading parameters from a parameters file.
	 *
	 * @param paramsFile Parameters file.
	 * @throws IOException If it wasn't possible to open the given parameters
	 * file, or if a parameter is missing or is not an integer.
	 * @throws IllegalArgumentException If any of the values is out of range.
	 */
	public WavefrontParams(String paramsFile) throws IOException {

		Properties properties = new Properties();
		FileReader in = new FileReader(paramsFile);
		try {
			properties.load(in);
		} finally {
			in.close();
		}

		this.rows = intProperty(properties, ROWS_KEY);
		this.cols = intProperty(properties, COLS_KEY);
		this.rounds = intProperty(properties, ROUNDS_KEY);
		this.validate();
	}

	/**
	 * Get number of grid rows.
	 *
	 * @return Number of grid rows.
	 */
	public int getRows() {
		return this.rows;
	}

	/**
	 * Get number of grid columns.
	 *
	 * @return Number of grid columns.
	 */
	public int getCols() {
		return this.cols;
	}

	/**
	 * Get number of rounds.
	 *
	 * @return Number of rounds.
	 */
	public int getRounds() {
		return this.rounds;
	}

	/* Check ranges. */
	private void validate() {
		if (this.rows < 1) {
			throw new IllegalArgumentException("Number of rows must be at least 1, got " + this.rows + ".");
		}
		if (this.cols < 1) {
			throw new IllegalArgumentException("Number of columns must be at least 1, got " + this.cols + ".");
		}
		if (this.rounds < 0) {
			throw new IllegalArgumentException("Number of rounds must not be negative, got " + this.rounds + ".");
		}
	}

	/* Read a mandatory integer property. */
	private static int intProperty(Properties properties, String key) throws IOException {

		String value = properties.getProperty(key);
		if (value == null) {
			throw new IOException("Missing parameter " + key + ".");
		}

		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException nfe) {
			throw new IOException("Parameter " + key + " is not an integer: " + value, nfe);
		}
	}

}
