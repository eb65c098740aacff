/**
The MIT License (MIT)
Copyright (c) 2018 AroDev, adaptation portions (c) 2018 ProgrammerDan (Daniel Boston)

www.arionum.com

Permission is hereby granted, free of charge, to any person obtaining a copy
of this software and associated documentation files (the "Software"), to deal
in the Software without restriction, including without limitation the rights
to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
copies of the Software, and to permit persons to whom the Software is
furnished to do so, subject to the following conditions:

The above copyright notice and this permission notice shall be included in all
copies or substantial portions of
the Software.

THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND,
EXPRESS OR IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF
MERCHANTABILITY, FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT.
IN NO EVENT SHALL THE AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM,
DAMAGES OR OTHER LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR
OTHERWISE, ARISING FROM, OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE
OR OTHER DEALINGS IN THE SOFTWARE.

 */
package com.programmerdan.scavenger.scavenger_miner;

import java.util.ArrayList;
import java.util.List;

/**
 * Start-up settings, positional, in the same order whether they come from the command line or
 * from the lines of a config file:
 *
 * <pre>
 * address csv-file [base-url] [#workers] [daemon-host] [daemon-port] [true|false submit] [true|false colors]
 * </pre>
 *
 * Blank optional values fall back to defaults. Read once, never re-read during a run.
 *
 * @author ProgrammerDan (Daniel Boston)
 */
public class MinerConfig {

	public static final String DEFAULT_BASE_URL = "https://scavenger.prod.gd.midnighttge.io";
	public static final String DEFAULT_DAEMON_HOST = "127.0.0.1";
	public static final int DEFAULT_DAEMON_PORT = 4002;
	public static final int DEFAULT_WORKERS = 8;

	private final String address;
	private final String csvFile;
	private final String baseUrl;
	private final int workers;
	private final String daemonHost;
	private final int daemonPort;
	private final boolean submit;
	private final boolean colors;

	public MinerConfig(String address, String csvFile, String baseUrl, int workers, String daemonHost, int daemonPort,
			boolean submit, boolean colors) {
		if (isBlank(address)) {
			throw new IllegalArgumentException("address is required");
		}
		if (isBlank(csvFile)) {
			throw new IllegalArgumentException("csv-file is required");
		}
		if (workers < 1) {
			throw new IllegalArgumentException("#workers must be at least 1, was " + workers);
		}
		if (daemonPort < 1 || daemonPort > 65535) {
			throw new IllegalArgumentException("daemon-port out of range: " + daemonPort);
		}
		this.address = address.trim();
		this.csvFile = csvFile.trim();
		this.baseUrl = isBlank(baseUrl) ? DEFAULT_BASE_URL : baseUrl.trim();
		this.workers = workers;
		this.daemonHost = isBlank(daemonHost) ? DEFAULT_DAEMON_HOST : daemonHost.trim();
		this.daemonPort = daemonPort;
		this.submit = submit;
		this.colors = colors;
	}

	/**
	 * @param args positional values, any optional one may be null or blank
	 * @throws IllegalArgumentException with a readable message if anything is off
	 */
	public static MinerConfig parse(String[] args) {
		if (args == null || args.length < 2) {
			throw new IllegalArgumentException("address and csv-file are required");
		}
		String address = arg(args, 0);
		String csvFile = arg(args, 1);
		String baseUrl = arg(args, 2);
		int workers = isBlank(arg(args, 3)) ? DEFAULT_WORKERS : parseInt("#workers", arg(args, 3));
		String daemonHost = arg(args, 4);
		int daemonPort = isBlank(arg(args, 5)) ? DEFAULT_DAEMON_PORT : parseInt("daemon-port", arg(args, 5));
		boolean submit = isBlank(arg(args, 6)) ? true : parseBoolean("submit", arg(args, 6));
		boolean colors = isBlank(arg(args, 7)) ? false : parseBoolean("colors", arg(args, 7));

		return new MinerConfig(address, csvFile, baseUrl, workers, daemonHost, daemonPort, submit, colors);
	}

	/**
	 * Inverse of {@link #parse(String[])}, for saving a config file.
	 */
	public List<String> toLines() {
		List<String> lines = new ArrayList<>();
		lines.add(address);
		lines.add(csvFile);
		lines.add(baseUrl);
		lines.add(String.valueOf(workers));
		lines.add(daemonHost);
		lines.add(String.valueOf(daemonPort));
		lines.add(String.valueOf(submit));
		lines.add(String.valueOf(colors));
		return lines;
	}

	private static String arg(String[] args, int idx) {
		return args.length > idx ? args[idx] : null;
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}

	private static int parseInt(String name, String value) {
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException nfe) {
			throw new IllegalArgumentException(name + " is not a number: " + value);
		}
	}

	private static boolean parseBoolean(String name, String value) {
		String v = value.trim();
		if ("true".equalsIgnoreCase(v) || "y".equalsIgnoreCase(v)) {
			return true;
		}
		if ("false".equalsIgnoreCase(v) || "n".equalsIgnoreCase(v)) {
			return false;
		}
		throw new IllegalArgumentException(name + " must be true or false: " + value);
	}

	public String getAddress() {
		return address;
	}

	public String getCsvFile() {
		return csvFile;
	}

	public String getBaseUrl() {
		return baseUrl;
	}

	public int getWorkers() {
		return workers;
	}

	public String getDaemonHost() {
		return daemonHost;
	}

	public int getDaemonPort() {
		return daemonPort;
	}

	public boolean isSubmit() {
		return submit;
	}

	public boolean isColors() {
		return colors;
	}
}
