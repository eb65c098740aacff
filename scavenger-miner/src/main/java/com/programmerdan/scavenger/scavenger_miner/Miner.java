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

import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.lang.Thread.UncaughtExceptionHandler;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Scanner;
import java.util.concurrent.atomic.AtomicBoolean;

import com.diogonunes.jcdp.color.api.Ansi.Attribute;
import com.diogonunes.jcdp.color.api.Ansi.FColor;

/**
 * Miner wrapper. Loads config and challenges, then works through the challenges one at a time,
 * each with a fresh {@link Orchestrator}.
 */
public class Miner implements UncaughtExceptionHandler {

	public static final String DEFAULT_CONFIG = "config.cfg";

	/**
	 * Breather between challenges.
	 */
	public static final long CHALLENGE_DELAY = 1000l;

	/**
	 * How long the shutdown hook waits for the run loop to wind down before flushing the error log.
	 */
	public static final long SHUTDOWN_WAIT = 10000l;

	private final MinerConfig config;
	private final HashOracleFactory oracles;
	private final SubmissionClient submitter;

	private final MinerStats stats;
	private final AtomicBoolean stop;
	private final ErrorLog errorLog;

	private final CPrint coPrint;

	private long statsInterval = Orchestrator.DEFAULT_STATS_INTERVAL;

	protected volatile boolean active = false;

	public static void main(String[] args) {
		MinerConfig config = null;

		try (Scanner console = new Scanner(System.in)) {
			if (args == null || args.length == 0) {
				args = new String[] { DEFAULT_CONFIG };
			}
			// let's try to load a config file first.
			if (args.length == 1) {
				File cfg = new File(args[0]);
				if (cfg.exists() && cfg.canRead()) {
					System.out.println(" Attempting to open " + args[0] + " as a config file for scavenger-miner-java");
					List<String> lines = Files.readAllLines(cfg.toPath(), StandardCharsets.UTF_8);
					config = MinerConfig.parse(lines.toArray(new String[] {}));
				} else if (cfg.exists()) {
					config = MinerConfig.parse(args); // will cause error, probably.
				} else {
					System.out.print(" Would you like to generate a config and save it to " + args[0] + "? (y/N) ");
					if ("y".equalsIgnoreCase(console.nextLine().trim())) {
						config = generateConfig(console, cfg);
					}
				}
			} else {
				config = MinerConfig.parse(args);
			}
		} catch (IllegalArgumentException | IOException e) {
			System.err.println("Invalid configuration: " + e.getMessage());
			usage();
			System.exit(1);
		}

		if (config == null) {
			usage();
			System.exit(1);
		}

		final Miner miner = new Miner(config);

		List<Challenge> challenges = null;
		try {
			challenges = new ChallengeReader().read(new File(config.getCsvFile()));
		} catch (IOException e) {
			System.err.println("Error reading CSV file " + config.getCsvFile() + ": " + e.getMessage());
			System.exit(1);
		}
		miner.coPrint.label().p("Loaded ").normData().fd(challenges.size()).label().p(" challenges from ")
			.textData().ln(config.getCsvFile()).clr();
		if (challenges.isEmpty()) {
			miner.coPrint.alert().ln("No challenges found in CSV file").clr();
			return;
		}

		Thread.setDefaultUncaughtExceptionHandler(miner);
		final Thread runLoop = Thread.currentThread();
		Runtime.getRuntime().addShutdownHook(new Thread(() -> {
			miner.shutdown();
			try {
				runLoop.join(SHUTDOWN_WAIT);
			} catch (InterruptedException ie) {
				Thread.currentThread().interrupt();
			}
			miner.saveErrors(new File("."));
		}, "ScavengerShutdown"));

		miner.run(challenges);
	}

	private static MinerConfig generateConfig(Scanner console, File cfg) {
		List<String> lines = new ArrayList<>();

		System.out.print(" Address to mine for? ");
		lines.add(console.nextLine());

		System.out.print(" CSV file containing challenges? ");
		lines.add(console.nextLine());

		System.out.print(" Scavenger API base URL? (leave empty for " + MinerConfig.DEFAULT_BASE_URL + ") ");
		lines.add(console.nextLine());

		int defaultWorkers = MinerConfig.DEFAULT_WORKERS;
		System.out.print(" Simultaneous workers to run? (you have " + Runtime.getRuntime().availableProcessors()
				+ " cores, leave blank for default of " + defaultWorkers + ") ");
		lines.add(console.nextLine());

		System.out.print(" Hash daemon host? (leave empty for " + MinerConfig.DEFAULT_DAEMON_HOST + ") ");
		lines.add(console.nextLine());

		System.out.print(" Hash daemon port? (leave empty for " + MinerConfig.DEFAULT_DAEMON_PORT + ") ");
		lines.add(console.nextLine());

		System.out.print(" Submit found solutions? (Y/n) ");
		lines.add("n".equalsIgnoreCase(console.nextLine().trim()) ? "false" : "true");

		System.out.print(" Activate colors? (y/N) ");
		lines.add("y".equalsIgnoreCase(console.nextLine().trim()) ? "true" : "false");

		MinerConfig config = MinerConfig.parse(lines.toArray(new String[] {}));

		try (PrintWriter os = new PrintWriter(new FileWriter(cfg, StandardCharsets.UTF_8))) {
			for (String line : config.toLines()) {
				os.println(line);
			}
			os.flush();
		} catch (IOException ie) {
			System.err.println("Failed to save settings ... continuing. Check permissions? Error message: "
					+ ie.getMessage());
		}
		return config;
	}

	private static void usage() {
		System.err.println();
		System.err.println("Usage: ");
		System.err.println("  java -jar scavenger-miner-java.jar [config-file]");
		System.err.println(
				"  java -jar scavenger-miner-java.jar address csv-file [base-url] [#workers] [daemon-host] [daemon-port] [true|false] [true|false]");
		System.err.println(" where:");
		System.err.println("   [base-url] is the scavenger API. Default " + MinerConfig.DEFAULT_BASE_URL);
		System.err.println("   [#workers] is # of workers to spin up. Default " + MinerConfig.DEFAULT_WORKERS);
		System.err.println("   [daemon-host] [daemon-port] locate the local hash daemon. Default "
				+ MinerConfig.DEFAULT_DAEMON_HOST + " " + MinerConfig.DEFAULT_DAEMON_PORT);
		System.err.println("   first [true|false] is if found solutions are submitted. Default true.");
		System.err.println("   second [true|false] is if colored output is enabled. Default false.");
	}

	public Miner(MinerConfig config) {
		this(config, HashOracleFactory.daemon(config.getDaemonHost(), config.getDaemonPort()),
				new HttpSubmissionClient(config.getBaseUrl()));
	}

	public Miner(MinerConfig config, HashOracleFactory oracles, SubmissionClient submitter) {
		this.config = config;
		this.oracles = oracles;
		this.submitter = submitter;
		this.stats = new MinerStats();
		this.stop = new AtomicBoolean(false);
		this.errorLog = new ErrorLog();

		coPrint = new CPrint(config.isColors());
		coPrint.a(Attribute.BOLD).f(FColor.CYAN).ln("Active config:")
			.clr().f(FColor.CYAN).p("  address: ").f(FColor.GREEN).ln(config.getAddress())
			.clr().f(FColor.CYAN).p("  csv-file: ").f(FColor.GREEN).ln(config.getCsvFile())
			.clr().f(FColor.CYAN).p("  base-url: ").f(FColor.GREEN).ln(config.getBaseUrl())
			.clr().f(FColor.CYAN).p("  workers: ").f(FColor.GREEN).ln(config.getWorkers())
			.clr().f(FColor.CYAN).p("  daemon: ").f(FColor.GREEN).ln(config.getDaemonHost() + ":" + config.getDaemonPort())
			.clr().f(FColor.CYAN).p("  submit: ").f(FColor.GREEN).ln(config.isSubmit())
			.clr().f(FColor.CYAN).p("  colors: ").f(FColor.GREEN).ln(config.isColors()).clr();
	}

	/**
	 * Works through the challenges in order, one orchestrator run each.
	 *
	 * @return how many challenges were run
	 */
	public int run(List<Challenge> challenges) {
		active = true;
		int done = 0;
		String bar = "============================================================";

		Submission submission = config.isSubmit() ? new Submission(submitter, errorLog) : null;

		for (Challenge challenge : challenges) {
			if (!active) {
				break;
			}
			coPrint.ln().headers().ln(bar)
				.label().p("Processing challenge ").normData().p((done + 1) + "/" + challenges.size())
				.label().p(": ").textData().ln(challenge.getChallengeId())
				.headers().ln(bar).clr();

			// reset global stop and stats for each challenge
			stop.set(false);
			if (!active) {
				break;
			}
			stats.reset();

			Orchestrator orchestrator = new Orchestrator(config.getAddress(), config.getWorkers(), config.isColors(),
					oracles, submission, stats, stop, this);
			orchestrator.setChallenge(challenge);
			orchestrator.run(statsInterval);
			done++;

			if (Thread.currentThread().isInterrupted()) {
				coPrint.alert().ln("Interruption detected, shutting down.").clr();
				active = false;
				break;
			}

			coPrint.msg().p("Finished challenge ").normData().p(challenge.getChallengeId())
				.msg().ln(". Sleeping 1s before next challenge.").clr();
			if (!Utility.pause(CHALLENGE_DELAY)) {
				active = false;
				break;
			}
		}

		coPrint.ln().headers().ln(bar);
		if (done == challenges.size()) {
			coPrint.label().p("Completed all ").normData().fd(challenges.size()).label().ln(" challenges!");
		} else {
			coPrint.alert().p("Stopped after ").normData().fd(done).alert().p(" of ").normData()
				.fd(challenges.size()).alert().ln(" challenges.");
		}
		coPrint.headers().ln(bar).clr();
		active = false;
		return done;
	}

	/**
	 * Asks the run loop to finish up: the current challenge ends and no new one starts.
	 */
	public void shutdown() {
		active = false;
		stop.set(true);
	}

	/**
	 * @return the file written, or null if there was nothing to write or the write failed
	 */
	public File saveErrors(File directory) {
		if (errorLog.size() == 0) {
			return null;
		}
		try {
			File saved = errorLog.save(directory, config.getAddress());
			coPrint.msg().p("Saved ").normData().fd(errorLog.size()).msg().p(" error logs to ").textData().ln(saved)
				.clr();
			return saved;
		} catch (IOException e) {
			coPrint.alert().ln("Failed to save error log: " + e.getMessage()).clr();
			return null;
		}
	}

	public void setStatsInterval(long statsInterval) {
		this.statsInterval = statsInterval;
	}

	public MinerStats getStats() {
		return stats;
	}

	public ErrorLog getErrorLog() {
		return errorLog;
	}

	public AtomicBoolean getStop() {
		return stop;
	}

	public boolean isActive() {
		return active;
	}

	@Override
	public void uncaughtException(Thread t, Throwable e) {
		coPrint.a(Attribute.BOLD).f(FColor.RED)
			.p("Detected thread ").f(FColor.WHITE).p(t.getName())
			.f(FColor.RED).p(" death due to error: ").a(Attribute.LIGHT).ln(e.getMessage()).clr();
		e.printStackTrace();

		System.err.println("\n\nThis is probably fatal, so exiting now.");
		System.exit(1);
	}
}
