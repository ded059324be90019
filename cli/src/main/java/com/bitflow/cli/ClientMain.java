/**
 * Copyright (C) 2011-2013 Turn, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.bitflow.cli;

import com.bitflow.bcodec.InvalidBEncodingException;
import com.bitflow.client.Client;
import com.bitflow.client.ClientEnvironment;
import com.bitflow.client.ClientState;
import com.bitflow.common.TorrentMetadata;
import com.bitflow.common.TorrentParser;
import com.bitflow.common.TorrentUtils;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.util.concurrent.TimeUnit;

import jargs.gnu.CmdLineParser;
import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.Level;
import org.apache.log4j.PatternLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry-point for downloading a torrent with a {@link Client}.
 */
public class ClientMain {

	private static final Logger logger =
		LoggerFactory.getLogger(ClientMain.class);

	/**
	 * Default data output directory.
	 */
	private static final String DEFAULT_OUTPUT_DIRECTORY = ".";

	private static final long PROGRESS_REPORT_INTERVAL_SEC = 10;

	/**
	 * Display program usage on the given {@link PrintStream}.
	 */
	private static void usage(PrintStream s) {
		s.println("usage: bitflow [options] <torrent>");
		s.println();
		s.println("Available options:");
		s.println("  -h,--help                  Show this help and exit.");
		s.println("  -v,--verbose               Print the torrent metadata and log at DEBUG level.");
		s.println("  -o,--output DIR            Write data to directory DIR (default: current directory).");
		s.println("  -p,--port PORT             Port reported to the trackers (default: 6881).");
		s.println();
	}

	private static void configureLogging(boolean verbose) {
		org.apache.log4j.Logger root = org.apache.log4j.Logger.getRootLogger();
		if (!root.getAllAppenders().hasMoreElements()) {
			BasicConfigurator.configure(new ConsoleAppender(
				new PatternLayout("%d [%-25t] %-5p: %m%n")));
		}
		root.setLevel(verbose ? Level.DEBUG : Level.INFO);
	}

	/**
	 * Runs the client and returns the process exit code: 0 once the download
	 * is complete, 1 on usage or torrent decoding errors, 2 on any other
	 * fatal error.
	 */
	static int run(String[] args, PrintStream out, PrintStream err) {
		CmdLineParser parser = new CmdLineParser();
		CmdLineParser.Option help = parser.addBooleanOption('h', "help");
		CmdLineParser.Option verbose = parser.addBooleanOption('v', "verbose");
		CmdLineParser.Option output = parser.addStringOption('o', "output");
		CmdLineParser.Option port = parser.addIntegerOption('p', "port");

		try {
			parser.parse(args);
		} catch (CmdLineParser.OptionException oe) {
			err.println(oe.getMessage());
			usage(err);
			return 1;
		}

		// Display help and exit if requested
		if (Boolean.TRUE.equals((Boolean)parser.getOptionValue(help))) {
			usage(out);
			return 0;
		}

		boolean verboseValue = Boolean.TRUE.equals((Boolean)parser.getOptionValue(verbose));
		String outputValue = (String)parser.getOptionValue(output,
			DEFAULT_OUTPUT_DIRECTORY);
		ClientEnvironment environment = new ClientEnvironment();
		int portValue = (Integer)parser.getOptionValue(port, environment.getPort());
		if (portValue < 1 || portValue > 65535) {
			err.println("Invalid port " + portValue);
			usage(err);
			return 1;
		}

		String[] otherArgs = parser.getRemainingArgs();
		if (otherArgs.length != 1) {
			usage(err);
			return 1;
		}

		configureLogging(verboseValue);

		TorrentMetadata metadata;
		try {
			metadata = new TorrentParser().parseFromFile(new File(otherArgs[0]));
		} catch (InvalidBEncodingException ibee) {
			err.println("Invalid torrent file " + otherArgs[0] + ": " + ibee.getMessage());
			return 1;
		} catch (IOException ioe) {
			logger.error("Could not read {}: {}", otherArgs[0], ioe.getMessage());
			return 2;
		}

		if (verboseValue) {
			out.println(metadata.describe());
			for (String name : TorrentUtils.getTorrentFileNames(metadata)) {
				out.println("  " + name);
			}
		}

		environment.setPort(portValue);
		final Client client = new Client(environment, metadata, new File(outputValue));

		// Stop the client, and move finished files into place, on Ctrl-C.
		Thread shutdownHook = new Thread(new Runnable() {
			@Override
			public void run() {
				client.stop();
			}
		}, "bitflow-shutdown");
		Runtime.getRuntime().addShutdownHook(shutdownHook);

		try {
			client.start();
			while (!client.waitForCompletion(PROGRESS_REPORT_INTERVAL_SEC, TimeUnit.SECONDS)) {
				logger.info("{}", client.getProgress());
			}
			client.stop();
			Runtime.getRuntime().removeShutdownHook(shutdownHook);
			return ClientState.DONE.equals(client.getState()) ? 0 : 2;
		} catch (InterruptedException ie) {
			Thread.currentThread().interrupt();
			logger.error("Interrupted while downloading {}", metadata.getInfo().getName());
			return 2;
		} catch (Exception e) {
			logger.error("Fatal error: {}", e.getMessage(), e);
			return 2;
		}
	}

	/**
	 * Main client entry point for stand-alone operation.
	 */
	public static void main(String[] args) {
		System.exit(run(args, System.out, System.err));
	}
}
