/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.tdl.ui;

import java.io.File;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.log4j.Logger;

import exm.tdl.common.Logging;
import exm.tdl.common.Settings;
import exm.tdl.common.exceptions.InvalidOptionException;
import exm.tdl.common.exceptions.TDLFatal;

/**
 * Command line interface to the TDL parser.  Options may also be
 * given as Java properties.  See Settings.java for these.
 */
public class Main {
  private static final String FORMAT_FLAG = "f";
  private static final String RECOVER_FLAG = "r";
  private static final String STRICT_FLAG = "s";
  private static final String ENCODING_FLAG = "e";

  public static void main(String[] args) {
    try {
      Settings.initTDLProperties();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up options: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    Args tdlArgs = processArgs(args);

    Logger logger = null;
    try {
      logger = setupLogging();
    } catch (InvalidOptionException ex) {
      System.err.println("Error setting up logging: " + ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    try {
      TDLInspector inspector = new TDLInspector(logger, System.out);
      inspector.setFormat(tdlArgs.format);
      inspector.setRecover(Settings.getBoolean(Settings.PARSE_RECOVER));
      inspector.setStrictCoreferences(
                    Settings.getBoolean(Settings.PARSE_STRICT_COREFS));
      inspector.inspect(tdlArgs.inputFiles, selectCharset());
    } catch (InvalidOptionException ex) {
      System.err.println(ex.getMessage());
      System.exit(ExitCode.ERROR_COMMAND.code());
    } catch (TDLFatal ex) {
      System.exit(ex.exitCode);
    }
    System.exit(ExitCode.SUCCESS.code());
  }

  private static Options initOptions() {
    Options opts = new Options();
    opts.addOption(FORMAT_FLAG, "format", false,
                   "Print definitions as formatted TDL");
    opts.addOption(RECOVER_FLAG, "recover", false,
                   "Skip definitions with syntax errors");
    opts.addOption(STRICT_FLAG, "strict", false,
                   "Treat coreference tags used only once as errors");
    Option encoding = new Option(ENCODING_FLAG, "encoding", true,
                                 "Input encoding (default UTF-8)");
    encoding.setArgName("enc");
    opts.addOption(encoding);
    return opts;
  }

  private static Args processArgs(String[] args) {
    Options opts = initOptions();

    CommandLine cmd = null;
    try {
      CommandLineParser parser = new DefaultParser();
      cmd = parser.parse(opts, args);
    } catch (ParseException ex) {
      // Use Apache CLI-provided messages
      System.err.println(ex.getMessage());
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
      return null;
    }

    // Flags override properties
    if (cmd.hasOption(RECOVER_FLAG)) {
      Settings.set(Settings.PARSE_RECOVER, "true");
    }
    if (cmd.hasOption(STRICT_FLAG)) {
      Settings.set(Settings.PARSE_STRICT_COREFS, "true");
    }
    if (cmd.hasOption(ENCODING_FLAG)) {
      Settings.set(Settings.INPUT_ENCODING,
                   cmd.getOptionValue(ENCODING_FLAG));
    }

    String[] remainingArgs = cmd.getArgs();
    if (remainingArgs.length < 1) {
      System.err.println("Expected at least one input file");
      usage(opts);
      System.exit(ExitCode.ERROR_COMMAND.code());
    }

    List<File> inputFiles = new ArrayList<File>();
    for (String arg: remainingArgs) {
      File input = new File(arg);
      if (!input.isFile() || !input.canRead()) {
        System.err.println("Input file \"" + input + "\" is not readable");
        System.exit(ExitCode.ERROR_IO.code());
      }
      inputFiles.add(input);
    }
    return new Args(inputFiles, cmd.hasOption(FORMAT_FLAG));
  }

  private static Charset selectCharset() {
    String name = Settings.get(Settings.INPUT_ENCODING).trim();
    try {
      return Charset.forName(name);
    } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
      System.err.println("Unknown input encoding: " + name);
      throw new TDLFatal(ExitCode.ERROR_COMMAND.code());
    }
  }

  private static Logger setupLogging() throws InvalidOptionException {
    String logfile = Settings.get(Settings.LOG_FILE);
    boolean trace = Settings.getBoolean(Settings.LOG_TRACE);
    return Logging.setupLogging(logfile, trace);
  }

  private static void usage(Options opts) {
    HelpFormatter fmt = new HelpFormatter();
    fmt.printHelp("tdl [options] <file>...", opts);
  }

  private static class Args {
    public final List<File> inputFiles;
    public final boolean format;

    public Args(List<File> inputFiles, boolean format) {
      this.inputFiles = inputFiles;
      this.format = format;
    }
  }
}
