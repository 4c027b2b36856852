/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.linemerge.utils;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared option handling for the command line tools: builds the option set from a list of builders, adds a help
 * option and prints usage on bad input.
 */
public class CLIUtil {
  private static final Logger LOGGER = LogManager.getFormatterLogger(CLIUtil.class);

  public static final String OPTION_HELP = "h";

  public static final HelpFormatter HELP_FORMATTER = new HelpFormatter();
  static {
    HELP_FORMATTER.setWidth(100);
  }

  private final Class<?> callingClass;
  private final String helpMessage;
  private final Options opts;
  private CommandLine commandLine;

  public CLIUtil(Class<?> callingClass, String helpMessage, List<Option.Builder> optionBuilders) {
    this.callingClass = callingClass;
    this.helpMessage = helpMessage;

    List<Option.Builder> builders = new ArrayList<>(optionBuilders);
    builders.add(Option.builder(OPTION_HELP)
        .argName("help")
        .desc("Prints this help message")
        .longOpt("help")
    );

    opts = new Options();
    for (Option.Builder b : builders) {
      opts.addOption(b.build());
    }
  }

  public Options getOptions() {
    return opts;
  }

  /**
   * Parses the arguments without exiting, for callers that handle their own failures.
   */
  public CommandLine parse(String[] args) throws ParseException {
    commandLine = new DefaultParser().parse(opts, args);
    return commandLine;
  }

  public CommandLine parseCommandLine(String[] args) {
    CommandLine cl = null;
    try {
      cl = parse(args);
    } catch (ParseException e) {
      LOGGER.error("Argument parsing failed: %s", e.getMessage());
      printHelp();
      System.exit(1);
    }

    if (cl.hasOption(OPTION_HELP)) {
      printHelp();
      System.exit(0);
    }
    return cl;
  }

  public CommandLine getCommandLine() {
    return commandLine;
  }

  public void printHelp() {
    HELP_FORMATTER.printHelp(callingClass.getCanonicalName(), helpMessage, opts, null, true);
  }

  public void failWithMessage(String formatStr, Object... args) {
    failWithMessage(String.format(formatStr, args));
  }

  public void failWithMessage(String msg) {
    System.err.println(msg);
    printHelp();
    System.exit(1);
  }
}
