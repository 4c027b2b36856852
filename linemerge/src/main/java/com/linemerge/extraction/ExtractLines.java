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

package com.linemerge.extraction;

import com.linemerge.config.ConfigLoader;
import com.linemerge.config.ExtractionConfig;
import com.linemerge.lines.LineContainer;
import com.linemerge.reader.TsvLineListReader;
import com.linemerge.species.SpeciesTable;
import com.linemerge.utils.CLIUtil;
import com.linemerge.utils.FileChecker;
import com.linemerge.utils.LineListTsvWriter;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.Option;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.util.ArrayList;
import java.util.List;

public class ExtractLines {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ExtractLines.class);

  private static final String OPTION_CONFIG = "c";
  private static final String OPTION_SPECIES = "s";
  private static final String OPTION_HOME = "d";
  private static final String OPTION_WL_MIN = "a";
  private static final String OPTION_WL_MAX = "b";
  private static final String OPTION_ELEMENTS = "e";
  private static final String OPTION_MAX_LINES = "n";
  private static final String OPTION_OUTPUT = "o";

  private static final String HELP_MESSAGE = StringUtils.join(new String[]{
      "This class extracts the spectral lines in a wavelength range from every enabled line list of a configuration, ",
      "merges lines that several lists report into one line carrying the best ranked parameters, and writes the ",
      "result as tab separated columns."
  }, "");

  public static final List<Option.Builder> OPTION_BUILDERS = new ArrayList<Option.Builder>() {{
    add(Option.builder(OPTION_CONFIG)
        .argName("config-file")
        .desc("Line list configuration, either JSON or a legacy .cfg file")
        .hasArg()
        .required()
        .longOpt("config")
    );
    add(Option.builder(OPTION_SPECIES)
        .argName("species-file")
        .desc("CSV file listing species codes, names, charges, masses and ionization energies")
        .hasArg()
        .required()
        .longOpt("species")
    );
    add(Option.builder(OPTION_HOME)
        .argName("directory")
        .desc("Directory the configured line list paths are resolved against")
        .hasArg()
        .required()
        .longOpt("home")
    );
    add(Option.builder(OPTION_WL_MIN)
        .argName("angstroms")
        .desc("Lower end of the wavelength range, in Å")
        .hasArg()
        .required()
        .longOpt("wl-min")
    );
    add(Option.builder(OPTION_WL_MAX)
        .argName("angstroms")
        .desc("Upper end of the wavelength range, in Å")
        .hasArg()
        .required()
        .longOpt("wl-max")
    );
    add(Option.builder(OPTION_ELEMENTS)
        .argName("filter")
        .desc("Only extract these species, e.g. \"Fe 1, Ca 2, TiO\"; an element without a stage selects every stage")
        .hasArg()
        .longOpt("elements")
    );
    add(Option.builder(OPTION_MAX_LINES)
        .argName("count")
        .desc(String.format("Maximum number of lines to write, default is %d", LineExtractor.DEFAULT_MAX_LINES))
        .hasArg()
        .longOpt("max-lines")
    );
    add(Option.builder(OPTION_OUTPUT)
        .argName("output-file")
        .desc("Write the merged lines to this TSV file")
        .hasArg()
        .required()
        .longOpt("output")
    );
  }};

  public static void main(String[] args) throws Exception {
    CLIUtil cliUtil = new CLIUtil(ExtractLines.class, HELP_MESSAGE, OPTION_BUILDERS);
    CommandLine cl = cliUtil.parseCommandLine(args);

    File configFile = new File(cl.getOptionValue(OPTION_CONFIG));
    File speciesFile = new File(cl.getOptionValue(OPTION_SPECIES));
    File home = new File(cl.getOptionValue(OPTION_HOME));
    if (!configFile.isFile()) {
      cliUtil.failWithMessage("Configuration file does not exist at %s", configFile.getAbsolutePath());
    }
    if (!speciesFile.isFile()) {
      cliUtil.failWithMessage("Species file does not exist at %s", speciesFile.getAbsolutePath());
    }
    FileChecker.verifyInputDirectory(home);

    double wlMin = 0.0;
    double wlMax = 0.0;
    int maxLines = LineExtractor.DEFAULT_MAX_LINES;
    try {
      wlMin = Double.parseDouble(cl.getOptionValue(OPTION_WL_MIN));
      wlMax = Double.parseDouble(cl.getOptionValue(OPTION_WL_MAX));
      if (cl.hasOption(OPTION_MAX_LINES)) {
        maxLines = Integer.parseInt(cl.getOptionValue(OPTION_MAX_LINES));
      }
    } catch (NumberFormatException e) {
      cliUtil.failWithMessage("Unable to parse numeric argument: %s", e.getMessage());
    }

    ExtractionConfig config = ConfigLoader.load(configFile);
    SpeciesTable speciesTable = SpeciesTable.load(speciesFile);
    LOGGER.info("Loaded %d species and %d line lists", speciesTable.size(), config.getSources().size());

    LineExtractor extractor = new LineExtractor(speciesTable, new TsvLineListReader(home));
    LineContainer lines = extractor.extract(config, wlMin, wlMax, cl.getOptionValue(OPTION_ELEMENTS), maxLines);

    File outputFile = new File(cl.getOptionValue(OPTION_OUTPUT));
    try (LineListTsvWriter writer = new LineListTsvWriter(speciesTable)) {
      writer.open(outputFile);
      writer.append(lines);
    }
    LOGGER.info("Wrote %d lines to %s", lines.size(), outputFile.getAbsolutePath());
  }
}
