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

package com.linemerge.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linemerge.utils.FileChecker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

/**
 * Loads an {@link ExtractionConfig} from disk.  Files ending in {@code .cfg} are read as legacy text configurations,
 * anything else as JSON.
 */
public class ConfigLoader {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ConfigLoader.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static final String LEGACY_EXTENSION = ".cfg";

  public static ExtractionConfig load(File configFile) throws IOException {
    FileChecker.verifyInputFile(configFile);
    LOGGER.info("Loading extraction configuration from %s", configFile.getAbsolutePath());

    ExtractionConfig config;
    try (InputStream is = new FileInputStream(configFile)) {
      if (configFile.getName().endsWith(LEGACY_EXTENSION)) {
        config = loadLegacy(is);
      } else {
        config = loadJson(is);
      }
    }
    return config;
  }

  public static ExtractionConfig loadJson(InputStream inStream) throws IOException {
    ExtractionConfig config;
    try {
      config = OBJECT_MAPPER.readValue(inStream, ExtractionConfig.class);
    } catch (JsonProcessingException e) {
      throw new IOException("Unable to parse JSON configuration: " + e.getOriginalMessage(), e);
    }
    config.validate();
    return config;
  }

  public static ExtractionConfig loadLegacy(InputStream inStream) throws IOException {
    try (BufferedReader reader = new BufferedReader(new InputStreamReader(inStream, StandardCharsets.UTF_8))) {
      ExtractionConfig config = new LegacyConfigParser().parse(reader);
      config.validate();
      return config;
    }
  }
}
