/*
 * Copyright (c) 2025 Hal Hildebrand. All rights reserved.
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */

package com.hellblazer.loftsmith.gltf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the lofting tool.
 *
 * <p>Modes:
 * <ul>
 *   <li>BUILD - Loft the model described by a JSON configuration and write a .glb</li>
 *   <li>SAMPLE - Run the built-in bowling pin through the whole pipeline</li>
 *   <li>HELP - Print usage</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public class LoftsmithCommandLine {
    private static final Logger log = LoggerFactory.getLogger(LoftsmithCommandLine.class);

    /**
     * Available operation modes.
     */
    public enum Mode {
        BUILD("build", "Loft a model from a JSON configuration"),
        SAMPLE("sample", "Generate the built-in bowling pin"),
        HELP("help", "Show help information");

        private final String command;
        private final String description;

        Mode(String command, String description) {
            this.command = command;
            this.description = description;
        }

        public String getCommand() {
            return command;
        }

        public String getDescription() {
            return description;
        }

        public static Mode fromString(String s) {
            for (var mode : values()) {
                if (mode.command.equalsIgnoreCase(s)) {
                    return mode;
                }
            }
            return null;
        }
    }

    /**
     * Configuration holder for all command-line options.
     */
    public static class Config {
        public Mode mode = Mode.HELP;

        public String configFile;
        public String outputFile;

        /** Overrides the configuration's parallelism when set. */
        public Integer parallelism;

        // Parse problems that make the command line unusable
        public final List<String> parseErrors = new ArrayList<>();

        public boolean isValid() {
            return getValidationErrors().isEmpty();
        }

        public List<String> getValidationErrors() {
            var errors = new ArrayList<>(parseErrors);

            if (mode == Mode.BUILD) {
                if (configFile == null) {
                    errors.add("Build mode requires a configuration file");
                } else if (!Files.exists(Path.of(configFile))) {
                    errors.add("Configuration file does not exist: " + configFile);
                }
            }
            if (parallelism != null && parallelism < 1) {
                errors.add("Parallelism must be at least 1");
            }
            return errors;
        }

        @Override
        public String toString() {
            return String.format("Config{mode=%s, config=%s, output=%s, parallelism=%s}", mode, configFile,
                                 outputFile, parallelism);
        }
    }

    /**
     * Parse command-line arguments into configuration.
     */
    public static Config parse(String[] args) {
        var config = new Config();

        if (args.length == 0) {
            return config;
        }

        var modeArg = args[0];
        config.mode = Mode.fromString(modeArg);
        if (config.mode == null) {
            config.mode = Mode.HELP;
            if (!modeArg.startsWith("-")) {
                log.warn("Unknown mode: {}. Use 'help' for available modes.", modeArg);
                config.parseErrors.add("Unknown mode: " + modeArg);
            }
            return config;
        }

        for (int i = 1; i < args.length; i++) {
            var arg = args[i];

            switch (arg) {
                case "-o", "--output" -> {
                    if (i + 1 < args.length) {
                        config.outputFile = args[++i];
                    } else {
                        config.parseErrors.add(arg + " requires a file name");
                    }
                }
                case "-p", "--parallelism" -> {
                    if (i + 1 < args.length) {
                        var value = args[++i];
                        try {
                            config.parallelism = Integer.parseInt(value);
                        } catch (NumberFormatException e) {
                            config.parseErrors.add("Parallelism is not a number: " + value);
                        }
                    } else {
                        config.parseErrors.add(arg + " requires a value");
                    }
                }
                case "-h", "--help" -> config.mode = Mode.HELP;
                default -> {
                    if (arg.startsWith("-")) {
                        log.warn("Unknown option: {}", arg);
                        config.parseErrors.add("Unknown option: " + arg);
                    } else if (config.configFile == null) {
                        config.configFile = arg;
                    } else {
                        config.parseErrors.add("Unexpected argument: " + arg);
                    }
                }
            }
        }

        return config;
    }

    /**
     * Print usage information.
     */
    public static void printUsage(PrintStream out) {
        out.println("Loftsmith - SVG silhouette to 3D model lofting tool");
        out.println();
        out.println("Usage: loftsmith <mode> [options]");
        out.println();
        out.println("Modes:");
        for (var mode : Mode.values()) {
            out.printf("  %-12s  %s%n", mode.getCommand(), mode.getDescription());
        }
        out.println();
        out.println("Options:");
        out.println("  -o, --output <file>       Output .glb (default: the configuration's output)");
        out.println("  -p, --parallelism <n>     Components lofted concurrently (default: configuration)");
        out.println("  -h, --help                Show this help message");
        out.println();
        out.println("Configuration (JSON):");
        out.println("  name, svgFront, svgSide, svgTop, svgHeight, svgCenterX, scale, vertsPerRing,");
        out.println("  samplesPerUnit, components[], yRanges[], addons[], children[], skeleton, output");
        out.println();
        out.println("Examples:");
        out.println("  loftsmith build character.json");
        out.println("  loftsmith build character.json -o out/character.glb --parallelism 4");
        out.println("  loftsmith sample -o pin.glb");
    }

    /**
     * Validate configuration and print any errors.
     */
    public static boolean validate(Config config, PrintStream out) {
        var errors = config.getValidationErrors();
        if (!errors.isEmpty()) {
            out.println("Configuration errors:");
            for (var error : errors) {
                out.println("  - " + error);
            }
            out.println();
            out.println("Use 'loftsmith help' for usage information.");
            return false;
        }
        return true;
    }
}
