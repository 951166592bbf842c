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

import com.hellblazer.loftsmith.loft.config.ModelConfigException;
import com.hellblazer.loftsmith.loft.config.ModelConfigLoader;
import com.hellblazer.loftsmith.loft.pipeline.LoftPipeline;
import com.hellblazer.loftsmith.loft.pipeline.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;

/**
 * Entry point: dispatches the parsed command line to the lofting pipeline with a GLB exporter.
 *
 * @author hal.hildebrand
 */
public class LoftsmithLauncher {
    public static final int SUCCESS = 0;
    public static final int FAILURE = 1;
    public static final int USAGE   = 2;

    private static final Logger log = LoggerFactory.getLogger(LoftsmithLauncher.class);

    public static int execute(String[] args) {
        return execute(args, System.out, System.err);
    }

    public static int execute(String[] args, PrintStream out, PrintStream err) {
        var config = LoftsmithCommandLine.parse(args);
        if (!LoftsmithCommandLine.validate(config, err)) {
            return USAGE;
        }
        log.debug("Loftsmith {}", config);

        try {
            return switch (config.mode) {
                case BUILD -> build(config);
                case SAMPLE -> sample(config, out);
                case HELP -> {
                    LoftsmithCommandLine.printUsage(out);
                    yield SUCCESS;
                }
            };
        } catch (ModelConfigException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return FAILURE;
        } catch (PipelineException | IOException e) {
            log.error("Error executing {}: {}", config.mode.getCommand(), e.getMessage(), e);
            return FAILURE;
        }
    }

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    private static int build(LoftsmithCommandLine.Config command) throws IOException, PipelineException {
        var model = new ModelConfigLoader().load(Path.of(command.configFile));
        if (command.parallelism != null) {
            model.parallelism = command.parallelism;
        }
        var output = command.outputFile == null ? model.outputPath() : Path.of(command.outputFile);
        new LoftPipeline(new GlbExporter()).run(model, output);
        return SUCCESS;
    }

    private static int sample(LoftsmithCommandLine.Config command, PrintStream out)
    throws IOException, PipelineException {
        var model = BowlingPinSample.config();
        if (command.parallelism != null) {
            model.parallelism = command.parallelism;
        }
        var output = Path.of(command.outputFile == null ? BowlingPinSample.DEFAULT_OUTPUT : command.outputFile);
        var written = new LoftPipeline(new GlbExporter()).run(model, BowlingPinSample.views(), output);
        out.println("Bowling pin written to " + written);
        return SUCCESS;
    }
}
