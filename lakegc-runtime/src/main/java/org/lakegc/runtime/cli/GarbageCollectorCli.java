/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.lakegc.runtime.cli;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;

import com.google.common.base.Optional;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import org.lakegc.configuration.ConfigurationKeys;
import org.lakegc.mark.GarbageCollectionMode;
import org.lakegc.runtime.GarbageCollectionResult;
import org.lakegc.runtime.GarbageCollector;
import org.lakegc.util.ConfigUtils;
import org.lakegc.util.retry.CallContext;

import lombok.extern.slf4j.Slf4j;


/**
 * Command line entry point of the garbage collector.
 *
 * <pre>
 *   GarbageCollectorCli -r &lt;repository&gt; -m mark|sweep|both [-i &lt;mark id&gt;] [-c &lt;config file&gt;]
 * </pre>
 *
 * Exits with {@link #EXIT_SUCCESS}, {@link #EXIT_FAILURE} when the run fails, or {@link #EXIT_USAGE} on bad arguments.
 * Java system properties under the {@code lakegc.} prefix override the configuration file.
 */
@Slf4j
public class GarbageCollectorCli {

  public static final int EXIT_SUCCESS = 0;
  public static final int EXIT_FAILURE = 1;
  public static final int EXIT_USAGE = 2;

  private static final Option REPOSITORY_OPTION = Option.builder("r").longOpt("repository").hasArg()
      .argName("repository").desc("Repository to collect").build();
  private static final Option MODE_OPTION = Option.builder("m").longOpt("mode").hasArg().argName("mode")
      .desc("mark, sweep or both (default both)").build();
  private static final Option MARK_ID_OPTION = Option.builder("i").longOpt("mark-id").hasArg().argName("mark id")
      .desc("Mark id to write or sweep, required for sweep").build();
  private static final Option CONFIG_OPTION = Option.builder("c").longOpt("config").hasArg().argName("file")
      .desc("HOCON, JSON or properties configuration file").build();
  private static final Option HELP_OPTION = Option.builder("h").longOpt("help").desc("Display usage information")
      .build();

  private final PrintWriter out;

  public GarbageCollectorCli(PrintWriter out) {
    this.out = out;
  }

  public static void main(String[] args) {
    final CallContext context = CallContext.cancellable();
    Runtime.getRuntime().addShutdownHook(new Thread(new Runnable() {
      @Override
      public void run() {
        context.cancel();
      }
    }, "lakegc-shutdown"));
    PrintWriter out = new PrintWriter(System.out, true);
    System.exit(new GarbageCollectorCli(out).run(args, context));
  }

  /**
   * Parse <code>args</code> and run the collector.
   *
   * @return the process exit code
   */
  public int run(String[] args, CallContext context) {
    CommandLine cmd;
    GarbageCollectionMode mode;
    try {
      cmd = new DefaultParser().parse(options(), args);
      if (cmd.hasOption(HELP_OPTION.getOpt())) {
        printUsage();
        return EXIT_SUCCESS;
      }
      if (!cmd.hasOption(REPOSITORY_OPTION.getOpt())) {
        throw new ParseException("Missing required option: " + REPOSITORY_OPTION.getOpt());
      }
      mode = GarbageCollectionMode.forName(cmd.getOptionValue(MODE_OPTION.getOpt(), ConfigurationKeys.DEFAULT_MODE));
      if (mode == GarbageCollectionMode.SWEEP && !cmd.hasOption(MARK_ID_OPTION.getOpt())) {
        throw new ParseException("Mode sweep requires a mark id (-" + MARK_ID_OPTION.getOpt() + ")");
      }
    } catch (ParseException | IllegalArgumentException e) {
      this.out.println(e.getMessage());
      printUsage();
      return EXIT_USAGE;
    }

    String repository = cmd.getOptionValue(REPOSITORY_OPTION.getOpt());
    Optional<String> markId = Optional.fromNullable(cmd.getOptionValue(MARK_ID_OPTION.getOpt()));
    try {
      Config config = loadConfig(Optional.fromNullable(cmd.getOptionValue(CONFIG_OPTION.getOpt())));
      try (GarbageCollector collector = GarbageCollector.fromConfig(repository, config, context)) {
        GarbageCollectionResult result = collector.run(mode, markId, context);
        this.out.println(summary(result));
        return EXIT_SUCCESS;
      }
    } catch (IOException | RuntimeException e) {
      log.error(String.format("Garbage collection of %s failed", repository), e);
      this.out.println("Garbage collection failed: " + e.getMessage());
      return EXIT_FAILURE;
    }
  }

  static Config loadConfig(Optional<String> configFile) {
    Config fileConfig = configFile.isPresent()
        ? ConfigUtils.loadConfigFile(new File(configFile.get()))
        : ConfigFactory.empty();
    return ConfigUtils.propertiesToConfig(System.getProperties(), Optional.of(ConfigurationKeys.LAKEGC_PREFIX))
        .withFallback(fileConfig);
  }

  private static String summary(GarbageCollectionResult result) {
    StringBuilder summary = new StringBuilder()
        .append("Repository ").append(result.getRepository())
        .append(", mode ").append(result.getMode().getCliName())
        .append(", mark id ").append(result.getMarkId());
    if (result.getManifest().isPresent()) {
      summary.append(", marked ").append(result.getManifest().get().size());
    }
    if (result.getSweepReport().isPresent()) {
      summary.append(", removed ").append(result.getSweepReport().get().getRemoved().size())
          .append(", failed ").append(result.getSweepReport().get().getFailed().size());
    }
    return summary.toString();
  }

  private void printUsage() {
    StringWriter usage = new StringWriter();
    new HelpFormatter().printHelp(new PrintWriter(usage), HelpFormatter.DEFAULT_WIDTH,
        GarbageCollectorCli.class.getSimpleName() + " -r <repository> -m mark|sweep|both [-i <mark id>] [-c <file>]",
        null, options(), HelpFormatter.DEFAULT_LEFT_PAD, HelpFormatter.DEFAULT_DESC_PAD, null);
    this.out.print(usage);
    this.out.flush();
  }

  private static Options options() {
    Options options = new Options();
    options.addOption(REPOSITORY_OPTION);
    options.addOption(MODE_OPTION);
    options.addOption(MARK_ID_OPTION);
    options.addOption(CONFIG_OPTION);
    options.addOption(HELP_OPTION);
    return options;
  }
}
