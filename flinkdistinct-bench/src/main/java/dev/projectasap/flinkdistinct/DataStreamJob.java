/*
 * Copyright 2025 ProjectASAP contributors
 * SPDX-License-Identifier: Apache-2.0
 */
package dev.projectasap.flinkdistinct;

import dev.projectasap.flinkdistinct.datamodel.DataPoint;
import dev.projectasap.flinkdistinct.datamodel.PrecomputedOutput;
import dev.projectasap.flinkdistinct.datamodel.Summary;
import dev.projectasap.flinkdistinct.serialization.DistinctCountAccumulatorSerializer;
import dev.projectasap.flinkdistinct.sinks.SinkBuilder;
import dev.projectasap.flinkdistinct.utils.AggregationConfig;
import dev.projectasap.flinkdistinct.utils.ConfigLoader;
import dev.projectasap.flinkdistinct.utils.OutputStrategy;
import dev.projectasap.flinkdistinct.utils.StreamingConfig;
import dev.projectasap.flinkdistinct.windowfunctions.KeyedWindowProcessor;
import java.io.Serializable;
import java.util.Arrays;
import java.util.Objects;
import java.util.Random;
import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;
import org.apache.flink.api.common.ExecutionConfig;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.api.connector.sink2.Sink;
import org.apache.flink.api.java.functions.KeySelector;
import org.apache.flink.connector.datagen.source.DataGeneratorSource;
import org.apache.flink.connector.datagen.source.GeneratorFunction;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.streaming.api.windowing.assigners.TumblingEventTimeWindows;
import org.apache.flink.streaming.api.windowing.time.Time;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flink job that runs distinct aggregations over generated data. Each configured aggregation is
 * evaluated per group and tumbling window; in partition mode the groups are parallel slices of
 * the same window whose partial results are merged afterwards.
 */
public class DataStreamJob {
  private static final Logger LOG = LoggerFactory.getLogger(DataStreamJob.class);

  static final String GROUP_BY_KEY = "key";
  static final String GROUP_BY_PARTITION = "partition";

  private static final long BASE_TIMESTAMP = 1000000000000L;

  private static Namespace parseArgs(String[] args) {
    ArgumentParser parser =
        ArgumentParsers.newFor("DataStreamJob")
            .build()
            .defaultHelp(true)
            .description("Exact distinct aggregation benchmark");

    parser.addArgument("--outputFilePath").type(String.class).help("Output file path");

    parser.addArgument("--configFilePath").type(String.class).help("Configuration file path");

    parser
        .addArgument("--outputFormat")
        .type(String.class)
        .choices("byte", "json")
        .help("Output format: byte or json");

    parser
        .addArgument("--logLevel")
        .type(String.class)
        .choices("TRACE", "DEBUG", "INFO", "WARN", "ERROR")
        .setDefault("INFO")
        .help("Sets the logging level (default: INFO)");

    parser
        .addArgument("--datagenKeyCardinality")
        .type(Integer.class)
        .required(true)
        .help("DataGen key cardinality, -1 for a fresh key per record");

    parser
        .addArgument("--datagenValueCardinality")
        .type(Integer.class)
        .setDefault(1000000)
        .help("Number of distinct values the generator draws from (default: 1000000)");

    parser
        .addArgument("--datagenItemsPerWindow")
        .type(Long.class)
        .required(true)
        .help("Number of items to fit in each tumbling window");

    parser
        .addArgument("--datagenArrayLength")
        .type(Integer.class)
        .setDefault(0)
        .help("Generate arrays of this length instead of single values (default: 0)");

    parser
        .addArgument("--datagenNullFraction")
        .type(Double.class)
        .setDefault(0.0)
        .help("Fraction of generated values that are null (default: 0.0)");

    parser
        .addArgument("--verbose")
        .type(Boolean.class)
        .setDefault(false)
        .help("Enable verbose output to sink (default: false)");

    parser
        .addArgument("--pipeline")
        .type(String.class)
        .choices(OutputStrategy.PIPELINE_INSERTION, OutputStrategy.PIPELINE_INSERTION_QUERYING)
        .setDefault(OutputStrategy.PIPELINE_INSERTION)
        .help("Pipeline type: insertion (summary only) or insertion_querying (summary + query)");

    parser
        .addArgument("--outputMode")
        .type(String.class)
        .setDefault("summary")
        .help(
            "Output mode: summary, query, memory, or combinations separated by underscore"
                + " (e.g., query_memory). Note: query only available for insertion_querying"
                + " pipeline");

    parser
        .addArgument("--queryName")
        .type(String.class)
        .choices("count", "values")
        .help("Finalizer to run: count (distinct count) or values (sorted distinct values)");

    parser
        .addArgument("--groupBy")
        .type(String.class)
        .choices(GROUP_BY_KEY, GROUP_BY_PARTITION)
        .setDefault(GROUP_BY_PARTITION)
        .help("Group by record key, or by parallel partition of each window (default: partition)");

    parser
        .addArgument("--parallelism")
        .type(Integer.class)
        .setDefault(1)
        .help("Parallelism for the Flink job (default: 1)");

    parser
        .addArgument("--enableMerging")
        .type(Boolean.class)
        .setDefault(true)
        .help("Merge parallel partition results of each window (default: true)");

    parser
        .addArgument("--distribution")
        .type(String.class)
        .choices("uniform", "normal")
        .setDefault("uniform")
        .help("Distribution type for generated values: uniform or normal (default: uniform)");

    return parser.parseArgsOrFail(args);
  }

  private static void checkArgs(Namespace parsedArgs) {
    boolean verbose = parsedArgs.getBoolean("verbose");
    if (verbose && parsedArgs.getString("outputFilePath") == null) {
      throw new IllegalArgumentException(
          "Output file path is required when verbose mode is enabled");
    }
    if (parsedArgs.getString("configFilePath") == null) {
      throw new IllegalArgumentException("Configuration file path is required");
    }
    if (verbose && parsedArgs.getString("outputFormat") == null) {
      throw new IllegalArgumentException("Output format is required when verbose mode is enabled");
    }
    if (parsedArgs.getInt("datagenValueCardinality") <= 0) {
      throw new IllegalArgumentException("Value cardinality must be positive");
    }
    double nullFraction = parsedArgs.getDouble("datagenNullFraction");
    if (nullFraction < 0.0 || nullFraction > 1.0) {
      throw new IllegalArgumentException("Null fraction must be between 0 and 1");
    }
  }

  /** Shape of the generated records. */
  static final class DataGenSettings implements Serializable {
    private static final long serialVersionUID = 1L;

    final long itemsPerWindow;
    final long millisecondTumblingWindow;
    final int keyCardinality;
    final int valueCardinality;
    final int arrayLength;
    final double nullFraction;
    final String distribution;

    DataGenSettings(
        long itemsPerWindow,
        long millisecondTumblingWindow,
        int keyCardinality,
        int valueCardinality,
        int arrayLength,
        double nullFraction,
        String distribution) {
      this.itemsPerWindow = itemsPerWindow;
      this.millisecondTumblingWindow = millisecondTumblingWindow;
      this.keyCardinality = keyCardinality;
      this.valueCardinality = valueCardinality;
      this.arrayLength = arrayLength;
      this.nullFraction = nullFraction;
      this.distribution = distribution;
    }
  }


  /**
   * Generates the record at index. Timestamps advance one window every itemsPerWindow records;
   * values are drawn from {@code [1, valueCardinality]}.
   */
  static DataPoint generateDataPoint(long index, DataGenSettings settings, Random randomSource) {
    long timestamp =
        BASE_TIMESTAMP + (index / settings.itemsPerWindow) * settings.millisecondTumblingWindow;
    String key =
        settings.keyCardinality == -1
            ? "key" + index
            : "key" + ((index % settings.keyCardinality) + 1);

    if (settings.arrayLength > 0) {
      Number[] values = new Number[settings.arrayLength];
      for (int i = 0; i < values.length; i++) {
        values[i] = generateValue(settings, randomSource);
      }
      return DataPoint.ofValues(timestamp, key, values);
    }
    return new DataPoint(timestamp, key, generateValue(settings, randomSource));
  }

  private static Long generateValue(DataGenSettings settings, Random randomSource) {
    if (settings.nullFraction > 0 && randomSource.nextDouble() < settings.nullFraction) {
      return null;
    }
    int cardinality = settings.valueCardinality;
    if ("normal".equals(settings.distribution)) {
      // centred on the middle of the range, three standard deviations to each end
      double normalValue =
          randomSource.nextGaussian() * (cardinality / 6.0) + (cardinality / 2.0);
      return (long) Math.max(1, Math.min(cardinality, normalValue));
    }
    return (long) randomSource.nextInt(cardinality) + 1;
  }

  private static DataStream<DataPoint> createDataGenStream(
      StreamExecutionEnvironment env, int numSources, DataGenSettings settings) {
    long recordsPerSource = Long.MAX_VALUE;

    DataStream<DataPoint> inputStream = null;
    for (int i = 0; i < numSources; i++) {
      Random randomSource = new Random(40L + i);
      GeneratorFunction<Long, DataPoint> generatorFunction =
          index -> generateDataPoint(index, settings, randomSource);

      DataGeneratorSource<DataPoint> dataGenSource =
          new DataGeneratorSource<>(
              generatorFunction, recordsPerSource, TypeInformation.of(DataPoint.class));

      DataStream<DataPoint> sourceStream =
          env.fromSource(dataGenSource, WatermarkStrategy.noWatermarks(), "Generator Source " + i);
      inputStream = inputStream == null ? sourceStream : inputStream.union(sourceStream);
    }
    return inputStream;
  }

  /** Routes accumulators through the distinct set codec instead of Kryo field serialization. */
  static void registerSerializers(ExecutionConfig config) {
    DistinctCountAccumulatorSerializer.registerWith(config);
  }

  /**
   * Builds the aggregation for one configuration.
   *
   * @param inputStream timestamped records
   * @param config the aggregation to run
   * @param groupBy "key" to group by record key, "partition" to split each window into parallel
   *     partial groups
   * @param parallelism number of partial groups in partition mode
   * @param enableMerging whether partial groups of a window are merged into one result
   * @param pipeline pipeline mode
   * @param outputMode output mode
   * @param verbose whether outputs carry their parts
   * @return one output per group and window, or per window once merged
   */
  @SuppressWarnings("unchecked")
  static DataStream<PrecomputedOutput> buildAggregation(
      DataStream<DataPoint> inputStream,
      AggregationConfig config,
      String groupBy,
      int parallelism,
      boolean enableMerging,
      String pipeline,
      String outputMode,
      boolean verbose) {
    KeySelector<DataPoint, String> keySelector;
    if (GROUP_BY_KEY.equals(groupBy)) {
      keySelector = item -> item.key;
    } else {
      // deterministic spread of records over partitions, whatever their timestamps
      keySelector =
          item ->
              String.valueOf(
                  Math.floorMod(
                      Objects.hash(item.timestamp, item.key, item.value)
                          + Arrays.hashCode(item.values),
                      parallelism));
    }

    // tumblingWindowSize = -1 stands for a window that never closes before the input ends
    long windowSizeSeconds =
        config.tumblingWindowSize == -1 ? Long.MAX_VALUE / 1000 : config.tumblingWindowSize;

    DataStream<PrecomputedOutput> partialStream =
        inputStream
            .keyBy(keySelector)
            .window(TumblingEventTimeWindows.of(Time.seconds(windowSizeSeconds)))
            .aggregate(
                config.getAggregationFunction(),
                new KeyedWindowProcessor(config, pipeline, outputMode, verbose));

    if (!GROUP_BY_PARTITION.equals(groupBy) || !enableMerging || parallelism <= 1) {
      return partialStream;
    }

    return partialStream
        .windowAll(TumblingEventTimeWindows.of(Time.seconds(windowSizeSeconds)))
        .reduce(
            (output1, output2) -> {
              Summary merged = ((Summary) output1.precompute).merge(output2.precompute);
              PrecomputedOutput result =
                  new PrecomputedOutput(
                      output1.startTimestamp,
                      output1.endTimestamp,
                      merged,
                      config,
                      null,
                      pipeline,
                      outputMode,
                      verbose);
              if (result.getOutputStrategy().shouldExecuteQueries()) {
                result.setCachedQueryResults(
                    OutputStrategy.executeQuery(merged, config.statistic));
              }
              return result;
            });
  }

  /**
   * Main entry point for the Flink streaming job.
   *
   * @param args command-line arguments for configuration
   * @throws Exception if the job fails to execute
   */
  public static void main(String[] args) throws Exception {
    Namespace parsedArgs = parseArgs(args);

    if (parsedArgs.getString("logLevel") != null) {
      System.setProperty("log.level", parsedArgs.getString("logLevel"));
    }

    LOG.info("Starting with log level: {}", System.getProperty("log.level", "INFO"));

    checkArgs(parsedArgs);

    StreamingConfig streamingConfig =
        ConfigLoader.loadConfig(parsedArgs.getString("configFilePath"));
    if (streamingConfig.aggregationConfigs.isEmpty()) {
      throw new IllegalArgumentException("Configuration lists no aggregations");
    }

    String queryName = parsedArgs.getString("queryName");
    if (queryName != null) {
      for (AggregationConfig config : streamingConfig.aggregationConfigs) {
        config.statistic = queryName;
      }
    }

    StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
    registerSerializers(env.getConfig());

    int parallelism = parsedArgs.getInt("parallelism");
    env.setParallelism(parallelism);

    boolean verbose = parsedArgs.getBoolean("verbose");
    String pipeline = parsedArgs.getString("pipeline");
    String outputMode = parsedArgs.getString("outputMode");
    String groupBy = parsedArgs.getString("groupBy");
    boolean enableMerging = parsedArgs.getBoolean("enableMerging");

    Sink<PrecomputedOutput> sink = null;
    if (verbose) {
      sink =
          SinkBuilder.buildSink(
              parsedArgs.getString("outputFormat"), parsedArgs.getString("outputFilePath"));
    }

    long tumblingWindowSizeSeconds = streamingConfig.aggregationConfigs.get(0).tumblingWindowSize;
    DataGenSettings settings =
        new DataGenSettings(
            parsedArgs.getLong("datagenItemsPerWindow"),
            tumblingWindowSizeSeconds * 1000,
            parsedArgs.getInt("datagenKeyCardinality"),
            parsedArgs.getInt("datagenValueCardinality"),
            parsedArgs.getInt("datagenArrayLength"),
            parsedArgs.getDouble("datagenNullFraction"),
            parsedArgs.getString("distribution"));

    DataStream<DataPoint> inputStream = createDataGenStream(env, parallelism, settings);
    inputStream =
        inputStream.assignTimestampsAndWatermarks(
            WatermarkStrategy.<DataPoint>forMonotonousTimestamps()
                .withTimestampAssigner((event, timestamp) -> event.timestamp));

    for (AggregationConfig config : streamingConfig.aggregationConfigs) {
      LOG.info(
          "Aggregation {}: {}.{} ({}) params={} window={}s",
          config.aggregationId,
          config.aggregationPackage,
          config.aggregationType,
          config.aggregationSubType,
          config.parameters,
          config.tumblingWindowSize);

      DataStream<PrecomputedOutput> outputStream =
          buildAggregation(
              inputStream,
              config,
              groupBy,
              parallelism,
              enableMerging,
              pipeline,
              outputMode,
              verbose);

      if (verbose && sink != null) {
        outputStream.sinkTo(sink);
      }
    }

    env.execute("Distinct Aggregation");
  }
}
