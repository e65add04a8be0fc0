package com.sparkify.ingestion;

import com.sparkify.engine.RowSetEngine;
import com.sparkify.engine.memory.InMemoryEngine;
import com.sparkify.engine.spark.SparkEngine;
import com.sparkify.error.SinkWriteException;
import com.sparkify.error.SourceReadException;
import com.sparkify.rowset.RowSet;
import com.sparkify.transform.NextSongFilter;
import com.sparkify.transform.SongDimensionBuilder;
import com.sparkify.transform.SongplayFactBuilder;
import com.sparkify.transform.TimeDimensionBuilder;
import com.sparkify.transform.UserDimensionBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.time.ZoneId;

/**
 * Loads raw song and log records, reshapes them into the songs / artists / users / time
 * dimensions and the songplays fact table, and writes each as Parquet below the output base.
 *
 * <p>Usage: {@code spark-submit --class com.sparkify.ingestion.SparkifyEtlPipeline app.jar [config.yml]}
 */
public class SparkifyEtlPipeline {
    private static final Logger LOGGER = LoggerFactory.getLogger(SparkifyEtlPipeline.class);

    private final RowSetEngine engine;
    private final ZoneId zone;

    private final SongDimensionBuilder songDimensions = new SongDimensionBuilder();
    private final NextSongFilter nextSongFilter = new NextSongFilter();
    private final UserDimensionBuilder userDimension = new UserDimensionBuilder();

    public SparkifyEtlPipeline(RowSetEngine engine, ZoneId zone) {
        this.engine = engine;
        this.zone = zone;
    }

    public RunSummary run(String inputData, String outputData) {
        LOGGER.info("Starting ETL on {} engine: {} -> {} (time zone {})",
                engine.name(), inputData, outputData, zone);
        long start = System.currentTimeMillis();

        RunSummary summary = new RunSummary();
        processSongData(inputData, outputData, summary);
        processLogData(inputData, outputData, summary);

        LOGGER.info("ETL complete in {} ms: {}", System.currentTimeMillis() - start, summary);
        return summary;
    }

    /**
     * Song records to the songs and artists tables.
     */
    public void processSongData(String inputData, String outputData, RunSummary summary) {
        // === LOAD SONG DATA ===
        RowSet songData = DataLoader.loadSongData(engine, inputData);

        // === SONGS TABLE ===
        write(songDimensions.buildSongs(songData), OutputTable.SONGS, outputData, summary);

        // === ARTISTS TABLE ===
        write(songDimensions.buildArtists(songData), OutputTable.ARTISTS, outputData, summary);
    }

    /**
     * Log records to the users, time and songplays tables.
     */
    public void processLogData(String inputData, String outputData, RunSummary summary) {
        // === LOAD LOG DATA, KEEP SONG PLAYS ===
        RowSet events = nextSongFilter.apply(DataLoader.loadLogData(engine, inputData));

        // === USERS TABLE ===
        write(userDimension.build(events), OutputTable.USERS, outputData, summary);

        // === TIME TABLE ===
        write(new TimeDimensionBuilder(zone).build(events), OutputTable.TIME, outputData, summary);

        // === SONGPLAYS TABLE (joined against the full song data) ===
        RowSet songData = DataLoader.loadSongDataDirectory(engine, inputData);
        write(new SongplayFactBuilder(zone).build(events, songData), OutputTable.SONGPLAYS, outputData, summary);
    }

    private void write(RowSet table, OutputTable target, String outputData, RunSummary summary) {
        String path = target.pathUnder(outputData);
        engine.write(table, path, target.getPartitionColumns());
        long rows = table.count();
        summary.record(target, rows);
        LOGGER.info("{} table rows: {} -> {}", target.tableName(), rows, path);
    }

    static RowSetEngine createEngine(EtlConfig config) {
        if (EtlConfig.ENGINE_MEMORY.equals(config.getEngine())) {
            return new InMemoryEngine();
        }
        return new SparkEngine(SparkSessions.create(config));
    }

    /**
     * Runs the whole job and reports the process exit status instead of exiting.
     */
    static int execute(String[] args) {
        String configFile = args.length > 0 ? args[0] : EtlConfig.DEFAULT_FILE;
        try {
            EtlConfig config = EtlConfig.load(Paths.get(configFile));
            try (RowSetEngine engine = createEngine(config)) {
                new SparkifyEtlPipeline(engine, config.zoneId())
                        .run(config.getInputData(), config.getOutputData());
            }
            return 0;
        } catch (SourceReadException e) {
            LOGGER.error("ETL run failed reading {}: {}", e.getPath(), e.getMessage(), e);
            return 1;
        } catch (SinkWriteException e) {
            LOGGER.error("ETL run failed writing {}: {}", e.getPath(), e.getMessage(), e);
            return 1;
        } catch (Exception e) {
            LOGGER.error("ETL run failed: {}", e.getMessage(), e);
            return 1;
        }
    }

    public static void main(String[] args) {
        int status = execute(args);
        if (status != 0) {
            System.exit(status);
        }
    }
}
