package com.sparkify.ingestion;

import com.sparkify.engine.RowSetEngine;
import com.sparkify.rowset.RowSet;

/**
 * Locations of the raw inputs below the input base, and the calls that load them.
 */
public class DataLoader {

    public static final String SONG_DATA = "song_data/*/*/*/*.json";
    public static final String SONG_DATA_DIRECTORY = "song_data";
    public static final String LOG_DATA = "log_data/*.json";

    public static RowSet loadSongData(RowSetEngine engine, String inputData) {
        return engine.read(resolve(inputData, SONG_DATA));
    }

    /**
     * Every song file below {@code song_data}, however deep.
     */
    public static RowSet loadSongDataDirectory(RowSetEngine engine, String inputData) {
        return engine.read(resolve(inputData, SONG_DATA_DIRECTORY));
    }

    public static RowSet loadLogData(RowSetEngine engine, String inputData) {
        return engine.read(resolve(inputData, LOG_DATA));
    }

    public static String resolve(String base, String relative) {
        if (base.isEmpty() || base.endsWith("/")) {
            return base + relative;
        }
        return base + "/" + relative;
    }
}
