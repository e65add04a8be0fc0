package com.sparkify.transform;

import com.sparkify.rowset.RowSet;

/**
 * Narrows raw log records down to song plays.
 */
public class NextSongFilter {

    public static final String NEXT_SONG_PAGE = "NextSong";

    public RowSet apply(RowSet logRecords) {
        return logRecords.filterEquals("page", NEXT_SONG_PAGE);
    }
}
