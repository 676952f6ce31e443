package com.di.retailstar.source;

import com.di.retailstar.rowset.RowSet;

import java.nio.file.Path;

/**
 * Produces the raw extract the pipeline runs on. How the data was acquired is the source's
 * concern; the pipeline only sees the resulting rows.
 */
public interface RawDatasetSource {

    /**
     * @throws com.di.retailstar.exception.RawDatasetException when the location cannot be
     *         read or its content is malformed
     */
    RowSet read(Path location);
}
