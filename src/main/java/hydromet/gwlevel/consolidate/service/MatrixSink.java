package hydromet.gwlevel.consolidate.service;

import hydromet.gwlevel.consolidate.model.NationalMatrix;
import hydromet.gwlevel.consolidate.model.SinkAck;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Destination of the finished national matrix.
 */
public interface MatrixSink {

    /**
     * Write a complete matrix to the destination.
     *
     * @param matrix      the national matrix, must be {@link NationalMatrix.Completeness#COMPLETE}
     * @param destination target location
     * @return acknowledgement of what was written
     * @throws IllegalArgumentException if the matrix is still partial
     * @throws IOException if the destination cannot be written
     */
    SinkAck write(NationalMatrix matrix, Path destination) throws IOException;
}
