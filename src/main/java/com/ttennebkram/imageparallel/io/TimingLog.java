package com.ttennebkram.imageparallel.io;

import java.io.IOException;

/**
 * Append-only sink for timing records. Records keep insertion order.
 */
public interface TimingLog {

    void append(TimingRecord record) throws IOException;
}
