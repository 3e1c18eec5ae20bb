package io.planduck.commons.output;

/**
 * Payload delivered for a finished job: compressed bytes, the path of a spilled file, or nothing.
 */
public interface JobOutput {

    /**
     * Bytes delivered inline, or written to disk when spilled.
     */
    long size();

    record Inline(byte[] bytes) implements JobOutput {
        @Override
        public long size() {
            return bytes.length;
        }
    }

    record Spilled(String path, long size) implements JobOutput {
    }

    record Empty() implements JobOutput {
        @Override
        public long size() {
            return 0;
        }
    }

    Empty EMPTY = new Empty();
}
