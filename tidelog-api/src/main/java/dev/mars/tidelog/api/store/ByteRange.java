/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.tidelog.api.store;

/**
 * A contiguous byte range inside an object: {@code length} bytes starting at
 * {@code offset}.
 *
 * @param offset zero-based start offset
 * @param length number of bytes, may be zero
 */
public record ByteRange(long offset, long length) {

    public ByteRange {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must be non-negative: " + offset);
        }
        if (length < 0) {
            throw new IllegalArgumentException("Length must be non-negative: " + length);
        }
    }

    public static ByteRange of(long offset, long length) {
        return new ByteRange(offset, length);
    }

    /**
     * Range covering an entire object of the given size.
     */
    public static ByteRange whole(long size) {
        return new ByteRange(0, size);
    }

    /**
     * @return offset one past the last byte of the range
     */
    public long end() {
        return offset + length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    /**
     * Checks that this range lies inside {@code other}.
     */
    public boolean within(ByteRange other) {
        return offset >= other.offset && end() <= other.end();
    }

    /**
     * Range expressed relative to the start of {@code base}, which must contain it.
     */
    public ByteRange relativeTo(ByteRange base) {
        if (!within(base)) {
            throw new IllegalArgumentException(this + " is not within " + base);
        }
        return new ByteRange(offset - base.offset, length);
    }

    /**
     * Copies the bytes of this range out of {@code data}, which starts at
     * offset zero. Returns fewer bytes when {@code data} is shorter.
     */
    public byte[] slice(byte[] data) {
        if (offset >= data.length) {
            return new byte[0];
        }
        int from = (int) offset;
        int to = (int) Math.min(end(), data.length);
        byte[] out = new byte[to - from];
        System.arraycopy(data, from, out, 0, out.length);
        return out;
    }

    @Override
    public String toString() {
        return "[" + offset + ", " + end() + ")";
    }
}
