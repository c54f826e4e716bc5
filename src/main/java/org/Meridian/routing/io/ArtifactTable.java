package org.Meridian.routing.io;

import com.google.flatbuffers.Table;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.DoubleBuffer;
import java.nio.IntBuffer;

/**
 * Root table of a persisted artifact, read by field slot.
 * <p>
 * Field resolution, vector and string access all go through {@link Table}; slot {@code i}
 * is vtable offset {@code 4 + 2 * i}, the layout {@link com.google.flatbuffers.FlatBufferBuilder}
 * writes for {@code addX(i, ...)}. Vectors are copied out, so the table may be dropped once
 * decoded.
 */
public final class ArtifactTable extends Table {

    private ArtifactTable() {
    }

    /**
     * Checks the file identifier and opens the root table of a finished buffer.
     *
     * @param artifactName name used in error messages.
     * @throws IllegalArgumentException when the buffer is too small or carries another identifier.
     */
    public static ArtifactTable root(ByteBuffer buffer, String identifier, String artifactName) {
        if (buffer == null) {
            throw new IllegalArgumentException("Buffer cannot be null");
        }
        ByteBuffer bb = buffer.slice().order(ByteOrder.LITTLE_ENDIAN);
        if (bb.remaining() < 8) {
            throw new IllegalArgumentException("Buffer too small for " + artifactName + " header");
        }
        if (!__has_identifier(bb, identifier)) {
            throw new IllegalArgumentException(String.format(
                    "Invalid file identifier for %s. Expected '%s', got 0x%08X",
                    artifactName, identifier, bb.getInt(4)));
        }
        int rootPosition = bb.getInt(0);
        if (rootPosition < 8 || rootPosition > bb.limit() - 4) {
            throw new IllegalArgumentException("Root table offset out of bounds: " + rootPosition);
        }
        ArtifactTable table = new ArtifactTable();
        table.__reset(rootPosition, bb);
        return table;
    }

    private static int vtableOffset(int slot) {
        return 4 + slot * 2;
    }

    public boolean hasField(int slot) {
        return __offset(vtableOffset(slot)) != 0;
    }

    public int getInt(int slot, int defaultValue) {
        int o = __offset(vtableOffset(slot));
        return o != 0 ? bb.getInt(o + bb_pos) : defaultValue;
    }

    public long getLong(int slot, long defaultValue) {
        int o = __offset(vtableOffset(slot));
        return o != 0 ? bb.getLong(o + bb_pos) : defaultValue;
    }

    public double getDouble(int slot, double defaultValue) {
        int o = __offset(vtableOffset(slot));
        return o != 0 ? bb.getDouble(o + bb_pos) : defaultValue;
    }

    /**
     * @return the string in {@code slot}, or {@code null} when absent.
     */
    public String getString(int slot) {
        int o = __offset(vtableOffset(slot));
        return o != 0 ? __string(o + bb_pos) : null;
    }

    /**
     * @return a copy of the int vector in {@code slot}, or {@code null} when absent.
     */
    public int[] getIntVector(int slot) {
        ByteBuffer vector = __vector_as_bytebuffer(vtableOffset(slot), Integer.BYTES);
        if (vector == null) {
            return null;
        }
        IntBuffer ints = vector.order(ByteOrder.LITTLE_ENDIAN).asIntBuffer();
        int[] values = new int[ints.remaining()];
        ints.get(values);
        return values;
    }

    /**
     * @return a copy of the double vector in {@code slot}, or {@code null} when absent.
     */
    public double[] getDoubleVector(int slot) {
        ByteBuffer vector = __vector_as_bytebuffer(vtableOffset(slot), Double.BYTES);
        if (vector == null) {
            return null;
        }
        DoubleBuffer doubles = vector.order(ByteOrder.LITTLE_ENDIAN).asDoubleBuffer();
        double[] values = new double[doubles.remaining()];
        doubles.get(values);
        return values;
    }
}
