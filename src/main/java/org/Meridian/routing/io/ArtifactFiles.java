package org.Meridian.routing.io;

import com.google.flatbuffers.FlatBufferBuilder;
import lombok.experimental.UtilityClass;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Gzip-compressed FlatBuffers artifact helpers shared by graph and hierarchy persistence.
 */
@UtilityClass
public final class ArtifactFiles {

    /**
     * Writes a finished FlatBuffers payload through gzip, creating parent directories.
     */
    public static void writeCompressed(Path path, byte[] payload) throws IOException {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(payload, "payload");
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (OutputStream out = new GZIPOutputStream(new BufferedOutputStream(Files.newOutputStream(path)))) {
            out.write(payload);
        }
    }

    /**
     * Reads and inflates an artifact into a little-endian buffer.
     */
    public static ByteBuffer readCompressed(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        try (InputStream in = new GZIPInputStream(new BufferedInputStream(Files.newInputStream(path)))) {
            return ByteBuffer.wrap(in.readAllBytes()).order(ByteOrder.LITTLE_ENDIAN);
        }
    }

    public static int createIntVector(FlatBufferBuilder builder, int[] values) {
        builder.startVector(Integer.BYTES, values.length, Integer.BYTES);
        for (int i = values.length - 1; i >= 0; i--) {
            builder.addInt(values[i]);
        }
        return builder.endVector();
    }

    public static int createDoubleVector(FlatBufferBuilder builder, double[] values) {
        builder.startVector(Double.BYTES, values.length, Double.BYTES);
        for (int i = values.length - 1; i >= 0; i--) {
            builder.addDouble(values[i]);
        }
        return builder.endVector();
    }
}
