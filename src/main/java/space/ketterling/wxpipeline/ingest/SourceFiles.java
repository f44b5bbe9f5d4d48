/*
* Copyright 2025 Taylor Ketterling
* Watch-directory helpers for the wx-pipeline station ingest.
*/
package space.ketterling.wxpipeline.ingest;

import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Finds station files in the watch directory and opens them for reading.
 *
 * <p>
 * A station file is named {@code <stationId><suffix>}, optionally gzip
 * compressed as {@code <stationId><suffix>.gz}.
 * </p>
 */
public final class SourceFiles {
    private static final Logger log = LoggerFactory.getLogger(SourceFiles.class);
    static final String GZIP_SUFFIX = ".gz";

    private SourceFiles() {
    }

    /**
     * Regular files in {@code dir} with the expected suffix, sorted by name. A
     * missing directory yields an empty list.
     */
    public static List<Path> discover(Path dir, String suffix) throws IOException {
        if (!Files.isDirectory(dir)) {
            log.warn("Watch directory {} does not exist; nothing to sweep", dir);
            return List.of();
        }
        try (Stream<Path> stream = Files.list(dir)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> matches(p.getFileName().toString(), suffix))
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .toList();
        }
    }

    static boolean matches(String fileName, String suffix) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        String s = suffix.toLowerCase(Locale.ROOT);
        return stemLength(lower, s) > 0;
    }

    /**
     * The station id: the file name without its suffix (and {@code .gz}).
     */
    public static String stationId(Path file, String suffix) {
        String name = file.getFileName().toString();
        int n = stemLength(name.toLowerCase(Locale.ROOT), suffix.toLowerCase(Locale.ROOT));
        if (n <= 0)
            throw new IllegalArgumentException("not a station file: " + name);
        return name.substring(0, n);
    }

    private static int stemLength(String lowerName, String lowerSuffix) {
        if (lowerName.endsWith(lowerSuffix + GZIP_SUFFIX))
            return lowerName.length() - lowerSuffix.length() - GZIP_SUFFIX.length();
        if (lowerName.endsWith(lowerSuffix))
            return lowerName.length() - lowerSuffix.length();
        return -1;
    }

    /**
     * Opens the file as UTF-8 text, decompressing gzip files on the fly.
     */
    public static BufferedReader openReader(Path file) throws IOException {
        InputStream in = new BufferedInputStream(Files.newInputStream(file));
        try {
            if (file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(GZIP_SUFFIX))
                in = new GzipCompressorInputStream(in);
        } catch (IOException e) {
            in.close();
            throw e;
        }
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }
}
