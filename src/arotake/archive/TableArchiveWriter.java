/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake.archive;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.zip.GZIPOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import arotake.BatchRecord;
import arotake.BatchResult;

/**
 * Writes the batch tables to the stage and lev0 directories and compresses
 * the archived FITS files:
 * <ul>
 * <li>stage/dep_dqa&lt;INSTR&gt;.txt, the paths of the files that passed;</li>
 * <li>lev0/&lt;date&gt;.filelist.table, input name and identifier per file;</li>
 * <li>lev0/&lt;date&gt;.metadata.table, the metadata keywords per file;</li>
 * <li>lev0/&lt;date&gt;.FITS.md5sum.table and .JPEG.md5sum.table;</li>
 * </ul>
 * after which each lev0 .fits file is replaced by a .fits.gz file.
 */
public class TableArchiveWriter implements ArchiveWriter {

    private static final Logger logger = LoggerFactory.getLogger(TableArchiveWriter.class);

    static final String FITS_SUFFIX = ".fits";
    static final String JPEG_SUFFIX = ".jpg";
    static final String GZIP_SUFFIX = ".gz";

    private static final int BUFFER_SIZE = 64 * 1024;

    public void write(BatchResult result, ArchiveLayout layout) throws IOException {
        Path lev0 = layout.getLevel0Directory();
        Files.createDirectories(lev0);
        Files.createDirectories(layout.getStageDirectory());
        String date = layout.getDateText();

        writePassedList(result, layout.getPassedList());
        writeFileList(result, lev0.resolve(date + ".filelist.table"));
        writeMetadataTable(result, lev0.resolve(date + ".metadata.table"));
        writeChecksumTable(lev0, FITS_SUFFIX, lev0.resolve(date + ".FITS.md5sum.table"));
        writeChecksumTable(lev0, JPEG_SUFFIX, lev0.resolve(date + ".JPEG.md5sum.table"));
        compressFitsFiles(lev0);
    }

    void writePassedList(BatchResult result, Path target) throws IOException {
        BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
        try {
            for (BatchRecord record : result.getRecords()) {
                writer.write(record.getInputPath().toString());
                writer.newLine();
            }
        } finally {
            writer.close();
        }
        logger.info("{} files passed, listed in {}", result.getPassedCount(), target);
    }

    void writeFileList(BatchResult result, Path target) throws IOException {
        BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
        try {
            for (BatchRecord record : result.getRecords()) {
                writer.write(record.getInputPath().getFileName() + " " + record.getIdentifier());
                writer.newLine();
            }
            writer.write("    " + result.getPassedCount() + " Total FITS files");
            writer.newLine();
        } finally {
            writer.close();
        }
    }

    /**
     * Writes a pipe-delimited table with a header row of keyword names and
     * one row per archived file. Missing values are written as "null".
     */
    void writeMetadataTable(BatchResult result, Path target) throws IOException {
        List<String> keywords = result.getMetadataKeywords();
        BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
        try {
            StringBuilder line = new StringBuilder("|");
            for (String keyword : keywords) {
                line.append(keyword).append('|');
            }
            writer.write(line.toString());
            writer.newLine();

            for (BatchRecord record : result.getRecords()) {
                Map<String, Object> values = result.getMetadata(record.getIdentifier());
                line = new StringBuilder("|");
                for (String keyword : keywords) {
                    Object value = (values == null) ? null : values.get(keyword);
                    line.append(value == null ? "null" : clean(value.toString())).append('|');
                }
                writer.write(line.toString());
                writer.newLine();
            }
        } finally {
            writer.close();
        }
        logger.info("Wrote metadata for {} files to {}", result.getPassedCount(), target);
    }

    private static String clean(String value) {
        return value.replace('|', '/').replace('\n', ' ').trim();
    }

    /**
     * Writes "md5  filename" for every file in the directory with the given
     * suffix, in name order.
     */
    void writeChecksumTable(Path directory, String suffix, Path target) throws IOException {
        List<Path> files = listFiles(directory, suffix);
        BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
        try {
            for (Path file : files) {
                writer.write(md5(file) + "  " + file.getFileName());
                writer.newLine();
            }
        } finally {
            writer.close();
        }
        logger.info("Wrote {} checksums to {}", files.size(), target);
    }

    /**
     * Returns the hex MD5 digest of a file.
     */
    static String md5(Path file) throws IOException {
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("MD5 is not available", ex);
        }

        InputStream in = Files.newInputStream(file);
        try {
            byte[] buffer = new byte[BUFFER_SIZE];
            int count;
            while ((count = in.read(buffer)) > 0) {
                digest.update(buffer, 0, count);
            }
        } finally {
            in.close();
        }

        StringBuilder hex = new StringBuilder();
        for (byte b : digest.digest()) {
            hex.append(String.format("%02x", b & 0xff));
        }
        return hex.toString();
    }

    void compressFitsFiles(Path directory) throws IOException {
        List<Path> files = listFiles(directory, FITS_SUFFIX);
        for (Path file : files) {
            Path compressed = file.resolveSibling(file.getFileName() + GZIP_SUFFIX);
            InputStream in = Files.newInputStream(file);
            try {
                OutputStream out = new GZIPOutputStream(Files.newOutputStream(compressed), BUFFER_SIZE);
                try {
                    byte[] buffer = new byte[BUFFER_SIZE];
                    int count;
                    while ((count = in.read(buffer)) > 0) {
                        out.write(buffer, 0, count);
                    }
                } finally {
                    out.close();
                }
            } finally {
                in.close();
            }
            Files.delete(file);
        }
        logger.info("Compressed {} FITS files in {}", files.size(), directory);
    }

    static List<Path> listFiles(Path directory, String suffix) throws IOException {
        List<Path> files = new ArrayList<Path>();
        DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + suffix);
        try {
            for (Path file : stream) {
                if (Files.isRegularFile(file)) {
                    files.add(file);
                }
            }
        } finally {
            stream.close();
        }
        Collections.sort(files);
        return files;
    }
}
