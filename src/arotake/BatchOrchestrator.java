/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

import java.awt.image.BufferedImage;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.text.SimpleDateFormat;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TimeZone;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import arotake.archive.ArchiveLayout;
import arotake.archive.ArchiveWriter;
import arotake.archive.DirectoryQuarantineSink;
import arotake.archive.LoggingStatusUpdater;
import arotake.archive.ProgramInfo;
import arotake.archive.ProgramLookup;
import arotake.archive.ProgramTableLookup;
import arotake.archive.QuarantineSink;
import arotake.archive.StatusUpdater;
import arotake.archive.TableArchiveWriter;
import arotake.instrument.InstrumentProfile;

/**
 * Assesses every file listed for one night of one instrument. Files are
 * processed one at a time in the order they are listed; a file that fails
 * any check is quarantined and the batch moves on. Once every file has been
 * seen the results are handed to the archive writer and, when enabled, the
 * tracking database is updated.
 */
public class BatchOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(BatchOrchestrator.class);

    /**
     * Program ids that are never reported for notification.
     */
    static final Set<String> UNREPORTED_PROGRAMS = new HashSet<String>();

    static {
        UNREPORTED_PROGRAMS.add("NONE");
        UNREPORTED_PROGRAMS.add("null");
        UNREPORTED_PROGRAMS.add("ENG");
        UNREPORTED_PROGRAMS.add("");
    }

    private static final Pattern STORAGE_PARTITION = Pattern.compile("^/sdata(.*?)/", Pattern.CASE_INSENSITIVE);

    private final InstrumentProfile profile;
    private final ArchiveLayout layout;
    private final Settings settings;
    private final FitsFiles fitsFiles;
    private final ProgramLookup programLookup;
    private final QuarantineSink quarantineSink;
    private final ArchiveWriter archiveWriter;
    private final StatusUpdater statusUpdater;

    private final ValidationPipeline pipeline = new ValidationPipeline();
    private final MosaicReconstructor reconstructor = new MosaicReconstructor();
    private final PreviewImageFactory imageFactory = new PreviewImageFactory();

    /**
     * Creates an orchestrator that works entirely within the local
     * directory tree.
     */
    public BatchOrchestrator(InstrumentProfile profile, ArchiveLayout layout, Settings settings) {
        this(profile, layout, settings, new FitsFiles(), new ProgramTableLookup(),
                new DirectoryQuarantineSink(layout.getQuarantineDirectory()), new TableArchiveWriter(),
                new LoggingStatusUpdater());
    }

    public BatchOrchestrator(InstrumentProfile profile, ArchiveLayout layout, Settings settings, FitsFiles fitsFiles,
            ProgramLookup programLookup, QuarantineSink quarantineSink, ArchiveWriter archiveWriter,
            StatusUpdater statusUpdater) {
        if (profile == null || layout == null || settings == null) {
            throw new IllegalArgumentException("A batch needs an instrument profile, a layout and settings.");
        }
        if (fitsFiles == null || programLookup == null || quarantineSink == null || archiveWriter == null
                || statusUpdater == null) {
            throw new IllegalArgumentException("A batch needs all of its collaborators.");
        }
        this.profile = profile;
        this.layout = layout;
        this.settings = settings;
        this.fitsFiles = fitsFiles;
        this.programLookup = programLookup;
        this.quarantineSink = quarantineSink;
        this.archiveWriter = archiveWriter;
        this.statusUpdater = statusUpdater;
    }

    //****************************************************************************
    /**
     * Processes the batch.
     *
     * @return the files that passed and those that were quarantined.
     * @throws BatchSetupException if the list of files to process is missing
     *         or cannot be read. The empty list of passed files is written
     *         first.
     * @throws IOException if the archive tables cannot be written.
     */
    public BatchResult run() throws BatchSetupException, IOException {
        LocalDate date = layout.getDate();
        Path manifest = layout.getManifest();
        logger.info("Assessing {} data for {}", profile.getName(), date);

        if (!Files.exists(manifest)) {
            writeEmptyPassedList();
            throw new BatchSetupException("The list of files to process (" + manifest + ") does not exist.");
        }

        List<Path> files;
        try {
            layout.createDirectories();
            files = readManifest(manifest);
        } catch (IOException ex) {
            writeEmptyPassedList();
            throw new BatchSetupException("Unable to prepare the batch from " + manifest, ex);
        }

        BatchResult result = new BatchResult(profile.getName(), date, profile.getMetadataKeywords());
        if (files.isEmpty()) {
            notifyZeroFiles();
            return result;
        }

        BatchContext batch = new BatchContext(profile.getName(), date, settings.getDqaVersion());
        Map<String, ProgramInfo> programs;
        try {
            programs = programLookup.lookup(layout, files);
        } catch (IOException ex) {
            logger.warn("Unable to look up program information, all files will have program NONE", ex);
            programs = new LinkedHashMap<String, ProgramInfo>();
        }
        batch.setPrograms(programs);
        result.setPrincipalInvestigators(joinPrincipalInvestigators(programs.values()));
        result.setStoragePartitions(joinStoragePartitions(programs.values()));

        profile.prepareBatch(files, fitsFiles, batch);

        String endTime = settings.getEndTime() != null ? settings.getEndTime() : profile.getEndOfNightTime();
        IdentifierValidator validator = new IdentifierValidator(date, endTime);
        Set<String> seen = new HashSet<String>();

        logger.info("Processing {} files", files.size());
        for (Path file : files) {
            process(file, batch, validator, seen, result);
        }

        if (result.isEmpty()) {
            notifyZeroFiles();
            return result;
        }

        logger.info("{} files passed, {} quarantined", result.getPassedCount(), result.getQuarantined().size());
        archiveWriter.write(result, layout);

        if (settings.isStatusUpdates()) {
            reportStatus(result);
        }
        logger.info("Assessment complete for {} {}", profile.getName(), date);
        return result;
    }

    /**
     * Reads the manifest: one path per line, blank lines ignored.
     */
    static List<Path> readManifest(Path manifest) throws IOException {
        List<Path> files = new ArrayList<Path>();
        BufferedReader reader = Files.newBufferedReader(manifest, StandardCharsets.UTF_8);
        try {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.trim().length() > 0) {
                    files.add(Paths.get(line.trim()));
                }
            }
        } finally {
            reader.close();
        }
        return files;
    }

    //****************************************************************************
    // Takes one file through validation and output, or into quarantine.
    void process(Path file, BatchContext batch, IdentifierValidator validator, Set<String> seen, BatchResult result) {
        logger.info("Input file {}", file);

        Exposure exposure;
        try {
            exposure = fitsFiles.load(file);
        } catch (IOException ex) {
            logger.error("Unable to read {}: {}", file, ex.getMessage());
            quarantine(file, QuarantineReason.UNREADABLE, ex.getMessage(), result);
            return;
        }

        StepContext context = new StepContext(exposure, profile, batch);
        if (!pipeline.run(profile, context)) {
            quarantine(file, QuarantineReason.STEP_FAILURE, context.getFailedStep(), result);
            return;
        }

        String identifier = exposure.getIdentifier();
        IdentifierValidator.Outcome outcome = validator.check(identifier, seen);
        switch (outcome) {
            case VALID:
                break;
            case DUPLICATE:
                logger.error("Duplicate identifier {} found for {}", identifier, file);
                quarantine(file, QuarantineReason.DUPLICATE_IDENTIFIER, identifier, result);
                return;
            case OUT_OF_WINDOW:
                logger.error("Identifier {} has a bad date for {}", identifier, file);
                quarantine(file, QuarantineReason.TEMPORAL_INCONSISTENCY, identifier, result);
                return;
            default:
                logger.error("Bad identifier '{}' found for {}", identifier, file);
                quarantine(file, QuarantineReason.MISSING_IDENTIFIER, identifier, result);
                return;
        }

        Path level0 = layout.getLevel0Directory().resolve(identifier);
        try {
            fitsFiles.writeLevel0(exposure, level0);
            writePreview(exposure, previewPath(level0));
        } catch (IOException ex) {
            logger.error("Unable to write the archived copy of {}: {}", file, ex.getMessage());
            removePartialOutput(level0);
            quarantine(file, QuarantineReason.OUTPUT_FAILURE, ex.getMessage(), result);
            return;
        }

        HeaderStore header = exposure.getHeader();
        String semesterProgramId = header.getString("SEMESTER", "") + "_" + header.getString("PROGID", "");
        BatchRecord record = new BatchRecord(file, identifier, semesterProgramId, profile.isScience(header));
        result.addRecord(record, metadataRow(context));
    }

    /**
     * The preview sits next to the archived file, with .jpg in place of
     * .fits.
     */
    static Path previewPath(Path level0) {
        String name = level0.getFileName().toString();
        if (name.endsWith(ArchiveIdentifier.SUFFIX)) {
            name = name.substring(0, name.length() - ArchiveIdentifier.SUFFIX.length());
        }
        return level0.resolveSibling(name + ".jpg");
    }

    void writePreview(Exposure exposure, Path target) throws IOException {
        BufferedImage image = null;
        if (profile.usesMosaicPreview(exposure)) {
            try {
                OverscanRegion overscan = OverscanRegion.fromHeader(exposure.getHeader());
                double[][] mosaic = reconstructor.reconstruct(exposure.getSegments(), overscan, new IntensityBounds());
                image = imageFactory.renderNormalised(mosaic);
            } catch (GeometryParseException ex) {
                logger.warn("{}: cannot reconstruct the mosaic ({}), using the first image",
                        exposure.getFileName(), ex.getMessage());
            } catch (IllegalArgumentException ex) {
                logger.warn("{}: cannot reconstruct the mosaic ({}), using the first image",
                        exposure.getFileName(), ex.getMessage());
            }
        }

        if (image == null) {
            try {
                image = imageFactory.renderSingleFrame(exposure);
            } catch (IllegalArgumentException ex) {
                throw new IOException("Unable to render a preview of " + exposure.getFileName(), ex);
            }
        }
        imageFactory.writeJpeg(image, target);
    }

    private void removePartialOutput(Path level0) {
        try {
            Files.deleteIfExists(level0);
            Files.deleteIfExists(previewPath(level0));
        } catch (IOException ex) {
            logger.warn("Unable to remove partial output {}", level0, ex);
        }
    }

    private void quarantine(Path file, QuarantineReason reason, String detail, BatchResult result) {
        result.addQuarantined(file, reason, detail);
        try {
            quarantineSink.quarantine(file, reason);
        } catch (IOException ex) {
            logger.error("Unable to quarantine {}", file, ex);
        }
    }

    /**
     * The values of the metadata keywords, with values that are not written
     * to the header taken from the step context.
     */
    Map<String, Object> metadataRow(StepContext context) {
        Map<String, Object> row = context.getHeader().select(profile.getMetadataKeywords());
        for (Map.Entry<String, Object> entry : context.getAuxiliaryMetadata().entrySet()) {
            if (row.containsKey(entry.getKey())) {
                row.put(entry.getKey(), entry.getValue());
            }
        }
        return row;
    }

    //****************************************************************************
    // Writes the empty list of passed files and reports the night as done.
    private void notifyZeroFiles() {
        logger.info("0 files output from assessment");
        writeEmptyPassedList();
        if (settings.isStatusUpdates()) {
            updateStatus("arch_stat", "DONE");
            updateStatus("arch_time", utcTimestamp());
        }
    }

    private void writeEmptyPassedList() {
        Path passed = layout.getPassedList();
        try {
            Files.createDirectories(passed.getParent());
            if (!Files.exists(passed)) {
                Files.createFile(passed);
            }
        } catch (IOException ex) {
            logger.error("Unable to create {}", passed, ex);
        }
    }

    private void reportStatus(BatchResult result) {
        logger.info("Updating the tracking database");
        updateStatus("files_arch", String.valueOf(result.getPassedCount()));
        updateStatus("pi", result.getPrincipalInvestigators());
        updateStatus("sdata", result.getStoragePartitions());
        updateStatus("sci_files", String.valueOf(result.getScienceCount()));
        updateStatus("arch_stat", "DONE");
        updateStatus("arch_time", utcTimestamp());
        updateStatus("size", directorySize(layout.getLevel0Directory()));

        Set<String> reported = reportablePrograms(result.getSemesterProgramIds());
        try {
            if (!statusUpdater.notifyPrograms(profile.getName(), date(), reported)) {
                logger.warn("Program notification failed for {}", reported);
            }
        } catch (RuntimeException ex) {
            logger.warn("Program notification failed for {}", reported, ex);
        }
    }

    private void updateStatus(String column, String value) {
        try {
            if (!statusUpdater.update(profile.getName(), date(), column, value)) {
                logger.warn("Status update of {} to '{}' failed", column, value);
            }
        } catch (RuntimeException ex) {
            logger.warn("Status update of {} to '{}' failed", column, value, ex);
        }
    }

    private String date() {
        return layout.getDate().toString();
    }

    /**
     * Drops the semester_progid values whose program is not a real one.
     */
    static Set<String> reportablePrograms(Collection<String> semesterProgramIds) {
        Set<String> reported = new LinkedHashSet<String>();
        for (String semid : semesterProgramIds) {
            if (semid == null) {
                continue;
            }
            int split = semid.indexOf('_');
            if (split < 1) {
                continue;
            }
            String programId = semid.substring(split + 1);
            if (!UNREPORTED_PROGRAMS.contains(programId)) {
                reported.add(semid);
            }
        }
        return reported;
    }

    /**
     * The distinct principal investigators of the programs, '/' separated.
     */
    static String joinPrincipalInvestigators(Collection<ProgramInfo> programs) {
        Set<String> names = new LinkedHashSet<String>();
        for (ProgramInfo info : programs) {
            if (info.getPrincipalInvestigator() != null) {
                names.add(info.getPrincipalInvestigator());
            }
        }
        return join(names);
    }

    /**
     * The distinct storage partitions (the N of /sdataN/) of the program
     * files, '/' separated.
     */
    static String joinStoragePartitions(Collection<ProgramInfo> programs) {
        Set<String> partitions = new LinkedHashSet<String>();
        for (ProgramInfo info : programs) {
            Matcher matcher = STORAGE_PARTITION.matcher(info.getFile() == null ? "" : info.getFile());
            if (matcher.find()) {
                partitions.add(matcher.group(1));
            }
        }
        return join(partitions);
    }

    private static String join(Collection<String> items) {
        StringBuilder text = new StringBuilder();
        for (String item : items) {
            if (text.length() > 0) {
                text.append('/');
            }
            text.append(item);
        }
        return text.toString();
    }

    private static String utcTimestamp() {
        SimpleDateFormat formatter = new SimpleDateFormat("yyyyMMdd HH:mm");
        formatter.setTimeZone(TimeZone.getTimeZone("UTC"));
        return formatter.format(new Date());
    }

    // Size of the files in a directory, in megabytes.
    private static String directorySize(Path directory) {
        long bytes = 0;
        try {
            DirectoryStream<Path> stream = Files.newDirectoryStream(directory);
            try {
                for (Path file : stream) {
                    if (Files.isRegularFile(file)) {
                        bytes += Files.size(file);
                    }
                }
            } finally {
                stream.close();
            }
        } catch (IOException ex) {
            logger.warn("Unable to measure {}", directory, ex);
        }
        return String.format(Locale.ROOT, "%.3f", bytes / 1.0e6);
    }
}
