/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import static org.junit.Assert.*;

import arotake.archive.ArchiveLayout;
import arotake.archive.ArchiveWriter;
import arotake.archive.DirectoryQuarantineSink;
import arotake.archive.ProgramInfo;
import arotake.archive.ProgramTableLookup;
import arotake.archive.StatusUpdater;
import arotake.instrument.DeimosProfile;
import arotake.instrument.MosfireProfile;

/**
 * Unit tests for the BatchOrchestrator class.
 */
public class BatchOrchestratorTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private Path raw;
    private ArchiveLayout layout;
    private Settings settings;

    // Remembers every status update and notification.
    private static class RecordingStatusUpdater implements StatusUpdater {

        final Map<String, String> updates = new LinkedHashMap<String, String>();
        final List<Set<String>> notifications = new ArrayList<Set<String>>();

        public boolean update(String instrument, String date, String column, String value) {
            updates.put(column, value);
            return true;
        }

        public boolean notifyPrograms(String instrument, String date, Set<String> semesterProgramIds) {
            notifications.add(semesterProgramIds);
            return true;
        }
    }

    private static class CountingArchiveWriter implements ArchiveWriter {

        int calls = 0;

        public void write(BatchResult result, ArchiveLayout layout) {
            ++calls;
        }
    }

    @Before
    public void setUp() throws IOException {
        raw = folder.newFolder("raw").toPath();
        layout = new ArchiveLayout(folder.getRoot().toPath().resolve("koadata"), MosfireProfile.NAME,
                Fixtures.NIGHT);
        settings = new Settings();
    }

    private void writeManifest(Path... files) throws IOException {
        Files.createDirectories(layout.getStageDirectory());
        List<String> lines = new ArrayList<String>();
        for (Path file : files) {
            lines.add(file.toString());
        }
        Files.write(layout.getManifest(), lines, StandardCharsets.UTF_8);
    }

    private BatchOrchestrator orchestrator(ArchiveWriter writer, StatusUpdater updater) {
        return new BatchOrchestrator(new MosfireProfile(), layout, settings, new FitsFiles(),
                new ProgramTableLookup(), new DirectoryQuarantineSink(layout.getQuarantineDirectory()), writer,
                updater);
    }

    private static BatchResult.Quarantined onlyQuarantined(BatchResult result) {
        assertEquals(1, result.getQuarantined().size());
        return result.getQuarantined().get(0);
    }

    /**
     * Test of run method, of class BatchOrchestrator.
     */
    @Test
    public void testValidFilesAreArchived() throws Exception {
        Path one = Fixtures.writeMosfire(raw, "m180304_0001.fits", "2018-03-04", "10:15:30.25", 1);
        Path two = Fixtures.writeMosfire(raw, "m180304_0002.fits", "2018-03-04", "10:20:00.00", 2);
        Path three = Fixtures.writeMosfire(raw, "m180304_0003.fits", "2018-03-04", "10:25:00.00", 3);
        writeManifest(one, two, three);

        BatchResult result = new BatchOrchestrator(new MosfireProfile(), layout, settings).run();

        assertEquals(3, result.getPassedCount());
        assertTrue(result.getQuarantined().isEmpty());
        assertEquals(3, result.getScienceCount());
        assertEquals("MF.20180304.101530.25.fits", result.getRecords().get(0).getIdentifier());

        List<String> passed = Files.readAllLines(layout.getPassedList(), StandardCharsets.UTF_8);
        assertEquals(Arrays.asList(one.toString(), two.toString(), three.toString()), passed);

        Path lev0 = layout.getLevel0Directory();
        assertTrue(Files.exists(lev0.resolve("MF.20180304.101530.25.fits.gz")));
        assertFalse(Files.exists(lev0.resolve("MF.20180304.101530.25.fits")));
        assertTrue(Files.exists(lev0.resolve("MF.20180304.101530.25.jpg")));
        assertTrue(Files.exists(lev0.resolve("MF.20180304.102000.00.jpg")));

        List<String> fileList = Files.readAllLines(lev0.resolve("20180304.filelist.table"), StandardCharsets.UTF_8);
        assertEquals(4, fileList.size());
        assertEquals("m180304_0001.fits MF.20180304.101530.25.fits", fileList.get(0));
        assertEquals("    3 Total FITS files", fileList.get(3));

        List<String> metadata = Files.readAllLines(lev0.resolve("20180304.metadata.table"), StandardCharsets.UTF_8);
        assertEquals(4, metadata.size());
        assertTrue(metadata.get(0).startsWith("|KOAID|OFNAME|"));
        assertTrue(metadata.get(1).startsWith("|MF.20180304.101530.25.fits|m180304_0001.fits|"));

        assertEquals(3, Files.readAllLines(lev0.resolve("20180304.FITS.md5sum.table"), StandardCharsets.UTF_8)
                .size());
        assertEquals(3, Files.readAllLines(lev0.resolve("20180304.JPEG.md5sum.table"), StandardCharsets.UTF_8)
                .size());
    }

    @Test
    public void testDuplicateIdentifierIsQuarantined() throws Exception {
        Path one = Fixtures.writeMosfire(raw, "m180304_0001.fits", "2018-03-04", "10:15:30.25", 1);
        Path two = Fixtures.writeMosfire(raw, "m180304_0002.fits", "2018-03-04", "10:15:30.25", 2);
        writeManifest(one, two);

        CountingArchiveWriter writer = new CountingArchiveWriter();
        BatchResult result = orchestrator(writer, new RecordingStatusUpdater()).run();

        assertEquals(1, result.getPassedCount());
        BatchResult.Quarantined quarantined = onlyQuarantined(result);
        assertEquals(two, quarantined.getPath());
        assertEquals(QuarantineReason.DUPLICATE_IDENTIFIER, quarantined.getReason());
        assertTrue(Files.exists(layout.getQuarantineDirectory().resolve("m180304_0002.fits")));
        assertEquals(1, writer.calls);
    }

    @Test
    public void testDistantDateBeforeEndOfNightIsQuarantined() throws Exception {
        Path early = Fixtures.writeMosfire(raw, "m180304_0001.fits", "2018-03-01", "05:00:00.00", 1);
        Path late = Fixtures.writeMosfire(raw, "m180304_0002.fits", "2018-03-01", "21:00:00.00", 2);
        Path nextDay = Fixtures.writeMosfire(raw, "m180304_0003.fits", "2018-03-05", "10:00:00.00", 3);
        writeManifest(early, late, nextDay);

        BatchResult result = orchestrator(new CountingArchiveWriter(), new RecordingStatusUpdater()).run();

        assertEquals(2, result.getPassedCount());
        BatchResult.Quarantined quarantined = onlyQuarantined(result);
        assertEquals(early, quarantined.getPath());
        assertEquals(QuarantineReason.TEMPORAL_INCONSISTENCY, quarantined.getReason());
        assertEquals("MF.20180301.050000.00.fits", quarantined.getDetail());
    }

    @Test
    public void testEndTimeSettingOverridesInstrument() throws Exception {
        // 073000.00 passes the default 20:00:00 cutoff but not 21:00:00.
        Path morning = Fixtures.writeMosfire(raw, "m180304_0001.fits", "2018-03-01", "07:30:00.00", 1);
        writeManifest(morning);
        settings.setEndTime("21:00:00");

        BatchResult result = orchestrator(new CountingArchiveWriter(), new RecordingStatusUpdater()).run();

        assertEquals(QuarantineReason.TEMPORAL_INCONSISTENCY, onlyQuarantined(result).getReason());
    }

    @Test
    public void testStepFailureIsQuarantined() throws Exception {
        HeaderStore header = Fixtures.mosfireHeader("2018-03-04", "10:15:30.25", 1);
        header.load("INSTRUME", "NIRC2", "Instrument");
        Path wrong = raw.resolve("n180304_0001.fits");
        FitsFiles.saveImage(wrong, header, Fixtures.ramp());
        Path good = Fixtures.writeMosfire(raw, "m180304_0002.fits", "2018-03-04", "10:20:00.00", 2);
        writeManifest(wrong, good);

        BatchResult result = orchestrator(new CountingArchiveWriter(), new RecordingStatusUpdater()).run();

        assertEquals(1, result.getPassedCount());
        BatchResult.Quarantined quarantined = onlyQuarantined(result);
        assertEquals(QuarantineReason.STEP_FAILURE, quarantined.getReason());
        assertEquals("check_instr", quarantined.getDetail());
        assertFalse(Files.exists(layout.getLevel0Directory().resolve("MF.20180304.101530.25.fits")));
    }

    @Test
    public void testUnreadableFileIsQuarantined() throws Exception {
        Path empty = Files.createFile(raw.resolve("m180304_0001.fits"));
        Path good = Fixtures.writeMosfire(raw, "m180304_0002.fits", "2018-03-04", "10:20:00.00", 2);
        writeManifest(empty, good);

        BatchResult result = orchestrator(new CountingArchiveWriter(), new RecordingStatusUpdater()).run();

        assertEquals(1, result.getPassedCount());
        assertEquals(QuarantineReason.UNREADABLE, onlyQuarantined(result).getReason());
        assertTrue(Files.exists(layout.getQuarantineDirectory().resolve("m180304_0001.fits")));
    }

    @Test
    public void testMissingManifest() throws IOException {
        try {
            orchestrator(new CountingArchiveWriter(), new RecordingStatusUpdater()).run();
            fail("A missing manifest should stop the batch.");
        } catch (BatchSetupException ex) {
            // expected
        }
        assertTrue(Files.exists(layout.getPassedList()));
        assertEquals(0, Files.size(layout.getPassedList()));
    }

    @Test
    public void testUnreadableManifest() throws IOException {
        Files.createDirectories(layout.getManifest());
        try {
            orchestrator(new CountingArchiveWriter(), new RecordingStatusUpdater()).run();
            fail("An unreadable manifest should stop the batch.");
        } catch (BatchSetupException ex) {
            assertNotNull(ex.getCause());
        }
        assertTrue(Files.exists(layout.getPassedList()));
        assertEquals(0, Files.size(layout.getPassedList()));
    }

    @Test
    public void testEmptyManifestReportsZeroFiles() throws Exception {
        writeManifest();
        settings.setStatusUpdates(true);
        CountingArchiveWriter writer = new CountingArchiveWriter();
        RecordingStatusUpdater updater = new RecordingStatusUpdater();

        BatchResult result = orchestrator(writer, updater).run();

        assertTrue(result.isEmpty());
        assertEquals(0, writer.calls);
        assertTrue(Files.exists(layout.getPassedList()));
        assertEquals(2, updater.updates.size());
        assertEquals("DONE", updater.updates.get("arch_stat"));
        assertTrue(updater.updates.containsKey("arch_time"));
        assertTrue(updater.notifications.isEmpty());
    }

    @Test
    public void testNothingPassedReportsZeroFiles() throws Exception {
        Path empty = Files.createFile(raw.resolve("m180304_0001.fits"));
        writeManifest(empty);
        CountingArchiveWriter writer = new CountingArchiveWriter();

        BatchResult result = orchestrator(writer, new RecordingStatusUpdater()).run();

        assertTrue(result.isEmpty());
        assertEquals(1, result.getQuarantined().size());
        assertEquals(0, writer.calls);
        assertTrue(Files.exists(layout.getPassedList()));
    }

    @Test
    public void testStatusUpdatesAfterArchiving() throws Exception {
        Path one = Fixtures.writeMosfire(raw, "m180304_0001.fits", "2018-03-04", "10:15:30.25", 1);
        Path two = Fixtures.writeMosfire(raw, "m180304_0002.fits", "2018-03-04", "10:20:00.00", 2);
        Path three = Fixtures.writeMosfire(raw, "m180304_0003.fits", "2018-03-04", "10:25:00.00", 3);
        writeManifest(one, two, three);
        Files.write(layout.getStageDirectory().resolve(ProgramTableLookup.TABLE_NAME), Arrays.asList(
                one + "\t2018A\tC123\tCIT\tSmith\tGalaxies\t18",
                two + "\t2018A\tENG\tKECK\tStaff\tEngineering\t0"), StandardCharsets.UTF_8);
        settings.setStatusUpdates(true);
        CountingArchiveWriter writer = new CountingArchiveWriter();
        RecordingStatusUpdater updater = new RecordingStatusUpdater();

        BatchResult result = orchestrator(writer, updater).run();

        assertEquals(3, result.getPassedCount());
        assertEquals(1, writer.calls);
        assertEquals("C123", result.getMetadata("MF.20180304.101530.25.fits").get("PROGID"));
        assertEquals(Long.valueOf(18), Long.valueOf(((Number) result.getMetadata("MF.20180304.101530.25.fits")
                .get("PROPINT")).longValue()));
        assertEquals("NONE", result.getMetadata("MF.20180304.102500.00.fits").get("PROGID"));

        assertEquals(7, updater.updates.size());
        assertEquals("3", updater.updates.get("files_arch"));
        assertEquals("Smith/Staff", updater.updates.get("pi"));
        assertEquals("", updater.updates.get("sdata"));
        assertEquals("3", updater.updates.get("sci_files"));
        assertEquals("DONE", updater.updates.get("arch_stat"));
        assertTrue(updater.updates.get("size").matches("\\d+\\.\\d{3}"));

        assertEquals(1, updater.notifications.size());
        assertEquals(1, updater.notifications.get(0).size());
        assertTrue(updater.notifications.get(0).contains("2018A_C123"));
    }

    @Test
    public void testNoStatusUpdatesWhenDisabled() throws Exception {
        Path one = Fixtures.writeMosfire(raw, "m180304_0001.fits", "2018-03-04", "10:15:30.25", 1);
        writeManifest(one);
        RecordingStatusUpdater updater = new RecordingStatusUpdater();

        orchestrator(new CountingArchiveWriter(), updater).run();

        assertTrue(updater.updates.isEmpty());
        assertTrue(updater.notifications.isEmpty());
    }

    /**
     * Test of writePreview method, of class BatchOrchestrator.
     */
    @Test
    public void testPreviewFallsBackWithoutDetectorSections() throws IOException {
        HeaderStore header = new HeaderStore();
        header.load("INSTRUME", "DEIMOS: real science mosaic CCD subsystem", null);
        Exposure exposure = new Exposure(raw.resolve("d0304_0001.fits"), header);
        exposure.addSegment(new Segment(Fixtures.ramp(), new HeaderStore(), 1));
        exposure.addSegment(new Segment(Fixtures.ramp(), new HeaderStore(), 2));

        ArchiveLayout deimosLayout = new ArchiveLayout(folder.getRoot().toPath(), DeimosProfile.NAME,
                Fixtures.NIGHT);
        BatchOrchestrator orchestrator = new BatchOrchestrator(new DeimosProfile(), deimosLayout, settings);
        Path target = raw.resolve("preview.jpg");

        orchestrator.writePreview(exposure, target);

        assertTrue(Files.exists(target));
    }

    @Test
    public void testPreviewPath() {
        assertEquals(Paths.get("/lev0/MF.20180304.101530.25.jpg"),
                BatchOrchestrator.previewPath(Paths.get("/lev0/MF.20180304.101530.25.fits")));
    }

    @Test
    public void testReportablePrograms() {
        Set<String> reported = BatchOrchestrator.reportablePrograms(Arrays.asList("2018A_C123", "2018A_NONE",
                "2018A_ENG", "2018A_null", "2018A_", "2018A_C123", "2018B_U045", null));
        assertEquals(2, reported.size());
        assertTrue(reported.contains("2018A_C123"));
        assertTrue(reported.contains("2018B_U045"));
    }

    @Test
    public void testJoinStoragePartitionsAndInvestigators() {
        List<ProgramInfo> programs = Arrays.asList(
                new ProgramInfo("/sdata1300/mosfire1/m1.fits", "2018A", "C123", "CIT", "Smith", "A", 18),
                new ProgramInfo("/SDATA1301/mosfire1/m2.fits", "2018A", "C123", "CIT", "Smith", "A", 18),
                new ProgramInfo("/home/m3.fits", "2018A", "U045", "UC", "Jones", "B", 12));

        assertEquals("1300/1301", BatchOrchestrator.joinStoragePartitions(programs));
        assertEquals("Smith/Jones", BatchOrchestrator.joinPrincipalInvestigators(programs));
    }

    @Test
    public void testReadManifestSkipsBlankLines() throws IOException {
        Path manifest = raw.resolve("manifest.txt");
        Files.write(manifest, Arrays.asList("/a/one.fits", "", "  /a/two.fits  ", "   "), StandardCharsets.UTF_8);

        List<Path> files = BatchOrchestrator.readManifest(manifest);

        assertEquals(Arrays.asList(Paths.get("/a/one.fits"), Paths.get("/a/two.fits")), files);
    }
}
