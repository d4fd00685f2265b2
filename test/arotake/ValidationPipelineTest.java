/*
 * Copyright 2007-2010 The Authors (see AUTHORS)
 * This file is part of Arotake, which is free software. It is made available
 * to you under the terms of version 3 of the GNU General Public License, as
 * published by the Free Software Foundation. For more information, see LICENSE.
 */
package arotake;

import java.util.ArrayList;
import java.util.List;

import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

import arotake.instrument.AbstractInstrumentProfile;
import arotake.instrument.MosfireProfile;

/**
 * Unit tests for the ValidationPipeline class.
 */
public class ValidationPipelineTest {

    private ValidationPipeline pipeline;
    private List<String> applied;

    @Before
    public void setUp() {
        pipeline = new ValidationPipeline();
        applied = new ArrayList<String>();
    }

    // A step that records that it ran and returns a fixed outcome.
    private class RecordingStep extends ValidationStep {

        private final boolean outcome;

        RecordingStep(String name, boolean outcome) {
            super(name);
            this.outcome = outcome;
        }

        @Override
        public boolean apply(StepContext context) {
            applied.add(getName());
            return outcome;
        }
    }

    private static class TestProfile extends AbstractInstrumentProfile {

        TestProfile(ValidationStep... steps) {
            super("TEST", null);
            for (ValidationStep step : steps) {
                addStep(step);
            }
        }

        public String getIdentifierPrefix(HeaderStore header) {
            return "TS";
        }
    }

    private static StepContext context(TestProfile profile) {
        return Fixtures.context(Fixtures.exposure("test.fits", new HeaderStore(), null), profile);
    }

    /**
     * Test of run method, of class ValidationPipeline.
     */
    @Test
    public void testAllStepsRunInOrder() {
        TestProfile profile = new TestProfile(new RecordingStep("one", true), new RecordingStep("two", true),
                new RecordingStep("three", true));
        StepContext context = context(profile);

        assertTrue(pipeline.run(profile, context));
        assertEquals(3, applied.size());
        assertEquals("one", applied.get(0));
        assertEquals("three", applied.get(2));
        assertNull(context.getFailedStep());
    }

    @Test
    public void testStopsAtFirstFailure() {
        TestProfile profile = new TestProfile(new RecordingStep("one", true), new RecordingStep("two", false),
                new RecordingStep("three", true));
        StepContext context = context(profile);

        assertFalse(pipeline.run(profile, context));
        assertEquals(2, applied.size());
        assertEquals("two", context.getFailedStep());
    }

    @Test
    public void testExceptionCountsAsFailure() {
        ValidationStep throwing = new ValidationStep("throws") {
            @Override
            public boolean apply(StepContext context) {
                context.getHeader().set(HeaderStore.IDENTIFIER_KEYWORD, "TS.20180304.000000.00.fits", null);
                context.getHeader().set(HeaderStore.IDENTIFIER_KEYWORD, "TS.20180304.000001.00.fits", null);
                return true;
            }
        };
        TestProfile profile = new TestProfile(throwing, new RecordingStep("after", true));
        StepContext context = context(profile);

        assertFalse(pipeline.run(profile, context));
        assertEquals("throws", context.getFailedStep());
        assertTrue(applied.isEmpty());
    }

    @Test
    public void testRunningTwiceGivesTheSameHeader() {
        HeaderStore header = Fixtures.mosfireHeader("2018-03-04", "10:15:30.25", 12);
        StepContext context = Fixtures.mosfireContext(header);
        MosfireProfile profile = new MosfireProfile();

        assertTrue(pipeline.run(profile, context));
        String identifier = context.getExposure().getIdentifier();
        Object frame = header.get("FRAMENO");
        Object elapsed = header.get("ELAPTIME");
        Object fileName = header.get("OFNAME");
        int size = header.size();

        assertTrue(pipeline.run(profile, context));
        assertEquals(identifier, context.getExposure().getIdentifier());
        assertEquals(frame, header.get("FRAMENO"));
        assertEquals(elapsed, header.get("ELAPTIME"));
        assertEquals(fileName, header.get("OFNAME"));
        assertEquals(size, header.size());
    }
}
