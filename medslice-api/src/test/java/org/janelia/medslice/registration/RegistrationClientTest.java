package org.janelia.medslice.registration;

import java.io.IOException;

import org.janelia.medslice.TestUtils;
import org.janelia.medslice.image.SourceFormat;
import org.janelia.medslice.image.Volume;
import org.janelia.medslice.image.VoxelSpacing;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class RegistrationClientTest {

    @Test
    public void identityRegistration() {
        Volume fixed = TestUtils.createVolume(new double[][][] {{{1, 2}, {3, 4}}}, new VoxelSpacing(0.5, 0.5, 2));
        Volume moving = TestUtils.createVolume(new double[][][] {{{5, 6}, {7, 8}}}, VoxelSpacing.UNIT);
        RegistrationClient registrationClient = new RegistrationClient(request -> request.getMoving());

        Volume registered = registrationClient.register(fixed, moving);

        assertArrayEquals(fixed.getShape(), registered.getShape());
        assertEquals(fixed.getVoxelSpacing(), registered.getVoxelSpacing());
        assertEquals(fixed.getSourceFormat(), registered.getSourceFormat());
        assertEquals(8, TestUtils.valueAt(registered.getData(), 1, 1, 0), 0);
    }

    @Test
    public void collaboratorFailureIsWrapped() {
        IOException failure = new IOException("connection refused");
        RegistrationClient registrationClient = new RegistrationClient(request -> {
            throw failure;
        });
        try {
            registrationClient.register(TestUtils.createIndexedVolume(2, 2, 1), TestUtils.createIndexedVolume(2, 2, 1));
            fail("Expected RegistrationException");
        } catch (RegistrationException e) {
            assertSame(failure, e.getCause());
            assertTrue(e.getMessage().contains("connection refused"));
        }
    }

    @Test
    public void interruptedCollaboratorKeepsInterruptStatus() {
        InterruptedException interruption = new InterruptedException("cancelled");
        RegistrationClient registrationClient = new RegistrationClient(request -> {
            throw interruption;
        });
        try {
            registrationClient.register(TestUtils.createIndexedVolume(2, 2, 1), TestUtils.createIndexedVolume(2, 2, 1));
            fail("Expected RegistrationException");
        } catch (RegistrationException e) {
            assertSame(interruption, e.getCause());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            // clear the flag for the other tests running on this thread
            Thread.interrupted();
        }
    }

    @Test(expected = RegistrationException.class)
    public void missingResult() {
        new RegistrationClient(request -> null)
                .register(TestUtils.createIndexedVolume(2, 2, 1), TestUtils.createIndexedVolume(2, 2, 1));
    }

    @Test(expected = RegistrationException.class)
    public void resultShapeMustMatchFixedVolume() {
        Volume fixed = TestUtils.createIndexedVolume(2, 2, 2);
        Volume moving = TestUtils.createIndexedVolume(3, 3, 2);
        new RegistrationClient(request -> request.getMoving()).register(fixed, moving);
    }

    @Test(expected = RegistrationException.class)
    public void truncatedResult() {
        Volume fixed = TestUtils.createIndexedVolume(2, 2, 1);
        new RegistrationClient(request -> new VolumePayload(new byte[3], fixed.getShape(), VoxelSpacing.UNIT))
                .register(fixed, TestUtils.createIndexedVolume(2, 2, 1));
    }

    @Test
    public void resampleOntoFinerGrid() {
        Volume fixed = TestUtils.createVolume(new double[3][3][3], VoxelSpacing.UNIT);
        Volume moving = TestUtils.createVolume(new double[][][] {
                {{0, 10}, {20, 30}},
                {{0, 10}, {20, 30}}
        }, new VoxelSpacing(2, 2, 2));

        Volume registered = new RegistrationClient(new SpacingResampler()).register(fixed, moving);

        assertArrayEquals(new long[] {3, 3, 3}, registered.getShape());
        assertEquals(VoxelSpacing.UNIT, registered.getVoxelSpacing());
        // (x, y, z)
        assertEquals(0, TestUtils.valueAt(registered.getData(), 0, 0, 0), 1e-6);
        assertEquals(5, TestUtils.valueAt(registered.getData(), 1, 0, 0), 1e-6);
        assertEquals(15, TestUtils.valueAt(registered.getData(), 1, 1, 0), 1e-6);
        assertEquals(30, TestUtils.valueAt(registered.getData(), 2, 2, 2), 1e-6);
    }

    @Test(expected = IllegalArgumentException.class)
    public void resampleRequiresSameRank() {
        new SpacingResampler().resample(
                TestUtils.createVolume(new double[][] {{1, 2}}),
                TestUtils.createIndexedVolume(2, 2, 2));
    }

    @Test
    public void payloadKeepsSourceFormat() {
        Volume volume = TestUtils.createIndexedVolume(2, 3, 1);
        Volume decoded = VolumePayload.fromVolume(volume).toVolume(SourceFormat.DICOM);
        assertEquals(SourceFormat.DICOM, decoded.getSourceFormat());
        assertArrayEquals(volume.getShape(), decoded.getShape());
    }
}
