package net.preibisch.radnorm.process.transformation;

import static net.preibisch.radnorm.process.transformation.MomentLinearFitterTest.matches;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

import net.preibisch.radnorm.TestImages;
import net.preibisch.radnorm.data.LinearTransformation;
import net.preibisch.radnorm.exception.InsufficientPIFsException;
import net.preibisch.radnorm.process.diagnostics.DiagnosticCounters;
import net.preibisch.radnorm.process.diagnostics.NormalizationObserver;

public class OLSLinearFitterTest {

	@Test
	public void testExactLine() throws Exception {
		final LinearTransformation t = new OLSLinearFitter().fit(0,
				matches(TestImages.range(10, 200, 1, 0), TestImages.range(10, 200, 3, -20)), NormalizationObserver.NONE);
		assertEquals(3, t.getGain(), 1e-12);
		assertEquals(-20, t.getOffset(), 1e-9);
	}

	@Test
	public void testOutlierPullsTheFit() throws Exception {
		// least squares is not robust, the single outlier tilts the line
		final LinearTransformation t = new OLSLinearFitter().fit(0,
				matches(new int[] { 0, 1, 2, 3 }, new int[] { 0, 1, 2, 30 }), NormalizationObserver.NONE);
		assertEquals(9.1, t.getGain(), 1e-9);
	}

	@Test
	public void testConstantCandidate() throws Exception {
		final DiagnosticCounters counters = new DiagnosticCounters();
		final LinearTransformation t = new OLSLinearFitter().fit(1,
				matches(new int[] { 4, 4, 4 }, new int[] { 2, 3, 4 }), counters);
		assertEquals(1, t.getGain(), 0);
		assertEquals(-1, t.getOffset(), 1e-12);
		assertEquals(1, counters.getNumDegenerateFits());
	}

	@Test
	public void testFiveIdenticalPIFs() {
		final int[] same = { 100, 100, 100, 100, 100 };
		final DiagnosticCounters counters = new DiagnosticCounters();
		try {
			new OLSLinearFitter().fit(1, matches(same, same), counters);
		} catch (final InsufficientPIFsException e) {
			assertEquals(1, e.getBand());
			assertEquals(1, e.getNumPIFs());
			assertEquals(0, counters.getNumDegenerateFits());
			return;
		}
		throw new AssertionError("expected InsufficientPIFsException");
	}

	@Test(expected = InsufficientPIFsException.class)
	public void testNoPIFs() throws Exception {
		new OLSLinearFitter().fit(0, matches(new int[0], new int[0]), NormalizationObserver.NONE);
	}
}
