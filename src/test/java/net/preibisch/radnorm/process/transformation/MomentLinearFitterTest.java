package net.preibisch.radnorm.process.transformation;

import static org.junit.Assert.assertEquals;

import java.util.List;

import org.junit.Test;

import net.preibisch.radnorm.TestImages;
import net.preibisch.radnorm.data.Image;
import net.preibisch.radnorm.data.LinearTransformation;
import net.preibisch.radnorm.data.PIFMask;
import net.preibisch.radnorm.data.PIFSet;
import net.preibisch.radnorm.exception.InsufficientPIFsException;
import net.preibisch.radnorm.process.diagnostics.DiagnosticCounters;
import net.preibisch.radnorm.process.diagnostics.NormalizationObserver;
import net.preibisch.radnorm.process.transformation.mpicbg.FlattenedMatches;

public class MomentLinearFitterTest {

	@Test
	public void testFourBandsTwoPixels() throws Exception {
		// pixel 0 is (1, 2, 3, 4) in the candidate and (1, 4, 4, 2) in the reference,
		// pixel 1 is (1, 3, 4, 4) and (3, 6, 5, 4)
		final Image candidate = TestImages.row(new int[] { 1, 1 }, new int[] { 2, 3 }, new int[] { 3, 4 }, new int[] { 4, 4 });
		final Image reference = TestImages.row(new int[] { 1, 3 }, new int[] { 4, 6 }, new int[] { 4, 5 }, new int[] { 2, 4 });
		final DiagnosticCounters counters = new DiagnosticCounters();

		final List<LinearTransformation> t = TransformationFitting.generate(
				PIFSet.extract(PIFMask.all(2, 1), reference, candidate), new MomentLinearFitter(), 1, counters);

		final double[] gains = { 1, 2, 1, 1 };
		final double[] offsets = { 1, 0, 1, -1 };
		for (int b = 0; b < 4; ++b) {
			assertEquals(gains[b], t.get(b).getGain(), 1e-12);
			assertEquals(offsets[b], t.get(b).getOffset(), 1e-12);
		}

		// bands 0 and 3 have a constant candidate
		assertEquals(2, counters.getNumDegenerateFits());
		assertEquals(4, counters.getNumTransformations());
	}

	@Test
	public void testRepeatedPairIsASinglePIF() {
		// both pixels of band 0 are (1, 2), band 1 is well defined
		final Image candidate = TestImages.row(new int[] { 1, 1 }, new int[] { 2, 3 });
		final Image reference = TestImages.row(new int[] { 2, 2 }, new int[] { 4, 6 });
		final DiagnosticCounters counters = new DiagnosticCounters();

		try {
			TransformationFitting.generate(PIFSet.extract(PIFMask.all(2, 1), reference, candidate), new MomentLinearFitter(), 1, counters);
		} catch (final InsufficientPIFsException e) {
			assertEquals(0, e.getBand());
			assertEquals(1, e.getNumPIFs());
			assertEquals(0, counters.getNumTransformations());
			return;
		}
		throw new AssertionError("expected InsufficientPIFsException");
	}

	@Test
	public void testFiveIdenticalPIFs() {
		final int[] same = { 100, 100, 100, 100, 100 };
		try {
			new MomentLinearFitter().fit(3, matches(same, same), NormalizationObserver.NONE);
		} catch (final InsufficientPIFsException e) {
			assertEquals(3, e.getBand());
			assertEquals(1, e.getNumPIFs());
			return;
		}
		throw new AssertionError("expected InsufficientPIFsException");
	}

	@Test
	public void testIdenticalDistributions() throws Exception {
		final int[] values = TestImages.range(0, 100, 3, 7);
		final LinearTransformation t = new MomentLinearFitter().fit(0, matches(values, values), NormalizationObserver.NONE);
		assertEquals(1, t.getGain(), 1e-12);
		assertEquals(0, t.getOffset(), 1e-9);
	}

	@Test
	public void testScaledDistribution() throws Exception {
		final LinearTransformation t = new MomentLinearFitter().fit(0,
				matches(TestImages.range(0, 100, 1, 0), TestImages.range(0, 100, 2, 50)), NormalizationObserver.NONE);
		assertEquals(2, t.getGain(), 1e-12);
		assertEquals(50, t.getOffset(), 1e-9);
	}

	@Test
	public void testWeights() throws Exception {
		// the zero weight sample must not change the moments
		final FlattenedMatches weighted = new FlattenedMatches(
				new double[] { 1, 2, 3, 1000 }, new double[] { 3, 5, 7, 0 }, new double[] { 1, 1, 1, 0 }, true);
		final LinearTransformation t = new MomentLinearFitter().fit(0, weighted, NormalizationObserver.NONE);
		assertEquals(2, t.getGain(), 1e-12);
		assertEquals(1, t.getOffset(), 1e-12);
	}

	@Test
	public void testConstantCandidate() throws Exception {
		final DiagnosticCounters counters = new DiagnosticCounters();
		final LinearTransformation t = new MomentLinearFitter().fit(0,
				matches(new int[] { 10, 10, 10 }, new int[] { 1, 2, 6 }), counters);
		assertEquals(1, t.getGain(), 0);
		assertEquals(-7, t.getOffset(), 1e-12);
		assertEquals(1, counters.getNumDegenerateFits());
	}

	@Test
	public void testSinglePIF() {
		try {
			new MomentLinearFitter().fit(2, matches(new int[] { 1 }, new int[] { 2 }), NormalizationObserver.NONE);
		} catch (final InsufficientPIFsException e) {
			assertEquals(2, e.getBand());
			assertEquals(1, e.getNumPIFs());
			return;
		}
		throw new AssertionError("expected InsufficientPIFsException");
	}

	static FlattenedMatches matches(final int[] candidate, final int[] reference) {
		final FlattenedMatches matches = new FlattenedMatches(candidate.length);
		for (int i = 0; i < candidate.length; ++i)
			matches.put(candidate[i], reference[i], 1.0);
		matches.flip();
		matches.setWeighted(false);
		return matches;
	}
}
