package net.preibisch.radnorm.process.pif;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import net.preibisch.radnorm.TestImages;
import net.preibisch.radnorm.data.AlphaMask;
import net.preibisch.radnorm.data.Image;
import net.preibisch.radnorm.data.PIFMask;
import net.preibisch.radnorm.exception.ShapeMismatchException;
import net.preibisch.radnorm.exception.UnsupportedMethodException;
import net.preibisch.radnorm.process.diagnostics.DiagnosticCounters;
import net.preibisch.radnorm.process.diagnostics.NormalizationObserver;

public class PIFSelectionTest {

	@Test
	public void testBandMasksAreCombined() {
		final int[] c = TestImages.range(100, 1002, 1, 0);
		final int[] r0 = TestImages.range(100, 1002, 1, 0);
		final int[] r1 = TestImages.range(100, 1002, 1, 0);
		// band 0 only disagrees on pixel 1001, band 1 only on pixel 1000
		r0[1001] = 1400;
		r1[1000] = 1400;

		final Image candidate = TestImages.row(c, c);
		final Image reference = TestImages.row(r0, r1);
		final DiagnosticCounters counters = new DiagnosticCounters();

		final PIFMask mask = PIFSelection.generate(reference, candidate, new PIFParameters(PIFMethod.FILTER_PCA), counters);

		assertEquals(1000, mask.numSelected());
		assertFalse(mask.isSelected(1000));
		assertFalse(mask.isSelected(1001));
		assertTrue(mask.isSelected(999));
		assertEquals(2 * 1002, counters.getNumValid());
		assertEquals(2 * 1001, counters.getNumPIFs());
	}

	@Test
	public void testInvalidPixelsOfEitherImageAreExcluded() {
		final AlphaMask candidateAlpha = AlphaMask.fromRows(new int[][] { { 0, 65535, 65535, 65535 } });
		final AlphaMask referenceAlpha = AlphaMask.fromRows(new int[][] { { 65535, 65535, 0, 65535 } });
		final Image candidate = TestImages.row(candidateAlpha, new int[] { 1, 2, 3, 4 });
		final Image reference = TestImages.row(referenceAlpha, new int[] { 1, 2, 3, 4 });

		final PIFMask mask = PIFSelection.generate(reference, candidate, new PIFParameters(), NormalizationObserver.NONE);

		assertEquals(2, mask.numSelected());
		assertTrue(mask.isSelected(1));
		assertTrue(mask.isSelected(3));
	}

	@Test
	public void testSkipUsesReferenceAlpha() {
		final AlphaMask weights = AlphaMask.fromRows(new int[][] { { 0, 100, 65535 } });
		final Image reference = TestImages.row(weights, new int[] { 1, 2, 3 });
		final Image candidate = TestImages.row(new int[] { 1, 2, 3 });

		final PIFMask mask = PIFSelection.generate(reference, candidate, new PIFParameters(PIFMethod.SKIP), NormalizationObserver.NONE);

		assertEquals(2, mask.numSelected());
		assertEquals(100, mask.weight(1));
		assertEquals(65535, mask.weight(2));
	}

	@Test(expected = ShapeMismatchException.class)
	public void testDifferentBandCount() {
		PIFSelection.generate(TestImages.constant(2, 1, 3, 3), TestImages.constant(3, 1, 3, 3), new PIFParameters(), NormalizationObserver.NONE);
	}

	@Test
	public void testParse() {
		assertEquals(PIFMethod.FILTER_PCA, PIFMethod.parse("filter_PCA"));
		assertEquals(PIFMethod.FILTER_NODATA, PIFMethod.parse("filter_alpha"));
		assertEquals(PIFMethod.FILTER_NODATA, PIFMethod.parse("filter_nodata"));
		assertEquals(PIFMethod.FILTER_HISTOGRAM, PIFMethod.parse("filter_histogram"));
		assertEquals(PIFMethod.SKIP, PIFMethod.parse("skip"));
	}

	@Test(expected = UnsupportedMethodException.class)
	public void testParseUnknown() {
		PIFMethod.parse("filter_magic");
	}
}
