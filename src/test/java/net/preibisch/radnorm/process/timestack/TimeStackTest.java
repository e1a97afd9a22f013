package net.preibisch.radnorm.process.timestack;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import net.preibisch.radnorm.TestImages;
import net.preibisch.radnorm.data.AlphaMask;
import net.preibisch.radnorm.data.Image;
import net.preibisch.radnorm.data.ImageMetadata;
import net.preibisch.radnorm.exception.ShapeMismatchException;
import net.preibisch.radnorm.process.diagnostics.DiagnosticCounters;
import net.preibisch.radnorm.process.diagnostics.NormalizationObserver;

public class TimeStackTest {

	private static void assertSameValues(final Image expected, final Image actual) {
		assertEquals(expected.numBands(), actual.numBands());
		for (int b = 0; b < expected.numBands(); ++b)
			for (int i = 0; i < expected.numPixels(); ++i)
				assertEquals("band " + b + ", pixel " + i, expected.band(b).get(i), actual.band(b).get(i));
		for (int i = 0; i < expected.numPixels(); ++i)
			assertEquals(expected.alpha().isValid(i), actual.alpha().isValid(i));
	}

	private static List<Image> stack(final int numImages) {
		final List<Image> images = new ArrayList<>();
		for (int k = 0; k < numImages; ++k)
			images.add(TestImages.row(TestImages.range(k, 20, 3, 1), TestImages.range(0, 20, k + 1, 0)));
		return images;
	}

	@Test
	public void testIdenticalImages() {
		final Image image = TestImages.row(new int[] { 1, 200, 65535 }, new int[] { 0, 7, 9 });
		final DiagnosticCounters counters = new DiagnosticCounters();

		final Image composite = TimeStack.composite(Arrays.asList(image, image, image), new TimeStackParameters(), counters);

		assertSameValues(image, composite);
		assertEquals(3, composite.alpha().numValid());
		assertEquals(3, counters.getNumComposited());
	}

	@Test
	public void testMeanIsTruncated() {
		final Image a = TestImages.row(new int[] { 1, 10 });
		final Image b = TestImages.row(new int[] { 2, 13 });
		final Image composite = TimeStack.composite(Arrays.asList(a, b), new TimeStackParameters());
		assertEquals(1, composite.band(0).get(0));
		assertEquals(11, composite.band(0).get(1));
	}

	@Test
	public void testInvalidPixelsAreSkipped() {
		final Image a = TestImages.row(AlphaMask.fromRows(new int[][] { { 0, 65535, 0 } }), new int[] { 100, 4, 100 });
		final Image b = TestImages.row(AlphaMask.fromRows(new int[][] { { 65535, 65535, 0 } }), new int[] { 6, 8, 100 });

		final Image composite = TimeStack.composite(Arrays.asList(a, b), new TimeStackParameters());

		assertEquals(6, composite.band(0).get(0));
		assertEquals(6, composite.band(0).get(1));
		assertEquals(0, composite.band(0).get(2));
		assertTrue(composite.alpha().isValid(0));
		assertFalse(composite.alpha().isValid(2));
	}

	@Test
	public void testNodataValues() {
		final Image a = TestImages.row(new int[] { 0, 5 }, new int[] { 3, 9 });
		final Image b = TestImages.row(new int[] { 0, 7 }, new int[] { 5, 9 });
		final TimeStackParameters params = new TimeStackParameters(TimeStackMethod.MEAN_WITH_UNIFORM_WEIGHT, new int[] { 0, 9 }, false);
		final DiagnosticCounters counters = new DiagnosticCounters();

		final Image composite = TimeStack.composite(Arrays.asList(a, b), params, new NormalizationObserver() {
			@Override
			public void imageComposited(final int index, final long numValid) {
				assertEquals(0, numValid);
				counters.imageComposited(index, numValid);
			}
		});

		assertEquals(4, composite.band(1).get(0));
		assertEquals(6, composite.band(0).get(1));
		// pixel 0 is nodata in band 0, pixel 1 in band 1
		assertEquals(0, composite.alpha().numValid());
		assertEquals(2, counters.getNumComposited());
	}

	@Test(expected = ShapeMismatchException.class)
	public void testNodataForEveryBand() {
		TimeStack.composite(Arrays.asList(TestImages.constant(2, 1, 2, 2)),
				new TimeStackParameters(TimeStackMethod.MEAN_WITH_UNIFORM_WEIGHT, new int[] { 0 }, false));
	}

	@Test
	public void testOrderDoesNotMatter() {
		final List<Image> images = stack(5);
		final Image forward = TimeStack.composite(images, new TimeStackParameters());
		final List<Image> reversed = new ArrayList<>(images);
		Collections.reverse(reversed);
		assertSameValues(forward, TimeStack.composite(reversed, new TimeStackParameters()));
	}

	@Test
	public void testParallelEqualsSequential() {
		final List<Image> images = stack(7);
		final Image sequential = TimeStack.composite(images, new TimeStackParameters());
		final DiagnosticCounters counters = new DiagnosticCounters();
		assertSameValues(sequential, TimeStack.compositeParallel(images, new TimeStackParameters(), 3, counters));
		assertEquals(7, counters.getNumComposited());
	}

	@Test
	public void testMerge() {
		final List<Image> images = stack(4);
		final TimeStackAccumulator first = new TimeStackAccumulator(new TimeStackParameters());
		final TimeStackAccumulator second = new TimeStackAccumulator(new TimeStackParameters());
		first.add(images.get(0));
		first.add(images.get(1));
		second.add(images.get(2));
		second.add(images.get(3));

		final TimeStackAccumulator merged = first.merge(second);
		assertEquals(4, merged.numImages());
		assertSameValues(TimeStack.composite(images, new TimeStackParameters()), merged.finish());
	}

	@Test(expected = IllegalStateException.class)
	public void testFinishOnce() {
		final TimeStackAccumulator accumulator = new TimeStackAccumulator(new TimeStackParameters());
		accumulator.add(TestImages.constant(1, 1, 2, 2));
		accumulator.finish();
		accumulator.finish();
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEmptyStack() {
		TimeStack.composite(Collections.<Image>emptyList(), new TimeStackParameters());
	}

	@Test(expected = ShapeMismatchException.class)
	public void testDifferentSize() {
		TimeStack.composite(Arrays.asList(TestImages.constant(1, 1, 2, 2), TestImages.constant(1, 1, 3, 2)), new TimeStackParameters());
	}

	@Test(expected = ShapeMismatchException.class)
	public void testDifferentBandCount() {
		TimeStack.composite(Arrays.asList(TestImages.constant(1, 1, 2, 2), TestImages.constant(2, 1, 2, 2)), new TimeStackParameters());
	}

	@Test
	public void testMetadata() {
		final Image a = TestImages.constant(1, 1, 2, 2).withMetadata(TestImages.metadata(0));
		final Image b = TestImages.constant(1, 1, 2, 2).withMetadata(TestImages.metadata(30));

		final Image loose = TimeStack.composite(Arrays.asList(a, b), new TimeStackParameters());
		assertEquals(ImageMetadata.EMPTY, loose.metadata());

		final TimeStackParameters strict = new TimeStackParameters(TimeStackMethod.MEAN_WITH_UNIFORM_WEIGHT, null, true);
		assertEquals(TestImages.metadata(0), TimeStack.composite(Arrays.asList(a, a), strict).metadata());

		try {
			TimeStack.composite(Arrays.asList(a, b), strict);
		} catch (final ShapeMismatchException e) {
			return;
		}
		throw new AssertionError("expected ShapeMismatchException");
	}

	@Test
	public void testSkip() {
		final Image image = TestImages.constant(2, 5, 2, 2);
		final TimeStackParameters skip = new TimeStackParameters(TimeStackMethod.SKIP);
		assertSame(image, TimeStack.composite(Arrays.asList(image), skip));

		try {
			TimeStack.composite(Arrays.asList(image, image), skip);
		} catch (final IllegalArgumentException e) {
			return;
		}
		throw new AssertionError("expected IllegalArgumentException");
	}

	@Test
	public void testParse() {
		assertEquals(TimeStackMethod.SKIP, TimeStackMethod.parse("identity"));
		assertEquals(TimeStackMethod.MEAN_WITH_UNIFORM_WEIGHT, TimeStackMethod.parse("mean_with_uniform_weight"));
	}
}
