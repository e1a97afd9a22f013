package net.preibisch.radnorm.process.transformation;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

import net.preibisch.radnorm.TestImages;
import net.preibisch.radnorm.data.Image;
import net.preibisch.radnorm.data.LinearTransformation;
import net.preibisch.radnorm.data.PIFMask;
import net.preibisch.radnorm.data.PIFSet;
import net.preibisch.radnorm.exception.InsufficientPIFsException;
import net.preibisch.radnorm.exception.UnsupportedMethodException;
import net.preibisch.radnorm.process.diagnostics.DiagnosticCounters;
import net.preibisch.radnorm.process.diagnostics.NormalizationObserver;

public class TransformationFittingTest {

	private static PIFSet fourBands() {
		final Image candidate = TestImages.row(
				TestImages.range(0, 50, 1, 0), TestImages.range(0, 50, 1, 0),
				TestImages.range(0, 50, 1, 0), TestImages.range(0, 50, 1, 0));
		final Image reference = TestImages.row(
				TestImages.range(0, 50, 1, 5), TestImages.range(0, 50, 2, 0),
				TestImages.range(0, 50, 3, 1), TestImages.range(0, 50, 1, 0));
		return PIFSet.extract(PIFMask.all(50, 1), reference, candidate);
	}

	@Test
	public void testParallelEqualsSequential() throws Exception {
		final PIFSet pifs = fourBands();
		final TransformationParameters params = new TransformationParameters(TransformationMethod.OLS_LINEAR);

		final List<LinearTransformation> sequential = TransformationFitting.generate(pifs, params, 1, NormalizationObserver.NONE);
		final DiagnosticCounters counters = new DiagnosticCounters();
		final List<LinearTransformation> parallel = TransformationFitting.generate(pifs, params, 4, counters);

		assertEquals(sequential, parallel);
		assertEquals(4, counters.getNumTransformations());
		assertEquals(new LinearTransformation(3, 1), parallel.get(2));
	}

	@Test
	public void testSkip() throws Exception {
		final List<LinearTransformation> t = TransformationFitting.generate(fourBands(),
				new TransformationParameters(TransformationMethod.SKIP), 1, NormalizationObserver.NONE);
		assertEquals(4, t.size());
		for (final LinearTransformation each : t)
			assertEquals(LinearTransformation.IDENTITY, each);
	}

	@Test
	public void testTooFewPIFsInParallel() throws Exception {
		final Image image = TestImages.row(new int[] { 1, 2 }, new int[] { 3, 4 });
		final PIFSet pifs = PIFSet.extract(new PIFMask(new short[] { 1, 0 }, 2, 1), image, image);
		try {
			TransformationFitting.generate(pifs, new TransformationParameters(), 2, NormalizationObserver.NONE);
			fail("expected InsufficientPIFsException");
		} catch (final InsufficientPIFsException e) {
			assertEquals(1, e.getNumPIFs());
		}
	}

	@Test
	public void testParse() {
		assertEquals(TransformationMethod.MOMENT_LINEAR, TransformationMethod.parse("linear_relationship"));
		assertEquals(TransformationMethod.MOMENT_LINEAR, TransformationMethod.parse("LINEAR_TRANSFORMATION"));
		assertEquals(TransformationMethod.ROBUST_LINEAR, TransformationMethod.parse("robust_linear"));
		assertEquals(TransformationMethod.SKIP, TransformationMethod.parse("skip"));
	}

	@Test(expected = UnsupportedMethodException.class)
	public void testParseUnknown() {
		TransformationMethod.parse("quadratic");
	}
}
