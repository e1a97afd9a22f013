package net.preibisch.radnorm.process;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.nio.file.NoSuchFileException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import net.preibisch.radnorm.TestImages;
import net.preibisch.radnorm.data.AlphaMask;
import net.preibisch.radnorm.data.Image;
import net.preibisch.radnorm.data.LinearTransformation;
import net.preibisch.radnorm.data.PIFMask;
import net.preibisch.radnorm.exception.ShapeMismatchException;
import net.preibisch.radnorm.io.MemoryRasterStore;
import net.preibisch.radnorm.process.diagnostics.DiagnosticCounters;
import net.preibisch.radnorm.process.diagnostics.NormalizationObserver;
import net.preibisch.radnorm.process.pif.PIFMethod;
import net.preibisch.radnorm.process.pif.PIFParameters;
import net.preibisch.radnorm.process.timestack.TimeStackParameters;
import net.preibisch.radnorm.process.transformation.TransformationMethod;
import net.preibisch.radnorm.process.transformation.TransformationParameters;
import net.preibisch.radnorm.process.validation.ValidationMethod;

public class RadiometricNormalizationTest {

	private static final int N = 1000;

	private static Image candidate() {
		return TestImages.row(TestImages.range(100, N, 1, 0), TestImages.range(300, N, 1, 0));
	}

	/**
	 * The k-th of three references, their mean is band 0 = 2c + 50 and band 1 = c - 100.
	 */
	private static Image reference(final int k) {
		return TestImages.row(TestImages.range(100, N, 2, 50 + k - 1), TestImages.range(300, N, 1, -100 + k - 1));
	}

	private static MemoryRasterStore store(final Image candidate) {
		final MemoryRasterStore store = new MemoryRasterStore();
		store.save(candidate, "candidate.tif");
		for (int k = 0; k < 3; ++k)
			store.save(reference(k), "reference_" + k + ".tif");
		return store;
	}

	private static final List<String> REFERENCES = Arrays.asList("reference_0.tif", "reference_1.tif", "reference_2.tif");

	@Test
	public void testNormalize() throws Exception {
		final MemoryRasterStore store = store(candidate());
		final DiagnosticCounters counters = new DiagnosticCounters();
		final RadiometricNormalization normalization = new RadiometricNormalization(new NormalizationParameters(), counters);

		final List<LinearTransformation> t = normalization.normalize(store, "candidate.tif", REFERENCES, "normalized.tif");

		assertEquals(2, t.get(0).getGain(), 1e-9);
		assertEquals(50, t.get(0).getOffset(), 1e-6);
		assertEquals(1, t.get(1).getGain(), 1e-9);
		assertEquals(-100, t.get(1).getOffset(), 1e-6);
		assertEquals(3, counters.getNumComposited());
		assertEquals(2, counters.getNumTransformations());

		final Image normalized = store.load("normalized.tif");
		final Image reference = reference(1);
		assertTrue(normalization.validate(candidate(), reference) > 100);
		assertTrue(normalization.validate(normalized, reference) <= 2);
		assertEquals(candidate().alpha().numValid(), normalized.alpha().numValid());

		// restricted to the pseudo-invariant pixels only
		final PIFMask pifs = new RadiometricNormalization(new NormalizationParameters(), NormalizationObserver.NONE)
				.generatePIFs(reference, candidate());
		assertTrue(pifs.numSelected() > 0);

		final boolean[] selected = new boolean[N];
		for (int i = 0; i < N; ++i)
			selected[i] = pifs.isSelected(i);
		final AlphaMask pifAlpha = AlphaMask.fromBooleans(selected, N, 1);

		final double before = normalization.validate(candidate().withAlpha(pifAlpha), reference.withAlpha(pifAlpha));
		final double after = normalization.validate(normalized.withAlpha(pifAlpha), reference.withAlpha(pifAlpha));
		assertTrue(after < before);
		assertTrue(after <= 2);
	}

	@Test
	public void testMismatchedReferenceFailsBeforeCompositing() throws Exception {
		// three bands, the references have two
		final Image candidate = TestImages.row(TestImages.range(100, N, 1, 0), TestImages.range(300, N, 1, 0), TestImages.range(0, N, 1, 0));
		final MemoryRasterStore store = store(candidate);
		final DiagnosticCounters counters = new DiagnosticCounters();

		try {
			new RadiometricNormalization(new NormalizationParameters(), counters).normalize(store, "candidate.tif", REFERENCES, "normalized.tif");
			throw new AssertionError("expected ShapeMismatchException");
		} catch (final ShapeMismatchException e) {
			assertEquals(0, counters.getNumComposited());
			assertFalse(store.contains("normalized.tif"));
		}

		try {
			final Iterable<Image> references = Arrays.asList(reference(0), reference(1))::iterator;
			new RadiometricNormalization(new NormalizationParameters(), counters).normalize(candidate, references);
			throw new AssertionError("expected ShapeMismatchException");
		} catch (final ShapeMismatchException e) {
			assertEquals(0, counters.getNumComposited());
		}
	}

	@Test
	public void testAllReferencesAreCheckedBeforeCompositing() throws Exception {
		final DiagnosticCounters counters = new DiagnosticCounters();
		final NormalizationParameters params = new NormalizationParameters(
				new TimeStackParameters(), new PIFParameters(), new TransformationParameters(), ValidationMethod.RMSE, 2, false);

		// only the last reference is too small
		final List<Image> references = Arrays.asList(reference(0), reference(1),
				TestImages.row(TestImages.range(100, N - 1, 2, 50), TestImages.range(300, N - 1, 1, -100)));

		try {
			new RadiometricNormalization(params, counters).normalize(candidate(), references);
			throw new AssertionError("expected ShapeMismatchException");
		} catch (final ShapeMismatchException e) {
			assertEquals(0, counters.getNumComposited());
		}
	}

	@Test
	public void testOutliersWithParallelStages() throws Exception {
		final int[] c = TestImages.range(100, N + 2, 1, 0);
		final int[] r = TestImages.range(100, N + 2, 2, 50);
		c[N] = 500;
		r[N] = 3000;
		c[N + 1] = 900;
		r[N + 1] = 100;
		final Image candidate = TestImages.row(c, c);
		final List<Image> references = new ArrayList<>();
		for (int k = 0; k < 4; ++k)
			references.add(TestImages.row(r, r));

		final NormalizationParameters params = new NormalizationParameters(
				new TimeStackParameters(),
				new PIFParameters(PIFMethod.FILTER_PCA),
				new TransformationParameters(TransformationMethod.ROBUST_LINEAR),
				ValidationMethod.RMSE, 2, false);
		final RadiometricNormalization normalization = new RadiometricNormalization(params);

		final Image reference = normalization.generateReference(references);
		assertFalse(normalization.generatePIFs(reference, candidate).isSelected(N));

		final List<LinearTransformation> t = normalization.generateTransformations(reference, candidate, normalization.generatePIFs(reference, candidate));
		for (final LinearTransformation each : t) {
			assertEquals(2, each.getGain(), 1e-9);
			assertEquals(50, each.getOffset(), 1e-6);
		}

		final Image normalized = normalization.normalize(candidate, references);
		for (int i = 0; i < N; ++i)
			assertEquals(r[i], normalized.band(1).get(i), 1);
	}

	@Test(expected = NoSuchFileException.class)
	public void testMissingReference() throws Exception {
		new RadiometricNormalization(new NormalizationParameters())
				.normalize(store(candidate()), "candidate.tif", Arrays.asList("reference_0.tif", "nowhere.tif"), "normalized.tif");
	}

	@Test(expected = ShapeMismatchException.class)
	public void testMetadataMustMatch() {
		final NormalizationParameters params = new NormalizationParameters(
				new TimeStackParameters(), new PIFParameters(), new TransformationParameters(), ValidationMethod.RMSE, 1, true);
		final Image candidate = candidate().withMetadata(TestImages.metadata(0));
		final Image reference = reference(1).withMetadata(TestImages.metadata(30));
		new RadiometricNormalization(params).generatePIFs(reference, candidate);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testInvalidThreadCount() {
		new NormalizationParameters(new TimeStackParameters(), new PIFParameters(), new TransformationParameters(), ValidationMethod.RMSE, 0, false);
	}
}
