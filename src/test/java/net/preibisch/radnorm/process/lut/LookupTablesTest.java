package net.preibisch.radnorm.process.lut;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import net.imglib2.Cursor;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import net.preibisch.radnorm.TestImages;
import net.preibisch.radnorm.data.AlphaMask;
import net.preibisch.radnorm.data.Image;
import net.preibisch.radnorm.data.LinearTransformation;
import net.preibisch.radnorm.data.LookupTable;
import net.preibisch.radnorm.data.RasterBand;
import net.preibisch.radnorm.exception.ShapeMismatchException;
import net.preibisch.radnorm.exception.TypeMismatchException;

public class LookupTablesTest {

	@Test
	public void testIdentity() {
		final LookupTable lut = LookupTables.build(LinearTransformation.IDENTITY);
		assertEquals(65536, lut.size());
		for (int v = 0; v <= 65535; v += 257)
			assertEquals(v, lut.get(v));
	}

	@Test
	public void testClipsAtTheTop() {
		final LookupTable lut = LookupTables.build(new LinearTransformation(1, 2));
		assertEquals(2, lut.get(0));
		assertEquals(65535, lut.get(65533));
		assertEquals(65535, lut.get(65534));
		assertEquals(65535, lut.get(65535));
	}

	@Test
	public void testClipsAtZero() {
		final LookupTable lut = LookupTables.build(new LinearTransformation(1, -10));
		assertEquals(0, lut.get(0));
		assertEquals(0, lut.get(10));
		assertEquals(1, lut.get(11));
	}

	@Test
	public void testTruncates() {
		final LookupTable lut = LookupTables.build(new LinearTransformation(0.5, 0));
		assertEquals(32767, lut.get(65535));
		assertEquals(0, lut.get(1));
		assertEquals(1, lut.get(3));
	}

	@Test
	public void testSmallTable() {
		final LookupTable lut = LookupTables.build(new LinearTransformation(2, 0), 255);
		assertEquals(256, lut.size());
		assertEquals(254, lut.get(127));
		assertEquals(255, lut.get(128));
		assertEquals(lut, LookupTable.of(lut.toArray(), 255));
	}

	@Test(expected = TypeMismatchException.class)
	public void testTableDoesNotMatchBitDepth() {
		LookupTables.apply(RasterBand.constant(1, 2, 2), LookupTables.build(LinearTransformation.IDENTITY, 255));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testEntryOutOfRange() {
		LookupTable.of(new int[] { 0, 1, 4, 3 }, 3);
	}

	@Test
	public void testApplyKeepsAlphaAndMetadata() {
		final AlphaMask alpha = AlphaMask.fromRows(new int[][] { { 65535, 0, 65535 } });
		final Image image = TestImages.row(alpha, new int[] { 10, 20, 30 }, new int[] { 1, 2, 3 })
				.withMetadata(TestImages.metadata(500));

		final List<LookupTable> luts = LookupTables.build(Arrays.asList(new LinearTransformation(2, 1), new LinearTransformation(1, 100)));
		final Image out = LookupTables.apply(image, luts);

		assertEquals(21, out.band(0).get(0));
		assertEquals(41, out.band(0).get(1));
		assertEquals(61, out.band(0).get(2));
		assertEquals(103, out.band(1).get(2));
		assertSame(image.alpha(), out.alpha());
		assertEquals(TestImages.metadata(500), out.metadata());
	}

	@Test(expected = ShapeMismatchException.class)
	public void testWrongNumberOfTables() {
		LookupTables.applyTransformations(TestImages.constant(3, 1, 2, 2), Arrays.asList(LinearTransformation.IDENTITY));
	}

	@Test
	public void testApplyDirect() {
		final RasterBand band = RasterBand.fromValues(new int[] { 0, 1, 2, 3 }, 2, 2);
		final ArrayImg<DoubleType, DoubleArray> out = LookupTables.applyDirect(band, new LinearTransformation(1.5, -1));

		final double[] values = new double[4];
		final Cursor<DoubleType> cursor = out.cursor();
		for (int i = 0; i < 4; ++i)
			values[i] = cursor.next().get();

		assertArrayEquals(new double[] { -1, 0.5, 2, 3.5 }, values, 1e-12);
	}
}
