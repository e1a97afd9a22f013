package net.preibisch.radnorm.io;

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.nio.file.NoSuchFileException;

import org.junit.Test;

import net.preibisch.radnorm.TestImages;
import net.preibisch.radnorm.data.Image;

public class MemoryRasterStoreTest {

	@Test
	public void testSaveAndLoad() throws Exception {
		final MemoryRasterStore store = new MemoryRasterStore();
		final Image image = TestImages.constant(2, 3, 4, 4);

		assertFalse(store.contains("a.tif"));
		store.save(image, "a.tif");
		assertTrue(store.contains("a.tif"));
		assertSame(image, store.load("a.tif"));
		assertTrue(store.paths().contains("a.tif"));
	}

	@Test(expected = NoSuchFileException.class)
	public void testMissing() throws Exception {
		new MemoryRasterStore().load("missing.tif");
	}
}
