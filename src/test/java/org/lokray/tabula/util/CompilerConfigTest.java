package org.lokray.tabula.util;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class CompilerConfigTest
{
	@Test
	public void usesDefaults()
	{
		CompilerConfig config = new CompilerConfig(new Properties());

		assertEquals("tab", config.getSourceExtension());
		assertEquals(Runtime.getRuntime().availableProcessors(), config.getThreads());
		assertEquals(0L, config.getTimeoutMillis());
		assertFalse(config.isDebugEnabled());
	}

	@Test
	public void readsProperties()
	{
		Properties props = new Properties();
		props.setProperty("tabula.source_extension", ".tbl");
		props.setProperty("tabula.threads", "3");
		props.setProperty("tabula.timeout_ms", "1500");
		props.setProperty("tabula.debug", "true");

		CompilerConfig config = new CompilerConfig(props);

		assertEquals("tbl", config.getSourceExtension());
		assertEquals(3, config.getThreads());
		assertEquals(1500L, config.getTimeoutMillis());
		assertTrue(config.isDebugEnabled());
	}

	@Test
	public void invalidNumbersFallBackToDefaults()
	{
		Properties props = new Properties();
		props.setProperty("tabula.threads", "many");
		props.setProperty("tabula.timeout_ms", "-5");

		CompilerConfig config = new CompilerConfig(props);

		assertEquals(Runtime.getRuntime().availableProcessors(), config.getThreads());
		assertEquals(0L, config.getTimeoutMillis());
	}
}
