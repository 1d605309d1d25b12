package org.lokray.tabula.util;

import java.util.Properties;

/**
 * Holds configuration settings for the Tabula front end, loaded from a properties file.
 * Provides sensible defaults if settings are not specified.
 */
public class CompilerConfig
{
	private final String sourceExtension;
	private final int threads;
	private final long timeoutMillis; // 0 means no deadline
	private final boolean debugEnabled;

	public CompilerConfig(Properties props)
	{
		String extension = props.getProperty("tabula.source_extension", "tab").trim();
		this.sourceExtension = extension.startsWith(".") ? extension.substring(1) : extension;
		this.threads = Math.max(1, parseInt(props.getProperty("tabula.threads"), Runtime.getRuntime().availableProcessors()));
		this.timeoutMillis = Math.max(0L, parseLong(props.getProperty("tabula.timeout_ms"), 0L));
		this.debugEnabled = Boolean.parseBoolean(props.getProperty("tabula.debug", "false").trim());
	}

	/**
	 * @return the extension of source files without the leading dot, e.g. {@code tab}.
	 */
	public String getSourceExtension()
	{
		return sourceExtension;
	}

	public int getThreads()
	{
		return threads;
	}

	public long getTimeoutMillis()
	{
		return timeoutMillis;
	}

	public boolean isDebugEnabled()
	{
		return debugEnabled;
	}

	private static int parseInt(String value, int fallback)
	{
		if (value == null || value.isBlank())
		{
			return fallback;
		}
		try
		{
			return Integer.parseInt(value.trim());
		}
		catch (NumberFormatException e)
		{
			Debug.logWarning("Warning: Ignoring invalid integer setting '" + value + "'.");
			return fallback;
		}
	}

	private static long parseLong(String value, long fallback)
	{
		if (value == null || value.isBlank())
		{
			return fallback;
		}
		try
		{
			return Long.parseLong(value.trim());
		}
		catch (NumberFormatException e)
		{
			Debug.logWarning("Warning: Ignoring invalid integer setting '" + value + "'.");
			return fallback;
		}
	}
}
