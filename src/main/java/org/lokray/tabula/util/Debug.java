package org.lokray.tabula.util;

public class Debug
{
	// ANSI escape codes for colors
	public static final String ANSI_RESET = "\u001B[0m";
	public static final String ANSI_YELLOW = "\u001B[33m";
	public static final String ANSI_RED = "\u001B[31m";

	/**
	 * Master switch for debug logging. Turned on by {@code --verbose} or {@code tabula.debug=true}.
	 */
	private static volatile boolean enabled = false;

	public static void setEnabled(boolean value)
	{
		enabled = value;
	}

	public static boolean isEnabled()
	{
		return enabled;
	}

	/**
	 * Logs a formatted message if debugging is enabled.
	 *
	 * @param format The message format string (e.g., "Resolved %d markers").
	 * @param args   The arguments to format into the message.
	 */
	public static void log(String format, Object... args)
	{
		if (enabled)
		{
			System.out.println("[DEBUG] " + String.format(format, args));
		}
	}

	public static void logWarning(String log)
	{
		System.err.println(ANSI_YELLOW + log + ANSI_RESET);
	}

	public static void logError(String log)
	{
		System.err.println(ANSI_RED + log + ANSI_RESET);
	}
}
