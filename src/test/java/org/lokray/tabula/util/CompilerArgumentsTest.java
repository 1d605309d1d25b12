package org.lokray.tabula.util;

import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CompilerArgumentsTest
{
	@Test
	public void parsesCommandAndPaths()
	{
		CompilerArguments arguments = CompilerArguments.parse(new String[]{"check", "a.tab", "src"});

		assertNull(arguments.getUsageError());
		assertEquals(CompilerArguments.Command.CHECK, arguments.getCommand());
		assertEquals(List.of(Paths.get("a.tab"), Paths.get("src")), arguments.getInputPaths());
		assertNull(arguments.getThreads());
		assertNull(arguments.getTimeoutMillis());
	}

	@Test
	public void parsesOptions()
	{
		CompilerArguments arguments = CompilerArguments.parse(
				new String[]{"-v", "--json", "-j", "4", "--timeout", "250", "fmt", "-w", "a.tab"});

		assertNull(arguments.getUsageError());
		assertEquals(CompilerArguments.Command.FMT, arguments.getCommand());
		assertTrue(arguments.isVerboseFlag());
		assertTrue(arguments.isJsonOutput());
		assertTrue(arguments.isWriteInPlace());
		assertEquals(4, arguments.getThreads());
		assertEquals(250L, arguments.getTimeoutMillis());
	}

	@Test
	public void noArgumentsShowsHelp()
	{
		CompilerArguments arguments = CompilerArguments.parse(new String[0]);

		assertTrue(arguments.isHelpFlag());
		assertNull(arguments.getUsageError());
	}

	@Test
	public void helpAndVersionWin()
	{
		assertTrue(CompilerArguments.parse(new String[]{"check", "--help", "--bogus"}).isHelpFlag());
		assertTrue(CompilerArguments.parse(new String[]{"--version"}).isVersionFlag());
	}

	@Test
	public void rejectsBadInput()
	{
		assertNotNull(CompilerArguments.parse(new String[]{"--bogus", "check", "a"}).getUsageError());
		assertNotNull(CompilerArguments.parse(new String[]{"compile", "a"}).getUsageError());
		assertNotNull(CompilerArguments.parse(new String[]{"check"}).getUsageError());
		assertNotNull(CompilerArguments.parse(new String[]{"-v"}).getUsageError());
		assertNotNull(CompilerArguments.parse(new String[]{"check", "a", "-j"}).getUsageError());
		assertNotNull(CompilerArguments.parse(new String[]{"check", "a", "-j", "0"}).getUsageError());
		assertNotNull(CompilerArguments.parse(new String[]{"check", "a", "--timeout", "soon"}).getUsageError());
		assertNotNull(CompilerArguments.parse(new String[]{"check", "-w", "a"}).getUsageError());
	}
}
