// File: src/main/java/org/lokray/tabula/ProjectLoader.java
package org.lokray.tabula;

import org.lokray.tabula.util.Debug;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Discovers Tabula source files below a set of input paths and runs the front end over each of
 * them. Files are read up front; the compilations then run in parallel on a fixed pool, one
 * independent invocation per file.
 */
public class ProjectLoader
{
	private final String sourceExtension;
	private final int threads;
	private final long timeoutMillis;

	/**
	 * @param sourceExtension File extension of source files, without the dot.
	 * @param threads         Size of the worker pool.
	 * @param timeoutMillis   How long to wait for a single file; 0 waits forever.
	 */
	public ProjectLoader(String sourceExtension, int threads, long timeoutMillis)
	{
		this.sourceExtension = sourceExtension;
		this.threads = Math.max(1, threads);
		this.timeoutMillis = timeoutMillis;
	}

	/**
	 * The outcome of {@link #load(List)}: the finished units in input order, and the files
	 * whose compilation overran the deadline and was discarded.
	 */
	public static final class LoadResult
	{
		private final List<CompilationUnit> units;
		private final List<Path> timedOut;

		LoadResult(List<CompilationUnit> units, List<Path> timedOut)
		{
			this.units = Collections.unmodifiableList(units);
			this.timedOut = Collections.unmodifiableList(timedOut);
		}

		public List<CompilationUnit> getUnits()
		{
			return units;
		}

		public List<Path> getTimedOut()
		{
			return timedOut;
		}

		public boolean hasErrors()
		{
			return units.stream().anyMatch(CompilationUnit::hasErrors);
		}
	}

	/**
	 * Expands the input paths into source files. A file given explicitly is taken whatever its
	 * extension; directories are walked for files with the source extension.
	 *
	 * @return The files, without duplicates, in a stable order.
	 * @throws IOException if an input path does not exist or a directory cannot be walked.
	 */
	public List<Path> discover(List<Path> inputs) throws IOException
	{
		Set<Path> files = new LinkedHashSet<>();
		for (Path input : inputs)
		{
			if (!Files.exists(input))
			{
				throw new NoSuchFileException(input.toString(), null, "input file or directory not found");
			}
			if (!Files.isDirectory(input))
			{
				files.add(input.normalize());
				continue;
			}
			try (Stream<Path> stream = Files.walk(input))
			{
				List<Path> found = stream
						.filter(path -> !Files.isDirectory(path) && path.getFileName().toString().endsWith("." + sourceExtension))
						.map(Path::normalize)
						.sorted()
						.collect(Collectors.toList());
				Debug.log("Found %d .%s file(s) under %s", found.size(), sourceExtension, input);
				files.addAll(found);
			}
		}
		return new ArrayList<>(files);
	}

	/**
	 * Discovers, reads and compiles every source file below {@code inputs}.
	 *
	 * @throws IOException if an input is missing or a file cannot be read. Nothing is compiled then.
	 */
	public LoadResult load(List<Path> inputs) throws IOException
	{
		List<Path> files = discover(inputs);

		Map<Path, String> sources = new LinkedHashMap<>();
		for (Path file : files)
		{
			sources.put(file, Files.readString(file, StandardCharsets.UTF_8));
		}
		return compileAll(sources);
	}

	/**
	 * Compiles already-read sources in parallel.
	 *
	 * @param sources Source text by file, in the order the results should have.
	 */
	public LoadResult compileAll(Map<Path, String> sources) throws IOException
	{
		List<CompilationUnit> units = new ArrayList<>();
		List<Path> timedOut = new ArrayList<>();
		if (sources.isEmpty())
		{
			return new LoadResult(units, timedOut);
		}

		ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, sources.size()));
		try
		{
			Map<Path, Future<CompilationUnit>> futures = new LinkedHashMap<>();
			for (Map.Entry<Path, String> entry : sources.entrySet())
			{
				String path = entry.getKey().toString();
				String source = entry.getValue();
				futures.put(entry.getKey(), executor.submit(() -> TabulaFrontend.compile(path, source)));
			}

			for (Map.Entry<Path, Future<CompilationUnit>> entry : futures.entrySet())
			{
				try
				{
					units.add(timeoutMillis > 0
							? entry.getValue().get(timeoutMillis, TimeUnit.MILLISECONDS)
							: entry.getValue().get());
				}
				catch (TimeoutException e)
				{
					entry.getValue().cancel(true);
					Debug.logWarning("Warning: Gave up on " + entry.getKey() + " after " + timeoutMillis + " ms.");
					timedOut.add(entry.getKey());
				}
				catch (ExecutionException e)
				{
					throw new IllegalStateException("Front end failed on " + entry.getKey(), e.getCause());
				}
			}
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			InterruptedIOException interrupted = new InterruptedIOException("Interrupted while compiling sources");
			interrupted.initCause(e);
			throw interrupted;
		}
		finally
		{
			executor.shutdownNow();
		}

		Debug.log("Compiled %d unit(s), %d timed out", units.size(), timedOut.size());
		return new LoadResult(units, timedOut);
	}
}
